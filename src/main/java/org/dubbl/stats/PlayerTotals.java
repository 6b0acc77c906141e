package org.dubbl.stats;

import java.util.HashSet;
import java.util.Set;

import org.dubbl.runtime.model.PlayerIdentity;

/**
 * Mutable per-player accumulator used while folding events. Never persisted;
 * always recomputed from the event log.
 */
final class PlayerTotals {

    final String key;
    final PlayerIdentity identity;
    final Set<String> games = new HashSet<>();

    int atBats;
    int singles;
    int doubles;
    int triples;
    int homeruns;
    int strikeouts;
    int catches;
    int errors;
    int stealsAttempted;
    int stealsWon;
    int stealsLost;
    int basesDefended;
    int basesDefendedSuccessful;
    int basesStolen;
    int hits;
    int totalBases;
    int rbi;

    PlayerTotals(String key, PlayerIdentity identity) {
        this.key = key;
        this.identity = identity;
    }

    PlayerStatsRow toRow() {
        return new PlayerStatsRow(
                key,
                identity.displayName(),
                identity.identityKey(),
                identity.teamId(),
                identity.guest(),
                games.size(),
                atBats,
                hits,
                singles,
                doubles,
                triples,
                homeruns,
                strikeouts,
                totalBases,
                rbi,
                ratio(hits, atBats),
                ratio(totalBases, atBats),
                catches,
                errors,
                stealsAttempted,
                stealsWon,
                stealsLost,
                ratio(stealsWon, stealsAttempted),
                basesStolen,
                basesDefended,
                basesDefendedSuccessful);
    }

    static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
