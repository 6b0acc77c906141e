package org.dubbl.stats;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Statistics a player leaderboard can be sorted by.
 */
public enum StatKey {
    GAMES_PLAYED(PlayerStatsRow::gamesPlayed),
    AT_BATS(PlayerStatsRow::atBats),
    HITS(PlayerStatsRow::hits),
    SINGLES(PlayerStatsRow::singles),
    DOUBLES(PlayerStatsRow::doubles),
    TRIPLES(PlayerStatsRow::triples),
    HOMERUNS(PlayerStatsRow::homeruns),
    STRIKEOUTS(PlayerStatsRow::strikeouts),
    BATTING_AVERAGE(PlayerStatsRow::battingAverage),
    SLUGGING(PlayerStatsRow::slugging),
    TOTAL_BASES(PlayerStatsRow::totalBases),
    RBI(PlayerStatsRow::rbi),
    CATCHES(PlayerStatsRow::catches),
    ERRORS(PlayerStatsRow::errors),
    STEALS_ATTEMPTED(PlayerStatsRow::stealsAttempted),
    STEALS_WON(PlayerStatsRow::stealsWon),
    STEALS_LOST(PlayerStatsRow::stealsLost),
    STEAL_SUCCESS_RATE(PlayerStatsRow::stealSuccessRate),
    BASES_STOLEN(PlayerStatsRow::basesStolen),
    BASES_DEFENDED(PlayerStatsRow::basesDefended),
    BASES_DEFENDED_SUCCESSFUL(PlayerStatsRow::basesDefendedSuccessful);

    private final ToDoubleFunction<PlayerStatsRow> extractor;

    StatKey(ToDoubleFunction<PlayerStatsRow> extractor) {
        this.extractor = extractor;
    }

    public double valueOf(PlayerStatsRow row) {
        return extractor.applyAsDouble(row);
    }

    /**
     * Parses a key leniently: {@code battingAverage}, {@code batting-average} and
     * {@code BATTING_AVERAGE} all name the same key.
     *
     * @param name Key name in any of the accepted spellings.
     * @return The key.
     * @throws IllegalArgumentException if no key matches.
     */
    public static StatKey parse(String name) {
        String wanted = normalize(name);
        for (StatKey key : values()) {
            if (normalize(key.name()).equals(wanted)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown stat key: " + name);
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
