package org.dubbl.stats;

/**
 * One leaderboard row. Counts are summed over the scoped events; rates are
 * derived from the counts and are 0 when their denominator is 0.
 */
public record PlayerStatsRow(
        String playerKey,
        String displayName,
        String identityKey,
        String teamId,
        boolean guest,
        int gamesPlayed,
        int atBats,
        int hits,
        int singles,
        int doubles,
        int triples,
        int homeruns,
        int strikeouts,
        int totalBases,
        int rbi,
        double battingAverage,
        double slugging,
        int catches,
        int errors,
        int stealsAttempted,
        int stealsWon,
        int stealsLost,
        double stealSuccessRate,
        int basesStolen,
        int basesDefended,
        int basesDefendedSuccessful
) {

    public double value(StatKey key) {
        return key.valueOf(this);
    }
}
