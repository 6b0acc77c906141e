package org.dubbl.stats;

/**
 * One row of the team leaderboard. Player counts are summed over every player
 * who batted or fielded for the team in the scoped games.
 *
 * @param teamId          Team id.
 * @param label           Most recent display label of the team.
 * @param gamesPlayed     Scoped games the team took part in.
 * @param wins            Completed games won.
 * @param losses          Completed games lost.
 * @param averageScore    Runs per game played.
 * @param atBats          Summed at-bats.
 * @param hits            Summed hits.
 * @param homeruns        Summed homeruns.
 * @param totalBases      Summed total bases.
 * @param rbi             Summed RBI.
 * @param strikeouts      Summed strikeouts.
 * @param catches         Summed catches.
 * @param errors          Summed errors.
 * @param stealsAttempted Summed steal attempts.
 * @param stealsWon       Summed successful steals.
 * @param basesDefended   Summed steal attempts defended against.
 * @param battingAverage  hits / atBats, 0 when there are no at-bats.
 * @param slugging        totalBases / atBats, 0 when there are no at-bats.
 */
public record TeamStatsRow(
        String teamId,
        String label,
        int gamesPlayed,
        int wins,
        int losses,
        double averageScore,
        int atBats,
        int hits,
        int homeruns,
        int totalBases,
        int rbi,
        int strikeouts,
        int catches,
        int errors,
        int stealsAttempted,
        int stealsWon,
        int basesDefended,
        double battingAverage,
        double slugging
) {
}
