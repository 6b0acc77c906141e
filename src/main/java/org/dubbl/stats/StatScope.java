package org.dubbl.stats;

import java.util.Objects;

/**
 * Selects the games whose events feed a leaderboard.
 *
 * @param kind     What the scope filters on.
 * @param gameId   Game id for {@link Kind#GAME}.
 * @param year     Calendar year for {@link Kind#YEAR}; null means the latest year with games.
 * @param leagueId League id for {@link Kind#LEAGUE}; null means every league game.
 */
public record StatScope(Kind kind, String gameId, Integer year, String leagueId) {

    public enum Kind {
        OVERALL,
        GAME,
        YEAR,
        LEAGUE
    }

    public StatScope {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.GAME) {
            Objects.requireNonNull(gameId, "gameId");
        }
    }

    public static StatScope overall() {
        return new StatScope(Kind.OVERALL, null, null, null);
    }

    public static StatScope game(String gameId) {
        return new StatScope(Kind.GAME, gameId, null, null);
    }

    public static StatScope year(int year) {
        return new StatScope(Kind.YEAR, null, year, null);
    }

    public static StatScope latestYear() {
        return new StatScope(Kind.YEAR, null, null, null);
    }

    public static StatScope league(String leagueId) {
        return new StatScope(Kind.LEAGUE, null, null, leagueId);
    }
}
