package org.dubbl.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to start a game: mode, league, the two teams in batting
 * order (first team bats in the top half) and the planned number of innings.
 *
 * @param mode           Friendly or league game.
 * @param leagueId       League id for league games, otherwise null.
 * @param teams          The two teams; index 0 bats first.
 * @param plannedInnings Innings planned at start; extra innings extend it.
 */
public record GameSetup(GameMode mode, String leagueId, List<TeamSetup> teams, int plannedInnings) {

    public GameSetup {
        Objects.requireNonNull(mode, "mode");
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    public static GameSetup friendly(TeamSetup first, TeamSetup second, int plannedInnings) {
        return new GameSetup(GameMode.FRIENDLY, null, List.of(first, second), plannedInnings);
    }

    public static GameSetup league(String leagueId, TeamSetup first, TeamSetup second, int plannedInnings) {
        return new GameSetup(GameMode.LEAGUE, leagueId, List.of(first, second), plannedInnings);
    }
}
