package org.dubbl.stats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.dubbl.runtime.CompletedGame;
import org.dubbl.runtime.model.GameMode;
import org.dubbl.runtime.model.LivePlayState;

/**
 * Summary of one game as needed for scoping and team standings.
 *
 * @param id             Game id.
 * @param mode           Friendly or league.
 * @param leagueId       League id, or null.
 * @param startTime      Epoch milliseconds at game start.
 * @param teamOrder      Team ids, first-batting team first.
 * @param teamLabels     Display label per team.
 * @param finalScore     Runs per team id (current runs for a game in progress).
 * @param plannedInnings Innings planned or played, whichever is larger.
 * @param complete       Whether the game is finished.
 */
public record GameRecord(
        String id,
        GameMode mode,
        String leagueId,
        long startTime,
        List<String> teamOrder,
        Map<String, String> teamLabels,
        Map<String, Integer> finalScore,
        int plannedInnings,
        boolean complete
) {

    public GameRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(mode, "mode");
        teamOrder = List.copyOf(teamOrder);
        teamLabels = Map.copyOf(teamLabels);
        finalScore = Map.copyOf(finalScore);
    }

    /**
     * Summarises a game from its play state; works for live and finished games.
     */
    public static GameRecord of(LivePlayState state, long startTime) {
        Map<String, Integer> score = new LinkedHashMap<>();
        for (String teamId : state.teamOrder()) {
            score.put(teamId, state.score(teamId).runs());
        }
        return new GameRecord(state.gameId(), state.mode(), state.leagueId(), startTime, state.teamOrder(),
                state.teamLabels(), score, state.plannedInnings(), state.complete());
    }

    public static GameRecord of(CompletedGame game) {
        return of(game.finalState(), game.startedAt());
    }

    public boolean involves(String teamId) {
        return teamOrder.contains(teamId);
    }

    public int runsFor(String teamId) {
        return finalScore.getOrDefault(teamId, 0);
    }

    /**
     * Returns the runs of the other team, or 0 if the team did not play.
     */
    public int runsAgainst(String teamId) {
        int against = 0;
        for (String other : teamOrder) {
            if (!other.equals(teamId)) {
                against += runsFor(other);
            }
        }
        return against;
    }
}
