package org.dubbl.cli;

import java.io.PrintWriter;

import org.dubbl.runtime.model.Base;
import org.dubbl.runtime.model.LivePlayState;
import org.dubbl.runtime.model.PlayerIdentity;
import org.dubbl.runtime.model.TeamScore;

/**
 * Renders a play state as a plain-text line score.
 * <pre>
 * Reds vs Blues  (league spring-2026)
 *            1  2  3 |   R   H   E
 * Reds       0  2  1 |   3   5   1
 * Blues      1  0    |   1   2   0
 * Inning 3 bottom, 1 out, 2 strikes  Bases: 1B Ana, 2B -, 3B -  At bat: Ben
 * </pre>
 */
public final class ScoreboardPrinter {

    private ScoreboardPrinter() {
    }

    public static void print(PrintWriter out, LivePlayState state) {
        String first = state.teamOrder().get(0);
        String second = state.teamOrder().get(1);
        int innings = Math.max(state.plannedInnings(), state.inning());
        int labelWidth = Math.max(10, Math.max(state.teamLabels().get(first).length(),
                state.teamLabels().get(second).length()) + 1);

        String header = state.teamLabels().get(first) + " vs " + state.teamLabels().get(second);
        if (state.leagueId() != null) {
            header += "  (league " + state.leagueId() + ")";
        }
        out.println(header);

        StringBuilder columns = new StringBuilder(pad("", labelWidth));
        for (int inning = 1; inning <= innings; inning++) {
            columns.append(String.format("%3d", inning));
        }
        columns.append(" |   R   H   E");
        out.println(columns);

        for (String teamId : state.teamOrder()) {
            TeamScore score = state.score(teamId);
            StringBuilder row = new StringBuilder(pad(state.teamLabels().get(teamId), labelWidth));
            for (int inning = 1; inning <= innings; inning++) {
                row.append(played(state, teamId, inning) ? String.format("%3d", score.runsIn(inning)) : "   ");
            }
            row.append(String.format(" | %3d %3d %3d", score.runs(), score.hits(), score.errors()));
            out.println(row);
        }

        if (state.complete()) {
            out.println("Final");
        } else {
            PlayerIdentity batter = state.currentBatter().player();
            out.printf("Inning %d %s, %d out, %d strikes  Bases: %s  At bat: %s%n",
                    state.inning(), state.half().wireName(), state.outs(), state.strikes(),
                    bases(state), batter.displayName());
        }
        out.flush();
    }

    /**
     * A team has batted in an inning once its half has started.
     */
    private static boolean played(LivePlayState state, String teamId, int inning) {
        if (inning < state.inning()) {
            return true;
        }
        if (inning > state.inning()) {
            return false;
        }
        return teamId.equals(state.teamOrder().get(0)) || teamId.equals(state.offenseTeamId());
    }

    private static String bases(LivePlayState state) {
        StringBuilder text = new StringBuilder();
        for (Base base : Base.values()) {
            if (text.length() > 0) {
                text.append(", ");
            }
            String runner = state.bases().get(base);
            text.append(base.index()).append("B ").append(runner != null ? displayName(state, runner) : "-");
        }
        return text.toString();
    }

    private static String displayName(LivePlayState state, String playerId) {
        return state.lineups().get(state.offenseTeamId()).slots().stream()
                .filter(slot -> slot.playerId().equals(playerId))
                .map(slot -> slot.player().displayName())
                .findFirst()
                .orElse(playerId);
    }

    static String pad(String text, int width) {
        return text.length() >= width ? text + " " : text + " ".repeat(width - text.length());
    }
}
