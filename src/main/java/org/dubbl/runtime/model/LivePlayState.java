package org.dubbl.runtime.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.dubbl.runtime.GameSetupException;

/**
 * Snapshot of the game in progress: inning, half, count, bases, who bats,
 * the line score and both lineups.
 * <p>
 * Instances are immutable values. Reducers return a new snapshot for every
 * action, so a snapshot handed to a caller never changes underneath it and two
 * snapshots built from the same history are {@link #equals(Object) equal}.
 *
 * @param gameId         Game id.
 * @param mode           Friendly or league.
 * @param leagueId       League id, or null.
 * @param teamOrder      Team ids in batting order; index 0 bats in the top half.
 * @param teamLabels     Display label per team id.
 * @param inning         Current inning, starting at 1.
 * @param half           Current half.
 * @param outs           Outs in the current half, 0..2.
 * @param strikes        Strikes on the current batter, 0..2.
 * @param offenseTeamId  Team at bat.
 * @param defenseTeamId  Team in the field.
 * @param bases          Current base occupancy.
 * @param scoreboard     Line score per team id.
 * @param lineups        Lineup per team id.
 * @param plannedInnings Planned innings, extended when play goes past them.
 * @param complete       Whether the game has been completed and frozen.
 */
public record LivePlayState(
        String gameId,
        GameMode mode,
        String leagueId,
        List<String> teamOrder,
        Map<String, String> teamLabels,
        int inning,
        Half half,
        int outs,
        int strikes,
        String offenseTeamId,
        String defenseTeamId,
        BaseState bases,
        Map<String, TeamScore> scoreboard,
        Map<String, Lineup> lineups,
        int plannedInnings,
        boolean complete
) {

    public LivePlayState {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(half, "half");
        Objects.requireNonNull(bases, "bases");
        teamOrder = List.copyOf(teamOrder);
        teamLabels = Map.copyOf(teamLabels);
        scoreboard = Map.copyOf(scoreboard);
        lineups = Map.copyOf(lineups);
        if (inning < 1) {
            throw new IllegalArgumentException("Inning must be >= 1, got " + inning);
        }
    }

    /**
     * Creates the state of a game that has not seen any action yet: inning 1,
     * top half, no outs or strikes, empty bases, the first team at bat.
     *
     * @param setup  Teams, lineups and mode.
     * @param gameId Id of the new game.
     * @return The initial snapshot.
     * @throws GameSetupException if the setup cannot be played.
     */
    public static LivePlayState initial(GameSetup setup, String gameId) {
        validate(setup);
        TeamSetup first = setup.teams().get(0);
        TeamSetup second = setup.teams().get(1);

        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, TeamScore> scores = new LinkedHashMap<>();
        Map<String, Lineup> lineups = new LinkedHashMap<>();
        for (TeamSetup team : setup.teams()) {
            labels.put(team.teamId(), team.label());
            scores.put(team.teamId(), TeamScore.ZERO);
            lineups.put(team.teamId(), Lineup.of(team.teamId(), team.players()));
        }

        return new LivePlayState(
                gameId,
                setup.mode(),
                setup.leagueId(),
                List.of(first.teamId(), second.teamId()),
                labels,
                1,
                Half.TOP,
                0,
                0,
                first.teamId(),
                second.teamId(),
                BaseState.EMPTY,
                scores,
                lineups,
                setup.plannedInnings(),
                false);
    }

    private static void validate(GameSetup setup) {
        if (setup.teams().size() != 2) {
            throw new GameSetupException("A game needs exactly two teams, got " + setup.teams().size());
        }
        if (setup.plannedInnings() < 1) {
            throw new GameSetupException("Planned innings must be at least 1, got " + setup.plannedInnings());
        }
        Set<String> teamIds = new HashSet<>();
        Set<String> playerIds = new HashSet<>();
        for (TeamSetup team : setup.teams()) {
            if (!teamIds.add(team.teamId())) {
                throw new GameSetupException("Team '" + team.teamId() + "' appears twice");
            }
            if (team.players().isEmpty()) {
                throw new GameSetupException("Team '" + team.label() + "' has no players");
            }
            for (PlayerIdentity player : team.players()) {
                if (!playerIds.add(player.id())) {
                    throw new GameSetupException("Player '" + player.id() + "' is listed more than once");
                }
            }
        }
    }

    public Lineup offenseLineup() {
        return lineups.get(offenseTeamId);
    }

    public Lineup defenseLineup() {
        return lineups.get(defenseTeamId);
    }

    public LineupSlot currentBatter() {
        return offenseLineup().currentBatter();
    }

    public TeamScore score(String teamId) {
        return scoreboard.get(teamId);
    }

    public int totalRuns() {
        int total = 0;
        for (TeamScore score : scoreboard.values()) {
            total += score.runs();
        }
        return total;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Copy-and-modify helper used by the reducers. Only the fields that change
     * during play are settable.
     */
    public static final class Builder {
        private final LivePlayState source;
        private int inning;
        private Half half;
        private int outs;
        private int strikes;
        private String offenseTeamId;
        private String defenseTeamId;
        private BaseState bases;
        private final Map<String, TeamScore> scoreboard;
        private final Map<String, Lineup> lineups;
        private int plannedInnings;
        private boolean complete;

        private Builder(LivePlayState source) {
            this.source = source;
            this.inning = source.inning;
            this.half = source.half;
            this.outs = source.outs;
            this.strikes = source.strikes;
            this.offenseTeamId = source.offenseTeamId;
            this.defenseTeamId = source.defenseTeamId;
            this.bases = source.bases;
            this.scoreboard = new LinkedHashMap<>(source.scoreboard);
            this.lineups = new LinkedHashMap<>(source.lineups);
            this.plannedInnings = source.plannedInnings;
            this.complete = source.complete;
        }

        public Builder inning(int inning) {
            this.inning = inning;
            return this;
        }

        public Builder half(Half half) {
            this.half = half;
            return this;
        }

        public Builder outs(int outs) {
            this.outs = outs;
            return this;
        }

        public Builder strikes(int strikes) {
            this.strikes = strikes;
            return this;
        }

        public Builder offense(String offenseTeamId, String defenseTeamId) {
            this.offenseTeamId = offenseTeamId;
            this.defenseTeamId = defenseTeamId;
            return this;
        }

        public Builder bases(BaseState bases) {
            this.bases = bases;
            return this;
        }

        public Builder score(String teamId, TeamScore score) {
            this.scoreboard.put(teamId, score);
            return this;
        }

        public Builder lineup(Lineup lineup) {
            this.lineups.put(lineup.teamId(), lineup);
            return this;
        }

        public Builder plannedInnings(int plannedInnings) {
            this.plannedInnings = plannedInnings;
            return this;
        }

        public Builder complete(boolean complete) {
            this.complete = complete;
            return this;
        }

        public int outs() {
            return outs;
        }

        public LivePlayState build() {
            return new LivePlayState(
                    source.gameId,
                    source.mode,
                    source.leagueId,
                    source.teamOrder,
                    source.teamLabels,
                    inning,
                    half,
                    outs,
                    strikes,
                    offenseTeamId,
                    defenseTeamId,
                    bases,
                    scoreboard,
                    lineups,
                    plannedInnings,
                    complete);
        }
    }
}
