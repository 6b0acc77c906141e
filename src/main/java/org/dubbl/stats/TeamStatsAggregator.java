package org.dubbl.stats;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.PlayerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds team standings for a scope. Wins and losses come from the final
 * scores of completed games; tied games count as neither. Player counts are
 * credited to the team id recorded on each player, guests included.
 */
public class TeamStatsAggregator {

    private static final Logger log = LoggerFactory.getLogger(TeamStatsAggregator.class);

    private final StatsAggregator playerAggregator;

    public TeamStatsAggregator(ZoneId zone) {
        this.playerAggregator = new StatsAggregator(zone);
    }

    public TeamStatsAggregator() {
        this(ZoneId.of("UTC"));
    }

    /**
     * @param events  Events of any number of games.
     * @param games   Known games.
     * @param players Identities referenced by the events.
     * @param scope   Which games to include.
     * @return Team rows sorted by slugging, highest first.
     */
    public List<TeamStatsRow> leaderboard(List<GameEvent> events, List<GameRecord> games,
                                          PlayerDirectory players, StatScope scope) {
        Objects.requireNonNull(scope, "scope");
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<GameEvent> scoped = playerAggregator.filter(events, games, scope, unresolved);

        Map<String, TeamTotals> teams = new LinkedHashMap<>();
        for (GameRecord game : scopedGames(games, scope)) {
            for (String teamId : game.teamOrder()) {
                TeamTotals team = teams.computeIfAbsent(teamId, TeamTotals::new);
                team.label = game.teamLabels().getOrDefault(teamId, teamId);
                team.gamesPlayed++;
                team.runs += game.runsFor(teamId);
                if (game.complete()) {
                    int diff = game.runsFor(teamId) - game.runsAgainst(teamId);
                    if (diff > 0) {
                        team.wins++;
                    } else if (diff < 0) {
                        team.losses++;
                    }
                }
            }
        }

        StatsAggregator.fold(scoped, (event, playerId) -> {
            Optional<PlayerIdentity> identity = players.find(event.gameId(), playerId);
            if (identity.isEmpty() || identity.get().teamId() == null) {
                if (playerId != null) {
                    unresolved.add(new UnresolvedReference(event.id(), UnresolvedReference.Kind.PLAYER, playerId));
                }
                return Optional.empty();
            }
            TeamTotals team = teams.computeIfAbsent(identity.get().teamId(), TeamTotals::new);
            return Optional.of(team.players);
        });

        if (!unresolved.isEmpty()) {
            log.warn("Skipped {} unresolved references while building team standings", unresolved.size());
        }

        List<TeamStatsRow> rows = new ArrayList<>(teams.size());
        for (TeamTotals team : teams.values()) {
            rows.add(team.toRow());
        }
        rows.sort(Comparator.comparingDouble(TeamStatsRow::slugging).reversed());
        return rows;
    }

    private List<GameRecord> scopedGames(List<GameRecord> games, StatScope scope) {
        Integer year = playerAggregator.resolveYear(games, scope);
        List<GameRecord> scoped = new ArrayList<>();
        for (GameRecord game : games) {
            if (playerAggregator.matches(game, scope, year)) {
                scoped.add(game);
            }
        }
        return scoped;
    }

    private static final class TeamTotals {
        final String teamId;
        final PlayerTotals players;
        String label;
        int gamesPlayed;
        int wins;
        int losses;
        int runs;

        TeamTotals(String teamId) {
            this.teamId = teamId;
            this.label = teamId;
            this.players = new PlayerTotals(teamId, new PlayerIdentity(teamId, teamId, null, false, teamId));
        }

        TeamStatsRow toRow() {
            PlayerTotals p = players;
            return new TeamStatsRow(teamId, label, gamesPlayed, wins, losses,
                    PlayerTotals.ratio(runs, gamesPlayed),
                    p.atBats, p.hits, p.homeruns, p.totalBases, p.rbi, p.strikeouts, p.catches, p.errors,
                    p.stealsAttempted, p.stealsWon, p.basesDefended,
                    PlayerTotals.ratio(p.hits, p.atBats),
                    PlayerTotals.ratio(p.totalBases, p.atBats));
        }
    }
}
