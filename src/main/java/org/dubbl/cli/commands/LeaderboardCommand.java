package org.dubbl.cli.commands;

import java.io.PrintWriter;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.dubbl.archive.IGameArchive;
import org.dubbl.cli.CommandLineInterface;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.stats.AggregationReport;
import org.dubbl.stats.GameRecord;
import org.dubbl.stats.PlayerDirectory;
import org.dubbl.stats.PlayerStatsRow;
import org.dubbl.stats.StatKey;
import org.dubbl.stats.StatScope;
import org.dubbl.stats.StatsAggregator;
import org.dubbl.stats.TeamStatsAggregator;
import org.dubbl.stats.TeamStatsRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints player or team leaderboards computed from the archived event logs.
 */
@Command(
    name = "leaderboard",
    description = "Show player or team statistics from archived games"
)
public class LeaderboardCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardCommand.class);

    enum ScopeOption { OVERALL, YEAR, LEAGUE, GAME }

    @Option(
        names = {"--scope"},
        defaultValue = "OVERALL",
        description = "Which games to include: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private ScopeOption scope;

    @Option(names = {"--year"}, description = "Calendar year for --scope year (default: latest year with games)")
    private Integer year;

    @Option(names = {"--league"}, description = "League id for --scope league (default: all league games)")
    private String leagueId;

    @Option(names = {"--game"}, description = "Game id for --scope game")
    private String gameId;

    @Option(names = {"--sort"}, description = "Stat to sort players by, e.g. slugging, rbi, hits (default: stats.default-sort)")
    private String sort;

    @Option(names = {"--teams"}, description = "Show team standings instead of players")
    private boolean teams;

    @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum rows to show (default: ${DEFAULT-VALUE})")
    private int limit;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            StatScope statScope = toScope();
            StatKey sortKey = StatKey.parse(sort != null ? sort : config.getString("stats.default-sort"));
            ZoneId zone = ZoneId.of(config.getString("stats.time-zone"));

            List<GameRecord> games;
            List<GameEvent> events;
            PlayerDirectory players;
            try (IGameArchive archive = parent.openArchive()) {
                games = archive.loadGames();
                events = archive.loadEvents();
                players = PlayerDirectory.of(archive.loadPlayers());
            }
            log.debug("Loaded {} games, {} events and {} players", games.size(), events.size(), players.size());

            if (teams) {
                printTeams(out, new TeamStatsAggregator(zone).leaderboard(events, games, players, statScope));
            } else {
                AggregationReport report = new StatsAggregator(zone).aggregate(events, games, players, statScope, sortKey);
                printPlayers(out, report.rows(), sortKey);
                if (!report.unresolved().isEmpty()) {
                    out.printf("(%d unresolved references skipped)%n", report.unresolved().size());
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Leaderboard failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private StatScope toScope() {
        return switch (scope) {
            case OVERALL -> StatScope.overall();
            case YEAR -> year != null ? StatScope.year(year) : StatScope.latestYear();
            case LEAGUE -> StatScope.league(leagueId);
            case GAME -> {
                if (gameId == null) {
                    throw new IllegalArgumentException("--scope game requires --game <id>");
                }
                yield StatScope.game(gameId);
            }
        };
    }

    private void printPlayers(PrintWriter out, List<PlayerStatsRow> rows, StatKey sortKey) {
        out.printf("%-4s %-20s %3s %4s %4s %3s %3s %3s %3s %4s %5s %5s %3s %3s %5s %s%n",
                "#", "Player", "G", "AB", "H", "2B", "3B", "HR", "K", "RBI", "AVG", "SLG", "C", "E", "SB", "sorted by "
                        + sortKey.name().toLowerCase(Locale.ROOT));
        int rank = 0;
        for (PlayerStatsRow row : rows) {
            if (++rank > limit) {
                break;
            }
            out.printf(Locale.ROOT, "%-4d %-20s %3d %4d %4d %3d %3d %3d %3d %4d %5.3f %5.3f %3d %3d %2d/%-2d%n",
                    rank, truncate(row.displayName(), 20), row.gamesPlayed(), row.atBats(), row.hits(), row.doubles(),
                    row.triples(), row.homeruns(), row.strikeouts(), row.rbi(), row.battingAverage(), row.slugging(),
                    row.catches(), row.errors(), row.stealsWon(), row.stealsAttempted());
        }
        if (rows.isEmpty()) {
            out.println("No games in scope.");
        }
    }

    private void printTeams(PrintWriter out, List<TeamStatsRow> rows) {
        out.printf("%-4s %-20s %3s %3s %3s %6s %4s %4s %3s %5s %5s %3s%n",
                "#", "Team", "G", "W", "L", "R/G", "AB", "H", "HR", "AVG", "SLG", "E");
        int rank = 0;
        for (TeamStatsRow row : rows) {
            if (++rank > limit) {
                break;
            }
            out.printf(Locale.ROOT, "%-4d %-20s %3d %3d %3d %6.2f %4d %4d %3d %5.3f %5.3f %3d%n",
                    rank, truncate(row.label(), 20), row.gamesPlayed(), row.wins(), row.losses(), row.averageScore(),
                    row.atBats(), row.hits(), row.homeruns(), row.battingAverage(), row.slugging(), row.errors());
        }
        if (rows.isEmpty()) {
            out.println("No games in scope.");
        }
    }

    private static String truncate(String text, int width) {
        return text.length() <= width ? text : text.substring(0, width - 1) + "~";
    }
}
