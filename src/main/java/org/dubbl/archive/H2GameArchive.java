package org.dubbl.archive;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.dubbl.runtime.CompletedGame;
import org.dubbl.runtime.model.BaseState;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameMode;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.Half;
import org.dubbl.runtime.model.LineupSlot;
import org.dubbl.runtime.model.LivePlayState;
import org.dubbl.runtime.model.PlayerIdentity;
import org.dubbl.runtime.model.TeamScore;
import org.dubbl.runtime.model.TeamSetup;
import org.dubbl.stats.GamePlayer;
import org.dubbl.stats.GameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Game archive on H2 with a HikariCP connection pool.
 * <p>
 * Layout:
 * <ul>
 *   <li>{@code games}: one row per game (mode, league, start and completion time, innings).</li>
 *   <li>{@code game_teams}: both teams of a game with batting position and final line score.</li>
 *   <li>{@code game_players}: every participant record with its batting order.</li>
 *   <li>{@code game_events}: the event log, base states stored as JSON.</li>
 * </ul>
 * All writes use {@code MERGE ... KEY(...)} so storing a game twice is idempotent.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code jdbcUrl} (required)</li>
 *   <li>{@code username} (default {@code sa}), {@code password} (default empty)</li>
 *   <li>{@code maxPoolSize} (default 10), {@code minIdle} (default 2)</li>
 * </ul>
 */
public class H2GameArchive implements IGameArchive {

    private static final Logger log = LoggerFactory.getLogger(H2GameArchive.class);

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS games ("
            + "id VARCHAR PRIMARY KEY, mode VARCHAR NOT NULL, league_id VARCHAR, "
            + "start_time BIGINT NOT NULL, completed_at BIGINT NOT NULL, "
            + "planned_innings INT NOT NULL, played_innings INT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS game_teams ("
            + "game_id VARCHAR NOT NULL, team_id VARCHAR NOT NULL, label VARCHAR NOT NULL, "
            + "batting_position INT NOT NULL, runs INT NOT NULL, hits INT NOT NULL, errors INT NOT NULL, "
            + "PRIMARY KEY (game_id, team_id))",
        "CREATE TABLE IF NOT EXISTS game_players ("
            + "game_id VARCHAR NOT NULL, player_id VARCHAR NOT NULL, team_id VARCHAR NOT NULL, "
            + "display_name VARCHAR NOT NULL, identity_key VARCHAR, is_guest BOOLEAN NOT NULL, "
            + "batting_order INT NOT NULL, PRIMARY KEY (game_id, player_id))",
        "CREATE TABLE IF NOT EXISTS game_events ("
            + "game_id VARCHAR NOT NULL, seq INT NOT NULL, id VARCHAR NOT NULL, event_type VARCHAR NOT NULL, "
            + "inning INT NOT NULL, half VARCHAR NOT NULL, batter_id VARCHAR NOT NULL, defender_id VARCHAR, "
            + "runner_id VARCHAR, bases_before VARCHAR NOT NULL, bases_after VARCHAR NOT NULL, "
            + "runs_scored INT NOT NULL, rbi INT NOT NULL, ts BIGINT NOT NULL, notes VARCHAR, "
            + "PRIMARY KEY (game_id, seq))"
    };

    private static final String EVENT_COLUMNS =
        "e.game_id, e.id, e.event_type, e.inning, e.half, e.batter_id, e.defender_id, e.runner_id, "
            + "e.bases_before, e.bases_after, e.runs_scored, e.rbi, e.ts, e.notes";

    private final HikariDataSource dataSource;
    private final Gson gson = new Gson();

    public H2GameArchive(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for the game archive.");
        }
        String jdbcUrl = options.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setPoolName("dubbl-archive");

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("Game archive connection pool started (url={}, max={}, minIdle={})",
                jdbcUrl, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                throw new ArchiveException("Cannot open game archive: file already in use by another process. URL="
                    + jdbcUrl, e);
            }
            throw new ArchiveException("Failed to open game archive at " + jdbcUrl + ": " + causeMsg, e);
        }

        try {
            createSchema();
        } catch (ArchiveException e) {
            dataSource.close();
            throw e;
        }
    }

    private void createSchema() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new ArchiveException("Failed to create archive schema", e);
        }
    }

    @Override
    public void store(CompletedGame game) {
        LivePlayState state = game.finalState();
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO games (id, mode, league_id, start_time, completed_at, planned_innings, played_innings) "
                        + "KEY(id) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                stmt.setString(1, state.gameId());
                stmt.setString(2, state.mode().wireName());
                setNullableString(stmt, 3, state.leagueId());
                stmt.setLong(4, game.startedAt());
                stmt.setLong(5, game.completedAt());
                stmt.setInt(6, game.setup().plannedInnings());
                stmt.setInt(7, state.plannedInnings());
                stmt.executeUpdate();
            }

            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO game_teams (game_id, team_id, label, batting_position, runs, hits, errors) "
                        + "KEY(game_id, team_id) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                for (int i = 0; i < state.teamOrder().size(); i++) {
                    String teamId = state.teamOrder().get(i);
                    TeamScore score = state.score(teamId);
                    stmt.setString(1, state.gameId());
                    stmt.setString(2, teamId);
                    stmt.setString(3, state.teamLabels().get(teamId));
                    stmt.setInt(4, i);
                    stmt.setInt(5, score.runs());
                    stmt.setInt(6, score.hits());
                    stmt.setInt(7, score.errors());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO game_players (game_id, player_id, team_id, display_name, identity_key, is_guest, "
                        + "batting_order) KEY(game_id, player_id) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                for (String teamId : state.teamOrder()) {
                    for (LineupSlot slot : state.lineups().get(teamId).slots()) {
                        PlayerIdentity player = slot.player();
                        stmt.setString(1, state.gameId());
                        stmt.setString(2, player.id());
                        stmt.setString(3, teamId);
                        stmt.setString(4, player.displayName());
                        setNullableString(stmt, 5, player.identityKey());
                        stmt.setBoolean(6, player.guest());
                        stmt.setInt(7, slot.battingOrder());
                        stmt.addBatch();
                    }
                }
                stmt.executeBatch();
            }

            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO game_events (game_id, seq, id, event_type, inning, half, batter_id, defender_id, "
                        + "runner_id, bases_before, bases_after, runs_scored, rbi, ts, notes) "
                        + "KEY(game_id, seq) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                int seq = 0;
                for (GameEvent event : game.events()) {
                    stmt.setString(1, state.gameId());
                    stmt.setInt(2, seq++);
                    stmt.setString(3, event.id());
                    stmt.setString(4, event.eventType().wireName());
                    stmt.setInt(5, event.inning());
                    stmt.setString(6, event.half().wireName());
                    stmt.setString(7, event.batterId());
                    setNullableString(stmt, 8, event.defenderId());
                    setNullableString(stmt, 9, event.runnerId());
                    stmt.setString(10, gson.toJson(event.baseStateBefore()));
                    stmt.setString(11, gson.toJson(event.baseStateAfter()));
                    stmt.setInt(12, event.runsScored());
                    stmt.setInt(13, event.rbi());
                    stmt.setLong(14, event.timestamp());
                    setNullableString(stmt, 15, event.notes());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            conn.commit();
            log.info("Archived game {} with {} events", state.gameId(), game.events().size());
        } catch (SQLException e) {
            rollback(conn);
            throw new ArchiveException("Failed to store game " + state.gameId(), e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public List<GameRecord> loadGames() {
        return queryGames(null);
    }

    private List<GameRecord> queryGames(String gameId) {
        String sql = "SELECT g.id, g.mode, g.league_id, g.start_time, g.played_innings, "
            + "t.team_id, t.label, t.runs FROM games g JOIN game_teams t ON t.game_id = g.id "
            + (gameId != null ? "WHERE g.id = ? " : "")
            + "ORDER BY g.start_time, g.id, t.batting_position";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (gameId != null) {
                stmt.setString(1, gameId);
            }
            Map<String, GameRow> rows = new LinkedHashMap<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String id = rs.getString("id");
                    GameRow row = rows.get(id);
                    if (row == null) {
                        row = new GameRow(id, GameMode.fromWire(rs.getString("mode")), rs.getString("league_id"),
                            rs.getLong("start_time"), rs.getInt("played_innings"));
                        rows.put(id, row);
                    }
                    String teamId = rs.getString("team_id");
                    row.teamOrder.add(teamId);
                    row.labels.put(teamId, rs.getString("label"));
                    row.score.put(teamId, rs.getInt("runs"));
                }
            }
            List<GameRecord> games = new ArrayList<>(rows.size());
            for (GameRow row : rows.values()) {
                games.add(new GameRecord(row.id, row.mode, row.leagueId, row.startTime, row.teamOrder, row.labels,
                    row.score, row.playedInnings, true));
            }
            return games;
        } catch (SQLException e) {
            throw new ArchiveException("Failed to load games", e);
        }
    }

    @Override
    public List<GameEvent> loadEvents() {
        return queryEvents("SELECT " + EVENT_COLUMNS + " FROM game_events e JOIN games g ON g.id = e.game_id "
            + "ORDER BY g.start_time, g.id, e.seq", null);
    }

    @Override
    public List<GameEvent> loadEvents(String gameId) {
        return queryEvents("SELECT " + EVENT_COLUMNS + " FROM game_events e WHERE e.game_id = ? ORDER BY e.seq",
            gameId);
    }

    private List<GameEvent> queryEvents(String sql, String gameId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (gameId != null) {
                stmt.setString(1, gameId);
            }
            List<GameEvent> events = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new GameEvent(
                        rs.getString("id"),
                        rs.getString("game_id"),
                        EventType.fromWire(rs.getString("event_type")),
                        rs.getInt("inning"),
                        Half.fromWire(rs.getString("half")),
                        rs.getString("batter_id"),
                        rs.getString("defender_id"),
                        rs.getString("runner_id"),
                        gson.fromJson(rs.getString("bases_before"), BaseState.class),
                        gson.fromJson(rs.getString("bases_after"), BaseState.class),
                        rs.getInt("runs_scored"),
                        rs.getInt("rbi"),
                        rs.getLong("ts"),
                        rs.getString("notes")));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new ArchiveException("Failed to load events" + (gameId != null ? " of game " + gameId : ""), e);
        }
    }

    @Override
    public List<GamePlayer> loadPlayers() {
        return queryPlayers(null);
    }

    private List<GamePlayer> queryPlayers(String gameId) {
        String sql = "SELECT p.game_id, p.player_id, p.team_id, p.display_name, p.identity_key, p.is_guest "
            + "FROM game_players p JOIN games g ON g.id = p.game_id JOIN game_teams t "
            + "ON t.game_id = p.game_id AND t.team_id = p.team_id "
            + (gameId != null ? "WHERE p.game_id = ? " : "")
            + "ORDER BY g.start_time, g.id, t.batting_position, p.batting_order";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (gameId != null) {
                stmt.setString(1, gameId);
            }
            List<GamePlayer> players = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    players.add(new GamePlayer(rs.getString("game_id"), new PlayerIdentity(
                        rs.getString("player_id"),
                        rs.getString("display_name"),
                        rs.getString("identity_key"),
                        rs.getBoolean("is_guest"),
                        rs.getString("team_id"))));
                }
            }
            return players;
        } catch (SQLException e) {
            throw new ArchiveException("Failed to load players", e);
        }
    }

    @Override
    public Optional<ArchivedGame> loadGame(String gameId) {
        List<GameRecord> found = queryGames(gameId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        GameRecord record = found.get(0);

        Map<String, List<PlayerIdentity>> rosters = new LinkedHashMap<>();
        for (String teamId : record.teamOrder()) {
            rosters.put(teamId, new ArrayList<>());
        }
        for (GamePlayer player : queryPlayers(gameId)) {
            PlayerIdentity identity = player.identity();
            rosters.computeIfAbsent(identity.teamId(), k -> new ArrayList<>()).add(identity);
        }
        List<TeamSetup> teams = new ArrayList<>();
        for (String teamId : record.teamOrder()) {
            teams.add(new TeamSetup(teamId, record.teamLabels().get(teamId), rosters.get(teamId)));
        }
        GameSetup setup = new GameSetup(record.mode(), record.leagueId(), teams, plannedInningsAtStart(gameId));
        return Optional.of(new ArchivedGame(record, setup, loadEvents(gameId)));
    }

    private int plannedInningsAtStart(String gameId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT planned_innings FROM games WHERE id = ?")) {
            stmt.setString(1, gameId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new ArchiveException("Game " + gameId + " disappeared while loading");
                }
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new ArchiveException("Failed to load game " + gameId, e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("Game archive connection pool closed");
        }
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static void rollback(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.setAutoCommit(true);
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to return archive connection to the pool: {}", e.getMessage());
        }
    }

    private static final class GameRow {
        final String id;
        final GameMode mode;
        final String leagueId;
        final long startTime;
        final int playedInnings;
        final List<String> teamOrder = new ArrayList<>();
        final Map<String, String> labels = new LinkedHashMap<>();
        final Map<String, Integer> score = new LinkedHashMap<>();

        GameRow(String id, GameMode mode, String leagueId, long startTime, int playedInnings) {
            this.id = id;
            this.mode = mode;
            this.leagueId = leagueId;
            this.startTime = startTime;
            this.playedInnings = playedInnings;
        }
    }
}
