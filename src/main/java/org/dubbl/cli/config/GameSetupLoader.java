package org.dubbl.cli.config;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.dubbl.runtime.GameSetupException;
import org.dubbl.runtime.model.GameMode;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.PlayerIdentity;
import org.dubbl.runtime.model.TeamSetup;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Reads a game setup from a HOCON file.
 * <pre>
 * mode = league            # or friendly (default)
 * league-id = spring-2026  # league games only
 * planned-innings = 5      # optional
 * teams = [
 *   { id = reds, label = "Reds", players = [
 *       { id = r1, name = "Ana", identity-key = m-17 }
 *       { id = r2, name = "Ben", guest = true }
 *   ] }
 *   { id = blues, players = [ ... ] }
 * ]
 * </pre>
 * The first team bats in the top half.
 */
public class GameSetupLoader {

    private final int defaultPlannedInnings;

    /**
     * @param defaultPlannedInnings Innings used when the file does not set {@code planned-innings}.
     */
    public GameSetupLoader(int defaultPlannedInnings) {
        this.defaultPlannedInnings = defaultPlannedInnings;
    }

    /**
     * @throws GameSetupException if the file is missing or malformed.
     */
    public GameSetup load(File file) {
        if (!file.exists()) {
            throw new GameSetupException("Game setup file not found: " + file.getAbsolutePath());
        }
        try {
            return parse(ConfigFactory.parseFile(file).resolve());
        } catch (ConfigException e) {
            throw new GameSetupException("Invalid game setup in " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws GameSetupException if required keys are missing or have the wrong type.
     */
    public GameSetup parse(Config setup) {
        try {
            GameMode mode = setup.hasPath("mode") ? GameMode.fromWire(setup.getString("mode")) : GameMode.FRIENDLY;
            String leagueId = setup.hasPath("league-id") ? setup.getString("league-id") : null;
            int innings = setup.hasPath("planned-innings") ? setup.getInt("planned-innings") : defaultPlannedInnings;

            List<TeamSetup> teams = new ArrayList<>();
            for (Config team : setup.getConfigList("teams")) {
                List<PlayerIdentity> players = new ArrayList<>();
                for (Config player : team.getConfigList("players")) {
                    players.add(new PlayerIdentity(
                            player.getString("id"),
                            player.hasPath("name") ? player.getString("name") : null,
                            player.hasPath("identity-key") ? player.getString("identity-key") : null,
                            player.hasPath("guest") && player.getBoolean("guest"),
                            null));
                }
                teams.add(new TeamSetup(
                        team.getString("id"),
                        team.hasPath("label") ? team.getString("label") : null,
                        players));
            }
            return new GameSetup(mode, leagueId, teams, innings);
        } catch (ConfigException e) {
            throw new GameSetupException("Invalid game setup: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new GameSetupException("Invalid game setup: " + e.getMessage(), e);
        }
    }
}
