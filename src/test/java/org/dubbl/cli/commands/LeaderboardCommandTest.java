package org.dubbl.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Map;

import org.dubbl.archive.H2GameArchive;
import org.dubbl.cli.CommandLineInterface;
import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.GameEngine;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameSetup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;

@Tag("integration")
class LeaderboardCommandTest {

    private Config archiveOptions;
    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        archiveOptions = ConfigFactory.parseMap(Map.of(
                "jdbcUrl", "jdbc:h2:mem:leaderboard-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1",
                "maxPoolSize", 2,
                "minIdle", 0));
        try (H2GameArchive archive = new H2GameArchive(archiveOptions)) {
            // Ana homers, Ben and Cai go out; Cleo singles for the Blues.
            GameEngine engine = TestGames.start(GameSetup.league("spring-2026", TestGames.reds(), TestGames.blues(), 3),
                    "g1", TestGames.JAN_2026);
            engine.applyHit(EventType.HOMERUN);
            TestGames.retireSide(engine);
            engine.applyHit(EventType.SINGLE);
            archive.store(engine.completeGame());
        }

        cmdLine = CommandLineInterface.createCommandLine(
                new CommandLineInterface(options -> new H2GameArchive(archiveOptions)));
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void playerLeaderboardIsSortedBySlugging() {
        int exitCode = run("leaderboard");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("sorted by slugging")
                .contains("1    Ana ")
                .contains("Cleo");
    }

    @Test
    void sortAndLimitAreApplied() {
        int exitCode = run("leaderboard", "--sort", "strikeouts", "--limit", "1");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("sorted by strikeouts");
        assertThat(out.toString().lines().filter(line -> line.matches("\\d+\\s.*"))).hasSize(1);
    }

    @Test
    void teamStandingsShowBothTeams() {
        int exitCode = run("leaderboard", "--teams", "--scope", "league", "--league", "spring-2026");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Team").contains("Reds").contains("Blues");
    }

    @Test
    void emptyScopeSaysSo() {
        int exitCode = run("leaderboard", "--scope", "year", "--year", "2019");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("No games in scope.");
    }

    @Test
    void gameScopeNeedsAGameId() {
        int exitCode = run("leaderboard", "--scope", "game");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: --scope game requires --game");
    }

    @Test
    void unknownSortKeyIsAnError() {
        int exitCode = run("leaderboard", "--sort", "style");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: ");
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "-c";
        withConfig[1] = resource("test-dubbl.conf").getPath();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        int exitCode = cmdLine.execute(withConfig);
        cmdLine.getOut().flush();
        cmdLine.getErr().flush();
        return exitCode;
    }

    private File resource(String name) {
        URL url = getClass().getResource(name);
        assertThat(url).as("Test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
