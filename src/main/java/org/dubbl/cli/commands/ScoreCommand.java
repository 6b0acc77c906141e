package org.dubbl.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.dubbl.archive.IGameArchive;
import org.dubbl.cli.CommandLineInterface;
import org.dubbl.cli.ScoreboardPrinter;
import org.dubbl.cli.config.GameSetupLoader;
import org.dubbl.cli.script.ActionScriptParser;
import org.dubbl.cli.script.ScriptStep;
import org.dubbl.runtime.CompletedGame;
import org.dubbl.runtime.GameEngine;
import org.dubbl.runtime.InvalidActionException;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Scores a game from an action script and prints the line score.
 * <p>
 * Rejected steps are reported with their line number and skipped; the game
 * goes on. A completed game is handed to the archive unless {@code --no-archive}
 * is given. Exit code is 1 if any step was rejected.
 */
@Command(
    name = "score",
    description = "Score a game from an action script"
)
public class ScoreCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScoreCommand.class);

    @Option(
        names = {"-s", "--setup"},
        required = true,
        description = "Game setup file (HOCON: mode, league-id, planned-innings, teams)"
    )
    private File setupFile;

    @Option(
        names = {"--script"},
        description = "Action script, one step per line (default: read from stdin)"
    )
    private File scriptFile;

    @Option(
        names = {"--no-archive"},
        description = "Do not store the completed game"
    )
    private boolean noArchive;

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
            GameSetup setup = new GameSetupLoader(config.getInt("scoring.planned-innings")).load(setupFile);
            List<ScriptStep> steps = readScript();

            GameEngine engine = GameEngine.start(setup);
            int rejected = 0;
            CompletedGame completed = null;

            for (ScriptStep step : steps) {
                if (completed != null) {
                    err.printf("Line %d: game is already complete, ignoring the rest of the script%n", step.line());
                    rejected++;
                    break;
                }
                try {
                    switch (step.kind()) {
                        case ACTION -> {
                            GameEvent event = engine.apply(step.action(), step.notes());
                            log.debug("Line {}: {}", step.line(), event.eventType().wireName());
                        }
                        case UNDO -> {
                            Optional<GameEvent> undone = engine.undoLast();
                            if (undone.isEmpty()) {
                                out.printf("Line %d: nothing to undo%n", step.line());
                            }
                        }
                        case COMPLETE -> completed = engine.completeGame();
                    }
                } catch (InvalidActionException e) {
                    err.printf("Line %d: rejected: %s%n", step.line(), e.getMessage());
                    rejected++;
                }
            }

            out.printf("Game %s%n", engine.state().gameId());
            ScoreboardPrinter.print(out, engine.state());

            if (completed != null && !noArchive) {
                try (IGameArchive archive = parent.openArchive()) {
                    archive.store(completed);
                }
                out.printf("Archived game %s (%d events)%n", completed.gameId(), completed.events().size());
            } else if (completed == null) {
                out.println("Game not completed; nothing archived.");
            }
            out.flush();
            return rejected == 0 ? 0 : 1;
        } catch (Exception e) {
            log.error("Scoring failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private List<ScriptStep> readScript() throws IOException {
        if (scriptFile == null) {
            return ActionScriptParser.parse(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        try (Reader reader = Files.newBufferedReader(scriptFile.toPath(), StandardCharsets.UTF_8)) {
            return ActionScriptParser.parse(reader);
        }
    }
}
