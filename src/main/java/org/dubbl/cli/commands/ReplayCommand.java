package org.dubbl.cli.commands;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.dubbl.archive.ArchivedGame;
import org.dubbl.archive.IGameArchive;
import org.dubbl.cli.CommandLineInterface;
import org.dubbl.cli.ScoreboardPrinter;
import org.dubbl.runtime.Replayer;
import org.dubbl.runtime.model.LivePlayState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Re-derives an archived game from its event log and checks that the replay
 * produces the same events and the same final score.
 */
@Command(
    name = "replay",
    description = "Verify an archived game by replaying its event log"
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

    @Option(names = {"-g", "--game"}, required = true, description = "Id of the archived game")
    private String gameId;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Optional<ArchivedGame> found;
            try (IGameArchive archive = parent.openArchive()) {
                found = archive.loadGame(gameId);
            }
            if (found.isEmpty()) {
                err.println("Error: No archived game with id " + gameId);
                return 1;
            }
            ArchivedGame game = found.get();

            LivePlayState replayed = Replayer.replay(game.setup(), game.gameId(), game.events());
            for (String teamId : game.record().teamOrder()) {
                int stored = game.record().runsFor(teamId);
                int derived = replayed.score(teamId).runs();
                if (stored != derived) {
                    err.printf("Error: Stored score of %s is %d but replay gives %d%n", teamId, stored, derived);
                    return 1;
                }
            }

            out.printf("Replayed %d events of game %s: OK%n", game.events().size(), game.gameId());
            ScoreboardPrinter.print(out, replayed);
            return 0;
        } catch (Exception e) {
            log.error("Replay of game {} failed: {}", gameId, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
