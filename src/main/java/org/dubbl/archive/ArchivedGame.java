package org.dubbl.archive;

import java.util.List;

import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.stats.GameRecord;

/**
 * A stored game read back from the archive: its summary, the setup it started
 * from and its event log in order.
 */
public record ArchivedGame(GameRecord record, GameSetup setup, List<GameEvent> events) {

    public ArchivedGame {
        events = List.copyOf(events);
    }

    public String gameId() {
        return record.id();
    }
}
