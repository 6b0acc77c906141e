package org.dubbl.fixtures;

import org.dubbl.runtime.action.EventStamp;
import org.dubbl.runtime.action.IEventIdentitySource;

/**
 * Deterministic ids and clock for tests: events are numbered {@code e-1, e-2, ...}
 * and every call to the clock moves it forward by one second.
 */
public class SequentialIdentitySource implements IEventIdentitySource {

    private final String gameId;
    private long clock;
    private int nextEvent = 1;

    public SequentialIdentitySource(String gameId, long startMillis) {
        this.gameId = gameId;
        this.clock = startMillis;
    }

    public SequentialIdentitySource(String gameId) {
        this(gameId, 1_767_225_600_000L); // 2026-01-01T00:00:00Z
    }

    @Override
    public EventStamp nextEvent() {
        return new EventStamp(gameId + "-e-" + nextEvent++, tick());
    }

    @Override
    public String nextGameId() {
        return gameId;
    }

    @Override
    public long now() {
        return tick();
    }

    private long tick() {
        clock += 1000;
        return clock;
    }
}
