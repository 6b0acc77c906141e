package org.dubbl.runtime.action;

import java.time.Clock;
import java.util.UUID;

/**
 * Supplies ids and timestamps for new games and events.
 * <p>
 * Kept outside the reducers so that reducing is a pure function of state and
 * action; tests plug in a deterministic source.
 */
public interface IEventIdentitySource {

    EventStamp nextEvent();

    String nextGameId();

    long now();

    /**
     * Random UUIDs and the system UTC clock.
     */
    static IEventIdentitySource system() {
        return of(Clock.systemUTC());
    }

    static IEventIdentitySource of(Clock clock) {
        return new IEventIdentitySource() {
            @Override
            public EventStamp nextEvent() {
                return new EventStamp(UUID.randomUUID().toString(), clock.millis());
            }

            @Override
            public String nextGameId() {
                return UUID.randomUUID().toString();
            }

            @Override
            public long now() {
                return clock.millis();
            }
        };
    }
}
