package org.dubbl.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.LivePlayState;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ReplayerTest {

    private GameEngine playedGame() {
        GameEngine engine = TestGames.start("g1");
        engine.applyHit(EventType.SINGLE);
        engine.applySteal("r1", "b1", true);
        engine.applyHit(EventType.DOUBLE);
        engine.applyStrike();
        engine.applyError("b2");
        engine.applyStrike();
        TestGames.retireSide(engine);
        engine.applyHit(EventType.HOMERUN);
        return engine;
    }

    @Test
    void replayReproducesTheLiveState() {
        GameEngine engine = playedGame();

        LivePlayState replayed = Replayer.replay(engine.setup(), "g1", engine.events());

        assertThat(replayed).isEqualTo(engine.state());
        assertThat(replayed.score("reds").runs()).isEqualTo(1);
        assertThat(replayed.score("blues").runs()).isEqualTo(1);
    }

    @Test
    void replayDetectsATamperedEvent() {
        List<GameEvent> events = new ArrayList<>(playedGame().events());
        GameEvent original = events.get(2);
        events.set(2, new GameEvent(original.id(), original.gameId(), original.eventType(), original.inning(),
                original.half(), original.batterId(), original.defenderId(), original.runnerId(),
                original.baseStateBefore(), original.baseStateAfter(), original.runsScored() + 1, original.rbi(),
                original.timestamp(), original.notes()));

        assertThatThrownBy(() -> Replayer.replay(TestGames.friendly(), "g1", events))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("Event #2");
    }

    @Test
    void replayRejectsAnImpossibleEvent() {
        List<GameEvent> events = new ArrayList<>(playedGame().events());
        events.remove(0);

        assertThatThrownBy(() -> Replayer.replay(TestGames.friendly(), "g1", events))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("Event #0");
    }
}
