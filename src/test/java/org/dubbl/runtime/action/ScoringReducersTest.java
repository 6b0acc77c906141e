package org.dubbl.runtime.action;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.InvalidActionException;
import org.dubbl.runtime.model.BaseState;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.Half;
import org.dubbl.runtime.model.LivePlayState;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

class ScoringReducersTest {

    private static final EventStamp STAMP = new EventStamp("e", 42L);

    private final LivePlayState initial = LivePlayState.initial(TestGames.friendly(), "g");

    private static Reduction reduce(LivePlayState state, ScoringAction action) {
        return ScoringReducers.reduce(state, action, STAMP, null);
    }

    @Test
    @Tag("unit")
    void hitCreditsTheOffenseAndAdvancesTheBatter() {
        LivePlayState onThird = initial.toBuilder().bases(new BaseState(null, null, "r3")).strikes(2).build();

        Reduction reduction = reduce(onThird, ScoringAction.hit(EventType.SINGLE));

        LivePlayState next = reduction.state();
        assertThat(next.bases()).isEqualTo(new BaseState("r1", null, null));
        assertThat(next.strikes()).isZero();
        assertThat(next.outs()).isZero();
        assertThat(next.currentBatter().playerId()).isEqualTo("r2");
        assertThat(next.score("reds").runs()).isEqualTo(1);
        assertThat(next.score("reds").hits()).isEqualTo(1);
        assertThat(next.score("reds").runsIn(1)).isEqualTo(1);

        GameEvent event = reduction.event();
        assertThat(event.eventType()).isEqualTo(EventType.SINGLE);
        assertThat(event.batterId()).isEqualTo("r1");
        assertThat(event.runsScored()).isEqualTo(1);
        assertThat(event.rbi()).isEqualTo(1);
        assertThat(event.baseStateBefore()).isEqualTo(new BaseState(null, null, "r3"));
        assertThat(event.id()).isEqualTo("e");
        assertThat(event.timestamp()).isEqualTo(42L);
    }

    @Test
    @Tag("unit")
    void nonHitKindIsRejectedAsHit() {
        assertThatThrownBy(() -> reduce(initial, ScoringAction.hit(EventType.STRIKEOUT)))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("not a hit");
    }

    @Test
    @Tag("unit")
    void firstTwoStrikesOnlyCount() {
        Reduction first = reduce(initial, ScoringAction.strike());
        Reduction second = reduce(first.state(), ScoringAction.strike());

        assertThat(first.event().eventType()).isEqualTo(EventType.STRIKE);
        assertThat(second.state().strikes()).isEqualTo(2);
        assertThat(second.state().outs()).isZero();
        assertThat(second.state().currentBatter().playerId()).isEqualTo("r1");
    }

    @Test
    @Tag("unit")
    void thirdStrikeIsAStrikeout() {
        LivePlayState twoStrikes = initial.toBuilder().strikes(2).build();

        Reduction reduction = reduce(twoStrikes, ScoringAction.strike());

        assertThat(reduction.event().eventType()).isEqualTo(EventType.STRIKEOUT);
        assertThat(reduction.state().outs()).isEqualTo(1);
        assertThat(reduction.state().strikes()).isZero();
        assertThat(reduction.state().currentBatter().playerId()).isEqualTo("r2");
    }

    @Test
    @Tag("unit")
    void strikeoutForTheThirdOutRotatesSides() {
        LivePlayState state = initial.toBuilder().strikes(2).outs(2).bases(new BaseState("r2", null, null)).build();

        LivePlayState next = reduce(state, ScoringAction.strike()).state();

        assertThat(next.half()).isEqualTo(Half.BOTTOM);
        assertThat(next.inning()).isEqualTo(1);
        assertThat(next.outs()).isZero();
        assertThat(next.bases()).isEqualTo(BaseState.EMPTY);
        assertThat(next.offenseTeamId()).isEqualTo("blues");
    }

    @Test
    @Tag("unit")
    void errorCountsAsStrikeAndChargesTheDefense() {
        Reduction reduction = reduce(initial, ScoringAction.error("b1"));

        assertThat(reduction.state().strikes()).isEqualTo(1);
        assertThat(reduction.state().outs()).isZero();
        assertThat(reduction.state().score("blues").errors()).isEqualTo(1);
        assertThat(reduction.event().eventType()).isEqualTo(EventType.ERROR);
        assertThat(reduction.event().defenderId()).isEqualTo("b1");
    }

    @Test
    @Tag("unit")
    void errorOnTwoStrikesRetiresTheBatter() {
        LivePlayState twoStrikes = initial.toBuilder().strikes(2).build();

        LivePlayState next = reduce(twoStrikes, ScoringAction.error("b1")).state();

        assertThat(next.outs()).isEqualTo(1);
        assertThat(next.strikes()).isZero();
        assertThat(next.currentBatter().playerId()).isEqualTo("r2");
        assertThat(next.score("blues").errors()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void caughtOutRecordsAnOut() {
        Reduction reduction = reduce(initial.toBuilder().strikes(1).build(), ScoringAction.caughtOut("b3"));

        assertThat(reduction.state().outs()).isEqualTo(1);
        assertThat(reduction.state().strikes()).isZero();
        assertThat(reduction.event().eventType()).isEqualTo(EventType.CAUGHT_OUT);
        assertThat(reduction.event().defenderId()).isEqualTo("b3");
    }

    @Test
    @Tag("unit")
    void defenderMustBeOnTheDefendingRoster() {
        assertThatThrownBy(() -> reduce(initial, ScoringAction.caughtOut("r2")))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("not on the defending roster");
        assertThatThrownBy(() -> reduce(initial, ScoringAction.error(" ")))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("defender");
    }

    @Test
    @Tag("unit")
    void stealOnEmptyBasesIsRejected() {
        assertThatThrownBy(() -> reduce(initial, ScoringAction.steal("r1", "b1", true)))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("No runner");
    }

    @Test
    @Tag("unit")
    void stealWithoutRunnerIsRejected() {
        LivePlayState onFirst = initial.toBuilder().bases(new BaseState("r3", null, null)).build();

        assertThatThrownBy(() -> reduce(onFirst, ScoringAction.steal("", "b1", true)))
                .isInstanceOf(InvalidActionException.class);
    }

    @Test
    @Tag("unit")
    void stealOfHomeCreditsARunWithoutTouchingTheBatter() {
        LivePlayState onThird = initial.toBuilder().bases(new BaseState(null, null, "r3")).strikes(1).build();

        Reduction reduction = reduce(onThird, ScoringAction.steal("r3", "b2", true));

        assertThat(reduction.state().score("reds").runs()).isEqualTo(1);
        assertThat(reduction.state().score("reds").hits()).isZero();
        assertThat(reduction.state().strikes()).isEqualTo(1);
        assertThat(reduction.state().currentBatter().playerId()).isEqualTo("r1");
        assertThat(reduction.event().eventType()).isEqualTo(EventType.STEAL_SUCCESS);
        assertThat(reduction.event().runnerId()).isEqualTo("r3");
        assertThat(reduction.event().batterId()).isEqualTo("r1");
        assertThat(reduction.event().runsScored()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void caughtStealingForTheThirdOutRotates() {
        LivePlayState state = initial.toBuilder().outs(2).bases(new BaseState("r3", null, null)).build();

        Reduction reduction = reduce(state, ScoringAction.steal("r3", "b1", false));

        assertThat(reduction.event().eventType()).isEqualTo(EventType.STEAL_FAIL);
        assertThat(reduction.event().baseStateAfter()).isEqualTo(BaseState.EMPTY);
        assertThat(reduction.state().half()).isEqualTo(Half.BOTTOM);
        assertThat(reduction.state().outs()).isZero();
    }

    @Test
    @Tag("unit")
    void completedGameAcceptsNothing() {
        LivePlayState complete = initial.toBuilder().complete(true).build();

        assertThatThrownBy(() -> reduce(complete, ScoringAction.strike()))
                .isInstanceOf(InvalidActionException.class)
                .hasMessageContaining("complete");
    }

    @Test
    @Tag("unit")
    void sameInputsGiveEqualReductions() {
        LivePlayState state = initial.toBuilder().bases(new BaseState("r2", null, "r3")).build();

        assertThat(reduce(state, ScoringAction.hit(EventType.DOUBLE)))
                .isEqualTo(reduce(state, ScoringAction.hit(EventType.DOUBLE)));
    }

    @Test
    @Tag("unit")
    void fromEventRecoversTheAction() {
        GameEvent steal = reduce(initial.toBuilder().bases(new BaseState("r2", null, null)).build(),
                ScoringAction.steal("r2", "b1", false)).event();
        GameEvent strikeout = reduce(initial.toBuilder().strikes(2).build(), ScoringAction.strike()).event();

        assertThat(ScoringAction.fromEvent(steal)).isEqualTo(ScoringAction.steal("r2", "b1", false));
        assertThat(ScoringAction.fromEvent(strikeout)).isEqualTo(ScoringAction.strike());
    }
}
