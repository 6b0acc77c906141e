package org.dubbl.runtime.rotation;

import static org.assertj.core.api.Assertions.assertThat;

import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.model.BaseState;
import org.dubbl.runtime.model.Half;
import org.dubbl.runtime.model.Lineup;
import org.dubbl.runtime.model.LivePlayState;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class RotationTest {

    private final LivePlayState initial = LivePlayState.initial(TestGames.friendly(), "g");

    @Test
    void advanceBatterWrapsAroundTheOrder() {
        Lineup lineup = initial.offenseLineup();

        Lineup third = Rotation.advanceBatter(Rotation.advanceBatter(lineup));
        Lineup wrapped = Rotation.advanceBatter(third);

        assertThat(third.currentBatter().playerId()).isEqualTo("r3");
        assertThat(wrapped.currentBatter().playerId()).isEqualTo("r1");
    }

    @Test
    void leavingTheTopKeepsTheInning() {
        LivePlayState busy = initial.toBuilder().outs(3).strikes(2).bases(new BaseState("r1", null, "r2")).build();

        LivePlayState rotated = Rotation.rotateSides(busy);

        assertThat(rotated.half()).isEqualTo(Half.BOTTOM);
        assertThat(rotated.inning()).isEqualTo(1);
        assertThat(rotated.outs()).isZero();
        assertThat(rotated.strikes()).isZero();
        assertThat(rotated.bases()).isEqualTo(BaseState.EMPTY);
        assertThat(rotated.offenseTeamId()).isEqualTo("blues");
        assertThat(rotated.defenseTeamId()).isEqualTo("reds");
    }

    @Test
    void leavingTheBottomStartsTheNextInning() {
        LivePlayState bottom = Rotation.rotateSides(initial);

        LivePlayState next = Rotation.rotateSides(bottom);

        assertThat(next.half()).isEqualTo(Half.TOP);
        assertThat(next.inning()).isEqualTo(2);
        assertThat(next.offenseTeamId()).isEqualTo("reds");
    }

    @Test
    void extraInningsExtendPlannedInnings() {
        LivePlayState lastBottom = initial.toBuilder().inning(3).half(Half.BOTTOM).offense("blues", "reds").build();

        LivePlayState extra = Rotation.rotateSides(lastBottom);

        assertThat(extra.inning()).isEqualTo(4);
        assertThat(extra.plannedInnings()).isEqualTo(4);
    }

    @Test
    void rotateIfRetiredOnlyAtThreeOuts() {
        LivePlayState twoOuts = initial.toBuilder().outs(2).build();

        assertThat(Rotation.rotateIfRetired(twoOuts)).isSameAs(twoOuts);
        assertThat(Rotation.rotateIfRetired(twoOuts.toBuilder().outs(3).build()).half()).isEqualTo(Half.BOTTOM);
    }

    @Test
    void rotationKeepsEachLineupCursor() {
        LivePlayState advanced = initial.toBuilder().lineup(initial.offenseLineup().advance()).build();

        LivePlayState rotated = Rotation.rotateSides(Rotation.rotateSides(advanced));

        assertThat(rotated.currentBatter().playerId()).isEqualTo("r2");
    }
}
