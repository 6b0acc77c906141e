package org.dubbl.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.GameSetupException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class LivePlayStateTest {

    @Test
    void initialStateAssignsLineupsAndTeams() {
        LivePlayState state = LivePlayState.initial(TestGames.friendly(), "g");

        assertThat(state.teamOrder()).containsExactly("reds", "blues");
        assertThat(state.teamLabels()).containsEntry("blues", "Blues");
        assertThat(state.defenseTeamId()).isEqualTo("blues");
        assertThat(state.defenseLineup().slots()).extracting(LineupSlot::battingOrder).containsExactly(1, 2, 3);
        assertThat(state.defenseLineup().slots().get(1).player().teamId()).isEqualTo("blues");
        assertThat(state.totalRuns()).isZero();
        assertThat(state.plannedInnings()).isEqualTo(3);
        assertThat(state.complete()).isFalse();
    }

    @Test
    void duplicateTeamIsRejected() {
        GameSetup setup = GameSetup.friendly(TestGames.reds(), TestGames.reds(), 3);

        assertThatThrownBy(() -> LivePlayState.initial(setup, "g"))
                .isInstanceOf(GameSetupException.class)
                .hasMessageContaining("appears twice");
    }

    @Test
    void plannedInningsMustBePositive() {
        GameSetup setup = new GameSetup(GameMode.LEAGUE, "l1", List.of(TestGames.reds(), TestGames.blues()), 0);

        assertThatThrownBy(() -> LivePlayState.initial(setup, "g"))
                .isInstanceOf(GameSetupException.class)
                .hasMessageContaining("Planned innings");
    }

    @Test
    void playerIdentityDefaults() {
        PlayerIdentity anonymous = PlayerIdentity.member("p9", " ", "");

        assertThat(anonymous.displayName()).isEqualTo("p9");
        assertThat(anonymous.identityKey()).isNull();
        assertThat(PlayerIdentity.guest("g1", "Gus").guest()).isTrue();
    }
}
