package org.dubbl.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * A team entering a game together with its batting order.
 *
 * @param teamId  Team id.
 * @param label   Display label.
 * @param players Players in batting order.
 */
public record TeamSetup(String teamId, String label, List<PlayerIdentity> players) {

    public TeamSetup {
        Objects.requireNonNull(teamId, "teamId");
        label = label == null || label.isBlank() ? teamId : label;
        players = players == null ? List.of() : List.copyOf(players);
    }
}
