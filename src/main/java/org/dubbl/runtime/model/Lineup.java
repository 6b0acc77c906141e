package org.dubbl.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A team's batting order with a circular cursor on the current batter.
 * <p>
 * Lineups are immutable; {@link #advance()} returns a new lineup whose cursor
 * moved forward by one, wrapping at the end of the order.
 *
 * @param teamId       Team owning the lineup.
 * @param slots        Batting order, never empty.
 * @param currentIndex Index of the batter currently up.
 */
public record Lineup(String teamId, List<LineupSlot> slots, int currentIndex) {

    public Lineup {
        Objects.requireNonNull(teamId, "teamId");
        slots = List.copyOf(slots);
        if (slots.isEmpty()) {
            throw new IllegalArgumentException("Lineup for team '" + teamId + "' is empty");
        }
        if (currentIndex < 0 || currentIndex >= slots.size()) {
            throw new IllegalArgumentException("Batter index " + currentIndex + " outside lineup of " + slots.size());
        }
    }

    /**
     * Builds a lineup from players in batting order, cursor on the first batter.
     *
     * @param teamId  Team id.
     * @param players Players in batting order.
     * @return The new lineup.
     */
    public static Lineup of(String teamId, List<PlayerIdentity> players) {
        List<LineupSlot> slots = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            slots.add(new LineupSlot(players.get(i).onTeam(teamId), i + 1));
        }
        return new Lineup(teamId, slots, 0);
    }

    public LineupSlot currentBatter() {
        return slots.get(currentIndex);
    }

    public Lineup advance() {
        return new Lineup(teamId, slots, (currentIndex + 1) % slots.size());
    }

    public boolean contains(String playerId) {
        for (LineupSlot slot : slots) {
            if (slot.playerId().equals(playerId)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return slots.size();
    }
}
