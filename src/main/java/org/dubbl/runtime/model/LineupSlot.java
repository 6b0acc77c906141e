package org.dubbl.runtime.model;

/**
 * One position in a batting order.
 *
 * @param player       The player batting in this slot.
 * @param battingOrder 1-based position in the order.
 */
public record LineupSlot(PlayerIdentity player, int battingOrder) {

    public String playerId() {
        return player.id();
    }
}
