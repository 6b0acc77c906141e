package org.dubbl.runtime.action;

import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.LivePlayState;

/**
 * Result of reducing one action: the next state and the event to append.
 *
 * @param state Next play state.
 * @param event Event describing the action.
 */
public record Reduction(LivePlayState state, GameEvent event) {}
