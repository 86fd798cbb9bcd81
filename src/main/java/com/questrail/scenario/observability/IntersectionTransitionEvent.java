package com.questrail.scenario.observability;

import java.time.Instant;

/**
 * Record representing one application of an intersection state.
 *
 * @param acknowledged {@code true} if the simulator accepted every command
 */
public record IntersectionTransitionEvent(
    Instant timestamp,
    String intersection,
    String previousState,
    String newState,
    boolean acknowledged
) {
    /**
     * Checks whether the intersection actually changed state, as opposed to
     * re-asserting the state it was already in.
     */
    public boolean isStateChange() {
        return !previousState.equals(newState);
    }
}
