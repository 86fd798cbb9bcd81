package com.questrail.scenario.observability;

import java.time.Instant;

/**
 * Record representing a traffic-light command the simulator did not accept.
 *
 * @param cause the exception thrown by the simulator, or {@code null} if it
 *              merely returned {@code false}
 */
public record ActuatorFailureEvent(
    Instant timestamp,
    String intersection,
    String state,
    int signalId,
    Command command,
    String argument,
    Throwable cause
) {
    /**
     * Signal commands issued while applying an intersection state.
     */
    public enum Command {
        SET_COLOR,
        RESET_COLOR,
        SET_ARROW,
        RESET_ARROWS
    }
}
