package com.questrail.scenario.observability;

import java.time.Instant;

/**
 * Record representing an error that aborted a tick.
 */
public record ScenarioErrorEvent(
    Instant timestamp,
    long tick,
    String message,
    Throwable cause
) {
}
