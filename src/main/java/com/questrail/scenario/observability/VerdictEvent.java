package com.questrail.scenario.observability;

import com.questrail.scenario.api.Verdict;

import java.time.Instant;

/**
 * Record representing the verdict produced by one tick.
 */
public record VerdictEvent(
    Instant timestamp,
    long tick,
    boolean success,
    boolean failure,
    Verdict verdict
) {
    /**
     * Checks whether this tick ended the scenario.
     */
    public boolean isTerminal() {
        return verdict.isTerminal();
    }
}
