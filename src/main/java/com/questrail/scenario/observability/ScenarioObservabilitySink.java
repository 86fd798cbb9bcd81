package com.questrail.scenario.observability;

/**
 * Main interface for receiving scenario evaluation observability events.
 * Implementations can provide logging, metrics, or visualization.
 */
public interface ScenarioObservabilitySink {
    /**
     * Called after an intersection controller applied a state, including
     * re-assertions of the state it was already in.
     * @param event the transition details
     */
    void onIntersectionTransition(IntersectionTransitionEvent event);

    /**
     * Called for every signal command the simulator rejected or failed on.
     * The transition that issued it carries on regardless.
     * @param event the failed command
     */
    void onActuatorFailure(ActuatorFailureEvent event);

    /**
     * Called once per evaluated tick with the verdict it produced.
     * @param event the verdict details
     */
    void onVerdict(VerdictEvent event);

    /**
     * Called when a tick aborts with an error, before the error is rethrown.
     * @param event the error event
     */
    void onError(ScenarioErrorEvent event);
}
