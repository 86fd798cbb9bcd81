package com.questrail.scenario.observability;

/**
 * No-op implementation of ScenarioObservabilitySink.
 */
public final class NullObservabilitySink implements ScenarioObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onIntersectionTransition(IntersectionTransitionEvent event) {}

    @Override
    public void onActuatorFailure(ActuatorFailureEvent event) {}

    @Override
    public void onVerdict(VerdictEvent event) {}

    @Override
    public void onError(ScenarioErrorEvent event) {}
}
