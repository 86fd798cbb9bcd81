package com.questrail.scenario.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ScenarioObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jScenarioObservabilitySink implements ScenarioObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jScenarioObservabilitySink.class);

    @Override
    public void onIntersectionTransition(IntersectionTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("Intersection {}: {} -> {}",
                event.intersection(),
                event.previousState().isEmpty() ? "<blank>" : event.previousState(),
                event.newState().isEmpty() ? "<blank>" : event.newState());
        } else {
            log.debug("Intersection {}: re-asserted {}", event.intersection(), event.newState());
        }
    }

    @Override
    public void onActuatorFailure(ActuatorFailureEvent event) {
        if (event.cause() != null) {
            log.warn("Intersection {} state {}: {} {} on signal {} failed",
                event.intersection(), event.state(), event.command(), event.argument(),
                event.signalId(), event.cause());
        } else {
            log.warn("Intersection {} state {}: {} {} on signal {} was rejected",
                event.intersection(), event.state(), event.command(), event.argument(),
                event.signalId());
        }
    }

    @Override
    public void onVerdict(VerdictEvent event) {
        if (event.isTerminal()) {
            log.info("Scenario {} at tick {} (success={}, failure={})",
                event.verdict(), event.tick(), event.success(), event.failure());
        } else {
            log.trace("Tick {}: success={}, failure={}", event.tick(), event.success(), event.failure());
        }
    }

    @Override
    public void onError(ScenarioErrorEvent event) {
        log.error("Scenario error at tick {}: {}", event.tick(), event.message(), event.cause());
    }
}
