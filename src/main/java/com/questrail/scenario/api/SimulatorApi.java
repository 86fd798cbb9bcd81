package com.questrail.scenario.api;

import java.time.Duration;

/**
 * SimulatorApi
 * -----------------------------------------------------------------------------
 * {@code SimulatorApi} is the boundary between scenario evaluation and the
 * traffic simulator that actually moves vehicles and renders signals.
 *
 * <h2>Telemetry</h2>
 * Conditions read simulation time and entity state through this interface.
 * Values are assumed to be consistent for the duration of one tick.
 *
 * <h2>Actuator commands</h2>
 * Traffic-light commands return {@code true} when the simulator accepted the
 * command. A {@code false} return (for example an unknown signal id) is a
 * recoverable condition: callers report it and keep going. Implementations may
 * also throw a {@link RuntimeException}; callers treat that the same way.
 *
 * <h2>Threading</h2>
 * Scenario evaluation is single-threaded. Implementations need not be thread
 * safe unless they are shared outside the evaluation loop.
 */
public interface SimulatorApi
{
    /**
     * @return simulation time elapsed since the scenario started
     */
    Duration simulationTime();

    /**
     * @param entityName entity whose speed is requested
     * @return the entity's current speed in m/s
     */
    double entitySpeed(String entityName);

    /**
     * Lights the given color on a signal.
     *
     * @return {@code true} if the simulator accepted the command
     */
    boolean setTrafficLightColor(int signalId, Color color);

    /**
     * Returns a signal's lamps to their off/neutral rendering.
     *
     * @return {@code true} if the simulator accepted the command
     */
    boolean resetTrafficLightColor(int signalId);

    /**
     * Lights one arrow on a signal, leaving other arrows untouched.
     *
     * @return {@code true} if the simulator accepted the command
     */
    boolean setTrafficLightArrow(int signalId, Arrow arrow);

    /**
     * Turns off every arrow on a signal.
     *
     * @return {@code true} if the simulator accepted the command
     */
    boolean resetTrafficLightArrows(int signalId);
}
