package com.questrail.scenario.intersection;

import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.api.SimulatorApi;
import com.questrail.scenario.observability.ActuatorFailureEvent;
import com.questrail.scenario.observability.IntersectionTransitionEvent;
import com.questrail.scenario.observability.NullObservabilitySink;
import com.questrail.scenario.observability.ScenarioObservabilitySink;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * IntersectionController
 * -----------------------------------------------------------------------------
 * Named state machine owning the signals of one traffic intersection.
 *
 * <h2>States</h2>
 * States are finite and declared up front. Each maps to the
 * {@link SignalTransition}s it issues. In addition to the declared states,
 * every controller has the {@link #BLANK_STATE blank state}, which resets all
 * managed signals to their off rendering. There is no "unknown" state: the
 * initial state must be one of the states above or construction fails.
 *
 * <h2>Transitions</h2>
 * {@link #transitionTo(String)}:
 * <ul>
 *   <li>rejects undeclared targets with a {@link ScenarioConfigurationException},
 *       leaving the current state untouched</li>
 *   <li>issues every command of the target state, even when the target is
 *       already current</li>
 *   <li>records the target as current whether or not the simulator accepted
 *       the commands; rejected commands are reported to the observability sink</li>
 * </ul>
 * The model therefore always reflects the <b>intended</b> signal state, which
 * may differ from what the simulator acknowledged.
 *
 * <h2>Threading</h2>
 * Not thread safe. Controllers are only driven from the evaluation loop.
 */
public final class IntersectionController
{
    /**
     * Name of the implicit state that switches every managed signal off.
     */
    public static final String BLANK_STATE = "";

    private final String name;
    private final SimulatorApi simulator;
    private final ScenarioObservabilitySink observabilitySink;
    private final Clock clock;

    private final Set<Integer> ids;
    private final Map<String, List<SignalTransition>> states;

    private String currentState = BLANK_STATE;

    /**
     * Creates a controller and applies its initial state.
     *
     * @param name           intersection name, unique within its registry
     * @param declaredStates state name to the transitions it issues, in declaration order
     * @param managedIds     signal ids under this intersection's authority; ids
     *                       referenced by {@code declaredStates} are added implicitly
     * @param initialState   state applied at construction
     */
    public IntersectionController(String name,
                                  Map<String, List<SignalTransition>> declaredStates,
                                  Collection<Integer> managedIds,
                                  String initialState,
                                  SimulatorApi simulator,
                                  ScenarioObservabilitySink observabilitySink,
                                  Clock clock)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.simulator = Objects.requireNonNull(simulator, "simulator");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
        Objects.requireNonNull(declaredStates, "declaredStates");
        Objects.requireNonNull(initialState, "initialState");

        if (name.isBlank()) {
            throw new ScenarioConfigurationException("Intersection name must not be blank");
        }
        if (declaredStates.containsKey(BLANK_STATE)) {
            throw new ScenarioConfigurationException(
                    "Intersection '" + name + "' declares a state with an empty name");
        }

        TreeSet<Integer> allIds = new TreeSet<>(Objects.requireNonNull(managedIds, "managedIds"));
        declaredStates.values().forEach(transitions ->
                transitions.forEach(t -> allIds.add(t.signalId())));
        this.ids = Collections.unmodifiableSet(allIds);

        LinkedHashMap<String, List<SignalTransition>> all = new LinkedHashMap<>();
        all.put(BLANK_STATE, allIds.stream().map(SignalTransition::reset).toList());
        declaredStates.forEach((state, transitions) -> all.put(state, List.copyOf(transitions)));
        this.states = Collections.unmodifiableMap(all);

        if (!states.containsKey(initialState)) {
            throw new ScenarioConfigurationException(
                    "Intersection '" + name + "' has undeclared initial state '" + initialState
                            + "' (declared: " + declaredStates.keySet() + ")");
        }

        apply(initialState);
    }

    public String name() {
        return name;
    }

    /**
     * Returns every state this controller can be in, the blank state first.
     */
    public Set<String> states() {
        return states.keySet();
    }

    /**
     * Returns the transitions a state issues.
     *
     * @throws ScenarioConfigurationException if the state is not declared
     */
    public List<SignalTransition> transitionsOf(String state) {
        List<SignalTransition> transitions = states.get(state);
        if (transitions == null) {
            throw undeclared(state);
        }
        return transitions;
    }

    public String currentState() {
        return currentState;
    }

    /**
     * Pure query: is the controller (intentionally) in {@code state}?
     */
    public boolean is(String state) {
        return currentState.equals(state);
    }

    /**
     * Returns the signal ids this intersection has authority over, ascending.
     */
    public Set<Integer> ids() {
        return ids;
    }

    /**
     * Moves to {@code target} and issues its signal commands.
     *
     * @return {@code true} if the simulator accepted every command
     * @throws ScenarioConfigurationException if {@code target} is not declared;
     *         the current state is left unchanged
     */
    public boolean transitionTo(String target) {
        Objects.requireNonNull(target, "target");
        if (!states.containsKey(target)) {
            throw undeclared(target);
        }
        return apply(target);
    }

    /**
     * Re-asserts the current state's signal commands.
     *
     * @return {@code true} if the simulator accepted every command
     */
    public boolean tick() {
        return apply(currentState);
    }

    private boolean apply(String target) {
        boolean acknowledged = true;
        for (SignalTransition transition : states.get(target)) {
            acknowledged &= transition.apply(simulator, (signalId, command, argument, cause) ->
                    observabilitySink.onActuatorFailure(new ActuatorFailureEvent(
                            clock.instant(), name, target, signalId, command, argument, cause)));
        }

        String previous = currentState;
        currentState = target;

        observabilitySink.onIntersectionTransition(new IntersectionTransitionEvent(
                clock.instant(), name, previous, target, acknowledged));
        return acknowledged;
    }

    private ScenarioConfigurationException undeclared(String state) {
        return new ScenarioConfigurationException(
                "Intersection '" + name + "' declares no state '" + state
                        + "' (declared: " + states.keySet() + ")");
    }

    @Override
    public String toString() {
        return "IntersectionController[" + name + ", state=" + currentState + ", ids=" + ids + "]";
    }
}
