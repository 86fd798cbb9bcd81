package com.questrail.scenario.intersection;

import com.questrail.scenario.api.ScenarioConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every {@link IntersectionController} of a scenario, keyed by name.
 * <p>
 * The registry lives for the whole scenario run and is mutated only by
 * procedure evaluation on the evaluation thread; it is not synchronized.
 */
public final class IntersectionRegistry implements AutoCloseable
{
    private final Map<String, IntersectionController> controllers = new LinkedHashMap<>();

    /**
     * Adds a controller.
     *
     * @throws ScenarioConfigurationException if the name is already taken
     */
    public void register(IntersectionController controller) {
        Objects.requireNonNull(controller, "controller");
        if (controllers.putIfAbsent(controller.name(), controller) != null) {
            throw new ScenarioConfigurationException(
                    "Intersection '" + controller.name() + "' is declared twice");
        }
    }

    public Optional<IntersectionController> find(String name) {
        return Optional.ofNullable(controllers.get(name));
    }

    /**
     * Resolves a name referenced by the scenario.
     *
     * @throws ScenarioConfigurationException if no intersection has that name
     */
    public IntersectionController require(String name) {
        IntersectionController controller = controllers.get(name);
        if (controller == null) {
            throw new ScenarioConfigurationException(
                    "No intersection named '" + name + "' (declared: " + controllers.keySet() + ")");
        }
        return controller;
    }

    /**
     * Returns the registered names in declaration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(controllers.keySet());
    }

    public int size() {
        return controllers.size();
    }

    /**
     * Re-asserts every controller's current state.
     *
     * @return {@code true} if the simulator accepted every command
     */
    public boolean tick() {
        boolean acknowledged = true;
        for (IntersectionController controller : controllers.values()) {
            acknowledged &= controller.tick();
        }
        return acknowledged;
    }

    /**
     * Drops every controller at scenario teardown.
     */
    @Override
    public void close() {
        controllers.clear();
    }
}
