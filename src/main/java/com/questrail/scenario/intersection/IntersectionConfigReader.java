package com.questrail.scenario.intersection;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.Arrow;
import com.questrail.scenario.api.Color;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.api.SimulatorApi;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.observability.NullObservabilitySink;
import com.questrail.scenario.observability.ScenarioObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link IntersectionController}s from the {@code Intersection} block of
 * a scenario document.
 *
 * <pre>
 * Intersection:
 *   - Name: RedToGreen
 *     TrafficLight: [1, 2]          # optional, managed signal ids
 *     InitialState: Red
 *     Control:
 *       - StateName: Red
 *         TrafficLight:
 *           - { Id: 1, Color: Red }
 *       - StateName: Green
 *         TrafficLight:
 *           - { Id: 1, Color: Green, Arrows: [Straight] }
 * </pre>
 *
 * A scalar {@code Arrow: Left} is still accepted in place of
 * {@code Arrows: [Left]} but logs a deprecation warning.
 */
public final class IntersectionConfigReader
{
    private static final Logger log = LoggerFactory.getLogger(IntersectionConfigReader.class);

    private final SimulatorApi simulator;
    private final ScenarioObservabilitySink observabilitySink;
    private final Clock clock;

    public IntersectionConfigReader(SimulatorApi simulator,
                                    ScenarioObservabilitySink observabilitySink,
                                    Clock clock)
    {
        this.simulator = Objects.requireNonNull(simulator, "simulator");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
    }

    /**
     * Reads a whole {@code Intersection} sequence into a registry. A missing or
     * null block yields an empty registry.
     */
    public IntersectionRegistry readAll(JsonNode intersections) {
        IntersectionRegistry registry = new IntersectionRegistry();
        if (intersections == null || intersections.isNull() || intersections.isMissingNode()) {
            return registry;
        }
        if (!intersections.isArray()) {
            throw new ScenarioConfigurationException("'Intersection' must be a sequence", intersections);
        }
        for (JsonNode each : intersections) {
            registry.register(read(each));
        }
        return registry;
    }

    /**
     * Reads one intersection entry.
     */
    public IntersectionController read(JsonNode node) {
        String name = ConfigNodes.requireText(node, "Name");
        String initialState = ConfigNodes.requireText(node, "InitialState");

        List<Integer> managedIds = readManagedIds(node);

        JsonNode control = ConfigNodes.requireNode(node, "Control");
        if (!control.isArray()) {
            throw new ScenarioConfigurationException(
                    "'Control' of intersection '" + name + "' must be a sequence", node);
        }

        Map<String, List<SignalTransition>> states = new LinkedHashMap<>();
        for (JsonNode each : control) {
            String stateName = ConfigNodes.requireText(each, "StateName");
            if (states.containsKey(stateName)) {
                throw new ScenarioConfigurationException(
                        "Intersection '" + name + "' declares state '" + stateName + "' twice", node);
            }
            states.put(stateName, readState(name, stateName, each));
        }

        try {
            return new IntersectionController(
                    name, states, managedIds, initialState, simulator, observabilitySink, clock);
        } catch (ScenarioConfigurationException e) {
            throw new ScenarioConfigurationException(e.getMessage(), node, e);
        }
    }

    private List<Integer> readManagedIds(JsonNode node) {
        JsonNode trafficLights = node.get("TrafficLight");
        List<Integer> ids = new ArrayList<>();
        if (trafficLights == null || trafficLights.isNull()) {
            return ids;
        }
        if (trafficLights.isArray()) {
            for (JsonNode id : trafficLights) {
                ids.add(ConfigNodes.asInt(id, "TrafficLight", node));
            }
        } else {
            ids.add(ConfigNodes.asInt(trafficLights, "TrafficLight", node));
        }
        return ids;
    }

    private List<SignalTransition> readState(String intersection, String state, JsonNode node) {
        JsonNode trafficLights = node.get("TrafficLight");
        if (trafficLights == null) {
            throw new ScenarioConfigurationException(
                    "Each element of node 'Control' requires hash 'TrafficLight'.", node);
        }

        List<SignalTransition> transitions = new ArrayList<>();
        if (trafficLights.isNull()) {
            return transitions;
        }
        if (!trafficLights.isArray()) {
            throw new ScenarioConfigurationException(
                    "'TrafficLight' of state '" + state + "' must be a sequence", node);
        }
        for (JsonNode light : trafficLights) {
            transitions.add(readTransition(intersection, state, light));
        }
        return transitions;
    }

    private SignalTransition readTransition(String intersection, String state, JsonNode light) {
        int id = ConfigNodes.requireInt(light, "Id");

        Color color;
        try {
            color = ConfigNodes.optionalText(light, "Color").map(Color::parse).orElse(Color.BLANK);
        } catch (IllegalArgumentException e) {
            throw new ScenarioConfigurationException(e.getMessage(), light, e);
        }

        JsonNode arrows = light.get("Arrow");
        if (arrows != null) {
            log.warn("Tag 'Arrow: <String>' is deprecated. Use 'Arrows: [<String>*]' "
                    + "(intersection '{}', state '{}', signal {})", intersection, state, id);
        } else {
            arrows = light.get("Arrows");
        }

        return new SignalTransition(id, color, readArrows(arrows, light));
    }

    private static List<Arrow> readArrows(JsonNode arrows, JsonNode light) {
        List<Arrow> result = new ArrayList<>();
        if (arrows == null || arrows.isNull()) {
            return result;
        }
        try {
            if (arrows.isArray()) {
                for (JsonNode each : arrows) {
                    result.add(Arrow.parse(each.asText()));
                }
            } else if (arrows.isValueNode()) {
                result.add(Arrow.parse(arrows.asText()));
            } else {
                throw new ScenarioConfigurationException("Arrows must be a name or a sequence of names", light);
            }
        } catch (IllegalArgumentException e) {
            throw new ScenarioConfigurationException(e.getMessage(), light, e);
        }
        return result;
    }
}
