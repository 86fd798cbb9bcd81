package com.questrail.scenario.condition.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.expression.ExecutionContext;
import com.questrail.scenario.intersection.IntersectionController;

/**
 * Checks an {@code Intersection}/{@code State} pair against the intersections
 * known when the scenario is built. Without an intersection registry the
 * reference is resolved at tick time instead.
 */
final class IntersectionReferences
{
    private IntersectionReferences() {}

    static void validate(String intersection, String state, JsonNode node, ExecutionContext context) {
        context.intersections().ifPresent(registry -> {
            IntersectionController controller = registry.find(intersection).orElseThrow(() ->
                    new ScenarioConfigurationException(
                            "No intersection named '" + intersection + "' (declared: " + registry.names() + ")",
                            node));
            if (!controller.states().contains(state)) {
                throw new ScenarioConfigurationException(
                        "Intersection '" + intersection + "' declares no state '" + state + "'", node);
            }
        });
    }
}
