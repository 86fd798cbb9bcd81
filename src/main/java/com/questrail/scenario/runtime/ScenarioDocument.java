package com.questrail.scenario.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.config.ConfigNodes;

import java.util.Objects;

/**
 * The parts of a scenario document the evaluator consumes.
 *
 * <pre>
 * Entity:
 *   - Name: Ego
 * Intersection:
 *   - ...
 * Story:
 *   EndCondition:
 *     Success: ...
 *     Failure: ...          # optional
 * </pre>
 *
 * Blocks that are absent are {@link MissingNode}s, never {@code null}.
 */
public record ScenarioDocument(
    JsonNode entities,
    JsonNode intersections,
    JsonNode success,
    JsonNode failure
) {
    public ScenarioDocument {
        Objects.requireNonNull(entities, "entities");
        Objects.requireNonNull(intersections, "intersections");
        Objects.requireNonNull(success, "success");
        Objects.requireNonNull(failure, "failure");
    }

    /**
     * Splits a parsed document into its blocks.
     *
     * @throws ScenarioConfigurationException if the document has no success criteria
     */
    public static ScenarioDocument from(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ScenarioConfigurationException("Scenario document must be a mapping", root);
        }
        JsonNode endCondition = ConfigNodes.requireNode(ConfigNodes.requireNode(root, "Story"), "EndCondition");
        JsonNode success = ConfigNodes.requireNode(endCondition, "Success");
        return new ScenarioDocument(
                root.path("Entity"),
                root.path("Intersection"),
                success,
                endCondition.path("Failure"));
    }

    public boolean hasFailure() {
        return !failure.isMissingNode() && !failure.isNull();
    }
}
