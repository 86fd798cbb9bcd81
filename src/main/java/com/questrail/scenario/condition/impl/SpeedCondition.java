package com.questrail.scenario.condition.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.AbstractCondition;
import com.questrail.scenario.condition.ComparisonRule;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

/**
 * Compares an entity's current speed with a threshold in m/s.
 *
 * <pre>
 *   - { Type: Speed, Entity: Ego, Value: 10.0, Rule: greaterThan }
 * </pre>
 *
 * {@code Rule} defaults to {@code greaterThan}.
 */
public final class SpeedCondition extends AbstractCondition
{
    private String entity;
    private double threshold;
    private ComparisonRule rule = ComparisonRule.GREATER_THAN;

    public SpeedCondition() {
        super("Speed");
    }

    public String entity() {
        return entity;
    }

    public double threshold() {
        return threshold;
    }

    public ComparisonRule rule() {
        return rule;
    }

    @Override
    protected void configureCondition(JsonNode node, ExecutionContext context) {
        entity = ConfigNodes.requireText(node, "Entity");
        threshold = ConfigNodes.requireDouble(node, "Value");
        try {
            rule = ConfigNodes.optionalText(node, "Rule")
                    .map(ComparisonRule::parse)
                    .orElse(ComparisonRule.GREATER_THAN);
        } catch (ScenarioConfigurationException e) {
            throw new ScenarioConfigurationException(e.getMessage(), node, e);
        }

        context.entities().ifPresent(entities -> {
            if (!entities.exists(entity)) {
                throw new ScenarioConfigurationException(
                        "Speed condition refers to undeclared entity '" + entity + "'", node);
            }
        });
    }

    @Override
    protected boolean check(ExecutionContext context) {
        return rule.test(context.requireSimulator().entitySpeed(entity), threshold);
    }
}
