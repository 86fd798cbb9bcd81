package com.questrail.scenario.condition.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.AbstractCondition;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

import java.time.Duration;

/**
 * Holds once the simulation clock has reached {@code Value} seconds.
 *
 * <pre>
 *   - { Type: Timeout, Value: 180 }
 * </pre>
 */
public final class TimeoutCondition extends AbstractCondition
{
    private Duration limit = Duration.ZERO;

    public TimeoutCondition() {
        super("Timeout");
    }

    public Duration limit() {
        return limit;
    }

    @Override
    protected void configureCondition(JsonNode node, ExecutionContext context) {
        double seconds = ConfigNodes.requireDouble(node, "Value");
        if (seconds < 0.0 || Double.isNaN(seconds)) {
            throw new ScenarioConfigurationException("Timeout 'Value' must not be negative", node);
        }
        limit = Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    @Override
    protected boolean check(ExecutionContext context) {
        return context.requireSimulator().simulationTime().compareTo(limit) >= 0;
    }
}
