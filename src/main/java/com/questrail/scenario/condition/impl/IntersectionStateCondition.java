package com.questrail.scenario.condition.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.condition.AbstractCondition;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

/**
 * Holds while an intersection is (intentionally) in the given state.
 *
 * <pre>
 *   - { Type: IntersectionState, Intersection: RedToGreen, State: Green }
 * </pre>
 */
public final class IntersectionStateCondition extends AbstractCondition
{
    private String intersection;
    private String state;

    public IntersectionStateCondition() {
        super("IntersectionState");
    }

    public String intersection() {
        return intersection;
    }

    public String state() {
        return state;
    }

    @Override
    protected void configureCondition(JsonNode node, ExecutionContext context) {
        intersection = ConfigNodes.requireText(node, "Intersection");
        state = ConfigNodes.requireText(node, "State");
        IntersectionReferences.validate(intersection, state, node, context);
    }

    @Override
    protected boolean check(ExecutionContext context) {
        return context.requireIntersections().require(intersection).is(state);
    }
}
