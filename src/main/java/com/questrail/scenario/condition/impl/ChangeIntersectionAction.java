package com.questrail.scenario.condition.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.condition.AbstractProcedureModule;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

/**
 * Switches an intersection to a state each tick it is evaluated.
 *
 * <pre>
 *   - Action: { Type: ChangeIntersection, Intersection: RedToGreen, State: Green }
 * </pre>
 *
 * The result is {@code true} when the simulator acknowledged every signal
 * command of the transition. The intersection moves to the state either way.
 */
public final class ChangeIntersectionAction extends AbstractProcedureModule
{
    private String intersection;
    private String state;

    public ChangeIntersectionAction() {
        super("ChangeIntersection");
    }

    public String intersection() {
        return intersection;
    }

    public String state() {
        return state;
    }

    @Override
    protected void onConfigure(JsonNode node, ExecutionContext context) {
        intersection = ConfigNodes.requireText(node, "Intersection");
        state = ConfigNodes.requireText(node, "State");
        IntersectionReferences.validate(intersection, state, node, context);
    }

    @Override
    protected boolean onUpdate(ExecutionContext context) {
        return context.requireIntersections().require(intersection).transitionTo(state);
    }
}
