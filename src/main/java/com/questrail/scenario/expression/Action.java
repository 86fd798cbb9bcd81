package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.condition.ModuleRegistry;

/**
 * Procedure acting on the simulation, resolved as {@code <Type>Action}.
 * Its value is whether the action was carried out.
 */
final class Action extends Procedure
{
    static final String SUFFIX = "Action";

    private Action(JsonNode node, ExecutionContext context, ModuleRegistry registry) {
        super(bind("action", SUFFIX, node, context, registry));
    }

    static Expression read(JsonNode node, ExecutionContext context, ModuleRegistry registry) {
        return Expression.of(new Action(node, context, registry));
    }
}
