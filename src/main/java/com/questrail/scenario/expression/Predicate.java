package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.condition.ModuleRegistry;

/**
 * Procedure answering a question about the simulation, resolved as
 * {@code <Type>Condition}.
 */
final class Predicate extends Procedure
{
    static final String SUFFIX = "Condition";

    private Predicate(JsonNode node, ExecutionContext context, ModuleRegistry registry) {
        super(bind("predicate", SUFFIX, node, context, registry));
    }

    static Expression read(JsonNode node, ExecutionContext context, ModuleRegistry registry) {
        return Expression.of(new Predicate(node, context, registry));
    }
}
