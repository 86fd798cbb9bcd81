package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Backing node of an {@link Expression} handle.
 * <p>
 * Nodes may carry evaluation state (a procedure's bound module); every handle
 * referring to the same node observes and advances that same state.
 */
public interface ExpressionNode
{
    ExpressionKind kind();

    /**
     * Returns the name used to number this node in diagnostic reports, e.g.
     * {@code "All"} or a module type such as {@code "Speed"}.
     */
    String type();

    /**
     * Evaluates this node for the current tick.
     *
     * @return the resulting value, normally a boolean literal
     */
    Expression evaluate(ExecutionContext context);

    /**
     * Explicit truthiness of the node itself. Only literals carry a value;
     * combinators and procedures must be evaluated first.
     */
    boolean toBoolean();

    /**
     * Builds this node's diagnostic report.
     *
     * @param prefix     path of the enclosing combinators, e.g. {@code "All(0)/"}
     * @param occurrence how many earlier siblings share this node's type
     */
    JsonNode property(String prefix, int occurrence);
}
