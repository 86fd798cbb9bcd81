package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Unary negation of exactly one operand.
 */
final class Not implements ExpressionNode
{
    private final Expression operand;

    Not(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    Expression operand() {
        return operand;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.NOT;
    }

    @Override
    public String type() {
        return "Not";
    }

    @Override
    public Expression evaluate(ExecutionContext context) {
        return Expression.literal(!operand.evaluate(context).toBoolean());
    }

    @Override
    public boolean toBoolean() {
        return false;
    }

    @Override
    public JsonNode property(String prefix, int occurrence) {
        return Reports.collect(prefix, type(), occurrence, List.of(operand));
    }
}
