package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A boolean or numeric constant. Literals are immutable, so sharing them
 * between handles is always safe.
 */
final class Literal implements ExpressionNode
{
    static final Literal TRUE = new Literal(true, null);
    static final Literal FALSE = new Literal(false, null);

    private final boolean bool;
    private final Double number;

    private Literal(boolean bool, Double number) {
        this.bool = bool;
        this.number = number;
    }

    static Literal ofNumber(double value) {
        return new Literal(value != 0.0, value);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }

    @Override
    public String type() {
        return "Literal";
    }

    @Override
    public Expression evaluate(ExecutionContext context) {
        return Expression.of(this);
    }

    @Override
    public boolean toBoolean() {
        return bool;
    }

    @Override
    public JsonNode property(String prefix, int occurrence) {
        return Reports.emptyEntry();
    }

    @Override
    public String toString() {
        return number != null ? number.toString() : Boolean.toString(bool);
    }
}
