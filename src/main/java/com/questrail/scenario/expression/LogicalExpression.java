package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * N-ary {@code All} / {@code Any}.
 *
 * <h2>No short-circuit</h2>
 * Every operand is evaluated exactly once per tick, left to right, even after
 * the result is already decided. Later operands observe the side effects of
 * earlier actions.
 */
final class LogicalExpression implements ExpressionNode
{
    enum Operator {
        ALL("All", ExpressionKind.ALL, true),
        ANY("Any", ExpressionKind.ANY, false);

        private final String type;
        private final ExpressionKind kind;
        private final boolean seed;

        Operator(String type, ExpressionKind kind, boolean seed) {
            this.type = type;
            this.kind = kind;
            this.seed = seed;
        }

        boolean combine(boolean lhs, boolean rhs) {
            return this == ALL ? lhs && rhs : lhs || rhs;
        }
    }

    private final Operator operator;
    private final List<Expression> operands;

    LogicalExpression(Operator operator, List<Expression> operands) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operands = List.copyOf(operands);
    }

    List<Expression> operands() {
        return operands;
    }

    @Override
    public ExpressionKind kind() {
        return operator.kind;
    }

    @Override
    public String type() {
        return operator.type;
    }

    @Override
    public Expression evaluate(ExecutionContext context) {
        boolean result = operator.seed;
        for (Expression operand : operands) {
            boolean value = operand.evaluate(context).toBoolean();
            result = operator.combine(result, value);
        }
        return Expression.literal(result);
    }

    @Override
    public boolean toBoolean() {
        return false;
    }

    @Override
    public JsonNode property(String prefix, int occurrence) {
        return Reports.collect(prefix, type(), occurrence, operands);
    }
}
