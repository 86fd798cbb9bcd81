package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Expression
 * -----------------------------------------------------------------------------
 * Immutable value handle over a node of a scenario's criteria tree.
 *
 * <pre>
 *   Expression = Literal                      (boolean | number)
 *              | All [ Expression* ]          (conjunction)
 *              | Any [ Expression* ]          (disjunction)
 *              | Not { Expression }           (negation)
 *              | Procedure                    (condition or action module)
 * </pre>
 *
 * <h2>Shared backing</h2>
 * A handle never owns its node exclusively. Copying a handle, whether by
 * assignment or {@link #copy()}, shares the backing node, so evaluating any
 * copy advances the same procedure state (a latched condition stays latched
 * for every copy). The node lives as long as any handle refers to it.
 * Trees are built bottom-up and never rewired, so sharing cannot form cycles.
 *
 * <h2>Truthiness</h2>
 * {@link #toBoolean()} is explicit and per variant: the empty handle is
 * {@code false}, a literal is its carried value. Combinators and procedures
 * are only truthy through the literal their {@link #evaluate evaluation}
 * returns.
 */
public final class Expression
{
    private static final Expression EMPTY = new Expression(null);
    private static final Expression TRUE = new Expression(Literal.TRUE);
    private static final Expression FALSE = new Expression(Literal.FALSE);

    private final ExpressionNode node;

    private Expression(ExpressionNode node) {
        this.node = node;
    }

    /**
     * Returns the default handle, which has no node and converts to {@code false}.
     */
    public static Expression empty() {
        return EMPTY;
    }

    public static Expression of(ExpressionNode node) {
        return new Expression(Objects.requireNonNull(node, "node"));
    }

    public static Expression literal(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression literal(double value) {
        return new Expression(Literal.ofNumber(value));
    }

    public static Expression all(List<Expression> operands) {
        return new Expression(new LogicalExpression(LogicalExpression.Operator.ALL, operands));
    }

    public static Expression all(Expression... operands) {
        return all(Arrays.asList(operands));
    }

    public static Expression any(List<Expression> operands) {
        return new Expression(new LogicalExpression(LogicalExpression.Operator.ANY, operands));
    }

    public static Expression any(Expression... operands) {
        return any(Arrays.asList(operands));
    }

    public static Expression not(Expression operand) {
        return new Expression(new Not(operand));
    }

    /**
     * Returns a new handle sharing this handle's node.
     */
    public Expression copy() {
        return node == null ? EMPTY : new Expression(node);
    }

    /**
     * Checks whether both handles are backed by the same node.
     */
    public boolean sharesNodeWith(Expression other) {
        return node != null && other != null && node == other.node;
    }

    public boolean isEmpty() {
        return node == null;
    }

    public ExpressionKind kind() {
        return node == null ? ExpressionKind.EMPTY : node.kind();
    }

    public String type() {
        return node == null ? "Expression" : node.type();
    }

    /**
     * Evaluates the tree under this handle for the current tick. The empty
     * handle evaluates to itself.
     */
    public Expression evaluate(ExecutionContext context) {
        Objects.requireNonNull(context, "context");
        return node == null ? this : node.evaluate(context);
    }

    public boolean toBoolean() {
        return node != null && node.toBoolean();
    }

    /**
     * Diagnostic report of the whole tree.
     */
    public JsonNode property() {
        return property("", 0);
    }

    public JsonNode property(String prefix, int occurrence) {
        Objects.requireNonNull(prefix, "prefix");
        return node == null ? Reports.emptyEntry() : node.property(prefix, occurrence);
    }

    @Override
    public String toString() {
        return property().toPrettyString();
    }
}
