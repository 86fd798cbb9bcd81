package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.ModuleRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ExpressionReader
 * -----------------------------------------------------------------------------
 * Builds {@link Expression} trees from scenario document fragments.
 *
 * <pre>
 *   true | 0.5                       → Literal
 *   All: [ ... ]                     → All   (a single mapping is one operand)
 *   Any: [ ... ]                     → Any
 *   Not: { ... }                     → Not   (exactly one operand)
 *   Action: { Type: X, ... }         → Action,    module XAction
 *   { Type: X, ... }                 → Predicate, module XCondition
 * </pre>
 *
 * Reading is all-or-nothing. Procedure modules are resolved and configured
 * while reading, so an unknown type or an invalid module configuration fails
 * here, before any tick runs, and no partially built tree escapes.
 */
public final class ExpressionReader
{
    private final ModuleRegistry registry;
    private final ExecutionContext context;

    public ExpressionReader(ModuleRegistry registry, ExecutionContext context) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Reads one expression.
     *
     * @throws ScenarioConfigurationException if the fragment is malformed
     */
    public Expression read(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new ScenarioConfigurationException("Missing expression", node);
        }
        if (node.isBoolean()) {
            return Expression.literal(node.booleanValue());
        }
        if (node.isNumber()) {
            return Expression.literal(node.doubleValue());
        }
        if (node.isObject()) {
            return readMapping(node);
        }
        throw new ScenarioConfigurationException("Syntax error: malformed expression.", node);
    }

    /**
     * Reads a criteria block. A bare sequence is combined with
     * {@code implicit}, which must be {@link ExpressionKind#ALL} or
     * {@link ExpressionKind#ANY}.
     */
    public Expression readCriteria(JsonNode node, ExpressionKind implicit) {
        if (node != null && node.isArray()) {
            List<Expression> operands = readEach(node);
            return switch (implicit) {
                case ALL -> Expression.all(operands);
                case ANY -> Expression.any(operands);
                default -> throw new IllegalArgumentException("Not a sequence combinator: " + implicit);
            };
        }
        return read(node);
    }

    private Expression readMapping(JsonNode node) {
        if (node.size() == 1) {
            if (node.has("All")) {
                return Expression.all(readOperands(node.get("All")));
            }
            if (node.has("Any")) {
                return Expression.any(readOperands(node.get("Any")));
            }
            if (node.has("Not")) {
                return Expression.not(readSingleOperand(node));
            }
            if (node.has("Action")) {
                JsonNode call = node.get("Action");
                if (!call.isObject()) {
                    throw new ScenarioConfigurationException("Syntax error: malformed action.", node);
                }
                return Action.read(call, context, registry);
            }
        }
        if (node.has("Type")) {
            return Predicate.read(node, context, registry);
        }
        throw new ScenarioConfigurationException("Syntax error: malformed expression.", node);
    }

    private List<Expression> readOperands(JsonNode operands) {
        if (operands == null || operands.isNull()) {
            return List.of();
        }
        if (operands.isArray()) {
            return readEach(operands);
        }
        return List.of(read(operands));
    }

    private Expression readSingleOperand(JsonNode node) {
        JsonNode operand = node.get("Not");
        if (operand.isArray()) {
            if (operand.size() != 1) {
                throw new ScenarioConfigurationException("'Not' takes exactly one operand", node);
            }
            return read(operand.get(0));
        }
        if (operand.isNull()) {
            throw new ScenarioConfigurationException("'Not' takes exactly one operand", node);
        }
        return read(operand);
    }

    private List<Expression> readEach(JsonNode sequence) {
        List<Expression> result = new ArrayList<>(sequence.size());
        for (JsonNode each : sequence) {
            result.add(read(each));
        }
        return result;
    }
}
