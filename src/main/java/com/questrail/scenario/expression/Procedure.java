package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.ModuleRegistry;
import com.questrail.scenario.condition.ProcedureModule;
import com.questrail.scenario.config.ConfigNodes;

import java.util.Objects;

/**
 * A call into a condition or action module.
 *
 * <p>The module is resolved and configured while the tree is built and stays
 * bound to this node for the node's whole life, together with whatever history
 * it keeps (latched results, counters).</p>
 */
abstract class Procedure implements ExpressionNode
{
    private final ProcedureModule module;

    protected Procedure(ProcedureModule module) {
        this.module = Objects.requireNonNull(module, "module");
    }

    /**
     * Resolves {@code Type + suffix} and configures the module with the whole
     * fragment. Any failure is reported as a malformed {@code what}.
     */
    static ProcedureModule bind(String what, String suffix, JsonNode node,
                                ExecutionContext context, ModuleRegistry registry) {
        try {
            String type = ConfigNodes.requireText(node, "Type");
            ProcedureModule module = ProcedureDispatcher.load(registry, type + suffix);
            module.configure(node, context);
            return module;
        } catch (RuntimeException e) {
            throw new ScenarioConfigurationException("Syntax error: malformed " + what + ".", node, e);
        }
    }

    ProcedureModule module() {
        return module;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.PROCEDURE;
    }

    @Override
    public String type() {
        return module.type();
    }

    @Override
    public Expression evaluate(ExecutionContext context) {
        return Expression.literal(module.update(context));
    }

    @Override
    public boolean toBoolean() {
        return false;
    }

    @Override
    public JsonNode property(String prefix, int occurrence) {
        if (module.name().isEmpty()) {
            module.rename(prefix + module.type() + "(" + occurrence + ")");
        }
        return module.report();
    }
}
