package com.questrail.scenario.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

/**
 * Base class for predicates.
 *
 * <p>With {@code Keep: true} a condition latches: once it has held it keeps
 * reporting {@code true} and is no longer checked.</p>
 */
public abstract class AbstractCondition extends AbstractProcedureModule
{
    private boolean keep;
    private boolean latched;

    protected AbstractCondition(String type) {
        super(type);
    }

    public final boolean keep() {
        return keep;
    }

    @Override
    protected final void onConfigure(JsonNode node, ExecutionContext context) {
        keep = ConfigNodes.optionalBoolean(node, "Keep", false);
        configureCondition(node, context);
    }

    @Override
    protected final boolean onUpdate(ExecutionContext context) {
        if (latched) {
            return true;
        }
        boolean holds = check(context);
        latched = keep && holds;
        return holds;
    }

    protected abstract void configureCondition(JsonNode node, ExecutionContext context);

    /**
     * Evaluates the condition against the current simulation state.
     */
    protected abstract boolean check(ExecutionContext context);
}
