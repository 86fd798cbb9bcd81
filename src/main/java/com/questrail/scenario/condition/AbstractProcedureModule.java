package com.questrail.scenario.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.config.ConfigNodes;
import com.questrail.scenario.expression.ExecutionContext;

import java.util.Objects;

/**
 * AbstractProcedureModule
 * -----------------------------------------------------------------------------
 * Base class carrying the bookkeeping every {@link ProcedureModule} shares:
 * type, display name, last result and the configure-once lifecycle.
 *
 * <p>Subclasses implement {@link #onConfigure} to read their own keys and
 * {@link #onUpdate} to compute one tick. The optional {@code Name} key is
 * read here.</p>
 */
public abstract class AbstractProcedureModule implements ProcedureModule
{
    private final String type;

    private String name = "";
    private boolean result;
    private boolean configured;

    protected AbstractProcedureModule(String type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public final String type() {
        return type;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final void rename(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final boolean result() {
        return result;
    }

    @Override
    public final void configure(JsonNode node, ExecutionContext context) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(context, "context");
        if (configured) {
            throw new ScenarioConfigurationException(type + " is already configured", node);
        }
        name = ConfigNodes.optionalText(node, "Name").orElse("");
        onConfigure(node, context);
        configured = true;
    }

    @Override
    public final boolean update(ExecutionContext context) {
        Objects.requireNonNull(context, "context");
        if (!configured) {
            throw new IllegalStateException(type + " updated before it was configured");
        }
        result = onUpdate(context);
        return result;
    }

    @Override
    public ObjectNode report() {
        ObjectNode report = JsonNodeFactory.instance.objectNode();
        report.put("Name", name);
        report.put("Type", type);
        report.put("Value", result);
        return report;
    }

    /**
     * Reads module specific keys. {@code context} is the one in place when
     * the scenario is built; collaborators may still be missing.
     */
    protected abstract void onConfigure(JsonNode node, ExecutionContext context);

    protected abstract boolean onUpdate(ExecutionContext context);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", result=" + result + "]";
    }
}
