package com.questrail.scenario.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.scenario.expression.ExecutionContext;

/**
 * ProcedureModule
 * -----------------------------------------------------------------------------
 * A pluggable condition or action that a procedure node of the criteria tree
 * calls once per tick.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>created by a {@link ModuleRegistry}, one instance per procedure node</li>
 *   <li>{@link #configure configured} exactly once with the document fragment
 *       that declared it, while the criteria tree is being built</li>
 *   <li>{@link #update updated} once per tick for as long as the scenario runs</li>
 * </ol>
 *
 * A module may keep state across updates (latched results, counters). That
 * state is visible through every expression handle sharing the owning node.
 *
 * <h2>Errors</h2>
 * Configuration problems are reported as
 * {@link com.questrail.scenario.api.ScenarioConfigurationException}s from
 * {@link #configure}. A module that needs a collaborator the
 * {@link ExecutionContext} does not carry fails its {@link #update} with a
 * {@link com.questrail.scenario.api.ScenarioEvaluationException}.
 */
public interface ProcedureModule
{
    /**
     * Short type name as written in scenario documents ({@code Timeout},
     * {@code ChangeIntersection}).
     */
    String type();

    /**
     * Display name in diagnostic reports; empty until set by the document or
     * by {@link #rename}.
     */
    String name();

    void rename(String name);

    /**
     * Result of the most recent {@link #update}; {@code false} before the first.
     */
    boolean result();

    void configure(JsonNode node, ExecutionContext context);

    /**
     * Runs one tick and returns its result.
     */
    boolean update(ExecutionContext context);

    /**
     * Diagnostic entry: {@code {Name, Type, Value}}.
     */
    ObjectNode report();
}
