package com.questrail.scenario.runtime;

import com.questrail.scenario.api.SimulatorApi;
import com.questrail.scenario.api.Verdict;
import com.questrail.scenario.config.ScenarioRuntimeConfig;
import com.questrail.scenario.expression.ExecutionContext;
import com.questrail.scenario.expression.Expression;
import com.questrail.scenario.expression.ExpressionKind;
import com.questrail.scenario.expression.ExpressionReader;
import com.questrail.scenario.intersection.IntersectionConfigReader;
import com.questrail.scenario.intersection.IntersectionRegistry;

import java.util.Objects;

/**
 * ScenarioRuntime
 * -----------------------------------------------------------------------------
 * Composition root for one scenario run.
 *
 * <pre>
 *   ScenarioDocument
 *      → DeclaredEntityRegistry
 *      → IntersectionRegistry     (initial states applied)
 *      → ExecutionContext
 *      → success / failure trees  (modules configured, fail fast)
 *      → ScenarioEvaluator
 * </pre>
 *
 * A bare sequence under {@code Success} is read as {@code All}, under
 * {@code Failure} as {@code Any}. A document without failure criteria never
 * fails.
 */
public final class ScenarioRuntime implements AutoCloseable
{
    private final ScenarioRuntimeConfig config;
    private final IntersectionRegistry intersections;
    private final ExecutionContext context;
    private final ScenarioEvaluator evaluator;

    private ScenarioRuntime(ScenarioRuntimeConfig config,
                            IntersectionRegistry intersections,
                            ExecutionContext context,
                            ScenarioEvaluator evaluator)
    {
        this.config = config;
        this.intersections = intersections;
        this.context = context;
        this.evaluator = evaluator;
    }

    /**
     * Builds every part of the scenario.
     *
     * @throws com.questrail.scenario.api.ScenarioConfigurationException if any
     *         part of the document is invalid; nothing is left half built
     */
    public static ScenarioRuntime create(ScenarioDocument document,
                                         SimulatorApi simulator,
                                         ScenarioRuntimeConfig config)
    {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(simulator, "simulator");
        Objects.requireNonNull(config, "config");

        DeclaredEntityRegistry entities = DeclaredEntityRegistry.fromConfig(document.entities());

        IntersectionRegistry intersections = new IntersectionConfigReader(
                simulator, config.observabilitySink(), config.clock())
                .readAll(document.intersections());

        ExecutionContext context = ExecutionContext.builder()
                .withSimulator(simulator)
                .withEntities(entities)
                .withIntersections(intersections)
                .build();

        ExpressionReader reader = new ExpressionReader(config.modules(), context);
        Expression success = reader.readCriteria(document.success(), ExpressionKind.ALL);
        Expression failure = document.hasFailure()
                ? reader.readCriteria(document.failure(), ExpressionKind.ANY)
                : Expression.literal(false);

        ScenarioEvaluator evaluator = new ScenarioEvaluator(
                success, failure, context, config.observabilitySink(), config.clock());
        return new ScenarioRuntime(config, intersections, context, evaluator);
    }

    /**
     * Runs one tick, re-asserting signal states first when configured to.
     */
    public Verdict tick() {
        if (config.reassertSignalsEachTick() && !evaluator.isTerminated()) {
            intersections.tick();
        }
        return evaluator.tick();
    }

    public Verdict verdict() {
        return evaluator.verdict();
    }

    public ScenarioEvaluator evaluator() {
        return evaluator;
    }

    public IntersectionRegistry intersections() {
        return intersections;
    }

    public ExecutionContext context() {
        return context;
    }

    /**
     * Aborts the run, if still going, and drops the intersections.
     */
    @Override
    public void close() {
        if (!evaluator.isTerminated()) {
            evaluator.abort();
        }
        intersections.close();
    }
}
