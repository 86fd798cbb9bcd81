package com.questrail.scenario.runtime;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.scenario.api.Verdict;
import com.questrail.scenario.expression.ExecutionContext;
import com.questrail.scenario.expression.Expression;
import com.questrail.scenario.observability.NullObservabilitySink;
import com.questrail.scenario.observability.ScenarioErrorEvent;
import com.questrail.scenario.observability.ScenarioObservabilitySink;
import com.questrail.scenario.observability.VerdictEvent;

import java.time.Clock;
import java.util.Objects;

/**
 * ScenarioEvaluator
 * -----------------------------------------------------------------------------
 * Drives a scenario's success and failure criteria, one tick at a time, and
 * reduces them into a {@link Verdict}.
 *
 * <h2>Per tick</h2>
 * <ol>
 *   <li>evaluate the success tree</li>
 *   <li>evaluate the failure tree (always, even if the success tree held)</li>
 *   <li>reduce with {@link Verdict#reduce(boolean, boolean)}: failure wins</li>
 * </ol>
 *
 * <h2>Termination</h2>
 * Once a tick yields a terminal verdict neither tree is evaluated again.
 * Calling {@link #tick()} on a terminated or aborted scenario is a caller
 * error and raises {@link IllegalStateException}.
 *
 * <h2>Errors</h2>
 * An exception escaping either tree aborts the tick: it is reported to the
 * observability sink and rethrown. The tick is not counted and the verdict is
 * left as it was.
 *
 * <h2>Threading</h2>
 * Not thread safe; ticks are driven from a single thread. {@link #abort()}
 * belongs between ticks.
 */
public final class ScenarioEvaluator
{
    private final Expression success;
    private final Expression failure;
    private final ExecutionContext context;
    private final ScenarioObservabilitySink observabilitySink;
    private final Clock clock;

    private Verdict verdict = Verdict.RUNNING;
    private long ticks;
    private boolean aborted;

    public ScenarioEvaluator(Expression success,
                             Expression failure,
                             ExecutionContext context,
                             ScenarioObservabilitySink observabilitySink,
                             Clock clock)
    {
        this.success = Objects.requireNonNull(success, "success");
        this.failure = Objects.requireNonNull(failure, "failure");
        this.context = Objects.requireNonNull(context, "context");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
    }

    public ScenarioEvaluator(Expression success, Expression failure, ExecutionContext context) {
        this(success, failure, context, NullObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    /**
     * Evaluates one tick.
     *
     * @return the verdict after this tick
     * @throws IllegalStateException if the scenario already terminated or was aborted
     */
    public Verdict tick() {
        if (aborted) {
            throw new IllegalStateException("Scenario was aborted after " + ticks + " tick(s)");
        }
        if (verdict.isTerminal()) {
            throw new IllegalStateException("Scenario already " + verdict + " after " + ticks + " tick(s)");
        }

        boolean successHolds;
        boolean failureHolds;
        try {
            successHolds = success.evaluate(context).toBoolean();
            failureHolds = failure.evaluate(context).toBoolean();
        } catch (RuntimeException e) {
            observabilitySink.onError(new ScenarioErrorEvent(clock.instant(), ticks + 1, e.getMessage(), e));
            throw e;
        }

        ticks++;
        verdict = Verdict.reduce(successHolds, failureHolds);
        observabilitySink.onVerdict(new VerdictEvent(clock.instant(), ticks, successHolds, failureHolds, verdict));
        return verdict;
    }

    public Verdict verdict() {
        return verdict;
    }

    /**
     * Number of completed ticks.
     */
    public long ticks() {
        return ticks;
    }

    /**
     * Stops the scenario. Further ticks are refused; the verdict is kept.
     */
    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public boolean isTerminated() {
        return aborted || verdict.isTerminal();
    }

    public Expression success() {
        return success;
    }

    public Expression failure() {
        return failure;
    }

    /**
     * Diagnostic report of both criteria trees.
     */
    public ObjectNode report() {
        ObjectNode report = JsonNodeFactory.instance.objectNode();
        report.set("Success", success.property());
        report.set("Failure", failure.property());
        return report;
    }
}
