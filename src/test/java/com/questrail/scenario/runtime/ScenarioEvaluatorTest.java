package com.questrail.scenario.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.questrail.scenario.api.ScenarioEvaluationException;
import com.questrail.scenario.api.Verdict;
import com.questrail.scenario.condition.CountingModule;
import com.questrail.scenario.condition.DefaultModuleRegistry;
import com.questrail.scenario.expression.ExecutionContext;
import com.questrail.scenario.expression.Expression;
import com.questrail.scenario.expression.ExpressionReader;
import com.questrail.scenario.observability.RecordingObservabilitySink;
import com.questrail.scenario.observability.ScenarioErrorEvent;
import com.questrail.scenario.observability.VerdictEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScenarioEvaluatorTest
 * -----------------------------------------------------------------------------
 * Verdict reduction and termination rules of the per-tick driver.
 */
class ScenarioEvaluatorTest
{
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
    }

    private static JsonNode yaml(String text) throws Exception {
        return YAML.readTree(text);
    }

    private static Expression scripted(CountingModule module) throws Exception {
        DefaultModuleRegistry registry = DefaultModuleRegistry.builder()
                .register("CountingCondition", () -> module)
                .build();
        return new ExpressionReader(registry, ExecutionContext.empty()).read(yaml("{Type: Counting}"));
    }

    private ScenarioEvaluator evaluator(Expression success, Expression failure) {
        return new ScenarioEvaluator(success, failure, ExecutionContext.empty(), sink, Clock.systemUTC());
    }

    @Test
    void runsUntilSuccessThenRefusesFurtherTicks() throws Exception {
        CountingModule success = new CountingModule("Counting", false, false, true);
        CountingModule failure = new CountingModule("Counting", false);
        ScenarioEvaluator evaluator = evaluator(scripted(success), scripted(failure));

        List<Verdict> verdicts = new ArrayList<>();
        while (!evaluator.isTerminated()) {
            verdicts.add(evaluator.tick());
        }

        assertEquals(List.of(Verdict.RUNNING, Verdict.RUNNING, Verdict.SUCCEEDED), verdicts);
        assertEquals(3, evaluator.ticks());

        assertThrows(IllegalStateException.class, evaluator::tick);
        assertEquals(3, success.updates());
        assertEquals(3, failure.updates());
        assertEquals(Verdict.SUCCEEDED, evaluator.verdict());
    }

    @Test
    void failureWinsOverSuccessInTheSameTick() {
        ScenarioEvaluator evaluator = evaluator(Expression.literal(true), Expression.literal(true));

        assertEquals(Verdict.FAILED, evaluator.tick());
        assertTrue(evaluator.isTerminated());
    }

    @Test
    void failureTreeIsEvaluatedEvenWhenSuccessHolds() throws Exception {
        CountingModule failure = new CountingModule("Counting", false);
        ScenarioEvaluator evaluator = evaluator(Expression.literal(true), scripted(failure));

        assertEquals(Verdict.SUCCEEDED, evaluator.tick());
        assertEquals(1, failure.updates());
    }

    @Test
    void evaluationErrorIsReportedAndRethrown() throws Exception {
        Expression needsSimulator = new ExpressionReader(DefaultModuleRegistry.defaultRegistry(), ExecutionContext.empty())
                .read(yaml("{Type: Timeout, Value: 1}"));
        ScenarioEvaluator evaluator = evaluator(Expression.all(Expression.literal(true), needsSimulator),
                Expression.literal(false));

        assertThrows(ScenarioEvaluationException.class, evaluator::tick);

        assertEquals(0, evaluator.ticks());
        assertEquals(Verdict.RUNNING, evaluator.verdict());
        ScenarioErrorEvent error = sink.getEventsOfType(ScenarioErrorEvent.class).get(0);
        assertEquals(1, error.tick());
        assertInstanceOf(ScenarioEvaluationException.class, error.cause());
    }

    @Test
    void abortStopsFurtherTicks() {
        ScenarioEvaluator evaluator = evaluator(Expression.literal(false), Expression.literal(false));
        assertEquals(Verdict.RUNNING, evaluator.tick());

        evaluator.abort();

        assertTrue(evaluator.isAborted());
        assertTrue(evaluator.isTerminated());
        assertEquals(Verdict.RUNNING, evaluator.verdict());
        assertThrows(IllegalStateException.class, evaluator::tick);
    }

    @Test
    void everyTickEmitsAVerdictEvent() {
        ScenarioEvaluator evaluator = evaluator(Expression.literal(false), Expression.literal(false));
        evaluator.tick();
        evaluator.tick();

        List<VerdictEvent> events = sink.getEventsOfType(VerdictEvent.class);
        assertEquals(2, events.size());
        assertEquals(2, events.get(1).tick());
        assertFalse(events.get(1).isTerminal());
    }

    @Test
    void reportNestsBothTrees() {
        ScenarioEvaluator evaluator = evaluator(Expression.literal(false), Expression.literal(false));

        JsonNode report = evaluator.report();

        assertTrue(report.get("Success").isArray());
        assertTrue(report.get("Failure").isArray());
    }
}
