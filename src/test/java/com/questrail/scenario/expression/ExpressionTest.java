package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.questrail.scenario.condition.AbstractProcedureModule;
import com.questrail.scenario.condition.CountingModule;
import com.questrail.scenario.condition.DefaultModuleRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionTest
 * -----------------------------------------------------------------------------
 * Evaluation, truthiness, sharing and report shape of expression trees.
 */
class ExpressionTest
{
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static JsonNode yaml(String text) throws Exception {
        return YAML.readTree(text);
    }

    /**
     * Builds a predicate node around a module the test keeps hold of.
     */
    private static Expression predicate(CountingModule module, String fragment) throws Exception {
        DefaultModuleRegistry registry = DefaultModuleRegistry.builder()
                .includeBuiltIns(false)
                .register("CountingCondition", () -> module)
                .build();
        return new ExpressionReader(registry, ExecutionContext.empty()).read(yaml(fragment));
    }

    private static Expression predicate(CountingModule module) throws Exception {
        return predicate(module, "{Type: Counting}");
    }

    /**
     * Appends its name to a shared journal on every update.
     */
    static final class JournalModule extends AbstractProcedureModule {
        private final List<String> journal;

        JournalModule(List<String> journal) {
            super("Journal");
            this.journal = journal;
        }

        @Override
        protected void onConfigure(JsonNode node, ExecutionContext context) {}

        @Override
        protected boolean onUpdate(ExecutionContext context) {
            journal.add(name());
            return false;
        }
    }

    // ---------- Combinators ----------

    @Test
    void allEvaluatesEveryOperandAfterAFalseOne() throws Exception {
        CountingModule first = new CountingModule("Counting", false);
        CountingModule second = new CountingModule("Counting", true);

        Expression all = Expression.all(predicate(first), predicate(second));
        Expression result = all.evaluate(ExecutionContext.empty());

        assertFalse(result.toBoolean());
        assertEquals(ExpressionKind.LITERAL, result.kind());
        assertEquals(1, first.updates());
        assertEquals(1, second.updates());
    }

    @Test
    void anyEvaluatesEveryOperandAfterATrueOne() throws Exception {
        CountingModule first = new CountingModule("Counting", true);
        CountingModule second = new CountingModule("Counting", false);

        Expression any = Expression.any(predicate(first), predicate(second));

        assertTrue(any.evaluate(ExecutionContext.empty()).toBoolean());
        assertEquals(1, first.updates());
        assertEquals(1, second.updates());
    }

    @Test
    void allAndAnyMatchConjunctionAndDisjunctionOfEverySequence() {
        for (int size = 0; size <= 4; size++) {
            for (int bits = 0; bits < (1 << size); bits++) {
                List<Expression> operands = new ArrayList<>();
                boolean and = true;
                boolean or = false;
                for (int i = 0; i < size; i++) {
                    boolean value = (bits & (1 << i)) != 0;
                    operands.add(Expression.literal(value));
                    and &= value;
                    or |= value;
                }

                assertEquals(and, Expression.all(operands).evaluate(ExecutionContext.empty()).toBoolean(),
                        "All of " + operands.size() + " operands, bits " + bits);
                assertEquals(or, Expression.any(operands).evaluate(ExecutionContext.empty()).toBoolean(),
                        "Any of " + operands.size() + " operands, bits " + bits);
            }
        }
    }

    @Test
    void operandsAreEvaluatedLeftToRight() throws Exception {
        List<String> journal = new ArrayList<>();
        DefaultModuleRegistry registry = DefaultModuleRegistry.builder()
                .register("JournalCondition", () -> new JournalModule(journal))
                .build();
        ExpressionReader reader = new ExpressionReader(registry, ExecutionContext.empty());

        Expression tree = reader.read(yaml(
                "All: [{Type: Journal, Name: a}, {Any: [{Type: Journal, Name: b}, {Type: Journal, Name: c}]}, "
                        + "{Not: {Type: Journal, Name: d}}]"));
        tree.evaluate(ExecutionContext.empty());

        assertEquals(List.of("a", "b", "c", "d"), journal);
    }

    @Test
    void doubleNegationIsEquivalentToOperand() {
        List<Expression> operands = List.of(
                Expression.literal(true),
                Expression.literal(false),
                Expression.literal(0.0),
                Expression.literal(3.5),
                Expression.all(),
                Expression.any());

        for (Expression x : operands) {
            boolean expected = x.evaluate(ExecutionContext.empty()).toBoolean();
            boolean actual = Expression.not(Expression.not(x)).evaluate(ExecutionContext.empty()).toBoolean();
            assertEquals(expected, actual, x.type());
        }
    }

    // ---------- Truthiness ----------

    @Test
    void emptyHandleIsFalseAndEvaluatesToItself() {
        Expression empty = Expression.empty();

        assertTrue(empty.isEmpty());
        assertEquals(ExpressionKind.EMPTY, empty.kind());
        assertFalse(empty.toBoolean());
        assertSame(empty, empty.evaluate(ExecutionContext.empty()));
    }

    @Test
    void numericLiteralsAreTruthyWhenNonZero() {
        assertFalse(Expression.literal(0.0).toBoolean());
        assertTrue(Expression.literal(-1.0).toBoolean());
        assertTrue(Expression.literal(0.25).toBoolean());
    }

    @Test
    void unevaluatedCombinatorsAreFalse() {
        assertFalse(Expression.all().toBoolean());
        assertFalse(Expression.not(Expression.literal(false)).toBoolean());
        assertTrue(Expression.not(Expression.literal(false)).evaluate(ExecutionContext.empty()).toBoolean());
    }

    // ---------- Sharing ----------

    @Test
    void copiesShareProcedureState() throws Exception {
        CountingModule module = new CountingModule("Counting", false, true);
        Expression original = predicate(module);
        Expression copy = original.copy();

        assertTrue(copy.sharesNodeWith(original));
        assertNotSame(original, copy);

        assertFalse(original.evaluate(ExecutionContext.empty()).toBoolean());
        assertTrue(copy.evaluate(ExecutionContext.empty()).toBoolean());
        assertEquals(2, module.updates());
    }

    @Test
    void sameProcedureUnderTwoCombinatorsAdvancesOneModule() throws Exception {
        CountingModule module = new CountingModule("Counting", true);
        Expression shared = predicate(module);

        Expression tree = Expression.all(Expression.any(shared), Expression.not(shared.copy()));
        tree.evaluate(ExecutionContext.empty());

        assertEquals(2, module.updates());
    }

    // ---------- Reports ----------

    @Test
    void literalReportIsSingleEmptyEntry() {
        JsonNode report = Expression.literal(true).property();

        assertTrue(report.isArray());
        assertEquals(1, report.size());
        assertEquals(0, report.get(0).size());
        assertEquals(report, Expression.empty().property());
    }

    @Test
    void unnamedProceduresAreNamedByPathAndOccurrence() throws Exception {
        CountingModule first = new CountingModule("Counting", true);
        CountingModule second = new CountingModule("Counting", false);
        CountingModule nested = new CountingModule("Counting", true);

        Expression tree = Expression.any(
                Expression.all(predicate(nested)),
                predicate(first),
                predicate(second));
        tree.evaluate(ExecutionContext.empty());

        JsonNode report = tree.property();

        assertEquals(3, report.size());
        assertEquals("Any(0)/All(0)/Counting(0)", report.get(0).get("Name").asText());
        assertEquals("Any(0)/Counting(0)", report.get(1).get("Name").asText());
        assertEquals("Any(0)/Counting(1)", report.get(2).get("Name").asText());
        assertTrue(report.get(1).get("Value").asBoolean());
        assertFalse(report.get(2).get("Value").asBoolean());
        assertEquals("Counting", report.get(2).get("Type").asText());
    }

    @Test
    void explicitNameWinsOverGeneratedName() throws Exception {
        CountingModule module = new CountingModule("Counting", true);
        Expression tree = Expression.all(predicate(module, "{Type: Counting, Name: EgoIsFast}"));

        JsonNode report = tree.property();

        assertEquals("EgoIsFast", report.get(0).get("Name").asText());
        assertEquals("EgoIsFast", module.name());
    }

    @Test
    void generatedNameIsAssignedOnce() throws Exception {
        CountingModule module = new CountingModule("Counting", true);
        Expression leaf = predicate(module);

        Expression.all(leaf).property();
        Expression.any(Expression.literal(true), leaf.copy()).property();

        assertEquals("All(0)/Counting(0)", module.name());
    }

    @Test
    void toStringRendersReport() {
        assertTrue(Expression.literal(false).toString().contains("{ }"));
    }
}
