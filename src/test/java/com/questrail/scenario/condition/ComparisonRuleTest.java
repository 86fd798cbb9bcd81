package com.questrail.scenario.condition;

import com.questrail.scenario.api.ScenarioConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonRuleTest
{
    @Test
    void comparesMeasuredAgainstThreshold() {
        assertTrue(ComparisonRule.GREATER_THAN.test(5.1, 5.0));
        assertFalse(ComparisonRule.GREATER_THAN.test(5.0, 5.0));
        assertTrue(ComparisonRule.GREATER_THAN_OR_EQUAL.test(5.0, 5.0));
        assertTrue(ComparisonRule.LESS_THAN.test(3.0, 5.0));
        assertFalse(ComparisonRule.LESS_THAN_OR_EQUAL.test(5.5, 5.0));
        assertTrue(ComparisonRule.EQUAL_TO.test(2.0, 2.0));
    }

    @Test
    void parsesWireNamesIgnoringCase() {
        assertEquals(ComparisonRule.LESS_THAN, ComparisonRule.parse("lessThan"));
        assertEquals(ComparisonRule.GREATER_THAN_OR_EQUAL, ComparisonRule.parse("GreaterThanOrEqual"));
        assertThrows(ScenarioConfigurationException.class, () -> ComparisonRule.parse("roughly"));
    }
}
