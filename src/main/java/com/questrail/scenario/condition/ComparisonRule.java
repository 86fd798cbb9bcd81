package com.questrail.scenario.condition;

import com.questrail.scenario.api.ScenarioConfigurationException;

/**
 * Relation between a measured value and a configured threshold, as written
 * under a condition's {@code Rule} key.
 */
public enum ComparisonRule
{
    EQUAL_TO("equalTo"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual");

    private final String wireName;

    ComparisonRule(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Checks {@code measured <rule> threshold}.
     */
    public boolean test(double measured, double threshold) {
        return switch (this) {
            case EQUAL_TO -> Double.compare(measured, threshold) == 0;
            case GREATER_THAN -> measured > threshold;
            case LESS_THAN -> measured < threshold;
            case GREATER_THAN_OR_EQUAL -> measured >= threshold;
            case LESS_THAN_OR_EQUAL -> measured <= threshold;
        };
    }

    public static ComparisonRule parse(String text) {
        for (ComparisonRule rule : values()) {
            if (rule.wireName.equalsIgnoreCase(text)) {
                return rule;
            }
        }
        throw new ScenarioConfigurationException("Unknown rule '" + text + "'");
    }
}
