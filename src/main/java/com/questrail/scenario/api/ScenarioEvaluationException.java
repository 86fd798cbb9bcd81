package com.questrail.scenario.api;

/**
 * Indicates that a tick could not be evaluated.
 * <p>
 * The usual cause is a procedure that needs a collaborator (simulator, entity
 * registry, intersection registry) the execution context was built without.
 * The exception propagates through every enclosing combinator; the tick is
 * aborted as a whole and never scored as {@code false}.
 */
public class ScenarioEvaluationException extends RuntimeException
{
    public ScenarioEvaluationException(String message) {
        super(message);
    }

    public ScenarioEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
