/**
 * Scenario criteria expressions.
 * =============================================================================
 *
 * <p>A scenario's success and failure criteria are trees of
 * {@link com.questrail.scenario.expression.Expression}s, re-evaluated once per
 * simulation tick against an
 * {@link com.questrail.scenario.expression.ExecutionContext}.</p>
 *
 * <pre>
 *   scenario document
 *        → ExpressionReader       (modules resolved and configured here)
 *            → Expression tree    (shared, immutable handles)
 *                → evaluate(context) once per tick
 *                    → procedure modules read the simulator / drive intersections
 * </pre>
 *
 * <h2>Evaluation order</h2>
 * <p>Operands of {@code All}, {@code Any} and {@code Not} are evaluated left
 * to right, each exactly once per tick, with no short-circuit. The order is
 * observable: an action that switches an intersection is seen by a predicate
 * further right in the same tick.</p>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>Construction problems raise
 *       {@link com.questrail.scenario.api.ScenarioConfigurationException}.</li>
 *   <li>Missing collaborators at tick time raise
 *       {@link com.questrail.scenario.api.ScenarioEvaluationException}, which
 *       no combinator catches.</li>
 * </ul>
 */
package com.questrail.scenario.expression;
