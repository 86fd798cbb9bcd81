package com.questrail.scenario.expression;

/**
 * Variant tag of an {@link Expression}.
 */
public enum ExpressionKind
{
    /** A default-constructed handle with no backing node; converts to {@code false}. */
    EMPTY,

    /** A boolean or numeric constant. */
    LITERAL,

    /** N-ary conjunction. */
    ALL,

    /** N-ary disjunction. */
    ANY,

    /** Unary negation. */
    NOT,

    /** A call into a condition or action module. */
    PROCEDURE
}
