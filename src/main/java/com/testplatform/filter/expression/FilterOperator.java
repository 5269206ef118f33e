package com.testplatform.filter.expression;

/**
 * Entries of the parser's operator stack, ordered by precedence.
 * AND binds tighter than OR.
 */
enum FilterOperator {
    NONE(0),
    OR(1),
    AND(2),
    OPEN_PAREN(3);

    private final int precedence;

    FilterOperator(int precedence) {
        this.precedence = precedence;
    }

    boolean bindsLooserThan(FilterOperator other) {
        return precedence < other.precedence;
    }
}
