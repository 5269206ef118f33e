package com.testplatform.filter;

/**
 * Shapes a parsed filter can take.
 */
public enum FilterExpressionType {
    // single condition
    LEAF,
    // two sub-expressions joined by & or |
    BINARY,
    // set membership on one property, substituted for OR-only equality filters
    FAST_SET
}
