package com.testplatform.filter.expression;

/**
 * Token types of the filter language.
 */
public enum FilterTokenType {
    AND,
    OR,
    LPAREN,
    RPAREN,

    // name operator value, still escaped
    CONDITION
}
