package com.testplatform.filter;

/**
 * Comparison operations supported by a filter condition.
 */
public enum Operation {
    EQUAL("="),
    NOT_EQUAL("!=");

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
