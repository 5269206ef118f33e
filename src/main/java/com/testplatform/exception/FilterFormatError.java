package com.testplatform.exception;

/**
 * Reasons a test case filter string can be rejected.
 */
public enum FilterFormatError {
    EMPTY_PARENTHESIS("Empty parenthesis ( )"),
    MISSING_OPERAND("Missing operand"),
    MISSING_OPEN_PARENTHESIS("Missing '('"),
    MISSING_CLOSE_PARENTHESIS("Missing ')'"),
    MISSING_OPERATOR("Missing operator '|' or '&'"),
    INVALID_CONDITION("Invalid condition");

    private final String description;

    FilterFormatError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
