package com.testplatform.filter.expression;

/**
 * Represents a token in a filter string.
 *
 * @param type     Token type
 * @param text     Trimmed token text
 * @param position Position in the input string
 */
public record FilterToken(FilterTokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
