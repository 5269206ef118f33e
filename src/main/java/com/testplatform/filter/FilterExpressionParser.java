package com.testplatform.filter;

import com.testplatform.filter.expression.FilterParser;
import com.testplatform.filter.expression.FilterToken;
import com.testplatform.filter.expression.FilterTokenizer;

import java.util.List;
import java.util.Objects;

/**
 * Facade for parsing test case filter strings.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: {@code &} (AND), {@code |} (OR)</li>
 *   <li>Conditions: {@code name=value}, {@code name!=value}</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Backslash escapes for operator characters inside values</li>
 * </ul>
 * <p>
 * Precedence: AND > OR (parentheses override)
 */
public final class FilterExpressionParser {

    private FilterExpressionParser() {
    }

    /**
     * Parse a filter string.
     *
     * @param filter Filter text, e.g. {@code Category=Unit&(Priority=1|Priority=2)}
     * @return Parsed filter
     * @throws com.testplatform.exception.FilterFormatException if the filter is malformed
     */
    public static FilterExpression parse(String filter) {
        Objects.requireNonNull(filter, "filter");
        List<FilterToken> tokens = new FilterTokenizer(filter).tokenize();
        return new FilterParser(filter, tokens).parse();
    }
}
