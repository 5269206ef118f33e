package com.testplatform.filter.expression;

import com.testplatform.exception.FilterFormatError;
import com.testplatform.exception.FilterFormatException;
import com.testplatform.filter.Condition;
import com.testplatform.filter.FilterExpression;
import com.testplatform.filter.Operation;
import com.testplatform.filter.impl.BinaryExpression;
import com.testplatform.filter.impl.FastFilterExpression;
import com.testplatform.filter.impl.LeafExpression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator-precedence parser for filter strings.
 * Uses an operator stack and an operand stack (precedence: AND > OR, parentheses override).
 * <p>
 * While parsing it also checks whether the whole filter is a disjunction of
 * {@code =} conditions on one property, e.g. {@code Name=a|Name=b|Name=c}. Such a filter
 * is returned as a {@link FastFilterExpression} instead of the tree.
 * <p>
 * Not thread-safe; create one parser per filter string.
 */
public final class FilterParser {

    private final String input;
    private final List<FilterToken> tokens;

    private final Deque<FilterOperator> operators = new ArrayDeque<>();
    private final Deque<FilterExpression> operands = new ArrayDeque<>();

    private boolean fastFilterEligible = true;
    private String fastFilterProperty;
    private final Set<String> fastFilterValues = new HashSet<>();

    public FilterParser(String input, List<FilterToken> tokens) {
        this.input = input;
        this.tokens = tokens;
    }

    /**
     * Parse the token stream.
     *
     * @return Expression tree, or a fast filter when the filter qualifies
     * @throws FilterFormatException if the filter is malformed
     */
    public FilterExpression parse() {
        checkEmptyParentheses();

        for (FilterToken token : tokens) {
            switch (token.type()) {
                case AND -> {
                    fastFilterEligible = false;
                    pushOperator(FilterOperator.AND);
                }
                case OR -> pushOperator(FilterOperator.OR);
                case LPAREN -> operators.push(FilterOperator.OPEN_PAREN);
                case RPAREN -> closeParenthesis();
                case CONDITION -> pushCondition(Condition.parse(token.text()));
            }
        }

        while (!operators.isEmpty()) {
            reduce(operators.pop());
        }

        if (operands.size() != 1) {
            throw error(FilterFormatError.MISSING_OPERATOR);
        }

        if (fastFilterEligible) {
            return new FastFilterExpression(fastFilterProperty, fastFilterValues);
        }
        return operands.pop();
    }

    private void checkEmptyParentheses() {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).type() == FilterTokenType.LPAREN
                    && tokens.get(i + 1).type() == FilterTokenType.RPAREN) {
                throw error(FilterFormatError.EMPTY_PARENTHESIS);
            }
        }
    }

    /**
     * Only a higher precedence operator goes on top of the stack. Lower or equal
     * precedence operators on the stack are reduced first, which keeps AND above OR
     * and makes equal operators left-associative. An open parenthesis stops the reduction.
     */
    private void pushOperator(FilterOperator incoming) {
        while (true) {
            FilterOperator top = operators.isEmpty() ? FilterOperator.NONE : operators.peek();
            if (top == FilterOperator.NONE
                    || top == FilterOperator.OPEN_PAREN
                    || top.bindsLooserThan(incoming)) {
                operators.push(incoming);
                return;
            }
            reduce(operators.pop());
        }
    }

    private void closeParenthesis() {
        if (operators.isEmpty()) {
            throw error(FilterFormatError.MISSING_OPEN_PARENTHESIS);
        }
        FilterOperator top = operators.pop();
        while (top != FilterOperator.OPEN_PAREN) {
            reduce(top);
            if (operators.isEmpty()) {
                throw error(FilterFormatError.MISSING_OPEN_PARENTHESIS);
            }
            top = operators.pop();
        }
    }

    private void pushCondition(Condition condition) {
        operands.push(new LeafExpression(condition));

        if (fastFilterProperty == null) {
            fastFilterProperty = condition.getName();
        }
        // once revoked, never re-enabled
        if (fastFilterEligible
                && condition.getOperation() == Operation.EQUAL
                && condition.getName().equalsIgnoreCase(fastFilterProperty)) {
            fastFilterValues.add(condition.getValue());
        } else {
            fastFilterEligible = false;
        }
    }

    private void reduce(FilterOperator operator) {
        switch (operator) {
            case AND, OR -> {
                if (operands.size() < 2) {
                    throw error(FilterFormatError.MISSING_OPERAND);
                }
                FilterExpression right = operands.pop();
                FilterExpression left = operands.pop();
                operands.push(new BinaryExpression(left, right, operator == FilterOperator.AND));
            }
            case OPEN_PAREN -> throw error(FilterFormatError.MISSING_CLOSE_PARENTHESIS);
            default -> throw new IllegalStateException("Unexpected operator on stack: " + operator);
        }
    }

    private FilterFormatException error(FilterFormatError reason) {
        return new FilterFormatException(reason, input);
    }
}
