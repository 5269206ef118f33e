package com.testplatform.filter.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits a filter string on the separators {@code & | ( )}.
 * Each separator becomes its own token; the text in between is trimmed and
 * empty segments are dropped. Escaped separators stay part of the text.
 */
public final class FilterTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public FilterTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens in input order
     */
    public List<FilterToken> tokenize() {
        List<FilterToken> tokens = new ArrayList<>();
        int segmentStart = 0;

        while (!isAtEnd()) {
            char c = peek();

            if (c == FilterSyntax.ESCAPE) {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
                continue;
            }

            if (!FilterSyntax.isSeparator(c)) {
                advance();
                continue;
            }

            addSegment(tokens, segmentStart, pos);
            int start = pos;
            advance();
            tokens.add(switch (c) {
                case FilterSyntax.AND -> new FilterToken(FilterTokenType.AND, "&", start);
                case FilterSyntax.OR -> new FilterToken(FilterTokenType.OR, "|", start);
                case FilterSyntax.LEFT_PAREN -> new FilterToken(FilterTokenType.LPAREN, "(", start);
                default -> new FilterToken(FilterTokenType.RPAREN, ")", start);
            });
            segmentStart = pos;
        }

        addSegment(tokens, segmentStart, pos);
        return tokens;
    }

    private void addSegment(List<FilterToken> tokens, int start, int end) {
        String segment = input.substring(start, end);
        if (segment.isBlank()) {
            return;
        }

        // "A=1 B=2" holds two operands with no operator between them
        Matcher boundary = FilterSyntax.CONDITION_BOUNDARY.matcher(segment);
        int conditionStart = 0;
        while (boundary.find()) {
            addCondition(tokens, segment, conditionStart, boundary.start(), start);
            conditionStart = boundary.end();
        }
        addCondition(tokens, segment, conditionStart, segment.length(), start);
    }

    private void addCondition(List<FilterToken> tokens, String segment, int from, int to, int offset) {
        String text = segment.substring(from, to).trim();
        if (!text.isEmpty()) {
            tokens.add(new FilterToken(FilterTokenType.CONDITION, text, offset + from));
        }
    }

    private void advance() {
        pos++;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
