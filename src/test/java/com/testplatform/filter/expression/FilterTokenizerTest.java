package com.testplatform.filter.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterTokenizerTest {

    private static List<FilterTokenType> types(String input) {
        return new FilterTokenizer(input).tokenize().stream().map(FilterToken::type).toList();
    }

    private static List<String> texts(String input) {
        return new FilterTokenizer(input).tokenize().stream().map(FilterToken::text).toList();
    }

    @Test
    @DisplayName("Separators become their own tokens")
    void testSeparators() {
        assertEquals(List.of(
                FilterTokenType.LPAREN,
                FilterTokenType.CONDITION,
                FilterTokenType.OR,
                FilterTokenType.CONDITION,
                FilterTokenType.RPAREN,
                FilterTokenType.AND,
                FilterTokenType.CONDITION
        ), types("(A=1|B=2)&C=3"));
    }

    @Test
    @DisplayName("Condition text is trimmed and blank segments dropped")
    void testTrimming() {
        assertEquals(List.of("A=1", "|", "B = 2"), texts("  A=1  |  B = 2  "));
        assertEquals(List.of("(", "(", ")", ")"), texts("( ( ) )"));
    }

    @Test
    @DisplayName("Escaped separators stay inside the condition")
    void testEscapedSeparators() {
        List<FilterToken> tokens = new FilterTokenizer("Name=a\\|b\\(c\\)").tokenize();

        assertEquals(1, tokens.size());
        assertEquals(FilterTokenType.CONDITION, tokens.get(0).type());
        assertEquals("Name=a\\|b\\(c\\)", tokens.get(0).text());
    }

    @Test
    @DisplayName("Two conditions separated only by whitespace are two tokens")
    void testConditionsWithoutOperator() {
        assertEquals(List.of("A=1", "B!=2"), texts("A=1 B!=2"));
    }

    @Test
    @DisplayName("Whitespace inside a value does not split the condition")
    void testWhitespaceInValue() {
        assertEquals(List.of("Name=hello world"), texts("Name=hello world"));
    }

    @Test
    @DisplayName("Token positions point into the input")
    void testPositions() {
        List<FilterToken> tokens = new FilterTokenizer("A=1 | B=2").tokenize();

        assertEquals(0, tokens.get(0).position());
        assertEquals(4, tokens.get(1).position());
        assertEquals(6, tokens.get(2).position());
    }

    @Test
    @DisplayName("Empty input has no tokens")
    void testEmpty() {
        assertTrue(new FilterTokenizer("").tokenize().isEmpty());
        assertTrue(new FilterTokenizer("   ").tokenize().isEmpty());
    }
}
