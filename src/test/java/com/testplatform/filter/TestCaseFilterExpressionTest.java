package com.testplatform.filter;

import com.testplatform.exception.FilterFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TestCaseFilterExpressionTest {

    private static PropertyValueProvider fullyQualifiedName(String value) {
        return Map.<String, Object>of("FullyQualifiedName", value)::get;
    }

    @Test
    @DisplayName("Malformed filters fail on construction")
    void testEagerParse() {
        assertThrows(FilterFormatException.class, () -> new TestCaseFilterExpression("(A=1"));
    }

    @Test
    @DisplayName("Match test cases against a tree filter")
    void testMatchTree() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression("Category=Unit&Priority!=3");

        assertTrue(filter.matchTestCase(Map.<String, Object>of("Category", "Unit", "Priority", "1")::get));
        assertFalse(filter.matchTestCase(Map.<String, Object>of("Category", "Unit", "Priority", "3")::get));
        assertEquals("Category=Unit&Priority!=3", filter.getFilterString());
    }

    @Test
    @DisplayName("Regex options pick the part of the value to match")
    void testRegexMatch() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression(
                "FullyQualifiedName=Ns.Class.Method",
                new FilterOptions("[A-Za-z.]+", null));

        assertTrue(filter.matchTestCase(fullyQualifiedName("Ns.Class.Method(1)")));
        assertFalse(filter.matchTestCase(fullyQualifiedName("(1)")));
    }

    @Test
    @DisplayName("Regex options with a replacement rewrite the value")
    void testRegexReplacement() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression(
                "FullyQualifiedName=Ns.Class.Method|FullyQualifiedName=Ns.Class.Other",
                new FilterOptions("\\s*\\(.*\\)$", ""));

        assertTrue(filter.matchTestCase(fullyQualifiedName("Ns.Class.Method (1, 2)")));
        assertTrue(filter.matchTestCase(fullyQualifiedName("Ns.Class.Other")));
        assertFalse(filter.matchTestCase(fullyQualifiedName("Ns.Class.Third (1)")));
    }

    @Test
    @DisplayName("Regex options do not affect tree filters")
    void testRegexIgnoredForTrees() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression(
                "FullyQualifiedName!=Ns.Class.Method",
                new FilterOptions("[A-Za-z.]+", null));

        assertFalse(filter.matchTestCase(fullyQualifiedName("Ns.Class.Method")));
        assertTrue(filter.matchTestCase(fullyQualifiedName("Ns.Class.Method(1)")));
    }

    @Test
    @DisplayName("Null options behave like no options")
    void testNullOptions() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression("Name=a", null);

        assertEquals(FilterOptions.none(), filter.getOptions());
        assertEquals(FilterExpressionType.FAST_SET, filter.getExpression().getType());
    }

    @Test
    void testValidForProperties() {
        TestCaseFilterExpression filter = new TestCaseFilterExpression("Owner=me|Category=Unit");

        assertEquals(List.of("Owner"), filter.validForProperties(List.of("Category"), null));
    }
}
