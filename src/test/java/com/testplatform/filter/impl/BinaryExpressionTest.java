package com.testplatform.filter.impl;

import com.testplatform.filter.Condition;
import com.testplatform.filter.FilterExpression;
import com.testplatform.filter.PropertyValueProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BinaryExpressionTest {

    private static final PropertyValueProvider NO_PROPERTIES = name -> null;

    private static LeafExpression leaf(String condition) {
        return new LeafExpression(Condition.parse(condition));
    }

    @Test
    @DisplayName("Tree expressions reject a value transform")
    void testTransformRejected() {
        FilterExpression and = new BinaryExpression(leaf("A=1"), leaf("B=2"), true);

        assertThrows(IllegalArgumentException.class, () -> and.evaluate(NO_PROPERTIES, String::trim));
        assertThrows(IllegalArgumentException.class, () -> leaf("A=1").evaluate(NO_PROPERTIES, String::trim));
    }

    @Test
    @DisplayName("Invalid names keep duplicates in order")
    void testInvalidNamesOrder() {
        FilterExpression or = new BinaryExpression(leaf("X=1"), new BinaryExpression(leaf("Y=1"), leaf("X=2"), true), false);

        assertEquals(List.of("X", "Y", "X"), or.validForProperties(null, null));
    }

    @Test
    void testToString() {
        FilterExpression or = new BinaryExpression(leaf("A=1"), leaf("B!=2"), false);

        assertEquals("(A=1 | B!=2)", or.toString());
    }

    @Test
    @DisplayName("Fast set does not match a missing property")
    void testFastSetMissingProperty() {
        FastFilterExpression fast = new FastFilterExpression("Name", Set.of("a"));

        assertFalse(fast.evaluate(NO_PROPERTIES));
        assertTrue(fast.evaluate(name -> "Name".equals(name) ? "a" : null));
        assertEquals(List.of("Name"), fast.validForProperties(null, null));
    }

    @Test
    void testNullChildren() {
        assertThrows(NullPointerException.class, () -> new BinaryExpression(null, leaf("A=1"), true));
    }
}
