package com.testplatform.filter;

import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A parsed test case filter.
 * Implementations are immutable and safe to evaluate from several threads.
 */
public interface FilterExpression {

    /**
     * Evaluate this filter against one test case.
     *
     * @param propertyValueProvider Property lookup for the test case
     * @param valueTransform        Optional transform of the property value before matching.
     *                              Only fast filters accept one; pass null for trees.
     * @return true if the test case matches
     */
    boolean evaluate(PropertyValueProvider propertyValueProvider, UnaryOperator<String> valueTransform);

    default boolean evaluate(PropertyValueProvider propertyValueProvider) {
        return evaluate(propertyValueProvider, null);
    }

    /**
     * Find the property names used by this filter that the caller does not support.
     *
     * @param supportedProperties Supported property names, compared ignoring case; null means none
     * @param propertyResolver    Optional property metadata lookup
     * @return Unsupported names, left to right, duplicates kept; empty if the filter is valid
     */
    List<String> validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver);

    FilterExpressionType getType();
}
