package com.testplatform.filter.impl;

import com.testplatform.filter.Condition;
import com.testplatform.filter.FilterExpression;
import com.testplatform.filter.FilterExpressionType;
import com.testplatform.filter.PropertyResolver;
import com.testplatform.filter.PropertyValueProvider;
import com.testplatform.filter.expression.FilterSyntax;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Set membership test on one property.
 * Equivalent to {@code P=v1|P=v2|...} but evaluated with one hash lookup per value.
 * Membership is case-sensitive, like condition comparison.
 */
public class FastFilterExpression implements FilterExpression {

    private final String propertyName;
    private final Set<String> values;

    public FastFilterExpression(String propertyName, Set<String> values) {
        this.propertyName = Objects.requireNonNull(propertyName, "propertyName");
        this.values = Collections.unmodifiableSet(new HashSet<>(values));
    }

    @Override
    public boolean evaluate(PropertyValueProvider propertyValueProvider, UnaryOperator<String> valueTransform) {
        Objects.requireNonNull(propertyValueProvider, "propertyValueProvider");

        if (isNormalizedFullyQualifiedName()) {
            return matchesAny(propertyValueProvider.getPropertyValue(FilterSyntax.FULLY_QUALIFIED_NAME),
                    FastFilterExpression::normalize);
        }
        return matchesAny(propertyValueProvider.getPropertyValue(propertyName), valueTransform);
    }

    private boolean matchesAny(Object propertyValue, UnaryOperator<String> valueTransform) {
        String[] candidates = Condition.toValues(propertyValue);
        if (candidates == null) {
            return false;
        }
        for (String candidate : candidates) {
            String value = valueTransform != null ? valueTransform.apply(candidate) : candidate;
            if (value != null && values.contains(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver) {
        String name = isNormalizedFullyQualifiedName() ? FilterSyntax.FULLY_QUALIFIED_NAME : propertyName;
        if (supportedProperties != null && supportedProperties.stream().anyMatch(name::equalsIgnoreCase)) {
            return List.of();
        }
        return List.of(name);
    }

    @Override
    public FilterExpressionType getType() {
        return FilterExpressionType.FAST_SET;
    }

    private boolean isNormalizedFullyQualifiedName() {
        return propertyName.equalsIgnoreCase(FilterSyntax.NORMALIZED_FULLY_QUALIFIED_NAME);
    }

    // "Ns.Class.Method (1, 2)" -> "Ns.Class.Method"
    private static String normalize(String fullyQualifiedName) {
        int space = fullyQualifiedName.indexOf(' ');
        return space > 0 ? fullyQualifiedName.substring(0, space) : fullyQualifiedName;
    }

    public String getPropertyName() {
        return propertyName;
    }

    public Set<String> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return propertyName + " IN " + values;
    }
}
