package com.testplatform.filter.impl;

import com.testplatform.filter.Condition;
import com.testplatform.filter.FilterExpression;
import com.testplatform.filter.FilterExpressionType;
import com.testplatform.filter.PropertyResolver;
import com.testplatform.filter.PropertyValueProvider;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Filter made of a single condition.
 */
public class LeafExpression implements FilterExpression {

    private final Condition condition;

    public LeafExpression(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public boolean evaluate(PropertyValueProvider propertyValueProvider, UnaryOperator<String> valueTransform) {
        Objects.requireNonNull(propertyValueProvider, "propertyValueProvider");
        if (valueTransform != null) {
            throw new IllegalArgumentException("Value transform is only supported by fast filters");
        }
        return condition.evaluate(propertyValueProvider);
    }

    @Override
    public List<String> validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver) {
        Collection<String> supported = supportedProperties == null ? List.of() : supportedProperties;
        return condition.validForProperties(supported, propertyResolver)
                ? List.of()
                : List.of(condition.getName());
    }

    @Override
    public FilterExpressionType getType() {
        return FilterExpressionType.LEAF;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return condition.toString();
    }
}
