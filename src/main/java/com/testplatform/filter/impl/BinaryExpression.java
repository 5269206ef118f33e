package com.testplatform.filter.impl;

import com.testplatform.filter.FilterExpression;
import com.testplatform.filter.FilterExpressionType;
import com.testplatform.filter.PropertyResolver;
import com.testplatform.filter.PropertyValueProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Two filters joined by logical AND or OR.
 * Both sides are always evaluated; property providers may count or record lookups.
 */
public class BinaryExpression implements FilterExpression {

    private final FilterExpression left;
    private final FilterExpression right;
    private final boolean joinedByAnd;

    public BinaryExpression(FilterExpression left, FilterExpression right, boolean joinedByAnd) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.joinedByAnd = joinedByAnd;
    }

    @Override
    public boolean evaluate(PropertyValueProvider propertyValueProvider, UnaryOperator<String> valueTransform) {
        Objects.requireNonNull(propertyValueProvider, "propertyValueProvider");
        if (valueTransform != null) {
            throw new IllegalArgumentException("Value transform is only supported by fast filters");
        }
        boolean leftResult = left.evaluate(propertyValueProvider, null);
        boolean rightResult = right.evaluate(propertyValueProvider, null);
        return joinedByAnd ? leftResult && rightResult : leftResult || rightResult;
    }

    @Override
    public List<String> validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver) {
        List<String> invalidLeft = left.validForProperties(supportedProperties, propertyResolver);
        List<String> invalidRight = right.validForProperties(supportedProperties, propertyResolver);
        if (invalidLeft.isEmpty()) {
            return invalidRight;
        }
        if (invalidRight.isEmpty()) {
            return invalidLeft;
        }
        List<String> invalid = new ArrayList<>(invalidLeft);
        invalid.addAll(invalidRight);
        return invalid;
    }

    @Override
    public FilterExpressionType getType() {
        return FilterExpressionType.BINARY;
    }

    public FilterExpression getLeft() {
        return left;
    }

    public FilterExpression getRight() {
        return right;
    }

    public boolean isJoinedByAnd() {
        return joinedByAnd;
    }

    @Override
    public String toString() {
        return "(" + left + (joinedByAnd ? " & " : " | ") + right + ")";
    }
}
