package com.testplatform.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A filter string parsed once and matched against many test cases.
 */
public class TestCaseFilterExpression {

    private static final Logger log = LoggerFactory.getLogger(TestCaseFilterExpression.class);

    private final String filterString;
    private final FilterOptions options;
    private final FilterExpression expression;
    private final UnaryOperator<String> valueTransform;

    public TestCaseFilterExpression(String filterString) {
        this(filterString, FilterOptions.none());
    }

    /**
     * @throws com.testplatform.exception.FilterFormatException if the filter is malformed
     */
    public TestCaseFilterExpression(String filterString, FilterOptions options) {
        this.filterString = Objects.requireNonNull(filterString, "filterString");
        this.options = options == null ? FilterOptions.none() : options;
        this.expression = FilterExpressionParser.parse(filterString);

        // tree evaluation never takes a transform
        this.valueTransform = expression.getType() == FilterExpressionType.FAST_SET
                ? this.options.toValueTransform()
                : null;

        log.debug("Parsed test case filter '{}' as {}", filterString, expression.getType());
    }

    /**
     * @return Property names used by the filter that are not supported; empty when valid
     */
    public List<String> validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver) {
        return expression.validForProperties(supportedProperties, propertyResolver);
    }

    public boolean matchTestCase(PropertyValueProvider propertyValueProvider) {
        return expression.evaluate(propertyValueProvider, valueTransform);
    }

    public String getFilterString() {
        return filterString;
    }

    public FilterOptions getOptions() {
        return options;
    }

    public FilterExpression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return filterString;
    }
}
