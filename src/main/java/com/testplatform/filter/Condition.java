package com.testplatform.filter;

import com.testplatform.exception.FilterFormatError;
import com.testplatform.exception.FilterFormatException;
import com.testplatform.filter.expression.FilterSyntax;

import java.util.Collection;
import java.util.Objects;

/**
 * A single {@code name operator value} predicate, the leaf of a filter expression.
 * Immutable.
 */
public final class Condition {

    private final String name;
    private final Operation operation;
    private final String value;

    public Condition(String name, Operation operation, String value) {
        this.name = Objects.requireNonNull(name, "name");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Parse a single condition token such as {@code Priority=1} or {@code Category!=Slow}.
     *
     * @param token Condition text, escapes still in place
     * @return Parsed condition
     * @throws FilterFormatException if the token is not exactly {@code name operator value}
     */
    public static Condition parse(String token) {
        Objects.requireNonNull(token, "token");

        int operatorStart = -1;
        Operation operation = null;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == FilterSyntax.ESCAPE) {
                i++;
                continue;
            }
            Operation found = operationAt(token, i);
            if (found == null) {
                continue;
            }
            if (operation != null) {
                throw new FilterFormatException(FilterFormatError.INVALID_CONDITION, token,
                        "more than one operator");
            }
            operation = found;
            operatorStart = i;
            i += found.getSymbol().length() - 1;
        }

        if (operation == null) {
            throw new FilterFormatException(FilterFormatError.INVALID_CONDITION, token, "missing operator");
        }

        String name = token.substring(0, operatorStart).trim();
        String rawValue = token.substring(operatorStart + operation.getSymbol().length()).trim();
        if (name.isEmpty() || rawValue.isEmpty()) {
            throw new FilterFormatException(FilterFormatError.INVALID_CONDITION, token,
                    name.isEmpty() ? "missing property name" : "missing value");
        }
        return new Condition(name, operation, FilterSyntax.unescape(rawValue));
    }

    private static Operation operationAt(String token, int index) {
        char c = token.charAt(index);
        if (c == '!' && index + 1 < token.length() && token.charAt(index + 1) == '=') {
            return Operation.NOT_EQUAL;
        }
        if (c == '=') {
            return Operation.EQUAL;
        }
        return null;
    }

    /**
     * Evaluate against the property values of one test case.
     * Values are compared case-sensitively; a multi-valued property matches on any value.
     */
    public boolean evaluate(PropertyValueProvider propertyValueProvider) {
        String[] values = toValues(propertyValueProvider.getPropertyValue(name));
        return switch (operation) {
            case EQUAL -> values != null && contains(values);
            case NOT_EQUAL -> values == null || !contains(values);
        };
    }

    private boolean contains(String[] values) {
        for (String candidate : values) {
            if (value.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the property this condition refers to can be filtered on.
     *
     * @param supportedProperties Property names supported by the caller
     * @param propertyResolver    Optional metadata lookup, may be null
     */
    public boolean validForProperties(Collection<String> supportedProperties, PropertyResolver propertyResolver) {
        boolean supported = supportedProperties.stream().anyMatch(name::equalsIgnoreCase);
        if (!supported) {
            return false;
        }
        if (propertyResolver == null) {
            return true;
        }
        return propertyResolver.resolve(name)
                .map(TestProperty::isFilterable)
                .orElse(true);
    }

    /**
     * Text values of a property: a single string, a string array or the strings of a collection.
     *
     * @return Values, or null if the property is absent or not text
     */
    public static String[] toValues(Object propertyValue) {
        if (propertyValue instanceof String s) {
            return new String[]{s};
        }
        if (propertyValue instanceof String[] array) {
            return array;
        }
        if (propertyValue instanceof Collection<?> collection) {
            return collection.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .toArray(String[]::new);
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public Operation getOperation() {
        return operation;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Condition other)) {
            return false;
        }
        return name.equals(other.name) && operation == other.operation && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operation, value);
    }

    @Override
    public String toString() {
        return name + operation.getSymbol() + value;
    }
}
