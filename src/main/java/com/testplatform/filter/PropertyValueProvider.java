package com.testplatform.filter;

/**
 * Supplies test case property values by property name.
 * <p>
 * A value is expected to be a {@code String}, a {@code String[]} or a collection of
 * strings; {@code null} means the test case does not carry the property.
 */
@FunctionalInterface
public interface PropertyValueProvider {

    Object getPropertyValue(String propertyName);
}
