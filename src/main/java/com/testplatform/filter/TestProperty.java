package com.testplatform.filter;

/**
 * Describes a test case property known to the platform.
 *
 * @param id        Property name as used in filters
 * @param valueType Java type of the property value
 */
public record TestProperty(String id, Class<?> valueType) {

    /**
     * Filters compare text, so only string and string-array properties can be used.
     */
    public boolean isFilterable() {
        return valueType == String.class || valueType == String[].class;
    }
}
