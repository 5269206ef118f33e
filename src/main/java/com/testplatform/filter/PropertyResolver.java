package com.testplatform.filter;

import java.util.Optional;

/**
 * Looks up property metadata for a property name used in a filter.
 */
@FunctionalInterface
public interface PropertyResolver {

    /**
     * @param propertyName Property name from a filter condition
     * @return Property metadata, or empty if the name is unknown to the resolver
     */
    Optional<TestProperty> resolve(String propertyName);
}
