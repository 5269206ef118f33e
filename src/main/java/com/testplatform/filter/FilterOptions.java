package com.testplatform.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Options that adjust how property values are matched by a fast filter.
 *
 * @param filterRegEx            Pattern applied to the property value before matching, may be null
 * @param filterRegExReplacement Replacement for {@code filterRegEx} matches; when null the first
 *                               match itself is used as the value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterOptions(
        @JsonProperty("FilterRegEx") String filterRegEx,
        @JsonProperty("FilterRegExReplacement") String filterRegExReplacement
) {

    public static FilterOptions none() {
        return new FilterOptions(null, null);
    }

    /**
     * Build the value transform described by these options.
     *
     * @return Transform returning null when the value does not match, or null if no pattern is set
     */
    public UnaryOperator<String> toValueTransform() {
        if (filterRegEx == null || filterRegEx.isEmpty()) {
            return null;
        }
        Pattern pattern = Pattern.compile(filterRegEx);
        if (filterRegExReplacement != null) {
            return value -> pattern.matcher(value).replaceAll(filterRegExReplacement);
        }
        return value -> {
            Matcher matcher = pattern.matcher(value);
            return matcher.find() ? matcher.group() : null;
        };
    }
}
