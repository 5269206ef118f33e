package com.testplatform.filter.expression;

import java.util.regex.Pattern;

/**
 * Symbols and keywords of the test case filter language.
 */
public final class FilterSyntax {

    private FilterSyntax() {
    }

    public static final char AND = '&';
    public static final char OR = '|';
    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';
    public static final char ESCAPE = '\\';

    /**
     * Property every test case carries; the target of {@link #NORMALIZED_FULLY_QUALIFIED_NAME}.
     */
    public static final String FULLY_QUALIFIED_NAME = "FullyQualifiedName";

    /**
     * Keyword for the fully qualified name truncated at its first space (parameterized tests).
     */
    public static final String NORMALIZED_FULLY_QUALIFIED_NAME = "NFQN";

    /**
     * Whitespace that starts another {@code name operator} pair inside one text segment.
     * Names cannot contain whitespace, operator characters or escapes.
     */
    static final Pattern CONDITION_BOUNDARY = Pattern.compile("\\s+(?=[^\\s=!\\\\]+\\s*!?=)");

    public static boolean isSeparator(char c) {
        return c == AND || c == OR || c == LEFT_PAREN || c == RIGHT_PAREN;
    }

    /**
     * Remove escape characters: {@code \x} becomes {@code x}.
     * A trailing lone escape is kept as is.
     */
    public static String unescape(String text) {
        if (text.indexOf(ESCAPE) < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                sb.append(text.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escape every character that has a meaning in the filter language.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isSeparator(c) || c == '=' || c == '!' || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
