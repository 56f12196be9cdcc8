package com.raditha.pyrefactor.util;

import com.raditha.pyrefactor.parser.PythonParser;

/**
 * Checks and conversions for Python identifiers.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    public static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }

    /**
     * True for a syntactically valid name, keywords included.
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || !isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isKeyword(String name) {
        return PythonParser.isKeyword(name);
    }

    /**
     * {@code OrderRepository} to {@code order_repository}, {@code HTTPClient}
     * to {@code http_client}.
     */
    public static String toSnakeCase(String name) {
        String withBreaks = name
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return withBreaks.toLowerCase();
    }
}
