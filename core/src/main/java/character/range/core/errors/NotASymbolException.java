/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when a value that should be exactly one character (or one byte) is not.
 */
public class NotASymbolException extends IllegalArgumentException {
    public NotASymbolException(String kindName, Object actual) {
        super("Expected a single " + kindName + ", got " + describe(actual));
    }

    public NotASymbolException(String kindName, int codepoint) {
        super("Expected a single " + kindName + ", got code point " + String.format("0x%X", codepoint));
    }

    private static String describe(Object actual) {
        if(actual instanceof String) {
            String string = (String) actual;
            return "a string of " + string.codePointCount(0, string.length()) + " code points";
        }
        return actual == null ? "null" : actual.getClass().getSimpleName() + " " + actual;
    }
}
