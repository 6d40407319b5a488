/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when a custom index-to-symbol lookup returns something that is not a single symbol of the map's kind.
 */
public class InvalidSymbolException extends IllegalStateException {
    public InvalidSymbolException(String kindName, int index, Object actual) {
        super("Expected the index lookup to return a single " + kindName + " for index " + index
                + ", got " + (actual instanceof String ? "\"" + actual + "\"" : String.valueOf(actual)));
    }
}
