/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when a custom symbol-to-index lookup returns something outside [0, cardinality).
 */
public class InvalidIndexException extends IllegalStateException {
    public InvalidIndexException(int cardinality, Object actual) {
        super("Expected the symbol lookup to return an integer in [0, " + cardinality + "), got " + actual);
    }
}
