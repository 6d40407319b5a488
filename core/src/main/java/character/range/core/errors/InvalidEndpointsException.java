/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when a range endpoint is empty or contains a symbol its map does not know.
 */
public class InvalidEndpointsException extends IllegalArgumentException {
    public InvalidEndpointsException(String start, String end) {
        super("Invalid endpoints: " + start + ", " + end);
    }
}
