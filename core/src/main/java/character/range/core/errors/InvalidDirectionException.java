/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when the start of an interval or a range lies after its end.
 */
public class InvalidDirectionException extends IllegalArgumentException {
    public InvalidDirectionException(Object start, Object end) {
        super("Start is greater than end (" + start + " > " + end + ")");
    }
}
