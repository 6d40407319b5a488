/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

public class OverlappingIntervalsException extends IllegalArgumentException {
    public OverlappingIntervalsException(Object first, Object second) {
        super("Intervals must not overlap: " + first + " and " + second);
    }
}
