/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

/**
 * Thrown when a map is configured inconsistently: intervals of different kinds, only one of the two lookup
 * functions, or two maps that cannot be combined.
 */
public class ConfigurationConflictException extends IllegalArgumentException {
    public ConfigurationConflictException(String message) {
        super(message);
    }
}
