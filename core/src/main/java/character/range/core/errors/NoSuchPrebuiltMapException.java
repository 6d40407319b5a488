/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

public class NoSuchPrebuiltMapException extends IllegalArgumentException {
    public NoSuchPrebuiltMapException(String name) {
        super("No such prebuilt map with given name: " + name);
    }
}
