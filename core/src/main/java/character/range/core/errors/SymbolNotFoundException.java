/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.errors;

import java.util.NoSuchElementException;

public class SymbolNotFoundException extends NoSuchElementException {
    public SymbolNotFoundException(Object symbol, Object map) {
        super("Symbol " + symbol + " is not in " + map);
    }
}
