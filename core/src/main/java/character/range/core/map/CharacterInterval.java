/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.NotASymbolException;

/**
 * An interval of Unicode scalar values. Each endpoint is a string holding exactly one code point, and the interval
 * must not span the surrogate block U+D800 to U+DFFF; alphabets on both sides of it are made of two intervals.
 */
public final class CharacterInterval extends Interval<String> {
    public CharacterInterval(String start, String end) {
        this(rank(start), rank(end));
    }

    private CharacterInterval(int startCodepoint, int endCodepoint) {
        super(SymbolKind.CHARACTER, startCodepoint, endCodepoint);
        if(startCodepoint <= Character.MAX_SURROGATE && endCodepoint >= Character.MIN_SURROGATE) {
            throw new NotASymbolException(SymbolKind.CHARACTER.getName(),
                    Math.max(startCodepoint, Character.MIN_SURROGATE));
        }
    }

    public static CharacterInterval ofCodepoints(int startCodepoint, int endCodepoint) {
        SymbolKind.CHARACTER.symbolOf(startCodepoint);
        SymbolKind.CHARACTER.symbolOf(endCodepoint);
        return new CharacterInterval(startCodepoint, endCodepoint);
    }

    private static int rank(Object endpoint) {
        return SymbolKind.CHARACTER.codepointOf(SymbolKind.CHARACTER.requireSymbol(endpoint));
    }
}
