/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.range;

import character.range.core.map.IndexMap;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A range of strings. Each code point of a string is one symbol, supplementary characters included:
 * <pre>
 *     new StringRange("a", "c", CharacterMaps.ASCII_LOWERCASE.getMap())   // a, b, c
 *     new StringRange("aa", "ac", CharacterMaps.ASCII_LOWERCASE.getMap()) // aa, ab, ac
 * </pre>
 */
public final class StringRange extends SymbolRange<String, String> {
    public StringRange(String start, String end, IndexMap<String> map) {
        super(start, end, map);
    }

    @Override
    protected List<String> split(String word) {
        return word.codePoints()
                .mapToObj(codepoint -> new String(Character.toChars(codepoint)))
                .collect(Collectors.toList());
    }

    @Override
    protected String join(List<String> symbols) {
        StringBuilder builder = new StringBuilder(symbols.size() * 2);
        for(String symbol : symbols) {
            builder.append(symbol);
        }
        return builder.toString();
    }

    @Override
    protected String copy(String word) {
        return word;
    }

    @Override
    protected String describe(String word) {
        return "\"" + word + "\"";
    }
}
