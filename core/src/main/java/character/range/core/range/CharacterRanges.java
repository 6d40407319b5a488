/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.range;

import character.range.core.errors.ConfigurationConflictException;
import character.range.core.map.ByteMaps;
import character.range.core.map.CharacterMaps;
import character.range.core.map.IndexMap;
import character.range.core.map.SymbolKind;
import lombok.NonNull;

/**
 * Entry points for creating ranges, in the manner of {@code range(start, end)}.
 */
public final class CharacterRanges {
    private CharacterRanges() {}

    public static StringRange characterRange(String start, String end, IndexMap<String> map) {
        return new StringRange(start, end, map);
    }

    public static BytesRange characterRange(byte[] start, byte[] end, IndexMap<Byte> map) {
        return new BytesRange(start, end, map);
    }

    /**
     * Creates a string range over the pre-built character map with the given name, e.g. {@code "ascii_lowercase"}.
     */
    public static StringRange characterRange(String start, String end, String mapName) {
        return new StringRange(start, end, CharacterMaps.byName(mapName).getMap());
    }

    /**
     * Creates a bytes range over the pre-built byte map with the given name.
     */
    public static BytesRange characterRange(byte[] start, byte[] end, String mapName) {
        return new BytesRange(start, end, ByteMaps.byName(mapName).getMap());
    }

    /**
     * Picks the string or bytes variant from the runtime types of the endpoints.
     *
     * @throws IllegalArgumentException       if the endpoints are not two strings or two byte arrays
     * @throws ConfigurationConflictException if the map's kind does not match the endpoints
     */
    public static SymbolRange<?, ?> characterRange(Object start, Object end, @NonNull IndexMap<?> map) {
        if(start instanceof String && end instanceof String) {
            return new StringRange((String) start, (String) end, requireKind(map, SymbolKind.CHARACTER));
        }
        if(start instanceof byte[] && end instanceof byte[]) {
            return new BytesRange((byte[]) start, (byte[]) end, requireKind(map, SymbolKind.BYTE));
        }
        throw new IllegalArgumentException("Expected two strings or two byte arrays, got "
                + typeName(start) + " and " + typeName(end));
    }

    private static <S> IndexMap<S> requireKind(IndexMap<?> map, SymbolKind<S> kind) {
        if(map.getKind() != kind) {
            throw new ConfigurationConflictException("Expected a " + kind + " map, got " + map);
        }
        // Same kind, so same symbol type
        @SuppressWarnings("unchecked")
        IndexMap<S> typed = (IndexMap<S>) map;
        return typed;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
