/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.NoSuchPrebuiltMapException;
import com.esotericsoftware.minlog.Log;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * The pre-built character alphabets. Each map is built on first use and shared afterwards.
 */
public enum CharacterMaps {
    ASCII_LOWERCASE(() -> IndexMap.of(interval("a", "z"))),
    ASCII_UPPERCASE(() -> IndexMap.of(interval("A", "Z"))),
    ASCII_LETTERS(() -> IndexMap.of(interval("a", "z"), interval("A", "Z"))),

    ASCII_DIGITS(() -> IndexMap.of(interval("0", "9"))),

    LOWERCASE_HEX_DIGITS(() -> IndexMap.of(interval("0", "9"), interval("a", "f"))),
    UPPERCASE_HEX_DIGITS(() -> IndexMap.of(interval("0", "9"), interval("A", "F"))),

    LOWERCASE_BASE_36(() -> IndexMap.of(interval("0", "9"), interval("a", "z"))),
    UPPERCASE_BASE_36(() -> IndexMap.of(interval("0", "9"), interval("A", "Z"))),

    ASCII(() -> new IndexMap<>(List.of(CharacterInterval.ofCodepoints(0x00, 0xFF)),
            symbol -> offsetOf(symbol, 0x00, 0xFF), index -> SymbolKind.CHARACTER.symbolOf(index))),
    NON_ASCII(() -> new IndexMap<>(scalarIntervals(0x100),
            symbol -> scalarOffset(symbol, 0x100), index -> scalarAt(index, 0x100))),
    UNICODE(() -> new IndexMap<>(scalarIntervals(0x00),
            symbol -> scalarOffset(symbol, 0x00), index -> scalarAt(index, 0x00)));

    private static final int SURROGATE_COUNT = Character.MAX_SURROGATE - Character.MIN_SURROGATE + 1;

    private final Supplier<IndexMap<String>> factory;

    @Getter(lazy = true)
    private final IndexMap<String> map = build();

    CharacterMaps(Supplier<IndexMap<String>> factory) {
        this.factory = factory;
    }

    /**
     * The snake_case name of this map, e.g. {@code ascii_lowercase}.
     */
    public String getMapName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a map by its snake_case name, ignoring case.
     */
    public static CharacterMaps byName(String name) {
        if(name == null) {
            throw new NoSuchPrebuiltMapException(null);
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new NoSuchPrebuiltMapException(name);
        }
    }

    private IndexMap<String> build() {
        IndexMap<String> built = factory.get();
        Log.debug(IndexMap.LOG_CATEGORY, "Built prebuilt character map " + getMapName() + ": " + built);
        return built;
    }

    private static CharacterInterval interval(String start, String end) {
        return new CharacterInterval(start, end);
    }

    private static int offsetOf(String symbol, int first, int last) {
        int codepoint = symbol.codePointAt(0);
        if(codepoint < first || codepoint > last) {
            throw new NoSuchElementException("Code point " + SymbolKind.escape(codepoint) + " is not in "
                    + SymbolKind.escape(first) + "-" + SymbolKind.escape(last));
        }
        return codepoint - first;
    }

    /**
     * Every scalar value from {@code first} up, as the two intervals on either side of the surrogate block.
     */
    private static List<CharacterInterval> scalarIntervals(int first) {
        return List.of(CharacterInterval.ofCodepoints(first, Character.MIN_SURROGATE - 1),
                CharacterInterval.ofCodepoints(Character.MAX_SURROGATE + 1, Character.MAX_CODE_POINT));
    }

    private static int scalarOffset(String symbol, int first) {
        int codepoint = symbol.codePointAt(0);
        if(codepoint < first) {
            throw new NoSuchElementException("Code point " + SymbolKind.escape(codepoint) + " is below "
                    + SymbolKind.escape(first));
        }
        return codepoint < Character.MIN_SURROGATE ? codepoint - first : codepoint - first - SURROGATE_COUNT;
    }

    private static String scalarAt(int index, int first) {
        int codepoint = index + first;
        if(codepoint >= Character.MIN_SURROGATE) {
            codepoint += SURROGATE_COUNT;
        }
        return SymbolKind.CHARACTER.symbolOf(codepoint);
    }
}
