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
import java.util.function.Supplier;

/**
 * The pre-built byte alphabets. Each map is built on first use and shared afterwards.
 */
public enum ByteMaps {
    ASCII_LOWERCASE(() -> IndexMap.of(interval('a', 'z'))),
    ASCII_UPPERCASE(() -> IndexMap.of(interval('A', 'Z'))),
    ASCII_LETTERS(() -> IndexMap.of(interval('a', 'z'), interval('A', 'Z'))),

    ASCII_DIGITS(() -> IndexMap.of(interval('0', '9'))),

    LOWERCASE_HEX_DIGITS(() -> IndexMap.of(interval('0', '9'), interval('a', 'f'))),
    UPPERCASE_HEX_DIGITS(() -> IndexMap.of(interval('0', '9'), interval('A', 'F'))),

    LOWERCASE_BASE_36(() -> IndexMap.of(interval('0', '9'), interval('a', 'z'))),
    UPPERCASE_BASE_36(() -> IndexMap.of(interval('0', '9'), interval('A', 'Z'))),

    // Every byte, by unsigned value
    ASCII(() -> new IndexMap<>(List.of(ByteInterval.ofValues(0x00, 0xFF)),
            Byte::toUnsignedInt, index -> SymbolKind.BYTE.symbolOf(index)));

    private final Supplier<IndexMap<Byte>> factory;

    @Getter(lazy = true)
    private final IndexMap<Byte> map = build();

    ByteMaps(Supplier<IndexMap<Byte>> factory) {
        this.factory = factory;
    }

    public String getMapName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ByteMaps byName(String name) {
        if(name == null) {
            throw new NoSuchPrebuiltMapException(null);
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new NoSuchPrebuiltMapException(name);
        }
    }

    private IndexMap<Byte> build() {
        IndexMap<Byte> built = factory.get();
        Log.debug(IndexMap.LOG_CATEGORY, "Built prebuilt byte map " + getMapName() + ": " + built);
        return built;
    }

    private static ByteInterval interval(char start, char end) {
        return ByteInterval.ofValues(start, end);
    }
}
