/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.NoSuchPrebuiltMapException;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrebuiltMapsTest {

    @Test
    void mapsAreBuiltOnceAndShared() {
        assertThat(CharacterMaps.ASCII_LOWERCASE.getMap()).isSameAs(CharacterMaps.ASCII_LOWERCASE.getMap());
        assertThat(ByteMaps.ASCII.getMap()).isSameAs(ByteMaps.ASCII.getMap());
    }

    @Test
    void characterMapsHaveExpectedCardinalities() {
        assertThat(CharacterMaps.ASCII_LOWERCASE.getMap().cardinality()).isEqualTo(26);
        assertThat(CharacterMaps.ASCII_UPPERCASE.getMap().cardinality()).isEqualTo(26);
        assertThat(CharacterMaps.ASCII_LETTERS.getMap().cardinality()).isEqualTo(52);
        assertThat(CharacterMaps.ASCII_DIGITS.getMap().cardinality()).isEqualTo(10);
        assertThat(CharacterMaps.LOWERCASE_HEX_DIGITS.getMap().cardinality()).isEqualTo(16);
        assertThat(CharacterMaps.UPPERCASE_HEX_DIGITS.getMap().cardinality()).isEqualTo(16);
        assertThat(CharacterMaps.LOWERCASE_BASE_36.getMap().cardinality()).isEqualTo(36);
        assertThat(CharacterMaps.UPPERCASE_BASE_36.getMap().cardinality()).isEqualTo(36);
        assertThat(CharacterMaps.ASCII.getMap().cardinality()).isEqualTo(256);
        // Every code point but the 0x800 surrogates
        assertThat(CharacterMaps.NON_ASCII.getMap().cardinality()).isEqualTo(0x110000 - 0x800 - 0x100);
        assertThat(CharacterMaps.UNICODE.getMap().cardinality()).isEqualTo(0x110000 - 0x800);
    }

    @Test
    void onlyCodepointSpaceMapsAreLazy() {
        for(CharacterMaps prebuilt : CharacterMaps.values()) {
            boolean expectLazy = prebuilt == CharacterMaps.ASCII || prebuilt == CharacterMaps.NON_ASCII
                    || prebuilt == CharacterMaps.UNICODE;
            assertThat(prebuilt.getMap().isLazy()).as(prebuilt.getMapName()).isEqualTo(expectLazy);
            assertThat(prebuilt.getMap().getKind()).isSameAs(SymbolKind.CHARACTER);
        }
        for(ByteMaps prebuilt : ByteMaps.values()) {
            assertThat(prebuilt.getMap().isLazy()).as(prebuilt.getMapName()).isEqualTo(prebuilt == ByteMaps.ASCII);
            assertThat(prebuilt.getMap().getKind()).isSameAs(SymbolKind.BYTE);
        }
    }

    @Test
    void hexDigitsFollowDecimalDigits() {
        IndexMap<String> hex = CharacterMaps.LOWERCASE_HEX_DIGITS.getMap();

        assertThat(hex.symbolToIndex("9")).isEqualTo(9);
        assertThat(hex.symbolToIndex("a")).isEqualTo(10);
        assertThat(hex.indexToSymbol(15)).isEqualTo("f");
        assertThat(hex.contains("A")).isFalse();
    }

    @Test
    void unicodeMapUsesCodepoints() {
        IndexMap<String> unicode = CharacterMaps.UNICODE.getMap();

        assertThat(unicode.symbolToIndex("a")).isEqualTo('a');
        assertThat(unicode.symbolToIndex("😀")).isEqualTo(0x1F600 - 0x800);
        assertThat(unicode.indexToSymbol(0x1F600 - 0x800)).isEqualTo("😀");
        assertThat(unicode.indexToSymbol(0)).isEqualTo("\u0000");
    }

    @Test
    void unicodeMapSkipsSurrogates() {
        IndexMap<String> unicode = CharacterMaps.UNICODE.getMap();

        assertThat(unicode.getIntervals()).hasSize(2);
        assertThat(unicode.indexToSymbol(0xD7FF)).isEqualTo("\uD7FF");
        assertThat(unicode.indexToSymbol(0xD800)).isEqualTo("\uE000");
        assertThat(unicode.symbolToIndex("\uE000")).isEqualTo(0xD800);
        assertThat(unicode.indexToSymbol(unicode.cardinality() - 1))
                .isEqualTo(new String(Character.toChars(Character.MAX_CODE_POINT)));
        assertThat(unicode.contains("\uD800")).isFalse();
        assertThat(CharacterMaps.NON_ASCII.getMap().symbolToIndex("\uE000")).isEqualTo(0xD800 - 0x100);
    }

    @Test
    void asciiAndNonAsciiSplitTheCodepointSpace() {
        IndexMap<String> ascii = CharacterMaps.ASCII.getMap();
        IndexMap<String> nonAscii = CharacterMaps.NON_ASCII.getMap();

        assertThat(ascii.symbolToIndex("ÿ")).isEqualTo(0xFF);
        assertThat(ascii.contains("Ā")).isFalse();
        assertThat(nonAscii.symbolToIndex("Ā")).isEqualTo(0);
        assertThat(nonAscii.indexToSymbol(0)).isEqualTo("Ā");
        assertThat(nonAscii.contains("a")).isFalse();
        assertThatThrownBy(() -> nonAscii.symbolToIndex("a")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void byteAsciiCoversEveryByte() {
        IndexMap<Byte> ascii = ByteMaps.ASCII.getMap();

        assertThat(ascii.cardinality()).isEqualTo(256);
        assertThat(ascii.symbolToIndex((byte) 0xFE)).isEqualTo(0xFE);
        assertThat(ascii.indexToSymbol(0x81)).isEqualTo((byte) 0x81);
    }

    @Test
    void eagerMapsRoundTrip() {
        for(CharacterMaps prebuilt : CharacterMaps.values()) {
            IndexMap<String> map = prebuilt.getMap();
            if(map.isLazy()) { continue; }
            for(int index = 0; index < map.cardinality(); index++) {
                assertThat(map.symbolToIndex(map.indexToSymbol(index))).isEqualTo(index);
            }
        }
        for(ByteMaps prebuilt : ByteMaps.values()) {
            IndexMap<Byte> map = prebuilt.getMap();
            for(int index = 0; index < map.cardinality(); index++) {
                assertThat(map.symbolToIndex(map.indexToSymbol(index))).isEqualTo(index);
            }
        }
    }

    @Test
    void mapsResolveByName() {
        assertThat(CharacterMaps.byName("ascii_lowercase")).isSameAs(CharacterMaps.ASCII_LOWERCASE);
        assertThat(CharacterMaps.byName("Lowercase_Base_36")).isSameAs(CharacterMaps.LOWERCASE_BASE_36);
        assertThat(ByteMaps.byName("ascii")).isSameAs(ByteMaps.ASCII);
        assertThat(CharacterMaps.UPPERCASE_HEX_DIGITS.getMapName()).isEqualTo("uppercase_hex_digits");
    }

    @Test
    void unknownNamesAreRejected() {
        assertThatThrownBy(() -> CharacterMaps.byName("klingon")).isInstanceOf(NoSuchPrebuiltMapException.class);
        assertThatThrownBy(() -> ByteMaps.byName("unicode")).isInstanceOf(NoSuchPrebuiltMapException.class);
        assertThatThrownBy(() -> ByteMaps.byName(null)).isInstanceOf(NoSuchPrebuiltMapException.class);
    }
}
