/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

/**
 * An interval of bytes, ordered by unsigned value: {@code (byte) 0x80} comes after {@code (byte) 0x7F}.
 */
public final class ByteInterval extends Interval<Byte> {
    public ByteInterval(byte start, byte end) {
        super(SymbolKind.BYTE, Byte.toUnsignedInt(start), Byte.toUnsignedInt(end));
    }

    /**
     * @param start unsigned value of the first byte, 0 to 255
     * @param end   unsigned value of the last byte, 0 to 255
     */
    public static ByteInterval ofValues(int start, int end) {
        return new ByteInterval(SymbolKind.BYTE.symbolOf(start), SymbolKind.BYTE.symbolOf(end));
    }
}
