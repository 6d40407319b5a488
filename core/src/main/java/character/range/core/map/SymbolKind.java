/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.NotASymbolException;
import lombok.Getter;

/**
 * The kind of the atomic units an alphabet is made of. There are exactly two kinds: {@link #CHARACTER}, whose symbols
 * are strings holding a single Unicode scalar value (any code point but a surrogate), and {@link #BYTE}, whose symbols
 * are bytes ordered by their unsigned value.
 * <p>
 * Every symbol has an unsigned rank (its code point or byte value) which orders it within its kind.
 *
 * @param <S> the Java type of a single symbol
 */
@Getter
public abstract class SymbolKind<S> {
    public static final SymbolKind<String> CHARACTER = new CharacterKind();
    public static final SymbolKind<Byte> BYTE = new ByteKind();

    private final String name;
    private final Class<S> symbolType;
    private final int maxCodepoint;

    private SymbolKind(String name, Class<S> symbolType, int maxCodepoint) {
        this.name = name;
        this.symbolType = symbolType;
        this.maxCodepoint = maxCodepoint;
    }

    /**
     * Whether the given value is exactly one symbol of this kind.
     */
    public abstract boolean isSymbol(Object value);

    /**
     * Returns the rank of a symbol. The symbol is assumed to be valid, see {@link #requireSymbol(Object)}.
     */
    public abstract int codepointOf(S symbol);

    /**
     * Returns the symbol with the given rank.
     *
     * @throws NotASymbolException if the rank is outside [0, {@link #getMaxCodepoint()}] or is not a symbol of this
     *                             kind
     */
    public abstract S symbolOf(int codepoint);

    public S requireSymbol(Object value) {
        if(!isSymbol(value)) {
            throw new NotASymbolException(name, value);
        }
        return symbolType.cast(value);
    }

    public String describe(S symbol) {
        return escape(codepointOf(symbol));
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Printable ASCII is kept as is, everything else becomes a {@code \xHH}, {@code \}{@code uHHHH} or
     * {@code \UHHHHHHHH} escape.
     */
    public static String escape(int codepoint) {
        if(codepoint == '\\') {
            return "\\\\";
        }
        if(codepoint >= ' ' && codepoint <= '~') {
            return String.valueOf((char) codepoint);
        }
        if(codepoint <= 0xFF) {
            return String.format("\\x%02X", codepoint);
        }
        if(codepoint <= 0xFFFF) {
            return String.format("\\u%04X", codepoint);
        }
        return String.format("\\U%08X", codepoint);
    }

    private static final class CharacterKind extends SymbolKind<String> {
        private CharacterKind() {
            super("character", String.class, Character.MAX_CODE_POINT);
        }

        @Override
        public boolean isSymbol(Object value) {
            if(!(value instanceof String)) { return false; }
            String string = (String) value;
            return !string.isEmpty() && string.codePointCount(0, string.length()) == 1
                    && !isSurrogate(string.codePointAt(0));
        }

        @Override
        public int codepointOf(String symbol) {
            return symbol.codePointAt(0);
        }

        @Override
        public String symbolOf(int codepoint) {
            if(codepoint < 0 || codepoint > Character.MAX_CODE_POINT || isSurrogate(codepoint)) {
                throw new NotASymbolException(getName(), codepoint);
            }
            return new String(Character.toChars(codepoint));
        }

        // Surrogate halves are not scalar values
        private static boolean isSurrogate(int codepoint) {
            return codepoint >= Character.MIN_SURROGATE && codepoint <= Character.MAX_SURROGATE;
        }
    }

    private static final class ByteKind extends SymbolKind<Byte> {
        private ByteKind() {
            super("byte", Byte.class, 0xFF);
        }

        @Override
        public boolean isSymbol(Object value) {
            return value instanceof Byte;
        }

        @Override
        public int codepointOf(Byte symbol) {
            return Byte.toUnsignedInt(symbol);
        }

        @Override
        public Byte symbolOf(int codepoint) {
            if(codepoint < 0 || codepoint > 0xFF) {
                throw new NotASymbolException(getName(), codepoint);
            }
            return (byte) codepoint;
        }
    }
}
