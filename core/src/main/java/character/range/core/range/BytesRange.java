/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.range;

import character.range.core.map.IndexMap;
import character.range.core.map.SymbolKind;

import java.util.ArrayList;
import java.util.List;

/**
 * A range of byte arrays, each byte being one symbol. Arrays passed in or handed out are copied.
 */
public final class BytesRange extends SymbolRange<Byte, byte[]> {
    public BytesRange(byte[] start, byte[] end, IndexMap<Byte> map) {
        super(start, end, map);
    }

    @Override
    protected List<Byte> split(byte[] word) {
        List<Byte> symbols = new ArrayList<>(word.length);
        for(byte b : word) {
            symbols.add(b);
        }
        return symbols;
    }

    @Override
    protected byte[] join(List<Byte> symbols) {
        byte[] word = new byte[symbols.size()];
        for(int i = 0; i < word.length; i++) {
            word[i] = symbols.get(i);
        }
        return word;
    }

    @Override
    protected byte[] copy(byte[] word) {
        return word.clone();
    }

    @Override
    protected String describe(byte[] word) {
        StringBuilder builder = new StringBuilder("b'");
        for(byte b : word) {
            builder.append(SymbolKind.escape(Byte.toUnsignedInt(b)));
        }
        return builder.append('\'').toString();
    }
}
