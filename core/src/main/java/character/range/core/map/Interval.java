/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.InvalidDirectionException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An inclusive, contiguous span of symbols, ordered by code point (or unsigned byte value). Two intervals are equal
 * when they are of the same kind and cover the same code points.
 *
 * @param <S> the symbol type
 */
@Getter
@EqualsAndHashCode
public abstract class Interval<S> implements Iterable<S> {
    private final SymbolKind<S> kind;
    private final int startCodepoint, endCodepoint;

    Interval(@NonNull SymbolKind<S> kind, int startCodepoint, int endCodepoint) {
        // Both endpoints have already been validated as symbols by the subclass
        if(startCodepoint > endCodepoint) {
            throw new InvalidDirectionException(SymbolKind.escape(startCodepoint), SymbolKind.escape(endCodepoint));
        }
        this.kind = kind;
        this.startCodepoint = startCodepoint;
        this.endCodepoint = endCodepoint;
    }

    public S getStart() {
        return kind.symbolOf(startCodepoint);
    }

    public S getEnd() {
        return kind.symbolOf(endCodepoint);
    }

    /**
     * The number of symbols in the interval.
     */
    public int length() {
        return endCodepoint - startCodepoint + 1;
    }

    /**
     * Whether the value is a symbol of this interval's kind lying between both endpoints. Never throws.
     */
    public boolean contains(Object value) {
        if(!kind.isSymbol(value)) { return false; }
        int codepoint = kind.codepointOf(kind.getSymbolType().cast(value));
        return startCodepoint <= codepoint && codepoint <= endCodepoint;
    }

    /**
     * O(1) access to the i-th symbol of the interval.
     */
    public S get(int index) {
        if(index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Index " + index + " is out of range for " + this);
        }
        return kind.symbolOf(startCodepoint + index);
    }

    public boolean intersects(@NonNull Interval<?> other) {
        if(other.kind != kind) { return false; }
        return Math.max(startCodepoint, other.startCodepoint) <= Math.min(endCodepoint, other.endCodepoint);
    }

    /**
     * Creates a map made of this interval followed by {@code other}.
     */
    public IndexMap<S> combine(@NonNull Interval<S> other) {
        return new IndexMap<>(Arrays.asList(this, other));
    }

    @Override
    public Iterator<S> iterator() {
        return new Iterator<S>() {
            private int next = startCodepoint;

            @Override
            public boolean hasNext() {
                return next <= endCodepoint;
            }

            @Override
            public S next() {
                if(!hasNext()) {
                    throw new NoSuchElementException();
                }
                return kind.symbolOf(next++);
            }
        };
    }

    @Override
    public String toString() {
        if(startCodepoint == endCodepoint) {
            return SymbolKind.escape(startCodepoint);
        }
        return SymbolKind.escape(startCodepoint) + "-" + SymbolKind.escape(endCodepoint);
    }
}
