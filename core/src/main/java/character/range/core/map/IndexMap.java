/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import character.range.core.errors.ConfigurationConflictException;
import character.range.core.errors.InvalidIndexException;
import character.range.core.errors.InvalidSymbolException;
import character.range.core.errors.NoIntervalsException;
import character.range.core.errors.OverlappingIntervalsException;
import character.range.core.errors.SymbolNotFoundException;
import com.esotericsoftware.minlog.Log;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Synchronized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * A two-way mapping between the symbols of one or more disjoint intervals and their dense, 0-based indices. Indices
 * are assigned in interval list order: the first interval's symbols get 0 to {@code length - 1}, the next interval
 * continues from there, and so on.
 * <p>
 * A map is built in one of two modes:
 * <ul>
 *     <li><b>eager</b> (no lookup functions): both tables are populated at construction, after which the map never
 *     changes.</li>
 *     <li><b>lazy</b> (both lookup functions given): the tables start empty and are filled with the results of the
 *     lookup functions as symbols and indices are requested. This is what makes an alphabet as large as Unicode
 *     usable. The functions must agree with the interval layout; their results are range-checked but otherwise
 *     trusted.</li>
 * </ul>
 * A map may be shared between threads. Cache misses in lazy mode are serialized, so a lookup function is called at
 * most once per symbol or index.
 *
 * @param <S> the symbol type
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexMap<S> {
    public static final String LOG_CATEGORY = "map";

    @Getter
    @EqualsAndHashCode.Include
    private final SymbolKind<S> kind;
    @Getter
    @EqualsAndHashCode.Include
    private final List<Interval<S>> intervals;
    private final Lookup<S> lookup;
    private final int cardinality;

    private final Map<S, Integer> symbolToIndexCache = new ConcurrentHashMap<>();
    private final Map<Integer, S> indexToSymbolCache = new ConcurrentHashMap<>();
    private final Object[] cacheLock = new Object[0];

    /**
     * Creates an eager map.
     */
    public IndexMap(@NonNull List<? extends Interval<S>> intervals) {
        this(intervals, null, null);
    }

    /**
     * Creates a map that is lazy if the lookup functions are given, eager if both are {@code null}.
     * <p>
     * A lookup function reports a symbol or index it does not know by throwing {@link NoSuchElementException} or
     * {@link IllegalArgumentException}.
     *
     * @throws ConfigurationConflictException if exactly one lookup function is given, or the intervals are of
     *                                        different kinds
     * @throws NoIntervalsException           if {@code intervals} is empty
     * @throws OverlappingIntervalsException  if two intervals share a symbol
     */
    public IndexMap(@NonNull List<? extends Interval<S>> intervals,
                    Function<? super S, Integer> symbolToIndex, IntFunction<? extends S> indexToSymbol) {
        if((symbolToIndex == null) != (indexToSymbol == null)) {
            throw new ConfigurationConflictException(
                    "The two lookup functions must be either both given or both omitted");
        }
        if(intervals.isEmpty()) {
            throw new NoIntervalsException();
        }
        this.intervals = List.copyOf(intervals);
        this.kind = this.intervals.get(0).getKind();
        for(Interval<S> interval : this.intervals) {
            if(interval.getKind() != kind) {
                throw new ConfigurationConflictException("Intervals must be of the same kind, got "
                        + kind + " and " + interval.getKind());
            }
        }

        if(symbolToIndex != null) {
            requireDisjoint(this.intervals);
            this.lookup = new Lookup<>(symbolToIndex, indexToSymbol);
            this.cardinality = totalLength(this.intervals);
            Log.debug(LOG_CATEGORY, "Created lazy map " + this + " with " + cardinality + " symbols");
        } else {
            this.lookup = null;
            this.cardinality = populate();
            Log.debug(LOG_CATEGORY, "Populated map " + this + " with " + cardinality + " symbols");
        }
    }

    @SafeVarargs
    public static <S> IndexMap<S> of(Interval<S>... intervals) {
        return new IndexMap<>(Arrays.asList(intervals));
    }

    /**
     * The number of symbols in the map, which is also the base ranges over this map count in.
     */
    public int cardinality() {
        return cardinality;
    }

    public boolean isLazy() {
        return lookup != null;
    }

    /**
     * Returns the index of a symbol.
     *
     * @throws character.range.core.errors.NotASymbolException if {@code symbol} is not a single symbol of this
     *                                                         map's kind
     * @throws SymbolNotFoundException                         if an eager map does not contain the symbol
     * @throws InvalidIndexException                           if a lookup function returned an invalid index
     */
    public int symbolToIndex(S symbol) {
        S checked = kind.requireSymbol(symbol);
        Integer cached = symbolToIndexCache.get(checked);
        if(cached != null) {
            return cached;
        }
        if(lookup == null) {
            throw new SymbolNotFoundException(kind.describe(checked), this);
        }
        return lookUpIndex(checked);
    }

    /**
     * Returns the symbol at an index.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in [0, {@link #cardinality()})
     * @throws InvalidSymbolException    if a lookup function returned something that is not a single symbol
     */
    public S indexToSymbol(int index) {
        if(!containsIndex(index)) {
            throw new IndexOutOfBoundsException("Index " + index + " is out of range [0, " + cardinality + ")");
        }
        S cached = indexToSymbolCache.get(index);
        if(cached != null) {
            return cached;
        }
        if(lookup == null) {
            throw new IllegalStateException("Index " + index + " missing from populated map " + this);
        }
        return lookUpSymbol(index);
    }

    /**
     * Whether the value is a symbol this map assigns an index to. Failures of the lookup function count as absence.
     */
    public boolean contains(Object value) {
        if(!kind.isSymbol(value)) {
            return false;
        }
        try {
            symbolToIndex(kind.getSymbolType().cast(value));
            return true;
        } catch (NoSuchElementException | IllegalArgumentException | InvalidIndexException e) {
            return false;
        }
    }

    public boolean containsIndex(int index) {
        return index >= 0 && index < cardinality;
    }

    /**
     * Creates a map with this map's intervals followed by {@code other}'s. Both maps must be eager, or share the
     * same lookup functions.
     */
    public IndexMap<S> combine(@NonNull IndexMap<S> other) {
        if(other.kind != kind) {
            throw new ConfigurationConflictException("Different element kinds: " + kind + " and " + other.kind);
        }
        if(!Objects.equals(lookup, other.lookup)) {
            throw new ConfigurationConflictException("Maps having different lookup functions cannot be combined");
        }
        List<Interval<S>> combined = new ArrayList<>(intervals);
        combined.addAll(other.intervals);
        return withIntervals(combined);
    }

    /**
     * Creates a map with this map's intervals followed by {@code other}, resolved the same way as this map.
     */
    public IndexMap<S> combine(@NonNull Interval<S> other) {
        if(other.getKind() != kind) {
            throw new ConfigurationConflictException("Different element kinds: " + kind + " and " + other.getKind());
        }
        List<Interval<S>> combined = new ArrayList<>(intervals);
        combined.add(other);
        return withIntervals(combined);
    }

    @Override
    public String toString() {
        return "IndexMap(" + intervals.stream().map(Interval::toString).collect(Collectors.joining()) + ")";
    }

    private IndexMap<S> withIntervals(List<Interval<S>> combined) {
        if(lookup == null) {
            return new IndexMap<>(combined);
        }
        return new IndexMap<>(combined, lookup.getSymbolToIndex(), lookup.getIndexToSymbol());
    }

    @Synchronized("cacheLock")
    private int lookUpIndex(S symbol) {
        Integer cached = symbolToIndexCache.get(symbol);
        if(cached != null) {
            return cached;
        }
        if(Log.TRACE) { Log.trace(LOG_CATEGORY, "Looking up index of " + kind.describe(symbol) + " in " + this); }
        Integer index = lookup.getSymbolToIndex().apply(symbol);
        if(index == null || !containsIndex(index)) {
            throw new InvalidIndexException(cardinality, index);
        }
        symbolToIndexCache.put(symbol, index);
        return index;
    }

    @Synchronized("cacheLock")
    private S lookUpSymbol(int index) {
        S cached = indexToSymbolCache.get(index);
        if(cached != null) {
            return cached;
        }
        if(Log.TRACE) { Log.trace(LOG_CATEGORY, "Looking up symbol at " + index + " in " + this); }
        S symbol = lookup.getIndexToSymbol().apply(index);
        if(!kind.isSymbol(symbol)) {
            throw new InvalidSymbolException(kind.getName(), index, symbol);
        }
        indexToSymbolCache.put(index, symbol);
        return symbol;
    }

    /**
     * Fills both tables; a symbol seen twice means two intervals overlap.
     */
    private int populate() {
        int index = 0;
        for(int i = 0; i < intervals.size(); i++) {
            Interval<S> interval = intervals.get(i);
            for(S symbol : interval) {
                if(symbolToIndexCache.putIfAbsent(symbol, index) != null) {
                    throw new OverlappingIntervalsException(firstContaining(symbol, i), interval);
                }
                indexToSymbolCache.put(index, symbol);
                index++;
            }
        }
        return index;
    }

    private Interval<S> firstContaining(S symbol, int before) {
        for(int i = 0; i < before; i++) {
            if(intervals.get(i).contains(symbol)) {
                return intervals.get(i);
            }
        }
        return intervals.get(before);
    }

    private static <S> void requireDisjoint(List<Interval<S>> intervals) {
        for(int i = 0; i < intervals.size(); i++) {
            for(int j = 0; j < i; j++) {
                if(intervals.get(i).intersects(intervals.get(j))) {
                    throw new OverlappingIntervalsException(intervals.get(j), intervals.get(i));
                }
            }
        }
    }

    private static <S> int totalLength(List<Interval<S>> intervals) {
        long total = 0;
        for(Interval<S> interval : intervals) {
            total += interval.length();
        }
        // Disjoint intervals of one kind never exceed the kind's code point space
        return Math.toIntExact(total);
    }
}
