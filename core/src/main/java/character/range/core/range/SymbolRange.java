/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.range;

import character.range.core.errors.InvalidDirectionException;
import character.range.core.errors.InvalidEndpointsException;
import character.range.core.map.IndexMap;
import character.range.core.map.SymbolKind;
import com.esotericsoftware.minlog.Log;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The inclusive sequence of words between two endpoints, where each position of a word is a symbol of an
 * {@link IndexMap}. Words are enumerated like the numbers of a base-{@code cardinality} odometer that grows a digit
 * on overflow: every word of the start's length from the start onwards, then every word of each following length,
 * then the words of the end's length up to the end.
 * <pre>
 *     "0" to "19" over 0-9:  0 1 ... 9 00 01 ... 09 10 ... 19
 * </pre>
 * Ranges are immutable. Each iteration owns its own cursor, so a range may be iterated any number of times, also
 * from several threads at once.
 *
 * @param <S> the symbol type
 * @param <W> the word type, made of symbols
 */
public abstract class SymbolRange<S, W> implements Iterable<W> {
    public static final String LOG_CATEGORY = "range";

    private final W start, end;
    @Getter
    private final IndexMap<S> map;
    private final PositionalCounter first, last;

    /**
     * @throws InvalidEndpointsException if an endpoint is empty or holds a symbol that is not in {@code map}
     * @throws InvalidDirectionException if {@code start} comes after {@code end}
     */
    protected SymbolRange(@NonNull W start, @NonNull W end, @NonNull IndexMap<S> map) {
        this.map = map;
        Optional<PositionalCounter> startCounter = toCounter(split(start));
        Optional<PositionalCounter> endCounter = toCounter(split(end));
        if(startCounter.isEmpty() || endCounter.isEmpty()) {
            throw new InvalidEndpointsException(describe(start), describe(end));
        }
        // Shorter words always come first, words of equal length compare by map index
        if(startCounter.get().compareTo(endCounter.get()) > 0) {
            throw new InvalidDirectionException(describe(start), describe(end));
        }
        this.start = copy(start);
        this.end = copy(end);
        this.first = startCounter.get();
        this.last = endCounter.get();
        if(Log.TRACE) { Log.trace(LOG_CATEGORY, "Created " + this + " over " + map); }
    }

    /**
     * Splits a word into its symbols.
     */
    protected abstract List<S> split(W word);

    /**
     * Assembles a word from its symbols.
     */
    protected abstract W join(List<S> symbols);

    protected abstract W copy(W word);

    protected abstract String describe(W word);

    public W getStart() {
        return copy(start);
    }

    public W getEnd() {
        return copy(end);
    }

    public SymbolKind<S> getKind() {
        return map.getKind();
    }

    /**
     * The number of words in the range, computed without enumerating them:
     * <pre>
     *     sum(base^w for w in [len(start), len(end))) + value(end) - value(start) + 1
     * </pre>
     */
    public BigInteger length() {
        return offsetOf(last).add(BigInteger.ONE);
    }

    /**
     * Returns the word at a 0-based position, without enumerating the words before it.
     */
    public W get(@NonNull BigInteger position) {
        return render(counterAt(position));
    }

    /**
     * Returns the 0-based position of a word.
     *
     * @throws IllegalArgumentException if the word is not part of this range
     */
    public BigInteger indexOf(@NonNull W word) {
        return locate(word).map(this::offsetOf).orElseThrow(() ->
                new IllegalArgumentException("Word " + describe(word) + " is not in " + this));
    }

    public boolean contains(W word) {
        return word != null && locate(word).isPresent();
    }

    /**
     * A fresh cursor over every word, from the start through the end.
     */
    @Override
    public Iterator<W> iterator() {
        return new Cursor(first.copy());
    }

    /**
     * A fresh cursor starting at the word at {@code position}.
     */
    public Iterator<W> iterator(@NonNull BigInteger position) {
        return new Cursor(counterAt(position));
    }

    public Stream<W> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + describe(start) + ", " + describe(end) + ")";
    }

    private Optional<PositionalCounter> toCounter(List<S> symbols) {
        if(symbols.isEmpty()) {
            return Optional.empty();
        }
        int[] digits = new int[symbols.size()];
        for(int i = 0; i < digits.length; i++) {
            S symbol = symbols.get(i);
            if(!map.contains(symbol)) {
                return Optional.empty();
            }
            digits[i] = map.symbolToIndex(symbol);
        }
        return Optional.of(new PositionalCounter(digits, map.cardinality()));
    }

    private Optional<PositionalCounter> locate(W word) {
        return toCounter(split(word))
                .filter(counter -> counter.compareTo(first) >= 0 && counter.compareTo(last) <= 0);
    }

    /**
     * How many words come before {@code counter}, counted from the start.
     */
    private BigInteger offsetOf(PositionalCounter counter) {
        BigInteger base = BigInteger.valueOf(map.cardinality());
        BigInteger shorterWords = BigInteger.ZERO;
        for(int width = first.digitCount(); width < counter.digitCount(); width++) {
            shorterWords = shorterWords.add(base.pow(width));
        }
        return shorterWords.add(counter.toBigInteger()).subtract(first.toBigInteger());
    }

    private PositionalCounter counterAt(BigInteger position) {
        if(position.signum() < 0 || position.compareTo(length()) >= 0) {
            throw new IndexOutOfBoundsException("Position " + position + " is out of range for " + this);
        }
        BigInteger base = BigInteger.valueOf(map.cardinality());
        BigInteger value = first.toBigInteger().add(position);
        int width = first.digitCount();
        BigInteger wordsOfWidth = base.pow(width);
        while(value.compareTo(wordsOfWidth) >= 0) {
            value = value.subtract(wordsOfWidth);
            width++;
            wordsOfWidth = base.pow(width);
        }
        return PositionalCounter.of(value, width, map.cardinality());
    }

    private W render(PositionalCounter counter) {
        List<S> symbols = new ArrayList<>(counter.digitCount());
        for(int i = 0; i < counter.digitCount(); i++) {
            symbols.add(map.indexToSymbol(counter.digitAt(i)));
        }
        return join(symbols);
    }

    private final class Cursor implements Iterator<W> {
        private final PositionalCounter current;

        private Cursor(PositionalCounter current) {
            this.current = current;
        }

        @Override
        public boolean hasNext() {
            return current.compareTo(last) <= 0;
        }

        @Override
        public W next() {
            if(!hasNext()) {
                throw new NoSuchElementException("Iterated past the end of " + SymbolRange.this);
            }
            W word = render(current);
            current.increment();
            return word;
        }
    }
}
