/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.wordlist;

import character.range.core.range.BytesRange;
import character.range.core.range.StringRange;
import character.range.core.range.SymbolRange;
import com.esotericsoftware.minlog.Log;
import lombok.Getter;
import lombok.NonNull;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Serves the words of a range as a newline-separated word list. String words are written in UTF-8, byte words as
 * they are.
 *
 * @param <W> the word type
 */
public class RangeWordlistGenerator<W> implements WordlistGenerator<W> {
    public static final String LOG_CATEGORY = "wordlist";

    @Getter
    private final SymbolRange<?, W> range;
    private final Function<W, byte[]> encoder;
    private final long size;

    /**
     * @throws ArithmeticException if the range has more than {@link Long#MAX_VALUE} words
     */
    public RangeWordlistGenerator(@NonNull SymbolRange<?, W> range, @NonNull Function<W, byte[]> encoder) {
        this.range = range;
        this.encoder = encoder;
        this.size = range.length().longValueExact();
    }

    public static RangeWordlistGenerator<String> of(StringRange range) {
        return new RangeWordlistGenerator<>(range, word -> word.getBytes(StandardCharsets.UTF_8));
    }

    public static RangeWordlistGenerator<byte[]> of(BytesRange range) {
        return new RangeWordlistGenerator<>(range, word -> word);
    }

    @Override
    public long getSize() {
        return size;
    }

    @Override
    public void outputWords(long beginIndex, long endIndex, OutputStream os) throws IOException {
        if(beginIndex < 0) throw new IllegalArgumentException("Negative begin index");
        if(beginIndex > endIndex) throw new IllegalArgumentException("begin must be smaller than end");
        if(endIndex > getSize()) throw new IllegalArgumentException("End exceeds size");
        if(beginIndex == endIndex) return;

        Iterator<W> words = range.iterator(BigInteger.valueOf(beginIndex));
        for(long i = beginIndex; i < endIndex; i++) {
            os.write(encoder.apply(words.next()));
            os.write('\n');
        }
    }

    @Override
    public long indexOf(W word) {
        return range.indexOf(word).longValueExact();
    }

    /**
     * Splits the whole word list into consecutive assignments of at most {@code maxSize} words each.
     */
    public List<WordlistAssignment> partition(long maxSize) {
        if(maxSize <= 0) { throw new IllegalArgumentException("Invalid target size " + maxSize); }

        List<WordlistAssignment> assignments = new ArrayList<>();
        for(long begin = 0; begin < size; begin += Math.min(maxSize, size - begin)) {
            assignments.add(new WordlistAssignment(begin, begin + Math.min(maxSize, size - begin)));
        }
        Log.debug(LOG_CATEGORY, "Split " + range + " (" + size + " words) into "
                + assignments.size() + " assignments of up to " + maxSize + " words");
        return assignments;
    }

    /**
     * The first and last word of an assignment, or an empty list for an empty assignment.
     */
    public List<W> boundaries(@NonNull WordlistAssignment assignment) {
        if(assignment.getEndIndex() > size) {
            throw new IllegalArgumentException("Assignment " + assignment + " exceeds size " + size);
        }
        if(assignment.isEmpty()) {
            return List.of();
        }
        return List.of(range.get(BigInteger.valueOf(assignment.getBeginIndex())),
                range.get(BigInteger.valueOf(assignment.getEndIndex() - 1)));
    }
}
