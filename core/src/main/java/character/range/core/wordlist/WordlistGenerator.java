/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.wordlist;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A finite, ordered list of words addressed by 0-based position, written out one word per line. Positions are
 * {@code long}s, so a list can be cut into {@link WordlistAssignment}s and each slice written on its own.
 *
 * @param <W> the word type
 */
public interface WordlistGenerator<W> {
    /**
     * The number of words; valid positions are 0 up to this value, exclusive.
     */
    long getSize();

    /**
     * Writes the words at positions {@code beginIndex} (inclusive) to {@code endIndex} (exclusive), each terminated
     * by {@code '\n'}. Nothing is written when both are equal.
     *
     * @throws IllegalArgumentException if the positions are negative, reversed or past {@link #getSize()}
     */
    void outputWords(long beginIndex, long endIndex, OutputStream os) throws IOException;

    /**
     * The position of {@code word}; writing the slice from there to the next position yields that word.
     *
     * @throws IllegalArgumentException if the list does not contain the word
     */
    long indexOf(W word);
}
