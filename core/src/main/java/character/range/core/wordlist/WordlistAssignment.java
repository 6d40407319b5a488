/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.wordlist;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Locale;

/**
 * The half-open slice [beginIndex, endIndex) of a word list.
 */
@Getter
@EqualsAndHashCode
public class WordlistAssignment implements Comparable<WordlistAssignment> {
    private final long beginIndex, endIndex;

    public WordlistAssignment(@JsonProperty("beginIndex") long beginIndex, @JsonProperty("endIndex") long endIndex) {
        if(beginIndex < 0) {
            throw new IllegalArgumentException("Negative begin index " + beginIndex);
        }
        if (beginIndex > endIndex) {
            throw new IllegalArgumentException("Begin index " + beginIndex
                    + " is after end index " + endIndex);
        }
        this.beginIndex = beginIndex;
        this.endIndex = endIndex;
    }

    public boolean overlaps(@NonNull WordlistAssignment other) {
        return this.beginIndex < other.endIndex && this.endIndex > other.beginIndex;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return beginIndex == endIndex;
    }

    public long size() {
        return endIndex - beginIndex;
    }

    @Override
    public int compareTo(WordlistAssignment o) {
        return beginIndex != o.beginIndex ?
                Long.compare(beginIndex, o.beginIndex)
                : Long.compare(endIndex, o.endIndex);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "[%,d; %,d)", beginIndex, endIndex).replace(',', '.');
    }
}
