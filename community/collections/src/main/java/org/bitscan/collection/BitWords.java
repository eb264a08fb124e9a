/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * This file is part of Neo4j.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package org.bitscan.collection;

import static org.bitscan.util.Preconditions.requireWordCount;

/**
 * Read-only view of the words backing a bit vector. Word {@code w} holds positions {@code [64w, 64w + 63]},
 * bit {@code b} of that word being position {@code 64w + b}.
 * <p>
 * The owner of the words guarantees that they are not modified while any cursor reads them.
 */
public interface BitWords {
    /**
     * @return the backing words, not a copy. May be longer than {@link #wordCount()}.
     */
    long[] words();

    /**
     * @return the number of valid words at the start of {@link #words()}.
     */
    int wordCount();

    static BitWords of(long[] words, int wordCount) {
        requireWordCount(words, wordCount);
        return new BitWords() {
            @Override
            public long[] words() {
                return words;
            }

            @Override
            public int wordCount() {
                return wordCount;
            }

            @Override
            public String toString() {
                return "BitWords[wordCount=" + wordCount + "]";
            }
        };
    }
}
