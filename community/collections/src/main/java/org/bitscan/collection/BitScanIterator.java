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

import static org.bitscan.collection.BitPositionTable.dropLowestSlot;
import static org.bitscan.collection.BitPositionTable.lowestSlot;
import static org.bitscan.util.Preconditions.checkArgument;
import static org.bitscan.util.Preconditions.requireNonNegative;
import static org.bitscan.util.Preconditions.requireWordCount;

/**
 * {@link PositionCursor} over the set bits of a {@code long[]} bit vector, in ascending order.
 * <p>
 * The current word is kept in a register. The lowest non-zero byte of the register is found with a binary search
 * over 32, 16 and 8 bit halves, and its set bits are then read from {@link BitPositionTable} one at a time before
 * the register is shifted on or refilled from the next non-empty word. This is considerably faster than testing
 * bits one by one, especially for dense vectors.
 * <p>
 * The words are borrowed, never copied, and must not change while the cursor is in use.
 */
public class BitScanIterator implements PositionCursor {
    private final long[] words;
    private final int wordCount;
    private final boolean strictAdvance;

    private int wordIndex = -1;
    private long word;
    // position of the register's bit 0 within the word, minus one for the one-based table slots
    private int wordShift;
    private int pending;
    private long position = UNSTARTED_POSITION;
    private CursorState state = CursorState.UNSTARTED;

    public BitScanIterator(BitWords bits) {
        this(bits.words(), bits.wordCount());
    }

    public BitScanIterator(long[] words, int wordCount) {
        this(words, wordCount, false);
    }

    /**
     * @param strictAdvance whether {@link #advance(long)} rejects targets below the current position.
     */
    public BitScanIterator(long[] words, int wordCount, boolean strictAdvance) {
        this.wordCount = requireWordCount(words, wordCount);
        this.words = words;
        this.strictAdvance = strictAdvance;
    }

    @Override
    public long next() {
        if (state == CursorState.EXHAUSTED) {
            return NO_MORE_POSITIONS;
        }
        if (pending == 0) {
            if (word != 0) {
                word >>>= 8;
                wordShift += 8;
            }
            while (word == 0) {
                if (++wordIndex >= wordCount) {
                    return exhaust();
                }
                word = words[wordIndex];
                wordShift = -1;
            }
            scanLowestByte();
        }
        return emit();
    }

    @Override
    public long advance(long target) {
        requireNonNegative(target);
        if (state == CursorState.EXHAUSTED) {
            return NO_MORE_POSITIONS;
        }
        if (strictAdvance) {
            checkArgument(target >= position, "Cannot advance backwards from %d to %d", position, target);
        }
        pending = 0;
        long targetWord = target >>> 6;
        if (targetWord >= wordCount) {
            return exhaust();
        }
        wordIndex = (int) targetWord;
        wordShift = (int) (target & 0x3F);
        word = words[wordIndex] >>> wordShift;
        if (word != 0) {
            wordShift--;
        } else {
            while (word == 0) {
                if (++wordIndex >= wordCount) {
                    return exhaust();
                }
                word = words[wordIndex];
            }
            wordShift = -1;
        }
        scanLowestByte();
        return emit();
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public CursorState state() {
        return state;
    }

    @Override
    public long cost() {
        return wordCount / 64;
    }

    @Override
    public void reset() {
        wordIndex = -1;
        word = 0;
        wordShift = 0;
        pending = 0;
        position = UNSTARTED_POSITION;
        state = CursorState.UNSTARTED;
    }

    /**
     * Shifts the non-zero register down to its lowest non-zero byte and loads that byte's positions.
     */
    private void scanLowestByte() {
        if ((int) word == 0) {
            wordShift += 32;
            word >>>= 32;
        }
        if ((word & 0x0000FFFF) == 0) {
            wordShift += 16;
            word >>>= 16;
        }
        if ((word & 0x000000FF) == 0) {
            wordShift += 8;
            word >>>= 8;
        }
        pending = BitPositionTable.positions((int) word);
    }

    private long emit() {
        int bitIndex = lowestSlot(pending) + wordShift;
        pending = dropLowestSlot(pending);
        state = CursorState.POSITIONED;
        return position = ((long) wordIndex << 6) + bitIndex;
    }

    private long exhaust() {
        wordIndex = wordCount;
        word = 0;
        pending = 0;
        state = CursorState.EXHAUSTED;
        return position = NO_MORE_POSITIONS;
    }

    @Override
    public String toString() {
        return "BitScanIterator[state=" + state + ", position=" + position + ", wordCount=" + wordCount + "]";
    }
}
