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

import static java.util.Arrays.copyOf;
import static org.bitscan.util.Preconditions.requireNonNegative;

import java.util.NoSuchElementException;
import org.eclipse.collections.api.iterator.LongIterator;

/**
 * Basic and common {@link PositionCursor} utils.
 */
public final class PositionCursors {
    private PositionCursors() {
        // nop
    }

    /**
     * @return a new cursor without positions, exhausted on its first step.
     */
    public static PositionCursor empty() {
        return new EmptyPositionCursor();
    }

    /**
     * Reference implementation of {@link PositionCursor#advance(long)} that steps with {@link PositionCursor#next()}
     * until it reaches {@code target}. A cursor already at or past {@code target} is not moved.
     *
     * @return the position of {@code cursor} after the call.
     */
    public static long slowAdvance(PositionCursor cursor, long target) {
        requireNonNegative(target);
        long position = cursor.position();
        if (cursor.state() == CursorState.UNSTARTED) {
            position = cursor.next();
        }
        while (position < target) {
            position = cursor.next();
        }
        return position;
    }

    /**
     * {@link LongIterator} view of the positions after the current one. Consuming the iterator moves the cursor.
     */
    public static LongIterator asLongIterator(PositionCursor cursor) {
        return new PositionCursorLongIterator(cursor);
    }

    /**
     * Pulls all positions after the current one into an array, leaving {@code cursor} exhausted.
     */
    public static long[] asArray(PositionCursor cursor) {
        long[] array = new long[8];
        int i = 0;
        for (long position = cursor.next(); position != PositionCursor.NO_MORE_POSITIONS; position = cursor.next()) {
            if (i >= array.length) {
                array = copyOf(array, i << 1);
            }
            array[i++] = position;
        }
        return i < array.length ? copyOf(array, i) : array;
    }

    private static final class PositionCursorLongIterator implements LongIterator {
        private final PositionCursor cursor;
        private boolean hasNextDecided;
        private long next;

        PositionCursorLongIterator(PositionCursor cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            if (!hasNextDecided) {
                next = cursor.next();
                hasNextDecided = true;
            }
            return next != PositionCursor.NO_MORE_POSITIONS;
        }

        @Override
        public long next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more positions in " + cursor);
            }
            hasNextDecided = false;
            return next;
        }
    }

    private static final class EmptyPositionCursor implements PositionCursor {
        private CursorState state = CursorState.UNSTARTED;

        @Override
        public long next() {
            state = CursorState.EXHAUSTED;
            return NO_MORE_POSITIONS;
        }

        @Override
        public long advance(long target) {
            requireNonNegative(target);
            return next();
        }

        @Override
        public long position() {
            return state == CursorState.EXHAUSTED ? NO_MORE_POSITIONS : UNSTARTED_POSITION;
        }

        @Override
        public CursorState state() {
            return state;
        }

        @Override
        public long cost() {
            return 0;
        }

        @Override
        public void reset() {
            state = CursorState.UNSTARTED;
        }

        @Override
        public String toString() {
            return "EmptyPositionCursor[state=" + state + "]";
        }
    }
}
