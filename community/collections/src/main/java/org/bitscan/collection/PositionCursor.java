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

/**
 * Forward-only cursor over an ascending set of non-negative positions, such as the document ids of a posting list
 * or a deleted-documents mask.
 * <p>
 * A cursor starts {@link CursorState#UNSTARTED UNSTARTED} on {@link #UNSTARTED_POSITION}, moves with {@link #next()}
 * and {@link #advance(long)}, and ends {@link CursorState#EXHAUSTED EXHAUSTED} on {@link #NO_MORE_POSITIONS}.
 * Instances are not thread-safe.
 */
public interface PositionCursor {
    /**
     * Position reported before the first step.
     */
    long UNSTARTED_POSITION = -1;

    /**
     * Position reported once the cursor is exhausted, larger than any real position.
     */
    long NO_MORE_POSITIONS = Long.MAX_VALUE;

    /**
     * Moves to the smallest position strictly greater than the current one.
     *
     * @return the new position, or {@link #NO_MORE_POSITIONS} if there is none.
     */
    long next();

    /**
     * Moves to the smallest position greater than or equal to {@code target}, skipping anything in between.
     * Targets must be non-decreasing across calls on the same cursor.
     *
     * @param target non-negative position to move to.
     * @return the new position, or {@link #NO_MORE_POSITIONS} if there is none.
     * @throws IllegalArgumentException if {@code target} is negative.
     */
    long advance(long target);

    /**
     * @return the last position returned by {@link #next()} or {@link #advance(long)}, {@link #UNSTARTED_POSITION}
     * before the first step. Never moves the cursor.
     */
    long position();

    CursorState state();

    /**
     * Cheap estimate of the remaining work of this cursor, for ordering cursors against each other. Not a count.
     */
    long cost();

    /**
     * Rewinds to {@link CursorState#UNSTARTED}, keeping whatever the cursor reads from.
     */
    void reset();
}
