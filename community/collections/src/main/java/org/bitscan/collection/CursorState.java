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
 * Where a {@link PositionCursor} stands, kept next to the numeric position so that the two sentinel
 * positions never have to be told apart by value alone.
 */
public enum CursorState {
    /**
     * Neither {@link PositionCursor#next()} nor {@link PositionCursor#advance(long)} has been called since
     * construction or the last {@link PositionCursor#reset()}.
     */
    UNSTARTED,
    /**
     * The cursor is on a real position.
     */
    POSITIONED,
    /**
     * No more positions. Absorbing until {@link PositionCursor#reset()}.
     */
    EXHAUSTED
}
