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
 * Lookup from a byte to the ascending list of its set bit positions, packed into an {@code int}.
 * <p>
 * Each position occupies a 4-bit slot, lowest position in the lowest slot. Slot values are one-based
 * ({@code bit index + 1}) so that a packed value of {@code 0} means that every position has been consumed.
 * A byte with all eight bits set packs to {@code 0x87654321}.
 */
public final class BitPositionTable {
    private static final int SLOT_BITS = 4;
    private static final int SLOT_MASK = 0x0F;

    private static final int[] POSITIONS = new int[256];

    static {
        for (int b = 1; b < POSITIONS.length; b++) {
            int packed = 0;
            int slot = 0;
            for (int bit = 0; bit < Byte.SIZE; bit++) {
                if ((b & (1 << bit)) != 0) {
                    packed |= (bit + 1) << (slot++ * SLOT_BITS);
                }
            }
            POSITIONS[b] = packed;
        }
    }

    private BitPositionTable() {
        throw new AssertionError("no instances");
    }

    /**
     * @param b byte value, only the lowest 8 bits are considered.
     * @return the packed one-based positions of the set bits in {@code b}, {@code 0} if no bit is set.
     */
    public static int positions(int b) {
        return POSITIONS[b & 0xFF];
    }

    public static int lowestSlot(int packed) {
        return packed & SLOT_MASK;
    }

    public static int dropLowestSlot(int packed) {
        return packed >>> SLOT_BITS;
    }
}
