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

import static org.assertj.core.api.Assertions.assertThat;
import static org.bitscan.collection.BitPositionTable.dropLowestSlot;
import static org.bitscan.collection.BitPositionTable.lowestSlot;
import static org.bitscan.collection.BitPositionTable.positions;

import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.junit.jupiter.api.Test;

class BitPositionTableTest {
    @Test
    void shouldHaveNoPositionsForZero() {
        assertThat(positions(0)).isZero();
    }

    @Test
    void shouldPackOneBasedPositionsLowestFirst() {
        assertThat(positions(0b0000_0001)).isEqualTo(0x1);
        assertThat(positions(0b1000_0000)).isEqualTo(0x8);
        assertThat(positions(0b0000_1010)).isEqualTo(0x42);
        assertThat(positions(0xFF)).isEqualTo(0x87654321);
    }

    @Test
    void shouldOnlyConsiderLowestByte() {
        assertThat(positions(0x10A)).isEqualTo(positions(0x0A));
        assertThat(positions(-1)).isEqualTo(positions(0xFF));
    }

    @Test
    void shouldListEverySetBitOfEveryByteInAscendingOrder() {
        for (int b = 1; b < 256; b++) {
            IntArrayList expected = new IntArrayList();
            for (int bit = 0; bit < 8; bit++) {
                if ((b & (1 << bit)) != 0) {
                    expected.add(bit);
                }
            }

            IntArrayList actual = new IntArrayList();
            for (int packed = positions(b); packed != 0; packed = dropLowestSlot(packed)) {
                assertThat(lowestSlot(packed)).as("slot of byte %d", b).isBetween(1, 8);
                actual.add(lowestSlot(packed) - 1);
            }

            assertThat(actual).as("positions of byte %d", b).isEqualTo(expected);
        }
    }
}
