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

import org.bitscan.util.FeatureToggles;
import org.neo4j.logging.Log;
import org.neo4j.logging.LogProvider;
import org.neo4j.logging.NullLogProvider;

/**
 * Opens {@link BitScanIterator}s over the words exposed by bit vectors.
 * <p>
 * Checking that {@link PositionCursor#advance(long) advance} targets never move backwards is controlled by the
 * {@code org.bitscan.collection.BitScanCursorFactory.strictAdvance} feature toggle, off by default.
 */
public final class BitScanCursorFactory {
    static final boolean STRICT_ADVANCE = FeatureToggles.flag(BitScanCursorFactory.class, "strictAdvance", false);

    private final Log log;
    private final boolean strictAdvance;

    public BitScanCursorFactory() {
        this(NullLogProvider.getInstance());
    }

    public BitScanCursorFactory(LogProvider logProvider) {
        this(logProvider, STRICT_ADVANCE);
    }

    public BitScanCursorFactory(LogProvider logProvider, boolean strictAdvance) {
        this.log = logProvider.getLog(getClass());
        this.strictAdvance = strictAdvance;
    }

    /**
     * @throws IllegalArgumentException if {@code bits} declares more words than it holds.
     */
    public BitScanIterator open(BitWords bits) {
        long[] words = bits.words();
        int wordCount = bits.wordCount();
        if (words == null || wordCount < 0 || wordCount > words.length) {
            log.error(
                    "Bit vector %s declares %d words but exposes %s",
                    bits,
                    wordCount,
                    words == null ? "no words" : words.length + " words");
        }
        BitScanIterator cursor = new BitScanIterator(words, wordCount, strictAdvance);
        if (log.isDebugEnabled()) {
            log.debug("Opened %s over %d words with cost %d", cursor, wordCount, cursor.cost());
        }
        return cursor;
    }

    public boolean strictAdvance() {
        return strictAdvance;
    }
}
