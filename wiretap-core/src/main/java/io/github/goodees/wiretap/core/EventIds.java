package io.github.goodees.wiretap.core;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.security.SecureRandom;
import java.util.Random;
import java.util.UUID;

/**
 * Generator of time-ordered event ids.
 *
 * <p>Layout follows UUID version 7: 48 bits of unix epoch milliseconds, version nibble, 12 bit counter
 * that keeps ids monotonic within one millisecond of this generator, variant bits and 62 random bits.
 * Comparing the most significant halves as unsigned numbers orders ids by creation time.
 */
public final class EventIds {
    private static final Random random = new SecureRandom();
    private static long lastMillis;
    private static int counter;

    private EventIds() {

    }

    public static UUID next() {
        return next(System.currentTimeMillis());
    }

    static synchronized UUID next(long millis) {
        if (millis > lastMillis) {
            lastMillis = millis;
            counter = 0;
        } else if (++counter > 0xFFF) {
            // counter overflow borrows the next millisecond
            lastMillis++;
            counter = 0;
        }
        long msb = (lastMillis & 0xFFFFFFFFFFFFL) << 16 | 0x7000L | counter;
        long lsb = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }

    /**
     * Extract creation millisecond from an id produced by this generator.
     * @param id the event id
     * @return epoch milliseconds
     */
    public static long timestampOf(UUID id) {
        return id.getMostSignificantBits() >>> 16;
    }

    /**
     * Order ids by creation time, unlike {@link UUID#compareTo(UUID)} which compares signed halves.
     * @param a first id
     * @param b second id
     * @return comparison result
     */
    public static int compare(UUID a, UUID b) {
        int result = Long.compareUnsigned(a.getMostSignificantBits(), b.getMostSignificantBits());
        return result != 0 ? result : Long.compareUnsigned(a.getLeastSignificantBits(), b.getLeastSignificantBits());
    }
}
