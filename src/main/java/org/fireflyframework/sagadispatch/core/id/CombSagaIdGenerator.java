/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.sagadispatch.core.id;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates time-ordered ("COMB") UUIDs: the 48 most significant bits hold the Unix epoch
 * millisecond, the remaining bits are random. Ids generated later sort after earlier ones,
 * which keeps index inserts in saga stores append-mostly.
 *
 * <p>The layout follows the version 7 UUID format, so the values are valid UUIDs.
 */
public class CombSagaIdGenerator implements SagaIdGenerator {

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong lastMillis = new AtomicLong();

    public CombSagaIdGenerator() {
        this(Clock.systemUTC());
    }

    public CombSagaIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String generate() {
        return nextUuid().toString();
    }

    UUID nextUuid() {
        long millis = monotonicMillis();
        long msb = (millis << 16) | 0x7000L | (random.nextInt() & 0x0FFFL);
        long lsb = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }

    // clock going backwards must not break ordering
    private long monotonicMillis() {
        long now = clock.millis() & 0xFFFFFFFFFFFFL;
        return lastMillis.accumulateAndGet(now, Math::max);
    }
}
