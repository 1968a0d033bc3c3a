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

package org.fireflyframework.sagadispatch.saga.model;

import java.time.Clock;
import java.time.Instant;

/**
 * A message signalling that a delay requested by a saga has elapsed. Notifications that
 * arrive before {@link #getExpiresAt()} are handed back to the transport for later delivery.
 */
public interface TimeoutNotification {

    Instant getExpiresAt();

    default boolean hasExpired(Clock clock) {
        Instant expiresAt = getExpiresAt();
        return expiresAt == null || !clock.instant().isBefore(expiresAt);
    }
}
