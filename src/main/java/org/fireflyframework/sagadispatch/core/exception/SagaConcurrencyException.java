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

package org.fireflyframework.sagadispatch.core.exception;

import java.util.Map;

/**
 * Raised by a persister when a write conflicts with a concurrent dispatch for the same
 * saga entity: a second create for an existing id, or an update or completion against a
 * stale version.
 */
public final class SagaConcurrencyException extends SagaDispatchException {

    private final String sagaId;

    public SagaConcurrencyException(String sagaId, String message) {
        super("Saga '" + sagaId + "': " + message, "SAGA_CONCURRENCY_CONFLICT",
                Map.of("sagaId", sagaId), null);
        this.sagaId = sagaId;
    }

    public String getSagaId() {
        return sagaId;
    }
}
