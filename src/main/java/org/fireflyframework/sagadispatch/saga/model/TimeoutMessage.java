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

import java.time.Instant;
import java.util.Objects;

/**
 * Generic timeout envelope carrying the state a saga attached when it requested the timeout.
 *
 * <p>Envelopes created with {@link #of(String, Instant, Class, Object)} declare the state type
 * and are routed to the handler for exactly that type. Envelopes created with
 * {@link #untyped(String, Instant, Object)} are routed by the runtime class of the state.
 */
public final class TimeoutMessage<T> implements SagaMessage, TimeoutNotification {

    private final String sagaId;
    private final Instant expiresAt;
    private final Class<T> stateType;
    private final T state;

    private TimeoutMessage(String sagaId, Instant expiresAt, Class<T> stateType, T state) {
        this.sagaId = sagaId;
        this.expiresAt = expiresAt;
        this.stateType = stateType;
        this.state = state;
    }

    public static <T> TimeoutMessage<T> of(String sagaId, Instant expiresAt, Class<T> stateType, T state) {
        Objects.requireNonNull(stateType, "stateType");
        if (state != null && !stateType.isInstance(state)) {
            throw new IllegalArgumentException("State " + state.getClass().getName() + " is not a " + stateType.getName());
        }
        return new TimeoutMessage<>(sagaId, expiresAt, stateType, state);
    }

    public static TimeoutMessage<Object> untyped(String sagaId, Instant expiresAt, Object state) {
        Objects.requireNonNull(state, "state");
        return new TimeoutMessage<>(sagaId, expiresAt, null, state);
    }

    @Override
    public String getSagaId() {
        return sagaId;
    }

    @Override
    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * The declared state type, or {@code null} when the envelope is untyped.
     */
    public Class<T> getStateType() {
        return stateType;
    }

    public T getState() {
        return state;
    }

    @Override
    public String toString() {
        return "TimeoutMessage[sagaId=" + sagaId + ", expiresAt=" + expiresAt
                + ", stateType=" + (stateType != null ? stateType.getName() : "<runtime>") + "]";
    }
}
