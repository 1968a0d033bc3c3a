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

import java.util.Objects;
import java.util.Optional;

/**
 * The role an inbound message plays for the dispatch core, resolved once per dispatch.
 */
public sealed interface MessageKind {

    /**
     * The explicit saga id carried by the message, if any. Blank ids count as absent.
     */
    Optional<String> correlationId();

    static MessageKind of(Object message) {
        Objects.requireNonNull(message, "message");
        if (message instanceof TimeoutMessage<?> envelope) {
            boolean typed = envelope.getStateType() != null;
            Class<?> payloadType = typed ? envelope.getStateType() : envelope.getState().getClass();
            return new Timeout(envelope, envelope.getState(), payloadType, typed, envelope.getSagaId());
        }
        if (message instanceof TimeoutNotification notification) {
            String sagaId = message instanceof SagaMessage correlated ? correlated.getSagaId() : null;
            return new Timeout(notification, message, message.getClass(), false, sagaId);
        }
        if (message instanceof SagaMessage correlated) {
            return new Correlated(correlated.getSagaId());
        }
        return new Plain();
    }

    private static Optional<String> present(String id) {
        return id == null || id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    record Plain() implements MessageKind {
        @Override
        public Optional<String> correlationId() {
            return Optional.empty();
        }
    }

    record Correlated(String sagaId) implements MessageKind {
        @Override
        public Optional<String> correlationId() {
            return present(sagaId);
        }
    }

    /**
     * @param staticallyTyped whether {@code payloadType} was declared by the sender rather
     *                        than taken from the payload's runtime class
     */
    record Timeout(TimeoutNotification notification, Object payload, Class<?> payloadType,
                   boolean staticallyTyped, String sagaId) implements MessageKind {
        @Override
        public Optional<String> correlationId() {
            return present(sagaId);
        }
    }
}
