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

package org.fireflyframework.sagadispatch.core.observability;

import java.time.Instant;

/**
 * Listener SPI for everything the dispatch core reports. All callbacks default to no-ops
 * so implementations override only what they record.
 */
public interface SagaDispatchEvents {
    // Relevance
    default void onMessageIgnored(String messageType, String messageId) {}
    default void onTimeoutDeferred(String messageType, String messageId, Instant expiresAt) {}

    // Saga lifecycle
    default void onSagaStarted(String sagaType, String sagaId, String messageType) {}
    default void onSagaInvoked(String sagaType, String sagaId, String messageType) {}
    default void onSagaCompleted(String sagaType, String sagaId) {}

    // Unclaimed messages
    default void onSagaNotFound(String messageType, String messageId) {}
    default void onNotFoundHandlerInvoked(String handlerType, String messageType) {}

    // Failures
    default void onDispatchFailed(String messageType, String messageId, Throwable error) {}
}
