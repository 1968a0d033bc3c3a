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

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeSagaDispatchEvents implements SagaDispatchEvents {
    private final List<SagaDispatchEvents> delegates;

    public CompositeSagaDispatchEvents(List<SagaDispatchEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<SagaDispatchEvents> getDelegates() {
        return delegates;
    }

    private void safeForEach(Consumer<SagaDispatchEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onMessageIgnored(String messageType, String messageId) { safeForEach(d -> d.onMessageIgnored(messageType, messageId)); }
    @Override public void onTimeoutDeferred(String messageType, String messageId, Instant expiresAt) { safeForEach(d -> d.onTimeoutDeferred(messageType, messageId, expiresAt)); }
    @Override public void onSagaStarted(String sagaType, String sagaId, String messageType) { safeForEach(d -> d.onSagaStarted(sagaType, sagaId, messageType)); }
    @Override public void onSagaInvoked(String sagaType, String sagaId, String messageType) { safeForEach(d -> d.onSagaInvoked(sagaType, sagaId, messageType)); }
    @Override public void onSagaCompleted(String sagaType, String sagaId) { safeForEach(d -> d.onSagaCompleted(sagaType, sagaId)); }
    @Override public void onSagaNotFound(String messageType, String messageId) { safeForEach(d -> d.onSagaNotFound(messageType, messageId)); }
    @Override public void onNotFoundHandlerInvoked(String handlerType, String messageType) { safeForEach(d -> d.onNotFoundHandlerInvoked(handlerType, messageType)); }
    @Override public void onDispatchFailed(String messageType, String messageId, Throwable error) { safeForEach(d -> d.onDispatchFailed(messageType, messageId, error)); }
}
