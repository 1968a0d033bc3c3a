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

@Slf4j
public class SagaDispatchLoggerEvents implements SagaDispatchEvents {
    @Override
    public void onMessageIgnored(String messageType, String messageId) {
        log.trace("[saga-dispatch] message.ignored messageType={} messageId={}", messageType, messageId);
    }
    @Override
    public void onTimeoutDeferred(String messageType, String messageId, Instant expiresAt) {
        log.info("[saga-dispatch] timeout.deferred messageType={} messageId={} expiresAt={}", messageType, messageId, expiresAt);
    }
    @Override
    public void onSagaStarted(String sagaType, String sagaId, String messageType) {
        log.info("[saga-dispatch] saga.started sagaType={} sagaId={} messageType={}", sagaType, sagaId, messageType);
    }
    @Override
    public void onSagaInvoked(String sagaType, String sagaId, String messageType) {
        log.debug("[saga-dispatch] saga.invoked sagaType={} sagaId={} messageType={}", sagaType, sagaId, messageType);
    }
    @Override
    public void onSagaCompleted(String sagaType, String sagaId) {
        log.debug("[saga-dispatch] {} {} has completed.", sagaType, sagaId);
    }
    @Override
    public void onSagaNotFound(String messageType, String messageId) {
        log.info("[saga-dispatch] Could not find a saga for the message type {} with id {}. Going to invoke saga-not-found handlers.",
                messageType, messageId);
    }
    @Override
    public void onNotFoundHandlerInvoked(String handlerType, String messageType) {
        log.debug("[saga-dispatch] Invoking saga-not-found handler: {} messageType={}", handlerType, messageType);
    }
    @Override
    public void onDispatchFailed(String messageType, String messageId, Throwable error) {
        log.error("[saga-dispatch] dispatch.failed messageType={} messageId={} error={}", messageType, messageId, error.getMessage());
    }
}
