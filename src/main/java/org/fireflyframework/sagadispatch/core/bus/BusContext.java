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

package org.fireflyframework.sagadispatch.core.bus;

import reactor.core.publisher.Mono;

/**
 * View of the transport's current message, supplied by the bus that drives the dispatch.
 * Implementations are expected to be bound to the message being processed on the calling
 * worker.
 */
public interface BusContext {

    /**
     * Reply-to address of the message being dispatched; stored as the originator of new sagas.
     */
    String currentReplyTo();

    String currentMessageId();

    /**
     * Asks the transport to deliver the current message again later.
     */
    Mono<Void> deferCurrentMessage();

    /**
     * Cancels every outstanding timeout requested by the saga with the given id.
     * Must be safe to call for sagas that never requested one.
     */
    Mono<Void> cancelTimeoutsFor(String sagaId);
}
