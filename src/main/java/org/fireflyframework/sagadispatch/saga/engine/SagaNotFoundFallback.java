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

package org.fireflyframework.sagadispatch.saga.engine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.bus.BusContext;
import org.fireflyframework.sagadispatch.core.observability.SagaDispatchEvents;
import org.springframework.util.ClassUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Hands unclaimed messages to every registered {@link SagaNotFoundHandler}, one after the
 * other and in registration order. Handler failures abort the remaining handlers and
 * propagate to the caller.
 */
@Slf4j
public class SagaNotFoundFallback {

    private final List<SagaNotFoundHandler> handlers;
    private final BusContext busContext;
    private final SagaDispatchEvents events;

    public SagaNotFoundFallback(List<SagaNotFoundHandler> handlers, BusContext busContext,
                                SagaDispatchEvents events) {
        this.handlers = List.copyOf(handlers);
        this.busContext = busContext;
        this.events = events;
    }

    public Mono<Void> handle(Object message) {
        return Mono.defer(() -> {
            String messageType = message.getClass().getName();
            events.onSagaNotFound(messageType, busContext.currentMessageId());
            return Flux.fromIterable(handlers)
                    .concatMap(handler -> {
                        events.onNotFoundHandlerInvoked(ClassUtils.getUserClass(handler).getName(), messageType);
                        return handler.handle(message);
                    })
                    .then();
        });
    }

    public List<SagaNotFoundHandler> getHandlers() {
        return handlers;
    }
}
