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
import org.fireflyframework.sagadispatch.core.id.SagaIdGenerator;
import org.fireflyframework.sagadispatch.core.observability.SagaDispatchEvents;
import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.saga.builder.SagaInstanceBuilder;
import org.fireflyframework.sagadispatch.saga.finder.SagaFinder;
import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.MessageKind;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.registry.SagaFinderDefinition;
import org.fireflyframework.sagadispatch.saga.registry.SagaRegistry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the saga infrastructure for one inbound message.
 *
 * <p>A dispatch runs every finder registered for the message type in order. A finder that
 * locates an entity gets the owning saga invoked with it; a finder that locates nothing may
 * start a new saga run when the message type starts one. Each entity is invoked at most
 * once and each saga type started at most once per dispatch. After the handler ran the
 * entity is created, updated or completed depending on the saga's state, and completed
 * sagas have their outstanding timeouts cancelled. Messages claimed by no saga go to the
 * {@link SagaNotFoundFallback}.
 *
 * <p>Timeouts that have not expired yet are handed back to the transport for later
 * delivery without touching any saga.
 */
@Slf4j
public class SagaDispatchOrchestrator {

    private final SagaRegistry registry;
    private final SagaPersister persister;
    private final BusContext busContext;
    private final SagaInstanceBuilder instanceBuilder;
    private final SagaIdGenerator idGenerator;
    private final SagaTimeoutDispatcher timeoutDispatcher;
    private final SagaNotFoundFallback notFoundFallback;
    private final SagaDispatchEvents events;
    private final Clock clock;

    public SagaDispatchOrchestrator(SagaRegistry registry, SagaPersister persister, BusContext busContext,
                                    SagaInstanceBuilder instanceBuilder, SagaIdGenerator idGenerator,
                                    SagaTimeoutDispatcher timeoutDispatcher, SagaNotFoundFallback notFoundFallback,
                                    SagaDispatchEvents events) {
        this(registry, persister, busContext, instanceBuilder, idGenerator, timeoutDispatcher, notFoundFallback,
                events, Clock.systemUTC());
    }

    public SagaDispatchOrchestrator(SagaRegistry registry, SagaPersister persister, BusContext busContext,
                                    SagaInstanceBuilder instanceBuilder, SagaIdGenerator idGenerator,
                                    SagaTimeoutDispatcher timeoutDispatcher, SagaNotFoundFallback notFoundFallback,
                                    SagaDispatchEvents events, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.persister = Objects.requireNonNull(persister, "persister");
        this.busContext = Objects.requireNonNull(busContext, "busContext");
        this.instanceBuilder = Objects.requireNonNull(instanceBuilder, "instanceBuilder");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.timeoutDispatcher = Objects.requireNonNull(timeoutDispatcher, "timeoutDispatcher");
        this.notFoundFallback = Objects.requireNonNull(notFoundFallback, "notFoundFallback");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Mono<Void> dispatch(Object message) {
        Objects.requireNonNull(message, "message");
        Class<?> messageType = message.getClass();
        return Mono.defer(() -> {
            MessageKind kind = MessageKind.of(message);

            if (kind instanceof MessageKind.Timeout timeout && !timeout.notification().hasExpired(clock)) {
                events.onTimeoutDeferred(messageType.getName(), busContext.currentMessageId(),
                        timeout.notification().getExpiresAt());
                return busContext.deferCurrentMessage();
            }
            if (!needToHandle(kind, messageType)) {
                events.onMessageIgnored(messageType.getName(), busContext.currentMessageId());
                return Mono.empty();
            }

            DispatchScope scope = new DispatchScope();
            return Flux.fromIterable(registry.findersFor(messageType))
                    .concatMap(finder -> dispatchThroughFinder(finder, message, kind, scope))
                    .then(Mono.defer(() -> scope.hasHandledAny()
                            ? Mono.<Void>empty()
                            : notFoundFallback.handle(message)));
        }).doOnError(e -> events.onDispatchFailed(messageType.getName(), busContext.currentMessageId(), e));
    }

    private boolean needToHandle(MessageKind kind, Class<?> messageType) {
        if (kind instanceof MessageKind.Correlated || kind instanceof MessageKind.Timeout) {
            return true;
        }
        return registry.isSagaRelevant(messageType);
    }

    @SuppressWarnings("unchecked")
    private Mono<Void> dispatchThroughFinder(SagaFinderDefinition finder, Object message, MessageKind kind,
                                             DispatchScope scope) {
        SagaFinder<SagaEntity, Object> lookup = (SagaFinder<SagaEntity, Object>) finder.finder();
        return Mono.defer(() -> lookup.find(message))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> found
                        .map(entity -> invokeExisting(entity, message, kind, scope))
                        .orElseGet(() -> startNew(finder, message, kind, scope)));
    }

    private Mono<Void> invokeExisting(SagaEntity entity, Object message, MessageKind kind, DispatchScope scope) {
        if (scope.isHandled(entity)) {
            log.debug("[saga-dispatch] Entity already invoked in this dispatch: entity={} id={}",
                    entity.getClass().getSimpleName(), entity.getId());
            return Mono.empty();
        }
        Class<? extends SagaInstance<?>> sagaType = registry.sagaTypeForEntityType(entity.getClass());
        return invoke(sagaType, entity, true, message, kind, scope);
    }

    private Mono<Void> startNew(SagaFinderDefinition finder, Object message, MessageKind kind, DispatchScope scope) {
        Optional<Class<? extends SagaInstance<?>>> toStart = registry.sagaTypeToStart(message.getClass(), finder);
        if (toStart.isEmpty()) {
            return Mono.empty();
        }
        Class<? extends SagaInstance<?>> sagaType = toStart.get();
        if (scope.isStarted(sagaType)) {
            log.debug("[saga-dispatch] Saga already started in this dispatch: saga={}", sagaType.getSimpleName());
            return Mono.empty();
        }
        scope.markStarted(sagaType);

        SagaEntity entity = registry.newEntity(sagaType);
        String sagaId = kind.correlationId().orElseGet(idGenerator::generate);
        entity.assignIdentity(sagaId, busContext.currentReplyTo(), busContext.currentMessageId());
        events.onSagaStarted(sagaType.getName(), sagaId, message.getClass().getName());
        return invoke(sagaType, entity, false, message, kind, scope);
    }

    @SuppressWarnings("unchecked")
    private Mono<Void> invoke(Class<? extends SagaInstance<?>> sagaType, SagaEntity entity, boolean persistent,
                              Object message, MessageKind kind, DispatchScope scope) {
        SagaInstance<SagaEntity> saga = (SagaInstance<SagaEntity>) instanceBuilder.build(sagaType);
        saga.bindEntity(entity);
        return haveSagaHandleMessage(sagaType, saga, message, kind, persistent)
                .then(Mono.fromRunnable(() -> {
                    scope.markHandled(entity);
                    scope.markStarted(sagaType);
                }));
    }

    private Mono<Void> haveSagaHandleMessage(Class<? extends SagaInstance<?>> sagaType, SagaInstance<SagaEntity> saga,
                                             Object message, MessageKind kind, boolean persistent) {
        events.onSagaInvoked(sagaType.getName(), saga.getEntity().getId(), message.getClass().getName());
        Mono<Void> handling = kind instanceof MessageKind.Timeout timeout
                ? timeoutDispatcher.dispatchTimeout(saga, timeout)
                : callHandler(sagaType, saga, message);
        return handling.then(Mono.defer(() -> persist(sagaType, saga, persistent)));
    }

    @SuppressWarnings("unchecked")
    private Mono<Void> callHandler(Class<?> sagaType, SagaInstance<SagaEntity> saga, Object message) {
        Optional<SagaMessageHandler<?, ?>> handler = registry.handlerFor(sagaType, message.getClass());
        if (handler.isEmpty()) {
            log.debug("[saga-dispatch] Saga {} has no handler for {}", sagaType.getSimpleName(),
                    message.getClass().getSimpleName());
            return Mono.empty();
        }
        SagaMessageHandler<Object, Object> invoker = (SagaMessageHandler<Object, Object>) handler.get();
        return Mono.defer(() -> invoker.handle(saga, message));
    }

    private Mono<Void> persist(Class<?> sagaType, SagaInstance<SagaEntity> saga, boolean persistent) {
        SagaEntity entity = saga.getEntity();
        if (!saga.isCompleted()) {
            return persistent ? persister.update(entity) : persister.create(entity);
        }
        Mono<Void> completion = persistent ? persister.complete(entity) : Mono.empty();
        return completion
                .then(Mono.defer(() -> busContext.cancelTimeoutsFor(entity.getId())))
                .then(Mono.fromRunnable(() -> events.onSagaCompleted(sagaType.getName(), entity.getId())));
    }
}
