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

package org.fireflyframework.sagadispatch.saga.builder;

import org.fireflyframework.sagadispatch.core.exception.DuplicateDefinitionException;
import org.fireflyframework.sagadispatch.saga.finder.SagaFinder;
import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.registry.SagaCorrelation;
import org.fireflyframework.sagadispatch.saga.registry.SagaDefinition;
import org.springframework.beans.BeanUtils;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fluent builder for constructing saga definitions programmatically.
 *
 * <p>Usage:
 * <pre>{@code
 * SagaDefinition def = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
 *     .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
 *     .handles(PaymentReceived.class, OrderSaga::onPaymentReceived)
 *     .correlateBy(PaymentReceived.class, PaymentReceived::getOrderId, "orderId")
 *     .timeout(PaymentOverdue.class, OrderSaga::onPaymentOverdue)
 *     .build();
 * }</pre>
 */
public final class SagaDefinitionBuilder<S extends SagaInstance<E>, E extends SagaEntity> {

    private final SagaDefinition definition;

    private SagaDefinitionBuilder(Class<S> sagaType, Class<E> entityType, Supplier<E> entityFactory) {
        this.definition = new SagaDefinition(sagaType, entityType, entityFactory);
    }

    public static <S extends SagaInstance<E>, E extends SagaEntity> SagaDefinitionBuilder<S, E> saga(
            Class<S> sagaType, Class<E> entityType) {
        return new SagaDefinitionBuilder<>(sagaType, entityType, () -> BeanUtils.instantiateClass(entityType));
    }

    public static <S extends SagaInstance<E>, E extends SagaEntity> SagaDefinitionBuilder<S, E> saga(
            Class<S> sagaType, Class<E> entityType, Supplier<E> entityFactory) {
        return new SagaDefinitionBuilder<>(sagaType, entityType, Objects.requireNonNull(entityFactory, "entityFactory"));
    }

    /**
     * Registers a handler for a message type that creates a new saga run when no entity is found.
     */
    public <M> SagaDefinitionBuilder<S, E> startedBy(Class<M> messageType, SagaMessageHandler<S, M> handler) {
        handles(messageType, handler);
        definition.startedBy.add(messageType);
        return this;
    }

    public <M> SagaDefinitionBuilder<S, E> handles(Class<M> messageType, SagaMessageHandler<S, M> handler) {
        Objects.requireNonNull(handler, "handler");
        if (definition.handlers.putIfAbsent(messageType, handler) != null) {
            throw new DuplicateDefinitionException("handler for " + messageType.getName()
                    + " in saga '" + definition.name() + "'");
        }
        return this;
    }

    /**
     * Registers the receiver of timeouts whose state is exactly {@code payloadType}.
     */
    public <T> SagaDefinitionBuilder<S, E> timeout(Class<T> payloadType, SagaMessageHandler<S, T> handler) {
        Objects.requireNonNull(handler, "handler");
        if (definition.timeoutHandlers.putIfAbsent(payloadType, handler) != null) {
            throw new DuplicateDefinitionException("timeout handler for " + payloadType.getName()
                    + " in saga '" + definition.name() + "'");
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public <M> SagaDefinitionBuilder<S, E> correlateBy(Class<M> messageType, Function<M, ?> messageValue,
                                                        String entityProperty) {
        Function<Object, Object> extractor = message -> messageValue.apply((M) message);
        definition.correlations.put(messageType, new SagaCorrelation(extractor, entityProperty));
        return this;
    }

    public <M> SagaDefinitionBuilder<S, E> findWith(Class<M> messageType, SagaFinder<E, M> finder) {
        definition.finders.put(messageType, Objects.requireNonNull(finder, "finder"));
        return this;
    }

    public SagaDefinition build() {
        return definition;
    }
}
