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

package org.fireflyframework.sagadispatch.saga.finder;

import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaMessage;
import org.fireflyframework.sagadispatch.saga.model.TimeoutNotification;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Factory methods for the finders the registry wires automatically.
 */
public final class SagaFinders {

    private SagaFinders() {}

    /**
     * Finds the entity whose id equals {@link SagaMessage#getSagaId()}.
     */
    public static <E extends SagaEntity> SagaFinder<E, SagaMessage> byId(Class<E> entityType, SagaPersister persister) {
        return message -> {
            String id = message.getSagaId();
            if (id == null || id.isBlank()) return Mono.empty();
            return persister.findById(entityType, id);
        };
    }

    /**
     * Finds the entity a timeout notification is addressed to, whatever its payload type.
     * Notifications that carry no saga id are not correlated.
     */
    public static <E extends SagaEntity> SagaFinder<E, TimeoutNotification> byTimeoutSagaId(Class<E> entityType,
                                                                                           SagaPersister persister) {
        SagaFinder<E, SagaMessage> byId = byId(entityType, persister);
        return notification -> notification instanceof SagaMessage correlated
                ? byId.find(correlated)
                : Mono.empty();
    }

    /**
     * Finds the entity whose {@code entityProperty} equals the value extracted from the message.
     * Messages yielding a {@code null} value are not correlated.
     */
    public static <E extends SagaEntity, M> SagaFinder<E, M> byProperty(Class<E> entityType, SagaPersister persister,
                                                                         Function<? super M, ?> messageValue,
                                                                         String entityProperty) {
        return message -> {
            Object value = messageValue.apply(message);
            if (value == null) return Mono.empty();
            return persister.findByProperty(entityType, entityProperty, value);
        };
    }

    /**
     * Never finds anything; used for messages that only ever start a saga.
     */
    public static <E extends SagaEntity, M> SagaFinder<E, M> none() {
        return message -> Mono.empty();
    }
}
