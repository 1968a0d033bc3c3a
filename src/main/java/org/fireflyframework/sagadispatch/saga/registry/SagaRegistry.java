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

package org.fireflyframework.sagadispatch.saga.registry;

import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the configured sagas consulted by the dispatch core.
 */
public interface SagaRegistry {

    /**
     * Finders applicable to a message type, in the order they must be tried.
     */
    List<SagaFinderDefinition> findersFor(Class<?> messageType);

    /**
     * The saga type to start when {@code finder} found nothing for a message of this type.
     */
    Optional<Class<? extends SagaInstance<?>>> sagaTypeToStart(Class<?> messageType, SagaFinderDefinition finder);

    Class<? extends SagaEntity> sagaEntityTypeFor(Class<?> sagaType);

    Class<? extends SagaInstance<?>> sagaTypeForEntityType(Class<? extends SagaEntity> entityType);

    Optional<SagaMessageHandler<?, ?>> handlerFor(Class<?> sagaType, Class<?> messageType);

    /**
     * The timeout handler of {@code sagaType} for exactly {@code payloadType}; no subtype matching.
     */
    Optional<SagaMessageHandler<?, ?>> timeoutHandlerFor(Class<?> sagaType, Class<?> payloadType);

    boolean isSagaRelevant(Class<?> messageType);

    /**
     * A new, identity-less entity for the given saga type.
     */
    SagaEntity newEntity(Class<?> sagaType);

    Collection<SagaDefinition> getAll();
}
