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

import org.fireflyframework.sagadispatch.saga.finder.SagaFinder;
import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Metadata for one saga type: its entity, how new entities are created, the messages that
 * start it, the handlers per message and timeout payload type, and how messages find
 * existing entities. Maps preserve registration order.
 */
public class SagaDefinition {

    public final Class<? extends SagaInstance<?>> sagaType;
    public final Class<? extends SagaEntity> entityType;
    public final Supplier<? extends SagaEntity> entityFactory;
    public final Set<Class<?>> startedBy = new LinkedHashSet<>();
    public final Map<Class<?>, SagaMessageHandler<?, ?>> handlers = new LinkedHashMap<>();
    public final Map<Class<?>, SagaMessageHandler<?, ?>> timeoutHandlers = new LinkedHashMap<>();
    public final Map<Class<?>, SagaFinder<?, ?>> finders = new LinkedHashMap<>();
    public final Map<Class<?>, SagaCorrelation> correlations = new LinkedHashMap<>();

    public SagaDefinition(Class<? extends SagaInstance<?>> sagaType,
                          Class<? extends SagaEntity> entityType,
                          Supplier<? extends SagaEntity> entityFactory) {
        this.sagaType = sagaType;
        this.entityType = entityType;
        this.entityFactory = entityFactory;
    }

    public String name() {
        return sagaType.getName();
    }

    /**
     * Every message type this saga handles, starts from or correlates, in registration order.
     */
    public Set<Class<?>> messageTypes() {
        Set<Class<?>> types = new LinkedHashSet<>(handlers.keySet());
        types.addAll(startedBy);
        types.addAll(finders.keySet());
        types.addAll(correlations.keySet());
        return types;
    }
}
