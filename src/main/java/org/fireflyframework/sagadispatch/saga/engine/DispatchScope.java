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

import org.fireflyframework.sagadispatch.saga.model.SagaEntity;

import java.util.HashSet;
import java.util.Set;

/**
 * Bookkeeping of a single dispatch: the entities already invoked and the saga types
 * already started or invoked. Never shared between dispatches.
 */
final class DispatchScope {

    private final Set<EntityKey> handledEntities = new HashSet<>();
    private final Set<Class<?>> startedSagaTypes = new HashSet<>();

    boolean isHandled(SagaEntity entity) {
        return handledEntities.contains(EntityKey.of(entity));
    }

    void markHandled(SagaEntity entity) {
        handledEntities.add(EntityKey.of(entity));
    }

    boolean hasHandledAny() {
        return !handledEntities.isEmpty();
    }

    boolean isStarted(Class<?> sagaType) {
        return startedSagaTypes.contains(sagaType);
    }

    void markStarted(Class<?> sagaType) {
        startedSagaTypes.add(sagaType);
    }

    /**
     * Entities are compared by type and id, since every lookup rehydrates a new copy.
     */
    record EntityKey(Class<?> entityType, String id) {
        static EntityKey of(SagaEntity entity) {
            return new EntityKey(entity.getClass(), entity.getId());
        }
    }
}
