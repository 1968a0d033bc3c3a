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

package org.fireflyframework.sagadispatch.core.persistence;

import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import reactor.core.publisher.Mono;

/**
 * Durable store of saga entities, keyed by entity type and id.
 *
 * <p>Implementations must make {@link #create} atomic per id (a second create for the same
 * id fails) and must detect concurrent updates to the same entity. After {@link #complete}
 * the entity must no longer be returned by any lookup.
 */
public interface SagaPersister {

    Mono<Void> create(SagaEntity entity);

    Mono<Void> update(SagaEntity entity);

    /**
     * Finalizes a completed saga run and removes the entity from the active search scope.
     */
    Mono<Void> complete(SagaEntity entity);

    <E extends SagaEntity> Mono<E> findById(Class<E> entityType, String id);

    <E extends SagaEntity> Mono<E> findByProperty(Class<E> entityType, String propertyName, Object value);

    default Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }
}
