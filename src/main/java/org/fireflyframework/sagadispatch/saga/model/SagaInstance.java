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

package org.fireflyframework.sagadispatch.saga.model;

import java.util.Objects;

/**
 * Behaviour object of a saga, created fresh for every dispatch and bound to exactly one
 * {@link SagaEntity}. Handlers signal the end of the saga run with {@link #markAsComplete()}.
 *
 * @param <E> the entity type holding this saga's state
 */
public abstract class SagaInstance<E extends SagaEntity> {

    private E entity;
    private boolean completed;

    public E getEntity() {
        return entity;
    }

    public void bindEntity(E entity) {
        Objects.requireNonNull(entity, "entity");
        if (this.entity != null) {
            throw new IllegalStateException("Saga instance " + getClass().getName()
                    + " is already bound to entity '" + this.entity.getId() + "'");
        }
        this.entity = entity;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Marks the saga run as finished. Once completed, an instance never reverts.
     */
    protected void markAsComplete() {
        this.completed = true;
    }
}
