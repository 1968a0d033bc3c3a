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
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;

/**
 * A finder registered for a message type and the entity type it returns.
 *
 * @param description short label used in logs ({@code id}, {@code property(orderId)}, ...)
 */
public record SagaFinderDefinition(
        Class<?> messageType,
        Class<? extends SagaEntity> entityType,
        SagaFinder<?, ?> finder,
        String description
) {
    @Override
    public String toString() {
        return "SagaFinder[" + messageType.getSimpleName() + " -> " + entityType.getSimpleName()
                + " by " + description + "]";
    }
}
