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

package org.fireflyframework.sagadispatch.saga.annotation;

import org.fireflyframework.sagadispatch.saga.model.SagaEntity;

import java.lang.annotation.*;

/**
 * Marks a {@link org.fireflyframework.sagadispatch.saga.model.SagaInstance} subclass for
 * discovery. The class must be registered as a Spring bean definition; a fresh instance is
 * created through the bean factory for every dispatch.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Saga {

    /**
     * Entity type holding the saga's state.
     */
    Class<? extends SagaEntity> entity();
}
