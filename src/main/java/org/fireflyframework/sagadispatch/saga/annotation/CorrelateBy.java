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

import java.lang.annotation.*;

/**
 * Correlates the message handled by the annotated method with an existing entity by
 * property value: the entity whose {@link #entity()} property equals the message's
 * {@link #message()} property is the one invoked.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CorrelateBy {

    /**
     * Bean property read from the message.
     */
    String message();

    /**
     * Entity property compared against the message value.
     */
    String entity();
}
