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

package org.fireflyframework.sagadispatch.saga.handler;

import reactor.core.publisher.Mono;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Adapts a single-argument saga method to {@link SagaMessageHandler}. The method may return
 * {@code void}, a {@link Mono}, or any other value (ignored).
 */
public final class MethodSagaMessageHandler implements SagaMessageHandler<Object, Object> {

    private final Method method;

    public MethodSagaMessageHandler(Method method) {
        if (method.getParameterCount() != 1) {
            throw new IllegalArgumentException("Saga handler method " + method + " must take exactly one parameter");
        }
        this.method = method;
    }

    public Method getMethod() {
        return method;
    }

    public Class<?> getParameterType() {
        return method.getParameterTypes()[0];
    }

    @Override
    public Mono<Void> handle(Object saga, Object message) {
        try {
            if (!method.canAccess(saga)) {
                method.setAccessible(true);
            }
            Object result = method.invoke(saga, message);
            if (result instanceof Mono<?> mono) {
                return mono.then();
            }
            return Mono.empty();
        } catch (InvocationTargetException e) {
            return Mono.error(e.getTargetException());
        } catch (Throwable t) {
            return Mono.error(t);
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName()
                + "(" + getParameterType().getSimpleName() + ")";
    }
}
