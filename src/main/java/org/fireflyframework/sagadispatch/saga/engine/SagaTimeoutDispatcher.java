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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.exception.SagaTimeoutHandlerNotFoundException;
import org.fireflyframework.sagadispatch.saga.annotation.SagaTimeout;
import org.fireflyframework.sagadispatch.saga.handler.MethodSagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.MessageKind;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.registry.SagaRegistry;
import org.springframework.util.ClassUtils;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers an expired timeout to the saga that requested it.
 *
 * <p>The receiver is the timeout handler registered for exactly the payload type: the
 * type declared by a {@link org.fireflyframework.sagadispatch.saga.model.TimeoutMessage}
 * when it carries one, otherwise the payload's runtime class. Payload types unknown to the
 * registry are resolved once against the saga class itself (a public single-argument method
 * annotated {@link SagaTimeout} or named {@code timeout}) and cached.
 */
@Slf4j
public class SagaTimeoutDispatcher {

    private static final String TIMEOUT_METHOD_NAME = "timeout";

    private final SagaRegistry registry;
    private final Map<ResolutionKey, Optional<SagaMessageHandler<?, ?>>> resolved = new ConcurrentHashMap<>();

    public SagaTimeoutDispatcher(SagaRegistry registry) {
        this.registry = registry;
    }

    @SuppressWarnings("unchecked")
    public Mono<Void> dispatchTimeout(SagaInstance<?> saga, MessageKind.Timeout timeout) {
        return Mono.defer(() -> {
            Class<?> sagaType = ClassUtils.getUserClass(saga);
            Class<?> payloadType = timeout.payloadType();
            SagaMessageHandler<Object, Object> handler = (SagaMessageHandler<Object, Object>)
                    resolved.computeIfAbsent(new ResolutionKey(sagaType, payloadType), this::resolve)
                            .orElseThrow(() -> new SagaTimeoutHandlerNotFoundException(payloadType, sagaType));
            log.debug("[saga-dispatch] Delivering timeout: saga={} payloadType={} declared={}",
                    sagaType.getSimpleName(), payloadType.getSimpleName(), timeout.staticallyTyped());
            return handler.handle(saga, timeout.payload());
        });
    }

    private Optional<SagaMessageHandler<?, ?>> resolve(ResolutionKey key) {
        Optional<SagaMessageHandler<?, ?>> registered = registry.timeoutHandlerFor(key.sagaType(), key.payloadType());
        if (registered.isPresent()) {
            return registered;
        }
        return Arrays.stream(key.sagaType().getMethods())
                .filter(m -> !Modifier.isStatic(m.getModifiers()))
                .filter(m -> m.getParameterCount() == 1 && m.getParameterTypes()[0] == key.payloadType())
                .filter(m -> m.isAnnotationPresent(SagaTimeout.class) || TIMEOUT_METHOD_NAME.equals(m.getName()))
                .min(Comparator.comparing((Method m) -> !m.isAnnotationPresent(SagaTimeout.class)))
                .<SagaMessageHandler<?, ?>>map(m -> {
                    log.debug("[saga-dispatch] Resolved timeout method {} on saga {}", m.getName(),
                            key.sagaType().getSimpleName());
                    return new MethodSagaMessageHandler(m);
                });
    }

    private record ResolutionKey(Class<?> sagaType, Class<?> payloadType) {}
}
