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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.exception.DuplicateDefinitionException;
import org.fireflyframework.sagadispatch.core.exception.SagaConfigurationException;
import org.fireflyframework.sagadispatch.saga.annotation.CorrelateBy;
import org.fireflyframework.sagadispatch.saga.annotation.Saga;
import org.fireflyframework.sagadispatch.saga.annotation.SagaHandler;
import org.fireflyframework.sagadispatch.saga.annotation.SagaTimeout;
import org.fireflyframework.sagadispatch.saga.annotation.StartedBy;
import org.fireflyframework.sagadispatch.saga.handler.MethodSagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.BeanWrapperImpl;
import org.springframework.context.ApplicationContext;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns {@link Saga}-annotated classes into {@link SagaDefinition}s. Public methods with a
 * single parameter annotated {@link StartedBy}, {@link SagaHandler} or {@link SagaTimeout}
 * become the saga's handlers; {@link CorrelateBy} on a handler method registers a property
 * correlation for its message type.
 */
@Slf4j
public class SagaAnnotationScanner {

    /**
     * Scans every bean definition in the context whose type carries {@link Saga}.
     */
    public List<SagaDefinition> scan(ApplicationContext applicationContext) {
        Set<Class<?>> sagaTypes = new LinkedHashSet<>();
        for (String beanName : applicationContext.getBeanNamesForAnnotation(Saga.class)) {
            Class<?> beanType = applicationContext.getType(beanName);
            if (beanType != null) {
                sagaTypes.add(ClassUtils.getUserClass(beanType));
            }
        }
        List<SagaDefinition> definitions = new ArrayList<>();
        for (Class<?> sagaType : sagaTypes) {
            definitions.add(scan(sagaType));
        }
        log.info("[saga-registry] Discovered {} annotated saga(s)", definitions.size());
        return definitions;
    }

    @SuppressWarnings("unchecked")
    public SagaDefinition scan(Class<?> sagaClass) {
        Saga sagaAnn = sagaClass.getAnnotation(Saga.class);
        if (sagaAnn == null) {
            throw new SagaConfigurationException("Class " + sagaClass.getName() + " is not annotated with @Saga");
        }
        if (!SagaInstance.class.isAssignableFrom(sagaClass)) {
            throw new SagaConfigurationException("@Saga class " + sagaClass.getName()
                    + " must extend " + SagaInstance.class.getSimpleName(),
                    Map.of("sagaType", sagaClass.getName()));
        }
        Class<? extends SagaEntity> entityType = sagaAnn.entity();
        SagaDefinition def = new SagaDefinition((Class<? extends SagaInstance<?>>) sagaClass, entityType,
                () -> BeanUtils.instantiateClass(entityType));

        List<Method> methods = new ArrayList<>(List.of(sagaClass.getMethods()));
        methods.sort(Comparator.comparing(Method::getName).thenComparing(Method::toGenericString));
        for (Method m : methods) {
            boolean startedBy = m.isAnnotationPresent(StartedBy.class);
            boolean handler = m.isAnnotationPresent(SagaHandler.class);
            boolean timeout = m.isAnnotationPresent(SagaTimeout.class);
            if (!startedBy && !handler && !timeout) continue;
            if (m.getParameterCount() != 1) {
                throw new SagaConfigurationException("Saga method " + m + " must take exactly one parameter",
                        Map.of("sagaType", sagaClass.getName(), "method", m.getName()));
            }
            MethodSagaMessageHandler invoker = new MethodSagaMessageHandler(m);
            Class<?> parameterType = invoker.getParameterType();

            if (timeout) {
                if (def.timeoutHandlers.putIfAbsent(parameterType, invoker) != null) {
                    throw new DuplicateDefinitionException("timeout handler for " + parameterType.getName()
                            + " in saga '" + def.name() + "'");
                }
                continue;
            }
            if (def.handlers.putIfAbsent(parameterType, invoker) != null) {
                throw new DuplicateDefinitionException("handler for " + parameterType.getName()
                        + " in saga '" + def.name() + "'");
            }
            if (startedBy) {
                def.startedBy.add(parameterType);
            }
            CorrelateBy correlateBy = m.getAnnotation(CorrelateBy.class);
            if (correlateBy != null) {
                String messageProperty = correlateBy.message();
                def.correlations.put(parameterType, new SagaCorrelation(
                        message -> new BeanWrapperImpl(message).getPropertyValue(messageProperty),
                        correlateBy.entity()));
            }
        }
        log.debug("[saga-registry] Scanned saga={} entity={} handlers={} timeouts={} startedBy={}",
                def.name(), entityType.getSimpleName(), def.handlers.size(), def.timeoutHandlers.size(),
                def.startedBy.size());
        return def;
    }
}
