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

package org.fireflyframework.sagadispatch.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.bus.BusContext;
import org.fireflyframework.sagadispatch.core.id.CombSagaIdGenerator;
import org.fireflyframework.sagadispatch.core.id.RandomSagaIdGenerator;
import org.fireflyframework.sagadispatch.core.id.SagaIdGenerator;
import org.fireflyframework.sagadispatch.core.observability.CompositeSagaDispatchEvents;
import org.fireflyframework.sagadispatch.core.observability.SagaDispatchEvents;
import org.fireflyframework.sagadispatch.core.observability.SagaDispatchLoggerEvents;
import org.fireflyframework.sagadispatch.core.persistence.InMemorySagaPersister;
import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.core.validation.SagaDefinitionValidator;
import org.fireflyframework.sagadispatch.core.validation.ValidationIssue;
import org.fireflyframework.sagadispatch.saga.builder.SagaInstanceBuilder;
import org.fireflyframework.sagadispatch.saga.builder.SpringSagaInstanceBuilder;
import org.fireflyframework.sagadispatch.saga.engine.SagaDispatchOrchestrator;
import org.fireflyframework.sagadispatch.saga.engine.SagaNotFoundFallback;
import org.fireflyframework.sagadispatch.saga.engine.SagaNotFoundHandler;
import org.fireflyframework.sagadispatch.saga.engine.SagaTimeoutDispatcher;
import org.fireflyframework.sagadispatch.saga.registry.DefaultSagaRegistry;
import org.fireflyframework.sagadispatch.saga.registry.SagaAnnotationScanner;
import org.fireflyframework.sagadispatch.saga.registry.SagaDefinition;
import org.fireflyframework.sagadispatch.saga.registry.SagaRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration of the saga dispatch core.
 *
 * <p>Wires observability, the default in-memory persister, saga id generation and the
 * registry built from {@code @Saga} classes plus any {@link SagaDefinition} beans. The
 * dispatch pipeline itself is only created once the transport contributes a
 * {@link BusContext}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(SagaDispatchProperties.class)
@ConditionalOnProperty(name = "firefly.saga-dispatch.enabled", havingValue = "true", matchIfMissing = true)
public class SagaDispatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SagaDispatchLoggerEvents sagaDispatchLoggerEvents() {
        return new SagaDispatchLoggerEvents();
    }

    /**
     * The events sink injected into the engine: the single {@link SagaDispatchEvents} bean in
     * the context, or all of them composed in order. Define a bean named
     * {@code sagaDispatchEvents} to replace it.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "sagaDispatchEvents")
    public SagaDispatchEvents sagaDispatchEvents(ObjectProvider<SagaDispatchEvents> sinks) {
        List<SagaDispatchEvents> delegates = sinks.orderedStream().toList();
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        log.info("[saga-dispatch] Composing {} events sinks", delegates.size());
        return new CompositeSagaDispatchEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaPersister sagaPersister() {
        log.info("[saga-dispatch] Using in-memory saga persister (default)");
        return new InMemorySagaPersister();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaIdGenerator sagaIdGenerator(SagaDispatchProperties properties) {
        log.info("[saga-dispatch] Saga id strategy: {}", properties.getIdStrategy());
        return switch (properties.getIdStrategy()) {
            case COMB -> new CombSagaIdGenerator();
            case RANDOM -> new RandomSagaIdGenerator();
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaInstanceBuilder sagaInstanceBuilder(ApplicationContext applicationContext) {
        return new SpringSagaInstanceBuilder(applicationContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaAnnotationScanner sagaAnnotationScanner() {
        return new SagaAnnotationScanner();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaDefinitionValidator sagaDefinitionValidator() {
        return new SagaDefinitionValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRegistry sagaRegistry(ApplicationContext applicationContext,
                                     SagaAnnotationScanner scanner,
                                     ObjectProvider<SagaDefinition> programmaticDefinitions,
                                     SagaPersister persister,
                                     SagaDefinitionValidator validator,
                                     SagaDispatchProperties properties) {
        List<SagaDefinition> definitions = new ArrayList<>(scanner.scan(applicationContext));
        programmaticDefinitions.orderedStream().forEach(definitions::add);

        if (properties.getValidation().isEnabled()) {
            List<ValidationIssue> issues = new ArrayList<>();
            definitions.forEach(def -> issues.addAll(validator.validate(def)));
            validator.validateAndThrow(issues, properties.getValidation().isFailOnWarning());
        }

        DefaultSagaRegistry registry = DefaultSagaRegistry.builder(persister)
                .registerAll(definitions)
                .build();
        log.info("[saga-dispatch] Saga registry initialized with {} saga(s)", registry.getAll().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BusContext.class)
    public SagaTimeoutDispatcher sagaTimeoutDispatcher(SagaRegistry registry) {
        return new SagaTimeoutDispatcher(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BusContext.class)
    public SagaNotFoundFallback sagaNotFoundFallback(ObjectProvider<SagaNotFoundHandler> handlers,
                                                     BusContext busContext,
                                                     SagaDispatchEvents sagaDispatchEvents) {
        List<SagaNotFoundHandler> ordered = handlers.orderedStream().toList();
        log.info("[saga-dispatch] Registered {} saga-not-found handler(s)", ordered.size());
        return new SagaNotFoundFallback(ordered, busContext, sagaDispatchEvents);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BusContext.class)
    public SagaDispatchOrchestrator sagaDispatchOrchestrator(SagaRegistry registry,
                                                             SagaPersister persister,
                                                             BusContext busContext,
                                                             SagaInstanceBuilder instanceBuilder,
                                                             SagaIdGenerator idGenerator,
                                                             SagaTimeoutDispatcher timeoutDispatcher,
                                                             SagaNotFoundFallback notFoundFallback,
                                                             SagaDispatchEvents sagaDispatchEvents) {
        log.info("[saga-dispatch] Saga dispatch orchestrator initialized");
        return new SagaDispatchOrchestrator(registry, persister, busContext, instanceBuilder, idGenerator,
                timeoutDispatcher, notFoundFallback, sagaDispatchEvents);
    }
}
