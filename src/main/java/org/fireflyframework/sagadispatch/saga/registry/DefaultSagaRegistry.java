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
import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.saga.finder.SagaFinder;
import org.fireflyframework.sagadispatch.saga.finder.SagaFinders;
import org.fireflyframework.sagadispatch.saga.handler.SagaMessageHandler;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.model.SagaMessage;
import org.fireflyframework.sagadispatch.saga.model.TimeoutNotification;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable registry built once from a set of {@link SagaDefinition}s.
 *
 * <p>Besides indexing the definitions, building the registry wires the finders of every
 * saga: explicit finders first, then property correlations, then lookup by saga id for
 * {@link SagaMessage} types and for every timeout notification, and finally a finder that never
 * matches for messages that can only start a saga. Lookups by message type honour
 * subtyping and are memoized per concrete type.
 */
@Slf4j
public class DefaultSagaRegistry implements SagaRegistry {

    private final Map<Class<?>, SagaDefinition> sagas;
    private final Map<Class<?>, SagaDefinition> sagasByEntityType;
    private final List<SagaFinderDefinition> finders;

    private final Map<Class<?>, List<SagaFinderDefinition>> findersByMessageType = new ConcurrentHashMap<>();
    private final Map<Class<?>, Boolean> relevanceByMessageType = new ConcurrentHashMap<>();
    private final Map<HandlerKey, Optional<SagaMessageHandler<?, ?>>> handlersByKey = new ConcurrentHashMap<>();

    private DefaultSagaRegistry(Map<Class<?>, SagaDefinition> sagas,
                                Map<Class<?>, SagaDefinition> sagasByEntityType,
                                List<SagaFinderDefinition> finders) {
        this.sagas = Collections.unmodifiableMap(sagas);
        this.sagasByEntityType = Collections.unmodifiableMap(sagasByEntityType);
        this.finders = List.copyOf(finders);
    }

    public static Builder builder(SagaPersister persister) {
        return new Builder(persister);
    }

    @Override
    public List<SagaFinderDefinition> findersFor(Class<?> messageType) {
        return findersByMessageType.computeIfAbsent(messageType, type -> finders.stream()
                .filter(f -> f.messageType().isAssignableFrom(type))
                .toList());
    }

    @Override
    public Optional<Class<? extends SagaInstance<?>>> sagaTypeToStart(Class<?> messageType, SagaFinderDefinition finder) {
        SagaDefinition def = sagasByEntityType.get(finder.entityType());
        if (def == null) {
            return Optional.empty();
        }
        boolean starts = def.startedBy.stream().anyMatch(t -> t.isAssignableFrom(messageType));
        return starts ? Optional.of(def.sagaType) : Optional.empty();
    }

    @Override
    public Class<? extends SagaEntity> sagaEntityTypeFor(Class<?> sagaType) {
        return requireSaga(sagaType).entityType;
    }

    @Override
    public Class<? extends SagaInstance<?>> sagaTypeForEntityType(Class<? extends SagaEntity> entityType) {
        SagaDefinition def = sagasByEntityType.get(entityType);
        if (def == null) {
            throw new SagaConfigurationException("No saga registered for entity type " + entityType.getName(),
                    Map.of("entityType", entityType.getName()));
        }
        return def.sagaType;
    }

    @Override
    public Optional<SagaMessageHandler<?, ?>> handlerFor(Class<?> sagaType, Class<?> messageType) {
        SagaDefinition def = requireSaga(sagaType);
        return handlersByKey.computeIfAbsent(new HandlerKey(sagaType, messageType), key -> {
            SagaMessageHandler<?, ?> exact = def.handlers.get(messageType);
            if (exact != null) {
                return Optional.of(exact);
            }
            return def.handlers.entrySet().stream()
                    .filter(e -> e.getKey().isAssignableFrom(messageType))
                    .<SagaMessageHandler<?, ?>>map(Map.Entry::getValue)
                    .findFirst();
        });
    }

    @Override
    public Optional<SagaMessageHandler<?, ?>> timeoutHandlerFor(Class<?> sagaType, Class<?> payloadType) {
        return Optional.ofNullable(requireSaga(sagaType).timeoutHandlers.get(payloadType));
    }

    @Override
    public boolean isSagaRelevant(Class<?> messageType) {
        return relevanceByMessageType.computeIfAbsent(messageType, type -> sagas.values().stream()
                .anyMatch(def -> def.messageTypes().stream().anyMatch(t -> t.isAssignableFrom(type))
                        || def.timeoutHandlers.containsKey(type)));
    }

    @Override
    public SagaEntity newEntity(Class<?> sagaType) {
        SagaDefinition def = requireSaga(sagaType);
        SagaEntity entity = def.entityFactory.get();
        if (entity == null || !def.entityType.isInstance(entity)) {
            throw new SagaConfigurationException("Entity factory of saga " + sagaType.getName()
                    + " did not produce a " + def.entityType.getName());
        }
        return entity;
    }

    @Override
    public Collection<SagaDefinition> getAll() {
        return sagas.values();
    }

    public Optional<SagaDefinition> getSaga(Class<?> sagaType) {
        return Optional.ofNullable(sagas.get(sagaType));
    }

    public List<SagaFinderDefinition> getFinders() {
        return finders;
    }

    private SagaDefinition requireSaga(Class<?> sagaType) {
        SagaDefinition def = sagas.get(sagaType);
        if (def == null) {
            throw new SagaConfigurationException("Saga type " + sagaType.getName() + " is not registered",
                    Map.of("sagaType", sagaType.getName()));
        }
        return def;
    }

    private record HandlerKey(Class<?> sagaType, Class<?> messageType) {}

    private record FinderKey(Class<?> messageType, Class<?> entityType) {}

    public static final class Builder {

        private final SagaPersister persister;
        private final Map<Class<?>, SagaDefinition> sagas = new LinkedHashMap<>();

        private Builder(SagaPersister persister) {
            this.persister = Objects.requireNonNull(persister, "persister");
        }

        public Builder register(SagaDefinition definition) {
            if (sagas.putIfAbsent(definition.sagaType, definition) != null) {
                throw new DuplicateDefinitionException("saga '" + definition.name() + "'");
            }
            return this;
        }

        public Builder registerAll(Collection<SagaDefinition> definitions) {
            definitions.forEach(this::register);
            return this;
        }

        public DefaultSagaRegistry build() {
            Map<Class<?>, SagaDefinition> byEntityType = new LinkedHashMap<>();
            for (SagaDefinition def : sagas.values()) {
                SagaDefinition previous = byEntityType.putIfAbsent(def.entityType, def);
                if (previous != null) {
                    throw new DuplicateDefinitionException("entity type '" + def.entityType.getName()
                            + "' used by sagas '" + previous.name() + "' and '" + def.name() + "'");
                }
            }

            List<SagaFinderDefinition> finders = new ArrayList<>();
            Set<FinderKey> wired = new HashSet<>();
            for (SagaDefinition def : sagas.values()) {
                for (Class<?> messageType : def.messageTypes()) {
                    SagaFinderDefinition finder = finderFor(def, messageType);
                    if (finder != null && wired.add(new FinderKey(messageType, def.entityType))) {
                        finders.add(finder);
                    }
                }
                if (wired.add(new FinderKey(TimeoutNotification.class, def.entityType))) {
                    finders.add(new SagaFinderDefinition(TimeoutNotification.class, def.entityType,
                            SagaFinders.byTimeoutSagaId(def.entityType, persister), "id"));
                }
            }

            log.info("[saga-registry] Registered {} saga(s) with {} finder(s)", sagas.size(), finders.size());
            finders.forEach(f -> log.debug("[saga-registry] {}", f));
            return new DefaultSagaRegistry(new LinkedHashMap<>(sagas), byEntityType, finders);
        }

        private SagaFinderDefinition finderFor(SagaDefinition def, Class<?> messageType) {
            SagaFinder<?, ?> custom = def.finders.get(messageType);
            if (custom != null) {
                return new SagaFinderDefinition(messageType, def.entityType, custom, "custom");
            }
            SagaCorrelation correlation = def.correlations.get(messageType);
            if (correlation != null) {
                SagaFinder<?, ?> finder = SagaFinders.byProperty(def.entityType, persister,
                        correlation.messageValue(), correlation.entityProperty());
                return new SagaFinderDefinition(messageType, def.entityType, finder,
                        "property(" + correlation.entityProperty() + ")");
            }
            if (SagaMessage.class.isAssignableFrom(messageType)) {
                return idFinder(def, messageType);
            }
            if (def.startedBy.contains(messageType)) {
                return new SagaFinderDefinition(messageType, def.entityType, SagaFinders.none(), "none");
            }
            return null;
        }

        private SagaFinderDefinition idFinder(SagaDefinition def, Class<?> messageType) {
            return new SagaFinderDefinition(messageType, def.entityType,
                    SagaFinders.byId(def.entityType, persister), "id");
        }
    }
}
