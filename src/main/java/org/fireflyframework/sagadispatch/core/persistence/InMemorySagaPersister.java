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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.exception.SagaConcurrencyException;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps saga entities as JSON snapshots in memory. Every lookup returns a fresh copy, so two
 * dispatches never share an entity object. Creates are atomic per id and updates use the
 * entity {@code version} for optimistic conflict detection.
 */
@Slf4j
public class InMemorySagaPersister implements SagaPersister {

    private final ConcurrentHashMap<String, StoredEntity> store = new ConcurrentHashMap<>();
    private final EntitySerializer serializer;

    public InMemorySagaPersister() {
        this(new EntitySerializer());
    }

    public InMemorySagaPersister(EntitySerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public Mono<Void> create(SagaEntity entity) {
        return Mono.fromRunnable(() -> {
            requireId(entity);
            long next = entity.getVersion() + 1;
            StoredEntity snapshot = snapshot(entity, next);
            if (store.putIfAbsent(key(entity.getClass(), entity.getId()), snapshot) != null) {
                throw new SagaConcurrencyException(entity.getId(), "an entity of type "
                        + entity.getClass().getName() + " with this id already exists");
            }
            entity.setVersion(next);
        });
    }

    @Override
    public Mono<Void> update(SagaEntity entity) {
        return Mono.fromRunnable(() -> {
            requireId(entity);
            long expected = entity.getVersion();
            StoredEntity snapshot = snapshot(entity, expected + 1);
            store.compute(key(entity.getClass(), entity.getId()), (k, current) -> {
                if (current == null) {
                    throw new SagaConcurrencyException(entity.getId(), "cannot update, entity no longer exists");
                }
                if (current.version() != expected) {
                    throw new SagaConcurrencyException(entity.getId(), "update conflict, expected version "
                            + expected + " but found " + current.version());
                }
                return snapshot;
            });
            entity.setVersion(expected + 1);
        });
    }

    @Override
    public Mono<Void> complete(SagaEntity entity) {
        return Mono.fromRunnable(() -> {
            requireId(entity);
            long expected = entity.getVersion();
            AtomicBoolean removed = new AtomicBoolean();
            store.computeIfPresent(key(entity.getClass(), entity.getId()), (k, current) -> {
                if (current.version() != expected) {
                    throw new SagaConcurrencyException(entity.getId(), "completion conflict, expected version "
                            + expected + " but found " + current.version());
                }
                removed.set(true);
                return null;
            });
            if (removed.get()) {
                log.debug("[saga-persistence] Removed completed saga {} {}", entity.getClass().getSimpleName(), entity.getId());
            } else {
                log.debug("[saga-persistence] Completed saga {} {} was not stored", entity.getClass().getSimpleName(), entity.getId());
            }
        });
    }

    @Override
    public <E extends SagaEntity> Mono<E> findById(Class<E> entityType, String id) {
        return Mono.fromCallable(() -> {
            if (id == null) return null;
            StoredEntity stored = store.get(key(entityType, id));
            return stored != null ? rehydrate(stored, entityType) : null;
        });
    }

    @Override
    public <E extends SagaEntity> Mono<E> findByProperty(Class<E> entityType, String propertyName, Object value) {
        return Mono.fromCallable(() -> {
            List<StoredEntity> matches = List.copyOf(store.values()).stream()
                    .filter(s -> s.type() == entityType)
                    .filter(s -> serializer.propertyEquals(s.json(), propertyName, value))
                    .toList();
            if (matches.size() > 1) {
                throw new IllegalStateException("Found " + matches.size() + " " + entityType.getName()
                        + " entities with " + propertyName + "=" + value + "; correlation properties must be unique");
            }
            return matches.isEmpty() ? null : rehydrate(matches.get(0), entityType);
        });
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }

    private StoredEntity snapshot(SagaEntity entity, long version) {
        return new StoredEntity(entity.getClass(), serializer.serialize(entity), version);
    }

    private <E extends SagaEntity> E rehydrate(StoredEntity stored, Class<E> entityType) {
        E entity = serializer.deserialize(stored.json(), entityType);
        entity.setVersion(stored.version());
        return entity;
    }

    private static void requireId(SagaEntity entity) {
        Objects.requireNonNull(entity, "entity");
        if (entity.getId() == null) {
            throw new IllegalArgumentException("Saga entity " + entity.getClass().getName() + " has no id");
        }
    }

    private static String key(Class<?> entityType, String id) {
        return entityType.getName() + ":" + id;
    }

    private record StoredEntity(Class<?> type, String json, long version) {}
}
