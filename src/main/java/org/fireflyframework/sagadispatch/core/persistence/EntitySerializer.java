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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;

import java.util.Objects;

/**
 * Serializes and deserializes {@link SagaEntity} snapshots to/from JSON.
 */
public class EntitySerializer {

    private final ObjectMapper mapper;

    public EntitySerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public EntitySerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String serialize(SagaEntity entity) {
        try {
            return mapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize saga entity " + entity, e);
        }
    }

    public <E extends SagaEntity> E deserialize(String json, Class<E> entityType) {
        try {
            return mapper.readValue(json, entityType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize saga entity of type " + entityType.getName(), e);
        }
    }

    /**
     * Whether the snapshot's {@code propertyName} equals {@code value}, comparing in the
     * value's own type so that e.g. an {@code int} property matches a {@code Long} lookup value.
     * A stored value that cannot be read as the lookup value's type is not equal; an unreadable
     * snapshot is an error.
     */
    public boolean propertyEquals(String json, String propertyName, Object value) {
        JsonNode node = readTree(json).get(propertyName);
        if (node == null || node.isNull()) {
            return value == null;
        }
        if (value == null) {
            return false;
        }
        try {
            Object stored = mapper.treeToValue(node, value.getClass());
            return Objects.equals(stored, value);
        } catch (MismatchedInputException e) {
            return false;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to read property '" + propertyName + "' of saga entity snapshot as "
                    + value.getClass().getName(), e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read saga entity snapshot", e);
        }
    }
}
