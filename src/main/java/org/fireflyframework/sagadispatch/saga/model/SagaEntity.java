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

package org.fireflyframework.sagadispatch.saga.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Durable correlation state of one saga run.
 *
 * <p>Subclasses add the business fields of their saga as ordinary bean properties and must
 * keep a public no-arg constructor so persisters can rehydrate them. The identity triple
 * ({@code id}, {@code originator}, {@code originatingMessageId}) is assigned exactly once
 * when the dispatch core creates the entity; the {@code version} belongs to the persister.
 */
public abstract class SagaEntity {

    @JsonProperty
    private String id;

    @JsonProperty
    private String originator;

    @JsonProperty
    private String originatingMessageId;

    private long version;

    public String getId() {
        return id;
    }

    public String getOriginator() {
        return originator;
    }

    public String getOriginatingMessageId() {
        return originatingMessageId;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * Assigns the identity of a freshly created entity.
     *
     * @throws IllegalStateException if the entity already has an id
     */
    public void assignIdentity(String id, String originator, String originatingMessageId) {
        Objects.requireNonNull(id, "id");
        if (this.id != null) {
            throw new IllegalStateException("Saga entity " + getClass().getName() + " already has id '" + this.id + "'");
        }
        this.id = id;
        this.originator = originator;
        this.originatingMessageId = originatingMessageId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", version=" + version + "]";
    }
}
