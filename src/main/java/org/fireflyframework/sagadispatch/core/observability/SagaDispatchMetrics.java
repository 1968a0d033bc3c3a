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

package org.fireflyframework.sagadispatch.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

public class SagaDispatchMetrics implements SagaDispatchEvents {
    private static final String PREFIX = "firefly.saga-dispatch";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public SagaDispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onMessageIgnored(String messageType, String messageId) {
        counter("messages.ignored", "messageType", messageType).increment();
    }

    @Override
    public void onTimeoutDeferred(String messageType, String messageId, Instant expiresAt) {
        counter("timeouts.deferred", "messageType", messageType).increment();
    }

    @Override
    public void onSagaStarted(String sagaType, String sagaId, String messageType) {
        counter("sagas.started", "sagaType", sagaType).increment();
    }

    @Override
    public void onSagaInvoked(String sagaType, String sagaId, String messageType) {
        counter("sagas.invoked", "sagaType", sagaType, "messageType", messageType).increment();
    }

    @Override
    public void onSagaCompleted(String sagaType, String sagaId) {
        counter("sagas.completed", "sagaType", sagaType).increment();
    }

    @Override
    public void onSagaNotFound(String messageType, String messageId) {
        counter("messages.unclaimed", "messageType", messageType).increment();
    }

    @Override
    public void onDispatchFailed(String messageType, String messageId, Throwable error) {
        counter("dispatch.failed", "messageType", messageType, "error", error.getClass().getSimpleName()).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
