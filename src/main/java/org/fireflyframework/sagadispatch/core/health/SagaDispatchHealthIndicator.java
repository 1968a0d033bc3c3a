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

package org.fireflyframework.sagadispatch.core.health;

import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.saga.registry.SagaRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

public class SagaDispatchHealthIndicator implements ReactiveHealthIndicator {

    private final SagaPersister persister;
    private final SagaRegistry registry;

    public SagaDispatchHealthIndicator(SagaPersister persister, SagaRegistry registry) {
        this.persister = persister;
        this.registry = registry;
    }

    @Override
    public Mono<Health> health() {
        int sagas = registry.getAll().size();
        return persister.isHealthy()
                .map(healthy -> healthy
                        ? Health.up().withDetail("sagas", sagas).build()
                        : Health.down().withDetail("reason", "Saga persister unhealthy").build())
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
