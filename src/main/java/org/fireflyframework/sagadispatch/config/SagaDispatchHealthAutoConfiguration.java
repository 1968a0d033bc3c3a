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
import org.fireflyframework.sagadispatch.core.health.SagaDispatchHealthIndicator;
import org.fireflyframework.sagadispatch.core.persistence.SagaPersister;
import org.fireflyframework.sagadispatch.saga.registry.SagaRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the actuator health indicator.
 */
@Slf4j
@AutoConfiguration(after = SagaDispatchAutoConfiguration.class)
@ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
@ConditionalOnProperty(name = "firefly.saga-dispatch.enabled", havingValue = "true", matchIfMissing = true)
public class SagaDispatchHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({SagaPersister.class, SagaRegistry.class})
    @ConditionalOnProperty(name = "firefly.saga-dispatch.health.enabled", havingValue = "true", matchIfMissing = true)
    public SagaDispatchHealthIndicator sagaDispatchHealthIndicator(SagaPersister persister, SagaRegistry registry) {
        log.info("[saga-dispatch] Health indicator initialized");
        return new SagaDispatchHealthIndicator(persister, registry);
    }
}
