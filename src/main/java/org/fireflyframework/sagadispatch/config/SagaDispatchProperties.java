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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties of the saga dispatch core.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   saga-dispatch:
 *     enabled: true
 *     id-strategy: comb
 *     validation:
 *       enabled: true
 *       fail-on-warning: false
 *     metrics:
 *       enabled: true
 *     health:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.saga-dispatch")
public class SagaDispatchProperties {

    /**
     * How ids of new sagas without a correlation id are generated.
     */
    public enum IdStrategy {
        /** Time-ordered UUIDs; index friendly. */
        COMB,
        RANDOM
    }

    private boolean enabled = true;

    private IdStrategy idStrategy = IdStrategy.COMB;

    @NestedConfigurationProperty
    private ValidationProperties validation = new ValidationProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    // --- Getters and Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public IdStrategy getIdStrategy() { return idStrategy; }
    public void setIdStrategy(IdStrategy idStrategy) { this.idStrategy = idStrategy; }

    public ValidationProperties getValidation() { return validation; }
    public void setValidation(ValidationProperties validation) { this.validation = validation; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    // --- Nested property classes ---

    public static class ValidationProperties {
        private boolean enabled = true;
        private boolean failOnWarning = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isFailOnWarning() { return failOnWarning; }
        public void setFailOnWarning(boolean failOnWarning) { this.failOnWarning = failOnWarning; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
