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

package org.fireflyframework.sagadispatch.core.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sagadispatch.core.exception.SagaConfigurationException;
import org.fireflyframework.sagadispatch.core.validation.ValidationIssue.Severity;
import org.fireflyframework.sagadispatch.saga.model.SagaMessage;
import org.fireflyframework.sagadispatch.saga.registry.SagaDefinition;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates saga definitions at registration time. Produces a list of
 * {@link ValidationIssue}s; {@link #validateAndThrow(List, boolean)} aborts startup when
 * errors (or, if requested, warnings) were found.
 */
@Slf4j
public class SagaDefinitionValidator {

    public List<ValidationIssue> validate(SagaDefinition def) {
        List<ValidationIssue> issues = new ArrayList<>();
        String loc = "saga." + def.sagaType.getSimpleName();

        if (def.entityFactory == null) {
            issues.add(new ValidationIssue(Severity.ERROR, "Saga has no entity factory", loc));
        }
        if (def.handlers.isEmpty() && def.timeoutHandlers.isEmpty()) {
            issues.add(new ValidationIssue(Severity.ERROR, "Saga declares no message or timeout handlers", loc));
            return issues;
        }
        if (def.startedBy.isEmpty()) {
            issues.add(new ValidationIssue(Severity.WARNING,
                    "Saga is not started by any message type; it can only be reached through existing entities",
                    loc));
        }

        for (Class<?> messageType : def.handlers.keySet()) {
            boolean correlated = def.startedBy.contains(messageType)
                    || def.finders.containsKey(messageType)
                    || def.correlations.containsKey(messageType)
                    || SagaMessage.class.isAssignableFrom(messageType);
            if (!correlated) {
                issues.add(new ValidationIssue(Severity.WARNING,
                        "Handled message type " + messageType.getName()
                                + " neither starts the saga nor has a finder, correlation or saga id",
                        loc + ".handler." + messageType.getSimpleName()));
            }
        }

        for (Class<?> payloadType : def.timeoutHandlers.keySet()) {
            if (payloadType.isInterface() || Modifier.isAbstract(payloadType.getModifiers())) {
                issues.add(new ValidationIssue(Severity.ERROR,
                        "Timeout payload type " + payloadType.getName()
                                + " is abstract; timeouts are matched on their exact payload type",
                        loc + ".timeout." + payloadType.getSimpleName()));
            }
        }

        for (Map.Entry<Class<?>, ?> correlation : def.correlations.entrySet()) {
            if (!def.handlers.containsKey(correlation.getKey())) {
                issues.add(new ValidationIssue(Severity.WARNING,
                        "Correlation declared for " + correlation.getKey().getName() + " which the saga does not handle",
                        loc + ".correlation." + correlation.getKey().getSimpleName()));
            }
        }
        return issues;
    }

    public void validateAndThrow(List<ValidationIssue> issues, boolean failOnWarning) {
        for (ValidationIssue issue : issues) {
            switch (issue.severity()) {
                case WARNING -> log.warn("[validation] {} at {}", issue.message(), issue.location());
                case ERROR -> log.error("[validation] {} at {}", issue.message(), issue.location());
            }
        }

        List<ValidationIssue> failures = issues.stream()
                .filter(i -> i.severity() == Severity.ERROR || failOnWarning)
                .toList();

        if (!failures.isEmpty()) {
            String messages = failures.stream()
                    .map(i -> i.location() + ": " + i.message())
                    .collect(Collectors.joining("; "));
            throw new SagaConfigurationException("Saga validation failed with " + failures.size()
                    + " issue(s): " + messages);
        }
    }
}
