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

package org.fireflyframework.sagadispatch.core.exception;

import java.util.Map;

/**
 * Raised when a timeout arrives for a saga that declares no handler for the timeout's
 * payload type. The saga scheduled a timeout it cannot receive, so the dispatch is aborted
 * and the message is handed back to the transport.
 */
public final class SagaTimeoutHandlerNotFoundException extends SagaDispatchException {

    private final Class<?> payloadType;
    private final Class<?> sagaType;

    public SagaTimeoutHandlerNotFoundException(Class<?> payloadType, Class<?> sagaType) {
        super(String.format("Timeout arrived with state %s, but saga %s has no timeout handler accepting exactly %s. "
                        + "Declare a method annotated with @SagaTimeout taking a single %s parameter on %s, "
                        + "or register one with SagaDefinitionBuilder.timeout(%s.class, ...)",
                        payloadType.getName(), sagaType.getName(), payloadType.getName(),
                        payloadType.getSimpleName(), sagaType.getSimpleName(), payloadType.getSimpleName()),
                "SAGA_TIMEOUT_HANDLER_NOT_FOUND",
                Map.of("payloadType", payloadType.getName(), "sagaType", sagaType.getName()),
                null);
        this.payloadType = payloadType;
        this.sagaType = sagaType;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public Class<?> getSagaType() {
        return sagaType;
    }
}
