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
 * Base class of every error raised by the saga dispatch core.
 *
 * <p>Each subclass carries a stable {@code errorCode} that operators can alert on,
 * plus an optional context map with the identifiers involved in the failure.
 */
public abstract class SagaDispatchException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    protected SagaDispatchException(String message, String errorCode) {
        this(message, errorCode, Map.of(), null);
    }

    protected SagaDispatchException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, Map.of(), cause);
    }

    protected SagaDispatchException(String message, String errorCode, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
