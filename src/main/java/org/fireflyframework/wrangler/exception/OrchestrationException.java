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

package org.fireflyframework.wrangler.exception;

import java.util.Map;

/**
 * Thrown when a checkpoint cannot be persisted or a pipeline step fails unrecoverably.
 */
public class OrchestrationException extends WranglerException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public OrchestrationException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public OrchestrationException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
