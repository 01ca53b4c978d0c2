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

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base unchecked exception for the data wrangler.
 *
 * <p>Carries an optional map of diagnostic details which is appended to the
 * message as {@code "message (key=value, ...)"} when rendered.</p>
 */
@Getter
public class WranglerException extends RuntimeException {

    private final Map<String, Object> details;

    public WranglerException(String message) {
        this(message, Map.of(), null);
    }

    public WranglerException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }

    public WranglerException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    public WranglerException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public String toString() {
        if (details.isEmpty()) {
            return getMessage();
        }
        String rendered = details.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
        return getMessage() + " (" + rendered + ")";
    }
}
