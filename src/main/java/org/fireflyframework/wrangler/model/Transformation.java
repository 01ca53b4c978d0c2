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

package org.fireflyframework.wrangler.model;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Immutable descriptor of a single proposed data-cleaning operation.
 *
 * <p>An empty {@code targetColumns} list means "all columns" for types that operate
 * row-wise, such as {@link TransformationType#DROP_DUPLICATES}.</p>
 */
@Data
@Builder
@Jacksonized
public class Transformation {

    private final String id;
    private final TransformationType type;
    @Singular
    private final List<String> targetColumns;
    @Singular
    private final Map<String, Object> params;
    private final boolean reversible;
    private final String description;

    /**
     * Returns a named parameter, or the given default when it is absent.
     *
     * @param name         the parameter name
     * @param defaultValue the value to return when the parameter is not set
     * @return the parameter value
     */
    public Object param(String name, Object defaultValue) {
        Object value = params.get(name);
        return value != null ? value : defaultValue;
    }

    public String stringParam(String name, String defaultValue) {
        return String.valueOf(param(name, defaultValue));
    }

    public double doubleParam(String name, double defaultValue) {
        Object value = params.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value != null ? Double.parseDouble(value.toString()) : defaultValue;
    }
}
