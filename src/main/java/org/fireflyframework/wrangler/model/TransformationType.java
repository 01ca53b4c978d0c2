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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of transformation kinds the executor knows how to apply.
 */
public enum TransformationType {

    FILL_MISSING("fill_missing"),
    NORMALIZE("normalize"),
    ENCODE_CATEGORICAL("encode_categorical"),
    REMOVE_OUTLIERS("remove_outliers"),
    DROP_DUPLICATES("drop_duplicates"),
    CAST_TYPE("cast_type");

    private final String value;

    TransformationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
