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

import java.time.Duration;

/**
 * Outcome of applying one {@link Transformation} to a dataset.
 *
 * <p>On failure {@code data} is the input dataset, unchanged.</p>
 */
@Data
@Builder
public class TransformationResult {

    private final Transformation transformation;
    private final boolean success;
    private final Dataset data;
    private final String errorMessage;
    private final Duration executionTime;

    public static TransformationResult success(Transformation transformation, Dataset data, Duration executionTime) {
        return TransformationResult.builder()
                .transformation(transformation)
                .success(true)
                .data(data)
                .executionTime(executionTime)
                .build();
    }

    public static TransformationResult failure(Transformation transformation, Dataset original,
                                               String errorMessage, Duration executionTime) {
        return TransformationResult.builder()
                .transformation(transformation)
                .success(false)
                .data(original)
                .errorMessage(errorMessage)
                .executionTime(executionTime)
                .build();
    }
}
