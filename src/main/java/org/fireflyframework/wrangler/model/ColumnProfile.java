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
import lombok.extern.jackson.Jacksonized;

/**
 * Per-column statistics of a {@link DataProfile}.
 *
 * <p>{@code min}, {@code max}, {@code mean} and {@code std} are only known for numeric
 * columns and are {@code null} otherwise.</p>
 */
@Data
@Builder
@Jacksonized
public class ColumnProfile {

    private final String name;
    private final DataType dtype;
    private final long nullCount;
    private final double nullPercentage;
    private final Integer uniqueCount;
    private final Double min;
    private final Double max;
    private final Double mean;
    private final Double std;
    private final InferredType inferredType;
}
