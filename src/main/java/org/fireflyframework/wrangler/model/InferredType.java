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

/**
 * Semantic type assigned to a column by profiling, independent of its physical {@link DataType}.
 *
 * <ul>
 *   <li>{@link #NUMERIC} - quantities that can be averaged and scaled</li>
 *   <li>{@link #CATEGORICAL} - a small set of repeating labels</li>
 *   <li>{@link #DATETIME} - timestamps or dates</li>
 *   <li>{@link #TEXT} - free-form strings with many distinct values</li>
 *   <li>{@link #BOOLEAN} - two-valued flags</li>
 * </ul>
 */
public enum InferredType {

    NUMERIC,
    CATEGORICAL,
    DATETIME,
    TEXT,
    BOOLEAN
}
