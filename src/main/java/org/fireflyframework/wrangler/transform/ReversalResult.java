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

package org.fireflyframework.wrangler.transform;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wrangler.model.Dataset;

/**
 * Outcome of reversing a transformation. On failure {@code data} is the input, unchanged,
 * and {@code error} says why.
 */
@Data
@Builder
public class ReversalResult {

    private final boolean success;
    private final Dataset data;
    private final ReversalError error;
    private final String errorMessage;

    public static ReversalResult success(Dataset data) {
        return ReversalResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    public static ReversalResult failure(Dataset data, ReversalError error, String errorMessage) {
        return ReversalResult.builder()
                .success(false)
                .data(data)
                .error(error)
                .errorMessage(errorMessage)
                .build();
    }
}
