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

package org.fireflyframework.wrangler.orchestrator;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.RankedTransformation;

import java.time.Duration;
import java.util.List;

/**
 * Structured outcome of a pipeline run. Failed runs carry {@code success=false} and an
 * {@code error} message rather than an exception.
 */
@Data
@Builder
public class PipelineResult {

    private final boolean success;
    private final Dataset data;
    private final DataProfile profile;
    @Builder.Default
    private final List<RankedTransformation> rankedTransformations = List.of();
    private final String error;
    private final Duration executionTime;
    private final PipelineState state;
}
