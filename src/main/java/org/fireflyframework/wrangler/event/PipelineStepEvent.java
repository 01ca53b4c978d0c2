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

package org.fireflyframework.wrangler.event;

import lombok.Data;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.wrangler.orchestrator.PipelineOrchestrator}
 * after a step's checkpoint has been written.
 */
@Data
public class PipelineStepEvent {

    private final String runName;
    private final PipelineStep step;
    private final PipelineState state;
    private final String checkpointLocation;
    private final Instant timestamp;

    public PipelineStepEvent(String runName, PipelineStep step, PipelineState state, String checkpointLocation) {
        this.runName = runName;
        this.step = step;
        this.state = state;
        this.checkpointLocation = checkpointLocation;
        this.timestamp = Instant.now();
    }
}
