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

package org.fireflyframework.wrangler.checkpoint;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;
import org.fireflyframework.wrangler.model.RankedTransformation;
import org.fireflyframework.wrangler.model.TransformationCandidate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a {@link PipelineState}, stamped with the time it was saved.
 */
@Data
@Builder
@Jacksonized
public class CheckpointDocument {

    private final PipelineStep currentStep;
    @Builder.Default
    private final List<PipelineStep> completedSteps = List.of();
    private final DataProfile dataProfile;
    @Builder.Default
    private final List<TransformationCandidate> candidates = List.of();
    @Builder.Default
    private final List<RankedTransformation> rankedTransformations = List.of();
    private final String error;
    private final Instant savedAt;

    public static CheckpointDocument from(PipelineState state, Instant savedAt) {
        return CheckpointDocument.builder()
                .currentStep(state.getCurrentStep())
                .completedSteps(List.copyOf(state.getCompletedSteps()))
                .dataProfile(state.getDataProfile())
                .candidates(List.copyOf(state.getCandidates()))
                .rankedTransformations(List.copyOf(state.getRankedTransformations()))
                .error(state.getError())
                .savedAt(savedAt)
                .build();
    }

    public PipelineState toState() {
        PipelineState state = new PipelineState();
        if (currentStep != null) {
            state.setCurrentStep(currentStep);
        }
        state.setCompletedSteps(new ArrayList<>(completedSteps));
        state.setDataProfile(dataProfile);
        state.setCandidates(new ArrayList<>(candidates));
        state.setRankedTransformations(new ArrayList<>(rankedTransformations));
        state.setError(error);
        return state;
    }
}
