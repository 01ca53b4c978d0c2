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

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable progress record of one pipeline run.
 *
 * <p>Only the orchestrating chain mutates a state; candidate workers never touch it.</p>
 */
@Data
@NoArgsConstructor
public class PipelineState {

    private PipelineStep currentStep = PipelineStep.PROFILING;
    private List<PipelineStep> completedSteps = new ArrayList<>();
    private DataProfile dataProfile;
    private List<TransformationCandidate> candidates = new ArrayList<>();
    private List<RankedTransformation> rankedTransformations = new ArrayList<>();
    private String error;

    public void markCompleted(PipelineStep step) {
        if (!completedSteps.contains(step)) {
            completedSteps.add(step);
        }
    }

    public boolean hasCompleted(PipelineStep step) {
        return completedSteps.contains(step);
    }

    /**
     * Copies this state so it can be handed to another thread.
     */
    public PipelineState snapshot() {
        PipelineState copy = new PipelineState();
        copy.setCurrentStep(currentStep);
        copy.setCompletedSteps(new ArrayList<>(completedSteps));
        copy.setDataProfile(dataProfile);
        copy.setCandidates(new ArrayList<>(candidates));
        copy.setRankedTransformations(new ArrayList<>(rankedTransformations));
        copy.setError(error);
        return copy;
    }
}
