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
 * A transformation together with its validation outcome and quality comparison.
 */
@Data
@Builder
@Jacksonized
public class TransformationCandidate {

    private final Transformation transformation;
    private final ValidationResult validationResult;
    private final QualityMetrics qualityBefore;
    private final QualityMetrics qualityAfter;
    private final QualityDelta qualityDelta;

    public static TransformationCandidate of(Transformation transformation, ValidationResult validationResult,
                                             QualityDelta qualityDelta) {
        return TransformationCandidate.builder()
                .transformation(transformation)
                .validationResult(validationResult)
                .qualityBefore(qualityDelta.getBefore())
                .qualityAfter(qualityDelta.getAfter())
                .qualityDelta(qualityDelta)
                .build();
    }
}
