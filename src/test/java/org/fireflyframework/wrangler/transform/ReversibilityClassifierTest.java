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

import org.fireflyframework.wrangler.model.TransformationType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReversibilityClassifier}.
 */
class ReversibilityClassifierTest {

    private final ReversibilityClassifier classifier = new ReversibilityClassifier();

    @Test
    void classify_shouldMarkRowDestroyingTypesIrreversible() {
        // Then
        assertThat(classifier.isReversible(TransformationType.REMOVE_OUTLIERS, Map.of())).isFalse();
        assertThat(classifier.isReversible(TransformationType.DROP_DUPLICATES, Map.of())).isFalse();
        assertThat(classifier.classify(TransformationType.DROP_DUPLICATES, Map.of()).reason())
                .isEqualTo("Duplicate removal permanently removes rows");
    }

    @Test
    void classify_shouldMarkValueMappingsReversible() {
        // Then
        assertThat(classifier.isReversible(TransformationType.NORMALIZE, Map.of("method", "standard"))).isTrue();
        assertThat(classifier.isReversible(TransformationType.ENCODE_CATEGORICAL, Map.of("method", "label"))).isTrue();
        assertThat(classifier.classify(TransformationType.CAST_TYPE, Map.of()).reason())
                .isEqualTo("cast_type transformations are reversible");
    }

    @Test
    void classify_shouldOnlyTreatConstantFillAsReversible() {
        // Then
        assertThat(classifier.isReversible(TransformationType.FILL_MISSING, Map.of("strategy", "constant"))).isTrue();
        assertThat(classifier.classify(TransformationType.FILL_MISSING, Map.of("strategy", "median")))
                .isEqualTo(new Reversibility(false, "Fill with median is not reversible (original values lost)"));
    }
}
