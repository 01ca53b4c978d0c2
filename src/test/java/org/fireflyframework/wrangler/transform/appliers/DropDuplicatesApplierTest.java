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

package org.fireflyframework.wrangler.transform.appliers;

import org.fireflyframework.wrangler.exception.TransformationException;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DropDuplicatesApplier}.
 */
class DropDuplicatesApplierTest {

    private final DropDuplicatesApplier applier = new DropDuplicatesApplier();

    private static Dataset data() {
        return Dataset.builder()
                .column("a", DataType.INTEGER, 1L, 1L, 2L, 1L)
                .column("b", DataType.STRING, "x", "x", "y", "z")
                .build();
    }

    @Test
    void apply_shouldKeepFirstOccurrenceOfWholeRows() {
        // Given
        Transformation dedupe = Transformation.builder().id("d").type(TransformationType.DROP_DUPLICATES).build();

        // When
        AppliedTransformation applied = applier.apply(data(), dedupe);

        // Then
        assertThat(applied.data().column("b").getValues()).containsExactly("x", "y", "z");
    }

    @Test
    void apply_shouldHonourColumnSubset() {
        // Given
        Transformation dedupe = Transformation.builder()
                .id("d").type(TransformationType.DROP_DUPLICATES).targetColumn("a").build();

        // When
        AppliedTransformation applied = applier.apply(data(), dedupe);

        // Then
        assertThat(applied.data().column("a").getValues()).containsExactly(1L, 2L);
        assertThat(applied.data().column("b").getValues()).containsExactly("x", "y");
    }

    @Test
    void reverse_shouldAlwaysFail() {
        // Given
        Transformation dedupe = Transformation.builder().id("d").type(TransformationType.DROP_DUPLICATES).build();
        AppliedTransformation applied = applier.apply(data(), dedupe);

        // When & Then
        assertThatThrownBy(() -> applier.reverse(applied.data(), dedupe, applied.context()))
                .isInstanceOf(TransformationException.class)
                .hasMessageContaining("not reversible");
    }
}
