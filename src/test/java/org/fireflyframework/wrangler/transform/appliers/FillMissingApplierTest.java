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
 * Unit tests for {@link FillMissingApplier}.
 */
class FillMissingApplierTest {

    private final FillMissingApplier applier = new FillMissingApplier();

    private static Transformation fill(String column, String strategy) {
        return Transformation.builder()
                .id("f").type(TransformationType.FILL_MISSING).targetColumn(column).param("strategy", strategy)
                .build();
    }

    private static Dataset ages() {
        return Dataset.builder().column("age", DataType.INTEGER, 10L, null, 20L, 25L).build();
    }

    @Test
    void mean_shouldPromoteIntegerColumnWhenFillIsFractional() {
        // When
        AppliedTransformation applied = applier.apply(ages(), fill("age", "mean"));

        // Then
        assertThat(applied.data().column("age").getType()).isEqualTo(DataType.FLOAT);
        assertThat(applied.data().column("age").getValues()).containsExactly(10.0, 55.0 / 3, 20.0, 25.0);
        assertThat(applied.context()).isInstanceOf(ReversalContext.FillContext.class);
    }

    @Test
    void median_shouldKeepIntegerColumnWhenFillIsWhole() {
        // When
        AppliedTransformation applied = applier.apply(ages(), fill("age", "median"));

        // Then
        assertThat(applied.data().column("age").getType()).isEqualTo(DataType.INTEGER);
        assertThat(applied.data().column("age").getValues()).containsExactly(10L, 20L, 20L, 25L);
    }

    @Test
    void mode_shouldBreakTiesTowardsSmallerValue() {
        // Given
        Dataset data = Dataset.builder().column("city", DataType.STRING, "SF", "LA", null, "SF", "LA").build();

        // When
        AppliedTransformation applied = applier.apply(data, fill("city", "mode"));

        // Then
        assertThat(applied.data().column("city").getValues()).containsExactly("SF", "LA", "LA", "SF", "LA");
    }

    @Test
    void constant_shouldBeReversible() {
        // Given
        Dataset data = ages();
        Transformation constant = Transformation.builder()
                .id("c").type(TransformationType.FILL_MISSING).targetColumn("age")
                .param("strategy", "constant").param("fill_value", 0)
                .reversible(true)
                .build();

        // When
        AppliedTransformation applied = applier.apply(data, constant);
        Dataset restored = applier.reverse(applied.data(), constant, applied.context());

        // Then
        assertThat(applied.data().column("age").getValues()).containsExactly(10L, 0L, 20L, 25L);
        assertThat(restored.column("age")).isEqualTo(data.column("age"));
    }

    @Test
    void reverse_shouldRefuseStatisticalFills() {
        // Given
        AppliedTransformation applied = applier.apply(ages(), fill("age", "mean"));

        // When & Then
        assertThatThrownBy(() -> applier.reverse(applied.data(), fill("age", "mean"), applied.context()))
                .isInstanceOf(TransformationException.class)
                .hasMessageContaining("not reversible");
    }

    @Test
    void apply_shouldRejectUnknownStrategy() {
        // When & Then
        assertThatThrownBy(() -> applier.apply(ages(), fill("age", "interpolate")))
                .isInstanceOf(TransformationException.class)
                .hasMessageContaining("Unknown fill strategy");
    }
}
