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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RemoveOutliersApplier}.
 */
class RemoveOutliersApplierTest {

    private final RemoveOutliersApplier applier = new RemoveOutliersApplier();

    private static Dataset readings() {
        return Dataset.builder()
                .column("id", DataType.INTEGER, 1L, 2L, 3L, 4L, 5L, 6L)
                .column("value", DataType.FLOAT, 10.0, 11.0, 12.0, 11.5, 10.5, 100.0)
                .build();
    }

    private static Transformation outliers(String method, String action) {
        return Transformation.builder()
                .id("o").type(TransformationType.REMOVE_OUTLIERS).targetColumn("value")
                .param("method", method).param("action", action)
                .build();
    }

    @Test
    void iqr_shouldRemoveOutlierRows() {
        // When
        AppliedTransformation applied = applier.apply(readings(), outliers("iqr", "remove"));

        // Then
        assertThat(applied.data().getRowCount()).isEqualTo(5);
        assertThat(applied.data().column("id").getValues()).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(applied.context()).isEqualTo(new ReversalContext.RowRemoval("value", List.of(5)));
    }

    @Test
    void mask_shouldNullOutliersAndKeepRows() {
        // When
        AppliedTransformation applied = applier.apply(readings(), outliers("iqr", "mask"));

        // Then
        assertThat(applied.data().getRowCount()).isEqualTo(6);
        assertThat(applied.data().column("value").get(5)).isNull();
    }

    @Test
    void zscore_shouldIgnoreConstantColumns() {
        // Given
        Dataset constant = Dataset.builder().column("value", DataType.FLOAT, 3.0, 3.0, 3.0).build();

        // When
        AppliedTransformation applied = applier.apply(constant, outliers("zscore", "remove"));

        // Then
        assertThat(applied.data().getRowCount()).isEqualTo(3);
    }

    @Test
    void reverse_shouldAlwaysFail() {
        // Given
        AppliedTransformation applied = applier.apply(readings(), outliers("iqr", "remove"));

        // When & Then
        assertThatThrownBy(() -> applier.reverse(applied.data(), outliers("iqr", "remove"), applied.context()))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Outlier removal is not reversible");
    }
}
