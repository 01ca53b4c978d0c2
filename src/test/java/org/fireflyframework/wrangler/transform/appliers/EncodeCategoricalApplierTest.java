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
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EncodeCategoricalApplier}.
 */
class EncodeCategoricalApplierTest {

    private final EncodeCategoricalApplier applier = new EncodeCategoricalApplier();

    private static Dataset cities() {
        return Dataset.builder()
                .column("id", DataType.INTEGER, 1L, 2L, 3L, 4L)
                .column("city", DataType.STRING, "NYC", "LA", null, "NYC")
                .column("score", DataType.FLOAT, 0.1, 0.2, 0.3, 0.4)
                .build();
    }

    private static Transformation encode(String method) {
        return Transformation.builder()
                .id("e").type(TransformationType.ENCODE_CATEGORICAL).targetColumn("city").param("method", method)
                .reversible(true)
                .build();
    }

    @Test
    void label_shouldAssignSortedCodesAndReverseExactly() {
        // Given
        Dataset data = cities();

        // When
        AppliedTransformation applied = applier.apply(data, encode("label"));
        Dataset restored = applier.reverse(applied.data(), encode("label"), applied.context());

        // Then
        assertThat(applied.data().column("city").getValues()).containsExactly(1L, 0L, null, 1L);
        assertThat(applied.data().column("city").getType()).isEqualTo(DataType.INTEGER);
        assertThat(restored.column("city")).isEqualTo(data.column("city"));
    }

    @Test
    void label_reverseShouldFailOnUnknownCode() {
        // Given
        AppliedTransformation applied = applier.apply(cities(), encode("label"));
        Dataset tampered = applied.data().withColumn(
                applied.data().column("city").withValues(DataType.INTEGER, Arrays.asList(1L, 0L, null, 9L)));

        // When & Then
        assertThatThrownBy(() -> applier.reverse(tampered, encode("label"), applied.context()))
                .isInstanceOf(TransformationException.class)
                .hasMessageContaining("Unknown label code");
    }

    @Test
    void onehot_shouldInsertIndicatorsAtOriginalPosition() {
        // When
        AppliedTransformation applied = applier.apply(cities(), encode("onehot"));

        // Then
        Dataset encoded = applied.data();
        assertThat(encoded.getColumnNames()).containsExactly("id", "city_LA", "city_NYC", "score");
        assertThat(encoded.column("city_NYC").getValues()).containsExactly(true, false, false, true);
        assertThat(encoded.column("city_LA").getType()).isEqualTo(DataType.BOOLEAN);
    }

    @Test
    void onehot_reverseShouldRebuildColumnInPlace() {
        // Given
        Dataset data = cities();
        AppliedTransformation applied = applier.apply(data, encode("onehot"));

        // When
        Dataset restored = applier.reverse(applied.data(), encode("onehot"), applied.context());

        // Then
        assertThat(restored.getColumnNames()).containsExactly("id", "city", "score");
        assertThat(restored.column("city")).isEqualTo(data.column("city"));
    }

    @Test
    void onehot_shouldRejectIndicatorNameCollisions() {
        // Given
        Dataset data = cities().withColumn(
                Column.of("city_LA", DataType.BOOLEAN, true, true, true, true));

        // When & Then
        assertThatThrownBy(() -> applier.apply(data, encode("onehot")))
                .isInstanceOf(TransformationException.class)
                .hasMessageContaining("already in use");
    }
}
