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

import org.fireflyframework.wrangler.exception.GenerationException;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.InferredType;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CandidateGenerator}.
 */
class CandidateGeneratorTest {

    private final CandidateGenerator generator = new CandidateGenerator();

    private static ColumnProfile age() {
        return ColumnProfile.builder()
                .name("age").dtype(DataType.INTEGER).nullCount(2).nullPercentage(20.0).uniqueCount(8)
                .min(23.0).max(52.0).mean(36.25).std(9.6)
                .inferredType(InferredType.NUMERIC)
                .build();
    }

    private static ColumnProfile city() {
        return ColumnProfile.builder()
                .name("city").dtype(DataType.STRING).nullCount(0).nullPercentage(0.0).uniqueCount(3)
                .inferredType(InferredType.CATEGORICAL)
                .build();
    }

    private static ColumnProfile notes() {
        return ColumnProfile.builder()
                .name("notes").dtype(DataType.STRING).nullCount(0).nullPercentage(0.0).uniqueCount(10)
                .inferredType(InferredType.TEXT)
                .build();
    }

    private static DataProfile profile(int duplicateRows, ColumnProfile... columns) {
        Map<String, ColumnProfile> byName = new LinkedHashMap<>();
        for (ColumnProfile column : columns) {
            byName.put(column.getName(), column);
        }
        return DataProfile.builder()
                .rowCount(10).columnCount(columns.length).columns(byName).duplicateRows(duplicateRows)
                .build();
    }

    @Test
    void generate_shouldEmitRuleFamiliesInOrder() {
        // When
        List<Transformation> candidates = generator.generate(profile(1, age(), city(), notes()));

        // Then
        assertThat(candidates).extracting(Transformation::getDescription).containsExactly(
                "Fill missing values in age with mean",
                "Fill missing values in age with median",
                "Fill missing values in age with constant 0",
                "Standard normalize age (z-score)",
                "Min-max normalize age",
                "One-hot encode city",
                "Label encode city",
                "Remove outliers from age using IQR",
                "Remove outliers from age using z-score",
                "Remove duplicate rows",
                "Cast notes to datetime",
                "Cast notes to numeric");
    }

    @Test
    void generate_shouldSetParamsAndReversibility() {
        // When
        List<Transformation> candidates = generator.generate(profile(1, age(), city()));

        // Then
        Transformation constantFill = candidates.get(2);
        assertThat(constantFill.getParams()).containsEntry("strategy", "constant").containsEntry("fill_value", 0);
        assertThat(constantFill.isReversible()).isTrue();
        assertThat(candidates.get(0).isReversible()).isFalse();

        Transformation duplicates = candidates.stream()
                .filter(t -> t.getType() == TransformationType.DROP_DUPLICATES)
                .findFirst().orElseThrow();
        assertThat(duplicates.getTargetColumns()).isEmpty();
        assertThat(duplicates.isReversible()).isFalse();
    }

    @Test
    void generate_shouldIncludeFillForAgeAndBothEncodingsForCity() {
        // When
        List<Transformation> candidates = generator.generate(profile(0, age(), city()));

        // Then
        assertThat(candidates).anyMatch(t -> t.getType() == TransformationType.FILL_MISSING
                && t.getTargetColumns().equals(List.of("age")));
        assertThat(candidates)
                .filteredOn(t -> t.getType() == TransformationType.ENCODE_CATEGORICAL)
                .extracting(t -> t.getParams().get("method"))
                .containsExactly("onehot", "label");
        assertThat(candidates).noneMatch(t -> t.getType() == TransformationType.DROP_DUPLICATES);
    }

    @Test
    void generate_shouldBeDeterministic() {
        // Given
        DataProfile profile = profile(0, age(), city());

        // When
        List<Transformation> first = generator.generate(profile);
        List<Transformation> second = generator.generate(profile);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(Transformation::getId).doesNotHaveDuplicates();
    }

    @Test
    void generate_shouldHonourAllowedTypesAndMaximum() {
        // Given
        CandidateGenerator restricted = new CandidateGenerator(new ReversibilityClassifier(),
                EnumSet.of(TransformationType.NORMALIZE, TransformationType.ENCODE_CATEGORICAL), 3);

        // When
        List<Transformation> candidates = restricted.generate(profile(0, age(), city()));

        // Then
        assertThat(candidates).extracting(Transformation::getType).containsExactly(
                TransformationType.NORMALIZE, TransformationType.NORMALIZE, TransformationType.ENCODE_CATEGORICAL);
    }

    @Test
    void generate_shouldRejectMalformedProfiles() {
        // Given
        ColumnProfile untyped = ColumnProfile.builder().name("x").dtype(DataType.STRING).build();

        // When & Then
        assertThatThrownBy(() -> generator.generate(null)).isInstanceOf(GenerationException.class);
        assertThatThrownBy(() -> generator.generate(profile(0, untyped)))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Malformed column profile");
    }
}
