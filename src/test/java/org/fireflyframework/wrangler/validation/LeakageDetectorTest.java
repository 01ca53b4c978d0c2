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

package org.fireflyframework.wrangler.validation;

import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.IssueCode;
import org.fireflyframework.wrangler.model.IssueSeverity;
import org.fireflyframework.wrangler.model.ValidationIssue;
import org.fireflyframework.wrangler.profiling.DefaultDataProfiler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LeakageDetector}.
 */
class LeakageDetectorTest {

    private final LeakageDetector detector = new LeakageDetector();

    @Test
    void check_shouldFlagUnchangedRows() {
        // Given
        Dataset data = Dataset.builder()
                .column("a", DataType.INTEGER, 1L, 2L, 3L, 4L)
                .column("b", DataType.STRING, "w", "x", "y", "z")
                .build();

        // When
        List<ValidationIssue> issues = detector.check(new ValidationContext(data, data, null, null));

        // Then
        assertThat(issues).filteredOn(issue -> issue.getCode() == IssueCode.EXACT_ROW_LEAKAGE)
                .singleElement()
                .satisfies(issue -> {
                    assertThat(issue.getSeverity()).isEqualTo(IssueSeverity.ERROR);
                    assertThat(issue.getMessage()).isEqualTo("100.0% of transformed rows are identical to original rows");
                });
    }

    @Test
    void check_shouldSkipRowOverlapWhenRowCountChanges() {
        // Given
        Dataset original = Dataset.builder().column("b", DataType.STRING, "w", "x", "y").build();
        Dataset transformed = original.selectRows(List.of(0, 1));

        // When
        List<ValidationIssue> issues = detector.check(new ValidationContext(original, transformed, null, null));

        // Then
        assertThat(issues).isEmpty();
    }

    @Test
    void check_shouldReportHighCorrelationAsInfo() {
        // Given
        Dataset original = Dataset.builder().column("a", DataType.INTEGER, 1L, 2L, 3L, 4L).build();
        Dataset shifted = Dataset.of(Column.of("a", DataType.INTEGER, 101L, 102L, 103L, 104L));

        // When
        List<ValidationIssue> issues = detector.check(new ValidationContext(original, shifted, null, null));

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getCode()).isEqualTo(IssueCode.HIGH_CORRELATION);
            assertThat(issue.getSeverity()).isEqualTo(IssueSeverity.INFO);
            assertThat(issue.getColumn()).isEqualTo("a");
        });
    }

    @Test
    void check_shouldWarnWhenCategoricalValuesAreUnchanged() {
        // Given
        Dataset original = Dataset.builder()
                .column("city", DataType.STRING, "LA", "SF", "LA", "SF", "LA")
                .column("n", DataType.INTEGER, 1L, 2L, 3L, 4L, 5L)
                .build();
        DataProfile profile = new DefaultDataProfiler().profile(original);
        Dataset transformed = original.withColumn(Column.of("n", DataType.INTEGER, 50L, 10L, 40L, 20L, 30L));

        // When
        List<ValidationIssue> issues = detector.check(new ValidationContext(original, transformed, profile, null));

        // Then
        assertThat(issues).extracting(ValidationIssue::getCode).containsExactly(IssueCode.POTENTIAL_LEAKAGE);
        assertThat(issues.get(0).getColumn()).isEqualTo("city");
    }
}
