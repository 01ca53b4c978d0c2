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

import org.fireflyframework.wrangler.exception.ValidationException;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.IssueCode;
import org.fireflyframework.wrangler.model.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TransformationValidator}.
 */
@ExtendWith(MockitoExtension.class)
class TransformationValidatorTest {

    @Mock
    private ValidationCheck first;

    @Mock
    private ValidationCheck second;

    private final Dataset original = Dataset.builder()
            .column("n", DataType.INTEGER, 1L, 2L, 3L, 4L)
            .column("s", DataType.STRING, "a", "b", "c", "d")
            .build();

    @Test
    void validate_shouldPassWhenOnlyWarningsAreFound() {
        // Given
        TransformationValidator validator = new TransformationValidator();
        Dataset transformed = original
                .withColumn(Column.of("n", DataType.STRING, "10", "20", "30", "40"))
                .withColumn(Column.of("s", DataType.STRING, "e", "f", "g", "h"));

        // When
        ValidationResult result = validator.validate(original, transformed, null);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(result.isSchemaCompatible()).isTrue();
        assertThat(result.hasIssue(IssueCode.TYPE_CONVERSION)).isTrue();
        assertThat(result.getOriginalRowCount()).isEqualTo(4);
        assertThat(result.getTransformedRowCount()).isEqualTo(4);
    }

    @Test
    void validate_shouldFailAndMarkSchemaIncompatibleOnSchemaErrors() {
        // Given
        TransformationValidator validator = new TransformationValidator();

        // When
        ValidationResult result = validator.validate(original, original.withoutColumn("s"), null);

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.isSchemaCompatible()).isFalse();
        assertThat(result.hasIssue(IssueCode.COLUMN_REMOVED)).isTrue();
        assertThat(result.hasIssue(IssueCode.MISSING_COLUMN)).isTrue();
    }

    @Test
    void validate_shouldRunEveryCheck() {
        // Given
        when(first.check(any())).thenReturn(List.of());
        when(second.check(any())).thenReturn(List.of());
        TransformationValidator validator = new TransformationValidator(List.of(first, second));

        // When
        ValidationResult result = validator.validate(original, original, null);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getIssues()).isEmpty();
        verify(first).check(any());
        verify(second).check(any());
    }

    @Test
    void validate_shouldWrapCheckFailures() {
        // Given
        when(first.getCheckName()).thenReturn("broken");
        when(first.check(any())).thenThrow(new IllegalStateException("boom"));
        TransformationValidator validator = new TransformationValidator(List.of(first));

        // When & Then
        assertThatThrownBy(() -> validator.validate(original, original, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Validation check 'broken' failed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
