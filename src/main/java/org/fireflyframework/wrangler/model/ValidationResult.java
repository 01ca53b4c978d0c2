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

import java.util.List;

/**
 * Aggregated outcome of validating a transformed dataset against its original.
 *
 * <p>{@code passed} is {@code false} exactly when at least one {@link IssueSeverity#ERROR}
 * issue exists.</p>
 */
@Data
@Builder
@Jacksonized
public class ValidationResult {

    private final boolean passed;
    @Builder.Default
    private final List<ValidationIssue> issues = List.of();
    private final int originalRowCount;
    private final int transformedRowCount;
    private final boolean schemaCompatible;

    /**
     * Assembles a result, deriving the pass flag from the issue severities.
     *
     * @param issues              all issues found
     * @param originalRowCount    rows before the transformation
     * @param transformedRowCount rows after the transformation
     * @param schemaCompatible    whether the schema check reported no error
     * @return the validation result
     */
    public static ValidationResult of(List<ValidationIssue> issues, int originalRowCount,
                                      int transformedRowCount, boolean schemaCompatible) {
        boolean noErrors = issues.stream().noneMatch(issue -> issue.getSeverity() == IssueSeverity.ERROR);
        return ValidationResult.builder()
                .passed(noErrors)
                .issues(List.copyOf(issues))
                .originalRowCount(originalRowCount)
                .transformedRowCount(transformedRowCount)
                .schemaCompatible(schemaCompatible)
                .build();
    }

    public List<ValidationIssue> bySeverity(IssueSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .toList();
    }

    public List<ValidationIssue> errors() {
        return bySeverity(IssueSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return bySeverity(IssueSeverity.WARNING);
    }

    public boolean hasIssue(IssueCode code) {
        return issues.stream().anyMatch(issue -> issue.getCode() == code);
    }
}
