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
 * A single finding produced by a validation check.
 */
@Data
@Builder
@Jacksonized
public class ValidationIssue {

    private final IssueSeverity severity;
    private final IssueCode code;
    private final String message;
    private final String column;

    public static ValidationIssue of(IssueSeverity severity, IssueCode code, String message, String column) {
        return ValidationIssue.builder()
                .severity(severity)
                .code(code)
                .message(message)
                .column(column)
                .build();
    }

    public static ValidationIssue error(IssueCode code, String message, String column) {
        return of(IssueSeverity.ERROR, code, message, column);
    }

    public static ValidationIssue warning(IssueCode code, String message, String column) {
        return of(IssueSeverity.WARNING, code, message, column);
    }

    public static ValidationIssue info(IssueCode code, String message, String column) {
        return of(IssueSeverity.INFO, code, message, column);
    }
}
