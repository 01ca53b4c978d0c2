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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.ValidationException;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.IssueSeverity;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.ValidationIssue;
import org.fireflyframework.wrangler.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a set of {@link ValidationCheck}s over an original/transformed dataset pair and
 * aggregates their issues into a {@link ValidationResult}.
 *
 * <p>Every check runs, whatever the others report. The result passes when no issue has
 * {@link IssueSeverity#ERROR} severity and is schema-compatible when no schema check reported
 * an error. A check that throws is an internal fault and surfaces as a
 * {@link ValidationException}.</p>
 */
@Slf4j
public class TransformationValidator {

    private final List<ValidationCheck> checks;

    /**
     * Creates a validator with the integrity, leakage and schema checks at default thresholds.
     */
    public TransformationValidator() {
        this(List.of(new IntegrityValidator(), new LeakageDetector(), new SchemaValidator()));
    }

    public TransformationValidator(List<ValidationCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public ValidationResult validate(Dataset original, Dataset transformed, DataProfile profile) {
        return validate(original, transformed, profile, null);
    }

    /**
     * Validates a transformed dataset against its original.
     *
     * @param original       the dataset before the transformation
     * @param transformed    the dataset after the transformation
     * @param profile        the profile of {@code original}, or {@code null}
     * @param transformation the transformation that was applied, or {@code null}
     * @return the aggregated result
     */
    public ValidationResult validate(Dataset original, Dataset transformed, DataProfile profile,
                                     Transformation transformation) {
        ValidationContext context = new ValidationContext(original, transformed, profile, transformation);
        List<ValidationIssue> issues = new ArrayList<>();
        boolean schemaCompatible = true;

        for (ValidationCheck check : checks) {
            List<ValidationIssue> found = runCheck(check, context);
            issues.addAll(found);
            if (check.isSchemaCheck() && found.stream().anyMatch(issue -> issue.getSeverity() == IssueSeverity.ERROR)) {
                schemaCompatible = false;
            }
        }

        ValidationResult result = ValidationResult.of(issues, original.getRowCount(), transformed.getRowCount(),
                schemaCompatible);
        if (log.isDebugEnabled()) {
            log.debug("Validation of {}: passed={}, errors={}, warnings={}",
                    transformation != null ? transformation.getDescription() : "dataset",
                    result.isPassed(), result.errors().size(), result.warnings().size());
        }
        return result;
    }

    private List<ValidationIssue> runCheck(ValidationCheck check, ValidationContext context) {
        try {
            return check.check(context);
        } catch (RuntimeException e) {
            throw new ValidationException("Validation check '" + check.getCheckName() + "' failed", e);
        }
    }
}
