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

import org.fireflyframework.wrangler.model.CellValues;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.InferredType;
import org.fireflyframework.wrangler.model.IssueCode;
import org.fireflyframework.wrangler.model.ValidationIssue;
import org.fireflyframework.wrangler.profiling.Statistics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Flags transformed data that still exposes the original values.
 *
 * <ul>
 *   <li>error when, with unchanged row count, more than the overlap ratio of distinct
 *       transformed rows also occur in the original</li>
 *   <li>warning when a categorical column keeps exactly the profiled set of values</li>
 *   <li>info when a numeric column correlates with its original above the threshold</li>
 * </ul>
 *
 * <p>Both thresholds are empirical and configurable.</p>
 */
public class LeakageDetector implements ValidationCheck {

    public static final double DEFAULT_ROW_OVERLAP_RATIO = 0.5;
    public static final double DEFAULT_CORRELATION_THRESHOLD = 0.99;

    private final double rowOverlapRatio;
    private final double correlationThreshold;

    public LeakageDetector() {
        this(DEFAULT_ROW_OVERLAP_RATIO, DEFAULT_CORRELATION_THRESHOLD);
    }

    public LeakageDetector(double rowOverlapRatio, double correlationThreshold) {
        this.rowOverlapRatio = rowOverlapRatio;
        this.correlationThreshold = correlationThreshold;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        checkExactRows(context.original(), context.transformed(), issues);
        for (ColumnProfile reference : context.referenceColumns()) {
            Optional<Column> original = context.original().findColumn(reference.getName());
            Optional<Column> transformed = context.transformed().findColumn(reference.getName());
            if (original.isEmpty() || transformed.isEmpty()) {
                continue;
            }
            if (reference.getInferredType() == InferredType.CATEGORICAL) {
                checkCategorical(reference, original.get(), transformed.get(), issues);
            }
            if (original.get().getType().isNumeric() && transformed.get().getType().isNumeric()) {
                checkCorrelation(original.get(), transformed.get(), issues);
            }
        }
        return issues;
    }

    private void checkExactRows(Dataset original, Dataset transformed, List<ValidationIssue> issues) {
        if (original.getRowCount() != transformed.getRowCount() || transformed.getRowCount() == 0) {
            return;
        }
        Set<List<Object>> originalRows = new HashSet<>(original.rows());
        Set<List<Object>> transformedRows = new LinkedHashSet<>(transformed.rows());
        long overlap = transformedRows.stream().filter(originalRows::contains).count();
        double ratio = (double) overlap / transformedRows.size();
        if (ratio > rowOverlapRatio) {
            issues.add(ValidationIssue.error(IssueCode.EXACT_ROW_LEAKAGE,
                    String.format(Locale.ROOT, "%.1f%% of transformed rows are identical to original rows", ratio * 100),
                    null));
        }
    }

    private void checkCategorical(ColumnProfile reference, Column original, Column transformed,
                                  List<ValidationIssue> issues) {
        if (reference.getUniqueCount() == null) {
            return;
        }
        Set<Object> after = transformed.distinctValues();
        if (after.size() == reference.getUniqueCount() && after.equals(original.distinctValues())) {
            issues.add(ValidationIssue.warning(IssueCode.POTENTIAL_LEAKAGE,
                    "Categorical column " + reference.getName() + " has identical unique values after transformation",
                    reference.getName()));
        }
    }

    private void checkCorrelation(Column original, Column transformed, List<ValidationIssue> issues) {
        double[] before = numbers(original);
        double[] after = numbers(transformed);
        if (before.length != after.length || before.length < 2) {
            return;
        }
        double correlation = Statistics.pearson(before, after);
        if (correlation > correlationThreshold) {
            issues.add(ValidationIssue.info(IssueCode.HIGH_CORRELATION,
                    String.format(Locale.ROOT, "Column %s is highly correlated with its original values (r=%.4f)",
                            original.getName(), correlation),
                    original.getName()));
        }
    }

    private static double[] numbers(Column column) {
        return column.getValues().stream()
                .map(CellValues::toDouble)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    @Override
    public String getCheckName() {
        return "leakage";
    }
}
