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
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.IssueCode;
import org.fireflyframework.wrangler.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks that a transformation did not lose rows, columns or values.
 *
 * <ul>
 *   <li>row loss above the tolerance is an error, any smaller loss a warning</li>
 *   <li>a profiled column missing after the transformation is an error</li>
 *   <li>a column with more missing values than profiled is an error</li>
 *   <li>a changed column type is a warning, unless the transformation casts that column</li>
 * </ul>
 */
public class IntegrityValidator implements ValidationCheck {

    public static final double DEFAULT_ROW_COUNT_TOLERANCE = 0.1;

    private final double rowCountTolerance;

    public IntegrityValidator() {
        this(DEFAULT_ROW_COUNT_TOLERANCE);
    }

    /**
     * @param rowCountTolerance fraction of rows that may be lost without an error
     */
    public IntegrityValidator(double rowCountTolerance) {
        this.rowCountTolerance = rowCountTolerance;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        checkRowCount(context, issues);

        for (ColumnProfile reference : context.referenceColumns()) {
            String name = reference.getName();
            Optional<Column> transformed = context.transformed().findColumn(name);
            if (transformed.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.COLUMN_REMOVED,
                        "Column " + name + " was removed by the transformation", name));
                continue;
            }

            Column column = transformed.get();
            long nulls = column.nullCount();
            if (nulls > reference.getNullCount()) {
                issues.add(ValidationIssue.error(IssueCode.NULLS_INCREASED,
                        "Null count in " + name + " increased from " + reference.getNullCount() + " to " + nulls, name));
            }
            if (reference.getDtype() != null && reference.getDtype() != column.getType() && !context.isCastOf(name)) {
                issues.add(ValidationIssue.warning(IssueCode.TYPE_CHANGED,
                        "Type of " + name + " changed from " + reference.getDtype().getDtypeName()
                                + " to " + column.getType().getDtypeName(), name));
            }
        }
        return issues;
    }

    private void checkRowCount(ValidationContext context, List<ValidationIssue> issues) {
        int before = context.original().getRowCount();
        int after = context.transformed().getRowCount();
        if (before == 0 || after >= before) {
            return;
        }
        double loss = (double) (before - after) / before;
        if (loss > rowCountTolerance) {
            issues.add(ValidationIssue.error(IssueCode.EXCESSIVE_ROW_LOSS,
                    String.format(Locale.ROOT, "Row count decreased by %.1f%%, exceeding tolerance of %.1f%%",
                            loss * 100, rowCountTolerance * 100), null));
        } else {
            issues.add(ValidationIssue.warning(IssueCode.ROW_LOSS,
                    String.format(Locale.ROOT, "Row count decreased by %.1f%%", loss * 100), null));
        }
    }

    @Override
    public String getCheckName() {
        return "integrity";
    }
}
