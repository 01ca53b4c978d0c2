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
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.IssueCode;
import org.fireflyframework.wrangler.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks that the transformed schema can still stand in for the original one.
 *
 * <p>A missing profiled column is an error. A numeric column turned into text is a warning
 * while every value still parses as a number, an error otherwise.</p>
 */
public class SchemaValidator implements ValidationCheck {

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ColumnProfile reference : context.referenceColumns()) {
            String name = reference.getName();
            Optional<Column> transformed = context.transformed().findColumn(name);
            if (transformed.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.MISSING_COLUMN, "Column " + name + " is missing", name));
                continue;
            }
            if (reference.getDtype() != null && reference.getDtype().isNumeric()
                    && transformed.get().getType() == DataType.STRING) {
                boolean parseable = transformed.get().nonMissingValues().stream().allMatch(CellValues::isNumeric);
                issues.add(parseable
                        ? ValidationIssue.warning(IssueCode.TYPE_CONVERSION,
                                "Numeric column " + name + " converted to text (lossy but recoverable)", name)
                        : ValidationIssue.error(IssueCode.INCOMPATIBLE_TYPE,
                                "Numeric column " + name + " converted to non-numeric text", name));
            }
        }
        return issues;
    }

    @Override
    public String getCheckName() {
        return "schema";
    }

    @Override
    public boolean isSchemaCheck() {
        return true;
    }
}
