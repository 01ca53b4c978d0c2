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

import org.fireflyframework.wrangler.model.ValidationIssue;

import java.util.List;

/**
 * Port interface for checks comparing a transformed dataset with its original.
 *
 * <p>Findings are data: a check reports them as {@link ValidationIssue}s and only throws on
 * an internal fault. Checks are composed by the {@link TransformationValidator}.</p>
 */
public interface ValidationCheck {

    /**
     * Runs this check.
     *
     * @param context the datasets and profile to compare
     * @return the issues found, empty when none
     */
    List<ValidationIssue> check(ValidationContext context);

    /**
     * Returns the unique name of this check.
     *
     * @return the check name
     */
    String getCheckName();

    /**
     * Whether errors of this check make the result schema-incompatible.
     * Defaults to {@code false}.
     *
     * @return {@code true} for schema checks
     */
    default boolean isSchemaCheck() {
        return false;
    }
}
