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

/**
 * Fixed vocabulary of validation findings.
 */
public enum IssueCode {

    /** Row loss above the configured tolerance. */
    EXCESSIVE_ROW_LOSS,
    /** Row loss within the configured tolerance. */
    ROW_LOSS,
    NULLS_INCREASED,
    COLUMN_REMOVED,
    TYPE_CHANGED,
    MISSING_COLUMN,
    EXACT_ROW_LEAKAGE,
    POTENTIAL_LEAKAGE,
    HIGH_CORRELATION,
    /** Numeric column turned into parseable text. */
    TYPE_CONVERSION,
    /** Numeric column turned into text that no longer parses as a number. */
    INCOMPATIBLE_TYPE
}
