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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;

/**
 * Physical type of a {@link Column}.
 *
 * <ul>
 *   <li>{@link #INTEGER} - whole numbers ({@code int64})</li>
 *   <li>{@link #FLOAT} - floating point numbers ({@code float64})</li>
 *   <li>{@link #STRING} - free-form values, usually text ({@code object})</li>
 *   <li>{@link #BOOLEAN} - true/false flags ({@code bool})</li>
 *   <li>{@link #DATETIME} - timestamps ({@code datetime64[ns]})</li>
 * </ul>
 */
public enum DataType {

    INTEGER("int64"),
    FLOAT("float64"),
    STRING("object"),
    BOOLEAN("bool"),
    DATETIME("datetime64[ns]");

    private final String dtypeName;

    DataType(String dtypeName) {
        this.dtypeName = dtypeName;
    }

    public String getDtypeName() {
        return dtypeName;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Infers the narrowest type able to hold every non-missing value.
     * A column with no values at all is typed {@link #STRING}.
     *
     * @param values the column values
     * @return the inferred type
     */
    public static DataType infer(Collection<?> values) {
        boolean sawAny = false;
        boolean allBoolean = true;
        boolean allIntegral = true;
        boolean allNumeric = true;
        boolean allTemporal = true;

        for (Object value : values) {
            if (CellValues.isMissing(value)) {
                continue;
            }
            sawAny = true;
            allBoolean &= value instanceof Boolean;
            allNumeric &= value instanceof Number;
            allIntegral &= CellValues.isIntegralType(value);
            allTemporal &= isTemporal(value);
        }

        if (!sawAny) {
            return STRING;
        }
        if (allBoolean) {
            return BOOLEAN;
        }
        if (allNumeric) {
            return allIntegral ? INTEGER : FLOAT;
        }
        return allTemporal ? DATETIME : STRING;
    }

    static boolean isTemporal(Object value) {
        return value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime;
    }
}
