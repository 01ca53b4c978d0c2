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

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Static helpers for reading individual cell values.
 *
 * <p>A cell is <em>missing</em> when it is {@code null} or a floating point NaN.</p>
 */
public final class CellValues {

    private static final List<DateTimeFormatter> DATETIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("MM-dd-yyyy")
    );

    private CellValues() {}

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    static boolean isIntegralType(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    /**
     * Coerces a value to a double, parsing strings where necessary.
     *
     * @param value the cell value
     * @return the numeric value, or {@code null} when the value is missing or not numeric
     */
    public static Double toDouble(Object value) {
        if (isMissing(value) || value instanceof Boolean) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            String trimmed = value.toString().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static boolean isNumeric(Object value) {
        return toDouble(value) != null;
    }

    /**
     * Coerces a value to a {@link LocalDateTime}, parsing strings in the common
     * ISO, slash and dash layouts.
     *
     * @param value the cell value
     * @return the timestamp, or {@code null} when the value cannot be read as one
     */
    public static LocalDateTime toDateTime(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof CharSequence) {
            return parseDateTime(value.toString().trim());
        }
        return null;
    }

    private static LocalDateTime parseDateTime(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATETIME_FORMATS) {
            TemporalAccessor parsed = tryParse(format, text);
            if (parsed != null) {
                return LocalDateTime.from(parsed);
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            TemporalAccessor parsed = tryParse(format, text);
            if (parsed != null) {
                return LocalDate.from(parsed).atStartOfDay();
            }
        }
        return null;
    }

    private static TemporalAccessor tryParse(DateTimeFormatter format, String text) {
        try {
            return format.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Compares two non-missing cell values: numbers numerically, comparables
     * of the same class naturally, everything else by string form.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (isIntegralType(left) && isIntegralType(right)) {
                return new BigInteger(left.toString()).compareTo(new BigInteger(right.toString()));
            }
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return ((Comparable) left).compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }
}
