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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named, typed and immutable sequence of cell values.
 *
 * <p>Cells may be {@code null}; see {@link CellValues#isMissing(Object)}.</p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Column {

    private final String name;
    private final DataType type;
    private final List<Object> values;

    public Column(String name, DataType type, List<?> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Column of(String name, DataType type, Object... values) {
        return new Column(name, type, Arrays.asList(values));
    }

    /**
     * Creates a column whose type is inferred from its values.
     */
    public static Column inferred(String name, List<?> values) {
        return new Column(name, DataType.infer(values), values);
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public boolean isMissing(int row) {
        return CellValues.isMissing(values.get(row));
    }

    public long nullCount() {
        return values.stream().filter(CellValues::isMissing).count();
    }

    public List<Object> nonMissingValues() {
        return values.stream().filter(value -> !CellValues.isMissing(value)).toList();
    }

    public Set<Object> distinctValues() {
        Set<Object> distinct = new LinkedHashSet<>();
        for (Object value : values) {
            if (!CellValues.isMissing(value)) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    public Column withValues(DataType newType, List<?> newValues) {
        return new Column(name, newType, newValues);
    }

    public Column renamed(String newName) {
        return new Column(newName, type, values);
    }
}
