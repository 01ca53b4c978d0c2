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
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs shared by every {@link ValidationCheck}.
 *
 * @param original       the dataset before the transformation
 * @param transformed    the dataset after the transformation
 * @param profile        the profile of {@code original}, or {@code null}
 * @param transformation the transformation under validation, or {@code null} when unknown
 */
public record ValidationContext(Dataset original, Dataset transformed, DataProfile profile,
                                Transformation transformation) {

    /**
     * Returns the columns the transformed dataset is compared against: the profiled columns,
     * or columns summarized from {@code original} when no profile is available.
     */
    public List<ColumnProfile> referenceColumns() {
        if (profile != null) {
            return List.copyOf(profile.getColumns().values());
        }
        List<ColumnProfile> columns = new ArrayList<>(original.getColumnCount());
        for (Column column : original.getColumns()) {
            columns.add(ColumnProfile.builder()
                    .name(column.getName())
                    .dtype(column.getType())
                    .nullCount(column.nullCount())
                    .uniqueCount(column.distinctValues().size())
                    .build());
        }
        return columns;
    }

    /**
     * Whether the transformation under validation is a cast of the given column.
     */
    public boolean isCastOf(String column) {
        return transformation != null
                && transformation.getType() == TransformationType.CAST_TYPE
                && transformation.getTargetColumns().contains(column);
    }
}
