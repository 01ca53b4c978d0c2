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

package org.fireflyframework.wrangler.quality.metrics;

import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.quality.QualityMetric;

/**
 * Base class for metrics defined as the mean of a per-column score.
 *
 * <p>A dataset without columns scores 1.0.</p>
 */
public abstract class AbstractColumnMetric implements QualityMetric {

    @Override
    public double calculate(Dataset data, DataProfile profile) {
        if (data.getColumnCount() == 0) {
            return 1.0;
        }
        double total = 0.0;
        for (Column column : data.getColumns()) {
            ColumnProfile columnProfile = profile == null ? null : profile.findColumn(column.getName()).orElse(null);
            total += QualityMetric.clamp(scoreColumn(column, columnProfile));
        }
        return QualityMetric.clamp(total / data.getColumnCount());
    }

    /**
     * Scores one column.
     *
     * @param column  the column
     * @param profile the column's reference profile, or {@code null}
     * @return the column score
     */
    protected abstract double scoreColumn(Column column, ColumnProfile profile);
}
