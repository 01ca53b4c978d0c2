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
import org.fireflyframework.wrangler.model.QualityMetrics;

/**
 * Mean ratio of distinct values to non-missing values per column.
 *
 * <p>Uses the profiled unique count when available instead of recounting.</p>
 */
public class UniquenessMetric extends AbstractColumnMetric {

    @Override
    protected double scoreColumn(Column column, ColumnProfile profile) {
        long present = column.size() - column.nullCount();
        if (present == 0) {
            return 1.0;
        }
        long unique = profile != null && profile.getUniqueCount() != null
                ? profile.getUniqueCount()
                : column.distinctValues().size();
        return (double) unique / present;
    }

    @Override
    public String getMetricName() {
        return QualityMetrics.UNIQUENESS;
    }
}
