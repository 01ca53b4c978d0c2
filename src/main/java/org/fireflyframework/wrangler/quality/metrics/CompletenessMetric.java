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
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.quality.QualityMetric;

/**
 * Share of non-missing cells. An empty dataset is complete.
 */
public class CompletenessMetric implements QualityMetric {

    @Override
    public double calculate(Dataset data, DataProfile profile) {
        long cells = data.getCellCount();
        if (cells == 0) {
            return 1.0;
        }
        long missing = 0;
        for (Column column : data.getColumns()) {
            missing += column.nullCount();
        }
        return QualityMetric.clamp((double) (cells - missing) / cells);
    }

    @Override
    public String getMetricName() {
        return QualityMetrics.COMPLETENESS;
    }
}
