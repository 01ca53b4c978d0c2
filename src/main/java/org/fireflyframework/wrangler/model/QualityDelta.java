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

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Before/after quality comparison of one transformation.
 *
 * <p>{@code compositeDelta} always equals {@code after.overall - before.overall}.</p>
 */
@Data
@Builder
@Jacksonized
public class QualityDelta {

    private final QualityMetrics before;
    private final QualityMetrics after;
    private final QualityMetrics improvement;
    private final double compositeDelta;

    public static QualityDelta between(QualityMetrics before, QualityMetrics after) {
        return QualityDelta.builder()
                .before(before)
                .after(after)
                .improvement(after.minus(before))
                .compositeDelta(after.getOverall() - before.getOverall())
                .build();
    }
}
