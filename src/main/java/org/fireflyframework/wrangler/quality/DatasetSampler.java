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

package org.fireflyframework.wrangler.quality;

import org.fireflyframework.wrangler.model.Dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Draws reproducible row samples. The seed is always passed in; no generator state is shared.
 */
public final class DatasetSampler {

    private DatasetSampler() {}

    /**
     * Samples {@code size} distinct rows, kept in their original order.
     *
     * @param data the dataset
     * @param size the sample size; the dataset is returned as-is when it is not larger
     * @param seed the random seed
     * @return the sampled dataset
     */
    public static Dataset sample(Dataset data, int size, long seed) {
        int rows = data.getRowCount();
        if (size >= rows) {
            return data;
        }
        int[] indexes = new int[rows];
        for (int i = 0; i < rows; i++) {
            indexes[i] = i;
        }
        Random random = new Random(seed);
        for (int i = 0; i < size; i++) {
            int pick = i + random.nextInt(rows - i);
            int swap = indexes[i];
            indexes[i] = indexes[pick];
            indexes[pick] = swap;
        }
        int[] chosen = Arrays.copyOf(indexes, size);
        Arrays.sort(chosen);
        List<Integer> selection = new ArrayList<>(size);
        for (int index : chosen) {
            selection.add(index);
        }
        return data.selectRows(selection);
    }
}
