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

package org.fireflyframework.wrangler.transform;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.GenerationException;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.InferredType;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Derives candidate transformations from a {@link DataProfile} with fixed rules.
 *
 * <p>Generation is a pure function of the profile: the same profile always yields the same
 * candidates in the same order, with the same name-based ids. Rules run per rule family over
 * all columns: fill, normalize, encode, outliers, duplicates, cast.</p>
 */
@Slf4j
public class CandidateGenerator {

    public static final int DEFAULT_MAX_CANDIDATES = 100;

    private final ReversibilityClassifier classifier;
    private final Set<TransformationType> allowedTypes;
    private final int maxCandidates;

    public CandidateGenerator() {
        this(new ReversibilityClassifier(), EnumSet.allOf(TransformationType.class), DEFAULT_MAX_CANDIDATES);
    }

    /**
     * @param classifier    decides the reversibility flag of each candidate
     * @param allowedTypes  types that may be generated
     * @param maxCandidates upper bound on the number of candidates, {@code 0} for no bound
     */
    public CandidateGenerator(ReversibilityClassifier classifier, Collection<TransformationType> allowedTypes,
                              int maxCandidates) {
        this.classifier = classifier;
        this.allowedTypes = allowedTypes.isEmpty()
                ? EnumSet.noneOf(TransformationType.class)
                : EnumSet.copyOf(allowedTypes);
        this.maxCandidates = maxCandidates;
    }

    public List<Transformation> generate(DataProfile profile) {
        if (profile == null || profile.getColumns() == null) {
            throw new GenerationException("Cannot generate candidates without a data profile");
        }
        profile.getColumns().forEach(this::checkColumnProfile);

        Collection<ColumnProfile> columns = profile.getColumns().values();
        List<Transformation> candidates = new ArrayList<>();

        for (ColumnProfile column : columns) {
            addFillCandidates(column, candidates);
        }
        for (ColumnProfile column : columns) {
            addNormalizeCandidates(column, candidates);
        }
        for (ColumnProfile column : columns) {
            addEncodeCandidates(column, candidates);
        }
        for (ColumnProfile column : columns) {
            addOutlierCandidates(column, candidates);
        }
        if (profile.getDuplicateRows() > 0) {
            add(candidates, TransformationType.DROP_DUPLICATES, null, Map.of(), "Remove duplicate rows");
        }
        for (ColumnProfile column : columns) {
            addCastCandidates(column, candidates);
        }

        if (maxCandidates > 0 && candidates.size() > maxCandidates) {
            log.info("Truncating {} generated candidates to the configured maximum of {}",
                    candidates.size(), maxCandidates);
            return List.copyOf(candidates.subList(0, maxCandidates));
        }
        log.debug("Generated {} candidates for {} columns", candidates.size(), columns.size());
        return List.copyOf(candidates);
    }

    private void checkColumnProfile(String name, ColumnProfile column) {
        if (column == null || column.getInferredType() == null) {
            throw new GenerationException("Malformed column profile", Map.of("column", name));
        }
    }

    private void addFillCandidates(ColumnProfile column, List<Transformation> out) {
        if (column.getNullCount() <= 0) {
            return;
        }
        String name = column.getName();
        if (column.getInferredType() == InferredType.NUMERIC) {
            if (column.getMean() != null) {
                add(out, TransformationType.FILL_MISSING, name, Map.of("strategy", "mean"),
                        "Fill missing values in " + name + " with mean");
            }
            add(out, TransformationType.FILL_MISSING, name, Map.of("strategy", "median"),
                    "Fill missing values in " + name + " with median");
        } else if (column.getInferredType() == InferredType.CATEGORICAL) {
            add(out, TransformationType.FILL_MISSING, name, Map.of("strategy", "mode"),
                    "Fill missing values in " + name + " with mode");
        }
        add(out, TransformationType.FILL_MISSING, name, params("strategy", "constant", "fill_value", 0),
                "Fill missing values in " + name + " with constant 0");
    }

    private void addNormalizeCandidates(ColumnProfile column, List<Transformation> out) {
        if (column.getInferredType() != InferredType.NUMERIC) {
            return;
        }
        String name = column.getName();
        add(out, TransformationType.NORMALIZE, name, Map.of("method", "standard"),
                "Standard normalize " + name + " (z-score)");
        if (column.getMin() != null && column.getMax() != null) {
            add(out, TransformationType.NORMALIZE, name, Map.of("method", "minmax"),
                    "Min-max normalize " + name);
        }
    }

    private void addEncodeCandidates(ColumnProfile column, List<Transformation> out) {
        if (column.getInferredType() != InferredType.CATEGORICAL) {
            return;
        }
        String name = column.getName();
        add(out, TransformationType.ENCODE_CATEGORICAL, name, Map.of("method", "onehot"), "One-hot encode " + name);
        add(out, TransformationType.ENCODE_CATEGORICAL, name, Map.of("method", "label"), "Label encode " + name);
    }

    private void addOutlierCandidates(ColumnProfile column, List<Transformation> out) {
        if (column.getInferredType() != InferredType.NUMERIC || column.getStd() == null) {
            return;
        }
        String name = column.getName();
        add(out, TransformationType.REMOVE_OUTLIERS, name, params("method", "iqr", "threshold", 1.5),
                "Remove outliers from " + name + " using IQR");
        add(out, TransformationType.REMOVE_OUTLIERS, name, params("method", "zscore", "threshold", 3.0),
                "Remove outliers from " + name + " using z-score");
    }

    private void addCastCandidates(ColumnProfile column, List<Transformation> out) {
        if (column.getInferredType() != InferredType.TEXT) {
            return;
        }
        String name = column.getName();
        add(out, TransformationType.CAST_TYPE, name, Map.of("target_type", "datetime"), "Cast " + name + " to datetime");
        if (column.getNullCount() == 0) {
            add(out, TransformationType.CAST_TYPE, name, Map.of("target_type", "numeric"), "Cast " + name + " to numeric");
        }
    }

    private void add(List<Transformation> out, TransformationType type, String column,
                     Map<String, Object> params, String description) {
        if (!allowedTypes.contains(type)) {
            return;
        }
        List<String> targets = column == null ? List.of() : List.of(column);
        String seed = out.size() + "|" + type.getValue() + "|" + targets + "|" + params;
        out.add(Transformation.builder()
                .id(UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString())
                .type(type)
                .targetColumns(targets)
                .params(params)
                .reversible(classifier.isReversible(type, params))
                .description(description)
                .build());
    }

    private static Map<String, Object> params(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(k1, v1);
        params.put(k2, v2);
        return params;
    }
}
