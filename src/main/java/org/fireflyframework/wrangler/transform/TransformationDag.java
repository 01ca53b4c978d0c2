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
import org.fireflyframework.wrangler.exception.TransformationException;
import org.fireflyframework.wrangler.model.Transformation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of transformations, where an edge {@code A -> B} reads
 * "A depends on B" and B must run first.
 *
 * <p>{@link #topologicalSort()} applies Kahn's algorithm with a FIFO queue seeded in insertion
 * order, so the result is deterministic. The order is cached until the graph changes.</p>
 *
 * <p>Not thread-safe; build the graph on one thread, then share the sorted list.</p>
 */
@Slf4j
public class TransformationDag {

    static final String CIRCULAR_DEPENDENCY = "Circular dependency detected in transformation DAG";

    private final Map<String, Transformation> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private List<Transformation> sortedCache;

    /**
     * Adds a node. A transformation with an id already present replaces the earlier one
     * and keeps its edges.
     */
    public void addTransformation(Transformation transformation) {
        nodes.put(transformation.getId(), transformation);
        dependencies.computeIfAbsent(transformation.getId(), id -> new LinkedHashSet<>());
        sortedCache = null;
    }

    /**
     * Records that {@code dependentId} depends on {@code dependencyId}.
     *
     * @throws TransformationException if either id is not in the graph
     */
    public void addDependency(String dependentId, String dependencyId) {
        requireNode(dependentId);
        requireNode(dependencyId);
        dependencies.get(dependentId).add(dependencyId);
        sortedCache = null;
    }

    public List<Transformation> topologicalSort() {
        if (sortedCache != null) {
            return sortedCache;
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            inDegree.put(id, dependencies.get(id).size());
            dependents.put(id, new ArrayList<>());
        }
        dependencies.forEach((id, deps) -> deps.forEach(dep -> dependents.get(dep).add(id)));

        Deque<String> ready = new ArrayDeque<>();
        for (String id : nodes.keySet()) {
            if (inDegree.get(id) == 0) {
                ready.add(id);
            }
        }

        List<Transformation> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(nodes.get(id));
            for (String dependent : dependents.get(id)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != nodes.size()) {
            throw new TransformationException(CIRCULAR_DEPENDENCY,
                    Map.of("nodes", nodes.size(), "sorted", order.size()));
        }
        sortedCache = List.copyOf(order);
        return sortedCache;
    }

    public Set<String> getDependencies(String id) {
        requireNode(id);
        return Set.copyOf(dependencies.get(id));
    }

    public Set<String> getDependents(String id) {
        requireNode(id);
        Set<String> dependents = new LinkedHashSet<>();
        dependencies.forEach((candidate, deps) -> {
            if (deps.contains(id)) {
                dependents.add(candidate);
            }
        });
        return dependents;
    }

    /**
     * @return {@code true} when the graph has no cycle
     */
    public boolean validate() {
        try {
            topologicalSort();
            return true;
        } catch (TransformationException e) {
            log.debug("DAG validation failed: {}", e.getMessage());
            return false;
        }
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    private void requireNode(String id) {
        if (!nodes.containsKey(id)) {
            throw new TransformationException("Transformation not found in DAG", Map.of("id", String.valueOf(id)));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder that can derive edges from column ownership.
     */
    public static final class Builder {

        private final List<Transformation> transformations = new ArrayList<>();
        private final Map<String, List<String>> explicitDependencies = new LinkedHashMap<>();
        private boolean autoDependencies;

        private Builder() {}

        public Builder add(Transformation transformation) {
            transformations.add(transformation);
            return this;
        }

        public Builder addAll(Collection<Transformation> all) {
            transformations.addAll(all);
            return this;
        }

        /**
         * @param dependencies map of dependent id to the ids it depends on
         */
        public Builder withDependencies(Map<String, List<String>> dependencies) {
            dependencies.forEach((id, deps) ->
                    explicitDependencies.computeIfAbsent(id, key -> new ArrayList<>()).addAll(deps));
            return this;
        }

        /**
         * Makes each transformation depend on the most recent earlier transformation touching
         * any of its target columns. A transformation with no target columns touches every
         * column: it depends on all earlier owners and everything after it depends on it.
         */
        public Builder autoBuildDependencies() {
            this.autoDependencies = true;
            return this;
        }

        public TransformationDag build() {
            TransformationDag dag = new TransformationDag();
            transformations.forEach(dag::addTransformation);
            explicitDependencies.forEach((id, deps) -> deps.forEach(dep -> dag.addDependency(id, dep)));
            if (autoDependencies) {
                deriveColumnDependencies(dag);
            }
            return dag;
        }

        private void deriveColumnDependencies(TransformationDag dag) {
            Map<String, String> owners = new HashMap<>();
            String wholeTableOwner = null;
            for (Transformation transformation : transformations) {
                String id = transformation.getId();
                if (transformation.getTargetColumns().isEmpty()) {
                    Set<String> previous = new LinkedHashSet<>(owners.values());
                    if (wholeTableOwner != null) {
                        previous.add(wholeTableOwner);
                    }
                    previous.remove(id);
                    previous.forEach(dep -> dag.addDependency(id, dep));
                    owners.clear();
                    wholeTableOwner = id;
                    continue;
                }
                for (String column : transformation.getTargetColumns()) {
                    String owner = owners.getOrDefault(column, wholeTableOwner);
                    if (owner != null && !owner.equals(id)) {
                        dag.addDependency(id, owner);
                    }
                    owners.put(column, id);
                }
            }
        }
    }
}
