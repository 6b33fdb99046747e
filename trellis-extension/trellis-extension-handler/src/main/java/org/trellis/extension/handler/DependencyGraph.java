// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.trellis.extension.handler;

import org.trellis.extension.ExtensionDescriptor;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Requirement edges between known extensions.
 *
 * <p>Requirements on ids that are not known are ignored here; enabling such an
 * extension fails on the missing id instead.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> requirementsById;

    public DependencyGraph(Map<String, List<String>> requirementsById) {
        this.requirementsById = new LinkedHashMap<>(requirementsById);
    }

    public static DependencyGraph of(Collection<ExtensionDescriptor> descriptors) {
        Map<String, List<String>> requirements = new LinkedHashMap<>();
        for (ExtensionDescriptor descriptor : descriptors) {
            requirements.put(descriptor.getId(), descriptor.getRequirements());
        }
        return new DependencyGraph(requirements);
    }

    /**
     * Returns every known id that directly requires {@code extensionId}.
     *
     * @param extensionId dependency id
     * @return dependent ids in discovery order
     */
    public List<String> dependentsOf(String extensionId) {
        List<String> dependents = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : requirementsById.entrySet()) {
            if (!entry.getKey().equals(extensionId) && entry.getValue().contains(extensionId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Looks for a requirement cycle reachable from {@code extensionId}.
     *
     * @param extensionId start of the search
     * @return the cycle, first and last element equal, or empty if none is reachable
     */
    public Optional<List<String>> findCycle(String extensionId) {
        List<String> path = new ArrayList<>();
        return visit(extensionId, path, new HashSet<>(), new HashSet<>());
    }

    private Optional<List<String>> visit(String id, List<String> path, Set<String> onPath, Set<String> done) {
        if (onPath.contains(id)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return Optional.of(ImmutableList.copyOf(cycle));
        }
        if (done.contains(id) || !requirementsById.containsKey(id)) {
            return Optional.empty();
        }
        path.add(id);
        onPath.add(id);
        for (String requirement : requirementsById.getOrDefault(id, Collections.emptyList())) {
            Optional<List<String>> cycle = visit(requirement, path, onPath, done);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(id);
        done.add(id);
        return Optional.empty();
    }
}
