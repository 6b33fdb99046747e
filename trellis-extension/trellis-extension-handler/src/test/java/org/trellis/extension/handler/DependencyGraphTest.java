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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@DisplayName("DependencyGraph Unit Tests")
class DependencyGraphTest {

    @Test
    @DisplayName("UT-HANDLER-DG-001: Dependents are the direct requirers, in discovery order")
    void testDependentsOf() {
        // Given
        DependencyGraph graph = new DependencyGraph(ImmutableMap.of(
                "base", Collections.emptyList(),
                "reports", Collections.singletonList("base"),
                "charts", Arrays.asList("reports", "base"),
                "audit", Collections.emptyList()));

        // Then
        Assertions.assertEquals(Arrays.asList("reports", "charts"), graph.dependentsOf("base"));
        Assertions.assertEquals(Collections.singletonList("charts"), graph.dependentsOf("reports"));
        Assertions.assertTrue(graph.dependentsOf("audit").isEmpty());
    }

    @Test
    @DisplayName("UT-HANDLER-DG-002: Acyclic graph and unknown requirements report no cycle")
    void testNoCycle() {
        // Given
        DependencyGraph graph = new DependencyGraph(ImmutableMap.of(
                "a", Arrays.asList("b", "c"),
                "b", Collections.singletonList("c"),
                "c", Collections.singletonList("missing")));

        // Then
        Assertions.assertFalse(graph.findCycle("a").isPresent());
        Assertions.assertFalse(graph.findCycle("missing").isPresent());
    }

    @Test
    @DisplayName("UT-HANDLER-DG-003: Cycle reachable from the start is reported as a closed path")
    void testCycle() {
        // Given
        DependencyGraph graph = new DependencyGraph(ImmutableMap.of(
                "top", Collections.singletonList("a"),
                "a", Collections.singletonList("b"),
                "b", Collections.singletonList("a"),
                "self", Collections.singletonList("self")));

        // When
        Optional<List<String>> cycle = graph.findCycle("top");

        // Then
        Assertions.assertEquals(Arrays.asList("a", "b", "a"), cycle.get());
        Assertions.assertEquals(Arrays.asList("self", "self"), graph.findCycle("self").get());
    }
}
