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

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of active component names, seeded with the host's own components.
 */
public class ActiveComponentList implements ComponentDirectory {

    private final Set<String> components = new LinkedHashSet<>();

    public ActiveComponentList() {
        this(Collections.emptyList());
    }

    public ActiveComponentList(Collection<String> seed) {
        components.addAll(seed);
    }

    @Override
    public synchronized void add(String componentName) {
        components.add(Objects.requireNonNull(componentName, "componentName"));
    }

    @Override
    public synchronized void remove(String componentName) {
        components.remove(componentName);
    }

    @Override
    public synchronized boolean contains(String componentName) {
        return components.contains(componentName);
    }

    @Override
    public synchronized List<String> list() {
        return ImmutableList.copyOf(components);
    }

    @Override
    public synchronized String toString() {
        return "ActiveComponentList" + components;
    }
}
