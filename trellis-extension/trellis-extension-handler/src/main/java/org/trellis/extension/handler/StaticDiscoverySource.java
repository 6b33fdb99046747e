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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovery source fed programmatically, for extensions bundled with the host.
 */
public class StaticDiscoverySource implements DiscoverySource {

    private final Map<String, DiscoveredExtension> extensions = new LinkedHashMap<>();

    public StaticDiscoverySource() {
    }

    public StaticDiscoverySource(List<DiscoveredExtension> extensions) {
        for (DiscoveredExtension extension : extensions) {
            add(extension);
        }
    }

    /**
     * Makes a package available to the next discovery pass, replacing one with the same id.
     *
     * @param extension discovered package
     */
    public synchronized void add(DiscoveredExtension extension) {
        Objects.requireNonNull(extension, "extension");
        extensions.put(extension.getId(), extension);
    }

    /**
     * Withdraws a package; the next discovery pass drops it.
     *
     * @param extensionId extension id
     * @return true if the package was present
     */
    public synchronized boolean remove(String extensionId) {
        return extensions.remove(extensionId) != null;
    }

    @Override
    public void refresh() {
        // Nothing cached
    }

    @Override
    public synchronized List<DiscoveredExtension> discover() {
        return ImmutableList.copyOf(extensions.values());
    }
}
