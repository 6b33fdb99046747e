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

import java.util.List;

/**
 * Where an {@link ExtensionManager} finds installable extension packages.
 *
 * <p>A discovery pass calls {@link #refresh()} and then {@link #discover()}. Ids that
 * disappear from a pass are handed back through {@link #release(String)} once the
 * manager no longer references them.
 */
public interface DiscoverySource {

    /**
     * Invalidates any cached view of the available packages.
     */
    void refresh();

    /**
     * Enumerates the available packages. Packages that cannot be read are skipped by
     * the source; they never fail the whole pass.
     *
     * @return discovered packages in discovery order
     */
    List<DiscoveredExtension> discover();

    /**
     * Releases resources held for a package that is gone, such as its classloader.
     *
     * @param extensionId id of the vanished package
     */
    default void release(String extensionId) {
    }
}
