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

import java.util.List;

/**
 * What one {@link ExtensionManager#discover()} pass changed.
 */
public final class DiscoveryResult {

    private final List<String> added;
    private final List<String> removed;
    private final List<String> failed;

    public DiscoveryResult(List<String> added, List<String> removed, List<String> failed) {
        this.added = ImmutableList.copyOf(added);
        this.removed = ImmutableList.copyOf(removed);
        this.failed = ImmutableList.copyOf(failed);
    }

    /**
     * Ids discovered for the first time.
     *
     * @return added ids
     */
    public List<String> getAdded() {
        return added;
    }

    /**
     * Previously known ids missing from this pass; they were disabled and forgotten.
     *
     * @return removed ids
     */
    public List<String> getRemoved() {
        return removed;
    }

    /**
     * Ids whose registration or initialization failed in this pass.
     *
     * @return failed ids
     */
    public List<String> getFailed() {
        return failed;
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty();
    }

    @Override
    public String toString() {
        return "DiscoveryResult{added=" + added + ", removed=" + removed + ", failed=" + failed + '}';
    }
}
