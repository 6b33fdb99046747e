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

package org.trellis.extension.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered collection of the active hooks of one kind.
 *
 * <p>Register appends, unregister scans and removes. Populations are bounded by the
 * number of enabled extensions, so both stay cheap. Readers get a snapshot and never
 * observe a partially applied change.
 *
 * @param <H> hook kind
 */
public final class HookPoint<H extends ExtensionHook> {

    private final Class<H> kind;
    private final List<H> hooks = new CopyOnWriteArrayList<>();

    HookPoint(Class<H> kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Class<H> getKind() {
        return kind;
    }

    /**
     * Returns the active hooks in registration order.
     *
     * @return immutable snapshot
     */
    public List<H> getHooks() {
        return Collections.unmodifiableList(new ArrayList<>(hooks));
    }

    public int size() {
        return hooks.size();
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }

    public boolean contains(ExtensionHook hook) {
        return hooks.contains(hook);
    }

    void register(ExtensionHook hook) {
        hooks.add(kind.cast(hook));
    }

    void unregister(ExtensionHook hook) {
        hooks.remove(hook);
    }

    /**
     * Shuts down every hook still registered here. Used at host shutdown.
     */
    void drain() {
        for (H hook : getHooks()) {
            hook.shutdown();
        }
        hooks.clear();
    }

    @Override
    public String toString() {
        return "HookPoint{kind=" + kind.getName() + ", hooks=" + hooks.size() + '}';
    }
}
