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

import java.util.Objects;

/**
 * A capability contribution from one extension into one {@link HookPoint}.
 *
 * <p>The host defines a subclass per hook kind (for example a navigation entry
 * contributor) and extensions construct instances of it during
 * {@link Extension#initialize()}. Construction registers the hook both in its
 * owner's hook set and in the hook point; {@link #shutdown()} removes it from the
 * hook point. The owner calls {@code shutdown()} for every hook it still owns when
 * it is shut down.
 *
 * <pre>{@code
 * public class NavigationHook extends ExtensionHook {
 *     public NavigationHook(Extension extension, HookPointRegistry registry, String label) {
 *         super(extension, registry.hookPoint(NavigationHook.class));
 *         ...
 *     }
 * }
 * }</pre>
 */
public abstract class ExtensionHook {

    private final Extension extension;
    private final HookPoint<?> hookPoint;
    private volatile boolean active;

    /**
     * Registers this hook with its owner and its hook point.
     *
     * @param extension owning extension
     * @param hookPoint hook point of this hook's kind
     * @throws IllegalStateException if the owner is already shut down
     * @throws ClassCastException if this hook is not of the hook point's kind
     */
    protected ExtensionHook(Extension extension, HookPoint<?> hookPoint) {
        this.extension = Objects.requireNonNull(extension, "extension");
        this.hookPoint = Objects.requireNonNull(hookPoint, "hookPoint");
        extension.addHook(this);
        try {
            hookPoint.register(this);
        } catch (RuntimeException e) {
            extension.removeHook(this);
            throw e;
        }
        this.active = true;
    }

    public Extension getExtension() {
        return extension;
    }

    public HookPoint<?> getHookPoint() {
        return hookPoint;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Removes this hook from its hook point. Safe to call more than once.
     */
    public void shutdown() {
        if (!active) {
            return;
        }
        active = false;
        hookPoint.unregister(this);
        extension.removeHook(this);
    }
}
