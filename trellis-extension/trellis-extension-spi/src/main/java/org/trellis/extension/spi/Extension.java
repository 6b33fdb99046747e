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

import org.trellis.extension.ExtensionDescriptor;
import org.trellis.extension.RouteSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for a live extension instance.
 *
 * <p>An instance exists only while its extension is enabled. It owns its
 * {@link Settings} and every {@link ExtensionHook} constructed for it, and keeps a
 * back-reference to the {@link ExtensionHost} that created it.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>constructed by {@link ExtensionFactory#create(ExtensionContext)}</li>
 *   <li>{@link #initialize()}: register hooks and other runtime contributions</li>
 *   <li>{@link #shutdown()}: deregister every owned hook</li>
 * </ol>
 *
 * <p>Extensions that support configuration set {@link ExtensionFactory#isConfigurable()}
 * and return their admin routes from {@link #getAdminRoutes()}.
 */
public abstract class Extension {

    private final ExtensionContext context;
    private final Set<ExtensionHook> hooks = new LinkedHashSet<>();
    private volatile boolean shutdown;

    protected Extension(ExtensionContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public String getId() {
        return context.getDescriptor().getId();
    }

    public ExtensionDescriptor getDescriptor() {
        return context.getDescriptor();
    }

    public Settings getSettings() {
        return context.getSettings();
    }

    public ExtensionHost getHost() {
        return context.getHost();
    }

    protected HookPointRegistry getHookPoints() {
        return context.getHookPoints();
    }

    /**
     * Called once, right after construction and before the instance becomes live.
     * Subclasses register their hooks here.
     *
     * @throws Exception if the extension cannot start; the enable is aborted
     */
    public void initialize() throws Exception {
        // Default: nothing to initialize
    }

    /**
     * Admin/config routes, relative to {@code <admin url><id>/config/}.
     * Only consulted when the extension is configurable.
     *
     * @return route set, empty by default
     */
    public RouteSet getAdminRoutes() {
        return RouteSet.empty();
    }

    /**
     * Shuts down the extension, deregistering every hook it owns.
     *
     * <p>Subclasses that need custom shutdown behavior override this and call
     * {@code super.shutdown()}.
     */
    public void shutdown() {
        List<ExtensionHook> owned;
        synchronized (hooks) {
            owned = new ArrayList<>(hooks);
            hooks.clear();
        }
        for (ExtensionHook hook : owned) {
            hook.shutdown();
        }
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Returns the hooks this extension currently owns.
     *
     * @return snapshot of owned hooks in registration order
     */
    public Set<ExtensionHook> getHooks() {
        synchronized (hooks) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(hooks));
        }
    }

    void addHook(ExtensionHook hook) {
        if (shutdown) {
            throw new IllegalStateException("Extension '" + getId() + "' is shut down; cannot register hooks");
        }
        synchronized (hooks) {
            hooks.add(hook);
        }
    }

    void removeHook(ExtensionHook hook) {
        synchronized (hooks) {
            hooks.remove(hook);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + getId() + "'}";
    }
}
