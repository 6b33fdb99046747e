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

import org.trellis.extension.DependencyCycleException;
import org.trellis.extension.EnablingExtensionException;
import org.trellis.extension.ExtensionDescriptor;
import org.trellis.extension.ExtensionException;
import org.trellis.extension.InstallExtensionException;
import org.trellis.extension.RegistrationRecord;
import org.trellis.extension.RegistrationStore;
import org.trellis.extension.RouteSet;
import org.trellis.extension.UnknownExtensionException;
import org.trellis.extension.spi.Extension;
import org.trellis.extension.spi.ExtensionContext;
import org.trellis.extension.spi.ExtensionFactory;
import org.trellis.extension.spi.ExtensionHost;
import org.trellis.extension.spi.HookPointRegistry;
import org.trellis.extension.spi.Settings;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Manages the lifecycle of the extensions of one extension set.
 *
 * <p>States per extension id:
 * <pre>
 * Discovered -&gt; Registered (installed=false, enabled=false)
 *            -&gt; Installed  (installed=true)
 *            -&gt; Enabled    (live instance, enabled=true)
 * </pre>
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Discover packages through a {@link DiscoverySource} and keep one registration
 *       record per id in the {@link RegistrationStore}</li>
 *   <li>Enable extensions, requirements first: install assets and schema, create the
 *       live instance, install admin routes, activate the component</li>
 *   <li>Disable extensions, dependents first, undoing exactly what enabling did</li>
 *   <li>Notify {@link ExtensionListener}s after each transition</li>
 * </ul>
 *
 * <p>All mutating operations run under one per-manager lock. The lock is re-entrant so
 * requirement and dependent cascades run inside the same critical section. Asset copies
 * and schema migrations block the caller.
 */
public class ExtensionManager implements ExtensionHost {
    private static final Logger LOG = LogManager.getLogger(ExtensionManager.class);

    private final ExtensionManagerConfig config;
    private final DiscoverySource discoverySource;
    private final RegistrationStore registrationStore;
    private final RouteRegistrar routeRegistrar;
    private final ComponentDirectory componentDirectory;
    private final TemplateTagCache templateTagCache;
    private final HookPointRegistry hookPoints;
    private final ExtensionInstaller installer;
    private final List<ExtensionListener> listeners = new CopyOnWriteArrayList<>();

    /** Every discovered extension, in discovery order */
    private final Map<String, KnownExtension> knownById = new LinkedHashMap<>();

    /** Live instances, in initialization order (requirements before dependents) */
    private final Map<String, LiveExtension> liveById = new LinkedHashMap<>();

    /** Ids whose disable cascade is in progress */
    private final Set<String> disabling = new HashSet<>();

    private final Object lifecycleLock = new Object();

    private ExtensionManager(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.discoverySource = builder.discoverySource != null
                ? builder.discoverySource
                : new DirectoryDiscoverySource(config.getPluginRoots());
        this.registrationStore = builder.registrationStore != null
                ? builder.registrationStore
                : new InMemoryRegistrationStore();
        this.routeRegistrar = builder.routeRegistrar != null ? builder.routeRegistrar : new RouteTable();
        this.componentDirectory = builder.componentDirectory != null
                ? builder.componentDirectory
                : new ActiveComponentList(config.getInstalledComponents());
        this.templateTagCache = builder.templateTagCache != null
                ? builder.templateTagCache
                : new TemplateTagLibraryCache(componentDirectory);
        this.hookPoints = builder.hookPoints != null ? builder.hookPoints : HookPointRegistry.getInstance();
        SchemaMigrator migrator = builder.schemaMigrator != null ? builder.schemaMigrator : SchemaMigrator.NOOP;
        this.installer = new ExtensionInstaller(componentDirectory, migrator);

        ExtensionManagerDirectory directory = builder.directory != null
                ? builder.directory
                : ExtensionManagerDirectory.getInstance();
        directory.register(this);
    }

    // ==================== Discovery ====================

    /**
     * Refreshes the discovery source and reconciles the known extensions with it.
     *
     * <p>New packages get a registration record. Packages whose record says enabled are
     * initialized directly, without an install step. Known ids missing from the pass are
     * disabled, forgotten and released. Requirements are resolved once the whole pass
     * has been seen. A failing package is logged and skipped.
     *
     * @return what changed
     */
    public DiscoveryResult discover() {
        synchronized (lifecycleLock) {
            discoverySource.refresh();
            List<DiscoveredExtension> entries = discoverySource.discover();

            Map<String, RegistrationRecord> records = new HashMap<>();
            for (RegistrationRecord record : registrationStore.findAll()) {
                records.put(record.getId(), record);
            }

            Set<String> found = new LinkedHashSet<>();
            List<String> added = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (DiscoveredExtension entry : entries) {
                String id = entry.getId();
                if (!found.add(id)) {
                    LOG.warn("Skip duplicated extension id: {} from {}", id, entry);
                    continue;
                }
                try {
                    boolean isNew = !knownById.containsKey(id);
                    KnownExtension known = register(entry, records);
                    if (isNew) {
                        added.add(id);
                    }
                    if (known.record.isEnabled() && !liveById.containsKey(id)) {
                        Extension instance = initialize(known);
                        fire(listener -> listener.extensionInitialized(instance), "extensionInitialized", id);
                    }
                } catch (EnablingExtensionException | RuntimeException e) {
                    LOG.warn("Failed to load extension: id={}, message={}", id, e.getMessage(), e);
                    failed.add(id);
                }
            }

            List<String> removed = new ArrayList<>();
            for (String id : new ArrayList<>(knownById.keySet())) {
                if (found.contains(id)) {
                    continue;
                }
                if (liveById.containsKey(id)) {
                    try {
                        disable(id);
                    } catch (ExtensionException e) {
                        LOG.warn("Failed to disable vanished extension {}", id, e);
                    }
                }
                knownById.remove(id);
                removed.add(id);
                discoverySource.release(id);
            }

            resolveRequirements();
            DiscoveryResult result = new DiscoveryResult(added, removed, failed);
            LOG.info("Discovered {} extensions for {}: {}", knownById.size(), config.getKey(), result);
            return result;
        }
    }

    private KnownExtension register(DiscoveredExtension entry, Map<String, RegistrationRecord> records) {
        String id = entry.getId();
        KnownExtension existing = knownById.get(id);

        ExtensionDescriptor descriptor;
        if (existing != null && existing.descriptor.getVersion().equals(entry.getMetadata().getVersion())) {
            descriptor = existing.descriptor;
        } else {
            descriptor = buildDescriptor(entry);
            if (existing != null) {
                LOG.info("Extension {} changed version: {} -> {}", id,
                        existing.descriptor.getVersion(), descriptor.getVersion());
            }
        }

        RegistrationRecord record;
        if (existing != null) {
            record = existing.record;
        } else if (records.containsKey(id)) {
            record = records.get(id);
        } else {
            record = registrationStore.findById(id)
                    .orElseGet(() -> registrationStore.create(id, entry.getMetadata().getName()));
        }
        descriptor.setInstalled(record.isInstalled());
        descriptor.setEnabled(liveById.containsKey(id) || record.isEnabled());

        KnownExtension known = new KnownExtension(entry.getFactory(), descriptor, record);
        knownById.put(id, known);
        return known;
    }

    private ExtensionDescriptor buildDescriptor(DiscoveredExtension entry) {
        ExtensionFactory factory = entry.getFactory();
        return ExtensionDescriptor.builder()
                .id(entry.getId())
                .packageMetadata(entry.getMetadata())
                .requirements(factory.requirements())
                .resources(factory.resources())
                .configurable(factory.isConfigurable())
                .componentName(factory.componentName())
                .staticAssetPath(resolveAssetPath(entry))
                .assetSource(entry.getAssetSource().orElse(null))
                .build();
    }

    /**
     * Install path of a package's static assets: one directory directly under the static
     * root, named after the package. Install and disable delete this directory as a whole.
     *
     * @throws IllegalArgumentException if the package name would place it anywhere else
     */
    private Path resolveAssetPath(DiscoveredExtension entry) {
        Path staticRoot = config.getStaticRoot();
        String name = entry.getMetadata().getName();
        Path resolved = staticRoot.resolve(name).normalize();
        Preconditions.checkArgument(staticRoot.equals(resolved.getParent()),
                "Package name of extension %s does not name a directory under %s: %s",
                entry.getId(), staticRoot, name);
        return resolved;
    }

    private void resolveRequirements() {
        for (KnownExtension known : knownById.values()) {
            List<ExtensionDescriptor> resolved = new ArrayList<>();
            for (String requirement : known.descriptor.getRequirements()) {
                KnownExtension dependency = knownById.get(requirement);
                if (dependency != null) {
                    resolved.add(dependency.descriptor);
                } else {
                    LOG.warn("Extension {} requires unknown extension {}", known.descriptor.getId(), requirement);
                }
            }
            known.descriptor.resolveRequirements(resolved);
        }
    }

    // ==================== Enable / Disable ====================

    /**
     * Enables an extension and, first, every extension it requires.
     *
     * @param extensionId extension id
     * @return the live instance; the existing one if already enabled
     * @throws UnknownExtensionException if the id, or one of its requirements, was never discovered
     * @throws DependencyCycleException if the requirements form a cycle
     * @throws EnablingExtensionException if installing or initializing fails
     */
    public Extension enable(String extensionId) throws ExtensionException {
        Objects.requireNonNull(extensionId, "extensionId");
        synchronized (lifecycleLock) {
            LiveExtension live = liveById.get(extensionId);
            if (live != null) {
                return live.instance;
            }
            KnownExtension known = requireKnown(extensionId);
            Optional<List<String>> cycle = dependencyGraph().findCycle(extensionId);
            if (cycle.isPresent()) {
                throw new DependencyCycleException(extensionId, cycle.get());
            }

            for (String requirement : known.descriptor.getRequirements()) {
                if (!liveById.containsKey(requirement)) {
                    LOG.debug("Enabling requirement {} of extension {}", requirement, extensionId);
                }
                enable(requirement);
            }

            ExtensionDescriptor descriptor = known.descriptor;
            RegistrationRecord record = known.record;
            try {
                if (!record.isInstalled()) {
                    installer.install(descriptor);
                    record.setInstalled(true);
                    registrationStore.save(record);
                    descriptor.setInstalled(true);
                } else {
                    installer.placeAssets(descriptor);
                }
            } catch (InstallExtensionException e) {
                throw new EnablingExtensionException(extensionId,
                        "Failed to install extension " + extensionId + ": " + e.getMessage(), e);
            }

            record.setEnabled(true);
            registrationStore.save(record);
            descriptor.setEnabled(true);

            Extension instance = initialize(known);
            LOG.info("Enabled extension {}", descriptor);
            fire(listener -> listener.extensionInitialized(instance), "extensionInitialized", extensionId);
            return instance;
        }
    }

    /**
     * Disables an extension and, first, every enabled extension that requires it.
     *
     * <p>The live instance is shut down, its admin routes and component are removed and
     * its static assets are deleted. The {@code installed} flag and the schema are kept.
     * Does nothing if the extension is not enabled.
     *
     * @param extensionId extension id
     * @throws UnknownExtensionException if the id is not known
     */
    public void disable(String extensionId) throws ExtensionException {
        Objects.requireNonNull(extensionId, "extensionId");
        synchronized (lifecycleLock) {
            KnownExtension known = requireKnown(extensionId);
            if (!liveById.containsKey(extensionId) || !disabling.add(extensionId)) {
                return;
            }
            try {
                for (String dependent : dependencyGraph().dependentsOf(extensionId)) {
                    if (liveById.containsKey(dependent)) {
                        LOG.debug("Disabling dependent {} of extension {}", dependent, extensionId);
                        disable(dependent);
                    }
                }

                Extension instance = uninitialize(known);
                installer.removeAssets(known.descriptor);
                known.record.setEnabled(false);
                registrationStore.save(known.record);
                LOG.info("Disabled extension {}", known.descriptor);
                fire(listener -> listener.extensionUninitialized(instance), "extensionUninitialized", extensionId);
            } finally {
                disabling.remove(extensionId);
            }
        }
    }

    /**
     * Returns every known extension that requires {@code extensionId}.
     *
     * @param extensionId dependency id
     * @return dependent ids
     * @throws UnknownExtensionException if the id is not known
     */
    public List<String> getDependents(String extensionId) throws UnknownExtensionException {
        synchronized (lifecycleLock) {
            requireKnown(extensionId);
            return dependencyGraph().dependentsOf(extensionId);
        }
    }

    /**
     * Shuts down every live instance, dependents first, for host shutdown. Registration
     * records keep saying enabled so the next start brings the extensions back.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            for (String id : Lists.reverse(new ArrayList<>(liveById.keySet()))) {
                KnownExtension known = knownById.get(id);
                Extension instance = uninitialize(known);
                fire(listener -> listener.extensionUninitialized(instance), "extensionUninitialized", id);
            }
            LOG.info("Shut down extension manager {}", config.getKey());
        }
    }

    private Extension initialize(KnownExtension known) throws EnablingExtensionException {
        ExtensionDescriptor descriptor = known.descriptor;
        String id = descriptor.getId();
        Settings settings = new Settings(known.record, registrationStore);
        ExtensionContext context = new ExtensionContext(descriptor, settings, this, hookPoints);

        Extension instance = null;
        RouteSet adminRoutes = RouteSet.empty();
        try {
            instance = known.factory.create(context);
            if (instance == null) {
                throw new IllegalStateException("Factory of extension " + id + " returned no instance");
            }
            instance.initialize();
            if (descriptor.isConfigurable()) {
                RouteSet routes = instance.getAdminRoutes();
                if (routes != null && !routes.isEmpty()) {
                    adminRoutes = routeRegistrar.addRoutes(getAdminPrefix(id), routes);
                }
            }
        } catch (Exception e) {
            if (instance != null) {
                shutdownInstance(instance);
            }
            installer.removeAssets(descriptor);
            known.record.setEnabled(false);
            registrationStore.save(known.record);
            descriptor.setEnabled(false);
            throw new EnablingExtensionException(id, "Failed to initialize extension " + id + ": " + e.getMessage(), e);
        }

        liveById.put(id, new LiveExtension(instance, adminRoutes));
        descriptor.setInstalled(known.record.isInstalled());
        descriptor.setEnabled(true);
        componentDirectory.add(descriptor.getComponentName());
        templateTagCache.invalidate();
        return instance;
    }

    private Extension uninitialize(KnownExtension known) {
        String id = known.descriptor.getId();
        LiveExtension live = liveById.get(id);
        shutdownInstance(live.instance);
        if (!live.adminRoutes.isEmpty()) {
            routeRegistrar.removeRoutes(live.adminRoutes);
        }
        componentDirectory.remove(known.descriptor.getComponentName());
        templateTagCache.invalidate();
        known.descriptor.setEnabled(false);
        liveById.remove(id);
        return live.instance;
    }

    private void shutdownInstance(Extension instance) {
        try {
            instance.shutdown();
        } catch (RuntimeException e) {
            LOG.warn("Extension {} failed to shut down cleanly", instance.getId(), e);
        }
    }

    private void fire(Consumer<ExtensionListener> notification, String event, String extensionId) {
        for (ExtensionListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Extension listener {} failed on {} for {}", listener, event, extensionId, e);
            }
        }
    }

    private KnownExtension requireKnown(String extensionId) throws UnknownExtensionException {
        KnownExtension known = knownById.get(extensionId);
        if (known == null) {
            throw new UnknownExtensionException(extensionId);
        }
        return known;
    }

    private DependencyGraph dependencyGraph() {
        List<ExtensionDescriptor> descriptors = new ArrayList<>();
        for (KnownExtension known : knownById.values()) {
            descriptors.add(known.descriptor);
        }
        return DependencyGraph.of(descriptors);
    }

    private String getAdminPrefix(String extensionId) {
        return config.getAdminUrlPrefix() + extensionId + "/config/";
    }

    // ==================== Queries ====================

    @Override
    public String getKey() {
        return config.getKey();
    }

    @Override
    public String getAdminUrl() {
        return config.getAdminUrlPrefix();
    }

    @Override
    public Optional<Extension> getEnabledExtension(String extensionId) {
        synchronized (lifecycleLock) {
            LiveExtension live = liveById.get(extensionId);
            return live != null ? Optional.of(live.instance) : Optional.empty();
        }
    }

    @Override
    public Collection<Extension> getEnabledExtensions() {
        synchronized (lifecycleLock) {
            List<Extension> instances = new ArrayList<>();
            for (LiveExtension live : liveById.values()) {
                instances.add(live.instance);
            }
            return ImmutableList.copyOf(instances);
        }
    }

    public boolean isEnabled(String extensionId) {
        synchronized (lifecycleLock) {
            return liveById.containsKey(extensionId);
        }
    }

    /**
     * Returns the descriptor of a discovered extension.
     *
     * @param extensionId extension id
     * @return descriptor
     * @throws UnknownExtensionException if the id is not known
     */
    public ExtensionDescriptor getInstalledExtension(String extensionId) throws UnknownExtensionException {
        synchronized (lifecycleLock) {
            return requireKnown(extensionId).descriptor;
        }
    }

    /**
     * Returns the descriptors of every discovered extension, in discovery order.
     *
     * @return descriptors
     */
    public List<ExtensionDescriptor> getInstalledExtensions() {
        synchronized (lifecycleLock) {
            List<ExtensionDescriptor> descriptors = new ArrayList<>();
            for (KnownExtension known : knownById.values()) {
                descriptors.add(known.descriptor);
            }
            return ImmutableList.copyOf(descriptors);
        }
    }

    public ExtensionManagerConfig getConfig() {
        return config;
    }

    public void addListener(ExtensionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ExtensionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return "ExtensionManager{key='" + config.getKey() + "'}";
    }

    public static Builder builder(ExtensionManagerConfig config) {
        return new Builder(config);
    }

    private static final class KnownExtension {
        private final ExtensionFactory factory;
        private final ExtensionDescriptor descriptor;
        private final RegistrationRecord record;

        private KnownExtension(ExtensionFactory factory, ExtensionDescriptor descriptor, RegistrationRecord record) {
            this.factory = factory;
            this.descriptor = descriptor;
            this.record = record;
        }
    }

    private static final class LiveExtension {
        private final Extension instance;
        /** Admin routes as installed, removed as-is on disable */
        private final RouteSet adminRoutes;

        private LiveExtension(Extension instance, RouteSet adminRoutes) {
            this.instance = instance;
            this.adminRoutes = adminRoutes;
        }
    }

    /**
     * Builder for {@link ExtensionManager}. Collaborators that are not set get the
     * in-memory defaults; without a discovery source the configured plugin roots are
     * scanned.
     */
    public static final class Builder {
        private final ExtensionManagerConfig config;
        private DiscoverySource discoverySource;
        private RegistrationStore registrationStore;
        private RouteRegistrar routeRegistrar;
        private ComponentDirectory componentDirectory;
        private TemplateTagCache templateTagCache;
        private SchemaMigrator schemaMigrator;
        private HookPointRegistry hookPoints;
        private ExtensionManagerDirectory directory;

        private Builder(ExtensionManagerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder discoverySource(DiscoverySource discoverySource) {
            this.discoverySource = discoverySource;
            return this;
        }

        public Builder registrationStore(RegistrationStore registrationStore) {
            this.registrationStore = registrationStore;
            return this;
        }

        public Builder routeRegistrar(RouteRegistrar routeRegistrar) {
            this.routeRegistrar = routeRegistrar;
            return this;
        }

        public Builder componentDirectory(ComponentDirectory componentDirectory) {
            this.componentDirectory = componentDirectory;
            return this;
        }

        public Builder templateTagCache(TemplateTagCache templateTagCache) {
            this.templateTagCache = templateTagCache;
            return this;
        }

        public Builder schemaMigrator(SchemaMigrator schemaMigrator) {
            this.schemaMigrator = schemaMigrator;
            return this;
        }

        public Builder hookPoints(HookPointRegistry hookPoints) {
            this.hookPoints = hookPoints;
            return this;
        }

        public Builder directory(ExtensionManagerDirectory directory) {
            this.directory = directory;
            return this;
        }

        /**
         * Builds the manager and registers it in the manager directory.
         *
         * @return the manager; call {@link ExtensionManager#discover()} to load extensions
         */
        public ExtensionManager build() {
            return new ExtensionManager(this);
        }
    }
}
