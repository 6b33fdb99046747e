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

package org.trellis.extension.loader;

import org.trellis.extension.spi.PluginFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads extension factories from plugin root directories, and keeps them loaded
 * across rescans until they are unloaded.
 *
 * <p>Every direct subdirectory of a plugin root is one plugin directory:
 * <pre>
 * plugins/
 *   audit-trail/
 *     audit-trail.jar        one or more jars
 *     lib/*.jar              private dependencies
 *     extension.json         package metadata (read by the caller)
 *     htdocs/                static assets (read by the caller)
 * </pre>
 *
 * <p>Each directory gets its own {@link ChildFirstClassLoader} and must declare exactly
 * one factory of the loader's type through {@code META-INF/services}.
 *
 * <p>{@link #scan(List, ClassLoader)} is repeatable. A directory that is already loaded
 * is retained as is, a new directory is loaded, and a loaded plugin whose directory is
 * gone is reported as vanished but stays loaded until {@link #unload(String)}: the
 * caller may still have live instances created from its classes.
 *
 * <p>Failures are staged ({@code scan}, {@code resolve}, {@code createClassLoader},
 * {@code discover}, {@code instantiate}, {@code conflict}) and never stop other
 * directories from loading. When two directories yield the same plugin name the one
 * loaded first wins and the other's classloader is closed.
 *
 * @param <F> factory type
 */
public class PluginDirectoryLoader<F extends PluginFactory> implements Closeable {
    private static final Logger LOG = LogManager.getLogger(PluginDirectoryLoader.class);

    private final Class<F> factoryType;
    private final PluginLoader pluginLoader;
    private final Map<String, PluginHandle<F>> handlesByName = new LinkedHashMap<>();
    private final Object lifecycleLock = new Object();

    public PluginDirectoryLoader(Class<F> factoryType, ClassLoadingPolicy policy) {
        this.factoryType = Objects.requireNonNull(factoryType, "factoryType");
        this.pluginLoader = new PluginLoader(policy);
    }

    /**
     * Scans the plugin roots and loads every plugin directory not loaded yet.
     *
     * @param pluginRoots plugin root directories, null entries are skipped
     * @param parent host classloader
     * @return outcome of this pass
     */
    public LoadReport<F> scan(List<Path> pluginRoots, ClassLoader parent) {
        Objects.requireNonNull(pluginRoots, "pluginRoots");
        Objects.requireNonNull(parent, "parent");

        List<Path> pluginDirs = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();
        int rootsScanned = 0;
        for (Path root : pluginRoots) {
            if (root == null) {
                continue;
            }
            rootsScanned++;
            collectPluginDirs(root, pluginDirs, failures);
        }

        List<PluginHandle<F>> loaded = new ArrayList<>();
        List<PluginHandle<F>> retained = new ArrayList<>();
        List<String> vanished = new ArrayList<>();
        synchronized (lifecycleLock) {
            Map<Path, PluginHandle<F>> handlesByDir = new LinkedHashMap<>();
            for (PluginHandle<F> handle : handlesByName.values()) {
                handlesByDir.put(handle.getPluginDir(), handle);
            }

            Set<Path> seen = new HashSet<>();
            for (Path pluginDir : pluginDirs) {
                seen.add(pluginDir);
                PluginHandle<F> existing = handlesByDir.get(pluginDir);
                if (existing != null) {
                    retained.add(existing);
                    continue;
                }
                try {
                    PluginHandle<F> handle = loadFromPluginDir(pluginDir, parent);
                    if (handlesByName.containsKey(handle.getPluginName())) {
                        closeClassLoader(handle.getClassLoader());
                        failures.add(new LoadFailure(pluginDir, LoadFailure.STAGE_CONFLICT,
                                "Duplicate plugin name: " + handle.getPluginName(), null));
                        continue;
                    }
                    handlesByName.put(handle.getPluginName(), handle);
                    loaded.add(handle);
                } catch (PluginLoadException e) {
                    failures.add(e.toLoadFailure());
                }
            }

            for (PluginHandle<F> handle : handlesByName.values()) {
                if (!seen.contains(handle.getPluginDir())) {
                    vanished.add(handle.getPluginName());
                }
            }
        }

        for (LoadFailure failure : failures) {
            LOG.warn("Skip plugin directory due to load failure: pluginDir={}, stage={}, message={}",
                    failure.getPluginDir(), failure.getStage(), failure.getMessage(), failure.getCause());
        }
        LoadReport<F> report = new LoadReport<>(loaded, retained, vanished, failures, rootsScanned, pluginDirs.size());
        LOG.debug("Plugin scan of {} finished: {}", pluginRoots, report);
        return report;
    }

    public Optional<PluginHandle<F>> get(String pluginName) {
        synchronized (lifecycleLock) {
            return Optional.ofNullable(handlesByName.get(pluginName));
        }
    }

    /**
     * Returns every loaded handle, sorted by plugin name.
     *
     * @return loaded handles
     */
    public List<PluginHandle<F>> list() {
        synchronized (lifecycleLock) {
            List<PluginHandle<F>> results = new ArrayList<>(handlesByName.values());
            results.sort(Comparator.comparing(PluginHandle::getPluginName));
            return results;
        }
    }

    /**
     * Forgets a loaded plugin and closes its classloader.
     *
     * @param pluginName plugin name
     * @return true if the plugin was loaded
     */
    public boolean unload(String pluginName) {
        PluginHandle<F> removed;
        synchronized (lifecycleLock) {
            removed = handlesByName.remove(pluginName);
        }
        if (removed == null) {
            return false;
        }
        closeClassLoader(removed.getClassLoader());
        LOG.info("Unloaded plugin {} from {}", pluginName, removed.getPluginDir());
        return true;
    }

    /**
     * Unloads every plugin.
     */
    @Override
    public void close() {
        for (PluginHandle<F> handle : list()) {
            unload(handle.getPluginName());
        }
    }

    private void collectPluginDirs(Path root, List<Path> pluginDirs, List<LoadFailure> failures) {
        Path normalized = normalize(root);
        if (!Files.isDirectory(normalized)) {
            String reason = Files.exists(normalized) ? "is not a directory" : "does not exist";
            failures.add(new LoadFailure(normalized, LoadFailure.STAGE_SCAN,
                    "Plugin root " + reason + ": " + normalized, null));
            return;
        }
        try (Stream<Path> stream = Files.list(normalized)) {
            pluginDirs.addAll(stream.filter(Files::isDirectory)
                    .map(this::normalize)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            failures.add(new LoadFailure(normalized, LoadFailure.STAGE_SCAN,
                    "Failed to list plugin root: " + normalized, e));
        }
    }

    private PluginHandle<F> loadFromPluginDir(Path pluginDir, ClassLoader parent) throws PluginLoadException {
        List<Path> jars = resolveJars(pluginDir);
        URL[] urls = toUrls(jars, pluginDir);

        ClassLoader classLoader;
        try {
            classLoader = pluginLoader.createClassLoader(urls, parent, factoryType);
        } catch (RuntimeException e) {
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_CREATE_CLASSLOADER,
                    "Failed to create classloader for " + pluginDir, e);
        }

        try {
            F factory = pluginLoader.loadSingleFactory(classLoader, factoryType, pluginDir);
            String pluginName = factory.name();
            if (pluginName == null || pluginName.trim().isEmpty()) {
                throw new PluginLoadException(pluginDir, LoadFailure.STAGE_INSTANTIATE,
                        "Plugin name is empty for directory: " + pluginDir, null);
            }
            return new PluginHandle<>(pluginName, pluginDir, jars, classLoader, factory, Instant.now());
        } catch (PluginLoadException e) {
            closeClassLoader(classLoader);
            throw e;
        } catch (RuntimeException e) {
            closeClassLoader(classLoader);
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_INSTANTIATE,
                    "Failed to get plugin name from discovered factory in " + pluginDir, e);
        }
    }

    private List<Path> resolveJars(Path pluginDir) throws PluginLoadException {
        List<Path> jars = new ArrayList<>();
        collectJars(pluginDir, jars);
        Path libDir = pluginDir.resolve("lib");
        if (Files.isDirectory(libDir)) {
            collectJars(libDir, jars);
        }
        if (jars.isEmpty()) {
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_RESOLVE,
                    "No jar found under plugin directory: " + pluginDir, null);
        }
        return jars;
    }

    private void collectJars(Path directory, List<Path> target) throws PluginLoadException {
        try (Stream<Path> stream = Files.list(directory)) {
            target.addAll(stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .map(this::normalize)
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new PluginLoadException(directory, LoadFailure.STAGE_RESOLVE,
                    "Failed to resolve jars under " + directory, e);
        }
    }

    private URL[] toUrls(List<Path> jars, Path pluginDir) throws PluginLoadException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new PluginLoadException(pluginDir, LoadFailure.STAGE_RESOLVE,
                        "Invalid jar path: " + jars.get(i), e);
            }
        }
        return urls;
    }

    private static void closeClassLoader(ClassLoader classLoader) {
        if (!(classLoader instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) classLoader).close();
        } catch (IOException e) {
            LOG.warn("Failed to close plugin classloader {}", classLoader, e);
        }
    }

    private Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
