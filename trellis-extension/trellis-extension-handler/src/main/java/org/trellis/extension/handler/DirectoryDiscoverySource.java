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

import org.trellis.extension.PackageMetadata;
import org.trellis.extension.loader.ClassLoadingPolicy;
import org.trellis.extension.loader.LoadReport;
import org.trellis.extension.loader.PluginDirectoryLoader;
import org.trellis.extension.loader.PluginHandle;
import org.trellis.extension.spi.ExtensionFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers extension packages laid out in plugin directories.
 *
 * <p>Each direct subdirectory of a plugin root is one package:
 * {@code *.jar} and {@code lib/*.jar} hold the code and declare one
 * {@link ExtensionFactory} through {@code META-INF/services}; an optional
 * {@value #METADATA_FILE} holds the package metadata; an optional {@value #ASSET_DIR}
 * directory holds the static assets installed on enable.
 *
 * <p>{@link #refresh()} rescans the roots. Packages already loaded keep their
 * classloader; {@link #release(String)} closes the classloader of a vanished package.
 */
public class DirectoryDiscoverySource implements DiscoverySource, Closeable {
    private static final Logger LOG = LogManager.getLogger(DirectoryDiscoverySource.class);

    public static final String METADATA_FILE = "extension.json";
    public static final String ASSET_DIR = "htdocs";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    private final List<Path> pluginRoots;
    private final ClassLoader parent;
    private final PluginDirectoryLoader<ExtensionFactory> loader;
    private volatile LoadReport<ExtensionFactory> lastReport;

    public DirectoryDiscoverySource(List<Path> pluginRoots) {
        this(pluginRoots, DirectoryDiscoverySource.class.getClassLoader(), ClassLoadingPolicy.defaultPolicy());
    }

    public DirectoryDiscoverySource(List<Path> pluginRoots, ClassLoader parent, ClassLoadingPolicy policy) {
        this.pluginRoots = ImmutableList.copyOf(Objects.requireNonNull(pluginRoots, "pluginRoots"));
        this.parent = Objects.requireNonNull(parent, "parent");
        this.loader = new PluginDirectoryLoader<>(ExtensionFactory.class, policy);
    }

    @Override
    public void refresh() {
        LoadReport<ExtensionFactory> report = loader.scan(pluginRoots, parent);
        LOG.info("Scanned extension plugin roots {}: loaded={}, retained={}, vanished={}, failures={}",
                pluginRoots, report.getLoaded().size(), report.getRetained().size(),
                report.getVanished().size(), report.getFailures().size());
        lastReport = report;
    }

    @Override
    public List<DiscoveredExtension> discover() {
        LoadReport<ExtensionFactory> report = lastReport;
        if (report == null) {
            refresh();
            report = lastReport;
        }
        List<DiscoveredExtension> discovered = new ArrayList<>();
        for (PluginHandle<ExtensionFactory> handle : report.getAvailable()) {
            PackageMetadata metadata;
            try {
                metadata = readMetadata(handle);
            } catch (IOException e) {
                LOG.warn("Skip plugin directory due to unreadable metadata: pluginDir={}, message={}",
                        handle.getPluginDir(), e.getMessage(), e);
                continue;
            }
            Path assets = handle.resolve(ASSET_DIR);
            discovered.add(new DiscoveredExtension(handle.getFactory(), metadata,
                    Files.isDirectory(assets) ? assets : null));
        }
        return discovered;
    }

    @Override
    public void release(String extensionId) {
        loader.unload(extensionId);
    }

    @VisibleForTesting
    LoadReport<ExtensionFactory> getLastReport() {
        return lastReport;
    }

    @Override
    public void close() {
        loader.close();
    }

    /**
     * Reads {@value #METADATA_FILE}. Scalar values are kept as strings, a missing or
     * placeholder name falls back to the plugin name.
     */
    private PackageMetadata readMetadata(PluginHandle<ExtensionFactory> handle) throws IOException {
        Map<String, String> raw = new LinkedHashMap<>();
        Path file = handle.resolve(METADATA_FILE);
        if (Files.isRegularFile(file)) {
            Map<String, Object> parsed = MAPPER.readValue(file.toFile(), MAP_TYPE);
            if (parsed != null) {
                for (Map.Entry<String, Object> entry : parsed.entrySet()) {
                    if (entry.getValue() != null) {
                        raw.put(entry.getKey(), String.valueOf(entry.getValue()));
                    }
                }
            }
        }
        String name = raw.get(PackageMetadata.KEY_NAME);
        if (Strings.isNullOrEmpty(name) || name.trim().isEmpty() || PackageMetadata.UNKNOWN.equals(name)) {
            raw.put(PackageMetadata.KEY_NAME, handle.getPluginName());
        }
        return PackageMetadata.fromMap(raw);
    }
}
