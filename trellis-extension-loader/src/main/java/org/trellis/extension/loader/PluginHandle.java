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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One loaded plugin directory: its factory, the jars behind it and the classloader
 * that owns them.
 *
 * @param <F> factory type
 */
public final class PluginHandle<F extends PluginFactory> {

    private final String pluginName;
    private final Path pluginDir;
    private final List<Path> resolvedJars;
    private final ClassLoader classLoader;
    private final F factory;
    private final Instant loadedAt;

    public PluginHandle(String pluginName, Path pluginDir, List<Path> resolvedJars,
            ClassLoader classLoader, F factory, Instant loadedAt) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(pluginName) && !pluginName.trim().isEmpty(),
                "pluginName is blank");
        this.pluginName = pluginName.trim();
        this.pluginDir = Objects.requireNonNull(pluginDir, "pluginDir");
        this.resolvedJars = ImmutableList.copyOf(Objects.requireNonNull(resolvedJars, "resolvedJars"));
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
    }

    /**
     * Name reported by the factory; for extension factories this is the extension id.
     *
     * @return plugin name
     */
    public String getPluginName() {
        return pluginName;
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    /**
     * Resolves a file shipped next to the jars, such as package metadata or assets.
     *
     * @param relative path relative to the plugin directory
     * @return resolved path (may not exist)
     */
    public Path resolve(String relative) {
        return pluginDir.resolve(relative);
    }

    public List<Path> getResolvedJars() {
        return resolvedJars;
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    public F getFactory() {
        return factory;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    @Override
    public String toString() {
        return "PluginHandle{name='" + pluginName + "', dir=" + pluginDir + ", jars=" + resolvedJars.size() + '}';
    }
}
