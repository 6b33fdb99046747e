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

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Creates extension classloaders and discovers the single factory a package ships.
 *
 * <p>Does no directory IO; {@link PluginDirectoryLoader} resolves the jars.
 */
public final class PluginLoader {

    private final List<String> parentFirstPackages;

    public PluginLoader(ClassLoadingPolicy policy) {
        this.parentFirstPackages = (policy != null ? policy : ClassLoadingPolicy.defaultPolicy())
                .toParentFirstPackages();
    }

    /**
     * Creates the classloader for one package.
     *
     * <p>The parent is wrapped so that service descriptors for {@code factoryType} on the
     * host classpath stay invisible; each package discovers only its own factory.
     *
     * @param urls package jars
     * @param parent host classloader
     * @param factoryType factory service type
     * @return child-first classloader
     */
    public ClassLoader createClassLoader(URL[] urls, ClassLoader parent, Class<?> factoryType) {
        Objects.requireNonNull(factoryType, "factoryType");
        ClassLoader filteredParent = new ServiceResourceFilteringParentClassLoader(parent, factoryType);
        return new ChildFirstClassLoader(urls, filteredParent, parentFirstPackages);
    }

    /**
     * Loads exactly one factory of {@code factoryType} from {@code classLoader}.
     *
     * @param classLoader package classloader
     * @param factoryType factory service type
     * @param pluginDir directory reported on failure
     * @param <F> factory type
     * @return the factory
     * @throws PluginLoadException if none or more than one factory is declared, or a
     *         declared provider cannot be instantiated
     */
    public <F extends PluginFactory> F loadSingleFactory(ClassLoader classLoader, Class<F> factoryType,
            Path pluginDir) throws PluginLoadException {
        List<F> discovered = new ArrayList<>();
        try {
            ServiceLoader.load(factoryType, classLoader).forEach(discovered::add);
        } catch (Throwable t) {
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_DISCOVER,
                    "Failed to discover " + factoryType.getName() + " in " + pluginDir, t);
        }
        if (discovered.isEmpty()) {
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_DISCOVER,
                    "No " + factoryType.getName() + " found in " + pluginDir, null);
        }
        if (discovered.size() > 1) {
            throw new PluginLoadException(pluginDir, LoadFailure.STAGE_DISCOVER,
                    "Multiple " + factoryType.getName() + " found in " + pluginDir + ": " + discovered.size(), null);
        }
        return discovered.get(0);
    }

    private static final class ServiceResourceFilteringParentClassLoader extends ClassLoader {

        private final String blockedServiceResource;

        private ServiceResourceFilteringParentClassLoader(ClassLoader parent, Class<?> factoryType) {
            super(parent);
            this.blockedServiceResource = "META-INF/services/" + factoryType.getName();
        }

        @Override
        public URL getResource(String name) {
            return blockedServiceResource.equals(name) ? null : super.getResource(name);
        }

        @Override
        public Enumeration<URL> getResources(String name) throws IOException {
            if (blockedServiceResource.equals(name)) {
                return Collections.emptyEnumeration();
            }
            return super.getResources(name);
        }
    }
}
