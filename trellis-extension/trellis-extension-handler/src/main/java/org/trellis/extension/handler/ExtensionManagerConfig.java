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

import org.trellis.extension.ExtensionConfigurationException;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuration of one {@link ExtensionManager}.
 *
 * <p>Can be built programmatically or read from a properties file:
 * <pre>
 * extension_key = trellis.extensions
 * extension_static_root = /srv/trellis/static/ext
 * extension_admin_url_prefix = /admin/extensions/
 * extension_plugin_roots = /opt/trellis/plugins, /var/lib/trellis/plugins
 * extension_installed_components = trellis.core, trellis.accounts
 * </pre>
 */
public final class ExtensionManagerConfig {

    public static final String KEY = "extension_key";
    public static final String STATIC_ROOT = "extension_static_root";
    public static final String ADMIN_URL_PREFIX = "extension_admin_url_prefix";
    public static final String PLUGIN_ROOTS = "extension_plugin_roots";
    public static final String INSTALLED_COMPONENTS = "extension_installed_components";

    public static final String DEFAULT_ADMIN_URL_PREFIX = "/admin/extensions/";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final String key;
    private final Path staticRoot;
    private final String adminUrlPrefix;
    private final List<Path> pluginRoots;
    private final List<String> installedComponents;

    private ExtensionManagerConfig(Builder builder) {
        if (Strings.isNullOrEmpty(builder.key) || builder.key.trim().isEmpty()) {
            throw new ExtensionConfigurationException("Missing required configuration: " + KEY);
        }
        if (builder.staticRoot == null) {
            throw new ExtensionConfigurationException("Missing required configuration: " + STATIC_ROOT
                    + "; extensions cannot install static assets without it");
        }
        this.key = builder.key.trim();
        this.staticRoot = builder.staticRoot.toAbsolutePath().normalize();
        this.adminUrlPrefix = normalizePrefix(builder.adminUrlPrefix);
        this.pluginRoots = ImmutableList.copyOf(builder.pluginRoots);
        this.installedComponents = ImmutableList.copyOf(builder.installedComponents);
    }

    /**
     * Reads the configuration from properties.
     *
     * @param properties configuration properties
     * @return configuration
     * @throws ExtensionConfigurationException if a required key is missing
     */
    public static ExtensionManagerConfig fromProperties(Properties properties) {
        Builder builder = builder().key(properties.getProperty(KEY));
        String staticRoot = properties.getProperty(STATIC_ROOT);
        if (!Strings.isNullOrEmpty(staticRoot) && !staticRoot.trim().isEmpty()) {
            builder.staticRoot(Paths.get(staticRoot.trim()));
        }
        String adminUrlPrefix = properties.getProperty(ADMIN_URL_PREFIX);
        if (!Strings.isNullOrEmpty(adminUrlPrefix)) {
            builder.adminUrlPrefix(adminUrlPrefix.trim());
        }
        for (String root : LIST_SPLITTER.split(Strings.nullToEmpty(properties.getProperty(PLUGIN_ROOTS)))) {
            builder.addPluginRoot(Paths.get(root));
        }
        for (String component : LIST_SPLITTER.split(
                Strings.nullToEmpty(properties.getProperty(INSTALLED_COMPONENTS)))) {
            builder.addInstalledComponent(component);
        }
        return builder.build();
    }

    /**
     * Reads the configuration from a UTF-8 properties file.
     *
     * @param file configuration file
     * @return configuration
     * @throws ExtensionConfigurationException if the file cannot be read or a required key is missing
     */
    public static ExtensionManagerConfig load(Path file) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ExtensionConfigurationException("Failed to read extension configuration " + file, e);
        }
        return fromProperties(properties);
    }

    public String getKey() {
        return key;
    }

    public Path getStaticRoot() {
        return staticRoot;
    }

    /**
     * Admin URL prefix, always with a leading and a trailing slash.
     *
     * @return admin URL prefix
     */
    public String getAdminUrlPrefix() {
        return adminUrlPrefix;
    }

    public List<Path> getPluginRoots() {
        return pluginRoots;
    }

    public List<String> getInstalledComponents() {
        return installedComponents;
    }

    private static String normalizePrefix(String prefix) {
        String value = Strings.isNullOrEmpty(prefix) ? DEFAULT_ADMIN_URL_PREFIX : prefix.trim();
        if (!value.startsWith("/")) {
            value = "/" + value;
        }
        if (!value.endsWith("/")) {
            value = value + "/";
        }
        return value;
    }

    @Override
    public String toString() {
        return "ExtensionManagerConfig{key='" + key + "', staticRoot=" + staticRoot
                + ", adminUrlPrefix='" + adminUrlPrefix + "', pluginRoots=" + pluginRoots + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ExtensionManagerConfig}.
     */
    public static final class Builder {
        private String key;
        private Path staticRoot;
        private String adminUrlPrefix = DEFAULT_ADMIN_URL_PREFIX;
        private final List<Path> pluginRoots = new ArrayList<>();
        private final List<String> installedComponents = new ArrayList<>();

        private Builder() {
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder staticRoot(Path staticRoot) {
            this.staticRoot = staticRoot;
            return this;
        }

        public Builder adminUrlPrefix(String adminUrlPrefix) {
            this.adminUrlPrefix = adminUrlPrefix;
            return this;
        }

        public Builder addPluginRoot(Path pluginRoot) {
            this.pluginRoots.add(pluginRoot);
            return this;
        }

        public Builder addInstalledComponent(String component) {
            this.installedComponents.add(component);
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return configuration
         * @throws ExtensionConfigurationException if key or static root is missing
         */
        public ExtensionManagerConfig build() {
            return new ExtensionManagerConfig(this);
        }
    }
}
