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

package org.trellis.extension;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extension Descriptor - static and derived metadata about one discovered extension package.
 *
 * <p>The descriptor is built once per discovered package version. Identity, metadata,
 * declared requirements and capability markers are immutable; the {@code enabled} and
 * {@code installed} flags mirror the registration record and change with the lifecycle.
 *
 * <p>Requirements are declared as ids. They are resolved to descriptors only after a
 * full discovery pass, see {@link #resolveRequirements(List)}, because a dependency
 * may be discovered after its dependent.
 */
public final class ExtensionDescriptor {

    /** Stable extension id (primary key everywhere else) */
    private final String id;

    private final PackageMetadata packageMetadata;

    /** Ids of other extensions this one requires */
    private final List<String> requirements;

    /** Declared resource / capability markers */
    private final List<String> resources;

    private final boolean configurable;

    /** Name under which the host's active-component list knows this extension */
    private final String componentName;

    /** Where static assets are installed: {@code <static root>/<package name>} */
    private final Path staticAssetPath;

    /** Asset tree shipped with the package, may be null */
    private final Path assetSource;

    private volatile boolean enabled;
    private volatile boolean installed;
    private volatile List<ExtensionDescriptor> resolvedRequirements = Collections.emptyList();

    private ExtensionDescriptor(Builder builder) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(builder.id), "id is required");
        this.id = builder.id;
        this.packageMetadata = Objects.requireNonNull(builder.packageMetadata, "packageMetadata is required");
        this.requirements = ImmutableList.copyOf(builder.requirements);
        this.resources = ImmutableList.copyOf(builder.resources);
        this.configurable = builder.configurable;
        this.componentName = Strings.isNullOrEmpty(builder.componentName) ? builder.id : builder.componentName;
        this.staticAssetPath = Objects.requireNonNull(builder.staticAssetPath, "staticAssetPath is required");
        this.assetSource = builder.assetSource;
    }

    public String getId() {
        return id;
    }

    public PackageMetadata getPackageMetadata() {
        return packageMetadata;
    }

    public String getName() {
        return packageMetadata.getName();
    }

    public String getVersion() {
        return packageMetadata.getVersion();
    }

    public Optional<String> getSummary() {
        return packageMetadata.getSummary();
    }

    public Optional<String> getAuthor() {
        return packageMetadata.getAuthor();
    }

    public Optional<String> getLicense() {
        return packageMetadata.getLicense();
    }

    public List<String> getRequirements() {
        return requirements;
    }

    public List<String> getResources() {
        return resources;
    }

    public boolean isConfigurable() {
        return configurable;
    }

    public String getComponentName() {
        return componentName;
    }

    public Path getStaticAssetPath() {
        return staticAssetPath;
    }

    public Optional<Path> getAssetSource() {
        return Optional.ofNullable(assetSource);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isInstalled() {
        return installed;
    }

    public void setInstalled(boolean installed) {
        this.installed = installed;
    }

    /**
     * Returns true if this descriptor declares {@code extensionId} as a requirement.
     *
     * @param extensionId candidate dependency id
     * @return true if required
     */
    public boolean requires(String extensionId) {
        return requirements.contains(extensionId);
    }

    /**
     * Returns the requirement descriptors resolved by the last full discovery pass.
     *
     * @return resolved requirements, empty before the first resolution
     */
    public List<ExtensionDescriptor> getResolvedRequirements() {
        return resolvedRequirements;
    }

    /**
     * Records the resolved requirement descriptors.
     *
     * @param resolved descriptors, in declaration order
     */
    public void resolveRequirements(List<ExtensionDescriptor> resolved) {
        this.resolvedRequirements = Collections.unmodifiableList(new ArrayList<>(resolved));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExtensionDescriptor that = (ExtensionDescriptor) o;
        return id.equals(that.id) && getVersion().equals(that.getVersion());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, getVersion());
    }

    @Override
    public String toString() {
        return getName() + " " + getVersion() + " (enabled = " + enabled + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ExtensionDescriptor}.
     */
    public static final class Builder {
        private String id;
        private PackageMetadata packageMetadata;
        private List<String> requirements = new ArrayList<>();
        private List<String> resources = new ArrayList<>();
        private boolean configurable;
        private String componentName;
        private Path staticAssetPath;
        private Path assetSource;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder packageMetadata(PackageMetadata packageMetadata) {
            this.packageMetadata = packageMetadata;
            return this;
        }

        public Builder requirements(List<String> requirements) {
            this.requirements = requirements != null ? new ArrayList<>(requirements) : new ArrayList<>();
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources = resources != null ? new ArrayList<>(resources) : new ArrayList<>();
            return this;
        }

        public Builder configurable(boolean configurable) {
            this.configurable = configurable;
            return this;
        }

        public Builder componentName(String componentName) {
            this.componentName = componentName;
            return this;
        }

        public Builder staticAssetPath(Path staticAssetPath) {
            this.staticAssetPath = staticAssetPath;
            return this;
        }

        public Builder assetSource(Path assetSource) {
            this.assetSource = assetSource;
            return this;
        }

        /**
         * Builds the descriptor.
         *
         * @return built descriptor
         * @throws NullPointerException if metadata or static asset path is missing
         * @throws IllegalArgumentException if id is empty
         */
        public ExtensionDescriptor build() {
            return new ExtensionDescriptor(this);
        }
    }
}
