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
import org.trellis.extension.spi.ExtensionFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One installable package found by a {@link DiscoverySource}: the factory it ships,
 * its package metadata and, optionally, its static asset tree.
 */
public final class DiscoveredExtension {

    private final String id;
    private final ExtensionFactory factory;
    private final PackageMetadata metadata;
    private final Path assetSource;

    public DiscoveredExtension(ExtensionFactory factory, PackageMetadata metadata, Path assetSource) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        String name = factory.name();
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name) && !name.trim().isEmpty(),
                "Extension factory %s declares no id", factory.getClass().getName());
        this.id = name.trim();
        this.assetSource = assetSource;
    }

    public static DiscoveredExtension of(ExtensionFactory factory, PackageMetadata metadata) {
        return new DiscoveredExtension(factory, metadata, null);
    }

    public String getId() {
        return id;
    }

    public ExtensionFactory getFactory() {
        return factory;
    }

    public PackageMetadata getMetadata() {
        return metadata;
    }

    public Optional<Path> getAssetSource() {
        return Optional.ofNullable(assetSource);
    }

    @Override
    public String toString() {
        return id + " (" + metadata + ")";
    }
}
