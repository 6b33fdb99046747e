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

import org.trellis.extension.ExtensionDescriptor;
import org.trellis.extension.InstallExtensionException;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Places an extension's static assets and applies its schema changes.
 *
 * <p>The asset tree at {@link ExtensionDescriptor#getStaticAssetPath()} is always
 * replaced as a whole: any previous content is deleted before the package's asset
 * source is copied in. A failed copy leaves no partial tree behind.
 */
public class ExtensionInstaller {
    private static final Logger LOG = LogManager.getLogger(ExtensionInstaller.class);

    private final ComponentDirectory components;
    private final SchemaMigrator schemaMigrator;

    public ExtensionInstaller(ComponentDirectory components, SchemaMigrator schemaMigrator) {
        this.components = Objects.requireNonNull(components, "components");
        this.schemaMigrator = Objects.requireNonNull(schemaMigrator, "schemaMigrator");
    }

    /**
     * First install: places the assets, then runs the schema migrator with the
     * extension's component temporarily active.
     *
     * @param descriptor extension to install
     * @throws InstallExtensionException if the assets cannot be placed or the migration fails;
     *         the asset tree is removed again
     */
    public void install(ExtensionDescriptor descriptor) throws InstallExtensionException {
        placeAssets(descriptor);

        String component = descriptor.getComponentName();
        boolean added = !components.contains(component);
        if (added) {
            components.add(component);
        }
        try {
            schemaMigrator.applyPendingChanges(descriptor);
        } catch (MigrationException | RuntimeException e) {
            removeAssetsQuietly(descriptor);
            throw new InstallExtensionException(descriptor.getId(),
                    "Schema migration failed for extension " + descriptor.getId() + ": " + e.getMessage(), e);
        } finally {
            if (added) {
                components.remove(component);
            }
        }
        LOG.info("Installed extension {} {}", descriptor.getId(), descriptor.getVersion());
    }

    /**
     * Replaces the installed asset tree with the package's asset source. Without an
     * asset source the installed tree is only cleared.
     *
     * @param descriptor extension whose assets to place
     * @throws InstallExtensionException if the tree cannot be replaced
     */
    public void placeAssets(ExtensionDescriptor descriptor) throws InstallExtensionException {
        File target = descriptor.getStaticAssetPath().toFile();
        Optional<Path> source = descriptor.getAssetSource();
        try {
            FileUtils.deleteDirectory(target);
            if (source.isPresent()) {
                if (!Files.isDirectory(source.get())) {
                    throw new IOException("Asset source is not a directory: " + source.get());
                }
                FileUtils.copyDirectory(source.get().toFile(), target);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Copied assets of extension {} from {} to {}", descriptor.getId(), source.get(), target);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            removeAssetsQuietly(descriptor);
            throw new InstallExtensionException(descriptor.getId(),
                    "Failed to install static assets of extension " + descriptor.getId() + " into " + target, e);
        }
    }

    /**
     * Removes the installed asset tree.
     *
     * @param descriptor extension whose assets to remove
     * @return true if nothing is left behind
     */
    public boolean removeAssets(ExtensionDescriptor descriptor) {
        Path target = descriptor.getStaticAssetPath();
        try {
            FileUtils.deleteDirectory(target.toFile());
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to remove static assets of extension {} at {}", descriptor.getId(), target, e);
            return false;
        }
    }

    private void removeAssetsQuietly(ExtensionDescriptor descriptor) {
        FileUtils.deleteQuietly(descriptor.getStaticAssetPath().toFile());
    }
}
