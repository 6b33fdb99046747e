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

/**
 * Applies the pending storage schema changes an extension brings, on first install.
 *
 * <p>While it runs, the extension's component is present in the active-component
 * directory so the host's schema tooling can see the extension's models.
 */
@FunctionalInterface
public interface SchemaMigrator {

    /** Migrator for hosts without extension-owned schema */
    SchemaMigrator NOOP = descriptor -> {
    };

    /**
     * Creates and evolves the storage an extension needs.
     *
     * @param descriptor extension being installed
     * @throws MigrationException if the schema cannot be brought up to date
     */
    void applyPendingChanges(ExtensionDescriptor descriptor) throws MigrationException;
}
