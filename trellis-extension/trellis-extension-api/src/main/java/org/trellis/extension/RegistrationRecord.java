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

import java.util.Objects;

/**
 * Persisted registration of one extension, keyed by extension id.
 *
 * <p>Schema: {@code id, name, enabled:bool, installed:bool, settings:blob}. The record is
 * owned by a {@link RegistrationStore}; the lifecycle manager mutates it on every state
 * transition and saves it immediately. Records are created lazily on first discovery
 * and never deleted by the runtime.
 *
 * <p>Not thread-safe. Writers are expected to be serialized by the owning manager.
 */
public class RegistrationRecord {

    private final String id;
    private String name;
    private boolean enabled;
    private boolean installed;

    /** Opaque serialized settings mapping */
    private String settings;

    public RegistrationRecord(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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

    public String getSettings() {
        return settings;
    }

    public void setSettings(String settings) {
        this.settings = settings;
    }

    /**
     * Returns a detached copy, used by stores that hand out snapshots.
     *
     * @return copy of this record
     */
    public RegistrationRecord copy() {
        RegistrationRecord copy = new RegistrationRecord(id, name);
        copy.enabled = enabled;
        copy.installed = installed;
        copy.settings = settings;
        return copy;
    }

    @Override
    public String toString() {
        return "RegistrationRecord{"
                + "id='" + id + '\''
                + ", enabled=" + enabled
                + ", installed=" + installed
                + '}';
    }
}
