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

package org.trellis.extension.spi;

import org.trellis.extension.ExtensionDescriptor;

import java.util.Objects;

/**
 * Everything an extension instance receives at construction time.
 */
public final class ExtensionContext {

    private final ExtensionDescriptor descriptor;
    private final Settings settings;
    private final ExtensionHost host;
    private final HookPointRegistry hookPoints;

    public ExtensionContext(ExtensionDescriptor descriptor, Settings settings, ExtensionHost host,
            HookPointRegistry hookPoints) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.host = Objects.requireNonNull(host, "host");
        this.hookPoints = Objects.requireNonNull(hookPoints, "hookPoints");
    }

    public ExtensionDescriptor getDescriptor() {
        return descriptor;
    }

    public Settings getSettings() {
        return settings;
    }

    public ExtensionHost getHost() {
        return host;
    }

    public HookPointRegistry getHookPoints() {
        return hookPoints;
    }
}
