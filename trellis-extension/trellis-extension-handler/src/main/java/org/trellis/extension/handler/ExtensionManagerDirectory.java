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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Process-wide list of every {@link ExtensionManager}, in creation order.
 *
 * <p>Managers register themselves when constructed. Entries are never removed except
 * by {@link #clear()} at host shutdown.
 */
public final class ExtensionManagerDirectory {

    private static final ExtensionManagerDirectory INSTANCE = new ExtensionManagerDirectory();

    private final List<ExtensionManager> managers = new ArrayList<>();

    public ExtensionManagerDirectory() {
    }

    public static ExtensionManagerDirectory getInstance() {
        return INSTANCE;
    }

    synchronized void register(ExtensionManager manager) {
        managers.add(Objects.requireNonNull(manager, "manager"));
    }

    public synchronized List<ExtensionManager> getManagers() {
        return ImmutableList.copyOf(managers);
    }

    public synchronized void clear() {
        managers.clear();
    }
}
