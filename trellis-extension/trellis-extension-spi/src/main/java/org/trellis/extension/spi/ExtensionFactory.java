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

import java.util.Collections;
import java.util.List;

/**
 * Factory for one extension, discovered per package.
 *
 * <p>Packages loaded from plugin directories register their factory via Java ServiceLoader.
 * Configuration file: META-INF/services/org.trellis.extension.spi.ExtensionFactory
 *
 * <p>{@link #name()} is the extension id. It must be stable across releases of the
 * package because registration records are keyed by it.
 */
public interface ExtensionFactory extends PluginFactory {

    /**
     * Constructs a new extension instance. Called once per enable.
     *
     * @param context descriptor, settings and host of the new instance
     * @return the extension instance
     */
    Extension create(ExtensionContext context);

    /**
     * Ids of the extensions this one requires.
     *
     * @return requirement ids, empty by default
     */
    default List<String> requirements() {
        return Collections.emptyList();
    }

    /**
     * Resource / capability markers the extension declares.
     *
     * @return resource markers, empty by default
     */
    default List<String> resources() {
        return Collections.emptyList();
    }

    /**
     * Whether the extension exposes admin configuration routes.
     *
     * @return true if configurable
     */
    default boolean isConfigurable() {
        return false;
    }

    /**
     * Name of the component the host activates for this extension.
     *
     * @return component name, the extension id by default
     */
    default String componentName() {
        return name();
    }
}
