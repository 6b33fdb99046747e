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

import java.nio.file.Path;

/**
 * A plugin directory failed to load at a given {@link LoadFailure} stage.
 */
public class PluginLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path pluginDir;
    private final String stage;

    public PluginLoadException(Path pluginDir, String stage, String message, Throwable cause) {
        super(message, cause);
        this.pluginDir = pluginDir;
        this.stage = stage;
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    public String getStage() {
        return stage;
    }

    public LoadFailure toLoadFailure() {
        return new LoadFailure(pluginDir, stage, getMessage(), getCause());
    }
}
