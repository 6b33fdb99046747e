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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.nio.file.Path;

/**
 * Why one plugin directory could not be loaded, and at which stage.
 */
public final class LoadFailure {

    public static final String STAGE_SCAN = "scan";
    public static final String STAGE_RESOLVE = "resolve";
    public static final String STAGE_CREATE_CLASSLOADER = "createClassLoader";
    public static final String STAGE_DISCOVER = "discover";
    public static final String STAGE_INSTANTIATE = "instantiate";
    public static final String STAGE_CONFLICT = "conflict";
    /** Package metadata next to the jars could not be read */
    public static final String STAGE_METADATA = "metadata";

    private final Path pluginDir;
    private final String stage;
    private final String message;
    private final Throwable cause;

    public LoadFailure(Path pluginDir, String stage, String message, Throwable cause) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(stage) && !stage.trim().isEmpty(), "stage is blank");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(message) && !message.trim().isEmpty(), "message is blank");
        this.pluginDir = pluginDir;
        this.stage = stage.trim();
        this.message = message.trim();
        this.cause = cause;
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    public String getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "[" + stage + "] " + message;
    }
}
