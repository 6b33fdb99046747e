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

import org.trellis.extension.spi.PluginFactory;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link PluginDirectoryLoader#scan} pass.
 *
 * <p>{@code loaded} holds the handles created by this pass, {@code retained} the
 * handles of directories that were already loaded and are still present, and
 * {@code vanished} the names of loaded plugins whose directory is gone. Vanished
 * plugins are still loaded; the caller decides when to
 * {@link PluginDirectoryLoader#unload(String) unload} them.
 *
 * @param <F> factory type
 */
public final class LoadReport<F extends PluginFactory> {

    private final List<PluginHandle<F>> loaded;
    private final List<PluginHandle<F>> retained;
    private final List<String> vanished;
    private final List<LoadFailure> failures;
    private final int rootsScanned;
    private final int dirsScanned;

    public LoadReport(List<PluginHandle<F>> loaded, List<PluginHandle<F>> retained, List<String> vanished,
            List<LoadFailure> failures, int rootsScanned, int dirsScanned) {
        this.loaded = ImmutableList.copyOf(Objects.requireNonNull(loaded, "loaded"));
        this.retained = ImmutableList.copyOf(Objects.requireNonNull(retained, "retained"));
        this.vanished = ImmutableList.copyOf(Objects.requireNonNull(vanished, "vanished"));
        this.failures = ImmutableList.copyOf(Objects.requireNonNull(failures, "failures"));
        this.rootsScanned = rootsScanned;
        this.dirsScanned = dirsScanned;
    }

    public List<PluginHandle<F>> getLoaded() {
        return loaded;
    }

    public List<PluginHandle<F>> getRetained() {
        return retained;
    }

    /**
     * Every handle backed by a directory seen in this pass.
     *
     * @return retained handles followed by newly loaded ones
     */
    public List<PluginHandle<F>> getAvailable() {
        return ImmutableList.<PluginHandle<F>>builder().addAll(retained).addAll(loaded).build();
    }

    public List<String> getVanished() {
        return vanished;
    }

    public List<LoadFailure> getFailures() {
        return failures;
    }

    public int getRootsScanned() {
        return rootsScanned;
    }

    public int getDirsScanned() {
        return dirsScanned;
    }

    @Override
    public String toString() {
        return "LoadReport{loaded=" + loaded.size() + ", retained=" + retained.size()
                + ", vanished=" + vanished.size() + ", failures=" + failures.size()
                + ", roots=" + rootsScanned + ", dirs=" + dirsScanned + '}';
    }
}
