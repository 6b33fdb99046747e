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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Which class name prefixes an extension classloader delegates to the host first.
 *
 * <p>{@link ChildFirstClassLoader#DEFAULT_PARENT_FIRST_PACKAGES} are always included.
 * Hosts add the packages of the hook kinds and services they share with extensions.
 */
public final class ClassLoadingPolicy {

    private final List<String> hostPrefixes;

    public ClassLoadingPolicy(List<String> hostPrefixes) {
        LinkedHashSet<String> cleaned = new LinkedHashSet<>();
        if (hostPrefixes != null) {
            for (String prefix : hostPrefixes) {
                if (!Strings.isNullOrEmpty(prefix) && !prefix.trim().isEmpty()) {
                    cleaned.add(prefix.trim());
                }
            }
        }
        this.hostPrefixes = ImmutableList.copyOf(cleaned);
    }

    public static ClassLoadingPolicy defaultPolicy() {
        return new ClassLoadingPolicy(null);
    }

    public static ClassLoadingPolicy withHostPrefixes(String... prefixes) {
        return new ClassLoadingPolicy(Arrays.asList(prefixes));
    }

    public List<String> getHostPrefixes() {
        return hostPrefixes;
    }

    /**
     * Defaults followed by the host prefixes, without duplicates.
     *
     * @return effective parent-first prefixes
     */
    public List<String> toParentFirstPackages() {
        LinkedHashSet<String> merged = new LinkedHashSet<>(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES);
        merged.addAll(hostPrefixes);
        return ImmutableList.copyOf(merged);
    }
}
