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

import com.google.common.collect.ImmutableList;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;

/**
 * Per-package classloader: classes come from the package jars first, except for
 * prefixes that must be shared with the host.
 *
 * <p>A parent-first class the host does not have is still looked up in the package
 * jars, so extensions may live in sub-packages of a shared prefix.
 */
public class ChildFirstClassLoader extends URLClassLoader {

    /** Host prefixes always resolved through the parent: JDK, logging, and the extension api/spi */
    public static final List<String> DEFAULT_PARENT_FIRST_PACKAGES = ImmutableList.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "org.slf4j.",
            "org.apache.logging.",
            "org.trellis.extension.");

    private final List<String> parentFirstPackages;

    public ChildFirstClassLoader(URL[] urls, ClassLoader parent, List<String> parentFirstPackages) {
        super(urls, parent);
        this.parentFirstPackages = parentFirstPackages != null
                ? ImmutableList.copyOf(parentFirstPackages)
                : DEFAULT_PARENT_FIRST_PACKAGES;
    }

    public List<String> getParentFirstPackages() {
        return parentFirstPackages;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> loaded = findLoadedClass(name);
            if (loaded == null) {
                loaded = isParentFirst(name) ? loadParentThenChild(name) : loadChildThenParent(name);
            }
            if (resolve) {
                resolveClass(loaded);
            }
            return loaded;
        }
    }

    private Class<?> loadParentThenChild(String name) throws ClassNotFoundException {
        try {
            return super.loadClass(name, false);
        } catch (ClassNotFoundException e) {
            return findClass(name);
        }
    }

    private Class<?> loadChildThenParent(String name) throws ClassNotFoundException {
        try {
            return findClass(name);
        } catch (ClassNotFoundException e) {
            return super.loadClass(name, false);
        }
    }

    boolean isParentFirst(String className) {
        for (String prefix : parentFirstPackages) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
