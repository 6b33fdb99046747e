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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Caches the template tag libraries each active component provides.
 *
 * <p>Libraries are resolved per component on first lookup and kept until
 * {@link #invalidate()}, which the extension manager calls whenever the set of active
 * components changes.
 */
public class TemplateTagLibraryCache implements TemplateTagCache {
    private static final Logger LOG = LogManager.getLogger(TemplateTagLibraryCache.class);

    /** Conventional tag library module of a component */
    public static final String LIBRARY_SUFFIX = ".templatetags";

    private static final long MAX_COMPONENTS = 10_000L;

    private final ComponentDirectory components;
    private final LoadingCache<String, List<String>> librariesByComponent;
    private final AtomicLong invalidations = new AtomicLong();

    public TemplateTagLibraryCache(ComponentDirectory components) {
        this(components, component -> Collections.singletonList(component + LIBRARY_SUFFIX));
    }

    /**
     * @param components active component directory
     * @param libraryResolver resolves the tag libraries of one component
     */
    public TemplateTagLibraryCache(ComponentDirectory components, Function<String, List<String>> libraryResolver) {
        this.components = Objects.requireNonNull(components, "components");
        Objects.requireNonNull(libraryResolver, "libraryResolver");
        this.librariesByComponent = Caffeine.newBuilder()
                .maximumSize(MAX_COMPONENTS)
                .build(component -> ImmutableList.copyOf(libraryResolver.apply(component)));
    }

    /**
     * Returns the tag libraries of every active component, in component order.
     *
     * @return library names
     */
    public List<String> getLibraries() {
        ImmutableList.Builder<String> libraries = ImmutableList.builder();
        for (String component : components.list()) {
            List<String> resolved = librariesByComponent.get(component);
            if (resolved != null) {
                libraries.addAll(resolved);
            }
        }
        return libraries.build();
    }

    @Override
    public void invalidate() {
        librariesByComponent.invalidateAll();
        long count = invalidations.incrementAndGet();
        if (LOG.isDebugEnabled()) {
            LOG.debug("invalidate template tag library cache, invalidations={}", count);
        }
    }

    public long getInvalidationCount() {
        return invalidations.get();
    }

    long getCachedComponentCount() {
        librariesByComponent.cleanUp();
        return librariesByComponent.estimatedSize();
    }
}
