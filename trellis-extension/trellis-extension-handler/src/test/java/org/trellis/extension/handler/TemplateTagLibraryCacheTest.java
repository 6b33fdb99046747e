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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

@DisplayName("TemplateTagLibraryCache Unit Tests")
class TemplateTagLibraryCacheTest {

    @Test
    @DisplayName("UT-HANDLER-TC-001: Libraries follow the active components")
    void testLibrariesFollowComponents() {
        // Given
        ActiveComponentList components = new ActiveComponentList(Collections.singletonList("trellis.core"));
        TemplateTagLibraryCache cache = new TemplateTagLibraryCache(components);

        // When
        components.add("audit");

        // Then
        Assertions.assertEquals(Arrays.asList("trellis.core.templatetags", "audit.templatetags"),
                cache.getLibraries());
    }

    @Test
    @DisplayName("UT-HANDLER-TC-002: Resolution is cached until invalidated")
    void testInvalidate() {
        // Given
        AtomicInteger resolutions = new AtomicInteger();
        ActiveComponentList components = new ActiveComponentList(Collections.singletonList("audit"));
        TemplateTagLibraryCache cache = new TemplateTagLibraryCache(components, component -> {
            resolutions.incrementAndGet();
            return Collections.singletonList(component + "_tags");
        });
        cache.getLibraries();
        cache.getLibraries();
        Assertions.assertEquals(1, resolutions.get());

        // When
        cache.invalidate();

        // Then
        Assertions.assertEquals(0, cache.getCachedComponentCount());
        Assertions.assertEquals(Collections.singletonList("audit_tags"), cache.getLibraries());
        Assertions.assertEquals(2, resolutions.get());
        Assertions.assertEquals(1, cache.getInvalidationCount());
    }
}
