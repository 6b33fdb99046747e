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

package org.trellis.extension;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit tests for {@link PackageMetadata}.
 */
@DisplayName("PackageMetadata Unit Tests")
class PackageMetadataTest {

    @Test
    @DisplayName("UT-API-PM-001: Build metadata with all well-known fields")
    void testBuilder_AllFields() {
        // When
        PackageMetadata metadata = PackageMetadata.builder()
                .name("audit-trail")
                .version("1.2.0")
                .summary("Records admin actions")
                .description("Longer text")
                .author("Ops Team")
                .authorEmail("ops@example.com")
                .license("Apache-2.0")
                .homePage("https://example.com/audit-trail")
                .build();

        // Then
        Assertions.assertEquals("audit-trail", metadata.getName());
        Assertions.assertEquals("1.2.0", metadata.getVersion());
        Assertions.assertEquals("Records admin actions", metadata.getSummary().get());
        Assertions.assertEquals("Longer text", metadata.getDescription().get());
        Assertions.assertEquals("Ops Team", metadata.getAuthor().get());
        Assertions.assertEquals("ops@example.com", metadata.getAuthorEmail().get());
        Assertions.assertEquals("Apache-2.0", metadata.getLicense().get());
        Assertions.assertEquals("https://example.com/audit-trail", metadata.getHomePage().get());
    }

    @Test
    @DisplayName("UT-API-PM-002: UNKNOWN and blank values are dropped")
    void testFromMap_DropsUnknown() {
        // Given
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("name", " audit-trail ");
        raw.put("version", "2.0");
        raw.put("author", PackageMetadata.UNKNOWN);
        raw.put("license", "");
        raw.put("summary", null);
        raw.put("keywords", "audit");

        // When
        PackageMetadata metadata = PackageMetadata.fromMap(raw);

        // Then
        Assertions.assertEquals("audit-trail", metadata.getName());
        Assertions.assertFalse(metadata.getAuthor().isPresent());
        Assertions.assertFalse(metadata.getLicense().isPresent());
        Assertions.assertFalse(metadata.getSummary().isPresent());
        Assertions.assertEquals("audit", metadata.get("keywords").get());
        Assertions.assertEquals(3, metadata.getMetadata().size());
    }

    @Test
    @DisplayName("UT-API-PM-003: Missing version defaults to 0")
    void testVersionDefault() {
        // When
        PackageMetadata metadata = PackageMetadata.builder().name("audit-trail").build();

        // Then
        Assertions.assertEquals("0", metadata.getVersion());
    }

    @Test
    @DisplayName("UT-API-PM-004: Name is required")
    void testNameRequired() {
        // Given
        Map<String, String> raw = new HashMap<>();
        raw.put("name", PackageMetadata.UNKNOWN);
        raw.put("version", "1.0");

        // When & Then
        Assertions.assertThrows(NullPointerException.class, () -> PackageMetadata.fromMap(raw));
    }

    @Test
    @DisplayName("UT-API-PM-005: Metadata with same values are equal")
    void testEquality() {
        // When
        PackageMetadata first = PackageMetadata.of("audit-trail", "1.0");
        PackageMetadata second = PackageMetadata.of("audit-trail", "1.0");
        PackageMetadata third = PackageMetadata.of("audit-trail", "1.1");

        // Then
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(first.hashCode(), second.hashCode());
        Assertions.assertNotEquals(first, third);
        Assertions.assertEquals("audit-trail 1.0", first.toString());
    }
}
