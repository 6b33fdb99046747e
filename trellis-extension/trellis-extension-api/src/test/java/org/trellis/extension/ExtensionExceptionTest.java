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

import java.io.IOException;
import java.util.Arrays;

/**
 * Unit tests for the extension exception hierarchy.
 */
@DisplayName("ExtensionException Unit Tests")
class ExtensionExceptionTest {

    @Test
    @DisplayName("UT-API-EE-001: Create exception with message")
    void testCreateException_WithMessage() {
        // When
        ExtensionException exception = new ExtensionException("Extension failed");

        // Then
        Assertions.assertEquals("Extension failed", exception.getMessage());
        Assertions.assertNull(exception.getCause());
        Assertions.assertNull(exception.getExtensionId());
    }

    @Test
    @DisplayName("UT-API-EE-002: Create exception with extension id and cause")
    void testCreateException_WithIdAndCause() {
        // Given
        Throwable cause = new IOException("disk full");

        // When
        ExtensionException exception = new ExtensionException("audit", "copy failed", cause);

        // Then
        Assertions.assertEquals("audit", exception.getExtensionId());
        Assertions.assertEquals("copy failed", exception.getMessage());
        Assertions.assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("UT-API-EE-003: Unknown extension names the id")
    void testUnknownExtension() {
        // When
        UnknownExtensionException exception = new UnknownExtensionException("missing");

        // Then
        Assertions.assertInstanceOf(ExtensionException.class, exception);
        Assertions.assertEquals("missing", exception.getExtensionId());
        Assertions.assertEquals("Unknown extension: missing", exception.getMessage());
    }

    @Test
    @DisplayName("UT-API-EE-004: Enabling failure caused by install reports install kind")
    void testEnablingFailure_InstallKind() {
        // Given
        InstallExtensionException install = new InstallExtensionException("audit", "migration failed", null);

        // When
        EnablingExtensionException wrapped = new EnablingExtensionException("audit", "enable aborted", install);
        EnablingExtensionException other = new EnablingExtensionException("audit", "enable aborted",
                new IllegalStateException("boom"));

        // Then
        Assertions.assertTrue(wrapped.isInstallFailure());
        Assertions.assertFalse(other.isInstallFailure());
    }

    @Test
    @DisplayName("UT-API-EE-005: Dependency cycle lists the cycle path")
    void testDependencyCycle() {
        // When
        DependencyCycleException exception = new DependencyCycleException("a", Arrays.asList("a", "b", "a"));

        // Then
        Assertions.assertInstanceOf(EnablingExtensionException.class, exception);
        Assertions.assertEquals("Dependency cycle detected: a -> b -> a", exception.getMessage());
        Assertions.assertEquals(Arrays.asList("a", "b", "a"), exception.getCycle());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> exception.getCycle().add("c"));
    }

    @Test
    @DisplayName("UT-API-EE-006: Configuration exception is unchecked")
    void testConfigurationException() {
        // When
        ExtensionConfigurationException exception = new ExtensionConfigurationException("static root missing");

        // Then
        Assertions.assertInstanceOf(RuntimeException.class, exception);
        Assertions.assertEquals("static root missing", exception.getMessage());
    }
}
