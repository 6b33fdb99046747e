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

import com.google.common.base.Strings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Package-level metadata of an extension: what the distribution says about itself.
 *
 * <p>Well-known keys:
 * <pre>{@code
 * {
 *   "name": "audit-trail",
 *   "version": "1.2.0",
 *   "summary": "Records review changes",
 *   "description": "...",
 *   "author": "Jane Doe",
 *   "author_email": "jane@example.com",
 *   "license": "Apache-2.0",
 *   "home_page": "https://example.com/audit-trail"
 * }
 * }</pre>
 *
 * <p>Any other key is kept in {@link #getMetadata()}. Values equal to {@value #UNKNOWN}
 * are treated as absent.
 */
public final class PackageMetadata {

    public static final String UNKNOWN = "UNKNOWN";

    public static final String KEY_NAME = "name";
    public static final String KEY_VERSION = "version";
    public static final String KEY_SUMMARY = "summary";
    public static final String KEY_DESCRIPTION = "description";
    public static final String KEY_AUTHOR = "author";
    public static final String KEY_AUTHOR_EMAIL = "author_email";
    public static final String KEY_LICENSE = "license";
    public static final String KEY_HOME_PAGE = "home_page";

    private final Map<String, String> metadata;

    private PackageMetadata(Map<String, String> metadata) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        Objects.requireNonNull(this.metadata.get(KEY_NAME), "name is required");
    }

    /**
     * Builds metadata from raw key/value pairs, dropping blank and {@value #UNKNOWN} values.
     *
     * @param raw raw metadata
     * @return package metadata
     * @throws NullPointerException if no usable name is present
     */
    public static PackageMetadata fromMap(Map<String, String> raw) {
        Objects.requireNonNull(raw, "raw");
        Map<String, String> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String value = entry.getValue();
            if (entry.getKey() == null || Strings.isNullOrEmpty(value) || UNKNOWN.equals(value)) {
                continue;
            }
            cleaned.put(entry.getKey().trim(), value.trim());
        }
        return new PackageMetadata(cleaned);
    }

    public static PackageMetadata of(String name, String version) {
        return builder().name(name).version(version).build();
    }

    public String getName() {
        return metadata.get(KEY_NAME);
    }

    public String getVersion() {
        return metadata.getOrDefault(KEY_VERSION, "0");
    }

    public Optional<String> getSummary() {
        return get(KEY_SUMMARY);
    }

    public Optional<String> getDescription() {
        return get(KEY_DESCRIPTION);
    }

    public Optional<String> getAuthor() {
        return get(KEY_AUTHOR);
    }

    public Optional<String> getAuthorEmail() {
        return get(KEY_AUTHOR_EMAIL);
    }

    public Optional<String> getLicense() {
        return get(KEY_LICENSE);
    }

    public Optional<String> getHomePage() {
        return get(KEY_HOME_PAGE);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /**
     * Returns the full metadata mapping, well-known keys included.
     *
     * @return immutable map
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return metadata.equals(((PackageMetadata) o).metadata);
    }

    @Override
    public int hashCode() {
        return metadata.hashCode();
    }

    @Override
    public String toString() {
        return getName() + " " + getVersion();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link PackageMetadata}.
     */
    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            return put(KEY_NAME, name);
        }

        public Builder version(String version) {
            return put(KEY_VERSION, version);
        }

        public Builder summary(String summary) {
            return put(KEY_SUMMARY, summary);
        }

        public Builder description(String description) {
            return put(KEY_DESCRIPTION, description);
        }

        public Builder author(String author) {
            return put(KEY_AUTHOR, author);
        }

        public Builder authorEmail(String authorEmail) {
            return put(KEY_AUTHOR_EMAIL, authorEmail);
        }

        public Builder license(String license) {
            return put(KEY_LICENSE, license);
        }

        public Builder homePage(String homePage) {
            return put(KEY_HOME_PAGE, homePage);
        }

        public Builder put(String key, String value) {
            values.put(key, value);
            return this;
        }

        public PackageMetadata build() {
            return fromMap(values);
        }
    }
}
