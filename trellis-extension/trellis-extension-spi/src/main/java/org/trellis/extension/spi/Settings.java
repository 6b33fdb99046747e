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

package org.trellis.extension.spi;

import org.trellis.extension.RegistrationRecord;
import org.trellis.extension.RegistrationStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings data for an extension: a key/value view over the settings blob of its
 * {@link RegistrationRecord}.
 *
 * <p>Writes stay in memory until {@link #save()} is called. {@code save()} replaces the
 * whole stored mapping; two writers saving concurrently overwrite each other, last one
 * wins.
 *
 * <p>The blob is a JSON object. A blob that cannot be parsed is discarded on
 * {@link #load()} and the settings start out empty.
 */
public class Settings {
    private static final Logger LOG = LogManager.getLogger(Settings.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    private final RegistrationRecord registration;
    private final RegistrationStore store;
    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Creates the settings view and loads the stored values.
     *
     * @param registration registration record holding the blob
     * @param store store used to persist the record
     */
    public Settings(RegistrationRecord registration, RegistrationStore store) {
        this.registration = Objects.requireNonNull(registration, "registration");
        this.store = Objects.requireNonNull(store, "store");
        load();
    }

    /**
     * Replaces the in-memory values with the stored ones.
     */
    public synchronized void load() {
        values.clear();
        String blob = registration.getSettings();
        if (Strings.isNullOrEmpty(blob) || blob.trim().isEmpty()) {
            return;
        }
        try {
            Map<String, Object> stored = MAPPER.readValue(blob, MAP_TYPE);
            if (stored != null) {
                values.putAll(stored);
            }
        } catch (JsonProcessingException e) {
            // Only hand-edited records end up here; start from empty settings.
            LOG.warn("Discarding unreadable settings of extension {}: {}", registration.getId(), e.getOriginalMessage());
        }
    }

    /**
     * Writes every current value into the registration record and persists it.
     *
     * @throws IllegalStateException if a value cannot be serialized
     */
    public synchronized void save() {
        String blob;
        try {
            blob = MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize settings of extension " + registration.getId(), e);
        }
        registration.setSettings(blob);
        store.save(registration);
    }

    public synchronized Object get(String key) {
        return values.get(key);
    }

    public synchronized String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public synchronized boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    public synchronized int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public synchronized long getLong(String key, long defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Sets a value. Values must be JSON-serializable: strings, numbers, booleans,
     * lists and maps of those.
     *
     * <p>After a reload, numbers come back in the narrowest JSON type that holds them:
     * {@code Integer} for whole numbers that fit, then {@code Long}, {@code Double} for
     * fractions. A stored {@code 5L} reads back as {@code Integer 5}; read numbers through
     * {@link #getInt(String, int)} or {@link #getLong(String, long)} rather than comparing
     * the boxed values.
     *
     * @param key setting key
     * @param value setting value
     * @return previous value, or null
     */
    public synchronized Object set(String key, Object value) {
        return values.put(Objects.requireNonNull(key, "key"), value);
    }

    public synchronized Object remove(String key) {
        return values.remove(key);
    }

    public synchronized boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public synchronized Set<String> keySet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
    }

    public synchronized int size() {
        return values.size();
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    public synchronized void clear() {
        values.clear();
    }

    /**
     * Returns a read-only snapshot of the current values.
     *
     * @return snapshot, null values omitted
     */
    public synchronized Map<String, Object> asMap() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getValue() != null) {
                snapshot.put(entry.getKey(), entry.getValue());
            }
        }
        return ImmutableMap.copyOf(snapshot);
    }

    @Override
    public synchronized String toString() {
        return "Settings{extension=" + registration.getId() + ", keys=" + values.keySet() + '}';
    }
}
