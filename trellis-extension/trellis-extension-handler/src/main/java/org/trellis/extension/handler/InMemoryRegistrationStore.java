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

import org.trellis.extension.RegistrationRecord;
import org.trellis.extension.RegistrationStore;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registration store kept in memory, for hosts without persistent storage and for tests.
 *
 * <p>Records are live: callers mutate the returned objects and hand them back to
 * {@link #save(RegistrationRecord)}.
 */
public class InMemoryRegistrationStore implements RegistrationStore {

    private final Map<String, RegistrationRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized List<RegistrationRecord> findAll() {
        return ImmutableList.copyOf(records.values());
    }

    @Override
    public synchronized Optional<RegistrationRecord> findById(String extensionId) {
        return Optional.ofNullable(records.get(extensionId));
    }

    @Override
    public synchronized RegistrationRecord create(String extensionId, String displayName) {
        Objects.requireNonNull(extensionId, "extensionId");
        Preconditions.checkState(!records.containsKey(extensionId),
                "Registration for extension %s already exists", extensionId);
        RegistrationRecord record = new RegistrationRecord(extensionId, displayName);
        records.put(extensionId, record);
        return record;
    }

    @Override
    public synchronized void save(RegistrationRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.getId(), record);
    }
}
