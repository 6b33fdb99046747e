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

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract the extension runtime needs from the host's storage layer.
 *
 * <p>Implementations return live records: the manager mutates a record it obtained
 * from the store and hands the same object back to {@link #save(RegistrationRecord)}.
 */
public interface RegistrationStore {

    /**
     * Returns every registration record.
     *
     * @return all records
     */
    List<RegistrationRecord> findAll();

    /**
     * Finds a record by extension id.
     *
     * @param extensionId extension id
     * @return the record, or empty if none exists
     */
    Optional<RegistrationRecord> findById(String extensionId);

    /**
     * Creates and persists a new record with {@code enabled=false}, {@code installed=false}
     * and no settings.
     *
     * @param extensionId extension id
     * @param displayName human readable name
     * @return the new record
     */
    RegistrationRecord create(String extensionId, String displayName);

    /**
     * Persists the current state of a record.
     *
     * @param record record to save
     */
    void save(RegistrationRecord record);
}
