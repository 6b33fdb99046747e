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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when the requirements of an extension form a cycle.
 */
public class DependencyCycleException extends EnablingExtensionException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    /**
     * @param extensionId the extension whose enable closed the cycle
     * @param cycle ids along the cycle, first and last element equal
     */
    public DependencyCycleException(String extensionId, List<String> cycle) {
        super(extensionId, "Dependency cycle detected: " + String.join(" -> ", cycle), null);
        this.cycle = Collections.unmodifiableList(new ArrayList<>(cycle));
    }

    public List<String> getCycle() {
        return cycle;
    }
}
