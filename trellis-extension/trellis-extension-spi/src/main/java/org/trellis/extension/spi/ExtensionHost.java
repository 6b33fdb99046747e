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

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of the manager that owns an extension instance.
 */
public interface ExtensionHost {

    /**
     * Key of the extension set this host manages.
     *
     * @return manager key
     */
    String getKey();

    /**
     * Returns the live instance of an enabled extension.
     *
     * @param extensionId extension id
     * @return the instance, or empty if not enabled
     */
    Optional<Extension> getEnabledExtension(String extensionId);

    /**
     * Returns every live extension instance.
     *
     * @return enabled extensions
     */
    Collection<Extension> getEnabledExtensions();

    /**
     * Root URL under which admin configuration routes are installed.
     *
     * @return admin URL prefix
     */
    String getAdminUrl();
}
