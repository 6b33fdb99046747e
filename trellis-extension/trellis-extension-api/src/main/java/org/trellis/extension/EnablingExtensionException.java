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

/**
 * Raised when enabling an extension is aborted.
 *
 * <p>The cause is usually an {@link InstallExtensionException}. When this is thrown
 * the extension has no live instance and its registration is not marked enabled.
 */
public class EnablingExtensionException extends ExtensionException {

    private static final long serialVersionUID = 1L;

    public EnablingExtensionException(String extensionId, String message, Throwable cause) {
        super(extensionId, message, cause);
    }

    /**
     * Returns true if the enable failed during the install step.
     *
     * @return true if the cause is an {@link InstallExtensionException}
     */
    public boolean isInstallFailure() {
        return getCause() instanceof InstallExtensionException;
    }
}
