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
 * Base exception for extension lifecycle operations.
 *
 * <p>All failures reported by the extension runtime to its callers are subclasses
 * of this type. None of them is fatal to the host process; the manager performs
 * no automatic retry, so callers decide whether to try again.
 */
public class ExtensionException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Id of the extension the failure relates to, may be null */
    private final String extensionId;

    public ExtensionException(String message) {
        this(null, message, null);
    }

    public ExtensionException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public ExtensionException(Throwable cause) {
        super(cause);
        this.extensionId = null;
    }

    public ExtensionException(String extensionId, String message, Throwable cause) {
        super(message, cause);
        this.extensionId = extensionId;
    }

    /**
     * Returns the id of the extension involved in the failure.
     *
     * @return extension id, or null when the failure is not tied to one extension
     */
    public String getExtensionId() {
        return extensionId;
    }
}
