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

import org.trellis.extension.spi.Extension;

/**
 * Receives lifecycle notifications from an {@link ExtensionManager}.
 *
 * <p>Notifications are sent after every other side effect of the transition has been
 * applied. An exception thrown by a listener is logged and does not undo the transition.
 */
public interface ExtensionListener {

    /**
     * The extension is live: hooks registered, routes installed, component active.
     *
     * @param extension the new instance
     */
    default void extensionInitialized(Extension extension) {
    }

    /**
     * The extension was shut down and is no longer live.
     *
     * @param extension the instance that was shut down
     */
    default void extensionUninitialized(Extension extension) {
    }
}
