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

import org.trellis.extension.RouteSet;

/**
 * Bridge to the host's URL router.
 */
public interface RouteRegistrar {

    /**
     * Installs a route set under a path prefix.
     *
     * @param prefix path prefix, for example {@code /admin/extensions/audit/config/}
     * @param routes routes relative to the prefix
     * @return the routes as installed; pass exactly this set to {@link #removeRoutes(RouteSet)}
     */
    RouteSet addRoutes(String prefix, RouteSet routes);

    /**
     * Removes exactly the given installed routes and nothing else.
     *
     * @param installed set returned by {@link #addRoutes(String, RouteSet)}
     */
    void removeRoutes(RouteSet installed);
}
