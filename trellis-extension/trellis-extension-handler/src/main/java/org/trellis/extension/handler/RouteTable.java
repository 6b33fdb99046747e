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

import org.trellis.extension.Route;
import org.trellis.extension.RouteSet;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory, ordered route table.
 *
 * <p>Removal is by route identity: removing one extension's routes never touches an
 * equal-looking route another extension installed.
 */
public class RouteTable implements RouteRegistrar {

    private final List<Route> routes = new ArrayList<>();

    @Override
    public synchronized RouteSet addRoutes(String prefix, RouteSet routeSet) {
        Objects.requireNonNull(prefix, "prefix");
        RouteSet installed = routeSet.withPrefix(prefix);
        routes.addAll(installed.getRoutes());
        return installed;
    }

    @Override
    public synchronized void removeRoutes(RouteSet installed) {
        for (Route route : installed) {
            Iterator<Route> it = routes.iterator();
            while (it.hasNext()) {
                if (it.next() == route) {
                    it.remove();
                    break;
                }
            }
        }
    }

    public synchronized List<Route> getRoutes() {
        return ImmutableList.copyOf(routes);
    }

    /**
     * Finds the route with the longest pattern that prefixes {@code path}.
     *
     * @param path request path
     * @return matching route, if any
     */
    public synchronized Optional<Route> resolve(String path) {
        Route best = null;
        for (Route route : routes) {
            if (path.startsWith(route.getPattern())
                    && (best == null || route.getPattern().length() > best.getPattern().length())) {
                best = route;
            }
        }
        return Optional.ofNullable(best);
    }

    public synchronized int size() {
        return routes.size();
    }
}
