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

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered, immutable group of routes installed and removed together.
 */
public final class RouteSet implements Iterable<Route> {

    private static final RouteSet EMPTY = new RouteSet(ImmutableList.of());

    private final List<Route> routes;

    private RouteSet(List<Route> routes) {
        this.routes = routes;
    }

    public static RouteSet empty() {
        return EMPTY;
    }

    public static RouteSet of(Route... routes) {
        return new RouteSet(ImmutableList.copyOf(routes));
    }

    public static RouteSet of(List<Route> routes) {
        return new RouteSet(ImmutableList.copyOf(routes));
    }

    /**
     * Returns a new set where every route pattern starts with {@code prefix}.
     *
     * @param prefix path prefix
     * @return prefixed route set
     */
    public RouteSet withPrefix(String prefix) {
        ImmutableList.Builder<Route> prefixed = ImmutableList.builder();
        for (Route route : routes) {
            prefixed.add(route.withPrefix(prefix));
        }
        return new RouteSet(prefixed.build());
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    public int size() {
        return routes.size();
    }

    @Override
    public Iterator<Route> iterator() {
        return routes.iterator();
    }

    @Override
    public String toString() {
        return "RouteSet" + routes;
    }
}
