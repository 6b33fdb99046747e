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

import java.util.Objects;

/**
 * One URL route: a path pattern and the opaque target the host's router dispatches to.
 *
 * <p>Routes compare by identity so that removing a route set removes exactly the
 * routes that were added, even when another extension registered an equal pattern.
 */
public final class Route {

    private final String pattern;
    private final Object target;

    public Route(String pattern, Object target) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String getPattern() {
        return pattern;
    }

    public Object getTarget() {
        return target;
    }

    /**
     * Returns a new route with {@code prefix} prepended to the pattern.
     *
     * @param prefix path prefix
     * @return prefixed route
     */
    public Route withPrefix(String prefix) {
        return new Route(prefix + pattern, target);
    }

    @Override
    public String toString() {
        return pattern + " -> " + target;
    }
}
