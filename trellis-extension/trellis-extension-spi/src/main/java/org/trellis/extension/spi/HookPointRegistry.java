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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of every {@link HookPoint}, one per hook kind.
 *
 * <p>The process-wide instance ({@link #getInstance()}) is created once, on first use,
 * and lives until the host tears it down with {@link #clear()} at shutdown. Hook
 * points are created lazily the first time their kind is requested.
 *
 * <p>Separate instances can be created for isolated hosts and tests.
 */
public final class HookPointRegistry {

    private static final HookPointRegistry INSTANCE = new HookPointRegistry();

    private final ConcurrentMap<Class<?>, HookPoint<?>> hookPoints = new ConcurrentHashMap<>();

    public HookPointRegistry() {
    }

    public static HookPointRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Returns the hook point for a kind, creating it on first request.
     *
     * @param kind hook kind
     * @param <H> hook type
     * @return the hook point
     */
    public <H extends ExtensionHook> HookPoint<H> hookPoint(Class<H> kind) {
        Objects.requireNonNull(kind, "kind");
        return narrow(hookPoints.computeIfAbsent(kind, k -> new HookPoint<>(kind)), kind);
    }

    /**
     * Returns the active hooks of a kind.
     *
     * @param kind hook kind
     * @param <H> hook type
     * @return active hooks in registration order
     */
    public <H extends ExtensionHook> List<H> getHooks(Class<H> kind) {
        return hookPoint(kind).getHooks();
    }

    /** Points are stored under their own kind, so the stored point is a {@code HookPoint<H>} */
    private static <H extends ExtensionHook> HookPoint<H> narrow(HookPoint<?> hookPoint, Class<H> kind) {
        Preconditions.checkState(hookPoint.getKind() == kind, "Hook point %s stored under %s", hookPoint, kind);
        return (HookPoint<H>) hookPoint;
    }

    public List<HookPoint<?>> getHookPoints() {
        return ImmutableList.copyOf(hookPoints.values());
    }

    /**
     * Shuts down every registered hook and forgets every hook point.
     */
    public void clear() {
        for (HookPoint<?> hookPoint : hookPoints.values()) {
            hookPoint.drain();
        }
        hookPoints.clear();
    }
}
