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

/**
 * Directory-driven loading of extension packages.
 *
 * <p>Scans plugin roots, resolves each package's jars, creates one child-first
 * classloader per package with a configurable parent-first prefix list, discovers the
 * package's factory through {@code ServiceLoader}, and reports outcomes through
 * {@link org.trellis.extension.loader.LoadReport},
 * {@link org.trellis.extension.loader.LoadFailure} and
 * {@link org.trellis.extension.loader.PluginHandle}.
 *
 * <p>Rescans keep already loaded packages; unloading closes a package's classloader.
 * Directory watching and remote download are out of scope.
 */
package org.trellis.extension.loader;
