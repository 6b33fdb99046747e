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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contributes a template to a named template hook point of the host's pages.
 *
 * <p>The host's templating layer asks {@link #byName(HookPointRegistry, String)} for the
 * hooks attached to a point and renders {@link #getTemplateName()} for each hook whose
 * {@link #appliesTo(Map)} accepts the render context.
 */
public class TemplateHook extends ExtensionHook {

    private final String name;
    private final String templateName;

    public TemplateHook(Extension extension, String name, String templateName) {
        this(extension, extension.getHookPoints(), name, templateName);
    }

    public TemplateHook(Extension extension, HookPointRegistry registry, String name, String templateName) {
        super(extension, templateHookPoint(registry, name, templateName));
        this.name = name;
        this.templateName = templateName;
    }

    /**
     * Checks the arguments before the super constructor registers the hook, so a rejected
     * hook never becomes visible to {@link #byName(HookPointRegistry, String)}.
     */
    private static HookPoint<TemplateHook> templateHookPoint(HookPointRegistry registry, String name,
            String templateName) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(templateName, "templateName");
        return registry.hookPoint(TemplateHook.class);
    }

    /**
     * Name of the template hook point this hook attaches to.
     *
     * @return hook point name
     */
    public String getName() {
        return name;
    }

    public String getTemplateName() {
        return templateName;
    }

    /**
     * Whether this hook should render for the given context.
     *
     * @param context render context
     * @return true by default
     */
    public boolean appliesTo(Map<String, Object> context) {
        return true;
    }

    /**
     * Returns the active template hooks attached to a named point, in registration order.
     *
     * @param registry hook point registry
     * @param name template hook point name
     * @return matching hooks
     */
    public static List<TemplateHook> byName(HookPointRegistry registry, String name) {
        List<TemplateHook> result = new ArrayList<>();
        for (TemplateHook hook : registry.getHooks(TemplateHook.class)) {
            if (hook.getName().equals(name)) {
                result.add(hook);
            }
        }
        return result;
    }

    public static List<TemplateHook> byName(String name) {
        return byName(HookPointRegistry.getInstance(), name);
    }
}
