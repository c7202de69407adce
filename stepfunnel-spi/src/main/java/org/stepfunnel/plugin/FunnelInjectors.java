/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stepfunnel.plugin;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import io.airlift.configuration.ConfigurationFactory;
import io.airlift.log.Logger;

import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static java.lang.String.format;

public final class FunnelInjectors {
    private final static Logger LOGGER = Logger.get(FunnelInjectors.class);

    private FunnelInjectors() {
    }

    /**
     * Creates an injector from the {@link StepFunnelModule}s on the class path and the given modules. The
     * caller provides the warehouse client as a binding of {@link org.stepfunnel.report.QueryExecutor}.
     */
    public static Injector create(Map<String, String> properties, Module... extraModules) {
        ConfigurationFactory configurationFactory = new ConfigurationFactory(properties);

        ImmutableList.Builder<Module> modules = ImmutableList.builder();
        for (StepFunnelModule module : loadModules()) {
            module.setConfigurationFactory(configurationFactory);
            if (module.isEnabled()) {
                LOGGER.info("Installing module %s: %s", module.name(), module.description());
                modules.add(module);
            }
        }
        for (Module module : extraModules) {
            if (module instanceof StepFunnelModule) {
                ((StepFunnelModule) module).setConfigurationFactory(configurationFactory);
            }
            modules.add(module);
        }
        return Guice.createInjector(modules.build());
    }

    public static List<StepFunnelModule> loadModules() {
        ImmutableList.Builder<StepFunnelModule> builder = ImmutableList.builder();
        for (Object module : ServiceLoader.load(StepFunnelModule.class)) {
            if (!(module instanceof StepFunnelModule)) {
                throw new IllegalStateException(format("Modules must be subclasses of %s: %s",
                        StepFunnelModule.class.getName(), module.getClass().getName()));
            }
            builder.add((StepFunnelModule) module);
        }
        return builder.build();
    }
}
