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

import com.google.inject.Binder;
import io.airlift.configuration.ConfigurationAwareModule;
import io.airlift.configuration.ConfigurationFactory;
import org.stepfunnel.util.ConditionalModule;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Base class of the modules discovered through {@link java.util.ServiceLoader}. Config objects are built
 * from the properties of the {@link ConfigurationFactory} and bound as instances.
 */
public abstract class StepFunnelModule
        implements ConfigurationAwareModule {
    private ConfigurationFactory configurationFactory;
    private Binder binder;

    @Override
    public synchronized void setConfigurationFactory(ConfigurationFactory configurationFactory) {
        this.configurationFactory = checkNotNull(configurationFactory, "configurationFactory is null");
    }

    @Override
    public final synchronized void configure(Binder binder) {
        checkState(this.binder == null, "re-entry not allowed");
        checkState(configurationFactory != null, "configurationFactory is not set for %s", name());
        this.binder = checkNotNull(binder, "binder is null");

        try {
            if (!isEnabled()) {
                return;
            }
            setup(binder);
        } finally {
            this.binder = null;
        }
    }

    /**
     * A module annotated with {@link ConditionalModule} is only enabled when the property matches.
     */
    public synchronized boolean isEnabled() {
        ConditionalModule annotation = getClass().getAnnotation(ConditionalModule.class);
        if (annotation == null) {
            return true;
        }
        String value = Optional.ofNullable(configurationFactory.getProperties().get(annotation.config()))
                .map(String::trim).orElse(null);
        return Objects.equals(annotation.value(), value);
    }

    protected synchronized <T> T buildConfigObject(Class<T> configClass) {
        checkState(binder != null, "config objects can only be built in setup");
        T config = configurationFactory.build(configClass);
        binder.bind(configClass).toInstance(config);
        return config;
    }

    protected synchronized String getConfig(String config) {
        return configurationFactory.getProperties().get(config);
    }

    protected abstract void setup(Binder binder);

    public abstract String name();

    public abstract String description();
}
