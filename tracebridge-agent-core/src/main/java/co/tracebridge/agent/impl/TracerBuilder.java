/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.impl;

import co.tracebridge.agent.configuration.CoreConfiguration;
import co.tracebridge.agent.configuration.PrefixingConfigurationSourceWrapper;
import co.tracebridge.agent.configuration.source.PropertyFileConfigurationSource;
import co.tracebridge.agent.impl.sampling.ConstantSampler;
import co.tracebridge.agent.impl.sampling.Sampler;
import co.tracebridge.agent.logging.LoggingConfiguration;
import co.tracebridge.agent.report.LoggingReporter;
import co.tracebridge.agent.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.AbstractConfigurationSource;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

public class TracerBuilder {

    static final String SYSTEM_PROPERTY_PREFIX = "tracebridge.";
    static final String ENVIRONMENT_VARIABLE_PREFIX = "TRACEBRIDGE_";
    static final String PROPERTIES_FILE = "tracebridge.properties";

    private final Logger logger;
    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private Reporter reporter;
    @Nullable
    private Sampler sampler;
    private final Map<String, String> inlineConfig = new HashMap<>();

    public TracerBuilder() {
        final List<ConfigurationSource> configSources = getConfigSources();
        // the ConfigurationRegistry uses and thereby initializes a logger,
        // so we can't use it here
        LoggingConfiguration.init(configSources);
        logger = LoggerFactory.getLogger(getClass());
    }

    public TracerBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    public TracerBuilder reporter(Reporter reporter) {
        this.reporter = reporter;
        return this;
    }

    public TracerBuilder sampler(Sampler sampler) {
        this.sampler = sampler;
        return this;
    }

    public TracerBuilder withConfig(String key, String value) {
        inlineConfig.put(key, value);
        return this;
    }

    public TracebridgeTracer build() {
        if (configurationRegistry == null) {
            configurationRegistry = getDefaultConfigurationRegistry(getConfigSources());
        }
        if (reporter == null) {
            reporter = new LoggingReporter();
        }
        if (sampler == null) {
            sampler = ConstantSampler.of(true);
        }
        CoreConfiguration coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
        if (coreConfiguration != null) {
            logger.info("Starting tracer for service {} in environment {}", coreConfiguration.getServiceName(), coreConfiguration.getEnvironment());
        }
        return new TracebridgeTracer(configurationRegistry, reporter, sampler);
    }

    private ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        try {
            return ConfigurationRegistry.builder()
                .configSources(configSources)
                .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, TracebridgeTracer.class.getClassLoader()))
                .failOnMissingRequiredValues(true)
                .build();
        } catch (IllegalStateException e) {
            logger.warn(e.getMessage());
            return ConfigurationRegistry.builder()
                .addConfigSource(new SimpleSource("Noop Configuration")
                    .add(CoreConfiguration.ACTIVE, "false")
                    .add(CoreConfiguration.SERVICE_NAME, "none"))
                .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, TracebridgeTracer.class.getClassLoader()))
                .build();
        }
    }

    private List<ConfigurationSource> getConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(new PrefixingConfigurationSourceWrapper(new SystemPropertyConfigurationSource(), SYSTEM_PROPERTY_PREFIX));
        result.add(new PrefixingConfigurationSourceWrapper(new EnvironmentVariableConfigurationSource(), ENVIRONMENT_VARIABLE_PREFIX));
        result.add(new AbstractConfigurationSource() {
            @Override
            public String getValue(String key) {
                return inlineConfig.get(key);
            }

            @Override
            public String getName() {
                return "Inline configuration";
            }
        });
        if (PropertyFileConfigurationSource.isPresent(PROPERTIES_FILE)) {
            result.add(new PropertyFileConfigurationSource(PROPERTIES_FILE));
        }
        return result;
    }
}
