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
package co.tracebridge.agent.configuration;

import co.tracebridge.agent.impl.Instrumenter;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import javax.annotation.Nullable;

public class CoreConfiguration extends ConfigurationOptionProvider {

    public static final String ACTIVE = "active";
    public static final String SERVICE_NAME = "service_name";
    public static final String INSTRUMENTER = "instrumenter";
    private static final String CORE_CATEGORY = "Core";

    private final ConfigurationOption<Boolean> active = ConfigurationOption.booleanOption()
        .key(ACTIVE)
        .configurationCategory(CORE_CATEGORY)
        .description("A boolean specifying if the agent should be active or not.\n" +
            "When inactive, all transactions are noop transactions and no errors are captured.\n" +
            "\n" +
            "You can use this setting to dynamically disable tracing at runtime.")
        .dynamic(true)
        .buildWithDefault(true);

    private final ConfigurationOption<String> serviceName = ConfigurationOption.stringOption()
        .key(SERVICE_NAME)
        .configurationCategory(CORE_CATEGORY)
        .label("The name of your service (required)")
        .description("This is used to keep all the errors and transactions of your service together\n" +
            "and is the primary filter in the tracing backend.")
        .buildRequired();

    private final ConfigurationOption<String> environment = ConfigurationOption.stringOption()
        .key("environment")
        .configurationCategory(CORE_CATEGORY)
        .description("The name of the environment this service is deployed in, e.g. \"production\" or \"staging\".")
        .build();

    private final ConfigurationOption<Instrumenter> instrumenter = ConfigurationOption.enumOption(Instrumenter.class)
        .key(INSTRUMENTER)
        .configurationCategory(CORE_CATEGORY)
        .description("The instrumentation family whose transactions are recorded.\n" +
            "Transactions started by any other instrumenter are noop transactions.\n" +
            "\n" +
            "Set to `OPENTELEMETRY` when activities are bridged from an OpenTelemetry SDK.")
        .dynamic(false)
        .buildWithDefault(Instrumenter.OPENTELEMETRY);

    public boolean isActive() {
        return active.get();
    }

    public String getServiceName() {
        return serviceName.get();
    }

    @Nullable
    public String getEnvironment() {
        return environment.get();
    }

    public Instrumenter getInstrumenter() {
        return instrumenter.get();
    }
}
