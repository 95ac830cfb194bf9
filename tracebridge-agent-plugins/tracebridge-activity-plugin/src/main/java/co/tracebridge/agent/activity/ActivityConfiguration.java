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
package co.tracebridge.agent.activity;

import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

public class ActivityConfiguration extends ConfigurationOptionProvider {

    public static final String PRUNING_INTERVAL = "activity_pruning_interval";
    public static final String STATUS_PRECEDENCE = "activity_status_precedence";
    private static final String ACTIVITY_CATEGORY = "Activities";

    private final ConfigurationOption<Integer> pruningInterval = ConfigurationOption.integerOption()
        .key(PRUNING_INTERVAL)
        .configurationCategory(ACTIVITY_CATEGORY)
        .description("The minimum time in milliseconds between two sweeps which remove in-flight activities " +
            "that have been dropped by the instrumentation and will never end.")
        .addValidator(new ConfigurationOption.Validator<Integer>() {
            @Override
            public void assertValid(Integer value) {
                if (value != null && value <= 0) {
                    throw new IllegalArgumentException("The pruning interval must be positive but was " + value);
                }
            }
        })
        .dynamic(false)
        .buildWithDefault(5000);

    private final ConfigurationOption<StatusPrecedence> statusPrecedence = ConfigurationOption.enumOption(StatusPrecedence.class)
        .key(STATUS_PRECEDENCE)
        .configurationCategory(ACTIVITY_CATEGORY)
        .description("Whether the status derived from an ended activity (`DERIVED`) or a status which has been set " +
            "by a span customizer (`CUSTOMIZER`) wins when the span is finished.")
        .dynamic(true)
        .buildWithDefault(StatusPrecedence.DERIVED);

    public long getPruningIntervalMillis() {
        return pruningInterval.get();
    }

    public StatusPrecedence getStatusPrecedence() {
        return statusPrecedence.get();
    }
}
