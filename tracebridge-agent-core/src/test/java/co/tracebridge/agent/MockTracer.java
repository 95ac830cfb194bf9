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
package co.tracebridge.agent;

import co.tracebridge.agent.configuration.SpyConfiguration;
import co.tracebridge.agent.impl.TracebridgeTracer;
import co.tracebridge.agent.impl.TracerBuilder;
import co.tracebridge.agent.report.Reporter;
import org.stagemonitor.configuration.ConfigurationRegistry;

import static org.mockito.Mockito.mock;

public class MockTracer {

    /**
     * Creates a real tracer with a noop reporter and a mock configuration which returns default values which can be customized by mocking
     * the configuration.
     */
    public static TracebridgeTracer createRealTracer() {
        return createRealTracer(mock(Reporter.class));
    }

    /**
     * Creates a real tracer with a given reporter and a mock configuration which returns default values which can be customized by mocking
     * the configuration.
     */
    public static TracebridgeTracer createRealTracer(Reporter reporter) {
        return createRealTracer(reporter, SpyConfiguration.createSpyConfig());
    }

    public static TracebridgeTracer createRealTracer(Reporter reporter, ConfigurationRegistry config) {
        return new TracerBuilder()
            .configurationRegistry(config)
            .reporter(reporter)
            .build();
    }
}
