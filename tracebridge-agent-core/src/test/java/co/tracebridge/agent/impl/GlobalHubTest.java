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

import co.tracebridge.agent.MockReporter;
import co.tracebridge.agent.MockTracer;
import co.tracebridge.agent.impl.transaction.Transaction;
import co.tracebridge.agent.impl.transaction.TransactionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalHubTest {

    @AfterEach
    void tearDown() {
        GlobalHub.reset();
    }

    @Test
    void testNoopUntilInitialized() {
        assertThat(GlobalHub.isNoop()).isTrue();
        assertThat(GlobalHub.get()).isSameAs(NoopHub.INSTANCE);
        assertThat(HubAdapter.INSTANCE.getConfigurationRegistry()).isNull();
        Transaction transaction = HubAdapter.INSTANCE.startTransaction(new TransactionContext("noop", "test"),
            Collections.<String, Object>emptyMap(), null);
        assertThat(transaction.isNoop()).isTrue();
    }

    @Test
    void testAdapterForwardsToRegisteredHub() {
        TracebridgeTracer tracer = MockTracer.createRealTracer(new MockReporter());
        GlobalHub.init(tracer);

        assertThat(GlobalHub.getTracerImpl()).isSameAs(tracer);
        assertThat(HubAdapter.INSTANCE.getConfigurationRegistry()).isSameAs(tracer.getConfigurationRegistry());
        assertThatThrownBy(() -> GlobalHub.init(tracer)).isInstanceOf(IllegalStateException.class);
    }
}
