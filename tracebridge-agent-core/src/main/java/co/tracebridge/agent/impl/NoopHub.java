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

import co.tracebridge.agent.impl.baggage.DynamicSamplingContext;
import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.Transaction;
import co.tracebridge.agent.impl.transaction.TransactionContext;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The hub which is used as long as no agent has been initialized.
 */
public enum NoopHub implements Hub {
    INSTANCE;

    @Nullable
    @Override
    public ConfigurationRegistry getConfigurationRegistry() {
        return null;
    }

    @Override
    public Transaction startTransaction(TransactionContext context, Map<String, Object> customSamplingContext,
                                        @Nullable DynamicSamplingContext dynamicSamplingContext) {
        return Transaction.noop(null, context);
    }

    @Override
    public void configureScope(Consumer<Scope> callback) {
    }

    @Override
    public void restoreScope(Scope scope) {
    }

    @Nullable
    @Override
    public Id captureEvent(ErrorEvent event, @Nullable Consumer<Scope> configureScope) {
        return null;
    }
}
