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
 * The entry point to start transactions, to access the current {@link Scope} and to capture errors.
 */
public interface Hub {

    /**
     * @return the configuration, or {@code null} if the agent has not been initialized
     */
    @Nullable
    ConfigurationRegistry getConfigurationRegistry();

    /**
     * Starts a new transaction.
     * <p>
     * If the context carries no sampling decision, the decision is left to the configured sampler.
     * </p>
     *
     * @param context               name, operation and identifiers of the transaction
     * @param customSamplingContext additional data for the sampler
     * @param dynamicSamplingContext the propagated sampling metadata of the trace, if any
     * @return the started transaction, never {@code null} but possibly a {@link Transaction#isNoop() noop} one
     */
    Transaction startTransaction(TransactionContext context, Map<String, Object> customSamplingContext,
                                 @Nullable DynamicSamplingContext dynamicSamplingContext);

    /**
     * Invokes the callback with the current scope of the calling thread.
     */
    void configureScope(Consumer<Scope> callback);

    /**
     * Makes the given, previously saved, scope the current one of the calling thread.
     */
    void restoreScope(Scope scope);

    /**
     * Captures an error event.
     *
     * @param event          the event to capture
     * @param configureScope invoked with a copy of the current scope before it is applied to the event,
     *                       modifications don't affect the current scope
     * @return the id of the captured event, or {@code null} if the event has been dropped
     */
    @Nullable
    Id captureEvent(ErrorEvent event, @Nullable Consumer<Scope> configureScope);
}
