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
package co.tracebridge.agent.impl.sampling;

import co.tracebridge.agent.impl.transaction.TransactionContext;

import java.util.Map;

/**
 * A sampler is responsible for determining whether a {@link co.tracebridge.agent.impl.transaction.Transaction} should be sampled.
 * <p>
 * It is only consulted for transactions without a sampling decision,
 * decisions which have been propagated by a remote parent are always honored.
 * Unsampled transactions are not reported.
 * </p>
 */
public interface Sampler {

    /**
     * Determines whether the given transaction should be sampled.
     *
     * @param context               the context the transaction is about to be started with
     * @param customSamplingContext additional data provided by the instrumentation which starts the transaction
     * @return The sampling decision.
     */
    boolean isSampled(TransactionContext context, Map<String, Object> customSamplingContext);
}
