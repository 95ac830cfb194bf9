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
 * Samples either all or no transactions without a propagated sampling decision.
 */
public enum ConstantSampler implements Sampler {
    ALWAYS(true),
    NEVER(false);

    private final boolean sampled;

    ConstantSampler(boolean sampled) {
        this.sampled = sampled;
    }

    public static Sampler of(boolean sampled) {
        return sampled ? ALWAYS : NEVER;
    }

    @Override
    public boolean isSampled(TransactionContext context, Map<String, Object> customSamplingContext) {
        return sampled;
    }
}
