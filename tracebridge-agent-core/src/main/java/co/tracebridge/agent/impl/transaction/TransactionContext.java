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
package co.tracebridge.agent.impl.transaction;

import co.tracebridge.agent.impl.Instrumenter;

import javax.annotation.Nullable;

/**
 * Everything needed to start a {@link Transaction}.
 */
public class TransactionContext {

    private final String name;
    private final String operation;
    private final TraceContext traceContext;
    @Nullable
    private String description;
    private TransactionNameSource nameSource = TransactionNameSource.CUSTOM;
    /**
     * {@code null} means the decision is left to the {@link co.tracebridge.agent.impl.sampling.Sampler}
     */
    @Nullable
    private Boolean sampled;
    @Nullable
    private Boolean parentSampled;
    private Instrumenter instrumenter = Instrumenter.TRACEBRIDGE;

    public TransactionContext(String name, String operation, TraceContext traceContext) {
        this.name = name;
        this.operation = operation;
        this.traceContext = traceContext;
    }

    public TransactionContext(String name, String operation) {
        this(name, operation, TraceContext.newRoot());
    }

    public String getName() {
        return name;
    }

    public String getOperation() {
        return operation;
    }

    public TraceContext getTraceContext() {
        return traceContext;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public TransactionContext withDescription(@Nullable String description) {
        this.description = description;
        return this;
    }

    public TransactionNameSource getNameSource() {
        return nameSource;
    }

    public TransactionContext withNameSource(TransactionNameSource nameSource) {
        this.nameSource = nameSource;
        return this;
    }

    @Nullable
    public Boolean getSampled() {
        return sampled;
    }

    public TransactionContext withSampled(@Nullable Boolean sampled) {
        this.sampled = sampled;
        return this;
    }

    @Nullable
    public Boolean getParentSampled() {
        return parentSampled;
    }

    public TransactionContext withParentSampled(@Nullable Boolean parentSampled) {
        this.parentSampled = parentSampled;
        return this;
    }

    public Instrumenter getInstrumenter() {
        return instrumenter;
    }

    public TransactionContext withInstrumenter(Instrumenter instrumenter) {
        this.instrumenter = instrumenter;
        return this;
    }

    @Override
    public String toString() {
        return String.format("'%s' %s (%s)", name, traceContext, instrumenter);
    }
}
