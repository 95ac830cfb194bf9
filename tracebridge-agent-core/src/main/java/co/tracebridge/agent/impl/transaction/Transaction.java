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
import co.tracebridge.agent.impl.TracebridgeTracer;
import co.tracebridge.agent.impl.baggage.DynamicSamplingContext;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * The root span of a trace within this service.
 */
public final class Transaction extends AbstractSpan<Transaction> {

    private volatile String name;
    private volatile TransactionNameSource nameSource;
    /**
     * Backend specific metadata, keyed by context name
     */
    private final Map<String, Map<String, Object>> contexts = new ConcurrentHashMap<>();
    private final boolean sampled;
    @Nullable
    private final Boolean parentSampled;
    @Nullable
    private final DynamicSamplingContext dynamicSamplingContext;
    private final Queue<Span> finishedSpans = new ConcurrentLinkedQueue<>();
    private final boolean noop;

    public Transaction(@Nullable TracebridgeTracer tracer, TransactionContext context, boolean sampled,
                       @Nullable DynamicSamplingContext dynamicSamplingContext, long timestamp) {
        this(tracer, context, sampled, dynamicSamplingContext, timestamp, false);
    }

    private Transaction(@Nullable TracebridgeTracer tracer, TransactionContext context, boolean sampled,
                        @Nullable DynamicSamplingContext dynamicSamplingContext, long timestamp, boolean noop) {
        super(tracer, context.getTraceContext(), context.getOperation(), context.getInstrumenter(), timestamp);
        this.name = context.getName();
        this.nameSource = context.getNameSource();
        this.sampled = sampled;
        this.parentSampled = context.getParentSampled();
        this.dynamicSamplingContext = dynamicSamplingContext;
        this.noop = noop;
        withDescription(context.getDescription());
    }

    /**
     * Creates a transaction which is never reported.
     */
    public static Transaction noop(@Nullable TracebridgeTracer tracer, TransactionContext context) {
        return new Transaction(tracer, context, false, null, SystemClock.currentEpochMicros(), true);
    }

    @Override
    public Transaction getTransaction() {
        return this;
    }

    public String getName() {
        return name;
    }

    public Transaction withName(String name) {
        this.name = name;
        return this;
    }

    public TransactionNameSource getNameSource() {
        return nameSource;
    }

    public Transaction withNameSource(TransactionNameSource nameSource) {
        this.nameSource = nameSource;
        return this;
    }

    public Transaction setContext(String key, Map<String, Object> context) {
        contexts.put(key, context);
        return this;
    }

    @Nullable
    public Map<String, Object> getContext(String key) {
        return contexts.get(key);
    }

    public Map<String, Map<String, Object>> getContexts() {
        return Collections.unmodifiableMap(contexts);
    }

    public boolean isSampled() {
        return sampled;
    }

    @Nullable
    public Boolean getParentSampled() {
        return parentSampled;
    }

    @Nullable
    public DynamicSamplingContext getDynamicSamplingContext() {
        return dynamicSamplingContext;
    }

    public boolean isNoop() {
        return noop;
    }

    void onChildFinished(Span span) {
        if (!noop) {
            finishedSpans.add(span);
        }
    }

    /**
     * @return the finished child spans which are part of the payload of this transaction,
     * excluding filtered spans and requests to the ingestion endpoint
     */
    public List<Span> getSpans() {
        List<Span> spans = new ArrayList<>();
        for (Span span : finishedSpans) {
            if (!span.isIngestionRequest() && !span.isFiltered()) {
                spans.add(span);
            }
        }
        return spans;
    }

    @Override
    protected void doEnd() {
        if (tracer != null) {
            tracer.endTransaction(this);
        }
    }

    @Override
    public String toString() {
        return String.format("'%s' %s", name, traceContext);
    }
}
