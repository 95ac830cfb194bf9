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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

public abstract class AbstractSpan<T extends AbstractSpan<T>> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractSpan.class);

    /**
     * {@code null} for spans which have been created by a hub which doesn't record anything
     */
    @Nullable
    protected final TracebridgeTracer tracer;
    protected final TraceContext traceContext;
    private final Instrumenter instrumenter;
    /**
     * Keyword of specific relevance in the service's domain
     * (eg: 'http.server', 'db', 'rpc')
     */
    private volatile String operation;
    @Nullable
    private volatile String description;
    /**
     * Start time of the span or transaction in microseconds since epoch
     */
    private volatile long timestamp;
    /**
     * End time in microseconds since epoch, {@code 0} as long as it has not been set
     */
    private volatile long endTimestamp;
    @Nullable
    private volatile SpanStatus status;
    @Nullable
    private volatile Throwable throwable;
    /**
     * Marks requests to the ingestion endpoint of the tracing backend itself which must never be reported
     */
    private volatile boolean ingestionRequest;
    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private final AtomicBoolean finished = new AtomicBoolean();

    protected AbstractSpan(@Nullable TracebridgeTracer tracer, TraceContext traceContext, String operation,
                           Instrumenter instrumenter, long timestamp) {
        this.tracer = tracer;
        this.traceContext = traceContext;
        this.operation = operation;
        this.instrumenter = instrumenter;
        this.timestamp = timestamp;
    }

    public TraceContext getTraceContext() {
        return traceContext;
    }

    public Instrumenter getInstrumenter() {
        return instrumenter;
    }

    public String getOperation() {
        return operation;
    }

    public T withOperation(String operation) {
        this.operation = operation;
        return thiz();
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public T withDescription(@Nullable String description) {
        this.description = description;
        return thiz();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public T withStartTimestamp(long epochMicros) {
        this.timestamp = epochMicros;
        return thiz();
    }

    public long getEndTimestamp() {
        return endTimestamp;
    }

    public T withEndTimestamp(long epochMicros) {
        this.endTimestamp = epochMicros;
        return thiz();
    }

    /**
     * @return the duration in microseconds, or {@code 0} if the end timestamp has not been set yet
     */
    public long getDuration() {
        long end = endTimestamp;
        return end == 0 ? 0 : end - timestamp;
    }

    @Nullable
    public SpanStatus getStatus() {
        return status;
    }

    public T withStatus(@Nullable SpanStatus status) {
        this.status = status;
        return thiz();
    }

    @Nullable
    public Throwable getThrowable() {
        return throwable;
    }

    public boolean isIngestionRequest() {
        return ingestionRequest;
    }

    public void setIngestionRequest(boolean ingestionRequest) {
        this.ingestionRequest = ingestionRequest;
    }

    /**
     * Adds extra data to this span. {@code null} values remove the key.
     */
    public T setData(String key, @Nullable Object value) {
        if (value == null) {
            data.remove(key);
        } else {
            data.put(key, value);
        }
        return thiz();
    }

    public T setData(Map<String, ?> values) {
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            setData(entry.getKey(), entry.getValue());
        }
        return thiz();
    }

    @Nullable
    public Object getData(String key) {
        return data.get(key);
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public boolean isFinished() {
        return finished.get();
    }

    public boolean isChildOf(AbstractSpan<?> parent) {
        return traceContext.isChildOf(parent.traceContext);
    }

    public abstract Transaction getTransaction();

    public Span startChild(String operation) {
        return startChild(operation, traceContext.createChild(), SystemClock.currentEpochMicros(), null);
    }

    /**
     * Starts a child span with identifiers which have been assigned elsewhere.
     *
     * @param operation        the initial operation of the child
     * @param childContext     the identifiers of the child, its parent id has to be the span id of this span
     * @param startEpochMicros start time of the child
     * @param filter           evaluated when the owning transaction is reported, {@code true} excludes the child
     * @return the started child span
     */
    public Span startChild(String operation, TraceContext childContext, long startEpochMicros, @Nullable BooleanSupplier filter) {
        Span span = new Span(tracer, getTransaction(), childContext, operation, instrumenter, startEpochMicros, filter);
        if (logger.isDebugEnabled()) {
            logger.debug("startSpan {} {", span);
        }
        return span;
    }

    /**
     * Finishes with the status which has already been set on this span, or {@link SpanStatus#OK}.
     */
    public void finish() {
        SpanStatus currentStatus = status;
        finish(currentStatus != null ? currentStatus : SpanStatus.OK);
    }

    public void finish(SpanStatus status) {
        if (finished.compareAndSet(false, true)) {
            this.status = status;
            if (endTimestamp == 0) {
                endTimestamp = SystemClock.currentEpochMicros();
            }
            doEnd();
        } else {
            logger.warn("End has already been called: {}", this);
        }
    }

    /**
     * Captures the exception as an error correlated to this span and finishes with {@link SpanStatus#INTERNAL_ERROR}.
     */
    public void finish(Throwable t) {
        if (isFinished()) {
            logger.warn("End has already been called: {}", this);
            return;
        }
        this.throwable = t;
        if (tracer != null) {
            tracer.captureException(t, this);
        }
        finish(SpanStatus.INTERNAL_ERROR);
    }

    protected abstract void doEnd();

    @SuppressWarnings("unchecked")
    private T thiz() {
        return (T) this;
    }
}
