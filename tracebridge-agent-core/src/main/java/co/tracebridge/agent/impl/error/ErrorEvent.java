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
package co.tracebridge.agent.impl.error;

import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.TraceContext;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An error report, correlated to the trace it occurred in.
 */
public class ErrorEvent {

    private final Id eventId = Id.new128BitId();
    @Nullable
    private final Throwable exception;
    /**
     * Recorded time of the error in microseconds since epoch
     */
    private final long timestamp;
    private final Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    @Nullable
    private TraceContext traceContext;
    @Nullable
    private String transactionName;
    /**
     * Describes how the error has been captured
     */
    @Nullable
    private String mechanism;

    public ErrorEvent(@Nullable Throwable exception, long timestamp) {
        this.exception = exception;
        this.timestamp = timestamp;
    }

    public Id getEventId() {
        return eventId;
    }

    @Nullable
    public Throwable getException() {
        return exception;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public ErrorEvent setContext(String key, Map<String, Object> context) {
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

    public ErrorEvent setTag(String key, String value) {
        tags.put(key, value);
        return this;
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    @Nullable
    public TraceContext getTraceContext() {
        return traceContext;
    }

    public ErrorEvent setTraceContext(@Nullable TraceContext traceContext) {
        this.traceContext = traceContext;
        return this;
    }

    @Nullable
    public String getTransactionName() {
        return transactionName;
    }

    public ErrorEvent setTransactionName(@Nullable String transactionName) {
        this.transactionName = transactionName;
        return this;
    }

    @Nullable
    public String getMechanism() {
        return mechanism;
    }

    public ErrorEvent setMechanism(@Nullable String mechanism) {
        this.mechanism = mechanism;
        return this;
    }

    @Override
    public String toString() {
        return String.format("%s %s (%s)", eventId, exception, traceContext);
    }
}
