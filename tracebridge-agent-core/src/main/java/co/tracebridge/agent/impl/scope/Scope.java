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
package co.tracebridge.agent.impl.scope;

import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.transaction.TraceContext;
import co.tracebridge.agent.impl.transaction.Transaction;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The ambient state of a logical call chain: the current transaction, tags and an optional trace override.
 * <p>
 * Each thread works on its own scope (see {@link co.tracebridge.agent.impl.TracebridgeTracer#pushScope()}).
 * Instrumentation may keep a reference to a scope and restore it later on,
 * see {@link co.tracebridge.agent.impl.Hub#restoreScope(Scope)}.
 * </p>
 */
public class Scope {

    @Nullable
    private volatile Transaction transaction;
    @Nullable
    private volatile TraceContext traceContext;
    private final Map<String, String> tags = new ConcurrentHashMap<>();

    @Nullable
    public Transaction getTransaction() {
        return transaction;
    }

    public void setTransaction(@Nullable Transaction transaction) {
        this.transaction = transaction;
    }

    /**
     * Clears the current transaction, but only if it is the given one.
     */
    public synchronized void resetTransaction(Transaction expected) {
        if (transaction == expected) {
            transaction = null;
        }
    }

    /**
     * @return the trace override, if set, otherwise the trace context of the current transaction
     */
    @Nullable
    public TraceContext getTraceContext() {
        TraceContext override = traceContext;
        if (override != null) {
            return override;
        }
        Transaction current = transaction;
        return current != null ? current.getTraceContext() : null;
    }

    public void setTraceContext(@Nullable TraceContext traceContext) {
        this.traceContext = traceContext;
    }

    public void setTag(String key, String value) {
        tags.put(key, value);
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Scope copy() {
        Scope copy = new Scope();
        copy.transaction = transaction;
        copy.traceContext = traceContext;
        copy.tags.putAll(tags);
        return copy;
    }

    public void applyTo(ErrorEvent event) {
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            event.setTag(tag.getKey(), tag.getValue());
        }
        if (event.getTraceContext() == null) {
            event.setTraceContext(getTraceContext());
        }
        Transaction current = transaction;
        if (current != null && event.getTransactionName() == null) {
            event.setTransactionName(current.getName());
        }
    }
}
