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
import java.util.function.BooleanSupplier;

public final class Span extends AbstractSpan<Span> {
    private static final Logger logger = LoggerFactory.getLogger(Span.class);

    private final Transaction transaction;
    @Nullable
    private final BooleanSupplier filter;

    Span(@Nullable TracebridgeTracer tracer, Transaction transaction, TraceContext traceContext, String operation,
         Instrumenter instrumenter, long timestamp, @Nullable BooleanSupplier filter) {
        super(tracer, traceContext, operation, instrumenter, timestamp);
        this.transaction = transaction;
        this.filter = filter;
    }

    @Override
    public Transaction getTransaction() {
        return transaction;
    }

    /**
     * Evaluates the filter predicate, spans which are filtered are not reported with their transaction.
     */
    public boolean isFiltered() {
        return filter != null && filter.getAsBoolean();
    }

    @Override
    protected void doEnd() {
        if (logger.isDebugEnabled()) {
            logger.debug("} endSpan {}", this);
        }
        transaction.onChildFinished(this);
    }

    @Override
    public String toString() {
        return String.format("'%s' %s", getOperation(), traceContext);
    }
}
