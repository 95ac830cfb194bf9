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

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The identifiers which correlate a span or an error with its trace.
 */
public final class TraceContext {

    private final Id traceId;
    private final Id spanId;
    @Nullable
    private final Id parentId;

    public TraceContext(Id traceId, Id spanId, @Nullable Id parentId) {
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentId = parentId;
    }

    /**
     * Creates the context of a new trace root with random ids.
     */
    public static TraceContext newRoot() {
        return new TraceContext(Id.new128BitId(), Id.new64BitId(), null);
    }

    public TraceContext createChild() {
        return new TraceContext(traceId, Id.new64BitId(), spanId);
    }

    public Id getTraceId() {
        return traceId;
    }

    public Id getSpanId() {
        return spanId;
    }

    @Nullable
    public Id getParentId() {
        return parentId;
    }

    public boolean isChildOf(TraceContext parent) {
        return parent.traceId.equals(traceId) && parent.spanId.equals(parentId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraceContext that = (TraceContext) o;
        return traceId.equals(that.traceId) && spanId.equals(that.spanId) && Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceId, spanId, parentId);
    }

    @Override
    public String toString() {
        return "00-" + traceId + "-" + spanId + (parentId != null ? " (parent " + parentId + ")" : "");
    }
}
