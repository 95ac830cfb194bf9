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
package co.tracebridge.agent.activity;

import co.tracebridge.agent.impl.baggage.Baggage;
import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.SystemClock;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A thread-safe {@link Activity} for instrumentation which is written by hand.
 * <pre>
 * SimpleActivity activity = SimpleActivity.builder("my-library", "GET /users")
 *     .kind(ActivityKind.SERVER)
 *     .attribute("http.method", "GET")
 *     .build();
 * processor.onStart(activity);
 * ...
 * activity.stop();
 * processor.onEnd(activity);
 * </pre>
 */
public class SimpleActivity implements Activity {

    private final Id spanId;
    private final Id traceId;
    @Nullable
    private final Id parentSpanId;
    @Nullable
    private final Activity parent;
    private final boolean remoteParent;
    private final String operationName;
    private final ActivityKind kind;
    private final long startEpochMicros;
    private final Baggage baggage;
    private final Map<String, Object> attributes;
    private final List<ActivityEvent> events = new CopyOnWriteArrayList<>();
    private final Map<String, Object> customProperties = new ConcurrentHashMap<>();
    private volatile String displayName;
    private volatile long durationMicros;
    private volatile ActivityStatusCode status = ActivityStatusCode.UNSET;
    private volatile boolean recorded;
    private volatile boolean allDataRequested;

    private SimpleActivity(Builder builder) {
        this.parent = builder.parent;
        if (builder.parent != null) {
            this.traceId = builder.parent.getTraceId();
            this.parentSpanId = builder.parent.getSpanId();
        } else {
            this.traceId = builder.traceId != null ? builder.traceId : Id.new128BitId();
            this.parentSpanId = builder.parentSpanId;
        }
        this.spanId = builder.spanId != null ? builder.spanId : Id.new64BitId();
        this.remoteParent = builder.parent == null && builder.parentSpanId != null;
        this.operationName = builder.operationName;
        this.displayName = builder.displayName;
        this.kind = builder.kind;
        this.startEpochMicros = builder.startEpochMicros != 0 ? builder.startEpochMicros : SystemClock.currentEpochMicros();
        this.baggage = builder.baggage;
        this.attributes = Collections.synchronizedMap(new LinkedHashMap<>(builder.attributes));
        this.recorded = builder.recorded;
        this.allDataRequested = builder.allDataRequested;
    }

    public static Builder builder(String operationName, String displayName) {
        return new Builder(operationName, displayName);
    }

    @Override
    public Id getSpanId() {
        return spanId;
    }

    @Nullable
    @Override
    public Id getParentSpanId() {
        return parentSpanId;
    }

    @Override
    public Id getTraceId() {
        return traceId;
    }

    @Nullable
    @Override
    public Activity getParent() {
        return parent;
    }

    @Override
    public String getOperationName() {
        return operationName;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    public SimpleActivity setDisplayName(String displayName) {
        this.displayName = displayName;
        return this;
    }

    @Override
    public ActivityKind getKind() {
        return kind;
    }

    @Override
    public long getStartEpochMicros() {
        return startEpochMicros;
    }

    @Override
    public long getDurationMicros() {
        return durationMicros;
    }

    /**
     * Sets the duration to the time elapsed since the start of this activity
     */
    public SimpleActivity stop() {
        return stop(Math.max(0, SystemClock.currentEpochMicros() - startEpochMicros));
    }

    public SimpleActivity stop(long durationMicros) {
        this.durationMicros = durationMicros;
        return this;
    }

    /**
     * @return a snapshot of the attributes
     */
    @Override
    public Map<String, Object> getAttributes() {
        synchronized (attributes) {
            return new LinkedHashMap<>(attributes);
        }
    }

    public SimpleActivity setAttribute(String key, @Nullable Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
        return this;
    }

    @Override
    public List<ActivityEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public SimpleActivity addEvent(ActivityEvent event) {
        events.add(event);
        return this;
    }

    @Override
    public ActivityStatusCode getStatus() {
        return status;
    }

    public SimpleActivity setStatus(ActivityStatusCode status) {
        this.status = status;
        return this;
    }

    @Override
    public boolean isRecorded() {
        return recorded;
    }

    public SimpleActivity setRecorded(boolean recorded) {
        this.recorded = recorded;
        return this;
    }

    @Override
    public boolean isAllDataRequested() {
        return allDataRequested;
    }

    public SimpleActivity setAllDataRequested(boolean allDataRequested) {
        this.allDataRequested = allDataRequested;
        return this;
    }

    @Override
    public boolean hasRemoteParent() {
        return remoteParent;
    }

    @Override
    public Baggage getBaggage() {
        return baggage;
    }

    @Nullable
    @Override
    public Object getCustomProperty(String key) {
        return customProperties.get(key);
    }

    @Override
    public void setCustomProperty(String key, @Nullable Object value) {
        if (value == null) {
            customProperties.remove(key);
        } else {
            customProperties.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "'" + displayName + "' 00-" + traceId + "-" + spanId;
    }

    public static class Builder {
        private final String operationName;
        private final String displayName;
        private ActivityKind kind = ActivityKind.INTERNAL;
        @Nullable
        private Activity parent;
        @Nullable
        private Id traceId;
        @Nullable
        private Id parentSpanId;
        @Nullable
        private Id spanId;
        private long startEpochMicros;
        private Baggage baggage = Baggage.empty();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private boolean recorded = true;
        private boolean allDataRequested = true;

        private Builder(String operationName, String displayName) {
            this.operationName = operationName;
            this.displayName = displayName;
        }

        public Builder kind(ActivityKind kind) {
            this.kind = kind;
            return this;
        }

        /**
         * Sets an in-process parent, the trace id is inherited from it.
         */
        public Builder parent(Activity parent) {
            this.parent = parent;
            return this;
        }

        /**
         * Continues a trace which has been propagated from another process.
         */
        public Builder remoteParent(Id traceId, Id parentSpanId) {
            this.traceId = traceId;
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder spanId(Id spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder startEpochMicros(long startEpochMicros) {
            this.startEpochMicros = startEpochMicros;
            return this;
        }

        public Builder baggage(Baggage baggage) {
            this.baggage = baggage;
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder recorded(boolean recorded) {
            this.recorded = recorded;
            return this;
        }

        public Builder allDataRequested(boolean allDataRequested) {
            this.allDataRequested = allDataRequested;
            return this;
        }

        public SimpleActivity build() {
            return new SimpleActivity(this);
        }
    }
}
