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
package co.tracebridge.agent.activity.otel;

import co.tracebridge.agent.activity.Activity;
import co.tracebridge.agent.activity.ActivityEvent;
import co.tracebridge.agent.activity.ActivityKind;
import co.tracebridge.agent.activity.ActivityStatusCode;
import co.tracebridge.agent.impl.baggage.Baggage;
import co.tracebridge.agent.impl.transaction.Id;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Exposes an OpenTelemetry SDK span as an {@link Activity}.
 * <p>
 * Attributes, events, status and duration are read from the {@link SpanData} snapshot which is taken when the span ends.
 * Before that, they are read from the live span.
 * </p>
 */
class OpenTelemetryActivity implements Activity {

    private final ReadableSpan span;
    @Nullable
    private final Activity parent;
    private final Baggage baggage;
    private final Id spanId;
    private final Id traceId;
    @Nullable
    private final Id parentSpanId;
    private final boolean remoteParent;
    private final boolean allDataRequested;
    private final long startEpochNanos;
    private final Map<String, Object> customProperties = new ConcurrentHashMap<>();
    @Nullable
    private volatile SpanData endData;

    OpenTelemetryActivity(ReadableSpan span, @Nullable Activity parent, Baggage baggage) {
        this.span = span;
        this.parent = parent;
        this.baggage = baggage;
        SpanContext spanContext = span.getSpanContext();
        this.spanId = Id.spanIdFromHex(spanContext.getSpanId());
        this.traceId = Id.traceIdFromHex(spanContext.getTraceId());
        SpanContext parentSpanContext = span.getParentSpanContext();
        this.parentSpanId = parentSpanContext.isValid() ? Id.spanIdFromHex(parentSpanContext.getSpanId()) : null;
        this.remoteParent = parentSpanContext.isValid() && parentSpanContext.isRemote();
        // span processors are only notified about recording spans
        this.allDataRequested = !(span instanceof Span) || ((Span) span).isRecording();
        this.startEpochNanos = span.toSpanData().getStartEpochNanos();
    }

    void end(SpanData endData) {
        this.endData = endData;
    }

    private SpanData getSpanData() {
        SpanData data = endData;
        return data != null ? data : span.toSpanData();
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
        return span.getInstrumentationScopeInfo().getName();
    }

    @Override
    public String getDisplayName() {
        return span.getName();
    }

    @Override
    public ActivityKind getKind() {
        switch (span.getKind()) {
            case SERVER:
                return ActivityKind.SERVER;
            case CLIENT:
                return ActivityKind.CLIENT;
            case PRODUCER:
                return ActivityKind.PRODUCER;
            case CONSUMER:
                return ActivityKind.CONSUMER;
            default:
                return ActivityKind.INTERNAL;
        }
    }

    @Override
    public long getStartEpochMicros() {
        return TimeUnit.NANOSECONDS.toMicros(startEpochNanos);
    }

    @Override
    public long getDurationMicros() {
        SpanData data = endData;
        if (data == null) {
            return 0;
        }
        return TimeUnit.NANOSECONDS.toMicros(data.getEndEpochNanos() - data.getStartEpochNanos());
    }

    @Override
    public Map<String, Object> getAttributes() {
        return toMap(getSpanData().getAttributes());
    }

    @Override
    public List<ActivityEvent> getEvents() {
        List<EventData> events = getSpanData().getEvents();
        List<ActivityEvent> activityEvents = new ArrayList<>(events.size());
        for (EventData event : events) {
            activityEvents.add(new ActivityEvent(event.getName(), TimeUnit.NANOSECONDS.toMicros(event.getEpochNanos()), toMap(event.getAttributes())));
        }
        return activityEvents;
    }

    @Override
    public ActivityStatusCode getStatus() {
        switch (getSpanData().getStatus().getStatusCode()) {
            case OK:
                return ActivityStatusCode.OK;
            case ERROR:
                return ActivityStatusCode.ERROR;
            default:
                return ActivityStatusCode.UNSET;
        }
    }

    @Override
    public boolean isRecorded() {
        return span.getSpanContext().isSampled();
    }

    @Override
    public boolean isAllDataRequested() {
        return allDataRequested;
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

    private static Map<String, Object> toMap(Attributes attributes) {
        final Map<String, Object> map = new LinkedHashMap<>();
        attributes.forEach(new BiConsumer<AttributeKey<?>, Object>() {
            @Override
            public void accept(AttributeKey<?> key, Object value) {
                map.put(key.getKey(), value);
            }
        });
        return map;
    }

    @Override
    public String toString() {
        return "'" + span.getName() + "' 00-" + traceId + "-" + spanId;
    }
}
