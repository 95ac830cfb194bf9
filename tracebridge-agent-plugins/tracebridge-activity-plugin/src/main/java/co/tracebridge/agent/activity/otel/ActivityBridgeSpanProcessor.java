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

import co.tracebridge.agent.activity.ActivitySpanCustomizer;
import co.tracebridge.agent.activity.ActivitySpanProcessor;
import co.tracebridge.agent.impl.Hub;
import co.tracebridge.agent.impl.baggage.Baggage;
import io.opentelemetry.api.baggage.BaggageEntry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Forwards the spans of an OpenTelemetry SDK to an {@link ActivitySpanProcessor}.
 * <pre>
 * SdkTracerProvider.builder()
 *     .setResource(resource)
 *     .addSpanProcessor(new ActivityBridgeSpanProcessor(GlobalHub.get(), resource, null))
 *     .build();
 * </pre>
 */
public class ActivityBridgeSpanProcessor implements SpanProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ActivityBridgeSpanProcessor.class);

    private final ActivitySpanProcessor processor;
    private final ConcurrentMap<String, OpenTelemetryActivity> inFlight = new ConcurrentHashMap<>();

    public ActivityBridgeSpanProcessor(Hub hub) {
        this(new ActivitySpanProcessor(hub, null, null));
    }

    /**
     * @param resource the resource of the tracer provider, its attributes are added to the transactions
     */
    public ActivityBridgeSpanProcessor(Hub hub, final Resource resource, @Nullable ActivitySpanCustomizer beforeFinish) {
        this(new ActivitySpanProcessor(hub, beforeFinish, new Supplier<Map<String, Object>>() {
            @Override
            public Map<String, Object> get() {
                final Map<String, Object> attributes = new LinkedHashMap<>();
                resource.getAttributes().forEach(new BiConsumer<AttributeKey<?>, Object>() {
                    @Override
                    public void accept(AttributeKey<?> key, Object value) {
                        attributes.put(key.getKey(), value);
                    }
                });
                return attributes;
            }
        }));
    }

    public ActivityBridgeSpanProcessor(ActivitySpanProcessor processor) {
        this.processor = processor;
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        String parentSpanId = span.getParentSpanContext().getSpanId();
        OpenTelemetryActivity parent = span.getParentSpanContext().isValid() ? inFlight.get(parentSpanId) : null;
        OpenTelemetryActivity activity = new OpenTelemetryActivity(span, parent, toBaggage(io.opentelemetry.api.baggage.Baggage.fromContext(parentContext)));
        inFlight.put(span.getSpanContext().getSpanId(), activity);
        processor.onStart(activity);
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        OpenTelemetryActivity activity = inFlight.remove(span.getSpanContext().getSpanId());
        if (activity == null) {
            logger.debug("Span {} has been started before the bridge has been registered", span.getSpanContext().getSpanId());
            return;
        }
        activity.end(span.toSpanData());
        processor.onEnd(activity);
    }

    @Override
    public boolean isEndRequired() {
        return true;
    }

    public ActivitySpanProcessor getProcessor() {
        return processor;
    }

    private static Baggage toBaggage(io.opentelemetry.api.baggage.Baggage otelBaggage) {
        if (otelBaggage.isEmpty()) {
            return Baggage.empty();
        }
        final Baggage.Builder builder = Baggage.builder();
        otelBaggage.forEach(new BiConsumer<String, BaggageEntry>() {
            @Override
            public void accept(String key, BaggageEntry entry) {
                builder.put(key, entry.getValue());
            }
        });
        return builder.build();
    }
}
