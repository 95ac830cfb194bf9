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

import co.tracebridge.agent.configuration.ReporterConfiguration;
import co.tracebridge.agent.impl.GlobalHub;
import co.tracebridge.agent.impl.Hub;
import co.tracebridge.agent.impl.HubAdapter;
import co.tracebridge.agent.impl.Instrumenter;
import co.tracebridge.agent.impl.baggage.DynamicSamplingContext;
import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.transaction.AbstractSpan;
import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.SpanStatus;
import co.tracebridge.agent.impl.transaction.TraceContext;
import co.tracebridge.agent.impl.transaction.Transaction;
import co.tracebridge.agent.impl.transaction.TransactionContext;
import co.tracebridge.agent.util.Lazy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static co.tracebridge.agent.activity.SemanticConventions.HTTP_URL;
import static co.tracebridge.agent.activity.SemanticConventions.URL_FULL;

/**
 * Creates a transaction or span when an {@link Activity} starts and finishes it when the activity ends.
 * <p>
 * An activity whose parent is in flight becomes a child span of the parent's span,
 * any other activity becomes a new transaction which is bound to the current scope.
 * </p>
 * <p>
 * Both {@link #onStart(Activity)} and {@link #onEnd(Activity)} may be called concurrently from any thread.
 * Failures are logged and never propagate to the instrumentation.
 * </p>
 */
public class ActivitySpanProcessor {

    static final String OTEL_CONTEXT = "otel";
    static final String ATTRIBUTES = "attributes";
    static final String RESOURCE = "resource";
    static final String OTEL_KIND = "otel.kind";

    private static final Logger logger = LoggerFactory.getLogger(ActivitySpanProcessor.class);

    private final Hub hub;
    @Nullable
    private final ActivitySpanCustomizer beforeFinish;
    private final Instrumenter instrumenter;
    private final ReporterConfiguration reporterConfiguration;
    private final ActivityConfiguration activityConfiguration;
    private final ActivitySpanRegistry registry;
    private final Lazy<Map<String, Object>> resourceAttributes;
    private final Lazy<Hub> realHub;
    private final ExceptionEventSynthesizer exceptionEventSynthesizer;

    public ActivitySpanProcessor(Hub hub, Instrumenter instrumenter) {
        this(hub, null, null, instrumenter);
    }

    public ActivitySpanProcessor(Hub hub, @Nullable ActivitySpanCustomizer beforeFinish,
                                 @Nullable Supplier<Map<String, Object>> resourceAttributeResolver) {
        this(hub, beforeFinish, resourceAttributeResolver, Instrumenter.OPENTELEMETRY);
    }

    private ActivitySpanProcessor(final Hub hub, @Nullable ActivitySpanCustomizer beforeFinish,
                                  @Nullable final Supplier<Map<String, Object>> resourceAttributeResolver, Instrumenter instrumenter) {
        ConfigurationRegistry configurationRegistry = hub.getConfigurationRegistry();
        if (configurationRegistry == null) {
            throw new IllegalStateException("The agent has not been initialized. Initialize the agent before creating an " +
                ActivitySpanProcessor.class.getSimpleName());
        }
        this.hub = hub;
        this.beforeFinish = beforeFinish;
        this.instrumenter = instrumenter;
        this.reporterConfiguration = getConfig(configurationRegistry, ReporterConfiguration.class);
        this.activityConfiguration = getConfig(configurationRegistry, ActivityConfiguration.class);
        this.registry = new ActivitySpanRegistry(activityConfiguration.getPruningIntervalMillis());
        this.resourceAttributes = Lazy.of(new Supplier<Map<String, Object>>() {
            @Override
            public Map<String, Object> get() {
                return resolveResourceAttributes(resourceAttributeResolver);
            }
        });
        this.realHub = Lazy.of(new Supplier<Hub>() {
            @Override
            @Nullable
            public Hub get() {
                return resolveRealHub(hub);
            }
        });
        this.exceptionEventSynthesizer = new ExceptionEventSynthesizer(hub, new Function<ActivityAttributes, Map<String, Object>>() {
            @Override
            public Map<String, Object> apply(ActivityAttributes attributes) {
                return getOtelContext(attributes);
            }
        });
    }

    private static <T extends ConfigurationOptionProvider> T getConfig(ConfigurationRegistry configurationRegistry, Class<T> configClass) {
        T config = configurationRegistry.getConfig(configClass);
        if (config == null) {
            throw new IllegalStateException(configClass.getName() + " is not registered in the agent's configuration");
        }
        return config;
    }

    public void onStart(final Activity activity) {
        try {
            if (registry.get(activity.getSpanId()) != null) {
                logger.warn("Activity {} has already been started", activity);
                return;
            }
            AbstractSpan<?> span = startSpanOrTransaction(activity);
            // a concurrent start of the same activity may have won the race, the losing span stays unbound
            if (!registry.register(activity, span)) {
                logger.warn("Activity {} has already been started", activity);
                return;
            }
            ActivityBindings.bindSpan(activity, span);
            if (span instanceof Transaction) {
                final Transaction transaction = (Transaction) span;
                hub.configureScope(new Consumer<Scope>() {
                    @Override
                    public void accept(Scope scope) {
                        scope.setTransaction(transaction);
                    }
                });
            }
        } catch (RuntimeException e) {
            logger.error("Failed to start a span for activity {}", activity, e);
        } finally {
            registry.pruneIfNeeded();
        }
    }

    private AbstractSpan<?> startSpanOrTransaction(final Activity activity) {
        Id parentSpanId = activity.getParentSpanId();
        AbstractSpan<?> parent = parentSpanId != null ? registry.get(parentSpanId) : null;
        TraceContext traceContext = new TraceContext(activity.getTraceId(), activity.getSpanId(), parentSpanId);
        if (parent != null) {
            return parent.startChild(activity.getOperationName(), traceContext, activity.getStartEpochMicros(), new BooleanSupplier() {
                @Override
                public boolean getAsBoolean() {
                    return !activity.isRecorded() && !activity.isAllDataRequested();
                }
            }).withDescription(activity.getDisplayName());
        }

        // a remote parent has already made the sampling decision for the whole trace
        Boolean sampled = activity.hasRemoteParent() ? activity.isRecorded() : null;
        TransactionContext transactionContext = new TransactionContext(activity.getDisplayName(), activity.getOperationName(), traceContext)
            .withDescription(activity.getDisplayName())
            .withSampled(sampled)
            .withParentSampled(sampled)
            .withInstrumenter(instrumenter);
        DynamicSamplingContext dynamicSamplingContext = DynamicSamplingContext.fromBaggage(activity.getBaggage());
        return hub.startTransaction(transactionContext, new HashMap<String, Object>(), dynamicSamplingContext)
            .withStartTimestamp(activity.getStartEpochMicros());
    }

    public void onEnd(Activity activity) {
        Id spanId = activity.getSpanId();
        ActivityAttributes attributes = ActivityAttributes.of(activity.getAttributes());

        if (isIngestionRequest(attributes)) {
            ActivitySpanRegistry.Entry entry = registry.remove(spanId);
            if (entry != null) {
                logger.debug("Discarding activity {} as it is a request to the ingestion endpoint", activity);
                entry.getSpan().setIngestionRequest(true);
            }
            return;
        }

        AbstractSpan<?> span = registry.get(spanId);
        if (span == null) {
            logger.error("Span not found for activity {}. Has onStart been called for it?", activity);
            return;
        }

        try {
            finishSpan(span, activity, attributes);
        } catch (RuntimeException e) {
            logger.error("Failed to finish the span of activity {}", activity, e);
        } finally {
            registry.remove(spanId);
            registry.pruneIfNeeded();
        }
    }

    private void finishSpan(AbstractSpan<?> span, Activity activity, ActivityAttributes attributes) {
        SpanDescription description = SpanDescriptionResolver.resolve(activity, attributes);
        span.withOperation(description.getOperation())
            .withDescription(description.getDescription())
            .withEndTimestamp(activity.getStartEpochMicros() + activity.getDurationMicros());

        if (span instanceof Transaction) {
            ((Transaction) span)
                .withName(description.getDescription())
                .withNameSource(description.getNameSource())
                .setContext(OTEL_CONTEXT, getOtelContext(attributes));
        } else {
            span.setData(attributes.asMap())
                .setData(OTEL_KIND, activity.getKind());
        }

        restoreSavedScope(activity);

        exceptionEventSynthesizer.synthesize(activity, attributes);

        if (beforeFinish != null) {
            try {
                beforeFinish.beforeFinish(span, activity);
            } catch (RuntimeException e) {
                logger.warn("Span customizer failed for activity {}", activity, e);
            }
        }

        Throwable exception = ActivityBindings.getException(activity);
        if (exception != null) {
            span.finish(exception);
        } else {
            span.finish(getFinalStatus(span, activity, attributes));
        }
    }

    private SpanStatus getFinalStatus(AbstractSpan<?> span, Activity activity, ActivityAttributes attributes) {
        SpanStatus customizerStatus = span.getStatus();
        if (customizerStatus != null && activityConfiguration.getStatusPrecedence() == StatusPrecedence.CUSTOMIZER) {
            return customizerStatus;
        }
        return SpanStatusResolver.resolveStatus(activity.getStatus(), attributes);
    }

    private boolean isIngestionRequest(ActivityAttributes attributes) {
        String url = attributes.getString(URL_FULL);
        if (url == null) {
            url = attributes.getString(HTTP_URL);
        }
        return url != null && !url.isEmpty() && reporterConfiguration.isIngestionUrl(url);
    }

    private void restoreSavedScope(Activity activity) {
        Scope savedScope = ActivityBindings.findSavedScope(activity);
        if (savedScope == null) {
            return;
        }
        Hub hub = realHub.get();
        if (hub != null) {
            hub.restoreScope(savedScope);
        }
    }

    private Map<String, Object> getOtelContext(ActivityAttributes attributes) {
        Map<String, Object> otelContext = new LinkedHashMap<>();
        if (!attributes.isEmpty()) {
            otelContext.put(ATTRIBUTES, attributes.asMap());
        }
        Map<String, Object> resource = resourceAttributes.get();
        if (!resource.isEmpty()) {
            otelContext.put(RESOURCE, resource);
        }
        return otelContext;
    }

    private static Map<String, Object> resolveResourceAttributes(@Nullable Supplier<Map<String, Object>> resolver) {
        if (resolver == null) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> resource = resolver.get();
            return resource != null ? Collections.unmodifiableMap(new LinkedHashMap<>(resource)) : Collections.<String, Object>emptyMap();
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve the resource attributes", e);
            return Collections.emptyMap();
        }
    }

    /**
     * The {@link HubAdapter} can't restore scopes on behalf of the hub it forwards to,
     * so the globally registered hub is used instead.
     */
    @Nullable
    private static Hub resolveRealHub(Hub hub) {
        if (hub instanceof HubAdapter) {
            return GlobalHub.isNoop() ? null : GlobalHub.get();
        }
        return hub;
    }

    /**
     * @return the span or transaction of an in-flight activity
     */
    @Nullable
    public AbstractSpan<?> getMappedSpan(Id spanId) {
        return registry.get(spanId);
    }

    ActivitySpanRegistry getRegistry() {
        return registry;
    }
}
