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

import co.tracebridge.agent.MockReporter;
import co.tracebridge.agent.MockTracer;
import co.tracebridge.agent.configuration.SpyConfiguration;
import co.tracebridge.agent.impl.GlobalHub;
import co.tracebridge.agent.impl.HubAdapter;
import co.tracebridge.agent.impl.Instrumenter;
import co.tracebridge.agent.impl.NoopHub;
import co.tracebridge.agent.impl.TracebridgeTracer;
import co.tracebridge.agent.impl.baggage.Baggage;
import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.transaction.AbstractSpan;
import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.Span;
import co.tracebridge.agent.impl.transaction.SpanStatus;
import co.tracebridge.agent.impl.transaction.TraceContext;
import co.tracebridge.agent.impl.transaction.Transaction;
import co.tracebridge.agent.impl.transaction.TransactionContext;
import co.tracebridge.agent.impl.transaction.TransactionNameSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class ActivitySpanProcessorTest {

    private MockReporter reporter;
    private ConfigurationRegistry config;
    private TracebridgeTracer tracer;
    private ActivitySpanProcessor processor;

    @BeforeEach
    void setUp() {
        reporter = new MockReporter();
        config = SpyConfiguration.createSpyConfig();
        tracer = MockTracer.createRealTracer(reporter, config);
        processor = new ActivitySpanProcessor(tracer, Instrumenter.OPENTELEMETRY);
    }

    @AfterEach
    void tearDown() {
        GlobalHub.reset();
        tracer.getScope().setTransaction(null);
    }

    private static SimpleActivity.Builder activity(String displayName) {
        return SimpleActivity.builder("test-instrumentation", displayName);
    }

    @Test
    void testRootActivityStartsTransaction() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);

        AbstractSpan<?> span = processor.getMappedSpan(root.getSpanId());
        assertThat(span).isInstanceOf(Transaction.class);
        assertThat(tracer.currentTransaction()).isSameAs(span);
        assertThat(ActivityBindings.getSpan(root)).isSameAs(span);
        assertThat(span.getTraceContext().getTraceId()).isEqualTo(root.getTraceId());
        assertThat(span.getTraceContext().getSpanId()).isEqualTo(root.getSpanId());
        assertThat(span.getTimestamp()).isEqualTo(root.getStartEpochMicros());
    }

    @Test
    void testChildActivityStartsChildSpan() {
        SimpleActivity root = activity("root").build();
        SimpleActivity child = activity("child").parent(root).build();
        processor.onStart(root);
        processor.onStart(child);

        AbstractSpan<?> span = processor.getMappedSpan(child.getSpanId());
        assertThat(span).isInstanceOf(Span.class);
        assertThat(span.isChildOf(processor.getMappedSpan(root.getSpanId()))).isTrue();
        assertThat(span.getTraceContext().getTraceId()).isEqualTo(root.getTraceId());
        assertThat(span.getTraceContext().getSpanId()).isEqualTo(child.getSpanId());
        assertThat(span.getTraceContext().getParentId()).isEqualTo(root.getSpanId());
        assertThat(span.getTimestamp()).isEqualTo(child.getStartEpochMicros());
        assertThat(span.getDescription()).isEqualTo("child");
    }

    @Test
    void testActivityWithUnknownParentStartsTransaction() {
        SimpleActivity orphan = activity("orphan").remoteParent(Id.new128BitId(), Id.new64BitId()).build();
        processor.onStart(orphan);

        assertThat(processor.getMappedSpan(orphan.getSpanId())).isInstanceOf(Transaction.class);
    }

    @Test
    void testEndFinishesTransaction() {
        SimpleActivity root = activity("GET")
            .kind(ActivityKind.SERVER)
            .attribute("http.method", "GET")
            .attribute("http.route", "/users/{id}")
            .build();
        processor.onStart(root);
        root.stop(1500);
        processor.onEnd(root);

        Transaction transaction = reporter.getFirstTransaction();
        assertThat(transaction.getOperation()).isEqualTo("http.server");
        assertThat(transaction.getDescription()).isEqualTo("GET /users/{id}");
        assertThat(transaction.getName()).isEqualTo("GET /users/{id}");
        assertThat(transaction.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
        assertThat(transaction.getStatus()).isEqualTo(SpanStatus.OK);
        assertThat(transaction.getEndTimestamp()).isEqualTo(root.getStartEpochMicros() + 1500);
        assertThat(transaction.getContext(ActivitySpanProcessor.OTEL_CONTEXT))
            .containsOnlyKeys(ActivitySpanProcessor.ATTRIBUTES);
        assertThat(tracer.currentTransaction()).isNull();
        assertThat(processor.getRegistry().size()).isZero();
    }

    @Test
    void testEndFinishesChildSpan() {
        SimpleActivity root = activity("root").build();
        SimpleActivity child = activity("SELECT users")
            .parent(root)
            .kind(ActivityKind.CLIENT)
            .attribute("db.system", "h2")
            .attribute("db.statement", "SELECT * FROM users")
            .build();
        processor.onStart(root);
        processor.onStart(child);
        processor.onEnd(child.stop(200));
        processor.onEnd(root.stop(1000));

        Span span = reporter.getFirstSpan();
        assertThat(span.getOperation()).isEqualTo("db");
        assertThat(span.getDescription()).isEqualTo("SELECT * FROM users");
        assertThat(span.getEndTimestamp()).isEqualTo(child.getStartEpochMicros() + 200);
        assertThat(span.getData()).containsEntry("db.system", "h2")
            .containsEntry("db.statement", "SELECT * FROM users")
            .containsEntry(ActivitySpanProcessor.OTEL_KIND, ActivityKind.CLIENT);
        assertThat(span.getStatus()).isEqualTo(SpanStatus.OK);
    }

    @Test
    void testRegistryIsEmptyAfterMatchedStartsAndEnds() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        List<SimpleActivity> children = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            SimpleActivity child = activity("child " + i).parent(i == 0 ? root : children.get(i - 1)).build();
            children.add(child);
            processor.onStart(child);
        }
        assertThat(processor.getRegistry().size()).isEqualTo(11);

        Collections.reverse(children);
        for (SimpleActivity child : children) {
            processor.onEnd(child.stop());
        }
        processor.onEnd(root.stop());

        assertThat(processor.getRegistry().size()).isZero();
        assertThat(reporter.getFirstTransaction().getSpans()).hasSize(10);
    }

    @Test
    void testEndTwiceIsIgnored() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        processor.onEnd(root.stop());
        root.setStatus(ActivityStatusCode.ERROR);
        processor.onEnd(root);

        assertThat(reporter.getTransactions()).hasSize(1);
        assertThat(reporter.getFirstTransaction().getStatus()).isEqualTo(SpanStatus.OK);
    }

    @Test
    void testEndWithoutStartIsIgnored() {
        processor.onEnd(activity("never started").build().stop());

        assertThat(reporter.getTransactions()).isEmpty();
        assertThat(processor.getRegistry().size()).isZero();
    }

    @Test
    void testDuplicateStartIsIgnored() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        AbstractSpan<?> span = processor.getMappedSpan(root.getSpanId());
        processor.onStart(root);

        assertThat(processor.getMappedSpan(root.getSpanId())).isSameAs(span);
        assertThat(processor.getRegistry().size()).isEqualTo(1);
    }

    @Test
    void testConcurrentStartLoserIsNotBoundToScope() {
        SimpleActivity root = activity("root").build();
        Transaction winner = tracer.startTransaction(
            new TransactionContext("root", "test-instrumentation", new TraceContext(root.getTraceId(), root.getSpanId(), null)));
        TracebridgeTracer racingTracer = spy(tracer);
        ActivitySpanProcessor racingProcessor = new ActivitySpanProcessor(racingTracer, Instrumenter.OPENTELEMETRY);
        doAnswer(invocation -> {
            // another thread registers the same activity while this one is starting its transaction
            racingProcessor.getRegistry().register(root, winner);
            return invocation.callRealMethod();
        }).when(racingTracer).startTransaction(any(TransactionContext.class), anyMap(), any());

        racingProcessor.onStart(root);

        assertThat(racingProcessor.getMappedSpan(root.getSpanId())).isSameAs(winner);
        assertThat(racingProcessor.getRegistry().size()).isEqualTo(1);
        assertThat(ActivityBindings.getSpan(root)).isNull();
        assertThat(tracer.currentTransaction()).isNull();
    }

    @Test
    void testRequestsToTheIngestionEndpointAreDiscarded() {
        SimpleActivity root = activity("root").build();
        SimpleActivity ingestion = activity("POST")
            .parent(root)
            .kind(ActivityKind.CLIENT)
            .attribute("http.method", "POST")
            .attribute("url.full", "http://localhost:8200/intake/v2/events")
            .build();
        processor.onStart(root);
        processor.onStart(ingestion);
        AbstractSpan<?> span = processor.getMappedSpan(ingestion.getSpanId());
        processor.onEnd(ingestion.stop());

        assertThat(processor.getMappedSpan(ingestion.getSpanId())).isNull();
        assertThat(span.isIngestionRequest()).isTrue();
        assertThat(span.isFinished()).isFalse();
        // the description resolver has not been applied
        assertThat(span.getOperation()).isEqualTo("test-instrumentation");

        processor.onEnd(root.stop());
        assertThat(reporter.getFirstTransaction().getSpans()).isEmpty();
    }

    @Test
    void testLegacyHttpUrlAttributeIsUsedForIngestionDetection() {
        SimpleActivity root = activity("POST")
            .attribute("http.method", "POST")
            .attribute("http.url", "http://localhost:8200")
            .build();
        processor.onStart(root);
        processor.onEnd(root.stop());

        assertThat(processor.getMappedSpan(root.getSpanId())).isNull();
        assertThat(reporter.getTransactions()).isEmpty();
    }

    @Test
    void testOtherUrlsAreNotDiscarded() {
        SimpleActivity root = activity("GET")
            .kind(ActivityKind.CLIENT)
            .attribute("http.method", "GET")
            .attribute("url.full", "http://localhost:82001/intake")
            .build();
        processor.onStart(root);
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getOperation()).isEqualTo("http.client");
    }

    @Test
    void testErrorStatusIsDerivedFromHttpStatusCode() {
        SimpleActivity root = activity("GET")
            .attribute("http.method", "GET")
            .attribute("http.status_code", 404L)
            .build();
        processor.onStart(root);
        root.setStatus(ActivityStatusCode.ERROR);
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getStatus()).isEqualTo(SpanStatus.NOT_FOUND);
    }

    @Test
    void testExceptionEventsAreCaptured() {
        SimpleActivity root = activity("root").build();
        SimpleActivity child = activity("child").parent(root).attribute("component", "test").build();
        processor.onStart(root);
        processor.onStart(child);
        Map<String, Object> exceptionAttributes = new HashMap<>();
        exceptionAttributes.put("exception.type", "java.lang.IllegalStateException");
        exceptionAttributes.put("exception.message", "bad state");
        exceptionAttributes.put("exception.stacktrace", "java.lang.IllegalStateException: bad state\n\tat Foo.bar(Foo.java:42)");
        child.addEvent(new ActivityEvent("exception", child.getStartEpochMicros() + 10, exceptionAttributes));
        child.addEvent(new ActivityEvent("cache miss", child.getStartEpochMicros() + 20, Collections.<String, Object>emptyMap()));
        processor.onEnd(child.stop());

        assertThat(reporter.getErrors()).hasSize(1);
        ErrorEvent error = reporter.getFirstError();
        assertThat(error.getException()).isInstanceOf(IllegalStateException.class).hasMessage("bad state");
        assertThat(error.getException().getStackTrace()).isEmpty();
        assertThat(error.getTimestamp()).isEqualTo(child.getStartEpochMicros() + 10);
        assertThat(error.getMechanism()).isEqualTo(ExceptionEventSynthesizer.MECHANISM);
        assertThat(error.getTraceContext()).isEqualTo(new TraceContext(child.getTraceId(), child.getSpanId(), root.getSpanId()));
        assertThat(error.getContext(ActivitySpanProcessor.OTEL_CONTEXT))
            .containsEntry(ExceptionEventSynthesizer.STACK_TRACE, exceptionAttributes.get("exception.stacktrace"))
            .containsKey(ActivitySpanProcessor.ATTRIBUTES);
        assertThat(processor.getRegistry().size()).isEqualTo(1);
    }

    @Test
    void testUnresolvableExceptionTypeIsSkipped() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        root.addEvent(new ActivityEvent("exception", root.getStartEpochMicros(),
            Collections.singletonMap("exception.type", "System.InvalidOperationException")));
        processor.onEnd(root.stop());

        assertThat(reporter.getErrors()).isEmpty();
        assertThat(reporter.getTransactions()).hasSize(1);
    }

    @Test
    void testCapturedExceptionFinishesSpan() {
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        IllegalArgumentException exception = new IllegalArgumentException("invalid");
        ActivityBindings.setException(root, exception);
        processor.onEnd(root.stop());

        Transaction transaction = reporter.getFirstTransaction();
        assertThat(transaction.getStatus()).isEqualTo(SpanStatus.INTERNAL_ERROR);
        assertThat(transaction.getThrowable()).isSameAs(exception);
        assertThat(reporter.getFirstError().getException()).isSameAs(exception);
    }

    @Test
    void testCustomizerIsInvokedBeforeFinish() {
        processor = new ActivitySpanProcessor(tracer, (span, activity) -> {
            assertThat(span.isFinished()).isFalse();
            span.setData("customized", activity.getDisplayName());
        }, null);
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getData("customized")).isEqualTo("root");
    }

    @Test
    void testFailingCustomizerDoesNotPreventFinish() {
        processor = new ActivitySpanProcessor(tracer, (span, activity) -> {
            throw new IllegalStateException("customizer failure");
        }, null);
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        processor.onEnd(root.stop());

        assertThat(reporter.getTransactions()).hasSize(1);
        assertThat(processor.getRegistry().size()).isZero();
    }

    @Test
    void testDerivedStatusOverridesCustomizerStatusByDefault() {
        processor = new ActivitySpanProcessor(tracer, (span, activity) -> span.withStatus(SpanStatus.ABORTED), null);
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getStatus()).isEqualTo(SpanStatus.OK);
    }

    @Test
    void testCustomizerStatusPrecedence() {
        doReturn(StatusPrecedence.CUSTOMIZER).when(config.getConfig(ActivityConfiguration.class)).getStatusPrecedence();
        processor = new ActivitySpanProcessor(tracer, (span, activity) -> span.withStatus(SpanStatus.ABORTED), null);
        SimpleActivity root = activity("root").build();
        SimpleActivity child = activity("child").parent(root).build();
        processor.onStart(root);
        processor.onStart(child);
        processor.onEnd(child.stop());
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getStatus()).isEqualTo(SpanStatus.ABORTED);
        assertThat(reporter.getFirstSpan().getStatus()).isEqualTo(SpanStatus.ABORTED);
    }

    @Test
    void testSavedScopeIsRestored() {
        SimpleActivity root = activity("root").build();
        SimpleActivity child = activity("child").parent(root).build();
        processor.onStart(root);
        processor.onStart(child);
        Scope requestScope = tracer.getScope();
        ActivityBindings.saveScope(root, requestScope);
        tracer.restoreScope(new Scope());

        processor.onEnd(child.stop());

        assertThat(tracer.getScope()).isSameAs(requestScope);
    }

    @Test
    void testSavedScopeIsRestoredThroughHubAdapter() {
        GlobalHub.init(tracer);
        processor = new ActivitySpanProcessor(HubAdapter.INSTANCE, Instrumenter.OPENTELEMETRY);
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        Scope requestScope = tracer.getScope();
        ActivityBindings.saveScope(root, requestScope);
        tracer.restoreScope(new Scope());

        processor.onEnd(root.stop());

        assertThat(tracer.getScope()).isSameAs(requestScope);
        assertThat(reporter.getTransactions()).hasSize(1);
    }

    @Test
    void testResourceAttributesAreResolvedOnce() {
        AtomicInteger resolved = new AtomicInteger();
        processor = new ActivitySpanProcessor(tracer, null, () -> {
            resolved.incrementAndGet();
            return Collections.<String, Object>singletonMap("service.name", "checkout");
        });
        for (int i = 0; i < 3; i++) {
            SimpleActivity root = activity("root " + i).build();
            processor.onStart(root);
            processor.onEnd(root.stop());
        }

        assertThat(resolved).hasValue(1);
        assertThat(reporter.getTransactions()).hasSize(3);
        for (Transaction transaction : reporter.getTransactions()) {
            assertThat(transaction.getContext(ActivitySpanProcessor.OTEL_CONTEXT))
                .containsEntry(ActivitySpanProcessor.RESOURCE, Collections.singletonMap("service.name", "checkout"))
                .doesNotContainKey(ActivitySpanProcessor.ATTRIBUTES);
        }
    }

    @Test
    void testRemoteParentSamplingDecisionIsRespected() {
        SimpleActivity notSampled = activity("not sampled")
            .remoteParent(Id.new128BitId(), Id.new64BitId())
            .recorded(false)
            .build();
        processor.onStart(notSampled);
        Transaction transaction = (Transaction) processor.getMappedSpan(notSampled.getSpanId());
        assertThat(transaction.isSampled()).isFalse();
        assertThat(transaction.getParentSampled()).isFalse();
        processor.onEnd(notSampled.stop());
        assertThat(reporter.getTransactions()).isEmpty();

        SimpleActivity sampled = activity("sampled")
            .remoteParent(Id.new128BitId(), Id.new64BitId())
            .baggage(Baggage.fromHeader("tracebridge-sample_rate=0.5,other=value"))
            .build();
        processor.onStart(sampled);
        processor.onEnd(sampled.stop());
        Transaction reported = reporter.getFirstTransaction();
        assertThat(reported.isSampled()).isTrue();
        assertThat(reported.getTraceContext().getTraceId()).isEqualTo(sampled.getTraceId());
        assertThat(reported.getTraceContext().getParentId()).isEqualTo(sampled.getParentSpanId());
        assertThat(reported.getDynamicSamplingContext().getItems()).containsOnlyKeys("sample_rate");
    }

    @Test
    void testChildSpanDroppedAfterStartIsNotReported() {
        SimpleActivity root = activity("root").build();
        SimpleActivity dropped = activity("dropped").parent(root).build();
        processor.onStart(root);
        processor.onStart(dropped);
        dropped.setRecorded(false).setAllDataRequested(false);
        processor.onEnd(dropped.stop());
        processor.onEnd(root.stop());

        assertThat(reporter.getFirstTransaction().getSpans()).isEmpty();
    }

    @Test
    void testInstrumenterMismatchStartsNoopTransactions() {
        processor = new ActivitySpanProcessor(tracer, Instrumenter.TRACEBRIDGE);
        SimpleActivity root = activity("root").build();
        processor.onStart(root);
        assertThat(((Transaction) processor.getMappedSpan(root.getSpanId())).isNoop()).isTrue();
        processor.onEnd(root.stop());

        assertThat(reporter.getTransactions()).isEmpty();
        assertThat(processor.getRegistry().size()).isZero();
    }

    @Test
    void testAgentMustBeInitialized() {
        assertThatThrownBy(() -> new ActivitySpanProcessor(NoopHub.INSTANCE, Instrumenter.OPENTELEMETRY))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ActivitySpanProcessor(HubAdapter.INSTANCE, null, null))
            .isInstanceOf(IllegalStateException.class);
    }
}
