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

import co.tracebridge.agent.impl.Hub;
import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.transaction.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import static co.tracebridge.agent.activity.SemanticConventions.EXCEPTION_EVENT_NAME;
import static co.tracebridge.agent.activity.SemanticConventions.EXCEPTION_MESSAGE;
import static co.tracebridge.agent.activity.SemanticConventions.EXCEPTION_STACKTRACE;
import static co.tracebridge.agent.activity.SemanticConventions.EXCEPTION_TYPE;

/**
 * Turns the exception events of an activity into error events.
 * <p>
 * Only the type name, message and stack trace of a recorded exception are known,
 * so a synthetic exception of the same type is created from them.
 * It carries no stack frames, the recorded stack trace is attached as {@value #STACK_TRACE} context instead.
 * </p>
 */
class ExceptionEventSynthesizer {

    static final String MECHANISM = "ActivitySpanProcessor.ErrorSpan";
    static final String STACK_TRACE = "stack_trace";

    private static final Logger logger = LoggerFactory.getLogger(ExceptionEventSynthesizer.class);

    private final Hub hub;
    private final Function<ActivityAttributes, Map<String, Object>> otelContextFactory;

    /**
     * @param otelContextFactory creates a new, mutable {@code otel} context from the span attributes
     */
    ExceptionEventSynthesizer(Hub hub, Function<ActivityAttributes, Map<String, Object>> otelContextFactory) {
        this.hub = hub;
        this.otelContextFactory = otelContextFactory;
    }

    /**
     * @return the number of captured error events
     */
    int synthesize(Activity activity, ActivityAttributes spanAttributes) {
        int captured = 0;
        for (ActivityEvent event : activity.getEvents()) {
            if (!EXCEPTION_EVENT_NAME.equals(event.getName())) {
                continue;
            }
            try {
                if (captureException(activity, event, spanAttributes)) {
                    captured++;
                }
            } catch (RuntimeException e) {
                logger.error("Failed to capture the exception event of activity {}", activity.getSpanId(), e);
            }
        }
        return captured;
    }

    private boolean captureException(Activity activity, ActivityEvent event, ActivityAttributes spanAttributes) {
        ActivityAttributes eventAttributes = ActivityAttributes.of(event.getAttributes());
        String type = eventAttributes.getString(EXCEPTION_TYPE);
        if (type == null) {
            return false;
        }
        Throwable exception = createException(type, eventAttributes.getString(EXCEPTION_MESSAGE));
        if (exception == null) {
            return false;
        }

        Map<String, Object> otelContext = otelContextFactory.apply(spanAttributes);
        String stackTrace = eventAttributes.getString(EXCEPTION_STACKTRACE);
        if (stackTrace != null) {
            otelContext.put(STACK_TRACE, stackTrace);
        }
        ErrorEvent errorEvent = new ErrorEvent(exception, event.getEpochMicros())
            .setMechanism(MECHANISM)
            .setContext(ActivitySpanProcessor.OTEL_CONTEXT, otelContext);

        final TraceContext traceContext = new TraceContext(activity.getTraceId(), activity.getSpanId(), activity.getParentSpanId());
        hub.captureEvent(errorEvent, new Consumer<Scope>() {
            @Override
            public void accept(Scope scope) {
                scope.setTraceContext(traceContext);
            }
        });
        return true;
    }

    @Nullable
    static Throwable createException(String type, @Nullable String message) {
        try {
            Class<?> exceptionClass = loadClass(type);
            if (!Throwable.class.isAssignableFrom(exceptionClass)) {
                logger.error("Can't capture exception event: {} is not a Throwable", type);
                return null;
            }
            Throwable exception = exceptionClass.asSubclass(Throwable.class).getConstructor(String.class).newInstance(message);
            exception.setStackTrace(new StackTraceElement[0]);
            return exception;
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            logger.error("Can't capture exception event: failed to create an exception of type {}", type, e);
            return null;
        }
    }

    /**
     * Loads a class by its binary name or by its canonical name, as reported for nested classes.
     */
    private static Class<?> loadClass(String type) throws ClassNotFoundException {
        ClassLoader classLoader = getClassLoader();
        ClassNotFoundException notFound;
        try {
            return Class.forName(type, true, classLoader);
        } catch (ClassNotFoundException e) {
            notFound = e;
        }
        // Outer.Inner is loaded as Outer$Inner
        String className = type;
        for (int lastDot = className.lastIndexOf('.'); lastDot > 0; lastDot = className.lastIndexOf('.')) {
            className = className.substring(0, lastDot) + '$' + className.substring(lastDot + 1);
            try {
                return Class.forName(className, true, classLoader);
            } catch (ClassNotFoundException e) {
                notFound.addSuppressed(e);
            }
        }
        throw notFound;
    }

    private static ClassLoader getClassLoader() {
        ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : ExceptionEventSynthesizer.class.getClassLoader();
    }
}
