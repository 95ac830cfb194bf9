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
package co.tracebridge.agent.impl;

import co.tracebridge.agent.configuration.CoreConfiguration;
import co.tracebridge.agent.impl.baggage.DynamicSamplingContext;
import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.sampling.Sampler;
import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.scope.ScopeActivation;
import co.tracebridge.agent.impl.transaction.AbstractSpan;
import co.tracebridge.agent.impl.transaction.Id;
import co.tracebridge.agent.impl.transaction.SystemClock;
import co.tracebridge.agent.impl.transaction.Transaction;
import co.tracebridge.agent.impl.transaction.TransactionContext;
import co.tracebridge.agent.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.function.Consumer;

/**
 * This is the {@link Hub} implementation which provides access to lower level agent functionality.
 * <p>
 * Note that this is a internal API, so there are no guarantees in terms of backwards compatibility.
 * </p>
 */
public class TracebridgeTracer implements Hub {
    private static final Logger logger = LoggerFactory.getLogger(TracebridgeTracer.class);

    private final ConfigurationRegistry configurationRegistry;
    private final CoreConfiguration coreConfiguration;
    private final Reporter reporter;
    private final Sampler sampler;
    private final ThreadLocal<Scope> scope = new ThreadLocal<Scope>() {
        @Override
        protected Scope initialValue() {
            return new Scope();
        }
    };

    TracebridgeTracer(ConfigurationRegistry configurationRegistry, Reporter reporter, Sampler sampler) {
        this.configurationRegistry = configurationRegistry;
        this.reporter = reporter;
        this.sampler = sampler;
        this.coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
    }

    public Transaction startTransaction(TransactionContext context) {
        return startTransaction(context, Collections.<String, Object>emptyMap(), null);
    }

    @Override
    public Transaction startTransaction(TransactionContext context, Map<String, Object> customSamplingContext,
                                        @Nullable DynamicSamplingContext dynamicSamplingContext) {
        Transaction transaction;
        if (!coreConfiguration.isActive()) {
            transaction = Transaction.noop(this, context);
        } else if (context.getInstrumenter() != coreConfiguration.getInstrumenter()) {
            logger.debug("Instrumenter {} of transaction '{}' doesn't match the configured instrumenter {}, starting a noop transaction",
                context.getInstrumenter(), context.getName(), coreConfiguration.getInstrumenter());
            transaction = Transaction.noop(this, context);
        } else {
            Boolean sampled = context.getSampled();
            if (sampled == null) {
                sampled = sampler.isSampled(context, customSamplingContext);
            }
            transaction = new Transaction(this, context, sampled, dynamicSamplingContext, SystemClock.currentEpochMicros());
        }
        if (logger.isDebugEnabled()) {
            logger.debug("startTransaction {} {", transaction);
            if (logger.isTraceEnabled()) {
                logger.trace("starting transaction at",
                    new RuntimeException("this exception is just used to record where the transaction has been started from"));
            }
        }
        return transaction;
    }

    @Nullable
    public Transaction currentTransaction() {
        return scope.get().getTransaction();
    }

    /**
     * @return the scope of the calling thread
     */
    public Scope getScope() {
        return scope.get();
    }

    @Override
    public void configureScope(Consumer<Scope> callback) {
        callback.accept(scope.get());
    }

    @Override
    public void restoreScope(Scope scope) {
        this.scope.set(scope);
    }

    /**
     * Forks the current scope. Changes to the fork are discarded when the returned activation is closed.
     */
    public ScopeActivation pushScope() {
        final Scope previous = scope.get();
        scope.set(previous.copy());
        return new ScopeActivation() {
            @Override
            public void close() {
                scope.set(previous);
            }
        };
    }

    @Nullable
    @Override
    public Id captureEvent(ErrorEvent event, @Nullable Consumer<Scope> configureScope) {
        if (!coreConfiguration.isActive()) {
            return null;
        }
        Scope eventScope = scope.get();
        if (configureScope != null) {
            eventScope = eventScope.copy();
            try {
                configureScope.accept(eventScope);
            } catch (RuntimeException e) {
                logger.warn("Failed to configure the scope of error {}", event.getEventId(), e);
            }
        }
        eventScope.applyTo(event);
        reporter.report(event);
        return event.getEventId();
    }

    /**
     * Captures an exception which has been recorded while the given span was active.
     */
    public void captureException(@Nullable Throwable e, @Nullable AbstractSpan<?> span) {
        if (e == null || !coreConfiguration.isActive()) {
            return;
        }
        ErrorEvent error = new ErrorEvent(e, SystemClock.currentEpochMicros());
        if (span != null) {
            error.setTraceContext(span.getTraceContext());
            error.setTransactionName(span.getTransaction().getName());
        }
        scope.get().applyTo(error);
        reporter.report(error);
    }

    @Override
    public ConfigurationRegistry getConfigurationRegistry() {
        return configurationRegistry;
    }

    public <T extends ConfigurationOptionProvider> T getConfig(Class<T> pluginClass) {
        return configurationRegistry.getConfig(pluginClass);
    }

    public void endTransaction(final Transaction transaction) {
        if (logger.isDebugEnabled()) {
            logger.debug("} endTransaction {}", transaction);
        }
        configureScope(new Consumer<Scope>() {
            @Override
            public void accept(Scope scope) {
                scope.resetTransaction(transaction);
            }
        });
        if (transaction.isNoop() || !transaction.isSampled()) {
            return;
        }
        if (transaction.isIngestionRequest()) {
            logger.debug("Not reporting {} as it is a request to the ingestion endpoint", transaction);
            return;
        }
        reporter.report(transaction);
    }

    /**
     * Called when the container shuts down.
     * Cleans up thread pools and other resources.
     */
    public void stop() {
        try {
            configurationRegistry.close();
            reporter.close();
        } catch (Exception e) {
            logger.warn("Suppressed exception while calling stop()", e);
        }
    }

    public Reporter getReporter() {
        return reporter;
    }

    public Sampler getSampler() {
        return sampler;
    }
}
