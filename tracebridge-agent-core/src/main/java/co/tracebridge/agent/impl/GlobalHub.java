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

import javax.annotation.Nullable;

/**
 * Holds the hub of this process.
 */
public final class GlobalHub {

    private static volatile Hub hub = NoopHub.INSTANCE;

    private GlobalHub() {
    }

    /**
     * @return the registered hub, or {@link NoopHub#INSTANCE} if none has been registered
     */
    public static Hub get() {
        return hub;
    }

    /**
     * @return the registered hub if it is a {@link TracebridgeTracer}, {@code null} otherwise
     */
    @Nullable
    public static TracebridgeTracer getTracerImpl() {
        Hub current = hub;
        return current instanceof TracebridgeTracer ? (TracebridgeTracer) current : null;
    }

    public static synchronized void init(Hub hub) {
        if (!isNoop()) {
            throw new IllegalStateException("Hub is already initialized");
        }
        GlobalHub.hub = hub;
    }

    public static boolean isNoop() {
        return hub == NoopHub.INSTANCE;
    }

    public static synchronized void reset() {
        hub = NoopHub.INSTANCE;
    }
}
