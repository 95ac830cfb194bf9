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
package co.tracebridge.agent.report;

import co.tracebridge.agent.impl.error.ErrorEvent;
import co.tracebridge.agent.impl.transaction.Transaction;

import java.io.Closeable;

/**
 * Hands finished transactions and captured errors over to the transport.
 */
public interface Reporter extends Closeable {

    /**
     * Reports a finished transaction together with its {@link Transaction#getSpans() spans}.
     */
    void report(Transaction transaction);

    void report(ErrorEvent error);

    @Override
    void close();
}
