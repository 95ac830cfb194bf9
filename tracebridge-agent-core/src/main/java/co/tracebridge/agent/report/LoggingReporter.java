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
import co.tracebridge.agent.impl.transaction.Span;
import co.tracebridge.agent.impl.transaction.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Reporter} which only logs what would be sent to the backend.
 */
public class LoggingReporter implements Reporter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingReporter.class);

    @Override
    public void report(Transaction transaction) {
        if (logger.isInfoEnabled()) {
            logger.info("Reporting transaction {} ({}, {}us, status {})", transaction, transaction.getOperation(),
                transaction.getDuration(), transaction.getStatus());
            for (Span span : transaction.getSpans()) {
                logger.info("  span {} ({}, {}us, status {})", span, span.getDescription(), span.getDuration(), span.getStatus());
            }
        }
    }

    @Override
    public void report(ErrorEvent error) {
        logger.info("Reporting error {}", error);
    }

    @Override
    public void close() {
        logger.debug("Closing reporter");
    }
}
