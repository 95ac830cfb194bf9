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

import co.tracebridge.agent.impl.transaction.TransactionNameSource;

import static co.tracebridge.agent.activity.SemanticConventions.DB_STATEMENT;
import static co.tracebridge.agent.activity.SemanticConventions.DB_SYSTEM;
import static co.tracebridge.agent.activity.SemanticConventions.FAAS_TRIGGER;
import static co.tracebridge.agent.activity.SemanticConventions.HTTP_METHOD;
import static co.tracebridge.agent.activity.SemanticConventions.HTTP_ROUTE;
import static co.tracebridge.agent.activity.SemanticConventions.HTTP_TARGET;
import static co.tracebridge.agent.activity.SemanticConventions.MESSAGING_SYSTEM;
import static co.tracebridge.agent.activity.SemanticConventions.RPC_SERVICE;

/**
 * Infers operation, description and transaction name source from the semantic convention attributes of an activity.
 * <p>
 * The first matching rule wins. {@code db.system}, {@code rpc.service} and {@code messaging.system} select a rule
 * by their presence alone, any value type will do. The other attributes only count when they hold a string.
 * </p>
 */
public final class SpanDescriptionResolver {

    static final String HTTP_CLIENT = "http.client";
    static final String HTTP_SERVER = "http.server";
    static final String DB = "db";
    static final String RPC = "rpc";
    static final String MESSAGE = "message";

    private SpanDescriptionResolver() {
    }

    public static SpanDescription resolve(Activity activity, ActivityAttributes attributes) {
        String displayName = activity.getDisplayName();

        String httpMethod = attributes.getString(HTTP_METHOD);
        if (httpMethod != null) {
            if (activity.getKind() == ActivityKind.CLIENT) {
                return new SpanDescription(HTTP_CLIENT, httpMethod, TransactionNameSource.CUSTOM);
            }
            String route = attributes.getString(HTTP_ROUTE);
            if (route != null) {
                return new SpanDescription(HTTP_SERVER, httpMethod + " " + route, TransactionNameSource.ROUTE);
            }
            String target = attributes.getString(HTTP_TARGET);
            if (target != null) {
                TransactionNameSource nameSource = "/".equals(target) ? TransactionNameSource.ROUTE : TransactionNameSource.URL;
                return new SpanDescription(HTTP_SERVER, httpMethod + " " + target, nameSource);
            }
            return new SpanDescription(HTTP_SERVER, displayName, TransactionNameSource.CUSTOM);
        }

        if (attributes.contains(DB_SYSTEM)) {
            String statement = attributes.getString(DB_STATEMENT);
            return new SpanDescription(DB, statement != null ? statement : displayName, TransactionNameSource.TASK);
        }

        if (attributes.contains(RPC_SERVICE)) {
            return new SpanDescription(RPC, displayName, TransactionNameSource.ROUTE);
        }

        if (attributes.contains(MESSAGING_SYSTEM)) {
            return new SpanDescription(MESSAGE, displayName, TransactionNameSource.ROUTE);
        }

        String faasTrigger = attributes.getString(FAAS_TRIGGER);
        if (faasTrigger != null) {
            return new SpanDescription(faasTrigger, displayName, TransactionNameSource.ROUTE);
        }

        return new SpanDescription(activity.getOperationName(), displayName, TransactionNameSource.CUSTOM);
    }
}
