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

/**
 * Attribute keys of the OpenTelemetry semantic conventions which are used to interpret activities.
 */
public final class SemanticConventions {

    public static final String OTEL_STATUS_CODE = "otel.status_code";
    public static final String OTEL_STATUS_CODE_ERROR = "ERROR";

    public static final String HTTP_METHOD = "http.method";
    public static final String HTTP_ROUTE = "http.route";
    public static final String HTTP_TARGET = "http.target";
    public static final String HTTP_STATUS_CODE = "http.status_code";
    /**
     * Deprecated since semantic conventions 1.5.0, see {@link #URL_FULL}
     */
    public static final String HTTP_URL = "http.url";
    public static final String URL_FULL = "url.full";

    public static final String DB_SYSTEM = "db.system";
    public static final String DB_STATEMENT = "db.statement";

    public static final String RPC_SERVICE = "rpc.service";
    public static final String RPC_GRPC_STATUS_CODE = "rpc.grpc.status_code";

    public static final String MESSAGING_SYSTEM = "messaging.system";

    public static final String FAAS_TRIGGER = "faas.trigger";

    public static final String EXCEPTION_EVENT_NAME = "exception";
    public static final String EXCEPTION_TYPE = "exception.type";
    public static final String EXCEPTION_MESSAGE = "exception.message";
    public static final String EXCEPTION_STACKTRACE = "exception.stacktrace";

    private SemanticConventions() {
    }
}
