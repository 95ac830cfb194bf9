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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SpanDescriptionResolverTest {

    private static SpanDescription resolve(SimpleActivity activity) {
        return SpanDescriptionResolver.resolve(activity, ActivityAttributes.of(activity.getAttributes()));
    }

    private static SimpleActivity.Builder activity() {
        return SimpleActivity.builder("my-instrumentation", "display name");
    }

    @Test
    void testHttpClient() {
        SpanDescription description = resolve(activity()
            .kind(ActivityKind.CLIENT)
            .attribute("http.method", "GET")
            .attribute("http.route", "/users/{id}")
            .build());

        assertThat(description.getOperation()).isEqualTo("http.client");
        assertThat(description.getDescription()).isEqualTo("GET");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.CUSTOM);
    }

    @ParameterizedTest
    @EnumSource(value = ActivityKind.class, names = "CLIENT", mode = EnumSource.Mode.EXCLUDE)
    void testHttpServerRoute(ActivityKind kind) {
        SpanDescription description = resolve(activity()
            .kind(kind)
            .attribute("http.method", "GET")
            .attribute("http.route", "/users/{id}")
            .attribute("http.target", "/users/42")
            .build());

        assertThat(description.getOperation()).isEqualTo("http.server");
        assertThat(description.getDescription()).isEqualTo("GET /users/{id}");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
    }

    @Test
    void testHttpServerRootTarget() {
        SpanDescription description = resolve(activity()
            .attribute("http.method", "GET")
            .attribute("http.target", "/")
            .build());

        assertThat(description.getOperation()).isEqualTo("http.server");
        assertThat(description.getDescription()).isEqualTo("GET /");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
    }

    @Test
    void testHttpServerTarget() {
        SpanDescription description = resolve(activity()
            .attribute("http.method", "POST")
            .attribute("http.target", "/users/42?expand=true")
            .build());

        assertThat(description.getDescription()).isEqualTo("POST /users/42?expand=true");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.URL);
    }

    @Test
    void testHttpServerWithoutRouteOrTarget() {
        SpanDescription description = resolve(activity()
            .attribute("http.method", "GET")
            .build());

        assertThat(description.getOperation()).isEqualTo("http.server");
        assertThat(description.getDescription()).isEqualTo("display name");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.CUSTOM);
    }

    @Test
    void testHttpTakesPrecedenceOverDatabase() {
        SpanDescription description = resolve(activity()
            .attribute("db.system", "h2")
            .attribute("http.method", "GET")
            .build());

        assertThat(description.getOperation()).isEqualTo("http.server");
    }

    @Test
    void testDatabase() {
        SpanDescription description = resolve(activity()
            .attribute("db.system", "postgresql")
            .attribute("db.statement", "SELECT 1")
            .build());

        assertThat(description.getOperation()).isEqualTo("db");
        assertThat(description.getDescription()).isEqualTo("SELECT 1");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.TASK);
    }

    @Test
    void testDatabaseWithoutStatement() {
        SpanDescription description = resolve(activity()
            .attribute("db.system", "")
            .build());

        assertThat(description.getOperation()).isEqualTo("db");
        assertThat(description.getDescription()).isEqualTo("display name");
    }

    @Test
    void testRpc() {
        SpanDescription description = resolve(activity()
            .attribute("rpc.service", "UserService")
            .attribute("messaging.system", "kafka")
            .build());

        assertThat(description.getOperation()).isEqualTo("rpc");
        assertThat(description.getDescription()).isEqualTo("display name");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
    }

    @Test
    void testMessaging() {
        SpanDescription description = resolve(activity()
            .attribute("messaging.system", "kafka")
            .attribute("faas.trigger", "pubsub")
            .build());

        assertThat(description.getOperation()).isEqualTo("message");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
    }

    static Stream<Arguments> nonStringSystemAttributes() {
        return Stream.of(
            Arguments.of("db.system", ActivityKind.CLIENT, "db", TransactionNameSource.TASK),
            Arguments.of("db.system", 5L, "db", TransactionNameSource.TASK),
            Arguments.of("rpc.service", 42L, "rpc", TransactionNameSource.ROUTE),
            Arguments.of("rpc.service", Boolean.FALSE, "rpc", TransactionNameSource.ROUTE),
            Arguments.of("messaging.system", new StringBuilder("kafka"), "message", TransactionNameSource.ROUTE),
            Arguments.of("messaging.system", 0, "message", TransactionNameSource.ROUTE)
        );
    }

    @ParameterizedTest
    @MethodSource("nonStringSystemAttributes")
    void testSystemAttributesMatchOnPresenceRegardlessOfValueType(String key, Object value, String operation, TransactionNameSource nameSource) {
        SpanDescription description = resolve(activity()
            .attribute(key, value)
            .build());

        assertThat(description.getOperation()).isEqualTo(operation);
        assertThat(description.getDescription()).isEqualTo("display name");
        assertThat(description.getNameSource()).isEqualTo(nameSource);
    }

    @Test
    void testNonStringStatementFallsBackToDisplayName() {
        SpanDescription description = resolve(activity()
            .attribute("db.system", "postgresql")
            .attribute("db.statement", 1)
            .build());

        assertThat(description.getOperation()).isEqualTo("db");
        assertThat(description.getDescription()).isEqualTo("display name");
    }

    @Test
    void testFaas() {
        SpanDescription description = resolve(activity()
            .attribute("faas.trigger", "timer")
            .build());

        assertThat(description.getOperation()).isEqualTo("timer");
        assertThat(description.getDescription()).isEqualTo("display name");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.ROUTE);
    }

    @Test
    void testFallback() {
        SpanDescription description = resolve(activity()
            .attribute("http.method", 42)
            .attribute("component", "cache")
            .build());

        assertThat(description.getOperation()).isEqualTo("my-instrumentation");
        assertThat(description.getDescription()).isEqualTo("display name");
        assertThat(description.getNameSource()).isEqualTo(TransactionNameSource.CUSTOM);
    }
}
