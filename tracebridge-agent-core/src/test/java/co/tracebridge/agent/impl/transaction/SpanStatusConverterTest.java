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
package co.tracebridge.agent.impl.transaction;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SpanStatusConverterTest {

    @ParameterizedTest
    @CsvSource({
        "200, OK",
        "302, OK",
        "400, INVALID_ARGUMENT",
        "401, UNAUTHENTICATED",
        "403, PERMISSION_DENIED",
        "404, NOT_FOUND",
        "409, ALREADY_EXISTS",
        "418, INVALID_ARGUMENT",
        "429, RESOURCE_EXHAUSTED",
        "499, CANCELLED",
        "500, INTERNAL_ERROR",
        "501, UNIMPLEMENTED",
        "502, INTERNAL_ERROR",
        "503, UNAVAILABLE",
        "504, DEADLINE_EXCEEDED",
        "600, UNKNOWN_ERROR"
    })
    void testHttpStatus(int httpStatus, SpanStatus expected) {
        assertThat(SpanStatusConverter.fromHttpStatusCode(httpStatus)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "0, OK",
        "1, CANCELLED",
        "2, UNKNOWN_ERROR",
        "5, NOT_FOUND",
        "7, PERMISSION_DENIED",
        "14, UNAVAILABLE",
        "16, UNAUTHENTICATED",
        "17, UNKNOWN_ERROR",
        "-1, UNKNOWN_ERROR"
    })
    void testGrpcStatus(int grpcStatus, SpanStatus expected) {
        assertThat(SpanStatusConverter.fromGrpcStatusCode(grpcStatus)).isEqualTo(expected);
    }
}
