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

public class SpanStatusConverter {

    private static final SpanStatus[] GRPC_STATUS = {
        SpanStatus.OK,
        SpanStatus.CANCELLED,
        SpanStatus.UNKNOWN_ERROR,
        SpanStatus.INVALID_ARGUMENT,
        SpanStatus.DEADLINE_EXCEEDED,
        SpanStatus.NOT_FOUND,
        SpanStatus.ALREADY_EXISTS,
        SpanStatus.PERMISSION_DENIED,
        SpanStatus.RESOURCE_EXHAUSTED,
        SpanStatus.FAILED_PRECONDITION,
        SpanStatus.ABORTED,
        SpanStatus.OUT_OF_RANGE,
        SpanStatus.UNIMPLEMENTED,
        SpanStatus.INTERNAL_ERROR,
        SpanStatus.UNAVAILABLE,
        SpanStatus.DATA_LOSS,
        SpanStatus.UNAUTHENTICATED
    };

    private SpanStatusConverter() {
    }

    public static SpanStatus fromHttpStatusCode(int status) {
        if (status < 400) {
            return SpanStatus.OK;
        }
        switch (status) {
            case 401:
                return SpanStatus.UNAUTHENTICATED;
            case 403:
                return SpanStatus.PERMISSION_DENIED;
            case 404:
                return SpanStatus.NOT_FOUND;
            case 409:
                return SpanStatus.ALREADY_EXISTS;
            case 429:
                return SpanStatus.RESOURCE_EXHAUSTED;
            case 499:
                return SpanStatus.CANCELLED;
            case 500:
                return SpanStatus.INTERNAL_ERROR;
            case 501:
                return SpanStatus.UNIMPLEMENTED;
            case 503:
                return SpanStatus.UNAVAILABLE;
            case 504:
                return SpanStatus.DEADLINE_EXCEEDED;
            default:
                break;
        }
        if (status < 500) {
            return SpanStatus.INVALID_ARGUMENT;
        }
        if (status < 600) {
            return SpanStatus.INTERNAL_ERROR;
        }
        return SpanStatus.UNKNOWN_ERROR;
    }

    /**
     * Maps a gRPC status code (see {@code io.grpc.Status.Code}) to a {@link SpanStatus}.
     */
    public static SpanStatus fromGrpcStatusCode(int code) {
        if (code < 0 || code >= GRPC_STATUS.length) {
            return SpanStatus.UNKNOWN_ERROR;
        }
        return GRPC_STATUS[code];
    }
}
