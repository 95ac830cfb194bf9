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

import co.tracebridge.agent.impl.transaction.SpanStatus;
import co.tracebridge.agent.impl.transaction.SpanStatusConverter;

import javax.annotation.Nullable;

import static co.tracebridge.agent.activity.SemanticConventions.HTTP_STATUS_CODE;
import static co.tracebridge.agent.activity.SemanticConventions.OTEL_STATUS_CODE;
import static co.tracebridge.agent.activity.SemanticConventions.OTEL_STATUS_CODE_ERROR;
import static co.tracebridge.agent.activity.SemanticConventions.RPC_GRPC_STATUS_CODE;

/**
 * Derives the {@link SpanStatus} of a finished activity.
 */
public final class SpanStatusResolver {

    private SpanStatusResolver() {
    }

    public static SpanStatus resolveStatus(@Nullable ActivityStatusCode statusCode, ActivityAttributes attributes) {
        if (OTEL_STATUS_CODE_ERROR.equals(attributes.getString(OTEL_STATUS_CODE))) {
            return getErrorStatus(attributes);
        }
        if (statusCode == null) {
            return SpanStatus.UNKNOWN_ERROR;
        }
        switch (statusCode) {
            case UNSET:
            case OK:
                return SpanStatus.OK;
            case ERROR:
                return getErrorStatus(attributes);
            default:
                return SpanStatus.UNKNOWN_ERROR;
        }
    }

    private static SpanStatus getErrorStatus(ActivityAttributes attributes) {
        Integer httpStatusCode = attributes.getInteger(HTTP_STATUS_CODE);
        if (httpStatusCode != null) {
            return SpanStatusConverter.fromHttpStatusCode(httpStatusCode);
        }
        Integer grpcStatusCode = attributes.getInteger(RPC_GRPC_STATUS_CODE);
        if (grpcStatusCode != null) {
            return SpanStatusConverter.fromGrpcStatusCode(grpcStatusCode);
        }
        return SpanStatus.UNKNOWN_ERROR;
    }
}
