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

import co.tracebridge.agent.impl.baggage.Baggage;
import co.tracebridge.agent.impl.transaction.Id;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A unit of work which has been recorded by instrumentation outside of the agent.
 * <p>
 * The {@link ActivitySpanProcessor} only reads activities,
 * except for the custom property slots which are used to attach agent state (see {@link ActivityBindings}).
 * Implementations have to be safe for concurrent reads.
 * </p>
 */
public interface Activity {

    /**
     * @return the 64 bit id of this activity, unique within the process
     */
    Id getSpanId();

    /**
     * @return the id of the parent activity, or {@code null} for root activities
     */
    @Nullable
    Id getParentSpanId();

    /**
     * @return the 128 bit id which is shared by all activities of a trace
     */
    Id getTraceId();

    /**
     * @return the parent activity, if it lives in this process
     */
    @Nullable
    Activity getParent();

    /**
     * @return the name of the instrumentation which recorded this activity
     */
    String getOperationName();

    String getDisplayName();

    ActivityKind getKind();

    long getStartEpochMicros();

    /**
     * @return the duration in microseconds, {@code 0} until the activity has ended
     */
    long getDurationMicros();

    Map<String, ?> getAttributes();

    List<ActivityEvent> getEvents();

    ActivityStatusCode getStatus();

    /**
     * @return whether the activity is part of a sampled trace, may change after the activity has been started
     */
    boolean isRecorded();

    /**
     * @return whether the instrumentation populates all data of this activity, may change after the activity has been started
     */
    boolean isAllDataRequested();

    /**
     * @return whether the parent context has been propagated from another process
     */
    boolean hasRemoteParent();

    Baggage getBaggage();

    @Nullable
    Object getCustomProperty(String key);

    /**
     * @param value the value to attach, {@code null} removes the property
     */
    void setCustomProperty(String key, @Nullable Object value);
}
