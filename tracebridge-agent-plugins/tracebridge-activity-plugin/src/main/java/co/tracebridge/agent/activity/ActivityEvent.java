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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A timestamped marker within an {@link Activity}, such as a recorded exception.
 */
public final class ActivityEvent {

    private final String name;
    private final long epochMicros;
    private final Map<String, Object> attributes;

    public ActivityEvent(String name, long epochMicros, Map<String, ?> attributes) {
        this.name = name;
        this.epochMicros = epochMicros;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(attributes));
    }

    public String getName() {
        return name;
    }

    public long getEpochMicros() {
        return epochMicros;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return name + attributes;
    }
}
