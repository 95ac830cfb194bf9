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
package co.tracebridge.agent.impl.baggage;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The trace-wide sampling metadata which has been propagated as baggage.
 * <p>
 * The values are opaque, they are forwarded to the backend unchanged.
 * </p>
 */
public final class DynamicSamplingContext {

    public static final String BAGGAGE_PREFIX = "tracebridge-";

    private final Map<String, String> items;

    private DynamicSamplingContext(Map<String, String> items) {
        this.items = items;
    }

    /**
     * Extracts the entries with the {@value #BAGGAGE_PREFIX} prefix from the baggage.
     *
     * @return the dynamic sampling context, or {@code null} if the baggage doesn't contain any such entry
     */
    @Nullable
    public static DynamicSamplingContext fromBaggage(Baggage baggage) {
        Map<String, String> items = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : baggage.asMap().entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(BAGGAGE_PREFIX) && key.length() > BAGGAGE_PREFIX.length()) {
                items.put(key.substring(BAGGAGE_PREFIX.length()), entry.getValue());
            }
        }
        if (items.isEmpty()) {
            return null;
        }
        return new DynamicSamplingContext(Collections.unmodifiableMap(items));
    }

    @Nullable
    public String get(String key) {
        return items.get(key);
    }

    public Map<String, String> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return "DynamicSamplingContext" + items;
    }
}
