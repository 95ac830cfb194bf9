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

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable, insertion ordered snapshot of the attributes of an activity with typed accessors.
 * <p>
 * The accessors never throw: a value of an unexpected type is treated as if it was absent.
 * {@link #contains(String)} only checks the key, whatever the type of its value.
 * Entries with a {@code null} value are not part of the snapshot, so such keys are never present.
 * </p>
 */
public final class ActivityAttributes {

    private static final ActivityAttributes EMPTY = new ActivityAttributes(Collections.<String, Object>emptyMap());

    private final Map<String, Object> attributes;

    private ActivityAttributes(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    /**
     * Takes a snapshot of raw attributes, {@code null} keys and values are skipped.
     */
    public static ActivityAttributes of(@Nullable Map<String, ?> rawAttributes) {
        if (rawAttributes == null || rawAttributes.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : rawAttributes.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }
        return new ActivityAttributes(Collections.unmodifiableMap(attributes));
    }

    public boolean contains(String key) {
        return attributes.containsKey(key);
    }

    @Nullable
    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * @return the value if it is a {@link String}, {@code null} otherwise
     */
    @Nullable
    public String getString(String key) {
        Object value = attributes.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * @return the value if it is a {@link Number} within the range of an {@code int}, {@code null} otherwise
     */
    @Nullable
    public Integer getInteger(String key) {
        Object value = attributes.get(key);
        if (!(value instanceof Number)) {
            return null;
        }
        long longValue = ((Number) value).longValue();
        if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
            return null;
        }
        return (int) longValue;
    }

    public Map<String, Object> asMap() {
        return attributes;
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
