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
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Propagated key/value metadata of a trace, as carried by the W3C {@code baggage} header.
 * <p>
 * Instances are immutable.
 * </p>
 */
public final class Baggage {

    private static final Baggage EMPTY = new Baggage(Collections.<String, String>emptyMap());

    private final Map<String, String> entries;

    private Baggage(Map<String, String> entries) {
        this.entries = entries;
    }

    public static Baggage empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a W3C baggage header, such as {@code key1=value1;property,key2=value2}.
     * Entry properties are dropped, malformed list members are skipped.
     */
    public static Baggage fromHeader(@Nullable String header) {
        if (header == null || header.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        for (String member : header.split(",")) {
            int propertiesStart = member.indexOf(';');
            String keyValue = propertiesStart >= 0 ? member.substring(0, propertiesStart) : member;
            int separator = keyValue.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = keyValue.substring(0, separator).trim();
            String value = keyValue.substring(separator + 1).trim();
            if (!key.isEmpty()) {
                builder.put(key, decode(value));
            }
        }
        return builder.build();
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            return value;
        }
    }

    @Nullable
    public String get(String key) {
        return entries.get(key);
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Baggage) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Baggage" + entries;
    }

    public static class Builder {

        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, @Nullable String value) {
            if (value == null) {
                entries.remove(key);
            } else {
                entries.put(key, value);
            }
            return this;
        }

        public Baggage build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new Baggage(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
