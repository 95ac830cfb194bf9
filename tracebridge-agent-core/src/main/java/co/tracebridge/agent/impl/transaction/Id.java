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

import co.tracebridge.agent.util.HexUtils;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An immutable identifier of a trace (128 bit) or a span (64 bit).
 * <p>
 * Ids are used as registry keys, so {@link #equals(Object)} and {@link #hashCode()} are based on the raw bytes.
 * </p>
 */
public final class Id {

    public static final int TRACE_ID_LENGTH = 16;
    public static final int SPAN_ID_LENGTH = 8;

    private final byte[] data;
    @Nullable
    private volatile String cachedStringRepresentation;

    private Id(byte[] data) {
        this.data = data;
    }

    public static Id new128BitId() {
        return randomId(TRACE_ID_LENGTH, ThreadLocalRandom.current());
    }

    public static Id new64BitId() {
        return randomId(SPAN_ID_LENGTH, ThreadLocalRandom.current());
    }

    static Id randomId(int idLengthBytes, Random random) {
        final byte[] data = new byte[idLengthBytes];
        do {
            random.nextBytes(data);
        } while (isAllZeros(data));
        return new Id(data);
    }

    public static Id traceIdFromHex(String hexEncodedString) {
        return new Id(HexUtils.hexToBytes(hexEncodedString, TRACE_ID_LENGTH));
    }

    public static Id spanIdFromHex(String hexEncodedString) {
        return new Id(HexUtils.hexToBytes(hexEncodedString, SPAN_ID_LENGTH));
    }

    public static Id fromBytes(byte[] bytes) {
        return new Id(bytes.clone());
    }

    public byte[] toBytes() {
        return data.clone();
    }

    public boolean isEmpty() {
        return isAllZeros(data);
    }

    int getLength() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Id that = (Id) o;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        String s = cachedStringRepresentation;
        if (s == null) {
            s = cachedStringRepresentation = HexUtils.bytesToHex(data);
        }
        return s;
    }

    private static boolean isAllZeros(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
