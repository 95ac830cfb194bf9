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
package co.tracebridge.agent.util;

/**
 * Lower case base 16 encoding of the binary trace and span ids.
 */
public final class HexUtils {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexUtils() {
    }

    public static String bytesToHex(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int value = bytes[i] & 0xFF;
            hex[i * 2] = DIGITS[value >>> 4];
            hex[i * 2 + 1] = DIGITS[value & 0x0F];
        }
        return new String(hex);
    }

    /**
     * Decodes a hex string which has to consist of exactly {@code byteLength * 2} characters, case insensitive.
     *
     * @throws IllegalArgumentException if the string has another length or contains a character which is not a hex digit
     */
    public static byte[] hexToBytes(String hex, int byteLength) {
        if (hex.length() != byteLength * 2) {
            throw new IllegalArgumentException(String.format("Expected %d hex characters but got '%s'", byteLength * 2, hex));
        }
        byte[] bytes = new byte[byteLength];
        for (int i = 0; i < byteLength; i++) {
            int high = Character.digit(hex.charAt(i * 2), 16);
            int low = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("Not a hex encoded id: " + hex);
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }
}
