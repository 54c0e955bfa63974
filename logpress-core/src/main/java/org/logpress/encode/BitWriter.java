/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.logpress.encode;

import java.util.Arrays;

/** 高位在前的位写入器。 */
final class BitWriter {

    private byte[] buffer = new byte[32];
    private long bitLength;

    void writeBit(boolean bit) {
        int byteIndex = (int) (bitLength >>> 3);
        if (byteIndex >= buffer.length) {
            buffer = Arrays.copyOf(buffer, buffer.length * 2);
        }
        if (bit) {
            buffer[byteIndex] |= (byte) (0x80 >>> (bitLength & 7));
        }
        bitLength++;
    }

    /** 写入 {@code value} 的低 {@code count} 位。 */
    void writeBits(long value, int count) {
        for (int i = count - 1; i >= 0; i--) {
            writeBit(((value >>> i) & 1L) != 0);
        }
    }

    long bitLength() {
        return bitLength;
    }

    byte[] toByteArray() {
        return Arrays.copyOf(buffer, (int) ((bitLength + 7) >>> 3));
    }
}
