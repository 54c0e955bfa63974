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

import java.io.EOFException;

/** 与 {@link BitWriter} 配对的位读取器。 */
final class BitReader {

    private final byte[] data;
    private final long limit;
    private long position;

    BitReader(byte[] data) {
        this.data = data;
        this.limit = (long) data.length * 8;
    }

    boolean readBit() throws EOFException {
        if (position >= limit) {
            throw new EOFException("Bit stream exhausted");
        }
        int b = data[(int) (position >>> 3)] & 0xff;
        boolean bit = (b & (0x80 >>> (position & 7))) != 0;
        position++;
        return bit;
    }

    long readBits(int count) throws EOFException {
        long value = 0;
        for (int i = 0; i < count; i++) {
            value = (value << 1) | (readBit() ? 1L : 0L);
        }
        return value;
    }

    /** 读取 {@code count} 位的补码有符号数。 */
    long readSigned(int count) throws EOFException {
        long value = readBits(count);
        if (count < 64 && (value & (1L << (count - 1))) != 0) {
            value |= -1L << count;
        }
        return value;
    }
}
