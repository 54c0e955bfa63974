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

import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;

import java.io.IOException;

/**
 * Gorilla 风格的时间戳编码,适合间隔非常规律的序列。
 *
 * <p>位流布局:
 * <ul>
 *   <li>首值 64 位
 *   <li>首个差值: 标志位 0 后跟 32 位,标志位 1 后跟 64 位
 *   <li>之后每个值写 delta-of-delta: {@code 0} 表示 0;{@code 10} 后跟 7 位;{@code 110} 后跟
 *       9 位;{@code 1110} 后跟 12 位;{@code 1111} 后跟标志位,0 为 32 位,1 为 64 位
 * </ul>
 *
 * <p>所有定长字段都是补码有符号数。
 */
public class GorillaTimestampCodec extends TimestampCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.TIMESTAMP_GORILLA;
    }

    @Override
    void writeTimestamps(DataOutputSerializer out, long[] values) throws IOException {
        BitWriter bits = new BitWriter();
        if (values.length > 0) {
            bits.writeBits(values[0], 64);
        }
        if (values.length > 1) {
            long delta = values[1] - values[0];
            writeWide(bits, delta);
            long previousDelta = delta;
            for (int i = 2; i < values.length; i++) {
                delta = values[i] - values[i - 1];
                writeDeltaOfDelta(bits, delta - previousDelta);
                previousDelta = delta;
            }
        }
        byte[] block = bits.toByteArray();
        out.writeVarInt(block.length);
        out.write(block);
    }

    @Override
    long[] readTimestamps(DataInputDeserializer in, int count) throws IOException {
        BitReader bits = new BitReader(readBlock(in));
        long[] values = new long[count];
        if (count > 0) {
            values[0] = bits.readBits(64);
        }
        if (count > 1) {
            long delta = readWide(bits);
            values[1] = values[0] + delta;
            for (int i = 2; i < count; i++) {
                delta += readDeltaOfDelta(bits);
                values[i] = values[i - 1] + delta;
            }
        }
        return values;
    }

    private static void writeDeltaOfDelta(BitWriter bits, long dod) {
        if (dod == 0) {
            bits.writeBit(false);
        } else if (fits(dod, 7)) {
            bits.writeBits(0b10, 2);
            bits.writeBits(dod, 7);
        } else if (fits(dod, 9)) {
            bits.writeBits(0b110, 3);
            bits.writeBits(dod, 9);
        } else if (fits(dod, 12)) {
            bits.writeBits(0b1110, 4);
            bits.writeBits(dod, 12);
        } else {
            bits.writeBits(0b1111, 4);
            writeWide(bits, dod);
        }
    }

    private static long readDeltaOfDelta(BitReader bits) throws IOException {
        if (!bits.readBit()) {
            return 0;
        }
        if (!bits.readBit()) {
            return bits.readSigned(7);
        }
        if (!bits.readBit()) {
            return bits.readSigned(9);
        }
        if (!bits.readBit()) {
            return bits.readSigned(12);
        }
        return readWide(bits);
    }

    private static void writeWide(BitWriter bits, long value) {
        if (fits(value, 32)) {
            bits.writeBit(false);
            bits.writeBits(value, 32);
        } else {
            bits.writeBit(true);
            bits.writeBits(value, 64);
        }
    }

    private static long readWide(BitReader bits) throws IOException {
        return bits.readBit() ? bits.readBits(64) : bits.readSigned(32);
    }

    /** 是否能用 {@code width} 位补码表示。 */
    private static boolean fits(long value, int width) {
        long min = -(1L << (width - 1));
        long max = (1L << (width - 1)) - 1;
        return value >= min && value <= max;
    }
}
