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
 * 整数下标流的 RLE 后处理。
 *
 * <p>格式: 一个标志字节,之后是值的个数。
 * <ul>
 *   <li>标志 0: 逐个 varint
 *   <li>标志 1: 若干分组,每组以 varint 头 {@code (length << 1) | isRun} 开始;
 *       游程组后跟一个值,字面组后跟 {@code length} 个值
 * </ul>
 *
 * <p>只有存在长度不小于 {@code minRun} 的游程、且 RLE 形式更小时才使用标志 1,
 * 避免在噪声较多的列上得不偿失。
 */
public class RunLengthEncoding {

    static final int PLAIN = 0;
    static final int RLE = 1;

    private RunLengthEncoding() {}

    public static void write(DataOutputSerializer out, int[] values, int minRun)
            throws IOException {
        DataOutputSerializer plain = new DataOutputSerializer(Math.max(16, values.length));
        plain.writeByte(PLAIN);
        plain.writeVarInt(values.length);
        for (int value : values) {
            plain.writeVarInt(value);
        }

        if (hasRun(values, minRun)) {
            DataOutputSerializer rle = new DataOutputSerializer(16);
            rle.writeByte(RLE);
            rle.writeVarInt(values.length);
            writeGroups(rle, values, minRun);
            if (rle.length() < plain.length()) {
                out.write(rle.getSharedBuffer(), 0, rle.length());
                return;
            }
        }
        out.write(plain.getSharedBuffer(), 0, plain.length());
    }

    /**
     * 读取下标流。
     *
     * @param expectedCount 调用方已知的值个数,与流中记录的不一致时视为数据损坏
     */
    public static int[] read(DataInputDeserializer in, int expectedCount) throws IOException {
        int flag = in.readUnsignedByte();
        int count = in.readVarInt();
        if (count != expectedCount) {
            throw new IOException("Expected " + expectedCount + " values but found " + count);
        }
        int[] values = new int[count];
        if (flag == PLAIN) {
            for (int i = 0; i < count; i++) {
                values[i] = in.readVarInt();
            }
            return values;
        }
        if (flag != RLE) {
            throw new IOException("Unknown run length flag " + flag);
        }

        int position = 0;
        while (position < count) {
            int header = in.readVarInt();
            int length = header >>> 1;
            if (length == 0 || length > count - position) {
                throw new IOException("Invalid run length group of " + length + " values");
            }
            if ((header & 1) == 1) {
                int value = in.readVarInt();
                for (int i = 0; i < length; i++) {
                    values[position++] = value;
                }
            } else {
                for (int i = 0; i < length; i++) {
                    values[position++] = in.readVarInt();
                }
            }
        }
        return values;
    }

    private static boolean hasRun(int[] values, int minRun) {
        int run = 1;
        for (int i = 1; i < values.length; i++) {
            run = values[i] == values[i - 1] ? run + 1 : 1;
            if (run >= minRun) {
                return true;
            }
        }
        return minRun <= 1 && values.length > 0;
    }

    private static void writeGroups(DataOutputSerializer out, int[] values, int minRun)
            throws IOException {
        int literalStart = 0;
        int i = 0;
        while (i < values.length) {
            int runEnd = i + 1;
            while (runEnd < values.length && values[runEnd] == values[i]) {
                runEnd++;
            }
            if (runEnd - i >= minRun) {
                writeLiterals(out, values, literalStart, i);
                out.writeVarInt(((runEnd - i) << 1) | 1);
                out.writeVarInt(values[i]);
                literalStart = runEnd;
            }
            i = runEnd;
        }
        writeLiterals(out, values, literalStart, values.length);
    }

    private static void writeLiterals(DataOutputSerializer out, int[] values, int from, int to)
            throws IOException {
        if (from >= to) {
            return;
        }
        out.writeVarInt((to - from) << 1);
        for (int i = from; i < to; i++) {
            out.writeVarInt(values[i]);
        }
    }
}
