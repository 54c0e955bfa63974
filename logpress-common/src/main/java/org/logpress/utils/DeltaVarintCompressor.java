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

package org.logpress.utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

/**
 * Delta 编码和 Varints 编码的组合压缩器。
 *
 * <p>适用于递增或差异不大的整数序列压缩,通过以下步骤实现高效压缩:
 * <ol>
 *   <li>Delta 编码 - 存储相邻元素之间的差值而非原始值
 *   <li>ZigZag 变换 - 将有符号整数映射为无符号整数,优化负数编码
 *   <li>Varints 编码 - 使用变长编码,小数字占用更少字节
 * </ol>
 *
 * <p>容器用它保存每个模板所匹配日志行的全局行号,以及时间戳列的 delta 编码。
 * 行号严格递增,相邻差值通常为 1 或很小的数,几乎每个值只占 1 字节。
 */
public class DeltaVarintCompressor {

    /**
     * 压缩长整型数组。
     *
     * @param data 待压缩的长整型数组
     * @return 压缩后的字节数组,空数组压缩为空字节数组
     */
    public static byte[] compress(long[] data) {
        if (data == null || data.length == 0) {
            return new byte[0];
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
        // Store the first element
        encodeVarint(data[0], out);
        for (int i = 1; i < data.length; i++) {
            encodeVarint(data[i] - data[i - 1], out);
        }
        return out.toByteArray();
    }

    /**
     * 解压缩字节数组,恢复原始长整型数组。
     *
     * @param compressed 压缩数据
     * @return 原始数组
     * @throws IllegalArgumentException 数据被截断或 varint 溢出
     */
    public static long[] decompress(byte[] compressed) {
        if (compressed == null || compressed.length == 0) {
            return new long[0];
        }

        ByteArrayInputStream in = new ByteArrayInputStream(compressed);
        LongArrayList values = new LongArrayList(compressed.length);
        long previous = 0;
        while (in.available() > 0) {
            // Reconstruct using deltas
            previous = values.isEmpty() ? decodeVarint(in) : previous + decodeVarint(in);
            values.add(previous);
        }
        return values.toArray();
    }

    private static void encodeVarint(long value, ByteArrayOutputStream out) {
        long tmp = VarLengthIntUtils.zigZagEncode(value);
        while ((tmp & ~0x7FL) != 0) {
            // Set MSB to 1 (continuation)
            out.write(((int) tmp & 0x7F) | 0x80);
            tmp >>>= 7;
        }
        out.write((byte) tmp);
    }

    private static long decodeVarint(ByteArrayInputStream in) {
        long result = 0;
        int shift = 0;
        while (true) {
            long b = in.read();
            if (b == -1) {
                throw new IllegalArgumentException("Unexpected end of input");
            }
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                break;
            }
            shift += 7;
            if (shift > 63) {
                throw new IllegalArgumentException("Varint overflow");
            }
        }
        return VarLengthIntUtils.zigZagDecode(result);
    }
}
