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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * 变长整数编码工具类。
 *
 * <p>采用 7 位分组的 varint 格式:每个字节的低 7 位存放数据,最高位表示后面是否还有字节。
 * 小数值只占 1 个字节,适合行号、字典下标、词元池下标等大多数情况下很小的非负整数。
 *
 * <p>有符号值先经过 ZigZag 变换({@code (v << 1) ^ (v >> 63)})映射为非负数再编码,
 * 这样绝对值小的负数同样只占很少的字节。
 *
 * <h2>编码长度</h2>
 * <ul>
 *   <li>0-127: 1 字节
 *   <li>128-16383: 2 字节
 *   <li>int 最多 5 字节,long 最多 10 字节
 * </ul>
 */
public final class VarLengthIntUtils {

    public static final int MAX_VAR_LONG_SIZE = 10;

    public static final int MAX_VAR_INT_SIZE = 5;

    /** ZigZag 变换,将有符号 long 映射为无符号表示。 */
    public static long zigZagEncode(long value) {
        return (value << 1) ^ (value >> 63);
    }

    /** ZigZag 逆变换。 */
    public static long zigZagDecode(long value) {
        return (value >>> 1) ^ -(value & 1);
    }

    /**
     * 编码非负 long 到输出流。
     *
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果 value 为负数
     */
    public static int encodeLong(DataOutput os, long value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("negative value: v=" + value);
        }
        return encodeUnsignedLong(os, value);
    }

    /** 先 ZigZag 变换再编码任意 long。 */
    public static int encodeSignedLong(DataOutput os, long value) throws IOException {
        return encodeUnsignedLong(os, zigZagEncode(value));
    }

    private static int encodeUnsignedLong(DataOutput os, long value) throws IOException {
        int i = 1;
        while ((value & ~0x7FL) != 0) {
            os.write((((int) value & 0x7F) | 0x80));
            value >>>= 7;
            i++;
        }
        os.write((byte) value);
        return i;
    }

    /**
     * 从输入流解码 long。
     *
     * @throws IOException 数据不足或编码超过 10 字节
     */
    public static long decodeLong(DataInput is) throws IOException {
        long result = 0;
        for (int offset = 0; offset < 64; offset += 7) {
            long b = is.readUnsignedByte();
            result |= (b & 0x7F) << offset;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("Malformed long.");
    }

    public static long decodeSignedLong(DataInput is) throws IOException {
        return zigZagDecode(decodeLong(is));
    }

    /**
     * 编码非负 int 到输出流。
     *
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果 value 为负数
     */
    public static int encodeInt(DataOutput os, int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("negative value: v=" + value);
        }

        int i = 1;
        while ((value & ~0x7F) != 0) {
            os.write(((value & 0x7F) | 0x80));
            value >>>= 7;
            i++;
        }

        os.write((byte) value);
        return i;
    }

    /**
     * 从输入流解码非负 int。
     *
     * @throws IOException 数据不足、编码超过 5 字节或结果为负
     */
    public static int decodeInt(DataInput is) throws IOException {
        for (int offset = 0, result = 0; offset < 32; offset += 7) {
            int b = is.readUnsignedByte();
            result |= (b & 0x7F) << offset;
            if ((b & 0x80) == 0) {
                if (result < 0) {
                    throw new IOException("Malformed integer.");
                }
                return result;
            }
        }
        throw new IOException("Malformed integer.");
    }

    /** 计算非负 long 编码后的字节数。 */
    public static int encodedLongSize(long value) {
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            value >>>= 7;
            size++;
        }
        return size;
    }

    private VarLengthIntUtils() {}
}
