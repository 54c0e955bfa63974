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

package org.logpress.compression;

/**
 * 压缩器公共工具。
 *
 * <p>LZ4 与 LZO 的压缩块带有 8 字节头部:4 字节压缩后长度与 4 字节原始长度,均为小端序。
 * Zstd 帧自带长度信息,不使用该头部。
 */
public class CompressorUtils {

    public static final int HEADER_LENGTH = 8;

    public static void writeIntLE(int i, byte[] buf, int offset) {
        buf[offset++] = (byte) i;
        buf[offset++] = (byte) (i >>> 8);
        buf[offset++] = (byte) (i >>> 16);
        buf[offset] = (byte) (i >>> 24);
    }

    public static int readIntLE(byte[] buf, int i) {
        return (buf[i] & 0xFF)
                | ((buf[i + 1] & 0xFF) << 8)
                | ((buf[i + 2] & 0xFF) << 16)
                | ((buf[i + 3] & 0xFF) << 24);
    }

    /** 读取并校验 8 字节头部中的原始长度。 */
    static int readOriginalLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        if (srcOff < 0 || srcLen < HEADER_LENGTH || srcOff > src.length - srcLen) {
            throw new BufferDecompressionException("Input is corrupted, header is truncated.");
        }
        int compressedLen = readIntLE(src, srcOff);
        int originalLen = readIntLE(src, srcOff + 4);
        validateLength(compressedLen, originalLen);
        return originalLen;
    }

    /** 读取并校验 8 字节头部,返回原始长度。 */
    static int readAndValidateHeader(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = readOriginalLength(src, srcOff, srcLen);
        int compressedLen = readIntLE(src, srcOff);

        if (dst.length - dstOff < originalLen) {
            throw new BufferDecompressionException("Buffer length too small");
        }
        if (srcLen - HEADER_LENGTH < compressedLen) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }
        return originalLen;
    }

    public static void validateLength(int compressedLen, int originalLen)
            throws BufferDecompressionException {
        if (originalLen < 0
                || compressedLen < 0
                || (originalLen == 0 && compressedLen != 0)
                || (originalLen != 0 && compressedLen == 0)) {
            throw new BufferDecompressionException("Input is corrupted, invalid length.");
        }
    }

    private CompressorUtils() {}
}
