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

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;

import java.util.Arrays;

/**
 * 解压缩 {@link ZstdBlockCompressor} 输出的 zstd 帧。
 *
 * <p>zstd-jni 对损坏的帧抛出非受检的 {@link ZstdException},这里统一转换为
 * {@link BufferDecompressionException}。
 */
public class ZstdBlockDecompressor implements BlockDecompressor {

    /** zstd 帧头的最大长度: 4 字节魔数加最多 14 字节帧描述。 */
    private static final int MAX_FRAME_HEADER_LENGTH = 18;

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        checkSource(src, srcOff, srcLen);
        long size;
        try {
            size = Zstd.decompressByteArray(dst, dstOff, dst.length - dstOff, src, srcOff, srcLen);
        } catch (ZstdException e) {
            throw new BufferDecompressionException("Input is corrupted: " + e.getMessage(), e);
        }
        if (Zstd.isError(size)) {
            throw new BufferDecompressionException(
                    "Input is corrupted: " + Zstd.getErrorName(size));
        }
        return (int) size;
    }

    @Override
    public int decompressedLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        checkSource(src, srcOff, srcLen);
        byte[] header =
                Arrays.copyOfRange(src, srcOff, srcOff + Math.min(srcLen, MAX_FRAME_HEADER_LENGTH));
        long size;
        try {
            size = Zstd.getFrameContentSize(header);
        } catch (ZstdException e) {
            throw new BufferDecompressionException("Input is corrupted: " + e.getMessage(), e);
        }
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new BufferDecompressionException(
                    "Input is corrupted, frame content size is unknown or invalid.");
        }
        return (int) size;
    }

    private static void checkSource(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        if (srcOff < 0 || srcLen < 0 || srcOff > src.length - srcLen) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }
    }
}
