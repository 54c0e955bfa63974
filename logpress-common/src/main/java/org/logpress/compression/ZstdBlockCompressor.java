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

/**
 * 基于 zstd-jni 的块压缩器。
 *
 * <p>使用一次性压缩接口,zstd 会根据已知的源数据大小收缩窗口等参数,
 * 因此即使使用最高级别 22 压缩较小的段,内存占用也保持在较低水平。
 * 输出是完整的 zstd 帧,帧头自带原始长度,不额外写入头部。
 */
public class ZstdBlockCompressor implements BlockCompressor {

    private final int level;

    public ZstdBlockCompressor(int level) {
        this.level = level;
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        long bound = Zstd.compressBound(srcSize);
        if (bound > Integer.MAX_VALUE - 8) {
            throw new BufferCompressionException("Input of " + srcSize + " bytes is too large");
        }
        return (int) bound;
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        long size =
                Zstd.compressByteArray(
                        dst, dstOff, dst.length - dstOff, src, srcOff, srcLen, level);
        if (Zstd.isError(size)) {
            throw new BufferCompressionException(
                    "Zstd compression failed: " + Zstd.getErrorName(size));
        }
        return (int) size;
    }
}
