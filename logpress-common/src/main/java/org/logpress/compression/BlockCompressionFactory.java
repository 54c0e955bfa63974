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

import io.airlift.compress.lzo.LzoCompressor;
import io.airlift.compress.lzo.LzoDecompressor;

import javax.annotation.Nullable;

/**
 * 块压缩工厂接口。
 *
 * <p>每种压缩算法都有一个实现来创建压缩器和解压缩器。写容器时按配置创建,
 * 读容器时按页脚里记录的 {@link BlockCompressionType} 创建。
 */
public interface BlockCompressionFactory {

    BlockCompressionType getCompressionType();

    BlockCompressor getCompressor();

    BlockDecompressor getDecompressor();

    /**
     * 根据配置创建 {@link BlockCompressionFactory}。
     *
     * @param compression 压缩选项配置
     * @return 对应的压缩工厂,如果不压缩则返回 null
     * @throws IllegalArgumentException 如果压缩算法未知
     */
    @Nullable
    static BlockCompressionFactory create(CompressOptions compression) {
        return create(
                BlockCompressionType.fromName(compression.compress()), compression.zstdLevel());
    }

    /**
     * 根据压缩类型创建 {@link BlockCompressionFactory}。解压缩不需要级别,读取端可传任意值。
     *
     * @return 对应的压缩工厂,如果不压缩则返回 null
     */
    @Nullable
    static BlockCompressionFactory create(BlockCompressionType compression, int zstdLevel) {
        switch (compression) {
            case NONE:
                return null;
            case ZSTD:
                return new ZstdBlockCompressionFactory(zstdLevel);
            case LZ4:
                return new Lz4BlockCompressionFactory();
            case LZO:
                return new AirCompressorFactory(
                        BlockCompressionType.LZO, new LzoCompressor(), new LzoDecompressor());
            default:
                throw new IllegalStateException("Unknown CompressionMethod " + compression);
        }
    }
}
