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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the block compressors created by {@link BlockCompressionFactory}. */
public class BlockCompressionTest {

    private static byte[] sampleSection() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            builder.append("[2005-06-09 06:07:0")
                    .append(i % 10)
                    .append("] [INFO] jk2_init() Found child ")
                    .append(6725 + i)
                    .append('\n');
        }
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    public void testCompressAndDecompress(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 22);
        assertThat(factory).isNotNull();
        assertThat(factory.getCompressionType()).isEqualTo(type);

        byte[] raw = sampleSection();
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length)];
        int compressedLength = compressor.compress(raw, 0, raw.length, compressed, 0);
        assertThat(compressedLength).isLessThan(raw.length);

        byte[] restored = new byte[raw.length];
        int restoredLength =
                factory.getDecompressor()
                        .decompress(compressed, 0, compressedLength, restored, 0);
        assertThat(restoredLength).isEqualTo(raw.length);
        assertThat(restored).isEqualTo(raw);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    public void testTruncatedInputIsRejected(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 3);
        byte[] raw = sampleSection();
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length)];
        int compressedLength = compressor.compress(raw, 0, raw.length, compressed, 0);

        byte[] truncated = Arrays.copyOf(compressed, compressedLength / 2);
        byte[] restored = new byte[raw.length];
        assertThatThrownBy(
                        () ->
                                factory.getDecompressor()
                                        .decompress(truncated, 0, truncated.length, restored, 0))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    public void testDecompressedLength(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 3);
        byte[] raw = sampleSection();
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length) + 7];
        int compressedLength = compressor.compress(raw, 0, raw.length, compressed, 7);

        assertThat(factory.getDecompressor().decompressedLength(compressed, 7, compressedLength))
                .isEqualTo(raw.length);
        assertThatThrownBy(() -> factory.getDecompressor().decompressedLength(compressed, 7, 3))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @Test
    public void testCorruptedZstdFrameHeaderIsRejected() {
        BlockCompressionFactory factory =
                BlockCompressionFactory.create(BlockCompressionType.ZSTD, 3);
        byte[] raw = sampleSection();
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length)];
        int compressedLength = compressor.compress(raw, 0, raw.length, compressed, 0);
        compressed[0] ^= (byte) 0xFF;

        BlockDecompressor decompressor = factory.getDecompressor();
        byte[] restored = new byte[raw.length];
        assertThatThrownBy(
                        () -> decompressor.decompress(compressed, 0, compressedLength, restored, 0))
                .isInstanceOf(BufferDecompressionException.class);
        assertThatThrownBy(() -> decompressor.decompressedLength(compressed, 0, compressedLength))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @Test
    public void testFlippedZstdBytesOnlyRaiseDecompressionErrors() {
        BlockCompressionFactory factory =
                BlockCompressionFactory.create(BlockCompressionType.ZSTD, 3);
        byte[] raw = sampleSection();
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length)];
        int compressedLength = compressor.compress(raw, 0, raw.length, compressed, 0);

        BlockDecompressor decompressor = factory.getDecompressor();
        int rejected = 0;
        for (int i = 0; i < compressedLength; i++) {
            byte[] corrupted = Arrays.copyOf(compressed, compressedLength);
            corrupted[i] ^= (byte) 0x5A;
            byte[] restored = new byte[raw.length];
            // any exception other than BufferDecompressionException fails the test
            try {
                decompressor.decompress(corrupted, 0, compressedLength, restored, 0);
            } catch (BufferDecompressionException e) {
                rejected++;
            }
        }
        assertThat(rejected).isPositive();
    }

    @Test
    public void testCreateFromOptions() {
        assertThat(BlockCompressionFactory.create(new CompressOptions("none", 1))).isNull();
        assertThat(BlockCompressionFactory.create(new CompressOptions("Zstd", 9)))
                .isInstanceOf(ZstdBlockCompressionFactory.class);
        assertThat(BlockCompressionFactory.create(new CompressOptions("lz4", 1)))
                .isInstanceOf(Lz4BlockCompressionFactory.class);
        assertThatThrownBy(() -> BlockCompressionFactory.create(new CompressOptions("brotli", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPersistentIds() {
        for (BlockCompressionType type : BlockCompressionType.values()) {
            assertThat(BlockCompressionType.getCompressionTypeByPersistentId(type.persistentId()))
                    .isEqualTo(type);
        }
        assertThatThrownBy(() -> BlockCompressionType.getCompressionTypeByPersistentId(42))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
