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

import io.airlift.compress.Decompressor;
import io.airlift.compress.MalformedInputException;

import static org.logpress.compression.CompressorUtils.HEADER_LENGTH;
import static org.logpress.compression.CompressorUtils.readAndValidateHeader;
import static org.logpress.compression.CompressorUtils.readIntLE;
import static org.logpress.compression.CompressorUtils.readOriginalLength;

/** 解压缩 {@link AirBlockCompressor} 的输出。 */
public class AirBlockDecompressor implements BlockDecompressor {

    private final Decompressor internalDecompressor;

    public AirBlockDecompressor(Decompressor internalDecompressor) {
        this.internalDecompressor = internalDecompressor;
    }

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        final int originalLen = readAndValidateHeader(src, srcOff, srcLen, dst, dstOff);
        final int compressedLen = readIntLE(src, srcOff);

        try {
            final int decompressedLen =
                    internalDecompressor.decompress(
                            src, srcOff + HEADER_LENGTH, compressedLen, dst, dstOff, originalLen);
            if (originalLen != decompressedLen) {
                throw new BufferDecompressionException("Input is corrupted");
            }
        } catch (MalformedInputException e) {
            throw new BufferDecompressionException("Input is corrupted", e);
        }

        return originalLen;
    }

    @Override
    public int decompressedLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        return readOriginalLength(src, srcOff, srcLen);
    }
}
