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

/** 块数据解压缩器接口,与 {@link BlockCompressor} 配对使用。 */
public interface BlockDecompressor {

    /**
     * 解压缩源数组中的数据。目标数组从 {@code dstOff} 开始的剩余空间必须能容纳原始数据。
     *
     * @return 解压缩后的字节数
     * @throws BufferDecompressionException 如果输入被破坏或目标空间不足
     */
    int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException;

    /**
     * 读取压缩数据自带的原始长度,不解压缩。调用方可据此在分配目标数组前校验长度。
     *
     * @throws BufferDecompressionException 如果头部被破坏或不包含原始长度
     */
    int decompressedLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException;
}
