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
 * 块数据压缩器接口。
 *
 * <p>把一段连续字节压缩到目标数组中。调用方需要先通过 {@link #getMaxCompressedSize}
 * 分配足够大的目标数组。
 */
public interface BlockCompressor {

    /** 返回压缩 {@code srcSize} 字节时最多需要的目标空间。 */
    int getMaxCompressedSize(int srcSize);

    /**
     * 压缩源数组中的数据。
     *
     * @return 写入目标数组的字节数
     * @throws BufferCompressionException 如果压缩失败或目标空间不足
     */
    int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException;
}
