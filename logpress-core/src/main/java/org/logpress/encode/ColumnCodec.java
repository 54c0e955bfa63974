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

package org.logpress.encode;

/**
 * 列编码方式。持久化 ID 写入容器元数据,不能修改。
 *
 * <p>每种编码对应一个 {@link ValueCodec} 实现,通过 {@link ValueCodecs#of} 查找。
 */
public enum ColumnCodec {
    /** 首值绝对值,之后为相邻差值,zigzag + varint。 */
    TIMESTAMP_DELTA(1),
    /** Gorilla 风格的 delta-of-delta 位打包。 */
    TIMESTAMP_GORILLA(2),
    /** 首次出现顺序的字典加下标流。 */
    DICTIONARY(3),
    /** 规范十进制整数,zigzag + varint。 */
    ZIGZAG_VARINT(4),
    /** 定长 8 字节 double。 */
    DOUBLE(5),
    /** 全局词元池下标。 */
    POOL_INDEX(6),
    /** 原文。 */
    VERBATIM(7);

    private final int persistentId;

    ColumnCodec(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return persistentId;
    }

    public static ColumnCodec fromPersistentId(int persistentId) {
        for (ColumnCodec codec : values()) {
            if (codec.persistentId == persistentId) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown column codec id " + persistentId);
    }
}
