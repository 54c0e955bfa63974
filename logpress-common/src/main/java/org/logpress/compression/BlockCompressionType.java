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

import java.util.Locale;

/**
 * 块压缩类型枚举。
 *
 * <p>每种压缩类型都有一个持久化 ID,写入容器页脚的段描述中,读取时据此选择解压缩器。
 * 因此 ID 一旦发布就不能修改。
 */
public enum BlockCompressionType {
    /** 不压缩 */
    NONE(0),
    /** Zstandard 压缩算法 */
    ZSTD(1),
    /** LZ4 压缩算法 */
    LZ4(2),
    /** LZO 压缩算法 */
    LZO(3);

    /** 持久化 ID,用于在存储中标识压缩类型 */
    private final int persistentId;

    BlockCompressionType(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return this.persistentId;
    }

    /**
     * 根据持久化 ID 获取压缩类型。
     *
     * @throws IllegalArgumentException 如果 ID 未知
     */
    public static BlockCompressionType getCompressionTypeByPersistentId(int persistentId) {
        for (BlockCompressionType type : values()) {
            if (type.persistentId == persistentId) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unknown persistentId " + persistentId);
    }

    /**
     * 根据配置中的名称(不区分大小写)获取压缩类型。
     *
     * @throws IllegalArgumentException 如果名称未知
     */
    public static BlockCompressionType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown compression '" + name + "'", e);
        }
    }
}
