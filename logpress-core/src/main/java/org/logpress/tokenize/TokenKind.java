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

package org.logpress.tokenize;

/**
 * 词元类别。
 *
 * <p>持久化 ID 写入容器元数据(模板槽位记录其覆盖的词元类别),因此不能修改。
 */
public enum TokenKind {
    /** 括号包裹的片段,包括嵌套括号,如 {@code [INFO]}、{@code (Fedora)}。 */
    BRACKET(0),
    /** 空白与分隔符的连续序列。 */
    DELIMITER(1),
    /** 引号包裹的片段。 */
    QUOTED(2),
    /** 字母、数字及词内连接符的连续序列。 */
    ALPHANUMERIC(3),
    /** 其他单个字符。 */
    SPECIAL(4);

    private final int persistentId;

    TokenKind(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return persistentId;
    }

    public static TokenKind fromPersistentId(int persistentId) {
        for (TokenKind kind : values()) {
            if (kind.persistentId == persistentId) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown token kind id " + persistentId);
    }
}
