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

package org.logpress.container;

/**
 * 容器二进制格式定义。
 *
 * <pre>
 *  ______________________________________
 * |  magic 'L' 'S' 'C' 0x00 ｜ version   |     HEADER (5 字节)
 * |--------------------------------------|
 * |  meta                                |
 * |--------------------------------------|
 * |  rows/T000                           |
 * |--------------------------------------|
 * |  col/T000/timestamp                  |
 * |--------------------------------------|
 * |  col/T000/severity                   |     SECTIONS (各自独立块压缩)
 * |--------------------------------------|
 * |  ...                                 |
 * |--------------------------------------|
 * |  pool                                |
 * |--------------------------------------|
 * |  section count                       |
 * |  name ｜offset｜length｜raw length    |     FOOTER
 * |  compression ｜crc32                 |
 * |  ...                                 |
 * |--------------------------------------|
 * |  footer offset ｜footer length｜magic|     TRAILER (16 字节)
 * |______________________________________|
 *
 * 字段说明:
 * - version:        1 字节,当前为 1
 * - meta:           模板定义、槽位、列编码 id,字面量以词元池下标引用
 * - rows/id:        该模板所匹配行的全局行号,delta-varint 编码
 * - col/id/slot:    一列的编码数据,按模板、槽位顺序排列
 * - pool:           词元池
 * - offset:         8 字节,段在文件中的起始位置
 * - length:         4 字节,段在文件中的长度
 * - raw length:     4 字节,段压缩前的长度
 * - compression:    1 字节,块压缩类型的持久化 id
 * - crc32:          4 字节,段压缩前数据的 CRC32
 * - footer offset:  8 字节,footer length: 4 字节
 * </pre>
 *
 * <p>每个段单独压缩,读取任意一列只需要解压该段,footer 中的偏移直接指向文件中的位置。
 */
public final class ContainerFormat {

    static final byte[] MAGIC = {'L', 'S', 'C', 0x00};

    static final int HEADER_LENGTH = MAGIC.length + 1;

    static final int TRAILER_LENGTH = 8 + 4 + MAGIC.length;

    static final String META_SECTION = "meta";

    static final String POOL_SECTION = "pool";

    /** 容器格式版本。 */
    enum Version {
        V_1(1);

        private final int version;

        Version(int version) {
            this.version = version;
        }

        int version() {
            return version;
        }

        static Version current() {
            return V_1;
        }
    }

    private ContainerFormat() {}

    static String rowsSection(String templateId) {
        return "rows/" + templateId;
    }

    static String columnSection(String templateId, String slotName) {
        return "col/" + templateId + "/" + slotName;
    }

    static boolean hasMagic(byte[] bytes, int offset) {
        if (offset < 0 || offset + MAGIC.length > bytes.length) {
            return false;
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (bytes[offset + i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
