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

import org.logpress.compression.BlockCompressionType;
import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;

import java.io.IOException;

/** footer 中一个段的描述: 名称、在文件中的位置与长度、原始长度、压缩类型和校验和。 */
public final class SectionDescriptor {

    private final String name;
    private final long offset;
    private final int length;
    private final int rawLength;
    private final BlockCompressionType compression;
    private final int crc32;

    public SectionDescriptor(
            String name,
            long offset,
            int length,
            int rawLength,
            BlockCompressionType compression,
            int crc32) {
        this.name = name;
        this.offset = offset;
        this.length = length;
        this.rawLength = rawLength;
        this.compression = compression;
        this.crc32 = crc32;
    }

    public String name() {
        return name;
    }

    public long offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public int rawLength() {
        return rawLength;
    }

    public BlockCompressionType compression() {
        return compression;
    }

    public int crc32() {
        return crc32;
    }

    void write(DataOutputSerializer out) throws IOException {
        out.writeString(name);
        out.writeLong(offset);
        out.writeInt(length);
        out.writeInt(rawLength);
        out.writeByte(compression.persistentId());
        out.writeInt(crc32);
    }

    static SectionDescriptor read(DataInputDeserializer in) throws IOException {
        String name = in.readString();
        long offset = in.readLong();
        int length = in.readInt();
        int rawLength = in.readInt();
        int compressionId = in.readUnsignedByte();
        int crc32 = in.readInt();
        BlockCompressionType compression;
        try {
            compression = BlockCompressionType.getCompressionTypeByPersistentId(compressionId);
        } catch (IllegalArgumentException e) {
            throw new CorruptContainerException(
                    "Unknown compression id " + compressionId + " for section " + name, e);
        }
        return new SectionDescriptor(name, offset, length, rawLength, compression, crc32);
    }

    @Override
    public String toString() {
        return String.format(
                "%s@%d[%d->%d, %s]", name, offset, rawLength, length, compression);
    }
}
