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

import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;
import org.logpress.utils.DeltaVarintCompressor;

import java.io.IOException;

/** 时间戳 delta 编码: 首值绝对值,之后为相邻差值,都经 zigzag + varint 编码。 */
public class DeltaTimestampCodec extends TimestampCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.TIMESTAMP_DELTA;
    }

    @Override
    void writeTimestamps(DataOutputSerializer out, long[] values) throws IOException {
        byte[] block = DeltaVarintCompressor.compress(values);
        out.writeVarInt(block.length);
        out.write(block);
    }

    @Override
    long[] readTimestamps(DataInputDeserializer in, int count) throws IOException {
        long[] values;
        try {
            values = DeltaVarintCompressor.decompress(readBlock(in));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed delta timestamp block", e);
        }
        if (values.length != count) {
            throw new IOException(
                    "Delta block holds " + values.length + " timestamps, expected " + count);
        }
        return values;
    }
}
