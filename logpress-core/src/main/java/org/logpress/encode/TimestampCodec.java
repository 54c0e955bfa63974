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

import org.logpress.classify.TimestampLayout;
import org.logpress.classify.TimestampLayouts;
import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;
import org.logpress.utils.LongArrayList;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * 时间戳列编码的公共部分。
 *
 * <p>整列使用同一个格式: 第一个可解析值所匹配的已知格式。只有解析后再格式化能得到相同原文的值
 * 走主路径,其余值进入例外列表。payload 布局: 例外列表、格式 id、主路径值个数、时间序列。
 */
abstract class TimestampCodec implements ValueCodec {

    /** 列中第一个可解析值的格式,都不可解析时返回 null。 */
    @Nullable
    static TimestampLayout detectLayout(List<String> values) {
        for (String value : values) {
            TimestampLayout layout = TimestampLayouts.detect(value);
            if (layout != null) {
                return layout;
            }
        }
        return null;
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        TimestampLayout layout = detectLayout(values);
        if (layout == null) {
            throw new IllegalArgumentException("Column contains no parsable timestamp");
        }
        ExceptionList.Builder exceptions = new ExceptionList.Builder();
        LongArrayList parsed = new LongArrayList(values.size());
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            Long millis = layout.parse(value);
            if (millis != null && layout.format(millis).equals(value)) {
                parsed.add(millis);
            } else {
                exceptions.add(i, value);
            }
        }

        DataOutputSerializer out = new DataOutputSerializer(64);
        exceptions.build().write(out);
        out.writeVarInt(layout.id());
        out.writeVarInt(parsed.size());
        writeTimestamps(out, parsed.toArray());
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public TimestampColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        TimestampLayout layout;
        try {
            layout = TimestampLayouts.byId(in.readVarInt());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        int count = in.readVarInt();
        if (count != column.valueCount() - exceptions.size()) {
            throw new IOException(
                    "Timestamp column holds "
                            + count
                            + " values but "
                            + (column.valueCount() - exceptions.size())
                            + " were expected");
        }
        long[] parsed = readTimestamps(in, count);

        long[] millis = new long[column.valueCount()];
        int next = 0;
        for (int row = 0; row < millis.length; row++) {
            if (!exceptions.containsRow(row)) {
                millis[row] = parsed[next++];
            }
        }
        return new TimestampColumn(layout, millis, exceptions);
    }

    abstract void writeTimestamps(DataOutputSerializer out, long[] values) throws IOException;

    abstract long[] readTimestamps(DataInputDeserializer in, int count) throws IOException;

    static byte[] readBlock(DataInputDeserializer in) throws IOException {
        int length = in.readVarInt();
        if (length < 0 || length > in.available()) {
            throw new IOException("Block of " + length + " bytes exceeds the payload");
        }
        byte[] block = new byte[length];
        in.readFully(block);
        return block;
    }
}
