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

import java.io.IOException;
import java.util.List;

/**
 * 整数列的 zigzag + varint 编码。
 *
 * <p>只有规范的十进制整数走主路径(没有前导零和正号,也不是 {@code -0}),
 * 保证格式化后与原文一致;其余值进入例外列表。
 */
public class ZigZagVarintCodec implements ValueCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.ZIGZAG_VARINT;
    }

    /** 值是否为规范的十进制 long。 */
    public static boolean isCanonical(String value) {
        if (value.isEmpty() || value.length() > 20) {
            return false;
        }
        try {
            return Long.toString(Long.parseLong(value)).equals(value);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        ExceptionList.Builder exceptions = new ExceptionList.Builder();
        DataOutputSerializer primary = new DataOutputSerializer(Math.max(16, values.size()));
        int count = 0;
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (isCanonical(value)) {
                primary.writeZigZagLong(Long.parseLong(value));
                count++;
            } else {
                exceptions.add(i, value);
            }
        }

        DataOutputSerializer out = new DataOutputSerializer(primary.length() + 16);
        exceptions.build().write(out);
        out.writeVarInt(count);
        out.write(primary.getSharedBuffer(), 0, primary.length());
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public StringColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        int count = in.readVarInt();
        if (count != column.valueCount() - exceptions.size()) {
            throw new IOException(
                    "Integer column holds "
                            + count
                            + " values, expected "
                            + (column.valueCount() - exceptions.size()));
        }
        String[] values = new String[column.valueCount()];
        int exception = 0;
        for (int row = 0; row < values.length; row++) {
            if (exception < exceptions.size() && exceptions.row(exception) == row) {
                values[row] = exceptions.value(exception++);
            } else {
                values[row] = Long.toString(in.readZigZagLong());
            }
        }
        return new StringColumn(values);
    }
}
