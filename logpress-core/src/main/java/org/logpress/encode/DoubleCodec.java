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
 * 浮点列的定长 8 字节编码。
 *
 * <p>只有 {@link Double#toString(double)} 能还原出原文的值走主路径,例如 {@code 0.25};
 * {@code 1.50}、{@code 100} 这样的写法进入例外列表。
 */
public class DoubleCodec implements ValueCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.DOUBLE;
    }

    /** 值能否由 double 精确还原。 */
    public static boolean isExact(String value) {
        if (value.isEmpty() || value.length() > 32) {
            return false;
        }
        char first = value.charAt(0);
        if (first != '-' && !Character.isDigit(first)) {
            // rejects NaN, Infinity and hex floats
            return false;
        }
        try {
            return Double.toString(Double.parseDouble(value)).equals(value);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        ExceptionList.Builder exceptions = new ExceptionList.Builder();
        DataOutputSerializer primary = new DataOutputSerializer(Math.max(16, values.size() * 8));
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (isExact(value)) {
                primary.writeDouble(Double.parseDouble(value));
            } else {
                exceptions.add(i, value);
            }
        }

        DataOutputSerializer out = new DataOutputSerializer(primary.length() + 16);
        exceptions.build().write(out);
        out.write(primary.getSharedBuffer(), 0, primary.length());
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public StringColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        int expected = column.valueCount() - exceptions.size();
        if (in.available() != expected * 8) {
            throw new IOException(
                    "Double column holds " + in.available() + " bytes, expected " + expected * 8);
        }
        String[] values = new String[column.valueCount()];
        int exception = 0;
        for (int row = 0; row < values.length; row++) {
            if (exception < exceptions.size() && exceptions.row(exception) == row) {
                values[row] = exceptions.value(exception++);
            } else {
                values[row] = Double.toString(in.readDouble());
            }
        }
        return new StringColumn(values);
    }
}
