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

/** 原文编码,用于 UNMATCHED 模板的整行。 */
public class VerbatimCodec implements ValueCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.VERBATIM;
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(64);
        ExceptionList.EMPTY.write(out);
        for (String value : values) {
            out.writeString(value);
        }
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public StringColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        if (!exceptions.isEmpty()) {
            throw new IOException("Verbatim column must not carry exceptions");
        }
        String[] values = new String[column.valueCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = in.readString();
        }
        return new StringColumn(values);
    }
}
