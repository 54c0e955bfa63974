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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 字典编码,适合低基数的分类值。
 *
 * <p>按首次出现顺序编号,字典只保存一次,下标流经 {@link RunLengthEncoding} 后处理。
 * 任何字符串都能进入字典,所以例外列表总是空的。
 */
public class DictionaryCodec implements ValueCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.DICTIONARY;
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        Map<String, Integer> dictionary = new LinkedHashMap<>();
        int[] indices = new int[values.size()];
        for (int i = 0; i < values.size(); i++) {
            Integer index = dictionary.get(values.get(i));
            if (index == null) {
                index = dictionary.size();
                dictionary.put(values.get(i), index);
            }
            indices[i] = index;
        }

        DataOutputSerializer out = new DataOutputSerializer(64);
        ExceptionList.EMPTY.write(out);
        out.writeVarInt(dictionary.size());
        for (String value : dictionary.keySet()) {
            out.writeString(value);
        }
        RunLengthEncoding.write(out, indices, context.rleMinRun());
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public IndexedColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        int size = in.readVarInt();
        if (size < 0 || size > in.available()) {
            throw new IOException("Invalid dictionary size " + size);
        }
        List<String> dictionary = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            dictionary.add(in.readString());
        }
        int[] indices =
                readIndices(in, column.valueCount(), exceptions, dictionary.size());
        return new IndexedColumn(Collections.unmodifiableList(dictionary), indices, exceptions);
    }

    /** 读取下标流,并在例外行填入 -1。 */
    static int[] readIndices(
            DataInputDeserializer in, int valueCount, ExceptionList exceptions, int bound)
            throws IOException {
        int[] primary = RunLengthEncoding.read(in, valueCount - exceptions.size());
        int[] indices = new int[valueCount];
        int next = 0;
        for (int row = 0; row < valueCount; row++) {
            if (exceptions.containsRow(row)) {
                indices[row] = -1;
                continue;
            }
            int index = primary[next++];
            if (index < 0 || index >= bound) {
                throw new IOException("Index " + index + " out of range [0, " + bound + ")");
            }
            indices[row] = index;
        }
        return indices;
    }
}
