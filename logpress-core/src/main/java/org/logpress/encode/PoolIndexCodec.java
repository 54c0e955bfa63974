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
 * 词元池下标编码,用于自由文本类的列。
 *
 * <p>在任何位置出现过的值都引用词元池中的同一个下标,新值追加到词元池。下标流经
 * {@link RunLengthEncoding} 后处理。
 */
public class PoolIndexCodec implements ValueCodec {

    @Override
    public ColumnCodec codec() {
        return ColumnCodec.POOL_INDEX;
    }

    @Override
    public EncodedColumn encode(List<String> values, CodecContext context) throws IOException {
        TokenPool pool = context.pool();
        int[] indices = new int[values.size()];
        for (int i = 0; i < values.size(); i++) {
            indices[i] = pool.add(values.get(i));
        }
        DataOutputSerializer out = new DataOutputSerializer(64);
        ExceptionList.EMPTY.write(out);
        RunLengthEncoding.write(out, indices, context.rleMinRun());
        return new EncodedColumn(codec(), out.getCopyOfBuffer(), values.size());
    }

    @Override
    public IndexedColumn decode(EncodedColumn column, CodecContext context) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(column.payload());
        ExceptionList exceptions = ExceptionList.read(in, column.valueCount());
        TokenPool pool = context.pool();
        int[] indices =
                DictionaryCodec.readIndices(in, column.valueCount(), exceptions, pool.size());
        return new IndexedColumn(pool.values(), indices, exceptions);
    }
}
