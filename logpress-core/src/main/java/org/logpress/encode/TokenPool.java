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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 全局词元池: 按追加顺序编号、去重的字符串集合。
 *
 * <p>模板字面量和所有池下标编码的列共享同一个词元池,一个值无论在哪里出现都只保存一次。
 * 下标由追加顺序决定,因此一次压缩过程内只能单线程修改。
 */
public class TokenPool {

    private final List<String> values;
    private final Map<String, Integer> indexes;

    public TokenPool() {
        this.values = new ArrayList<>();
        this.indexes = new HashMap<>();
    }

    /** 加入一个值并返回其下标,已存在时返回原下标。 */
    public int add(String value) {
        Integer index = indexes.get(value);
        if (index != null) {
            return index;
        }
        int newIndex = values.size();
        values.add(value);
        indexes.put(value, newIndex);
        return newIndex;
    }

    public int indexOf(String value) {
        Integer index = indexes.get(value);
        return index == null ? -1 : index;
    }

    public String get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<String> values() {
        return Collections.unmodifiableList(values);
    }

    public void write(DataOutputSerializer out) throws IOException {
        out.writeVarInt(values.size());
        for (String value : values) {
            out.writeString(value);
        }
    }

    public static TokenPool read(DataInputDeserializer in) throws IOException {
        int size = in.readVarInt();
        TokenPool pool = new TokenPool();
        for (int i = 0; i < size; i++) {
            String value = in.readString();
            if (pool.add(value) != i) {
                throw new IOException("Duplicate token pool entry at index " + i);
            }
        }
        return pool;
    }
}
