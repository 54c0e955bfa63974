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
import org.logpress.utils.IntArrayList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 列的例外列表: 无法走主编码路径的值,按行号升序保存 {@code (行号, 原文)}。
 *
 * <p>解码时先还原主编码的值,再把例外值放回对应行,保证无损。行号以差值 varint 写入。
 */
public final class ExceptionList {

    public static final ExceptionList EMPTY =
            new ExceptionList(new int[0], Collections.emptyList());

    private final int[] rows;
    private final List<String> values;

    private ExceptionList(int[] rows, List<String> values) {
        this.rows = rows;
        this.values = values;
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public int row(int i) {
        return rows[i];
    }

    public String value(int i) {
        return values.get(i);
    }

    /** 行在例外列表中的位置,不在列表中时返回负数。 */
    public int indexOfRow(int row) {
        return Arrays.binarySearch(rows, row);
    }

    public boolean containsRow(int row) {
        return indexOfRow(row) >= 0;
    }

    public void write(DataOutputSerializer out) throws IOException {
        out.writeVarInt(rows.length);
        int previous = 0;
        for (int i = 0; i < rows.length; i++) {
            out.writeVarInt(rows[i] - previous);
            out.writeString(values.get(i));
            previous = rows[i];
        }
    }

    /**
     * 读取例外列表。
     *
     * @param valueCount 列的总行数,用于校验行号
     */
    public static ExceptionList read(DataInputDeserializer in, int valueCount) throws IOException {
        int size = in.readVarInt();
        if (size == 0) {
            return EMPTY;
        }
        if (size > valueCount) {
            throw new IOException(
                    "Exception list of " + size + " entries exceeds " + valueCount + " values");
        }
        int[] rows = new int[size];
        List<String> values = new ArrayList<>(size);
        int previous = 0;
        for (int i = 0; i < size; i++) {
            int row = previous + in.readVarInt();
            if (row >= valueCount || (i > 0 && row <= previous)) {
                throw new IOException("Invalid exception row " + row);
            }
            rows[i] = row;
            values.add(in.readString());
            previous = row;
        }
        return new ExceptionList(rows, values);
    }

    /** 按行号升序追加例外值。 */
    public static class Builder {

        private final IntArrayList rows = new IntArrayList(4);
        private final List<String> values = new ArrayList<>();

        public Builder add(int row, String value) {
            if (!rows.isEmpty() && rows.get(rows.size() - 1) >= row) {
                throw new IllegalArgumentException("Exception rows must be ascending: " + row);
            }
            rows.add(row);
            values.add(value);
            return this;
        }

        public int size() {
            return rows.size();
        }

        public ExceptionList build() {
            if (rows.isEmpty()) {
                return EMPTY;
            }
            return new ExceptionList(rows.toArray(), Collections.unmodifiableList(values));
        }
    }
}
