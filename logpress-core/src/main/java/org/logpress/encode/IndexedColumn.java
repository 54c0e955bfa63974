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

import java.util.List;

/**
 * 以下标引用取值表的列,字典编码和词元池编码解码后都是这种形式。
 *
 * <p>查询引擎可以对每个不同的下标只求值一次谓词,统计时也只需要遍历下标流。
 * 例外行的下标为 -1。
 */
public final class IndexedColumn implements DecodedColumn {

    private final List<String> dictionary;
    private final int[] indices;
    private final ExceptionList exceptions;

    public IndexedColumn(List<String> dictionary, int[] indices, ExceptionList exceptions) {
        this.dictionary = dictionary;
        this.indices = indices;
        this.exceptions = exceptions;
    }

    @Override
    public int size() {
        return indices.length;
    }

    @Override
    public String get(int row) {
        int index = indices[row];
        if (index < 0) {
            return exceptions.value(exceptions.indexOfRow(row));
        }
        return dictionary.get(index);
    }

    /** 取值表,对词元池编码的列是整个词元池。 */
    public List<String> dictionary() {
        return dictionary;
    }

    public int indexAt(int row) {
        return indices[row];
    }

    public ExceptionList exceptions() {
        return exceptions;
    }
}
