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

package org.logpress.template;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 一个模板匹配的所有行: 全局行号(严格递增)以及每行的槽位值。 */
public final class TemplateRows {

    private final LogTemplate template;
    private final int[] lineNumbers;
    private final List<String[]> values;

    public TemplateRows(LogTemplate template, int[] lineNumbers, List<String[]> values) {
        if (lineNumbers.length != values.size()) {
            throw new IllegalArgumentException(
                    "Got " + lineNumbers.length + " line numbers but " + values.size() + " rows");
        }
        this.template = template;
        this.lineNumbers = lineNumbers.clone();
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public LogTemplate template() {
        return template;
    }

    public int size() {
        return lineNumbers.length;
    }

    public int[] lineNumbers() {
        return lineNumbers.clone();
    }

    public int lineNumber(int row) {
        return lineNumbers[row];
    }

    public String[] row(int row) {
        return values.get(row).clone();
    }

    /** 一个槽位在所有行上的取值,按行顺序。 */
    public List<String> column(int slotIndex) {
        return new AbstractList<String>() {
            @Override
            public String get(int index) {
                return values.get(index)[slotIndex];
            }

            @Override
            public int size() {
                return values.size();
            }
        };
    }
}
