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

import org.logpress.template.LogTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 一个模板编码后的全部内容: 模板元数据、所匹配行的全局行号以及按槽位顺序排列的列。 */
public final class EncodedTemplate {

    private final LogTemplate template;
    private final int[] lineNumbers;
    private final Map<String, EncodedColumn> columns;

    public EncodedTemplate(
            LogTemplate template, int[] lineNumbers, Map<String, EncodedColumn> columns) {
        this.template = template;
        this.lineNumbers = lineNumbers.clone();
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public LogTemplate template() {
        return template;
    }

    public int[] lineNumbers() {
        return lineNumbers.clone();
    }

    public int rowCount() {
        return lineNumbers.length;
    }

    /** 槽位名到列的映射,按槽位顺序。 */
    public Map<String, EncodedColumn> columns() {
        return columns;
    }
}
