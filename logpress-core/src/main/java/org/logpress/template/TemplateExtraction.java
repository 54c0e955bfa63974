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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模板提取的结果: 模板列表、每个模板匹配的行,以及未匹配任何模板的行。
 *
 * <p>每个输入行恰好属于一个模板或 UNMATCHED。
 */
public final class TemplateExtraction {

    private final List<TemplateRows> matched;
    private final TemplateRows unmatched;
    private final String[] assignment;

    public TemplateExtraction(List<TemplateRows> matched, TemplateRows unmatched, int lineCount) {
        this.matched = Collections.unmodifiableList(new ArrayList<>(matched));
        this.unmatched = unmatched;
        this.assignment = new String[lineCount];
        for (TemplateRows rows : matched) {
            assign(rows);
        }
        assign(unmatched);
        for (int i = 0; i < lineCount; i++) {
            if (assignment[i] == null) {
                throw new IllegalArgumentException(
                        "Line " + i + " is not assigned to any template");
            }
        }
    }

    private void assign(TemplateRows rows) {
        String id = rows.template().id();
        for (int i = 0; i < rows.size(); i++) {
            int line = rows.lineNumber(i);
            if (assignment[line] != null) {
                throw new IllegalArgumentException(
                        "Line " + line + " is assigned to both " + assignment[line] + " and " + id);
            }
            assignment[line] = id;
        }
    }

    /** 推断出的模板,不含 UNMATCHED。 */
    public List<LogTemplate> templates() {
        List<LogTemplate> templates = new ArrayList<>(matched.size());
        for (TemplateRows rows : matched) {
            templates.add(rows.template());
        }
        return templates;
    }

    public List<TemplateRows> matchedRows() {
        return matched;
    }

    public TemplateRows unmatchedRows() {
        return unmatched;
    }

    public int lineCount() {
        return assignment.length;
    }

    /** 指定行所属模板的 id。 */
    public String templateIdOf(int line) {
        return assignment[line];
    }
}
