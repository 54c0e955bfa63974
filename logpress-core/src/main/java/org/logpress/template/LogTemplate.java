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

import org.logpress.classify.SemanticType;
import org.logpress.tokenize.Token;
import org.logpress.tokenize.TokenKind;
import org.logpress.utils.Preconditions;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 一组结构相同的日志行推断出的模板,不可变。
 *
 * <p>字面模式由 {@link PatternElement} 组成。按顺序回放字面量并代入槽位值,即可逐字还原原始行:
 *
 * <pre>{@code
 * [2005-06-09 06:07:04] [INFO] start
 * => [TIMESTAMP] [SEVERITY] MESSAGE
 * }</pre>
 *
 * <p>id 为 {@link #UNMATCHED_ID} 的模板是兜底模板,只有一个 {@code raw} 槽位,保存整行原文。
 */
public final class LogTemplate {

    public static final String UNMATCHED_ID = "UNMATCHED";

    private final String id;
    private final List<PatternElement> elements;
    private final List<SlotSpec> slots;
    private final int matchCount;
    private final List<String> examples;
    private final int tokenCount;

    public LogTemplate(
            String id,
            List<PatternElement> elements,
            List<SlotSpec> slots,
            int matchCount,
            List<String> examples) {
        this.id = Preconditions.checkNotNull(id);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.matchCount = matchCount;
        this.examples = Collections.unmodifiableList(new ArrayList<>(examples));
        int count = 0;
        for (PatternElement element : elements) {
            if (element.isSlot()) {
                Preconditions.checkArgument(
                        element.slotIndex() >= 0 && element.slotIndex() < slots.size(),
                        "Slot index %s out of range in template %s",
                        element.slotIndex(),
                        id);
            }
            count += element.span();
        }
        this.tokenCount = count;
    }

    /** 兜底模板。 */
    public static LogTemplate unmatched(int matchCount, List<String> examples) {
        return new LogTemplate(
                UNMATCHED_ID,
                Collections.singletonList(
                        PatternElement.slot(0, new TokenKind[0], "", "")),
                Collections.singletonList(new SlotSpec("raw", SemanticType.UNKNOWN, 0.0)),
                matchCount,
                examples);
    }

    public String id() {
        return id;
    }

    public List<PatternElement> elements() {
        return elements;
    }

    public List<SlotSpec> slots() {
        return slots;
    }

    public int matchCount() {
        return matchCount;
    }

    public List<String> examples() {
        return examples;
    }

    public boolean isUnmatched() {
        return UNMATCHED_ID.equals(id);
    }

    /** 指定名称槽位的下标,不存在时返回 -1。 */
    public int slotIndex(String slotName) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).name().equals(slotName)) {
                return i;
            }
        }
        return -1;
    }

    /** 以新的 id、匹配数和示例复制模板。 */
    public LogTemplate withMatches(String newId, int newMatchCount, List<String> newExamples) {
        return new LogTemplate(newId, elements, slots, newMatchCount, newExamples);
    }

    /**
     * 用模板匹配一行的词元。
     *
     * @return 各槽位的值;字面量不一致或结构不同时返回 null
     */
    @Nullable
    public String[] match(List<Token> tokens) {
        if (isUnmatched() || tokens.size() != tokenCount) {
            return null;
        }
        String[] values = new String[slots.size()];
        int position = 0;
        for (PatternElement element : elements) {
            if (!element.isSlot()) {
                Token token = tokens.get(position);
                if (token.kind() != element.literalKind()
                        || !token.value().equals(element.literal())) {
                    return null;
                }
                position++;
                continue;
            }

            for (int k = 0; k < element.span(); k++) {
                if (tokens.get(position + k).kind() != element.kindAt(k)) {
                    return null;
                }
            }
            if (element.isWrapped()) {
                Token token = tokens.get(position);
                if (!token.open().equals(element.open())
                        || !token.close().equals(element.close())) {
                    return null;
                }
                values[element.slotIndex()] = token.body();
            } else {
                StringBuilder value = new StringBuilder();
                for (int k = 0; k < element.span(); k++) {
                    value.append(tokens.get(position + k).value());
                }
                values[element.slotIndex()] = value.toString();
            }
            position += element.span();
        }
        return values;
    }

    /** 代入槽位值,还原原始行。 */
    public String reconstruct(String[] values) {
        Preconditions.checkArgument(
                values.length == slots.size(),
                "Template %s expects %s values but got %s",
                id,
                slots.size(),
                values.length);
        StringBuilder line = new StringBuilder();
        for (PatternElement element : elements) {
            if (element.isSlot()) {
                line.append(element.open())
                        .append(values[element.slotIndex()])
                        .append(element.close());
            } else {
                line.append(element.literal());
            }
        }
        return line.toString();
    }

    /** 可读的模式,槽位显示为大写的语义类型,如 {@code [TIMESTAMP] [SEVERITY] MESSAGE}。 */
    public String toPatternString() {
        StringBuilder pattern = new StringBuilder();
        for (PatternElement element : elements) {
            if (element.isSlot()) {
                pattern.append(element.open())
                        .append(
                                slots.get(element.slotIndex())
                                        .type()
                                        .name()
                                        .toUpperCase(Locale.ROOT))
                        .append(element.close());
            } else {
                pattern.append(element.literal());
            }
        }
        return pattern.toString();
    }

    /** 结构是否相同(忽略 id、匹配数与示例)。 */
    public boolean sameStructure(LogTemplate other) {
        return elements.equals(other.elements) && slots.equals(other.slots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogTemplate that = (LogTemplate) o;
        return matchCount == that.matchCount
                && id.equals(that.id)
                && elements.equals(that.elements)
                && slots.equals(that.slots)
                && examples.equals(that.examples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, elements, slots, matchCount, examples);
    }

    @Override
    public String toString() {
        return id + ": " + toPatternString() + " (" + matchCount + ")";
    }
}
