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

package org.logpress.container;

import org.logpress.encode.ColumnCodec;
import org.logpress.encode.TokenPool;
import org.logpress.template.LogTemplate;
import org.logpress.template.PatternElement;
import org.logpress.template.SlotSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 容器元数据段中一个模板的描述。
 *
 * <p>字面量以词元池下标保存,只有调用 {@link #resolve} 时才需要加载词元池。
 * 匹配数、槽位和列编码不依赖词元池,计数类查询只用这些信息。
 */
public final class TemplateDescriptor {

    private final String id;
    private final int matchCount;
    private final int exampleCount;
    private final List<PatternElement> elements;
    private final int[] literalRefs;
    private final List<SlotSpec> slots;
    private final List<ColumnCodec> codecs;

    TemplateDescriptor(
            String id,
            int matchCount,
            int exampleCount,
            List<PatternElement> elements,
            int[] literalRefs,
            List<SlotSpec> slots,
            List<ColumnCodec> codecs) {
        this.id = id;
        this.matchCount = matchCount;
        this.exampleCount = exampleCount;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.literalRefs = literalRefs;
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.codecs = Collections.unmodifiableList(new ArrayList<>(codecs));
    }

    public String id() {
        return id;
    }

    public int matchCount() {
        return matchCount;
    }

    public int exampleCount() {
        return exampleCount;
    }

    public List<SlotSpec> slots() {
        return slots;
    }

    public List<ColumnCodec> codecs() {
        return codecs;
    }

    public boolean isUnmatched() {
        return LogTemplate.UNMATCHED_ID.equals(id);
    }

    public int slotIndex(String slotName) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).name().equals(slotName)) {
                return i;
            }
        }
        return -1;
    }

    /** 用词元池还原字面量,得到完整的模板。 */
    LogTemplate resolve(TokenPool pool, List<String> examples) throws CorruptContainerException {
        List<PatternElement> resolved = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            PatternElement element = elements.get(i);
            if (element.isSlot()) {
                resolved.add(element);
                continue;
            }
            int ref = literalRefs[i];
            if (ref < 0 || ref >= pool.size()) {
                throw new CorruptContainerException(
                        "Literal reference " + ref + " of template " + id + " is out of range");
            }
            resolved.add(PatternElement.literal(element.literalKind(), pool.get(ref)));
        }
        return new LogTemplate(id, resolved, slots, matchCount, examples);
    }
}
