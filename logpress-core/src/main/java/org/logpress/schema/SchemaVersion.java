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

package org.logpress.schema;

import org.logpress.classify.SemanticType;
import org.logpress.template.SlotSpec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 某个日志来源的一个模式版本: 模板模式串、槽位布局及其适用的行数。 */
public final class SchemaVersion {

    private final int version;
    private final Instant registeredAt;
    private final String pattern;
    private final List<SlotSpec> slots;
    private final long sampleCount;
    private final String hash;

    public SchemaVersion(
            int version,
            Instant registeredAt,
            String pattern,
            List<SlotSpec> slots,
            long sampleCount,
            String hash) {
        this.version = version;
        this.registeredAt = registeredAt;
        this.pattern = pattern;
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.sampleCount = sampleCount;
        this.hash = hash;
    }

    public int version() {
        return version;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public String pattern() {
        return pattern;
    }

    public List<SlotSpec> slots() {
        return slots;
    }

    /** 槽位名到语义类型,按槽位顺序。 */
    public Map<String, SemanticType> slotTypes() {
        Map<String, SemanticType> types = new LinkedHashMap<>();
        for (SlotSpec slot : slots) {
            types.put(slot.name(), slot.type());
        }
        return types;
    }

    public long sampleCount() {
        return sampleCount;
    }

    public String hash() {
        return hash;
    }

    SchemaVersion withAdditionalSamples(long samples) {
        return new SchemaVersion(
                version, registeredAt, pattern, slots, sampleCount + samples, hash);
    }

    @Override
    public String toString() {
        return "v" + version + " " + pattern + " (" + sampleCount + " samples, " + hash + ")";
    }
}
