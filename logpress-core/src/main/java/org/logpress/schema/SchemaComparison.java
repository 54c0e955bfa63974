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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 两个模式版本的差异。 */
public final class SchemaComparison {

    private final int fromVersion;
    private final int toVersion;
    private final List<String> addedSlots;
    private final List<String> removedSlots;
    private final Map<String, TypeChange> typeChanges;
    private final CompatibilityLevel compatibility;

    SchemaComparison(SchemaVersion from, SchemaVersion to) {
        this.fromVersion = from.version();
        this.toVersion = to.version();
        Map<String, SemanticType> fromTypes = from.slotTypes();
        Map<String, SemanticType> toTypes = to.slotTypes();

        List<String> added = new ArrayList<>();
        Map<String, TypeChange> changed = new LinkedHashMap<>();
        for (Map.Entry<String, SemanticType> slot : toTypes.entrySet()) {
            SemanticType previous = fromTypes.get(slot.getKey());
            if (previous == null) {
                added.add(slot.getKey());
            } else if (previous != slot.getValue()) {
                changed.put(slot.getKey(), new TypeChange(previous, slot.getValue()));
            }
        }
        List<String> removed = new ArrayList<>();
        for (String slot : fromTypes.keySet()) {
            if (!toTypes.containsKey(slot)) {
                removed.add(slot);
            }
        }

        this.addedSlots = Collections.unmodifiableList(added);
        this.removedSlots = Collections.unmodifiableList(removed);
        this.typeChanges = Collections.unmodifiableMap(changed);
        if (from.hash().equals(to.hash())) {
            this.compatibility = CompatibilityLevel.IDENTICAL;
        } else if (!removed.isEmpty()) {
            this.compatibility = CompatibilityLevel.INCOMPATIBLE;
        } else if (!changed.isEmpty()) {
            this.compatibility = CompatibilityLevel.COMPATIBLE_WITH_CAST;
        } else {
            this.compatibility = CompatibilityLevel.BACKWARD_COMPATIBLE;
        }
    }

    public int fromVersion() {
        return fromVersion;
    }

    public int toVersion() {
        return toVersion;
    }

    public List<String> addedSlots() {
        return addedSlots;
    }

    public List<String> removedSlots() {
        return removedSlots;
    }

    public Map<String, TypeChange> typeChanges() {
        return typeChanges;
    }

    public CompatibilityLevel compatibility() {
        return compatibility;
    }

    /** 同时满足没有删除槽位、没有类型变化。 */
    public boolean isCompatible() {
        return compatibility == CompatibilityLevel.IDENTICAL
                || compatibility == CompatibilityLevel.BACKWARD_COMPATIBLE;
    }

    @Override
    public String toString() {
        return "v"
                + fromVersion
                + " -> v"
                + toVersion
                + ": "
                + compatibility
                + " (added="
                + addedSlots
                + ", removed="
                + removedSlots
                + ", changed="
                + typeChanges.keySet()
                + ")";
    }

    /** 槽位类型的变化。 */
    public static final class TypeChange {

        private final SemanticType from;
        private final SemanticType to;

        TypeChange(SemanticType from, SemanticType to) {
            this.from = from;
            this.to = to;
        }

        public SemanticType from() {
            return from;
        }

        public SemanticType to() {
            return to;
        }

        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }
}
