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

import java.util.Objects;

/** 模板中一个变量槽位的定义: 名称、推断的语义类型与置信度。模板构建完成后不可变。 */
public final class SlotSpec {

    private final String name;
    private final SemanticType type;
    private final double confidence;

    public SlotSpec(String name, SemanticType type, double confidence) {
        this.name = name;
        this.type = type;
        this.confidence = confidence;
    }

    public String name() {
        return name;
    }

    public SemanticType type() {
        return type;
    }

    public double confidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SlotSpec slotSpec = (SlotSpec) o;
        return Double.compare(slotSpec.confidence, confidence) == 0
                && name.equals(slotSpec.name)
                && type == slotSpec.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, confidence);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
