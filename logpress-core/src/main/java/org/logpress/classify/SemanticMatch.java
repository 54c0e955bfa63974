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

package org.logpress.classify;

import java.util.Objects;

/** 分类结果: 语义类型与置信度。 */
public final class SemanticMatch {

    public static final SemanticMatch UNKNOWN = new SemanticMatch(SemanticType.UNKNOWN, 0.0);

    private final SemanticType type;
    private final double confidence;

    public SemanticMatch(SemanticType type, double confidence) {
        this.type = type;
        this.confidence = confidence;
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
        SemanticMatch that = (SemanticMatch) o;
        return Double.compare(that.confidence, confidence) == 0 && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, confidence);
    }

    @Override
    public String toString() {
        return type + "(" + confidence + ")";
    }
}
