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

import java.util.function.BiPredicate;

/** 语义匹配器: 一个语义类型、固定置信度以及只依赖值和上下文的纯函数判定。 */
public interface SemanticMatcher {

    SemanticType type();

    double confidence();

    boolean matches(String value, TokenContext context);

    static SemanticMatcher of(
            SemanticType type, double confidence, BiPredicate<String, TokenContext> predicate) {
        return new SemanticMatcher() {
            @Override
            public SemanticType type() {
                return type;
            }

            @Override
            public double confidence() {
                return confidence;
            }

            @Override
            public boolean matches(String value, TokenContext context) {
                return predicate.test(value, context);
            }

            @Override
            public String toString() {
                return type + "Matcher";
            }
        };
    }
}
