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

import org.logpress.utils.Preconditions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 基于有序匹配器表的语义分类器。
 *
 * <p>单个值按表顺序逐个尝试匹配器,第一个命中的决定类型;都不命中时为 UNKNOWN(置信度 0)。
 * 一组值(一个槽位在所有行上的取值)通过多数投票决定类型,票数相同时取表中优先级更高的类型,
 * 置信度为获胜类型各票置信度的平均值。
 *
 * <p>无副作用,可以被多个线程共享。
 */
public class SemanticClassifier {

    private final List<SemanticMatcher> matchers;

    public SemanticClassifier() {
        this(SemanticMatchers.defaultMatchers());
    }

    public SemanticClassifier(List<SemanticMatcher> matchers) {
        Preconditions.checkNotNull(matchers, "matchers must not be null");
        this.matchers = new ArrayList<>(matchers);
    }

    public SemanticMatch classify(String value, TokenContext context) {
        for (SemanticMatcher matcher : matchers) {
            if (matcher.matches(value, context)) {
                return new SemanticMatch(matcher.type(), matcher.confidence());
            }
        }
        return SemanticMatch.UNKNOWN;
    }

    /**
     * 对一组值投票。
     *
     * @param values 槽位的取值
     * @param contexts 与 {@code values} 一一对应的上下文
     */
    public SemanticMatch vote(List<String> values, List<TokenContext> contexts) {
        Preconditions.checkArgument(
                values.size() == contexts.size(), "values and contexts differ in size");
        if (values.isEmpty()) {
            return SemanticMatch.UNKNOWN;
        }

        Map<SemanticType, int[]> counts = new EnumMap<>(SemanticType.class);
        Map<SemanticType, double[]> confidenceSums = new EnumMap<>(SemanticType.class);
        for (int i = 0; i < values.size(); i++) {
            SemanticMatch match = classify(values.get(i), contexts.get(i));
            counts.computeIfAbsent(match.type(), t -> new int[1])[0]++;
            confidenceSums.computeIfAbsent(match.type(), t -> new double[1])[0] +=
                    match.confidence();
        }

        SemanticType winner = null;
        int winnerVotes = -1;
        for (Map.Entry<SemanticType, int[]> entry : counts.entrySet()) {
            int votes = entry.getValue()[0];
            if (votes > winnerVotes
                    || (votes == winnerVotes
                            && priority(entry.getKey()) < priority(winner))) {
                winner = entry.getKey();
                winnerVotes = votes;
            }
        }
        return new SemanticMatch(winner, confidenceSums.get(winner)[0] / winnerVotes);
    }

    private int priority(SemanticType type) {
        for (int i = 0; i < matchers.size(); i++) {
            if (matchers.get(i).type() == type) {
                return i;
            }
        }
        return matchers.size();
    }
}
