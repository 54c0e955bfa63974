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

package org.logpress.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 容器统计信息。
 *
 * <ul>
 *   <li>总行数、模板数、未匹配行数
 *   <li>每个模板的 id、可读模式和匹配数
 *   <li>字典编码列的取值计数,按槽位名汇总所有模板,只遍历下标流
 *   <li>时间戳列的最小值、最大值和可解析行数,例外行不参与
 * </ul>
 */
public final class ContainerStatistics {

    private final int totalLines;
    private final int templateCount;
    private final int unmatchedCount;
    private final List<TemplateSummary> templates;
    private final Map<String, Map<String, Long>> valueCounts;
    private final Map<String, TimestampStatistics> timestamps;

    public ContainerStatistics(
            int totalLines,
            int templateCount,
            int unmatchedCount,
            List<TemplateSummary> templates,
            Map<String, Map<String, Long>> valueCounts,
            Map<String, TimestampStatistics> timestamps) {
        this.totalLines = totalLines;
        this.templateCount = templateCount;
        this.unmatchedCount = unmatchedCount;
        this.templates = Collections.unmodifiableList(new ArrayList<>(templates));
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        valueCounts.forEach(
                (slot, values) ->
                        counts.put(slot, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.valueCounts = Collections.unmodifiableMap(counts);
        this.timestamps = Collections.unmodifiableMap(new LinkedHashMap<>(timestamps));
    }

    public int totalLines() {
        return totalLines;
    }

    public int templateCount() {
        return templateCount;
    }

    public int unmatchedCount() {
        return unmatchedCount;
    }

    public List<TemplateSummary> templates() {
        return templates;
    }

    /** 槽位名到 (取值 -> 行数) 的映射,取值按首次出现顺序。 */
    public Map<String, Map<String, Long>> valueCounts() {
        return valueCounts;
    }

    public Map<String, TimestampStatistics> timestamps() {
        return timestamps;
    }

    /** 模板概要。 */
    public static final class TemplateSummary {

        private final String id;
        private final String pattern;
        private final int matchCount;

        public TemplateSummary(String id, String pattern, int matchCount) {
            this.id = id;
            this.pattern = pattern;
            this.matchCount = matchCount;
        }

        public String id() {
            return id;
        }

        public String pattern() {
            return pattern;
        }

        public int matchCount() {
            return matchCount;
        }

        @Override
        public String toString() {
            return id + " " + pattern + " (" + matchCount + ")";
        }
    }

    /** 时间戳列的聚合,单位为 UTC 毫秒。没有可解析行时最小值和最大值无意义。 */
    public static final class TimestampStatistics {

        private final long min;
        private final long max;
        private final long parsedCount;
        private final long exceptionCount;

        public TimestampStatistics(long min, long max, long parsedCount, long exceptionCount) {
            this.min = min;
            this.max = max;
            this.parsedCount = parsedCount;
            this.exceptionCount = exceptionCount;
        }

        public long min() {
            return min;
        }

        public long max() {
            return max;
        }

        public long parsedCount() {
            return parsedCount;
        }

        public long exceptionCount() {
            return exceptionCount;
        }

        TimestampStatistics merge(TimestampStatistics other) {
            if (other.parsedCount == 0) {
                return new TimestampStatistics(
                        min, max, parsedCount, exceptionCount + other.exceptionCount);
            }
            if (parsedCount == 0) {
                return new TimestampStatistics(
                        other.min,
                        other.max,
                        other.parsedCount,
                        exceptionCount + other.exceptionCount);
            }
            return new TimestampStatistics(
                    Math.min(min, other.min),
                    Math.max(max, other.max),
                    parsedCount + other.parsedCount,
                    exceptionCount + other.exceptionCount);
        }

        @Override
        public String toString() {
            return "TimestampStatistics{min="
                    + min
                    + ", max="
                    + max
                    + ", parsed="
                    + parsedCount
                    + ", exceptions="
                    + exceptionCount
                    + "}";
        }
    }
}
