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

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 查询结果: 匹配行数、检查过的行数、耗时以及按原始顺序还原的匹配行。 */
public final class QueryResult {

    private final long matchedCount;
    private final long scannedCount;
    private final Duration executionTime;
    private final List<String> logs;
    @Nullable private final ContainerStatistics statistics;

    public QueryResult(
            long matchedCount,
            long scannedCount,
            Duration executionTime,
            List<String> logs,
            @Nullable ContainerStatistics statistics) {
        this.matchedCount = matchedCount;
        this.scannedCount = scannedCount;
        this.executionTime = executionTime;
        this.logs = Collections.unmodifiableList(new ArrayList<>(logs));
        this.statistics = statistics;
    }

    public long matchedCount() {
        return matchedCount;
    }

    public long scannedCount() {
        return scannedCount;
    }

    public Duration executionTime() {
        return executionTime;
    }

    public List<String> logs() {
        return logs;
    }

    /** 只有统计查询才有。 */
    @Nullable
    public ContainerStatistics statistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "QueryResult{matched="
                + matchedCount
                + ", scanned="
                + scannedCount
                + ", time="
                + executionTime.toMillis()
                + "ms}";
    }
}
