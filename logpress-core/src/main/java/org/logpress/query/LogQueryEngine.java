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

import org.logpress.container.LogContainer;
import org.logpress.container.TemplateDescriptor;
import org.logpress.encode.ColumnCodec;
import org.logpress.encode.DecodedColumn;
import org.logpress.encode.IndexedColumn;
import org.logpress.encode.TimestampColumn;
import org.logpress.utils.Preconditions;

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 直接在容器上执行查询,只解码查询需要的列。
 *
 * <h2>选择性解码</h2>
 *
 * <ul>
 *   <li>{@link #countAll()} 只读取模板元数据中的匹配数,不碰任何列
 *   <li>{@link #filterBy} 对每个声明了该槽位的模板只解码这一列;字典列和词元池列对每个不同的值
 *       只求值一次谓词。命中的行记录在 {@link RoaringBitmap} 中,只有存在命中行的模板才会解码
 *       其余列和行号来还原原始行
 *   <li>{@link #getStatistics()} 对字典列只遍历下标流,不还原任何行
 * </ul>
 *
 * <p>结果按原始行的顺序返回。
 */
public class LogQueryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LogQueryEngine.class);

    private final LogContainer container;

    public LogQueryEngine(LogContainer container) {
        this.container = Preconditions.checkNotNull(container);
    }

    public LogContainer container() {
        return container;
    }

    /** 总行数,只使用模板元数据。 */
    public QueryResult countAll() {
        long start = System.nanoTime();
        long total = 0;
        for (TemplateDescriptor descriptor : container.descriptors()) {
            total += descriptor.matchCount();
        }
        return new QueryResult(total, 0, elapsedSince(start), Collections.emptyList(), null);
    }

    /** 槽位值等于 {@code value} 的行。 */
    public QueryResult filterBy(String slotName, String value) throws IOException {
        return filterBy(slotName, SlotPredicate.equalTo(value));
    }

    public QueryResult filterBy(String slotName, SlotPredicate predicate) throws IOException {
        Map<String, SlotPredicate> predicates = new LinkedHashMap<>();
        predicates.put(slotName, predicate);
        return filterAll(predicates);
    }

    /**
     * 同时满足所有槽位谓词的行。只有声明了全部槽位的模板参与,各槽位的命中行取交集,
     * 交集为空后不再解码该模板的其余谓词列。
     */
    public QueryResult filterAll(Map<String, SlotPredicate> predicates) throws IOException {
        Preconditions.checkArgument(!predicates.isEmpty(), "At least one predicate is required");
        long start = System.nanoTime();
        long scanned = 0;
        TreeMap<Integer, String> matches = new TreeMap<>();

        List<TemplateDescriptor> descriptors = container.descriptors();
        for (int t = 0; t < descriptors.size(); t++) {
            TemplateDescriptor descriptor = descriptors.get(t);
            if (!declaresAll(descriptor, predicates)) {
                continue;
            }
            RoaringBitmap rows = null;
            for (Map.Entry<String, SlotPredicate> entry : predicates.entrySet()) {
                DecodedColumn column = container.column(t, descriptor.slotIndex(entry.getKey()));
                scanned += rows == null ? column.size() : rows.getCardinality();
                RoaringBitmap hits = evaluate(column, entry.getValue(), rows);
                rows = hits;
                if (rows.isEmpty()) {
                    break;
                }
            }
            collect(t, rows, matches);
        }

        LOG.debug(
                "Filter {} matched {} of {} scanned rows", predicates, matches.size(), scanned);
        return new QueryResult(
                matches.size(),
                scanned,
                elapsedSince(start),
                new ArrayList<>(matches.values()),
                null);
    }

    /**
     * 时间戳槽位落在 {@code [fromMillis, toMillis)} 内的行,直接比较解码后的毫秒时间。
     * 不是时间戳编码的列以及例外行不会命中。
     */
    public QueryResult filterByTimeRange(String slotName, long fromMillis, long toMillis)
            throws IOException {
        long start = System.nanoTime();
        long scanned = 0;
        TreeMap<Integer, String> matches = new TreeMap<>();

        List<TemplateDescriptor> descriptors = container.descriptors();
        for (int t = 0; t < descriptors.size(); t++) {
            TemplateDescriptor descriptor = descriptors.get(t);
            int slot = descriptor.slotIndex(slotName);
            if (slot < 0 || !isTimestampCodec(descriptor.codecs().get(slot))) {
                continue;
            }
            TimestampColumn column = (TimestampColumn) container.column(t, slot);
            RoaringBitmap rows = new RoaringBitmap();
            for (int row = 0; row < column.size(); row++) {
                if (column.isParsed(row)) {
                    long millis = column.millisAt(row);
                    if (millis >= fromMillis && millis < toMillis) {
                        rows.add(row);
                    }
                }
            }
            scanned += column.size();
            collect(t, rows, matches);
        }
        return new QueryResult(
                matches.size(),
                scanned,
                elapsedSince(start),
                new ArrayList<>(matches.values()),
                null);
    }

    public QueryResult getStatistics() throws IOException {
        long start = System.nanoTime();
        List<ContainerStatistics.TemplateSummary> summaries = new ArrayList<>();
        Map<String, Map<String, Long>> valueCounts = new LinkedHashMap<>();
        Map<String, ContainerStatistics.TimestampStatistics> timestamps = new LinkedHashMap<>();

        List<TemplateDescriptor> descriptors = container.descriptors();
        for (int t = 0; t < descriptors.size(); t++) {
            TemplateDescriptor descriptor = descriptors.get(t);
            summaries.add(
                    new ContainerStatistics.TemplateSummary(
                            descriptor.id(),
                            container.template(t).toPatternString(),
                            descriptor.matchCount()));
            for (int slot = 0; slot < descriptor.slots().size(); slot++) {
                String name = descriptor.slots().get(slot).name();
                ColumnCodec codec = descriptor.codecs().get(slot);
                if (codec == ColumnCodec.DICTIONARY) {
                    countValues(
                            (IndexedColumn) container.column(t, slot),
                            valueCounts.computeIfAbsent(name, k -> new LinkedHashMap<>()));
                } else if (isTimestampCodec(codec)) {
                    timestamps.merge(
                            name,
                            timestampStatistics((TimestampColumn) container.column(t, slot)),
                            ContainerStatistics.TimestampStatistics::merge);
                }
            }
        }

        ContainerStatistics statistics =
                new ContainerStatistics(
                        container.totalLines(),
                        container.templateCount(),
                        container.unmatchedCount(),
                        summaries,
                        valueCounts,
                        timestamps);
        return new QueryResult(
                container.totalLines(),
                0,
                elapsedSince(start),
                Collections.emptyList(),
                statistics);
    }

    // ------------------------------------------------------------------------

    private static boolean declaresAll(
            TemplateDescriptor descriptor, Map<String, SlotPredicate> predicates) {
        for (String slotName : predicates.keySet()) {
            if (descriptor.slotIndex(slotName) < 0) {
                return false;
            }
        }
        return true;
    }

    /** 在候选行(null 表示全部行)中求值谓词。 */
    private static RoaringBitmap evaluate(
            DecodedColumn column, SlotPredicate predicate, RoaringBitmap candidates) {
        RoaringBitmap hits = new RoaringBitmap();
        if (column instanceof IndexedColumn) {
            IndexedColumn indexed = (IndexedColumn) column;
            Map<Integer, Boolean> verdicts = new HashMap<>();
            IntIterator rows = candidateRows(column, candidates);
            while (rows.hasNext()) {
                int row = rows.next();
                int index = indexed.indexAt(row);
                boolean hit =
                        index < 0
                                ? predicate.test(indexed.get(row))
                                : verdicts.computeIfAbsent(
                                        index, i -> predicate.test(indexed.dictionary().get(i)));
                if (hit) {
                    hits.add(row);
                }
            }
            return hits;
        }
        IntIterator rows = candidateRows(column, candidates);
        while (rows.hasNext()) {
            int row = rows.next();
            if (predicate.test(column.get(row))) {
                hits.add(row);
            }
        }
        return hits;
    }

    private static IntIterator candidateRows(DecodedColumn column, RoaringBitmap candidates) {
        if (candidates != null) {
            return candidates.getIntIterator();
        }
        return RoaringBitmap.bitmapOfRange(0, column.size()).getIntIterator();
    }

    private void collect(int templateIndex, RoaringBitmap rows, Map<Integer, String> matches)
            throws IOException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        int[] positions = container.rowPositions(templateIndex);
        IntIterator iterator = rows.getIntIterator();
        while (iterator.hasNext()) {
            int row = iterator.next();
            matches.put(positions[row], container.reconstruct(templateIndex, row));
        }
    }

    private static void countValues(IndexedColumn column, Map<String, Long> counts) {
        for (int row = 0; row < column.size(); row++) {
            int index = column.indexAt(row);
            String value = index < 0 ? column.get(row) : column.dictionary().get(index);
            counts.merge(value, 1L, Long::sum);
        }
    }

    private static ContainerStatistics.TimestampStatistics timestampStatistics(
            TimestampColumn column) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        long parsed = 0;
        for (int row = 0; row < column.size(); row++) {
            if (column.isParsed(row)) {
                long millis = column.millisAt(row);
                min = Math.min(min, millis);
                max = Math.max(max, millis);
                parsed++;
            }
        }
        return new ContainerStatistics.TimestampStatistics(
                min, max, parsed, column.exceptions().size());
    }

    private static boolean isTimestampCodec(ColumnCodec codec) {
        return codec == ColumnCodec.TIMESTAMP_DELTA || codec == ColumnCodec.TIMESTAMP_GORILLA;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
