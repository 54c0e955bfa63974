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

import org.logpress.LogCompressor;
import org.logpress.LogPressOptions;
import org.logpress.container.LogContainer;
import org.logpress.container.TemplateDescriptor;
import org.logpress.encode.DecodedColumn;
import org.logpress.template.SlotSpec;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/** Tests for {@link LogQueryEngine}. */
public class LogQueryEngineTest {

    private static final long T0 = 1118297224000L; // 2005-06-09 06:07:04 UTC

    private static final List<String> BRACKETED_LOG =
            Arrays.asList(
                    "[2005-06-09 06:07:04] [INFO] start",
                    "[2005-06-09 06:07:05] [ERROR] fail",
                    "[2005-06-09 06:07:06] [INFO] start");

    private static final List<String> UNPARSABLE_TIMESTAMP_LOG =
            Arrays.asList(
                    "[2005-06-09 06:07:04] [INFO] start",
                    "[2005-06-09 06:07:05] [ERROR] fail",
                    "[N/A] [INFO] retry",
                    "[2005-06-09 06:07:07] [INFO] start");

    private static LogQueryEngine open(List<String> lines) throws IOException {
        Map<String, String> options = new HashMap<>();
        options.put(LogPressOptions.MIN_SUPPORT.key(), "2");
        LogCompressor compressor = new LogCompressor(new LogPressOptions(options));
        return compressor.open(compressor.compress(lines).container());
    }

    private static List<String> twoTemplates() {
        List<String> lines = new ArrayList<>(BRACKETED_LOG);
        for (int i = 0; i < 3; i++) {
            lines.add("user u" + i + " logged in");
        }
        return lines;
    }

    @Test
    public void testFilterBySeverity() throws IOException {
        QueryResult result = open(BRACKETED_LOG).filterBy("severity", "ERROR");

        assertThat(result.matchedCount()).isEqualTo(1);
        assertThat(result.logs()).containsExactly("[2005-06-09 06:07:05] [ERROR] fail");
        assertThat(result.scannedCount()).isEqualTo(3);
        assertThat(result.statistics()).isNull();
    }

    private static List<String> mixedCorpus() {
        String[] severities = {"INFO", "ERROR", "WARN", "INFO"};
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            lines.add(
                    String.format(
                            "[2005-06-09 06:07:%02d] [%s] worker %d %s",
                            i, severities[i % 4], i % 3, i % 5 == 0 ? "stopped" : "started"));
            if (i % 3 == 0) {
                lines.add("user u" + (i % 4) + " logged in from 10.0.0." + (i % 2));
            }
            if (i == 5) {
                lines.add("some odd line!");
            }
            if (i == 17) {
                lines.add("stray line with \u00fcmlauts and \t tabs");
            }
        }
        lines.add("");
        return lines;
    }

    @Test
    public void testFilterMatchesFullDecode() throws IOException {
        List<String> lines = mixedCorpus();
        LogQueryEngine engine = open(lines);
        LogContainer container = engine.container();
        assertThat(container.decodeAll()).isEqualTo(lines);
        assertThat(container.templateCount()).isGreaterThanOrEqualTo(2);
        assertThat(container.unmatchedCount()).isPositive();

        // slot name -> value -> line position -> line, built from the decoded columns
        Map<String, Map<String, TreeMap<Integer, String>>> expected = new LinkedHashMap<>();
        List<TemplateDescriptor> descriptors = container.descriptors();
        for (int t = 0; t < descriptors.size(); t++) {
            int[] positions = container.rowPositions(t);
            List<SlotSpec> slots = descriptors.get(t).slots();
            for (int slot = 0; slot < slots.size(); slot++) {
                DecodedColumn column = container.column(t, slot);
                assertThat(column.size()).isEqualTo(positions.length);
                Map<String, TreeMap<Integer, String>> byValue =
                        expected.computeIfAbsent(slots.get(slot).name(), k -> new HashMap<>());
                for (int row = 0; row < column.size(); row++) {
                    byValue.computeIfAbsent(column.get(row), k -> new TreeMap<>())
                            .put(positions[row], lines.get(positions[row]));
                }
            }
        }

        assertThat(expected).containsKey("raw");
        for (Map.Entry<String, Map<String, TreeMap<Integer, String>>> slot : expected.entrySet()) {
            for (Map.Entry<String, TreeMap<Integer, String>> value : slot.getValue().entrySet()) {
                QueryResult result = engine.filterBy(slot.getKey(), value.getKey());
                assertThat(result.logs())
                        .as("%s = '%s'", slot.getKey(), value.getKey())
                        .containsExactlyElementsOf(value.getValue().values());
                assertThat(result.matchedCount()).isEqualTo(value.getValue().size());
            }
        }
    }

    @Test
    public void testFilterDecodesOnlyTemplatesDeclaringTheSlot() throws IOException {
        LogQueryEngine engine = open(twoTemplates());
        assertThat(engine.container().descriptors()).hasSize(2);

        QueryResult result = engine.filterBy("severity", "INFO");

        assertThat(result.logs()).containsExactly(BRACKETED_LOG.get(0), BRACKETED_LOG.get(2));
        assertThat(engine.container().decodedSections())
                .contains("col/T000/severity")
                .noneMatch(name -> name.contains("T001"));
    }

    @Test
    public void testFilterOnUnknownSlot() throws IOException {
        LogQueryEngine engine = open(twoTemplates());

        QueryResult result = engine.filterBy("port", "22");

        assertThat(result.matchedCount()).isZero();
        assertThat(result.scannedCount()).isZero();
        assertThat(result.logs()).isEmpty();
        assertThat(engine.container().decodedSections()).containsExactly("meta");
    }

    @Test
    public void testFilterAllIntersectsPredicates() throws IOException {
        LogQueryEngine engine = open(BRACKETED_LOG);

        Map<String, SlotPredicate> predicates = new LinkedHashMap<>();
        predicates.put("severity", SlotPredicate.equalTo("INFO"));
        predicates.put("message", SlotPredicate.equalTo("start"));
        QueryResult result = engine.filterAll(predicates);
        assertThat(result.logs()).containsExactly(BRACKETED_LOG.get(0), BRACKETED_LOG.get(2));
        assertThat(result.scannedCount()).isEqualTo(3 + 2);

        predicates.put("message", SlotPredicate.equalTo("fail"));
        result = engine.filterAll(predicates);
        assertThat(result.matchedCount()).isZero();
        assertThat(result.logs()).isEmpty();
    }

    @Test
    public void testFilterAllStopsAfterEmptyIntersection() throws IOException {
        LogQueryEngine engine = open(BRACKETED_LOG);

        Map<String, SlotPredicate> predicates = new LinkedHashMap<>();
        predicates.put("severity", SlotPredicate.equalTo("DEBUG"));
        predicates.put("message", SlotPredicate.equalTo("start"));
        QueryResult result = engine.filterAll(predicates);

        assertThat(result.matchedCount()).isZero();
        assertThat(result.scannedCount()).isEqualTo(3);
        assertThat(engine.container().decodedSections()).doesNotContain("col/T000/message");
    }

    @Test
    public void testFilterAllRequiresPredicates() throws IOException {
        LogQueryEngine engine = open(BRACKETED_LOG);

        assertThatThrownBy(() -> engine.filterAll(Collections.emptyMap()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPredicateFactories() throws IOException {
        LogQueryEngine engine = open(BRACKETED_LOG);

        assertThat(engine.filterBy("severity", SlotPredicate.in("ERROR", "WARN")).logs())
                .containsExactly(BRACKETED_LOG.get(1));
        assertThat(engine.filterBy("severity", SlotPredicate.equalToIgnoreCase("error")).logs())
                .containsExactly(BRACKETED_LOG.get(1));
        assertThat(engine.filterBy("message", SlotPredicate.startsWith("st")).matchedCount())
                .isEqualTo(2);
        assertThat(engine.filterBy("message", SlotPredicate.contains("ai")).logs())
                .containsExactly(BRACKETED_LOG.get(1));
        assertThat(engine.filterBy("severity", SlotPredicate.matches("^I.F")).matchedCount())
                .isEqualTo(2);
        assertThat(engine.filterBy("severity", SlotPredicate.equalTo("INFO").negate()).logs())
                .containsExactly(BRACKETED_LOG.get(1));

        assertThat(SlotPredicate.equalTo("INFO").negate()).hasToString("not = 'INFO'");
    }

    @Test
    public void testFilterByTimeRange() throws IOException {
        LogQueryEngine engine = open(BRACKETED_LOG);

        assertThat(engine.filterByTimeRange("timestamp", T0 + 1000, T0 + 2000).logs())
                .containsExactly(BRACKETED_LOG.get(1));
        assertThat(engine.filterByTimeRange("timestamp", T0, T0 + 3000).matchedCount())
                .isEqualTo(3);
        assertThat(engine.filterByTimeRange("timestamp", T0 + 3000, T0 + 9000).logs()).isEmpty();

        QueryResult notTimestamp = engine.filterByTimeRange("severity", 0, Long.MAX_VALUE);
        assertThat(notTimestamp.matchedCount()).isZero();
        assertThat(notTimestamp.scannedCount()).isZero();
    }

    @Test
    public void testTimeRangeSkipsUnparsableTimestamps() throws IOException {
        List<String> lines = UNPARSABLE_TIMESTAMP_LOG;
        QueryResult result =
                open(lines).filterByTimeRange("timestamp", Long.MIN_VALUE, Long.MAX_VALUE);

        assertThat(result.scannedCount()).isEqualTo(4);
        assertThat(result.logs()).containsExactly(lines.get(0), lines.get(1), lines.get(3));
    }

    @Test
    public void testCountAllUsesMetadataOnly() throws IOException {
        LogQueryEngine engine = open(twoTemplates());

        QueryResult result = engine.countAll();

        assertThat(result.matchedCount()).isEqualTo(6);
        assertThat(result.scannedCount()).isZero();
        assertThat(result.logs()).isEmpty();
        assertThat(engine.container().decodedSections()).containsExactly("meta");
    }

    @Test
    public void testStatisticsExcludeUnparsableTimestamps() throws IOException {
        LogQueryEngine engine = open(UNPARSABLE_TIMESTAMP_LOG);
        assertThat(engine.container().decodeAll()).isEqualTo(UNPARSABLE_TIMESTAMP_LOG);

        QueryResult result = engine.getStatistics();
        ContainerStatistics statistics = result.statistics();

        assertThat(result.matchedCount()).isEqualTo(4);
        assertThat(statistics).isNotNull();
        assertThat(statistics.totalLines()).isEqualTo(4);
        assertThat(statistics.templateCount()).isEqualTo(1);
        assertThat(statistics.unmatchedCount()).isZero();
        assertThat(statistics.templates())
                .extracting(ContainerStatistics.TemplateSummary::pattern)
                .containsExactly("[TIMESTAMP] [SEVERITY] MESSAGE");
        assertThat(statistics.valueCounts().get("severity"))
                .containsOnly(entry("INFO", 3L), entry("ERROR", 1L));

        ContainerStatistics.TimestampStatistics timestamps =
                statistics.timestamps().get("timestamp");
        assertThat(timestamps.parsedCount()).isEqualTo(3);
        assertThat(timestamps.exceptionCount()).isEqualTo(1);
        assertThat(timestamps.min()).isEqualTo(T0);
        assertThat(timestamps.max()).isEqualTo(T0 + 3000);
    }

    @Test
    public void testStatisticsIncludeUnmatchedLines() throws IOException {
        List<String> lines = new ArrayList<>(twoTemplates());
        lines.add("something else entirely!");

        ContainerStatistics statistics = open(lines).getStatistics().statistics();

        assertThat(statistics.templateCount()).isEqualTo(2);
        assertThat(statistics.unmatchedCount()).isEqualTo(1);
        assertThat(statistics.templates())
                .extracting(ContainerStatistics.TemplateSummary::id)
                .containsExactly("T000", "T001", "UNMATCHED");
        assertThat(statistics.templates())
                .extracting(ContainerStatistics.TemplateSummary::matchCount)
                .containsExactly(3, 3, 1);
    }
}
