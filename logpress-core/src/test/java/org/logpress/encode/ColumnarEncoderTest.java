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

package org.logpress.encode;

import org.logpress.LogPressOptions;
import org.logpress.classify.SemanticType;
import org.logpress.template.LogTemplate;
import org.logpress.template.TemplateRows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for the codec selection of {@link ColumnarEncoder}. */
public class ColumnarEncoderTest {

    private TokenPool pool;
    private CodecContext context;

    @BeforeEach
    public void before() {
        pool = new TokenPool();
        context = new CodecContext(() -> pool, 3);
    }

    private static ColumnarEncoder encoder(String... keyValues) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            options.put(keyValues[i], keyValues[i + 1]);
        }
        return new ColumnarEncoder(new LogPressOptions(options));
    }

    private ColumnCodec codecOf(SemanticType type, String... values) throws IOException {
        return encoder().encodeColumn(type, Arrays.asList(values), context).codec();
    }

    @Test
    public void testCategoricalTypesUseDictionary() throws IOException {
        assertThat(codecOf(SemanticType.SEVERITY, "INFO", "ERROR", "INFO"))
                .isEqualTo(ColumnCodec.DICTIONARY);
        assertThat(codecOf(SemanticType.STATUS, "OK", "FAILED"))
                .isEqualTo(ColumnCodec.DICTIONARY);
        assertThat(codecOf(SemanticType.USER_ID, "root", "alice"))
                .isEqualTo(ColumnCodec.DICTIONARY);
    }

    @Test
    public void testIntegerTypes() throws IOException {
        assertThat(codecOf(SemanticType.PORT, "22", "8080", "x"))
                .isEqualTo(ColumnCodec.ZIGZAG_VARINT);
        assertThat(codecOf(SemanticType.PORT, "a", "b", "22"))
                .isEqualTo(ColumnCodec.DICTIONARY);
        assertThat(codecOf(SemanticType.PROCESS_ID, "19937", "19938"))
                .isEqualTo(ColumnCodec.ZIGZAG_VARINT);
        assertThat(codecOf(SemanticType.ERROR_CODE, "ERR-404", "ERR-500"))
                .isEqualTo(ColumnCodec.DICTIONARY);
    }

    @Test
    public void testMetrics() throws IOException {
        assertThat(codecOf(SemanticType.METRIC, "1", "2", "3.5"))
                .isEqualTo(ColumnCodec.ZIGZAG_VARINT);
        assertThat(codecOf(SemanticType.METRIC, "1.5", "2.25", "3"))
                .isEqualTo(ColumnCodec.DOUBLE);
        assertThat(codecOf(SemanticType.METRIC, "1.50", "abc", "x"))
                .isEqualTo(ColumnCodec.POOL_INDEX);
    }

    @Test
    public void testFreeTextUsesTokenPool() throws IOException {
        assertThat(codecOf(SemanticType.MESSAGE, "start", "fail", "start"))
                .isEqualTo(ColumnCodec.POOL_INDEX);
        assertThat(codecOf(SemanticType.HOST, "node-1.example.com"))
                .isEqualTo(ColumnCodec.POOL_INDEX);
        assertThat(pool.values()).containsExactly("start", "fail", "node-1.example.com");
    }

    @Test
    public void testTimestamps() throws IOException {
        List<String> values =
                Arrays.asList("2005-06-09 06:07:04", "N/A", "2005-06-09 06:07:06");
        EncodedColumn column = encoder().encodeColumn(SemanticType.TIMESTAMP, values, context);
        assertThat(column.codec())
                .isIn(ColumnCodec.TIMESTAMP_DELTA, ColumnCodec.TIMESTAMP_GORILLA);

        EncodedColumn delta = ValueCodecs.of(ColumnCodec.TIMESTAMP_DELTA).encode(values, context);
        EncodedColumn gorilla =
                ValueCodecs.of(ColumnCodec.TIMESTAMP_GORILLA).encode(values, context);
        assertThat(column.payload().length)
                .isEqualTo(Math.min(delta.payload().length, gorilla.payload().length));

        TimestampColumn decoded =
                (TimestampColumn) ValueCodecs.of(column.codec()).decode(column, context);
        assertThat(decoded.isParsed(1)).isFalse();
        assertThat(decoded.get(1)).isEqualTo("N/A");
        assertThat(decoded.get(2)).isEqualTo("2005-06-09 06:07:06");

        ColumnarEncoder deltaOnly =
                encoder(LogPressOptions.TIMESTAMP_GORILLA_TRIAL.key(), "false");
        assertThat(deltaOnly.encodeColumn(SemanticType.TIMESTAMP, values, context).codec())
                .isEqualTo(ColumnCodec.TIMESTAMP_DELTA);

        assertThat(codecOf(SemanticType.TIMESTAMP, "N/A", "never"))
                .isEqualTo(ColumnCodec.POOL_INDEX);
    }

    @Test
    public void testUnmatchedRowsAreStoredVerbatim() throws IOException {
        List<String[]> values =
                Arrays.asList(new String[] {"first odd line"}, new String[] {"second"});
        TemplateRows rows =
                new TemplateRows(
                        LogTemplate.unmatched(2, Collections.emptyList()),
                        new int[] {3, 7},
                        values);
        EncodedTemplate encoded = encoder().encode(rows, pool);

        assertThat(encoded.rowCount()).isEqualTo(2);
        assertThat(encoded.lineNumbers()).containsExactly(3, 7);
        assertThat(encoded.columns()).containsOnlyKeys("raw");
        assertThat(encoded.columns().get("raw").codec()).isEqualTo(ColumnCodec.VERBATIM);
        assertThat(pool.size()).isZero();
    }
}
