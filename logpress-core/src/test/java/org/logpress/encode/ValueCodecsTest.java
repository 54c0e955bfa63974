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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for every {@link ValueCodec} registered in {@link ValueCodecs}. */
public class ValueCodecsTest {

    private TokenPool pool;
    private CodecContext context;

    @BeforeEach
    public void before() {
        pool = new TokenPool();
        context = new CodecContext(() -> pool, 3);
    }

    private static List<String> decoded(DecodedColumn column) {
        List<String> values = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            values.add(column.get(row));
        }
        return values;
    }

    private List<String> roundTrip(ColumnCodec codec, List<String> values) throws IOException {
        ValueCodec valueCodec = ValueCodecs.of(codec);
        assertThat(valueCodec.codec()).isEqualTo(codec);
        EncodedColumn encoded = valueCodec.encode(values, context);
        assertThat(encoded.codec()).isEqualTo(codec);
        assertThat(encoded.valueCount()).isEqualTo(values.size());
        return decoded(valueCodec.decode(encoded, context));
    }

    @ParameterizedTest
    @EnumSource(
            value = ColumnCodec.class,
            names = {"TIMESTAMP_DELTA", "TIMESTAMP_GORILLA"})
    public void testTimestampCodecs(ColumnCodec codec) throws IOException {
        List<String> values =
                Arrays.asList(
                        "2005-06-09 06:07:04",
                        "2005-06-09 06:07:05",
                        "2005-06-09 06:07:05",
                        "N/A",
                        "2005-06-09 06:07:09",
                        "2005-06-09 05:00:00",
                        "2031-01-01 00:00:00",
                        "1970-01-01 00:00:00",
                        "1969-12-31 23:59:59",
                        "2005-06-09 06:07:10");
        assertThat(roundTrip(codec, values)).isEqualTo(values);

        TimestampColumn column =
                (TimestampColumn)
                        ValueCodecs.of(codec)
                                .decode(ValueCodecs.of(codec).encode(values, context), context);
        assertThat(column.layout().id()).isZero();
        assertThat(column.isParsed(3)).isFalse();
        assertThat(column.exceptions().size()).isEqualTo(1);
        assertThat(column.millisAt(7)).isZero();
        assertThat(column.millisAt(8)).isEqualTo(-1000L);
    }

    @Test
    public void testGorillaHandlesIrregularDeltas() throws IOException {
        List<String> values = new ArrayList<>();
        long millis = 1_118_297_224_000L;
        long[] steps = {0, 1, 1, 2, 63, -64, 255, -256, 2047, -2048, 100_000, 5_000_000_000L, 1};
        for (long step : steps) {
            millis += step;
            values.add(Long.toString(millis));
        }
        assertThat(roundTrip(ColumnCodec.TIMESTAMP_GORILLA, values)).isEqualTo(values);
        assertThat(roundTrip(ColumnCodec.TIMESTAMP_DELTA, values)).isEqualTo(values);
    }

    @Test
    public void testTimestampCodecRejectsColumnWithoutTimestamps() {
        assertThatThrownBy(
                        () ->
                                ValueCodecs.of(ColumnCodec.TIMESTAMP_DELTA)
                                        .encode(Arrays.asList("N/A", "-"), context))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testDictionary() throws IOException {
        List<String> values = Arrays.asList("INFO", "ERROR", "INFO", "INFO", "INFO", "WARN");
        EncodedColumn encoded = ValueCodecs.of(ColumnCodec.DICTIONARY).encode(values, context);
        IndexedColumn column =
                (IndexedColumn) ValueCodecs.of(ColumnCodec.DICTIONARY).decode(encoded, context);

        assertThat(column.dictionary()).containsExactly("INFO", "ERROR", "WARN");
        assertThat(column.indexAt(0)).isZero();
        assertThat(column.indexAt(1)).isEqualTo(1);
        assertThat(column.exceptions().isEmpty()).isTrue();
        assertThat(decoded(column)).isEqualTo(values);
        assertThat(pool.size()).isZero();
    }

    @Test
    public void testZigZagVarint() throws IOException {
        List<String> values =
                Arrays.asList(
                        "0",
                        "-1",
                        "65535",
                        "007",
                        "-0",
                        "+5",
                        "9223372036854775807",
                        "-9223372036854775808",
                        "99999999999999999999",
                        "",
                        "12");
        assertThat(roundTrip(ColumnCodec.ZIGZAG_VARINT, values)).isEqualTo(values);

        assertThat(ZigZagVarintCodec.isCanonical("42")).isTrue();
        assertThat(ZigZagVarintCodec.isCanonical("-42")).isTrue();
        assertThat(ZigZagVarintCodec.isCanonical("042")).isFalse();
        assertThat(ZigZagVarintCodec.isCanonical("-0")).isFalse();
    }

    @Test
    public void testDouble() throws IOException {
        List<String> values =
                Arrays.asList("1.5", "-0.25", "100", "1.50", "NaN", "1.0E10", "3.141592653589793");
        assertThat(roundTrip(ColumnCodec.DOUBLE, values)).isEqualTo(values);

        assertThat(DoubleCodec.isExact("1.5")).isTrue();
        assertThat(DoubleCodec.isExact("100")).isFalse();
        assertThat(DoubleCodec.isExact("Infinity")).isFalse();
    }

    @Test
    public void testPoolIndexSharesPool() throws IOException {
        List<String> first = Arrays.asList("alpha", "beta", "alpha");
        List<String> second = Arrays.asList("beta", "gamma");
        EncodedColumn a = ValueCodecs.of(ColumnCodec.POOL_INDEX).encode(first, context);
        EncodedColumn b = ValueCodecs.of(ColumnCodec.POOL_INDEX).encode(second, context);

        assertThat(pool.values()).containsExactly("alpha", "beta", "gamma");
        assertThat(decoded(ValueCodecs.of(ColumnCodec.POOL_INDEX).decode(a, context)))
                .isEqualTo(first);
        IndexedColumn column =
                (IndexedColumn) ValueCodecs.of(ColumnCodec.POOL_INDEX).decode(b, context);
        assertThat(decoded(column)).isEqualTo(second);
        assertThat(column.indexAt(1)).isEqualTo(2);
    }

    @Test
    public void testPoolIndexRejectsIndexOutsidePool() throws IOException {
        EncodedColumn encoded =
                ValueCodecs.of(ColumnCodec.POOL_INDEX)
                        .encode(Arrays.asList("alpha", "beta"), context);
        CodecContext emptyPool = new CodecContext(TokenPool::new, 3);
        assertThatThrownBy(
                        () -> ValueCodecs.of(ColumnCodec.POOL_INDEX).decode(encoded, emptyPool))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void testVerbatim() throws IOException {
        List<String> values = Arrays.asList("", "a lonely line", "ü 😀 \t");
        assertThat(roundTrip(ColumnCodec.VERBATIM, values)).isEqualTo(values);
    }

    @ParameterizedTest
    @EnumSource(ColumnCodec.class)
    public void testEmptyColumns(ColumnCodec codec) throws IOException {
        if (codec == ColumnCodec.TIMESTAMP_DELTA || codec == ColumnCodec.TIMESTAMP_GORILLA) {
            return;
        }
        assertThat(roundTrip(codec, Collections.emptyList())).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ColumnCodec.class)
    public void testTruncatedPayloadIsRejected(ColumnCodec codec) throws IOException {
        List<String> values =
                codec == ColumnCodec.TIMESTAMP_DELTA || codec == ColumnCodec.TIMESTAMP_GORILLA
                        ? Arrays.asList("2005-06-09 06:07:04", "2005-06-09 06:07:05")
                        : Arrays.asList("12", "1.5", "alpha");
        EncodedColumn encoded = ValueCodecs.of(codec).encode(values, context);
        byte[] truncated = Arrays.copyOf(encoded.payload(), encoded.payload().length - 1);
        EncodedColumn broken = new EncodedColumn(codec, truncated, values.size());
        assertThatThrownBy(() -> ValueCodecs.of(codec).decode(broken, context))
                .isInstanceOf(IOException.class);
    }
}
