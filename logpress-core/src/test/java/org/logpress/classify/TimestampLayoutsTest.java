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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link TimestampLayouts} and {@link TimestampLayout}. */
public class TimestampLayoutsTest {

    private static long utc(int year, int month, int day, int hour, int minute, int second) {
        return LocalDateTime.of(year, month, day, hour, minute, second)
                .toInstant(ZoneOffset.UTC)
                .toEpochMilli();
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "2005-06-09 06:07:04|0",
                "2005-06-09 06:07:04,123|1",
                "2005-06-09 06:07:04.123|2",
                "2005-06-09T06:07:04|3",
                "2005-06-09T06:07:04.123|4",
                "2005-06-09T06:07:04Z|5",
                "2005-06-09T06:07:04.123Z|6",
                "Thu Jun 09 06:07:04 2005|7",
                "20171223-22:15:29:606|8",
                "Jun 09 06:07:04|9",
                "09/Jun/2005:06:07:04|10",
                "2005-06-09|11",
                "2005/06/09 06:07:04|12",
                "05/06/09|13",
                "06:07:04.123|14",
                "06:07:04,123|15",
                "06:07:04|16",
                "1118297224000|17",
                "1118297224|18"
            })
    public void testDetectAndFormatExactly(String value, int layoutId) {
        TimestampLayout layout = TimestampLayouts.detect(value);
        assertThat(layout).isNotNull();
        assertThat(layout.id()).isEqualTo(layoutId);
        assertThat(TimestampLayouts.byId(layoutId)).isSameAs(layout);
        assertThat(layout.isExact(value)).isTrue();
        assertThat(layout.format(layout.parse(value))).isEqualTo(value);
    }

    @Test
    public void testParsedValues() {
        long expected = utc(2005, 6, 9, 6, 7, 4);
        assertThat(TimestampLayouts.byId(0).parse("2005-06-09 06:07:04")).isEqualTo(expected);
        assertThat(TimestampLayouts.byId(2).parse("2005-06-09 06:07:04.123"))
                .isEqualTo(expected + 123);
        assertThat(TimestampLayouts.byId(18).parse("1118297224")).isEqualTo(expected);
        assertThat(TimestampLayouts.byId(17).parse("1118297224000")).isEqualTo(expected);
        // year-less layouts assume 1970, date-less layouts assume 1970-01-01
        assertThat(TimestampLayouts.byId(9).parse("Jun 09 06:07:04"))
                .isEqualTo(utc(1970, 6, 9, 6, 7, 4));
        assertThat(TimestampLayouts.byId(16).parse("06:07:04")).isEqualTo(utc(1970, 1, 1, 6, 7, 4));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "N/A",
                "",
                "2005-13-09 06:07:04",
                "2005-02-30",
                "Feb 29 10:00:00",
                "Mon Jun 09 06:07:04 2005",
                "25:00:00",
                "2005-06-09 06:07:04.123456"
            })
    public void testUnparsableValues(String value) {
        assertThat(TimestampLayouts.detect(value)).isNull();
    }

    @Test
    public void testUnknownLayoutId() {
        assertThatThrownBy(() -> TimestampLayouts.byId(TimestampLayouts.all().size()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimestampLayouts.byId(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testLayoutIdsAreDense() {
        for (int i = 0; i < TimestampLayouts.all().size(); i++) {
            assertThat(TimestampLayouts.all().get(i).id()).isEqualTo(i);
        }
    }
}
