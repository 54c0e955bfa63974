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

import javax.annotation.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 一种时间戳文本格式,在文本与 UTC 毫秒时间之间双向转换。
 *
 * <p>解析前先用正则做快速预过滤,避免对明显不匹配的值抛出异常。缺少日期的格式以 1970-01-01
 * 为日期,缺少年份的格式以 1970 年为年份。只有 {@link #isExact} 为 true 的值才能只保存毫秒数,
 * 其余值需要原样保存。
 */
public final class TimestampLayout {

    private final int id;
    private final String pattern;
    private final Pattern prefilter;
    @Nullable private final DateTimeFormatter formatter;
    private final long epochUnit;

    private TimestampLayout(
            int id,
            String pattern,
            String prefilter,
            @Nullable DateTimeFormatter formatter,
            long epochUnit) {
        this.id = id;
        this.pattern = pattern;
        this.prefilter = Pattern.compile(prefilter);
        this.formatter = formatter;
        this.epochUnit = epochUnit;
    }

    static TimestampLayout dateTime(int id, String pattern, String prefilter) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().appendPattern(pattern);
        if (pattern.contains("MM") && !pattern.contains("u")) {
            builder.parseDefaulting(ChronoField.YEAR, 1970);
        }
        DateTimeFormatter formatter =
                builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
        return new TimestampLayout(id, pattern, prefilter, formatter, 0);
    }

    static TimestampLayout epoch(int id, String name, String prefilter, long unitMillis) {
        return new TimestampLayout(id, name, prefilter, null, unitMillis);
    }

    public int id() {
        return id;
    }

    public String pattern() {
        return pattern;
    }

    /** 解析为 UTC 毫秒时间,无法解析时返回 null。 */
    @Nullable
    public Long parse(String value) {
        if (!prefilter.matcher(value).matches()) {
            return null;
        }
        if (formatter == null) {
            try {
                return Math.multiplyExact(Long.parseLong(value), epochUnit);
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        try {
            TemporalAccessor parsed = formatter.parse(value);
            LocalDate date = parsed.query(TemporalQueries.localDate());
            LocalTime time = parsed.query(TemporalQueries.localTime());
            LocalDateTime dateTime =
                    LocalDateTime.of(
                            date == null ? LocalDate.of(1970, 1, 1) : date,
                            time == null ? LocalTime.MIDNIGHT : time);
            return dateTime.toEpochSecond(ZoneOffset.UTC) * 1000L
                    + dateTime.getNano() / 1_000_000;
        } catch (DateTimeException e) {
            return null;
        }
    }

    public String format(long millis) {
        if (formatter == null) {
            return Long.toString(millis / epochUnit);
        }
        LocalDateTime dateTime =
                LocalDateTime.ofEpochSecond(
                        Math.floorDiv(millis, 1000L),
                        (int) Math.floorMod(millis, 1000L) * 1_000_000,
                        ZoneOffset.UTC);
        return formatter.format(dateTime);
    }

    /** 值可解析,且由毫秒时间格式化后与原文逐字相同。 */
    public boolean isExact(String value) {
        Long millis = parse(value);
        return millis != null && format(millis).equals(value);
    }

    @Override
    public String toString() {
        return "TimestampLayout{" + id + ", '" + pattern + "'}";
    }
}
