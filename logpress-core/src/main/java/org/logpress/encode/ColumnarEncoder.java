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
import org.logpress.classify.TimestampLayout;
import org.logpress.template.LogTemplate;
import org.logpress.template.SlotSpec;
import org.logpress.template.TemplateRows;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列式编码器: 按槽位的语义类型为每一列选择编码方式。
 *
 * <table border="1">
 *   <tr><th>语义类型</th><th>编码</th></tr>
 *   <tr><td>TIMESTAMP</td><td>delta 与 Gorilla 都试编码,取较小者;没有可解析值时用词元池</td></tr>
 *   <tr><td>SEVERITY, STATUS, USER_ID</td><td>字典</td></tr>
 *   <tr><td>ERROR_CODE, PORT, PROCESS_ID</td><td>至少一半是规范整数时 zigzag + varint,否则字典</td></tr>
 *   <tr><td>METRIC</td><td>以整数为主时 zigzag + varint,以小数为主时 double,否则词元池</td></tr>
 *   <tr><td>其他自由文本类型</td><td>词元池下标</td></tr>
 *   <tr><td>UNMATCHED 的 raw 槽位</td><td>原文</td></tr>
 * </table>
 *
 * <p>编码从不丢值,主路径无法表示的值进入列的例外列表。
 */
public class ColumnarEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnarEncoder.class);

    private final int rleMinRun;
    private final boolean gorillaTrial;

    public ColumnarEncoder(LogPressOptions options) {
        this.rleMinRun = options.rleMinRun();
        this.gorillaTrial = options.timestampGorillaTrial();
    }

    public EncodedTemplate encode(TemplateRows rows, TokenPool pool) throws IOException {
        LogTemplate template = rows.template();
        CodecContext context = new CodecContext(() -> pool, rleMinRun);
        Map<String, EncodedColumn> columns = new LinkedHashMap<>();
        List<SlotSpec> slots = template.slots();
        for (int i = 0; i < slots.size(); i++) {
            SlotSpec slot = slots.get(i);
            List<String> values = rows.column(i);
            EncodedColumn column =
                    template.isUnmatched()
                            ? ValueCodecs.of(ColumnCodec.VERBATIM).encode(values, context)
                            : encodeColumn(slot.type(), values, context);
            LOG.debug(
                    "Encoded {}/{} ({}) with {} into {} bytes",
                    template.id(),
                    slot.name(),
                    slot.type(),
                    column.codec(),
                    column.payload().length);
            columns.put(slot.name(), column);
        }
        return new EncodedTemplate(template, rows.lineNumbers(), columns);
    }

    public EncodedColumn encodeColumn(
            SemanticType type, List<String> values, CodecContext context) throws IOException {
        switch (type) {
            case TIMESTAMP:
                return encodeTimestamps(values, context);
            case SEVERITY:
            case STATUS:
            case USER_ID:
                return ValueCodecs.of(ColumnCodec.DICTIONARY).encode(values, context);
            case ERROR_CODE:
            case PORT:
            case PROCESS_ID:
                int integers = countCanonical(values);
                if (integers * 2 >= values.size()) {
                    warnOnExceptions(type, values.size() - integers, values.size());
                    return ValueCodecs.of(ColumnCodec.ZIGZAG_VARINT).encode(values, context);
                }
                return ValueCodecs.of(ColumnCodec.DICTIONARY).encode(values, context);
            case METRIC:
                return encodeMetrics(values, context);
            default:
                return ValueCodecs.of(ColumnCodec.POOL_INDEX).encode(values, context);
        }
    }

    private EncodedColumn encodeTimestamps(List<String> values, CodecContext context)
            throws IOException {
        TimestampLayout layout = TimestampCodec.detectLayout(values);
        if (layout == null) {
            LOG.debug("No parsable timestamp among {} values, using the token pool", values.size());
            return ValueCodecs.of(ColumnCodec.POOL_INDEX).encode(values, context);
        }
        int exact = 0;
        for (String value : values) {
            if (layout.isExact(value)) {
                exact++;
            }
        }
        warnOnExceptions(SemanticType.TIMESTAMP, values.size() - exact, values.size());

        EncodedColumn delta = ValueCodecs.of(ColumnCodec.TIMESTAMP_DELTA).encode(values, context);
        if (!gorillaTrial) {
            return delta;
        }
        EncodedColumn gorilla =
                ValueCodecs.of(ColumnCodec.TIMESTAMP_GORILLA).encode(values, context);
        return gorilla.payload().length < delta.payload().length ? gorilla : delta;
    }

    private EncodedColumn encodeMetrics(List<String> values, CodecContext context)
            throws IOException {
        int integers = countCanonical(values);
        int decimals = 0;
        for (String value : values) {
            if (DoubleCodec.isExact(value)) {
                decimals++;
            }
        }
        if (integers >= decimals && integers * 2 >= values.size()) {
            warnOnExceptions(SemanticType.METRIC, values.size() - integers, values.size());
            return ValueCodecs.of(ColumnCodec.ZIGZAG_VARINT).encode(values, context);
        }
        if (decimals * 2 >= values.size()) {
            warnOnExceptions(SemanticType.METRIC, values.size() - decimals, values.size());
            return ValueCodecs.of(ColumnCodec.DOUBLE).encode(values, context);
        }
        return ValueCodecs.of(ColumnCodec.POOL_INDEX).encode(values, context);
    }

    private static int countCanonical(List<String> values) {
        int count = 0;
        for (String value : values) {
            if (ZigZagVarintCodec.isCanonical(value)) {
                count++;
            }
        }
        return count;
    }

    private static void warnOnExceptions(SemanticType type, int exceptions, int total) {
        if (exceptions * 2 > total) {
            LOG.warn(
                    "{} of {} {} values do not fit the primary codec and are kept as exceptions",
                    exceptions,
                    total,
                    type);
        }
    }
}
