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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** 已知时间戳格式的有序列表,按 id 持久化到容器中。 */
public class TimestampLayouts {

    private static final String D4 = "\\d{4}";
    private static final String D2 = "\\d{2}";
    private static final String HMS = D2 + ":" + D2 + ":" + D2;
    private static final String MON = "[A-Z][a-z]{2}";

    private static final List<TimestampLayout> LAYOUTS =
            Collections.unmodifiableList(
                    Arrays.asList(
                            TimestampLayout.dateTime(
                                    0, "uuuu-MM-dd HH:mm:ss", D4 + "-" + D2 + "-" + D2 + " " + HMS),
                            TimestampLayout.dateTime(
                                    1,
                                    "uuuu-MM-dd HH:mm:ss,SSS",
                                    D4 + "-" + D2 + "-" + D2 + " " + HMS + ",\\d{3}"),
                            TimestampLayout.dateTime(
                                    2,
                                    "uuuu-MM-dd HH:mm:ss.SSS",
                                    D4 + "-" + D2 + "-" + D2 + " " + HMS + "\\.\\d{3}"),
                            TimestampLayout.dateTime(
                                    3,
                                    "uuuu-MM-dd'T'HH:mm:ss",
                                    D4 + "-" + D2 + "-" + D2 + "T" + HMS),
                            TimestampLayout.dateTime(
                                    4,
                                    "uuuu-MM-dd'T'HH:mm:ss.SSS",
                                    D4 + "-" + D2 + "-" + D2 + "T" + HMS + "\\.\\d{3}"),
                            TimestampLayout.dateTime(
                                    5,
                                    "uuuu-MM-dd'T'HH:mm:ss'Z'",
                                    D4 + "-" + D2 + "-" + D2 + "T" + HMS + "Z"),
                            TimestampLayout.dateTime(
                                    6,
                                    "uuuu-MM-dd'T'HH:mm:ss.SSS'Z'",
                                    D4 + "-" + D2 + "-" + D2 + "T" + HMS + "\\.\\d{3}Z"),
                            TimestampLayout.dateTime(
                                    7,
                                    "EEE MMM dd HH:mm:ss uuuu",
                                    MON + " " + MON + " " + D2 + " " + HMS + " " + D4),
                            TimestampLayout.dateTime(
                                    8,
                                    "uuuuMMdd-HH:mm:ss:SSS",
                                    "\\d{8}-" + HMS + ":\\d{3}"),
                            TimestampLayout.dateTime(
                                    9, "MMM dd HH:mm:ss", MON + " " + D2 + " " + HMS),
                            TimestampLayout.dateTime(
                                    10,
                                    "dd/MMM/uuuu:HH:mm:ss",
                                    D2 + "/" + MON + "/" + D4 + ":" + HMS),
                            TimestampLayout.dateTime(
                                    11, "uuuu-MM-dd", D4 + "-" + D2 + "-" + D2),
                            TimestampLayout.dateTime(
                                    12,
                                    "uuuu/MM/dd HH:mm:ss",
                                    D4 + "/" + D2 + "/" + D2 + " " + HMS),
                            TimestampLayout.dateTime(
                                    13, "uu/MM/dd", D2 + "/" + D2 + "/" + D2),
                            TimestampLayout.dateTime(14, "HH:mm:ss.SSS", HMS + "\\.\\d{3}"),
                            TimestampLayout.dateTime(15, "HH:mm:ss,SSS", HMS + ",\\d{3}"),
                            TimestampLayout.dateTime(16, "HH:mm:ss", HMS),
                            TimestampLayout.epoch(17, "epoch-millis", "1\\d{12}", 1L),
                            TimestampLayout.epoch(18, "epoch-seconds", "1\\d{9}", 1000L)));

    private TimestampLayouts() {}

    public static List<TimestampLayout> all() {
        return LAYOUTS;
    }

    /** 第一个能解析该值的格式,都不能解析时返回 null。 */
    @Nullable
    public static TimestampLayout detect(String value) {
        for (TimestampLayout layout : LAYOUTS) {
            if (layout.parse(value) != null) {
                return layout;
            }
        }
        return null;
    }

    public static TimestampLayout byId(int id) {
        if (id < 0 || id >= LAYOUTS.size()) {
            throw new IllegalArgumentException("Unknown timestamp layout id: " + id);
        }
        return LAYOUTS.get(id);
    }
}
