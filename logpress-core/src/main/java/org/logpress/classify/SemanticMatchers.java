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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 默认的语义匹配器表。
 *
 * <p>表按优先级排列,越具体的类型越靠前: IP 地址在通用数值之前,带上下文关键字的整数类型
 * (端口、进程号、错误码)在 METRIC 之前,MESSAGE 作为最后的兜底。表在构造时创建且不可变,
 * 不存在全局注册表。
 */
public class SemanticMatchers {

    private static final String OCTET = "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

    private static final Pattern IPV4 =
            Pattern.compile("/?(" + OCTET + "\\.){3}" + OCTET + "(:\\d{1,5})?");
    private static final Pattern IPV6_GROUP = Pattern.compile("[0-9a-fA-F]{1,4}");
    private static final Pattern URL = Pattern.compile("[a-zA-Z][a-zA-Z0-9+.-]*://\\S+");
    private static final Pattern EMAIL =
            Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern UNSIGNED = Pattern.compile("\\d{1,18}");
    private static final Pattern SIGNED = Pattern.compile("-?\\d{1,18}");
    private static final Pattern CODE = Pattern.compile("[A-Z]{2,}[-_]?\\d{3,}");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern DRIVE_PATH = Pattern.compile("[A-Za-z]:\\\\.*");
    private static final Pattern HOST =
            Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*(\\.[A-Za-z0-9-]+)*\\.[A-Za-z][A-Za-z-]*");
    private static final Pattern NUMBER =
            Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private static final Set<String> SEVERITIES =
            words(
                    "DEBUG", "INFO", "WARN", "WARNING", "ERROR", "FATAL", "CRITICAL", "TRACE",
                    "NOTICE", "EMERG", "ALERT", "CRIT", "ERR", "SEVERE", "FINE");
    private static final Set<String> STATUSES =
            words(
                    "SUCCESS", "SUCCEEDED", "SUCCESSFUL", "FAILED", "FAILURE", "FAIL", "TIMEOUT",
                    "DENIED", "OK", "ACCEPTED", "REJECTED", "REFUSED", "COMPLETED", "ABORTED",
                    "STARTED", "STOPPED", "RUNNING", "PENDING", "UP", "DOWN");
    private static final Set<String> PORT_WORDS = words("port");
    private static final Set<String> PROCESS_WORDS = words("pid", "process", "proc");
    private static final Set<String> USER_WORDS = words("user", "uid", "username", "login");
    private static final Set<String> CODE_WORDS = words("errno", "code", "error");
    private static final Set<String> STATUS_WORDS = words("status");

    private static final List<SemanticMatcher> DEFAULT =
            Collections.unmodifiableList(
                    Arrays.asList(
                            SemanticMatcher.of(
                                    SemanticType.TIMESTAMP,
                                    0.95,
                                    (v, c) -> TimestampLayouts.detect(v) != null),
                            SemanticMatcher.of(
                                    SemanticType.IP_ADDRESS,
                                    0.95,
                                    (v, c) -> IPV4.matcher(v).matches() || isIpv6(v)),
                            SemanticMatcher.of(
                                    SemanticType.URL, 0.95, (v, c) -> URL.matcher(v).matches()),
                            SemanticMatcher.of(
                                    SemanticType.EMAIL,
                                    0.95,
                                    (v, c) -> EMAIL.matcher(v).matches()),
                            SemanticMatcher.of(
                                    SemanticType.SEVERITY,
                                    0.95,
                                    (v, c) -> SEVERITIES.contains(upper(v))),
                            SemanticMatcher.of(
                                    SemanticType.PORT,
                                    0.85,
                                    (v, c) ->
                                            isPort(v)
                                                    && (":".equals(c.previous())
                                                            || PORT_WORDS.contains(
                                                                    upper(c.previousWord())))),
                            SemanticMatcher.of(
                                    SemanticType.PROCESS_ID,
                                    0.80,
                                    (v, c) ->
                                            UNSIGNED.matcher(v).matches()
                                                    && (PROCESS_WORDS.contains(
                                                                    upper(c.previousWord()))
                                                            || ("[".equals(c.open())
                                                                    && c.followsWord()))),
                            SemanticMatcher.of(
                                    SemanticType.USER_ID,
                                    0.90,
                                    (v, c) ->
                                            !v.isEmpty()
                                                    && !containsWhitespace(v)
                                                    && USER_WORDS.contains(
                                                            upper(c.previousWord()))),
                            SemanticMatcher.of(
                                    SemanticType.ERROR_CODE,
                                    0.85,
                                    (v, c) ->
                                            CODE.matcher(v).matches()
                                                    || HEX.matcher(v).matches()
                                                    || (SIGNED.matcher(v).matches()
                                                            && CODE_WORDS.contains(
                                                                    upper(c.previousWord())))),
                            SemanticMatcher.of(
                                    SemanticType.STATUS,
                                    0.85,
                                    (v, c) ->
                                            STATUSES.contains(upper(v))
                                                    || (isHttpStatus(v)
                                                            && STATUS_WORDS.contains(
                                                                    upper(c.previousWord())))),
                            SemanticMatcher.of(SemanticType.PATH, 0.90, (v, c) -> isPath(v)),
                            SemanticMatcher.of(
                                    SemanticType.HOST, 0.80, (v, c) -> HOST.matcher(v).matches()),
                            SemanticMatcher.of(
                                    SemanticType.METRIC,
                                    0.70,
                                    (v, c) -> NUMBER.matcher(v).matches()),
                            SemanticMatcher.of(
                                    SemanticType.MESSAGE,
                                    0.50,
                                    (v, c) -> v.codePoints().anyMatch(Character::isLetter))));

    private SemanticMatchers() {}

    /** 默认匹配器表,按优先级排列。 */
    public static List<SemanticMatcher> defaultMatchers() {
        return DEFAULT;
    }

    // ------------------------------------------------------------------------

    private static Set<String> words(String... words) {
        Set<String> set = new HashSet<>();
        for (String word : words) {
            set.add(upper(word));
        }
        return Collections.unmodifiableSet(set);
    }

    private static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }

    private static boolean containsWhitespace(String value) {
        return value.codePoints().anyMatch(Character::isWhitespace);
    }

    private static boolean isPort(String value) {
        return value.length() <= 5
                && UNSIGNED.matcher(value).matches()
                && Integer.parseInt(value) <= 65535;
    }

    private static boolean isHttpStatus(String value) {
        if (value.length() != 3 || !UNSIGNED.matcher(value).matches()) {
            return false;
        }
        int status = Integer.parseInt(value);
        return status >= 100 && status <= 599;
    }

    private static boolean isPath(String value) {
        if (value.length() < 2) {
            return false;
        }
        return value.startsWith("/")
                || value.startsWith("./")
                || value.startsWith("../")
                || value.startsWith("~/")
                || DRIVE_PATH.matcher(value).matches();
    }

    static boolean isIpv6(String value) {
        int gap = value.indexOf("::");
        if (gap < 0) {
            return countGroups(value) == 8;
        }
        if (value.indexOf("::", gap + 1) >= 0) {
            return false;
        }
        int head = countGroups(value.substring(0, gap));
        int tail = countGroups(value.substring(gap + 2));
        return head >= 0 && tail >= 0 && head + tail < 8;
    }

    /** 冒号分隔的十六进制分组数,空串为 0,存在非法分组时返回 -1。 */
    private static int countGroups(String part) {
        if (part.isEmpty()) {
            return 0;
        }
        String[] groups = part.split(":", -1);
        for (String group : groups) {
            if (!IPV6_GROUP.matcher(group).matches()) {
                return -1;
            }
        }
        return groups.length;
    }
}
