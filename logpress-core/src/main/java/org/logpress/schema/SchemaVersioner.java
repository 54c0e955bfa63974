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

package org.logpress.schema;

import org.logpress.template.LogTemplate;
import org.logpress.template.SlotSpec;
import org.logpress.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 跟踪各日志来源的模式演化,只保存在内存中。
 *
 * <p>一个来源的模式由模板模式串和槽位布局(名称与语义类型,按槽位顺序)唯一确定,二者的
 * SHA-256 摘要作为版本的指纹。登记的模式与来源当前版本的指纹相同时只累加适用行数,否则追加一个
 * 新版本,版本号从 1 开始连续递增。
 */
@ThreadSafe
public class SchemaVersioner {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaVersioner.class);

    private static final int HASH_HEX_LENGTH = 16;

    private final Clock clock;
    private final Map<String, List<SchemaVersion>> histories = new HashMap<>();

    public SchemaVersioner() {
        this(Clock.systemUTC());
    }

    public SchemaVersioner(Clock clock) {
        this.clock = Preconditions.checkNotNull(clock);
    }

    /** 登记模板,返回其所属的版本号。 */
    public int register(String source, LogTemplate template) {
        return register(
                source, template.toPatternString(), template.slots(), template.matchCount());
    }

    public synchronized int register(
            String source, String pattern, List<SlotSpec> slots, long sampleCount) {
        Preconditions.checkNotNull(source, "source must not be null");
        Preconditions.checkArgument(sampleCount >= 0, "Negative sample count %s", sampleCount);
        String hash = fingerprint(pattern, slots);
        List<SchemaVersion> history = histories.computeIfAbsent(source, k -> new ArrayList<>());

        if (!history.isEmpty()) {
            int last = history.size() - 1;
            SchemaVersion current = history.get(last);
            if (current.hash().equals(hash)) {
                history.set(last, current.withAdditionalSamples(sampleCount));
                return current.version();
            }
        }

        int version = history.size() + 1;
        history.add(new SchemaVersion(version, clock.instant(), pattern, slots, sampleCount, hash));
        if (version > 1) {
            LOG.info("Schema of source {} evolved from v{} to v{}", source, version - 1, version);
        } else {
            LOG.debug("Registered schema v1 for source {}", source);
        }
        return version;
    }

    @Nullable
    public synchronized SchemaVersion version(String source, int version) {
        List<SchemaVersion> history = histories.get(source);
        if (history == null || version < 1 || version > history.size()) {
            return null;
        }
        return history.get(version - 1);
    }

    @Nullable
    public synchronized SchemaVersion currentVersion(String source) {
        List<SchemaVersion> history = histories.get(source);
        return history == null || history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public synchronized List<SchemaVersion> history(String source) {
        List<SchemaVersion> history = histories.get(source);
        return history == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * 比较同一来源的两个版本。
     *
     * @throws IllegalArgumentException 任一版本不存在
     */
    public SchemaComparison compare(String source, int fromVersion, int toVersion) {
        SchemaVersion from = version(source, fromVersion);
        SchemaVersion to = version(source, toVersion);
        Preconditions.checkArgument(
                from != null && to != null,
                "Unknown version v%s or v%s of source %s",
                fromVersion,
                toVersion,
                source);
        return new SchemaComparison(from, to);
    }

    /** 兼容矩阵: {@code matrix.get(a).get(b)} 是从版本 a 到版本 b 的兼容级别。 */
    public Map<Integer, Map<Integer, CompatibilityLevel>> compatibilityMatrix(String source) {
        List<SchemaVersion> history = history(source);
        Map<Integer, Map<Integer, CompatibilityLevel>> matrix = new LinkedHashMap<>();
        for (SchemaVersion from : history) {
            Map<Integer, CompatibilityLevel> row = new LinkedHashMap<>();
            for (SchemaVersion to : history) {
                row.put(
                        to.version(),
                        from.version() == to.version()
                                ? CompatibilityLevel.IDENTICAL
                                : new SchemaComparison(from, to).compatibility());
            }
            matrix.put(from.version(), row);
        }
        return matrix;
    }

    static String fingerprint(String pattern, List<SlotSpec> slots) {
        StringBuilder content = new StringBuilder(pattern);
        for (SlotSpec slot : slots) {
            content.append('|').append(slot.name()).append(':').append(slot.type().name());
        }
        byte[] digest = sha256(content.toString());
        StringBuilder hex = new StringBuilder(HASH_HEX_LENGTH);
        for (int i = 0; i < HASH_HEX_LENGTH / 2; i++) {
            hex.append(String.format("%02x", digest[i] & 0xFF));
        }
        return hex.toString();
    }

    private static byte[] sha256(String s) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
