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

package org.logpress;

import org.logpress.annotation.Public;
import org.logpress.compression.CompressOptions;
import org.logpress.options.ConfigOption;
import org.logpress.options.Options;

import java.io.Serializable;
import java.util.Map;

import static org.logpress.options.ConfigOptions.key;
import static org.logpress.utils.Preconditions.checkArgument;

/**
 * LogPress 的核心配置选项。
 *
 * <p>声明模板抽取、列编码与容器压缩相关的全部配置项,并提供带校验的类型化访问方法。
 * 非法取值在访问时立即抛出 {@link IllegalArgumentException}。
 */
@Public
public class LogPressOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 模板最小支持度。形状分组中的行数少于该值时,这些行全部归入 UNMATCHED。 */
    public static final ConfigOption<Integer> MIN_SUPPORT =
            key("template.min-support")
                    .intType()
                    .defaultValue(3)
                    .withDescription(
                            "Minimum number of lines sharing a token shape before a template is emitted.");

    /** 相似度阈值。某一位置上出现最多的取值占比达到该阈值时,该位置保留为字面量。 */
    public static final ConfigOption<Double> SIMILARITY_THRESHOLD =
            key("template.similarity-threshold")
                    .doubleType()
                    .defaultValue(0.8)
                    .withDescription(
                            "Fraction of lines in a group that must agree on a token for the position to stay literal.");

    /** 每个模板保留的示例日志行数上限。 */
    public static final ConfigOption<Integer> EXAMPLE_LIMIT =
            key("template.example-limit")
                    .intType()
                    .defaultValue(5)
                    .withDescription("Maximum number of example lines kept per template.");

    public static final ConfigOption<Boolean> COALESCE_SLOTS =
            key("template.coalesce-slots")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether adjacent free-text slots of the same type are merged into one slot.");

    /** 游程编码的最短游程长度。 */
    public static final ConfigOption<Integer> RLE_MIN_RUN =
            key("encoder.rle.min-run")
                    .intType()
                    .defaultValue(3)
                    .withDescription(
                            "Shortest run of equal indices collapsed by the run-length post pass.");

    public static final ConfigOption<Boolean> TIMESTAMP_GORILLA_TRIAL =
            key("encoder.timestamp.gorilla-trial")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether timestamp columns are also trial-encoded with delta-of-delta bit packing.");

    /** 容器段压缩算法,支持 none、zstd、lz4、lzo。 */
    public static final ConfigOption<String> CONTAINER_COMPRESSION =
            key("container.compression")
                    .stringType()
                    .defaultValue("zstd")
                    .withDescription(
                            "Block compression applied to every container section, one of none, zstd, lz4, lzo.");

    /** Zstd 压缩级别,1-22 之间,默认使用最高级别。 */
    public static final ConfigOption<Integer> CONTAINER_COMPRESSION_ZSTD_LEVEL =
            key("container.compression.zstd-level")
                    .intType()
                    .defaultValue(22)
                    .withDescription("Zstd level used for container sections, between 1 and 22.");

    private final Options options;

    public LogPressOptions(Map<String, String> options) {
        this(Options.fromMap(options));
    }

    public LogPressOptions(Options options) {
        this.options = options;
    }

    public static LogPressOptions fromMap(Map<String, String> options) {
        return new LogPressOptions(options);
    }

    public Options toConfiguration() {
        return options;
    }

    public Map<String, String> toMap() {
        return options.toMap();
    }

    public int minSupport() {
        int minSupport = options.get(MIN_SUPPORT);
        checkArgument(
                minSupport >= 1, "%s must be at least 1, got %s", MIN_SUPPORT.key(), minSupport);
        return minSupport;
    }

    public double similarityThreshold() {
        double threshold = options.get(SIMILARITY_THRESHOLD);
        checkArgument(
                threshold > 0 && threshold <= 1,
                "%s must be in (0, 1], got %s",
                SIMILARITY_THRESHOLD.key(),
                threshold);
        return threshold;
    }

    public int exampleLimit() {
        int limit = options.get(EXAMPLE_LIMIT);
        checkArgument(limit >= 0, "%s must not be negative, got %s", EXAMPLE_LIMIT.key(), limit);
        return limit;
    }

    public boolean coalesceSlots() {
        return options.get(COALESCE_SLOTS);
    }

    public int rleMinRun() {
        int minRun = options.get(RLE_MIN_RUN);
        checkArgument(minRun >= 2, "%s must be at least 2, got %s", RLE_MIN_RUN.key(), minRun);
        return minRun;
    }

    public boolean timestampGorillaTrial() {
        return options.get(TIMESTAMP_GORILLA_TRIAL);
    }

    public CompressOptions containerCompressOptions() {
        int level = options.get(CONTAINER_COMPRESSION_ZSTD_LEVEL);
        checkArgument(
                level >= 1 && level <= 22,
                "%s must be between 1 and 22, got %s",
                CONTAINER_COMPRESSION_ZSTD_LEVEL.key(),
                level);
        return new CompressOptions(options.get(CONTAINER_COMPRESSION), level);
    }
}
