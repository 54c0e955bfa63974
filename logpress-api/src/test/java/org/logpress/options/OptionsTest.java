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

package org.logpress.options;

import org.logpress.LogPressOptions;
import org.logpress.compression.CompressOptions;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options} and {@link LogPressOptions}. */
public class OptionsTest {

    @Test
    public void testDefaults() {
        LogPressOptions options = new LogPressOptions(new Options());
        assertThat(options.minSupport()).isEqualTo(3);
        assertThat(options.similarityThreshold()).isEqualTo(0.8);
        assertThat(options.exampleLimit()).isEqualTo(5);
        assertThat(options.coalesceSlots()).isTrue();
        assertThat(options.rleMinRun()).isEqualTo(3);
        assertThat(options.timestampGorillaTrial()).isTrue();
        assertThat(options.containerCompressOptions()).isEqualTo(new CompressOptions("zstd", 22));
    }

    @Test
    public void testTypedConversionFromStrings() {
        Map<String, String> map = new HashMap<>();
        map.put("template.min-support", " 7 ");
        map.put("template.similarity-threshold", "0.5");
        map.put("template.coalesce-slots", "FALSE");
        LogPressOptions options = LogPressOptions.fromMap(map);

        assertThat(options.minSupport()).isEqualTo(7);
        assertThat(options.similarityThreshold()).isEqualTo(0.5);
        assertThat(options.coalesceSlots()).isFalse();
    }

    @Test
    public void testSetThroughConfigOption() {
        Options options = new Options().set(LogPressOptions.CONTAINER_COMPRESSION, "lz4");
        assertThat(options.get("container.compression")).isEqualTo("lz4");
        assertThat(options.contains(LogPressOptions.CONTAINER_COMPRESSION)).isTrue();
        assertThat(options.contains(LogPressOptions.MIN_SUPPORT)).isFalse();

        options.remove(LogPressOptions.CONTAINER_COMPRESSION);
        assertThat(options.get(LogPressOptions.CONTAINER_COMPRESSION)).isEqualTo("zstd");
    }

    @Test
    public void testFallbackKeys() {
        ConfigOption<Integer> option =
                ConfigOptions.key("new.key").intType().defaultValue(1).withFallbackKeys("old.key");
        Options options = new Options();
        assertThat(options.get(option)).isEqualTo(1);

        options.set("old.key", "9");
        assertThat(options.get(option)).isEqualTo(9);

        options.set("new.key", "4");
        assertThat(options.get(option)).isEqualTo(4);
    }

    @Test
    public void testUnparsableValue() {
        Options options = new Options();
        options.set("template.min-support", "many");
        assertThatThrownBy(() -> options.get(LogPressOptions.MIN_SUPPORT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("template.min-support");
    }

    @Test
    public void testInvalidRanges() {
        Options options = new Options();
        options.set(LogPressOptions.SIMILARITY_THRESHOLD, 1.5);
        options.set(LogPressOptions.MIN_SUPPORT, 0);
        options.set(LogPressOptions.CONTAINER_COMPRESSION_ZSTD_LEVEL, 30);
        LogPressOptions logPressOptions = new LogPressOptions(options);

        assertThatThrownBy(logPressOptions::similarityThreshold)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(logPressOptions::minSupport)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(logPressOptions::containerCompressOptions)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testEnumConversion() {
        ConfigOption<TestMode> option =
                ConfigOptions.key("mode").enumType(TestMode.class).defaultValue(TestMode.FAST);
        Options options = new Options();
        options.set("mode", "small");
        assertThat(options.get(option)).isEqualTo(TestMode.SMALL);
    }

    private enum TestMode {
        FAST,
        SMALL
    }
}
