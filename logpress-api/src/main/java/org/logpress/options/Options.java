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

import org.logpress.annotation.Public;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 配置选项类,用于存储键值对。
 *
 * <p>该类是线程安全的,内部以字符串形式保存所有值,通过 {@link ConfigOption} 读取时做类型转换。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * Options options = new Options();
 * options.set(LogPressOptions.MIN_SUPPORT, 5);
 * options.set("container.compression", "lz4");
 *
 * int minSupport = options.get(LogPressOptions.MIN_SUPPORT); // 5
 * }</pre>
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 存储具体键值对的映射 */
    private final HashMap<String, String> data;

    /** 创建一个新的空配置对象。 */
    public Options() {
        this.data = new HashMap<>();
    }

    /**
     * 创建一个新的配置对象,使用给定 Map 的选项进行初始化。
     *
     * @param map 初始配置键值对
     */
    public Options(Map<String, String> map) {
        this();
        map.forEach(this::set);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void set(String key, String value) {
        data.put(key, value);
    }

    /**
     * 使用 ConfigOption 设置配置值。
     *
     * @param option 配置选项
     * @param value 配置值
     * @param <T> 值的类型
     * @return 当前 Options 对象,用于链式调用
     */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /**
     * 获取配置选项的值,如果未设置则返回默认值。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return 配置值或默认值
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    /**
     * 获取配置选项的 Optional 值,依次检查主键与回退键。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return Optional 包装的配置值
     * @throws IllegalArgumentException 如果无法解析值
     */
    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<String> rawValue = getRawValue(option);
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> option) {
        return getRawValue(option).isPresent();
    }

    public synchronized Set<String> keySet() {
        return data.keySet();
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    public synchronized void remove(ConfigOption<?> option) {
        data.remove(option.key());
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }

    // -------------------------------------------------------------------------
    //                     Internal methods
    // -------------------------------------------------------------------------

    private Optional<String> getRawValue(ConfigOption<?> option) {
        String value = data.get(option.key());
        if (value != null) {
            return Optional.of(value);
        }
        // try the fallback keys
        for (String fallbackKey : option.fallbackKeys()) {
            String fallback = data.get(fallbackKey);
            if (fallback != null) {
                return Optional.of(fallback);
            }
        }
        return Optional.empty();
    }
}
