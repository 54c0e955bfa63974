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

import static org.logpress.utils.Preconditions.checkNotNull;

/**
 * 配置选项构建器类,用于构建 {@link ConfigOption} 实例。
 *
 * <h2>使用模式</h2>
 * <pre>{@code
 * ConfigOption<Double> threshold = ConfigOptions
 *     .key("template.similarity-threshold")
 *     .doubleType()
 *     .defaultValue(0.8);
 *
 * ConfigOption<String> codec = ConfigOptions
 *     .key("container.compression")
 *     .stringType()
 *     .defaultValue("zstd");
 * }</pre>
 */
@Public
public class ConfigOptions {

    /**
     * 开始构建一个新的 {@link ConfigOption}。
     *
     * @param key 配置选项的键
     * @return 配置选项的构建器
     */
    public static OptionBuilder key(String key) {
        checkNotNull(key);
        return new OptionBuilder(key);
    }

    // ------------------------------------------------------------------------

    /** 选项构建器,通过 {@link ConfigOptions#key(String)} 实例化。 */
    public static final class OptionBuilder {

        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        /** 定义选项值应为 {@link Boolean} 类型。 */
        public TypedConfigOptionBuilder<Boolean> booleanType() {
            return new TypedConfigOptionBuilder<>(key, Boolean.class);
        }

        /** 定义选项值应为 {@link Integer} 类型。 */
        public TypedConfigOptionBuilder<Integer> intType() {
            return new TypedConfigOptionBuilder<>(key, Integer.class);
        }

        /** 定义选项值应为 {@link Double} 类型。 */
        public TypedConfigOptionBuilder<Double> doubleType() {
            return new TypedConfigOptionBuilder<>(key, Double.class);
        }

        /** 定义选项值应为 {@link String} 类型。 */
        public TypedConfigOptionBuilder<String> stringType() {
            return new TypedConfigOptionBuilder<>(key, String.class);
        }

        /**
         * 定义选项值应为 {@link Enum} 类型。
         *
         * @param enumClass 期望的枚举的具体类型
         */
        public <T extends Enum<T>> TypedConfigOptionBuilder<T> enumType(Class<T> enumClass) {
            return new TypedConfigOptionBuilder<>(key, enumClass);
        }
    }

    /**
     * 带有已定义原子类型的 {@link ConfigOption} 构建器。
     *
     * @param <T> 选项的原子类型
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        /** 使用给定的默认值创建 ConfigOption。 */
        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, "", value);
        }
    }

    // ------------------------------------------------------------------------

    /** 不打算实例化的私有构造函数。 */
    private ConfigOptions() {}
}
