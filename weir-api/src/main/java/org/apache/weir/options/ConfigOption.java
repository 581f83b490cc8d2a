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

package org.apache.weir.options;

import org.apache.weir.annotation.Public;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.apache.weir.utils.Preconditions.checkNotNull;

/**
 * 配置选项类,描述一个配置参数。
 *
 * <p>该类封装了配置项的以下信息:
 *
 * <ul>
 *   <li>配置键(key)
 *   <li>回退键(fallback keys),按检查顺序排列
 *   <li>可选的默认值(default value)
 *   <li>描述信息(description)
 *   <li>配置值的类型(clazz)
 * </ul>
 *
 * <p>{@code ConfigOption} 通过 {@link ConfigOptions} 构建,一旦创建就是不可变的:
 *
 * <pre>{@code
 * ConfigOption<Integer> defaultWeight = ConfigOptions
 *     .key("select.source.default-weight")
 *     .intType()
 *     .defaultValue(1)
 *     .withDescription("未显式指定权重时使用的权重");
 * }</pre>
 *
 * @param <T> 配置选项关联的值的类型
 */
@Public
public class ConfigOption<T> {

    private static final String[] EMPTY = new String[0];

    private final String key;

    /** 回退键列表,按检查顺序排列 */
    private final String[] fallbackKeys;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    ConfigOption(
            String key, Class<?> clazz, String description, T defaultValue, String... fallbackKeys) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.fallbackKeys = fallbackKeys == null || fallbackKeys.length == 0 ? EMPTY : fallbackKeys;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    /**
     * 创建一个新的配置选项,并添加给定的回退键。
     *
     * <p>通过 {@link Options#get(ConfigOption)} 读取时,主键缺失才会按给定顺序检查回退键。
     *
     * @param fallbackKeys 回退键,按应该检查的顺序
     * @return 一个新的配置选项,包含给定的回退键
     */
    public ConfigOption<T> withFallbackKeys(String... fallbackKeys) {
        // 新的回退键放在前面,优先被检查
        String[] merged =
                Stream.concat(Arrays.stream(fallbackKeys), Arrays.stream(this.fallbackKeys))
                        .toArray(String[]::new);
        return new ConfigOption<>(key, clazz, description, defaultValue, merged);
    }

    /**
     * 创建一个新的配置选项,并添加给定的描述。
     *
     * @param description 该选项的描述
     * @return 一个新的配置选项,包含给定的描述
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue, fallbackKeys);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /** 返回默认值,如果没有默认值则返回 null。 */
    public T defaultValue() {
        return defaultValue;
    }

    public boolean hasFallbackKeys() {
        return fallbackKeys != EMPTY;
    }

    public List<String> fallbackKeys() {
        return fallbackKeys == EMPTY ? Collections.emptyList() : Arrays.asList(fallbackKeys);
    }

    public String description() {
        return description;
    }

    // ------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && Arrays.equals(this.fallbackKeys, that.fallbackKeys)
                    && (this.defaultValue == null
                            ? that.defaultValue == null
                            : (that.defaultValue != null
                                    && this.defaultValue.equals(that.defaultValue)));
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode()
                + 17 * Arrays.hashCode(fallbackKeys)
                + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format(
                "Key: '%s' , default: %s (fallback keys: %s)",
                key, defaultValue, Arrays.toString(fallbackKeys));
    }
}
