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

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 配置选项类,用于存储字符串键值对并按 {@link ConfigOption} 做类型安全的读取。
 *
 * <pre>{@code
 * Options options = new Options();
 * options.setString("select.source.default-weight", "3");
 *
 * int weight = options.get(SelectOptions.DEFAULT_WEIGHT); // 返回 3
 *
 * Options fromMap = Options.fromMap(Collections.singletonMap(
 *     "select.source.after-failure", "reject"));
 * }</pre>
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

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
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    /**
     * 向配置对象添加给定的键值对。
     *
     * @param key 要添加的键
     * @param value 要添加的值
     */
    public synchronized void setString(String key, String value) {
        setValueInternal(key, value);
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
        setValueInternal(option.key(), value);
        return this;
    }

    /**
     * 获取配置选项的值,如果未设置则返回默认值。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return 配置值或默认值
     * @throws IllegalArgumentException 如果无法解析已设置的值
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** 获取指定键的原始字符串值,不存在时返回 null。 */
    public synchronized String get(String key) {
        return data.get(key);
    }

    /**
     * 获取配置选项的 Optional 值,依次检查主键和回退键。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return Optional 包装的配置值
     * @throws IllegalArgumentException 如果无法解析值
     */
    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<String> rawValue = getRawValueFromOption(option);
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

    /**
     * 检查是否存在给定配置选项的条目。
     *
     * @return 如果存储了主键或任一回退键,返回 true
     */
    public synchronized boolean contains(ConfigOption<?> option) {
        return getRawValueFromOption(option).isPresent();
    }

    public synchronized boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public synchronized Set<String> keySet() {
        return data.keySet();
    }

    /** 返回配置内容的副本。 */
    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    /**
     * 删除指定配置选项的配置项。
     *
     * @param option 要删除的配置选项
     */
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
        return "Options" + data;
    }

    // -------------------------------------------------------------------------
    //                     Internal methods
    // -------------------------------------------------------------------------

    private <T> void setValueInternal(String key, T value) {
        if (key == null) {
            throw new NullPointerException("Key must not be null.");
        }
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(key, OptionsUtils.convertToString(value));
    }

    private Optional<String> getRawValueFromOption(ConfigOption<?> option) {
        String value = data.get(option.key());
        if (value != null) {
            return Optional.of(value);
        }
        for (String fallbackKey : option.fallbackKeys()) {
            value = data.get(fallbackKey);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
