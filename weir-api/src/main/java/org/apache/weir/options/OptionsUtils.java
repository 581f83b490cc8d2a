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

import java.util.Arrays;
import java.util.Locale;

/**
 * {@link Options} 相关辅助函数的工具类。
 *
 * <p>负责把以字符串形式存储的原始配置值转换为 {@link ConfigOption} 声明的类型,支持
 * {@link Integer}、{@link String} 以及枚举。
 *
 * <pre>{@code
 * Integer weight = OptionsUtils.convertValue("3", Integer.class);
 * FailurePolicy policy = OptionsUtils.convertValue("reject", FailurePolicy.class);
 * }</pre>
 */
public class OptionsUtils {

    /**
     * 尝试将原始值转换为提供的类型。
     *
     * @param rawValue 要转换的原始值
     * @param clazz 目标类型
     * @param <T> 结果的类型
     * @return 转换后的值
     * @throws IllegalArgumentException 如果 rawValue 无法转换为目标类型
     */
    @SuppressWarnings("unchecked")
    public static <T> T convertValue(Object rawValue, Class<?> clazz) {
        if (Integer.class.equals(clazz)) {
            return (T) convertToInt(rawValue);
        } else if (String.class.equals(clazz)) {
            return (T) convertToString(rawValue);
        } else if (clazz.isEnum()) {
            return (T) convertToEnum(rawValue, (Class<? extends Enum<?>>) clazz);
        }

        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    /**
     * 将对象转换为枚举值,忽略大小写。
     *
     * @param o 要转换的对象
     * @param clazz 枚举类型的 Class 对象
     * @param <E> 枚举类型
     * @return 枚举值
     */
    @SuppressWarnings("unchecked")
    public static <E extends Enum<?>> E convertToEnum(Object o, Class<E> clazz) {
        if (o.getClass().equals(clazz)) {
            return (E) o;
        }

        return Arrays.stream(clazz.getEnumConstants())
                .filter(
                        e ->
                                e.toString()
                                        .toUpperCase(Locale.ROOT)
                                        .equals(o.toString().toUpperCase(Locale.ROOT)))
                .findAny()
                .orElseThrow(
                        () ->
                                new IllegalArgumentException(
                                        String.format(
                                                "Could not parse value for enum %s. Expected one of: [%s]",
                                                clazz, Arrays.toString(clazz.getEnumConstants()))));
    }

    static String convertToString(Object o) {
        if (o.getClass() == String.class) {
            return (String) o;
        }
        return o.toString();
    }

    static Integer convertToInt(Object o) {
        if (o.getClass() == Integer.class) {
            return (Integer) o;
        }

        return Integer.parseInt(o.toString().trim());
    }

    private OptionsUtils() {}
}
