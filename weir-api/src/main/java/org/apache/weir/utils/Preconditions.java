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

package org.apache.weir.utils;

import javax.annotation.Nullable;

/**
 * 参数与状态检查工具类。
 *
 * <p>这些检查针对的是调用方的编程错误,而不是运行时条件:
 *
 * <ul>
 *   <li>{@link #checkNotNull}: 参数为 null 时抛出 {@link NullPointerException}
 *   <li>{@link #checkArgument}: 参数非法时抛出 {@link IllegalArgumentException}
 *   <li>{@link #checkState}: 对象状态不允许该调用时抛出 {@link IllegalStateException}
 * </ul>
 *
 * <p>错误消息模板只支持 {@code %s} 占位符,多余的参数会以 {@code [a, b]} 的形式追加到末尾。
 */
public final class Preconditions {

    // ------------------------------------------------------------------------
    //  Null checks
    // ------------------------------------------------------------------------

    /**
     * 确保给定对象引用不为 null。
     *
     * @param reference 要检查的对象引用
     * @return 非 null 的对象引用
     * @throws NullPointerException 如果 {@code reference} 为 null
     */
    public static <T> T checkNotNull(@Nullable T reference) {
        if (reference == null) {
            throw new NullPointerException();
        }
        return reference;
    }

    /**
     * 确保给定对象引用不为 null,否则以给定消息抛出 {@link NullPointerException}。
     *
     * @param reference 要检查的对象引用
     * @param errorMessage 异常消息,通过 {@link String#valueOf(Object)} 转换
     * @return 非 null 的对象引用
     */
    public static <T> T checkNotNull(@Nullable T reference, @Nullable String errorMessage) {
        if (reference == null) {
            throw new NullPointerException(String.valueOf(errorMessage));
        }
        return reference;
    }

    /**
     * 确保给定对象引用不为 null,异常消息由模板和参数拼装,只在检查失败时才格式化。
     */
    public static <T> T checkNotNull(
            @Nullable T reference,
            @Nullable String errorMessageTemplate,
            @Nullable Object... errorMessageArgs) {
        if (reference == null) {
            throw new NullPointerException(format(errorMessageTemplate, errorMessageArgs));
        }
        return reference;
    }

    // ------------------------------------------------------------------------
    //  Boolean Condition Checking (Argument)
    // ------------------------------------------------------------------------

    /**
     * 检查给定的参数条件。
     *
     * @param condition 要检查的条件
     * @throws IllegalArgumentException 如果条件不成立
     */
    public static void checkArgument(boolean condition) {
        if (!condition) {
            throw new IllegalArgumentException();
        }
    }

    /**
     * 检查给定的参数条件,不成立时以给定消息抛出 {@link IllegalArgumentException}。
     */
    public static void checkArgument(boolean condition, @Nullable Object errorMessage) {
        if (!condition) {
            throw new IllegalArgumentException(String.valueOf(errorMessage));
        }
    }

    /**
     * 检查给定的参数条件,不成立时以模板消息抛出 {@link IllegalArgumentException}。
     *
     * @param condition 要检查的条件
     * @param errorMessageTemplate 消息模板,{@code %s} 依次替换为参数
     * @param errorMessageArgs 模板参数
     */
    public static void checkArgument(
            boolean condition,
            @Nullable String errorMessageTemplate,
            @Nullable Object... errorMessageArgs) {
        if (!condition) {
            throw new IllegalArgumentException(format(errorMessageTemplate, errorMessageArgs));
        }
    }

    // ------------------------------------------------------------------------
    //  Boolean Condition Checking (State)
    // ------------------------------------------------------------------------

    /** 检查对象状态,不成立时抛出 {@link IllegalStateException}。 */
    public static void checkState(boolean condition) {
        if (!condition) {
            throw new IllegalStateException();
        }
    }

    /** 检查对象状态,不成立时以给定消息抛出 {@link IllegalStateException}。 */
    public static void checkState(boolean condition, @Nullable Object errorMessage) {
        if (!condition) {
            throw new IllegalStateException(String.valueOf(errorMessage));
        }
    }

    /** 检查对象状态,不成立时以模板消息抛出 {@link IllegalStateException}。 */
    public static void checkState(
            boolean condition,
            @Nullable String errorMessageTemplate,
            @Nullable Object... errorMessageArgs) {
        if (!condition) {
            throw new IllegalStateException(format(errorMessageTemplate, errorMessageArgs));
        }
    }

    // ------------------------------------------------------------------------
    //  Utilities
    // ------------------------------------------------------------------------

    private static String format(@Nullable String template, @Nullable Object... args) {
        final int numArgs = args == null ? 0 : args.length;
        template = String.valueOf(template); // null -> "null"

        // start substituting the arguments into the '%s' placeholders
        StringBuilder builder = new StringBuilder(template.length() + 16 * numArgs);
        int templateStart = 0;
        int i = 0;
        while (i < numArgs) {
            int placeholderStart = template.indexOf("%s", templateStart);
            if (placeholderStart == -1) {
                break;
            }
            builder.append(template, templateStart, placeholderStart);
            builder.append(args[i++]);
            templateStart = placeholderStart + 2;
        }
        builder.append(template.substring(templateStart));

        // if we run out of placeholders, append the extra args in square braces
        if (i < numArgs) {
            builder.append(" [");
            builder.append(args[i++]);
            while (i < numArgs) {
                builder.append(", ");
                builder.append(args[i++]);
            }
            builder.append(']');
        }

        return builder.toString();
    }

    /** 不打算实例化的私有构造函数。 */
    private Preconditions() {}
}
