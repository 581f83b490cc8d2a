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

/** 异常处理工具类。 */
public final class ExceptionUtils {

    /**
     * 把新异常与之前收集的异常合并。
     *
     * <p>第一次调用时直接返回 {@code newException};之后每次都把 {@code newException} 作为
     * suppressed 异常挂到最早的异常上,并返回最早的异常。适用于"依次关闭多个资源,最后统一抛出"的场景。
     *
     * <pre>{@code
     * Exception collected = null;
     * for (AutoCloseable c : closeables) {
     *     try {
     *         c.close();
     *     } catch (Exception e) {
     *         collected = ExceptionUtils.firstOrSuppressed(e, collected);
     *     }
     * }
     * if (collected != null) {
     *     throw collected;
     * }
     * }</pre>
     *
     * @param newException 新发生的异常
     * @param previous 之前收集的异常,可能为 null
     * @return 应该最终抛出的异常
     */
    public static <T extends Throwable> T firstOrSuppressed(T newException, @Nullable T previous) {
        if (newException == null) {
            throw new NullPointerException("newException");
        }

        if (previous == null || previous == newException) {
            return newException;
        } else {
            previous.addSuppressed(newException);
            return previous;
        }
    }

    /**
     * 如果给定的 Throwable 是 {@link Error},则直接抛出。用于在捕获 {@link Throwable} 后
     * 保留虚拟机级别的错误语义。
     */
    public static void rethrowIfFatalError(Throwable t) {
        if (t instanceof Error) {
            throw (Error) t;
        }
    }

    private ExceptionUtils() {}
}
