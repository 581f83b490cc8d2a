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

import static java.util.Arrays.asList;

/**
 * 资源关闭工具类。
 *
 * <p>批量关闭:依次关闭多个资源,收集异常后统一抛出。
 *
 * @see AutoCloseable
 */
public final class IOUtils {

    /** 关闭所有资源。@see #closeAll(Iterable) */
    public static void closeAll(AutoCloseable... closeables) throws Exception {
        closeAll(asList(closeables));
    }

    /**
     * 按迭代顺序关闭所有资源。
     *
     * <p>某个资源关闭失败不会阻止后续资源的关闭。全部尝试之后,抛出第一个异常,其余异常作为
     * suppressed 附加在它上面。null 元素会被跳过。
     *
     * @param closeables 要关闭的资源
     * @throws Exception 第一个关闭异常
     */
    public static void closeAll(Iterable<? extends AutoCloseable> closeables) throws Exception {
        if (null != closeables) {

            Exception collectedExceptions = null;

            for (AutoCloseable closeable : closeables) {
                try {
                    if (null != closeable) {
                        closeable.close();
                    }
                } catch (Throwable e) {
                    ExceptionUtils.rethrowIfFatalError(e);
                    Exception ex = e instanceof Exception ? (Exception) e : new Exception(e);
                    collectedExceptions = ExceptionUtils.firstOrSuppressed(ex, collectedExceptions);
                }
            }

            if (null != collectedExceptions) {
                throw collectedExceptions;
            }
        }
    }

    private IOUtils() {}
}
