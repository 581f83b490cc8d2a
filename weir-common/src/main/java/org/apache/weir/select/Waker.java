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

package org.apache.weir.select;

import org.apache.weir.annotation.Public;

/**
 * 宿主运行时提供的唤醒句柄。
 *
 * <p>源在返回 {@link Poll#pending()} 之前必须保存该句柄,并在有新进展(新元素、结束或失败)时调用
 * {@link #wake()}。运行时收到唤醒后才会再次轮询。{@link #wake()} 可以在任意线程上调用,也可以在
 * {@code poll} 返回之前同步调用,多次调用等价于一次。
 */
@Public
@FunctionalInterface
public interface Waker {

    /** 一个什么也不做的唤醒句柄,适用于源永远不会返回 {@code PENDING} 的场景。 */
    Waker NOOP = () -> {};

    /** 通知运行时重新轮询。 */
    void wake();
}
