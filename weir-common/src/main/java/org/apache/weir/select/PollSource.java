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
 * 可非阻塞轮询的有序元素源。
 *
 * <p>PollSource 是 Weir 的核心抽象:每次 {@link #poll(Waker)} 立即返回一个 {@link Poll},
 * 绝不阻塞调用线程。源可以是同步的(数据已经在内存中),也可以是异步的(数据由其他线程或 I/O 回调投递)。
 *
 * <h2>约定</h2>
 *
 * <ul>
 *   <li>返回 {@code PENDING} 之前,源必须保证之后会调用传入的 {@link Waker}
 *   <li>返回 {@code COMPLETED} 之后,源不应再产出元素;{@link FusedPollSource} 会在调用方一侧强制这一点
 *   <li>失败通过 {@link Poll#failed(Object)} 返回,而不是抛出异常
 * </ul>
 *
 * <h2>资源管理</h2>
 *
 * <p>{@link #close()} 相当于取消该源。默认实现什么也不做,持有资源的源应覆盖它。由于 {@code poll}
 * 是唯一的抽象方法,简单的源可以直接写成 lambda:
 *
 * <pre>{@code
 * PollSource<Integer, IOException> ones = waker -> Poll.ready(1);
 * }</pre>
 *
 * <h2>线程安全性</h2>
 *
 * <p>除非实现类另有说明,一个源只应由单个线程轮询。
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@Public
@FunctionalInterface
public interface PollSource<T, E> extends AutoCloseable {

    /**
     * 尝试取出下一个元素,不阻塞。
     *
     * @param waker 返回 {@code PENDING} 时需要登记的唤醒句柄
     * @return 本次轮询的结果
     */
    Poll<T, E> poll(Waker waker);

    /** 取消该源并释放资源。 */
    @Override
    default void close() throws Exception {}
}
