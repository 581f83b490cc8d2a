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

import org.apache.weir.annotation.Experimental;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayDeque;
import java.util.Queue;

import static org.apache.weir.utils.Preconditions.checkNotNull;
import static org.apache.weir.utils.Preconditions.checkState;

/**
 * 由生产者推送数据的异步源。
 *
 * <p>任意线程都可以调用 {@link #offer(Object)}、{@link #complete()} 或 {@link #fail(Object)};消费方通过
 * {@link #poll(Waker)} 非阻塞地读取。缓冲区为空时,轮询返回 {@code PENDING} 并保存唤醒句柄,生产者下一次
 * 投递时调用它。
 *
 * <p>结束或失败只在缓冲的元素全部取出之后才会被报告。缓冲区没有容量上限。
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@Experimental
@ThreadSafe
public class ChannelPollSource<T, E> implements PollSource<T, E> {

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Queue<T> buffer = new ArrayDeque<>();

    @GuardedBy("lock")
    @Nullable
    private Waker waiting;

    @GuardedBy("lock")
    private boolean completed;

    @GuardedBy("lock")
    @Nullable
    private E failure;

    @GuardedBy("lock")
    private boolean closed;

    /**
     * 投递一个元素。
     *
     * @return 消费方已经关闭该源时返回 false,元素被丢弃
     * @throws IllegalStateException 如果已经调用过 {@link #complete()} 或 {@link #fail(Object)}
     */
    public boolean offer(T item) {
        checkNotNull(item, "item must not be null");
        Waker toWake;
        synchronized (lock) {
            checkState(!isTerminated(), "Cannot offer an item to a finished channel.");
            if (closed) {
                return false;
            }
            buffer.add(item);
            toWake = takeWaker();
        }
        wake(toWake);
        return true;
    }

    /** 标记生产结束,缓冲的元素取完之后报告 {@code COMPLETED}。 */
    public void complete() {
        Waker toWake;
        synchronized (lock) {
            checkState(!isTerminated(), "The channel has already finished.");
            completed = true;
            toWake = takeWaker();
        }
        wake(toWake);
    }

    /** 标记生产失败,缓冲的元素取完之后报告给定的失败值。 */
    public void fail(E failure) {
        checkNotNull(failure, "failure must not be null");
        Waker toWake;
        synchronized (lock) {
            checkState(!isTerminated(), "The channel has already finished.");
            this.failure = failure;
            toWake = takeWaker();
        }
        wake(toWake);
    }

    @Override
    public Poll<T, E> poll(Waker waker) {
        synchronized (lock) {
            checkState(!closed, "Cannot poll a closed channel.");
            T item = buffer.poll();
            if (item != null) {
                return Poll.ready(item);
            }
            if (failure != null) {
                return Poll.failed(failure);
            }
            if (completed) {
                return Poll.completed();
            }
            waiting = checkNotNull(waker, "waker must not be null");
            return Poll.pending();
        }
    }

    /** 丢弃缓冲的元素,之后的投递返回 false。 */
    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            buffer.clear();
            waiting = null;
        }
    }

    /** 当前缓冲的元素个数。 */
    public int size() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    @GuardedBy("lock")
    private boolean isTerminated() {
        return completed || failure != null;
    }

    @GuardedBy("lock")
    @Nullable
    private Waker takeWaker() {
        Waker waker = waiting;
        waiting = null;
        return waker;
    }

    // wakers run outside the lock, they may poll straight back into this channel
    private static void wake(@Nullable Waker waker) {
        if (waker != null) {
            waker.wake();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "ChannelPollSource{buffered="
                    + buffer.size()
                    + ", completed="
                    + completed
                    + ", failed="
                    + (failure != null)
                    + ", closed="
                    + closed
                    + '}';
        }
    }
}
