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
import org.apache.weir.utils.CloseableIterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.LockSupport;

import static org.apache.weir.utils.Preconditions.checkNotNull;

/**
 * 在当前线程上驱动 {@link PollSource} 的阻塞式迭代器。
 *
 * <p>它充当最简单的宿主运行时:反复轮询源,遇到 {@code PENDING} 就挂起当前线程,直到源通过
 * {@link Waker} 唤醒后再继续。这样可以用普通的 {@link java.util.Iterator} 方式消费一个非阻塞源。
 *
 * <h2>工作原理</h2>
 *
 * <ol>
 *   <li>{@link #hasNext()} 轮询直到得到元素、结束或失败
 *   <li>{@code READY}: 缓存该元素,由 {@link #next()} 返回
 *   <li>{@code PENDING}: 挂起,直到被唤醒后重新轮询
 *   <li>{@code COMPLETED}: 迭代结束
 *   <li>{@code FAILED}: 抛出 {@link SourceFailedException},之后迭代结束
 * </ol>
 *
 * <p>源在同一次 {@code poll} 调用中就唤醒时不会挂起。关闭迭代器会关闭源。
 *
 * <pre>{@code
 * try (BlockingPollIterator<Integer, IOException> it = new BlockingPollIterator<>(select)) {
 *     while (it.hasNext()) {
 *         process(it.next());
 *     }
 * }
 * }</pre>
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@Public
@NotThreadSafe
public class BlockingPollIterator<T, E> implements CloseableIterator<T> {

    private static final Logger LOG = LoggerFactory.getLogger(BlockingPollIterator.class);

    private final PollSource<T, E> source;
    private final ParkingWaker waker;

    private boolean advanced;
    private boolean finished;
    private T current;

    public BlockingPollIterator(PollSource<T, E> source) {
        this.source = checkNotNull(source, "source must not be null");
        this.waker = new ParkingWaker();
    }

    @Override
    public boolean hasNext() {
        advanceIfNeeded();
        return !finished;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        advanced = false;
        T result = current;
        current = null;
        return result;
    }

    /** 取出所有剩余元素。 */
    public List<T> collect() {
        List<T> result = new ArrayList<>();
        while (hasNext()) {
            result.add(next());
        }
        return result;
    }

    private void advanceIfNeeded() {
        if (advanced || finished) {
            return;
        }

        while (true) {
            waker.reset();
            Poll<T, E> poll = source.poll(waker);
            switch (poll.kind()) {
                case READY:
                    current = poll.item();
                    advanced = true;
                    return;
                case COMPLETED:
                    finished = true;
                    return;
                case FAILED:
                    finished = true;
                    throw new SourceFailedException(poll.failure());
                default:
                    waker.await();
            }
        }
    }

    @Override
    public void close() throws Exception {
        finished = true;
        source.close();
    }

    /** 把唤醒转换为 {@link LockSupport#unpark(Thread)} 的唤醒句柄。 */
    private static final class ParkingWaker implements Waker {

        private volatile boolean notified;
        private volatile Thread parked;

        private void reset() {
            notified = false;
        }

        @Override
        public void wake() {
            notified = true;
            Thread thread = parked;
            if (thread != null) {
                LockSupport.unpark(thread);
            }
        }

        private void await() {
            if (notified) {
                return;
            }
            parked = Thread.currentThread();
            try {
                LOG.trace("Source is not ready, parking until it wakes up.");
                while (!notified) {
                    LockSupport.park(this);
                    if (Thread.interrupted()) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(
                                "Interrupted while waiting for the source to wake up.",
                                new InterruptedException());
                    }
                }
            } finally {
                parked = null;
            }
        }
    }
}
