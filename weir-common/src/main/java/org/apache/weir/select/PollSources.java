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

import java.util.Arrays;
import java.util.Iterator;

import static org.apache.weir.utils.Preconditions.checkNotNull;

/**
 * 常用 {@link PollSource} 的工厂方法。
 *
 * <p>这里创建的源都建立在内存数据之上,总是立即就绪,从不返回 {@code PENDING}。
 */
@Public
public final class PollSources {

    /** 按顺序产出给定元素的源。 */
    @SafeVarargs
    public static <T, E> PollSource<T, E> of(T... items) {
        return fromIterable(Arrays.asList(items));
    }

    /** 按迭代顺序产出给定集合元素的源。 */
    public static <T, E> PollSource<T, E> fromIterable(Iterable<T> items) {
        checkNotNull(items, "items must not be null");
        return fromIterator(items.iterator());
    }

    /**
     * 按迭代顺序产出给定迭代器元素的源。
     *
     * <p>如果迭代器实现了 {@link AutoCloseable}(例如 {@code CloseableIterator}),关闭源时会一并关闭它。
     */
    public static <T, E> PollSource<T, E> fromIterator(Iterator<T> iterator) {
        return new IteratorPollSource<>(checkNotNull(iterator, "iterator must not be null"));
    }

    /** 第一次轮询就结束的源。 */
    public static <T, E> PollSource<T, E> empty() {
        return waker -> Poll.completed();
    }

    private static final class IteratorPollSource<T, E> implements PollSource<T, E> {

        private final Iterator<T> iterator;

        private IteratorPollSource(Iterator<T> iterator) {
            this.iterator = iterator;
        }

        @Override
        public Poll<T, E> poll(Waker waker) {
            return iterator.hasNext() ? Poll.ready(iterator.next()) : Poll.completed();
        }

        @Override
        public void close() throws Exception {
            if (iterator instanceof AutoCloseable) {
                ((AutoCloseable) iterator).close();
            }
        }

        @Override
        public String toString() {
            return "IteratorPollSource(" + iterator + ")";
        }
    }

    private PollSources() {}
}
