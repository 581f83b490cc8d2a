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

import org.apache.weir.annotation.Public;

import javax.annotation.Nonnull;

import java.util.Iterator;

/**
 * 可关闭的迭代器接口。
 *
 * <p>同时实现 {@link Iterator} 和 {@link AutoCloseable},底层通常持有需要释放的资源,
 * 客户端在使用完迭代器后必须调用 {@link #close()}。
 *
 * @param <T> 迭代元素的类型
 */
@Public
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    /**
     * 将普通迭代器适配为可关闭迭代器。
     *
     * @param iterator 原始迭代器
     * @param close 关闭时执行的回调
     * @param <T> 元素类型
     * @return 可关闭迭代器
     */
    static <T> CloseableIterator<T> adapterForIterator(
            @Nonnull Iterator<T> iterator, AutoCloseable close) {
        return new IteratorAdapter<>(iterator, close);
    }

    /** 把 {@link Iterator} 与关闭回调组合起来的适配器。 */
    final class IteratorAdapter<E> implements CloseableIterator<E> {

        @Nonnull private final Iterator<E> delegate;
        private final AutoCloseable close;

        IteratorAdapter(@Nonnull Iterator<E> delegate, AutoCloseable close) {
            this.delegate = delegate;
            this.close = close;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public E next() {
            return delegate.next();
        }

        @Override
        public void remove() {
            delegate.remove();
        }

        @Override
        public void close() throws Exception {
            close.close();
        }
    }
}
