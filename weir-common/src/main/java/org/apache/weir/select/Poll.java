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

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 一次非阻塞轮询的结果。
 *
 * <p>每次调用 {@link PollSource#poll(Waker)} 恰好得到以下四种结果之一:
 *
 * <ul>
 *   <li>{@link Kind#READY}: 产出一个元素,通过 {@link #item()} 获取
 *   <li>{@link Kind#PENDING}: 暂时没有元素,源已登记唤醒,调用方应等待 {@link Waker#wake()} 后再轮询
 *   <li>{@link Kind#COMPLETED}: 源永久结束,不会再产出任何元素
 *   <li>{@link Kind#FAILED}: 源失败,失败值通过 {@link #failure()} 原样获取
 * </ul>
 *
 * <p>{@code PENDING} 与 {@code COMPLETED} 不携带数据,使用共享实例。
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@Public
public final class Poll<T, E> {

    /** 轮询结果的种类。 */
    public enum Kind {
        READY,
        PENDING,
        COMPLETED,
        FAILED
    }

    private static final Poll<?, ?> PENDING = new Poll<>(Kind.PENDING, null, null);

    private static final Poll<?, ?> COMPLETED = new Poll<>(Kind.COMPLETED, null, null);

    private final Kind kind;
    private final T item;
    private final E failure;

    private Poll(Kind kind, T item, E failure) {
        this.kind = kind;
        this.item = item;
        this.failure = failure;
    }

    public static <T, E> Poll<T, E> ready(T item) {
        return new Poll<>(Kind.READY, item, null);
    }

    @SuppressWarnings("unchecked")
    public static <T, E> Poll<T, E> pending() {
        return (Poll<T, E>) PENDING;
    }

    @SuppressWarnings("unchecked")
    public static <T, E> Poll<T, E> completed() {
        return (Poll<T, E>) COMPLETED;
    }

    public static <T, E> Poll<T, E> failed(E failure) {
        return new Poll<>(Kind.FAILED, null, failure);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isReady() {
        return kind == Kind.READY;
    }

    public boolean isPending() {
        return kind == Kind.PENDING;
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    /**
     * 返回产出的元素。
     *
     * @throws NoSuchElementException 如果结果不是 {@link Kind#READY}
     */
    public T item() {
        if (kind != Kind.READY) {
            throw new NoSuchElementException("No item in a " + kind + " poll.");
        }
        return item;
    }

    /**
     * 返回源报告的失败值。
     *
     * @throws NoSuchElementException 如果结果不是 {@link Kind#FAILED}
     */
    public E failure() {
        if (kind != Kind.FAILED) {
            throw new NoSuchElementException("No failure in a " + kind + " poll.");
        }
        return failure;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Poll<?, ?> that = (Poll<?, ?>) o;
        return kind == that.kind
                && Objects.equals(item, that.item)
                && Objects.equals(failure, that.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, item, failure);
    }

    @Override
    public String toString() {
        switch (kind) {
            case READY:
                return "Ready(" + item + ")";
            case FAILED:
                return "Failed(" + failure + ")";
            case PENDING:
                return "Pending";
            default:
                return "Completed";
        }
    }
}
