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
import org.apache.weir.annotation.VisibleForTesting;
import org.apache.weir.options.Options;
import org.apache.weir.utils.IOUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.Collections;
import java.util.List;

import static org.apache.weir.utils.Preconditions.checkArgument;
import static org.apache.weir.utils.Preconditions.checkState;

/**
 * 按固定整数权重合并多个 {@link PollSource} 的组合源。
 *
 * <p>WeightedSelect 自身也是一个 {@link PollSource},不创建线程也不加锁,完全由外部的
 * {@link #poll(Waker)} 调用驱动。
 *
 * <h2>轮转模型</h2>
 *
 * <p>设按追加顺序的各段权重为 {@code w1..wn},周期长度 {@code L = w1 + ... + wn}。一圈被划分为首尾相接的
 * 窗口 {@code [0, w1), [w1, w1 + w2), ...}。游标 {@code cursor ∈ [0, L)} 记录当前处在一圈中的哪个位置:
 * 所有源都一直就绪时,一圈依次产出 S1 的 w1 个元素、S2 的 w2 个元素……直到某个源结束。
 *
 * <h2>单次轮询</h2>
 *
 * <ol>
 *   <li>从游标所在的段开始,向追加顺序的后方逐段尝试:某段产出元素或失败,立即返回,游标加 1
 *   <li>某段暂时没有元素,或已经结束但它前面还有没结束的段,游标跳到该段窗口的终点,继续尝试下一段
 *   <li>某段结束且它前面的段(从一圈起点开始)也全部结束,则整个区间视为耗尽
 *   <li>若起始游标不为 0 且本轮没有产出,则从游标 0 重新走一遍,让排在前面的段在同一次调用里获得机会
 * </ol>
 *
 * <p>因此一个停滞或已耗尽的源让出的窗口,会在同一次调用中转给优先级次之的源,外部一次轮询就能取得进展。
 *
 * <h2>失败</h2>
 *
 * <p>任一源的失败都在它发生的那次轮询中原样返回,WeightedSelect 不重试、不包装、不记录。失败之后再轮询的行为
 * 由 {@link SelectOptions#AFTER_FAILURE} 决定,参见 {@link FusedPollSource}。
 *
 * <h2>资源管理</h2>
 *
 * <p>WeightedSelect 独占所有已追加的源。{@link #close()} 按追加顺序关闭每个源,关闭之后不能再轮询。
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@Public
@NotThreadSafe
public class WeightedSelect<T, E> implements PollSource<T, E> {

    private static final Logger LOG = LoggerFactory.getLogger(WeightedSelect.class);

    /** 按追加顺序排列,下标越小优先级越高。 */
    private final List<WeightedSegment<T, E>> segments;

    private final long cycleLength;

    private long cursor;

    /** 最近一次 {@link #walk} 结束时的位置,取模之前。 */
    private long walkedTo;

    private boolean closed;

    WeightedSelect(List<WeightedSegment<T, E>> segments, long cycleLength) {
        checkArgument(cycleLength > 0, "Cycle length must be positive, but is %s.", cycleLength);
        this.segments = Collections.unmodifiableList(segments);
        this.cycleLength = cycleLength;
        this.cursor = 0;
    }

    /** 使用默认配置创建一个空的构建器。 */
    public static <T, E> SelectBuilder<T, E> builder() {
        return builder(new Options());
    }

    /** 使用给定配置创建一个空的构建器,配置项见 {@link SelectOptions}。 */
    public static <T, E> SelectBuilder<T, E> builder(Options options) {
        return new SelectBuilder<>(new SelectOptions(options));
    }

    @Override
    public Poll<T, E> poll(Waker waker) {
        checkState(!closed, "Cannot poll a closed select.");

        long from = cursor;
        Poll<T, E> poll = walk(from, waker);
        if ((poll.isPending() || poll.isCompleted()) && from > 0) {
            poll = walk(0, waker);
        }

        cursor = walkedTo % cycleLength;
        return poll;
    }

    /**
     * 从游标所在的段开始,沿追加顺序向后走一遍。
     *
     * <p>{@code lowerExhausted} 表示从一圈起点到当前段之前的所有段都已耗尽;最低的起始段在游标恰好为 0
     * 时才满足这一点,中途恢复的游标不能说明前面的段已经结束。
     */
    private Poll<T, E> walk(long from, Waker waker) {
        int size = segments.size();
        if (size == 0) {
            walkedTo = 0;
            return Poll.completed();
        }

        // segment whose window contains the cursor
        int index = size - 1;
        while (from < segments.get(index).startAt()) {
            index--;
        }

        boolean lowerExhausted = from == 0;
        long position = from;
        Poll<T, E> result = Poll.pending();
        for (int i = index; i < size; i++) {
            WeightedSegment<T, E> segment = segments.get(i);
            Poll<T, E> poll = segment.poll(waker);
            if (poll.isReady() || poll.isFailed()) {
                walkedTo = position + 1;
                return poll;
            }

            position = segment.endAt();
            result = poll.isCompleted() && lowerExhausted ? Poll.completed() : Poll.pending();
            lowerExhausted = result.isCompleted();
        }

        walkedTo = position;
        return result;
    }

    /** 周期长度,即所有权重之和;没有任何段时为 1。 */
    public long cycleLength() {
        return cycleLength;
    }

    public int segmentCount() {
        return segments.size();
    }

    @VisibleForTesting
    long cursor() {
        return cursor;
    }

    /**
     * 按追加顺序关闭所有源。
     *
     * <p>某个源关闭失败不会阻止其余源的关闭,第一个异常被抛出,其余异常作为 suppressed 附加。重复调用无效果。
     */
    @Override
    public void close() throws Exception {
        if (closed) {
            return;
        }
        closed = true;
        LOG.debug("Closing weighted select with {} segments.", segments.size());
        IOUtils.closeAll(segments);
    }

    @Override
    public String toString() {
        return "WeightedSelect{"
                + "cursor="
                + cursor
                + ", cycleLength="
                + cycleLength
                + ", segments="
                + segments
                + '}';
    }
}
