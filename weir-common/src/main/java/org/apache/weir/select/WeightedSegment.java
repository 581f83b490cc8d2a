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

import static org.apache.weir.utils.Preconditions.checkArgument;
import static org.apache.weir.utils.Preconditions.checkNotNull;

/**
 * 已注册的一个源,连同它的权重以及它在一圈(lap)中占据的窗口 {@code [startAt, endAt)}。
 *
 * <p>{@code startAt} 是之前所有段的权重之和,{@code endAt = startAt + weight},因此按追加顺序相邻的
 * 两个段满足 {@code prev.endAt() == next.startAt()},所有窗口首尾相接地划分了长度为周期的一圈。
 */
final class WeightedSegment<T, E> implements AutoCloseable {

    private final FusedPollSource<T, E> source;
    private final int weight;
    private final long startAt;
    private final long endAt;

    WeightedSegment(FusedPollSource<T, E> source, int weight, long startAt) {
        checkArgument(weight > 0, "Weight must be at least 1, but is %s.", weight);
        checkArgument(startAt >= 0, "Start offset must not be negative, but is %s.", startAt);
        this.source = checkNotNull(source);
        this.weight = weight;
        this.startAt = startAt;
        this.endAt = startAt + weight;
    }

    Poll<T, E> poll(Waker waker) {
        return source.poll(waker);
    }

    /** 之前所有段的累计权重,即本段窗口的起点(包含)。 */
    long startAt() {
        return startAt;
    }

    /** 本段窗口的终点(不包含),也是下一段的 {@link #startAt()}。 */
    long endAt() {
        return endAt;
    }

    @Override
    public void close() throws Exception {
        source.close();
    }

    @Override
    public String toString() {
        return "Segment{weight=" + weight + ", window=[" + startAt + ", " + endAt + ")}";
    }
}
