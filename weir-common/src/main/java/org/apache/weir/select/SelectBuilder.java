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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.List;

import static org.apache.weir.utils.Preconditions.checkArgument;
import static org.apache.weir.utils.Preconditions.checkNotNull;
import static org.apache.weir.utils.Preconditions.checkState;

/**
 * {@link WeightedSelect} 的增量构建器。
 *
 * <p>按追加顺序登记带权重的源,追加顺序就是优先级顺序:越早追加,在每一圈中越先获得输出机会。
 * 每次 {@link #append(PollSource, int)} 都会:
 *
 * <ol>
 *   <li>检查权重至少为 1,否则抛出 {@link IllegalArgumentException}(调用方的编程错误)
 *   <li>把源包装为 {@link FusedPollSource}
 *   <li>以当前累计权重作为新段窗口的起点,并把累计权重增加该权重
 * </ol>
 *
 * <p>{@link #build()} 之后构建器失效,再调用 {@code append} 或 {@code build} 会抛出
 * {@link IllegalStateException}。已追加的源归构建出的 {@link WeightedSelect} 所有。
 *
 * <pre>{@code
 * WeightedSelect<Integer, IOException> select =
 *         WeightedSelect.<Integer, IOException>builder()
 *                 .append(PollSources.of(1, 1), 1)
 *                 .append(PollSources.of(2, 2, 2), 3)
 *                 .append(PollSources.of(3, 3, 3, 3), 1)
 *                 .build();
 * // 输出: 1, 2, 2, 2, 3, 1, 3, 3, 3
 * }</pre>
 *
 * @param <T> 所有源共享的元素类型
 * @param <E> 所有源共享的失败值类型
 */
@Public
@NotThreadSafe
public class SelectBuilder<T, E> {

    private static final Logger LOG = LoggerFactory.getLogger(SelectBuilder.class);

    private final SelectOptions options;
    private final List<WeightedSegment<T, E>> segments;

    /** 已追加的所有权重之和,也是下一段的起点。 */
    private long totalWeight;

    private boolean built;

    SelectBuilder(SelectOptions options) {
        this.options = checkNotNull(options);
        this.segments = new ArrayList<>();
        this.totalWeight = 0;
        this.built = false;
    }

    /**
     * 以给定权重追加一个源。
     *
     * @param source 要追加的源
     * @param weight 每圈分配给该源的输出次数,至少为 1
     * @return 当前构建器
     * @throws IllegalArgumentException 如果权重小于 1
     * @throws IllegalStateException 如果已经调用过 {@link #build()}
     */
    public SelectBuilder<T, E> append(PollSource<T, E> source, int weight) {
        checkState(!built, "Cannot append a source after the select has been built.");
        checkNotNull(source, "source must not be null");
        checkArgument(weight > 0, "Weight must be at least 1, but is %s.", weight);

        FusedPollSource<T, E> fused = new FusedPollSource<>(source, options.failurePolicy());
        segments.add(new WeightedSegment<>(fused, weight, totalWeight));
        totalWeight += weight;
        return this;
    }

    /** 以 {@link SelectOptions#DEFAULT_WEIGHT} 配置的权重追加一个源。 */
    public SelectBuilder<T, E> append(PollSource<T, E> source) {
        return append(source, options.defaultWeight());
    }

    /**
     * 完成构建。
     *
     * <p>周期长度固定为所有权重之和;一个源都没有追加时为 1,此时得到的 select 第一次轮询就返回
     * {@code COMPLETED}。
     *
     * @throws IllegalStateException 如果已经调用过 {@link #build()}
     */
    public WeightedSelect<T, E> build() {
        checkState(!built, "The select has already been built.");
        built = true;

        // an empty chain still needs a positive modulus for the cursor
        long cycleLength = segments.isEmpty() ? 1 : totalWeight;
        LOG.debug(
                "Built weighted select with {} segments and cycle length {}.",
                segments.size(),
                cycleLength);
        return new WeightedSelect<>(new ArrayList<>(segments), cycleLength);
    }

    /** 当前的累计权重;一个源都没有时为 1,与构建后的周期长度一致。 */
    public long cycleLength() {
        return segments.isEmpty() ? 1 : totalWeight;
    }

    public int segmentCount() {
        return segments.size();
    }
}
