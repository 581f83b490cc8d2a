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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

import static org.apache.weir.utils.Preconditions.checkNotNull;
import static org.apache.weir.utils.Preconditions.checkState;

/**
 * 熔断(fuse)适配器:源一旦报告结束,就再也不会被轮询。
 *
 * <p>在被包装的源返回 {@code COMPLETED} 之前,所有轮询原样转发;之后的每次轮询立即返回
 * {@code COMPLETED},不再调用被包装的源。{@link WeightedSelect} 依赖这一点,它会在一圈中反复
 * 经过已经结束的源。
 *
 * <p>源返回 {@code FAILED} 之后的行为由 {@link FailurePolicy} 决定:
 *
 * <ul>
 *   <li>{@link FailurePolicy#COMPLETE}: 同样熔断,后续轮询返回 {@code COMPLETED}
 *   <li>{@link FailurePolicy#REJECT}: 后续轮询抛出 {@link IllegalStateException}。包装在
 *       {@link WeightedSelect} 中时,下一次经过该段的遍历就会抛出,整个 select 随之不可再用
 * </ul>
 *
 * <p>失败本身总是在发生的那次轮询中原样返回。
 *
 * @param <T> 元素类型
 * @param <E> 失败值类型
 */
@NotThreadSafe
public class FusedPollSource<T, E> implements PollSource<T, E> {

    private static final Logger LOG = LoggerFactory.getLogger(FusedPollSource.class);

    private final PollSource<T, E> source;
    private final FailurePolicy failurePolicy;

    private boolean done;
    private boolean failed;

    public FusedPollSource(PollSource<T, E> source, FailurePolicy failurePolicy) {
        this.source = checkNotNull(source, "source must not be null");
        this.failurePolicy = checkNotNull(failurePolicy, "failurePolicy must not be null");
    }

    /** 使用 {@link FailurePolicy#COMPLETE} 包装源;已经熔断的源原样返回。 */
    public static <T, E> FusedPollSource<T, E> fuse(PollSource<T, E> source) {
        if (source instanceof FusedPollSource) {
            return (FusedPollSource<T, E>) source;
        }
        return new FusedPollSource<>(source, FailurePolicy.COMPLETE);
    }

    @Override
    public Poll<T, E> poll(Waker waker) {
        if (failed) {
            checkState(
                    failurePolicy != FailurePolicy.REJECT,
                    "Source %s was polled again after it reported a failure.",
                    source);
            return Poll.completed();
        }
        if (done) {
            return Poll.completed();
        }

        Poll<T, E> poll = source.poll(waker);
        if (poll.isCompleted()) {
            done = true;
            LOG.debug("Source {} completed, it will not be polled again.", source);
        } else if (poll.isFailed()) {
            failed = true;
        }
        return poll;
    }

    /** 被包装的源是否已经结束(或在 {@link FailurePolicy#COMPLETE} 下已经失败)。 */
    public boolean isTerminated() {
        return done || (failed && failurePolicy == FailurePolicy.COMPLETE);
    }

    @Override
    public void close() throws Exception {
        source.close();
    }

    @Override
    public String toString() {
        return "Fused(" + source + ")";
    }
}
