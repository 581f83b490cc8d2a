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

/** 源报告失败之后再次被轮询时,{@link FusedPollSource} 的处理方式。 */
@Public
public enum FailurePolicy {

    /** 失败之后视为已结束:后续轮询直接返回 {@code COMPLETED},不再调用被包装的源。 */
    COMPLETE,

    /**
     * 失败之后禁止再轮询:后续轮询抛出 {@link IllegalStateException}。
     *
     * <p>在 {@link WeightedSelect} 中,调用方并不直接轮询单个源,每次经过失败段的遍历都会抛出该异常。因此任一源
     * 失败之后,整个 select 实际上不可再用,其余源中剩下的元素也无法取出。
     */
    REJECT
}
