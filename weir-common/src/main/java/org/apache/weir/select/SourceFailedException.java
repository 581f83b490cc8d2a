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

/**
 * {@link BlockingPollIterator} 遇到 {@code FAILED} 结果时抛出的异常。
 *
 * <p>失败值原样保存在 {@link #getFailure()} 中;如果失败值本身是 {@link Throwable},它同时作为 cause。
 */
@Public
public class SourceFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object failure;

    public SourceFailedException(Object failure) {
        super(
                "Source reported a failure: " + failure,
                failure instanceof Throwable ? (Throwable) failure : null);
        this.failure = failure;
    }

    /** 返回源报告的失败值。 */
    @SuppressWarnings("unchecked")
    public <E> E getFailure() {
        return (E) failure;
    }
}
