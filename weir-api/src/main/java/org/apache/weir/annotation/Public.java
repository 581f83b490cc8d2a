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

package org.apache.weir.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 公共稳定接口注解。
 *
 * <p>被标记的类型属于 Weir 对外承诺的 API,在主版本内保持向后兼容。调用方可以直接依赖
 * {@code PollSource}、{@code WeightedSelect}、{@code Options} 等被标记的类型。
 *
 * <h2>与其他注解的关系</h2>
 *
 * <ul>
 *   <li>{@link Experimental}: 实验性 API,可能在次版本中变更,与 @Public 互斥
 *   <li>{@link VisibleForTesting}: 仅为测试放宽可见性,不属于公共 API
 * </ul>
 *
 * @see Experimental
 * @see VisibleForTesting
 */
@Documented
@Target(ElementType.TYPE)
@Public
public @interface Public {}
