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
import org.apache.weir.options.ConfigOption;
import org.apache.weir.options.ConfigOptions;
import org.apache.weir.options.Options;

import static org.apache.weir.utils.Preconditions.checkArgument;

/**
 * {@link WeightedSelect} 的配置项。
 *
 * <pre>{@code
 * Options options = new Options();
 * options.set(SelectOptions.DEFAULT_WEIGHT, 2);
 * options.set(SelectOptions.AFTER_FAILURE, FailurePolicy.REJECT);
 *
 * WeightedSelect<String, IOException> select =
 *         WeightedSelect.<String, IOException>builder(options)
 *                 .append(primary, 3)
 *                 .append(secondary)
 *                 .build();
 * }</pre>
 */
@Public
public class SelectOptions {

    public static final ConfigOption<Integer> DEFAULT_WEIGHT =
            ConfigOptions.key("select.source.default-weight")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "Weight given to a source appended without an explicit weight. "
                                    + "Must be at least 1.");

    public static final ConfigOption<FailurePolicy> AFTER_FAILURE =
            ConfigOptions.key("select.source.after-failure")
                    .enumType(FailurePolicy.class)
                    .defaultValue(FailurePolicy.COMPLETE)
                    .withDescription(
                            "What a source does when it is polled again after reporting a failure. "
                                    + "COMPLETE treats it as finished. REJECT throws, which "
                                    + "leaves the whole select unusable once any source failed.");

    private final int defaultWeight;
    private final FailurePolicy failurePolicy;

    public SelectOptions(Options options) {
        this.defaultWeight = options.get(DEFAULT_WEIGHT);
        this.failurePolicy = options.get(AFTER_FAILURE);
        checkArgument(
                defaultWeight > 0,
                "%s must be at least 1, but is %s.",
                DEFAULT_WEIGHT.key(),
                defaultWeight);
    }

    public int defaultWeight() {
        return defaultWeight;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }
}
