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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/** Tests for {@link IOUtils}. */
public class IOUtilsTest {

    @Test
    public void testCloseAllInOrder() throws Exception {
        List<String> closed = new ArrayList<>();

        IOUtils.closeAll(() -> closed.add("a"), null, () -> closed.add("b"));

        assertThat(closed).containsExactly("a", "b");
    }

    @Test
    public void testCloseAllCollectsExceptions() {
        List<String> closed = new ArrayList<>();
        IOException first = new IOException("first");
        IllegalStateException second = new IllegalStateException("second");

        List<AutoCloseable> closeables =
                Arrays.asList(
                        () -> {
                            throw first;
                        },
                        () -> closed.add("middle"),
                        () -> {
                            throw second;
                        });

        Throwable thrown = catchThrowable(() -> IOUtils.closeAll(closeables));

        assertThat(thrown).isSameAs(first);
        assertThat(thrown.getSuppressed()).containsExactly(second);
        assertThat(closed).containsExactly("middle");
    }

    @Test
    public void testErrorIsRethrownImmediately() {
        List<String> closed = new ArrayList<>();

        assertThatThrownBy(
                        () ->
                                IOUtils.closeAll(
                                        () -> {
                                            throw new AssertionError("fatal");
                                        },
                                        () -> closed.add("after")))
                .isInstanceOf(AssertionError.class);
        assertThat(closed).isEmpty();
    }

    @Test
    public void testCloseAllNullIterable() throws Exception {
        IOUtils.closeAll((Iterable<AutoCloseable>) null);
    }
}
