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

import org.apache.weir.utils.CloseableIterator;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.apache.weir.select.TestPollSources.drain;
import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link PollSources}. */
public class PollSourcesTest {

    @Test
    public void testOf() {
        PollSource<String, Exception> source = PollSources.of("a", "b");

        assertThat(source.poll(Waker.NOOP)).isEqualTo(Poll.ready("a"));
        assertThat(source.poll(Waker.NOOP)).isEqualTo(Poll.ready("b"));
        assertThat(source.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(source.poll(Waker.NOOP)).isEqualTo(Poll.completed());
    }

    @Test
    public void testEmpty() {
        assertThat(PollSources.<String, Exception>empty().poll(Waker.NOOP))
                .isEqualTo(Poll.completed());
        assertThat(drain(PollSources.<String, Exception>of())).isEmpty();
    }

    @Test
    public void testFromIterableKeepsOrder() {
        assertThat(drain(PollSources.fromIterable(Arrays.asList(3, 1, 2))))
                .containsExactly(3, 1, 2);
    }

    @Test
    public void testFromIteratorClosesCloseableIterator() throws Exception {
        AtomicInteger closes = new AtomicInteger();
        CloseableIterator<Integer> iterator =
                CloseableIterator.adapterForIterator(
                        Arrays.asList(1, 2).iterator(), closes::incrementAndGet);
        PollSource<Integer, Exception> source = PollSources.fromIterator(iterator);

        assertThat(drain(source)).containsExactly(1, 2);
        assertThat(closes).hasValue(0);

        source.close();
        assertThat(closes).hasValue(1);
    }

    @Test
    public void testFromPlainIteratorCloseIsNoop() throws Exception {
        PollSource<Integer, Exception> source =
                PollSources.fromIterator(Arrays.asList(1, 2).iterator());

        source.close();
        assertThat(source.poll(Waker.NOOP)).isEqualTo(Poll.ready(1));
    }
}
