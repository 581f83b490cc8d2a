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

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ChannelPollSource}. */
public class ChannelPollSourceTest {

    @Test
    public void testPendingUntilOffered() {
        ChannelPollSource<String, String> channel = new ChannelPollSource<>();
        AtomicInteger wakes = new AtomicInteger();

        assertThat(channel.poll(wakes::incrementAndGet)).isEqualTo(Poll.pending());
        assertThat(wakes).hasValue(0);

        assertThat(channel.offer("a")).isTrue();
        assertThat(wakes).hasValue(1);
        assertThat(channel.size()).isEqualTo(1);

        // the waker is consumed by the first offer
        channel.offer("b");
        assertThat(wakes).hasValue(1);

        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.ready("a"));
        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.ready("b"));
        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.pending());
    }

    @Test
    public void testCompletionAfterBufferedItems() {
        ChannelPollSource<String, String> channel = new ChannelPollSource<>();
        AtomicInteger wakes = new AtomicInteger();
        channel.poll(wakes::incrementAndGet);

        channel.offer("a");
        channel.complete();

        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.ready("a"));
        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThatThrownBy(() -> channel.offer("b")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(channel::complete).isInstanceOf(IllegalStateException.class);
        assertThat(wakes).hasValue(1);
    }

    @Test
    public void testFailureAfterBufferedItems() {
        ChannelPollSource<String, String> channel = new ChannelPollSource<>();
        AtomicInteger wakes = new AtomicInteger();
        channel.poll(wakes::incrementAndGet);

        channel.fail("broken pipe");
        assertThat(wakes).hasValue(1);

        assertThat(channel.poll(Waker.NOOP)).isEqualTo(Poll.failed("broken pipe"));
        assertThatThrownBy(() -> channel.fail("again"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testWakerMayPollBack() {
        ChannelPollSource<String, String> channel = new ChannelPollSource<>();
        StringBuilder seen = new StringBuilder();
        Waker waker =
                new Waker() {
                    @Override
                    public void wake() {
                        Poll<String, String> poll = channel.poll(this);
                        seen.append(poll);
                    }
                };

        channel.poll(waker);
        channel.offer("a");

        assertThat(seen).hasToString("Ready(a)");
    }

    @Test
    public void testClose() {
        ChannelPollSource<String, String> channel = new ChannelPollSource<>();
        channel.offer("a");

        channel.close();

        assertThat(channel.size()).isZero();
        assertThat(channel.offer("b")).isFalse();
        assertThatThrownBy(() -> channel.poll(Waker.NOOP))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testInsideSelect() {
        ChannelPollSource<Integer, String> channel = new ChannelPollSource<>();
        WeightedSelect<Integer, String> select =
                WeightedSelect.<Integer, String>builder()
                        .append(channel, 2)
                        .append(PollSources.of(10), 1)
                        .build();
        AtomicInteger wakes = new AtomicInteger();

        assertThat(select.poll(wakes::incrementAndGet)).isEqualTo(Poll.ready(10));
        assertThat(select.poll(wakes::incrementAndGet)).isEqualTo(Poll.pending());

        channel.offer(1);
        assertThat(wakes).hasValue(1);
        assertThat(select.poll(Waker.NOOP)).isEqualTo(Poll.ready(1));

        channel.complete();
        assertThat(select.poll(Waker.NOOP)).isEqualTo(Poll.completed());
    }
}
