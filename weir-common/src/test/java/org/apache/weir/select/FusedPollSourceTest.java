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

import org.apache.weir.select.TestPollSources.ScriptedSource;

import org.junit.jupiter.api.Test;

import static org.apache.weir.select.TestPollSources.scripted;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link FusedPollSource}. */
public class FusedPollSourceTest {

    @Test
    public void testNotPolledAfterCompletion() {
        // the script would produce another item after reporting completion
        ScriptedSource<Integer, String> source =
                scripted(Poll.ready(1), Poll.completed(), Poll.ready(2));
        FusedPollSource<Integer, String> fused = FusedPollSource.fuse(source);

        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.ready(1));
        assertThat(fused.isTerminated()).isFalse();
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(fused.isTerminated()).isTrue();
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(source.polls()).isEqualTo(2);
    }

    @Test
    public void testPendingIsForwarded() {
        ScriptedSource<Integer, String> source =
                scripted(Poll.pending(), Poll.ready(1), Poll.pending());
        FusedPollSource<Integer, String> fused = FusedPollSource.fuse(source);

        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.pending());
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.ready(1));
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.pending());
        assertThat(fused.isTerminated()).isFalse();
    }

    @Test
    public void testCompleteAfterFailure() {
        ScriptedSource<Integer, String> source =
                scripted(Poll.failed("boom"), Poll.ready(1));
        FusedPollSource<Integer, String> fused =
                new FusedPollSource<>(source, FailurePolicy.COMPLETE);

        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.failed("boom"));
        assertThat(fused.isTerminated()).isTrue();
        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.completed());
        assertThat(source.polls()).isEqualTo(1);
    }

    @Test
    public void testRejectAfterFailure() {
        ScriptedSource<Integer, String> source =
                scripted(Poll.failed("boom"), Poll.ready(1));
        FusedPollSource<Integer, String> fused =
                new FusedPollSource<>(source, FailurePolicy.REJECT);

        assertThat(fused.poll(Waker.NOOP)).isEqualTo(Poll.failed("boom"));
        assertThat(fused.isTerminated()).isFalse();
        assertThatThrownBy(() -> fused.poll(Waker.NOOP))
                .isInstanceOf(IllegalStateException.class);
        assertThat(source.polls()).isEqualTo(1);
    }

    @Test
    public void testFuseIsIdempotent() throws Exception {
        ScriptedSource<Integer, String> source = scripted(Poll.ready(1));
        FusedPollSource<Integer, String> fused = FusedPollSource.fuse(source);

        assertThat(FusedPollSource.fuse(fused)).isSameAs(fused);

        fused.close();
        assertThat(source.closes()).isEqualTo(1);
    }
}
