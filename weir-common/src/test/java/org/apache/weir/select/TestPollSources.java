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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/** {@link PollSource} implementations for tests. */
public class TestPollSources {

    /**
     * Alternates between forwarding to the wrapped source and reporting {@code PENDING}. The
     * pending polls wake the caller immediately.
     */
    public static <T, E> PollSource<T, E> withBreaks(PollSource<T, E> source) {
        return new PollSource<T, E>() {
            private boolean forward;

            @Override
            public Poll<T, E> poll(Waker waker) {
                forward = !forward;
                if (forward) {
                    return source.poll(waker);
                }
                waker.wake();
                return Poll.pending();
            }

            @Override
            public void close() throws Exception {
                source.close();
            }
        };
    }

    /** Replays the given outcomes in order, then reports {@code COMPLETED}. */
    @SafeVarargs
    public static <T, E> ScriptedSource<T, E> scripted(Poll<T, E>... polls) {
        return new ScriptedSource<>(Arrays.asList(polls));
    }

    /** Source with a fixed script of outcomes that records how often it was polled and closed. */
    public static class ScriptedSource<T, E> implements PollSource<T, E> {

        private final Deque<Poll<T, E>> script;
        private int polls;
        private int closes;
        private Exception closeException;

        ScriptedSource(List<Poll<T, E>> script) {
            this.script = new ArrayDeque<>(script);
        }

        @Override
        public Poll<T, E> poll(Waker waker) {
            polls++;
            Poll<T, E> next = script.poll();
            if (next == null) {
                return Poll.completed();
            }
            if (next.isPending()) {
                waker.wake();
            }
            return next;
        }

        public ScriptedSource<T, E> failOnClose(Exception e) {
            this.closeException = e;
            return this;
        }

        @Override
        public void close() throws Exception {
            closes++;
            if (closeException != null) {
                throw closeException;
            }
        }

        public int polls() {
            return polls;
        }

        public int closes() {
            return closes;
        }
    }

    /** Polls the source until it completes, collecting items and failing on any failure. */
    public static <T, E> List<T> drain(PollSource<T, E> source) {
        List<T> items = new ArrayList<>();
        for (int i = 0; i < 1_000_000; i++) {
            Poll<T, E> poll = source.poll(Waker.NOOP);
            if (poll.isReady()) {
                items.add(poll.item());
            } else if (poll.isCompleted()) {
                return items;
            } else if (poll.isFailed()) {
                throw new AssertionError("Unexpected failure " + poll.failure());
            }
        }
        throw new AssertionError("Source did not complete, got " + items);
    }
}
