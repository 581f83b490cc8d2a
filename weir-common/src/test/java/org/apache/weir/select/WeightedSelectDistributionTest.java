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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.apache.weir.select.TestPollSources.drain;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks that always-ready sources are drained lap by lap: each lap takes up to the weight of
 * items from every source in append order, skipping sources that have run dry.
 */
public class WeightedSelectDistributionTest {

    private static final long SEED = 20240611L;

    static Stream<Arguments> randomDistributions() {
        Random random = new Random(SEED);
        Stream<Arguments> fixed =
                Stream.of(
                        Arguments.of(0, 1, 0, 1, 0, 1),
                        Arguments.of(2, 1, 3, 3, 4, 1),
                        Arguments.of(0, 5, 7, 2, 0, 9),
                        Arguments.of(300, 255, 1, 1, 300, 1));
        Stream<Arguments> generated =
                IntStream.range(0, 200)
                        .mapToObj(
                                i ->
                                        Arguments.of(
                                                random.nextInt(60),
                                                1 + random.nextInt(8),
                                                random.nextInt(60),
                                                1 + random.nextInt(8),
                                                random.nextInt(60),
                                                1 + random.nextInt(8)));
        return Stream.concat(fixed, generated);
    }

    @ParameterizedTest(name = "a={0}x{1}, b={2}x{3}, c={4}x{5}")
    @MethodSource("randomDistributions")
    public void testDistribution(int an, int aw, int bn, int bw, int cn, int cw) {
        WeightedSelect<Character, String> select =
                WeightedSelect.<Character, String>builder()
                        .append(PollSources.fromIterable(Collections.nCopies(an, 'a')), aw)
                        .append(PollSources.fromIterable(Collections.nCopies(bn, 'b')), bw)
                        .append(PollSources.fromIterable(Collections.nCopies(cn, 'c')), cw)
                        .build();

        List<Character> expected = new ArrayList<>(an + bn + cn);
        while (an > 0 || bn > 0 || cn > 0) {
            expected.addAll(Collections.nCopies(Math.min(aw, an), 'a'));
            an = Math.max(0, an - aw);
            expected.addAll(Collections.nCopies(Math.min(bw, bn), 'b'));
            bn = Math.max(0, bn - bw);
            expected.addAll(Collections.nCopies(Math.min(cw, cn), 'c'));
            cn = Math.max(0, cn - cw);
        }

        assertThat(drain(select)).isEqualTo(expected);
    }
}
