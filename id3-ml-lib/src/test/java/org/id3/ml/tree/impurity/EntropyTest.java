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

package org.id3.ml.tree.impurity;

import org.id3.ml.common.exception.InvalidInputException;

import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/** Tests {@link Entropy}. */
public class EntropyTest {
    private static final double TOLERANCE = 1e-9;

    private final Entropy entropy = new Entropy();

    @Test
    public void testSingleClassIsPure() {
        assertEquals(0.0, entropy.calculate(new long[] {1}), 0.0);
        assertEquals(0.0, entropy.calculate(new long[] {42}), 0.0);
        assertEquals(0.0, entropy.calculate(new long[] {0, 7, 0}), 0.0);
    }

    @Test
    public void testEqualCountsReachMaximum() {
        for (int k = 1; k <= 16; k++) {
            for (long m : new long[] {1, 3, 1000}) {
                long[] counts = new long[k];
                Arrays.fill(counts, m);
                assertEquals(Math.log(k) / Math.log(2), entropy.calculate(counts), TOLERANCE);
            }
        }
    }

    @Test
    public void testKnownDistribution() {
        assertEquals(0.8112781244591328, entropy.calculate(new long[] {3, 1}), TOLERANCE);
        assertEquals(1.5, entropy.calculate(new long[] {2, 1, 1}), TOLERANCE);
    }

    @Test
    public void testBounds() {
        Random random = new Random(2022);
        for (int trial = 0; trial < 500; trial++) {
            long[] counts = new long[1 + random.nextInt(10)];
            int nonZero = 0;
            for (int i = 0; i < counts.length; i++) {
                counts[i] = random.nextInt(5) == 0 ? 0 : 1 + random.nextInt(50);
                if (counts[i] != 0) {
                    nonZero++;
                }
            }
            if (nonZero == 0) {
                counts[0] = 1;
                nonZero = 1;
            }

            double value = entropy.calculate(counts);
            assertTrue(value >= 0.0);
            assertTrue(value <= Math.log(nonZero) / Math.log(2) + TOLERANCE);
        }
    }

    @Test(expected = InvalidInputException.class)
    public void testZeroTotal() {
        entropy.calculate(new long[] {0, 0});
    }

    @Test(expected = InvalidInputException.class)
    public void testNoCounts() {
        entropy.calculate(new long[0]);
    }

    @Test(expected = InvalidInputException.class)
    public void testNegativeCount() {
        entropy.calculate(new long[] {3, -1});
    }
}
