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

import java.util.Arrays;

/** Base-2 Shannon entropy of a class distribution. */
public class Entropy implements Impurity {
    private static final long serialVersionUID = 1L;

    private static final double LOG_2 = Math.log(2);

    /**
     * Returns {@code -sum(p * log2(p))} over the nonzero counts, where {@code p} is a count divided
     * by the total. The result lies in {@code [0, log2(k)]} for {@code k} nonzero counts.
     *
     * @throws InvalidInputException if the counts are empty, contain a negative count or sum to
     *     zero.
     */
    @Override
    public double calculate(long[] counts) {
        if (counts == null || counts.length == 0) {
            throw new InvalidInputException("Entropy requires at least one class count.");
        }
        long totalCount = 0;
        for (long classCount : counts) {
            if (classCount < 0) {
                throw new InvalidInputException(
                        "Class counts must be non-negative, got " + Arrays.toString(counts));
            }
            totalCount += classCount;
        }
        if (totalCount == 0) {
            throw new InvalidInputException("Entropy is undefined for a distribution without rows.");
        }

        double impurity = 0.0;
        for (long classCount : counts) {
            // log2(0) is never evaluated, an empty class contributes nothing.
            if (classCount != 0) {
                double freq = (double) classCount / totalCount;
                impurity -= freq * log2(freq);
            }
        }
        return impurity;
    }

    private static double log2(double x) {
        return Math.log(x) / LOG_2;
    }
}
