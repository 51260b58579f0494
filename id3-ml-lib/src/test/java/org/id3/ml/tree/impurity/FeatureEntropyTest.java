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
import org.id3.ml.common.table.CategoricalTable;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

/** Tests {@link FeatureEntropy}. */
public class FeatureEntropyTest {
    private static final double TOLERANCE = 1e-4;

    private static final CategoricalTable WEATHER =
            CategoricalTable.builder()
                    .column(
                            "Weather",
                            "Sunny", "Sunny", "Sunny", "Sunny", "Rainy", "Rainy", "Rainy", "Rainy")
                    .column("Play", "Yes", "Yes", "Yes", "No", "Yes", "No", "No", "No")
                    .build();

    @Test
    public void testSubsetEntropy() {
        assertEquals(
                0.8113,
                FeatureEntropy.subsetEntropy(WEATHER.filter("Weather", "Sunny"), "Play"),
                TOLERANCE);
        assertEquals(
                0.8113,
                FeatureEntropy.subsetEntropy(WEATHER.filter("Weather", "Rainy"), "Play"),
                TOLERANCE);
        assertEquals(1.0, FeatureEntropy.labelEntropy(WEATHER, "Play"), 1e-9);
    }

    @Test
    public void testFeatureEntropy() {
        assertEquals(0.8113, FeatureEntropy.featureEntropy(WEATHER, "Weather", "Play"), TOLERANCE);
    }

    @Test
    public void testPerfectSplit() {
        CategoricalTable table =
                CategoricalTable.builder()
                        .column("F", "A", "B", "A", "B", "A")
                        .column("Play", "Yes", "No", "Yes", "No", "Yes")
                        .build();

        assertEquals(0.0, FeatureEntropy.featureEntropy(table, "F", "Play"), 0.0);
    }

    @Test
    public void testLabelAgainstItselfIsZero() {
        assertEquals(0.0, FeatureEntropy.featureEntropy(WEATHER, "Play", "Play"), 0.0);
    }

    @Test
    public void testUninformativeFeature() {
        CategoricalTable table =
                CategoricalTable.builder()
                        .column("Wind", "Weak", "Strong", "Weak", "Strong")
                        .column("Play", "Yes", "Yes", "No", "No")
                        .build();

        assertEquals(1.0, FeatureEntropy.featureEntropy(table, "Wind", "Play"), 1e-9);
    }

    @Test(expected = InvalidInputException.class)
    public void testMissingLabel() {
        FeatureEntropy.featureEntropy(WEATHER, "Weather", "Temperature");
    }

    @Test(expected = InvalidInputException.class)
    public void testMissingFeature() {
        FeatureEntropy.featureEntropy(WEATHER, "Temperature", "Play");
    }

    @Test(expected = InvalidInputException.class)
    public void testEmptyTable() {
        FeatureEntropy.featureEntropy(WEATHER.filter("Weather", "Snowy"), "Weather", "Play");
    }
}
