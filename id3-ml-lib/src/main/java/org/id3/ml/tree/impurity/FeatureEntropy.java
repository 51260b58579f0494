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

import org.apache.flink.util.Preconditions;

import java.util.Collection;

/**
 * Entropy of a label column within a table, and the conditional entropy of the label after
 * partitioning the rows by the values of a feature.
 */
public class FeatureEntropy {
    private static final Impurity ENTROPY = new Entropy();

    private FeatureEntropy() {}

    /**
     * Computes the entropy of the label distribution in {@code subtable}. Label values are grouped
     * in first-seen order.
     *
     * @throws InvalidInputException if the label column is missing or the table has no rows.
     */
    public static double subsetEntropy(CategoricalTable subtable, String label) {
        Preconditions.checkNotNull(subtable);
        return ENTROPY.calculate(toArray(subtable.valueCounts(label).values()));
    }

    /** Computes the entropy of the label over the whole table, before any split. */
    public static double labelEntropy(CategoricalTable table, String label) {
        return subsetEntropy(table, label);
    }

    /**
     * Computes the weighted average entropy of the label after splitting {@code table} on {@code
     * feature}: the sum over every distinct feature value {@code v} of {@code p(v) *
     * subsetEntropy(rows where feature == v)}. Values are visited in first-seen order so the
     * floating point sum is reproducible.
     *
     * @throws InvalidInputException if a column is missing or the table has no rows.
     */
    public static double featureEntropy(CategoricalTable table, String feature, String label) {
        Preconditions.checkNotNull(table);
        if (table.getNumRows() == 0) {
            throw new InvalidInputException(
                    String.format("Cannot compute the entropy of '%s' over %s.", feature, table));
        }
        if (!table.hasColumn(label)) {
            throw new InvalidInputException(
                    String.format("Label '%s' is not a column of %s.", label, table));
        }

        double entropy = 0.0;
        for (String value : table.distinctValues(feature)) {
            entropy +=
                    Probability.of(table, feature, value)
                            * subsetEntropy(table.filter(feature, value), label);
        }
        return entropy;
    }

    private static long[] toArray(Collection<Long> counts) {
        long[] result = new long[counts.size()];
        int index = 0;
        for (Long count : counts) {
            result[index++] = count;
        }
        return result;
    }
}
