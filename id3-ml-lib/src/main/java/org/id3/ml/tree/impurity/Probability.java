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

/** Estimates the empirical probability of a value within a column of a {@link CategoricalTable}. */
public class Probability {

    private Probability() {}

    /**
     * Returns the fraction of rows of {@code table} whose {@code feature} column holds {@code
     * value}.
     *
     * @throws InvalidInputException if the column does not exist or never holds the value.
     * @throws IllegalStateException if the table has no rows.
     */
    public static double of(CategoricalTable table, String feature, String value) {
        Preconditions.checkNotNull(table);
        if (!table.hasColumn(feature)) {
            throw new InvalidInputException(
                    String.format("Feature '%s' is not a column of %s.", feature, table));
        }
        Preconditions.checkState(
                table.getNumRows() > 0,
                "Cannot estimate the probability of '%s' in column '%s' of a table without rows.",
                value,
                feature);

        long count = table.countOf(feature, value);
        if (count == 0) {
            throw new InvalidInputException(
                    String.format("Value '%s' does not occur in column '%s'.", value, feature));
        }
        return (double) count / table.getNumRows();
    }
}
