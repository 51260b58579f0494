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

package org.id3.ml.feature.infogain;

import org.id3.ml.common.exception.AmbiguousLabelException;
import org.id3.ml.common.exception.InvalidInputException;
import org.id3.ml.common.table.CategoricalTable;
import org.id3.ml.common.table.LabelColumn;
import org.id3.ml.tree.impurity.FeatureEntropy;

import org.apache.flink.util.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Picks the feature to split an ID3 decision tree node on: the column whose values leave the label
 * with the lowest conditional entropy, which is the column with the highest information gain.
 *
 * <p>Ties are broken by column order. The label comes first in the working table, followed by the
 * columns of the input table in their original order, and among features with equal entropy the
 * one that comes first wins.
 *
 * <p>A column named {@value #INDEX_COL} is treated as leftover row numbering and is never ranked.
 */
public class InfoGainFeatureSelector {
    private static final Logger LOG = LoggerFactory.getLogger(InfoGainFeatureSelector.class);

    /** Name of the row identifier column stripped before ranking. */
    public static final String INDEX_COL = "index";

    private InfoGainFeatureSelector() {}

    /**
     * Returns the name of the feature with the lowest conditional entropy of the label.
     *
     * @param table The feature columns. Must not contain the label.
     * @param labelColumn The label values, aligned by row with {@code table}.
     * @return The name of the best feature to split on.
     * @throws InvalidInputException if the table has no rows or no candidate columns, or the label
     *     is not aligned with it.
     * @throws AmbiguousLabelException if the label name is already a column of the table.
     */
    public static String bestFeature(CategoricalTable table, LabelColumn labelColumn) {
        return rankFeatures(table, labelColumn).get(0).getFeature();
    }

    /**
     * Scores every candidate feature and returns them ordered by ascending conditional entropy,
     * which is descending information gain.
     *
     * @see #bestFeature(CategoricalTable, LabelColumn)
     */
    public static List<FeatureScore> rankFeatures(CategoricalTable table, LabelColumn labelColumn) {
        Preconditions.checkNotNull(table);
        Preconditions.checkNotNull(labelColumn);
        final String label = labelColumn.getName();

        if (table.hasColumn(label) || INDEX_COL.equals(label)) {
            throw new AmbiguousLabelException(label);
        }
        if (table.getNumColumns() == 0) {
            throw new InvalidInputException("Cannot select a feature from a table without columns.");
        }
        if (table.getNumRows() == 0) {
            throw new InvalidInputException("Cannot select a feature from a table without rows.");
        }

        CategoricalTable workingCopy = table.withColumn(0, labelColumn).withoutColumn(INDEX_COL);
        if (workingCopy.getNumColumns() < 2) {
            throw new InvalidInputException(
                    String.format("No candidate feature left in %s besides the label.", table));
        }

        List<Map.Entry<String, Double>> entropies = new ArrayList<>();
        for (String column : workingCopy.getColumnNames()) {
            entropies.add(
                    new AbstractMap.SimpleImmutableEntry<>(
                            column, FeatureEntropy.featureEntropy(workingCopy, column, label)));
        }
        // List.sort is stable, equal entropies keep the column order.
        entropies.sort(Map.Entry.comparingByValue());
        entropies.removeIf(entry -> entry.getKey().equals(label));

        double labelEntropy = FeatureEntropy.labelEntropy(workingCopy, label);
        // Rounding may leave an uninformative feature slightly above the label entropy.
        List<FeatureScore> scores = new ArrayList<>(entropies.size());
        for (Map.Entry<String, Double> entry : entropies) {
            scores.add(
                    new FeatureScore(
                            entry.getKey(),
                            entry.getValue(),
                            Math.max(0.0, labelEntropy - entry.getValue()),
                            scores.size()));
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Ranked {} features over {} rows against label '{}' (entropy {}): {}",
                    scores.size(),
                    table.getNumRows(),
                    label,
                    labelEntropy,
                    scores);
        }
        return scores;
    }
}
