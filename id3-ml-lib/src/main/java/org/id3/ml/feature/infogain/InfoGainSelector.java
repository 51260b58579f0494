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

import org.id3.ml.common.datastream.DataStreamUtils;
import org.id3.ml.common.exception.AmbiguousLabelException;
import org.id3.ml.common.exception.InvalidInputException;
import org.id3.ml.common.table.CategoricalTable;
import org.id3.ml.common.table.LabelColumn;

import org.apache.flink.api.common.functions.MapPartitionFunction;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.java.typeutils.RowTypeInfo;
import org.apache.flink.ml.api.AlgoOperator;
import org.apache.flink.ml.param.Param;
import org.apache.flink.ml.util.ParamUtils;
import org.apache.flink.ml.util.ReadWriteUtils;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.table.api.Table;
import org.apache.flink.table.api.bridge.java.StreamTableEnvironment;
import org.apache.flink.table.api.internal.TableImpl;
import org.apache.flink.types.Row;
import org.apache.flink.util.Collector;
import org.apache.flink.util.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An AlgoOperator which ranks the feature columns of a table by the information gain they provide
 * about a categorical label column, as used by ID3 to choose a split.
 *
 * <p>Every feature and label value is treated as a category through its string representation.
 * The output table has one row per feature with the columns {@value #FEATURE_COL}, {@value
 * #ENTROPY_COL}, {@value #INFO_GAIN_COL} and {@value #RANK_COL}. The row with rank 0 holds the
 * best feature.
 *
 * <p>All input rows are gathered into a single task before ranking.
 */
public class InfoGainSelector
        implements AlgoOperator<InfoGainSelector>, InfoGainSelectorParams<InfoGainSelector> {
    private static final Logger LOG = LoggerFactory.getLogger(InfoGainSelector.class);

    public static final String FEATURE_COL = "feature";
    public static final String ENTROPY_COL = "entropy";
    public static final String INFO_GAIN_COL = "infoGain";
    public static final String RANK_COL = "rank";

    private final Map<Param<?>, Object> paramMap = new HashMap<>();

    public InfoGainSelector() {
        ParamUtils.initializeMapWithDefaultValues(paramMap, this);
    }

    @Override
    public Table[] transform(Table... inputs) {
        Preconditions.checkArgument(inputs.length == 1);
        final String labelCol = getLabelCol();
        List<String> inputCols = inputs[0].getResolvedSchema().getColumnNames();
        if (!inputCols.contains(labelCol)) {
            throw new InvalidInputException(
                    String.format(
                            "Label column '%s' does not exist. Input columns: %s.",
                            labelCol, inputCols));
        }
        if (labelCol.equals(InfoGainFeatureSelector.INDEX_COL)
                || labelCol.equals(getIndexCol())) {
            throw new AmbiguousLabelException(labelCol);
        }
        final String[] featureCols = resolveFeatureCols(inputCols, labelCol);
        if (featureCols.length == 0) {
            throw new InvalidInputException(
                    String.format("No feature column to rank. Input columns: %s.", inputCols));
        }

        int[] featureIndices = new int[featureCols.length];
        for (int i = 0; i < featureCols.length; i++) {
            featureIndices[i] = inputCols.indexOf(featureCols[i]);
        }
        int labelIndex = inputCols.indexOf(labelCol);

        StreamTableEnvironment tEnv =
                (StreamTableEnvironment) ((TableImpl) inputs[0]).getTableEnvironment();
        DataStream<Row> input = tEnv.toDataStream(inputs[0]);

        RowTypeInfo outputTypeInfo =
                new RowTypeInfo(
                        new TypeInformation[] {Types.STRING, Types.DOUBLE, Types.DOUBLE, Types.INT},
                        new String[] {FEATURE_COL, ENTROPY_COL, INFO_GAIN_COL, RANK_COL});

        DataStream<Row> output =
                DataStreamUtils.mapAll(
                        input,
                        new RankFeaturesFunction(featureCols, featureIndices, labelCol, labelIndex),
                        outputTypeInfo);

        return new Table[] {tEnv.fromDataStream(output)};
    }

    private String[] resolveFeatureCols(List<String> inputCols, String labelCol) {
        String[] featureCols = getFeatureCols();
        if (featureCols == null) {
            List<String> candidates = new ArrayList<>();
            for (String col : inputCols) {
                if (!col.equals(labelCol) && !col.equals(getIndexCol())) {
                    candidates.add(col);
                }
            }
            return candidates.toArray(new String[0]);
        }

        for (String col : featureCols) {
            if (col.equals(labelCol)) {
                throw new AmbiguousLabelException(labelCol);
            }
            if (!inputCols.contains(col)) {
                throw new InvalidInputException(
                        String.format(
                                "Feature column '%s' does not exist. Input columns: %s.",
                                col, inputCols));
            }
        }
        return Arrays.stream(featureCols)
                .filter(col -> !col.equals(getIndexCol()))
                .toArray(String[]::new);
    }

    @Override
    public void save(String path) throws IOException {
        ReadWriteUtils.saveMetadata(this, path);
    }

    public static InfoGainSelector load(StreamTableEnvironment tEnv, String path)
            throws IOException {
        return ReadWriteUtils.loadStageParam(path);
    }

    @Override
    public Map<Param<?>, Object> getParamMap() {
        return paramMap;
    }

    /** Builds a {@link CategoricalTable} from all rows and emits the ranked features. */
    private static class RankFeaturesFunction implements MapPartitionFunction<Row, Row> {
        private final String[] featureCols;
        private final int[] featureIndices;
        private final String labelCol;
        private final int labelIndex;

        private RankFeaturesFunction(
                String[] featureCols, int[] featureIndices, String labelCol, int labelIndex) {
            this.featureCols = featureCols;
            this.featureIndices = featureIndices;
            this.labelCol = labelCol;
            this.labelIndex = labelIndex;
        }

        @Override
        public void mapPartition(Iterable<Row> rows, Collector<Row> out) {
            List<List<String>> featureValues = new ArrayList<>(featureCols.length);
            for (int i = 0; i < featureCols.length; i++) {
                featureValues.add(new ArrayList<>());
            }
            List<String> labelValues = new ArrayList<>();

            for (Row row : rows) {
                for (int i = 0; i < featureCols.length; i++) {
                    featureValues.get(i).add(getCategory(row, featureIndices[i], featureCols[i]));
                }
                labelValues.add(getCategory(row, labelIndex, labelCol));
            }

            CategoricalTable.Builder builder = CategoricalTable.builder();
            for (int i = 0; i < featureCols.length; i++) {
                builder.column(featureCols[i], featureValues.get(i));
            }
            List<FeatureScore> scores =
                    InfoGainFeatureSelector.rankFeatures(
                            builder.build(), new LabelColumn(labelCol, labelValues));

            LOG.info(
                    "Ranked {} features over {} rows, best feature is '{}'.",
                    scores.size(),
                    labelValues.size(),
                    scores.get(0).getFeature());
            for (FeatureScore score : scores) {
                out.collect(
                        Row.of(
                                score.getFeature(),
                                score.getEntropy(),
                                score.getInfoGain(),
                                score.getRank()));
            }
        }

        private static String getCategory(Row row, int index, String col) {
            Object value = row.getField(index);
            if (value == null) {
                throw new InvalidInputException(
                        String.format("Column '%s' contains a null value: %s.", col, row));
            }
            return String.valueOf(value);
        }
    }
}
