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

package org.id3.ml.common.datastream;

import org.apache.flink.annotation.Internal;
import org.apache.flink.api.common.functions.MapPartitionFunction;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.runtime.state.StateInitializationContext;
import org.apache.flink.runtime.state.StateSnapshotContext;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.operators.AbstractUdfStreamOperator;
import org.apache.flink.streaming.api.operators.BoundedOneInput;
import org.apache.flink.streaming.api.operators.OneInputStreamOperator;
import org.apache.flink.streaming.api.operators.TimestampedCollector;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;

import java.util.ArrayList;
import java.util.List;

/** Provides utility functions for {@link DataStream}. */
@Internal
public class DataStreamUtils {
    /**
     * Applies a {@link MapPartitionFunction} once on all elements of a bounded data stream. The
     * elements of every input partition are gathered into a single operator instance, so the result
     * data stream has parallelism one.
     *
     * <p>Gathered elements are kept in operator state and survive a restore from a checkpoint.
     *
     * @param input The input data stream.
     * @param func The user defined mapPartition function.
     * @param outputType The type information of the output.
     * @param <IN> The class type of the input.
     * @param <OUT> The class type of output.
     * @return The result data stream.
     */
    public static <IN, OUT> DataStream<OUT> mapAll(
            DataStream<IN> input,
            MapPartitionFunction<IN, OUT> func,
            TypeInformation<OUT> outputType) {
        return input.transform("mapAll", outputType, new MapAllOperator<>(func))
                .setParallelism(1);
    }

    /**
     * A stream operator that buffers every element of the bounded input and applies a {@link
     * MapPartitionFunction} on all of them at the end of input.
     */
    private static class MapAllOperator<IN, OUT>
            extends AbstractUdfStreamOperator<OUT, MapPartitionFunction<IN, OUT>>
            implements OneInputStreamOperator<IN, OUT>, BoundedOneInput {

        private ListState<IN> elementsState;

        private List<IN> elements;

        MapAllOperator(MapPartitionFunction<IN, OUT> func) {
            super(func);
        }

        @Override
        public void initializeState(StateInitializationContext context) throws Exception {
            super.initializeState(context);

            ListStateDescriptor<IN> descriptor =
                    new ListStateDescriptor<>(
                            "elementsState",
                            getOperatorConfig()
                                    .getTypeSerializerIn(0, getClass().getClassLoader()));
            elementsState = context.getOperatorStateStore().getListState(descriptor);
            elements = new ArrayList<>();
            elementsState.get().forEach(elements::add);
        }

        @Override
        public void snapshotState(StateSnapshotContext context) throws Exception {
            super.snapshotState(context);
            elementsState.update(elements);
        }

        @Override
        public void processElement(StreamRecord<IN> streamRecord) {
            elements.add(streamRecord.getValue());
        }

        @Override
        public void endInput() throws Exception {
            userFunction.mapPartition(elements, new TimestampedCollector<>(output));
            elements.clear();
            elementsState.clear();
        }
    }
}
