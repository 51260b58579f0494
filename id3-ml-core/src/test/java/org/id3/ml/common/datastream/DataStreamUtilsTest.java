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

import org.apache.flink.api.common.functions.MapPartitionFunction;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.ExecutionCheckpointingOptions;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.Collector;

import org.apache.commons.collections.IteratorUtils;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

/** Tests {@link DataStreamUtils}. */
public class DataStreamUtilsTest {
    private StreamExecutionEnvironment env;

    @Before
    public void before() {
        Configuration config = new Configuration();
        config.set(ExecutionCheckpointingOptions.ENABLE_CHECKPOINTS_AFTER_TASKS_FINISH, true);
        env = StreamExecutionEnvironment.getExecutionEnvironment(config);
        env.setParallelism(4);
        env.enableCheckpointing(100);
        env.setRestartStrategy(RestartStrategies.noRestart());
    }

    @Test
    public void testMapAll() throws Exception {
        DataStream<Long> input = env.fromSequence(1, 100);

        DataStream<Long> result =
                DataStreamUtils.mapAll(input, new SumAndCountFunction(), Types.LONG);

        List<Long> collected = IteratorUtils.toList(result.executeAndCollect());
        assertEquals(2, collected.size());
        assertEquals(Long.valueOf(5050), collected.get(0));
        assertEquals(Long.valueOf(100), collected.get(1));
        assertEquals(1, result.getParallelism());
    }

    @Test
    public void testMapAllOnEmptyInput() throws Exception {
        DataStream<Long> input = env.fromCollection(Collections.<Long>emptyList(), Types.LONG);

        DataStream<Long> result =
                DataStreamUtils.mapAll(input, new SumAndCountFunction(), Types.LONG);

        List<Long> collected = IteratorUtils.toList(result.executeAndCollect());
        assertEquals(2, collected.size());
        assertEquals(Long.valueOf(0), collected.get(1));
    }

    private static class SumAndCountFunction implements MapPartitionFunction<Long, Long> {
        @Override
        public void mapPartition(Iterable<Long> values, Collector<Long> out) {
            long sum = 0;
            long count = 0;
            for (Long value : values) {
                sum += value;
                count++;
            }
            out.collect(sum);
            out.collect(count);
        }
    }
}
