/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.faultpredictor;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.serialize.ModelArtifactSerDe;
import com.amazon.faultpredictor.serialize.ProtostuffArtifactCodec;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Benchmark)
public class SerDeBenchmark {

    public static final int NUM_TRAIN_SAMPLES = 1000;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "52" })
        int dimensions;

        @Param({ "100" })
        int numberOfTrees;

        ModelArtifacts artifacts;
        String json;
        byte[] bytes;

        @Setup(Level.Trial)
        public void setUpArtifacts() {
            FeatureSchema schema = FeatureSchema.ofWidth(dimensions);
            double[][] trainingData = new SensorWindowTestData().generateSeries(NUM_TRAIN_SAMPLES, dimensions, 0L);
            artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(60).numberOfEpochs(1)
                    .numberOfTrees(numberOfTrees).randomSeed(42L).build().train(trainingData);
            json = new ModelArtifactSerDe().toJson(artifacts);
            bytes = new ProtostuffArtifactCodec().toBytes(artifacts);
        }
    }

    @Benchmark
    public String toJson(BenchmarkState state) {
        return new ModelArtifactSerDe().toJson(state.artifacts);
    }

    @Benchmark
    public ModelArtifacts fromJson(BenchmarkState state) {
        return new ModelArtifactSerDe().artifactsFromJson(state.json);
    }

    @Benchmark
    public byte[] toBytes(BenchmarkState state) {
        return new ProtostuffArtifactCodec().toBytes(state.artifacts);
    }

    @Benchmark
    public ModelArtifacts fromBytes(BenchmarkState state) {
        return new ProtostuffArtifactCodec().artifactsFromBytes(state.bytes);
    }
}
