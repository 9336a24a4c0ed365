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

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Benchmark)
public class IntegratedPredictorBenchmark {

    public static final int NUM_TRAIN_SAMPLES = 1000;
    public static final int NUM_TEST_WINDOWS = 50;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "52" })
        int dimensions;

        @Param({ "60" })
        int windowLength;

        @Param({ "100" })
        int numberOfTrees;

        FeatureSchema schema;
        double[][] trainingData;
        List<SensorWindow> testWindows;
        IntegratedPredictor predictor;

        @Setup(Level.Trial)
        public void setUpPredictor() {
            schema = dimensions == FeatureSchema.tennesseeEastman().getWidth() ? FeatureSchema.tennesseeEastman()
                    : FeatureSchema.ofWidth(dimensions);
            SensorWindowTestData gen = new SensorWindowTestData();
            trainingData = gen.generateSeries(NUM_TRAIN_SAMPLES, dimensions, 0L);
            double[][] testData = SensorWindowTestData.injectFault(
                    gen.generateSeries(NUM_TEST_WINDOWS + windowLength - 1, dimensions, 1L), NUM_TEST_WINDOWS / 2,
                    new int[] { 0, dimensions - 1 }, 2.0);
            testWindows = SlidingWindows.createSequences(schema, testData, windowLength);

            ModelArtifacts artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                    .numberOfEpochs(2).numberOfTrees(numberOfTrees).randomSeed(42L).build().train(trainingData);
            predictor = IntegratedPredictor.builder().schema(schema).artifacts(artifacts)
                    .minimumWindowLength(windowLength).build();
        }

        @TearDown(Level.Trial)
        public void closePredictor() {
            predictor.close();
        }
    }

    @Benchmark
    @OperationsPerInvocation(NUM_TEST_WINDOWS)
    public DetectionResult predict(BenchmarkState state, Blackhole blackhole) {
        DetectionResult result = null;
        for (SensorWindow window : state.testWindows) {
            result = state.predictor.predict(window);
            blackhole.consume(result.getProbability());
        }
        return result;
    }

    @Benchmark
    public ModelArtifacts train(BenchmarkState state) {
        return FaultPredictorTrainer.builder().schema(state.schema).windowLength(state.windowLength)
                .numberOfEpochs(1).numberOfTrees(state.numberOfTrees).randomSeed(7L).build()
                .train(state.trainingData);
    }
}
