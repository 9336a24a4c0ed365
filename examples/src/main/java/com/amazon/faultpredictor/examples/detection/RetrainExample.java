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

package com.amazon.faultpredictor.examples.detection;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.amazon.faultpredictor.FaultPredictorTrainer;
import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.examples.Example;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

/**
 * Serves predictions from several threads while a new bundle is trained and
 * swapped in. Predictions keep flowing during training and pick up the new
 * bundle once it is published.
 */
public class RetrainExample implements Example {

    public static void main(String[] args) throws Exception {
        new RetrainExample().run();
    }

    @Override
    public String command() {
        return "retrain";
    }

    @Override
    public String description() {
        return "retrain and swap model artifacts while serving predictions";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 10;
        int windowLength = 30;
        int numberOfThreads = 4;
        FeatureSchema schema = FeatureSchema.ofWidth(dimensions);
        SensorWindowTestData testData = new SensorWindowTestData();

        List<SensorWindow> windows = SlidingWindows.createSequences(schema,
                testData.generateSeries(500, dimensions, 9L), windowLength);
        FaultPredictorTrainer trainer = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                .hiddenSize(5).numberOfEpochs(3).numberOfTrees(50).randomSeed(19L).build();

        AtomicInteger predictions = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(numberOfThreads);
        try (IntegratedPredictor predictor = IntegratedPredictor.builder().schema(schema)
                .minimumWindowLength(windowLength).randomSeed(19L).build()) {
            System.out.printf("serving trained artifacts: %b%n", predictor.getArtifacts().isTrained());

            Future<?>[] workers = new Future<?>[numberOfThreads];
            for (int t = 0; t < numberOfThreads; t++) {
                int offset = t;
                workers[t] = executor.submit(() -> {
                    for (int i = offset; i < windows.size(); i += numberOfThreads) {
                        predictor.predict(windows.get(i));
                        predictions.incrementAndGet();
                    }
                });
            }

            ModelArtifacts trained = predictor.retrainAndSwap(trainer, windows);
            System.out.printf("swapped in artifacts for schema %s after %d predictions%n", trained.getSchemaVersion(),
                    predictions.get());

            for (Future<?> worker : workers) {
                worker.get();
            }
            System.out.printf("serving trained artifacts: %b, %d predictions in total%n",
                    predictor.getArtifacts().isTrained(), predictions.get());
        } finally {
            executor.shutdown();
            executor.awaitTermination(1, TimeUnit.MINUTES);
        }
    }
}
