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

import java.util.Arrays;

import com.amazon.faultpredictor.FaultPredictorTrainer;
import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.examples.Example;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.preprocessor.SlidingWindowBuffer;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

/**
 * Trains on normal operation of the 52 Tennessee Eastman channels, then
 * streams a series in which two channels drift away from their levels and
 * prints how the probability, the risk tier and the explanation evolve.
 */
public class FaultDetectionExample implements Example {

    public static void main(String[] args) throws Exception {
        new FaultDetectionExample().run();
    }

    @Override
    public String command() {
        return "fault_detection";
    }

    @Override
    public String description() {
        return "stream a drifting process through an integrated predictor";
    }

    @Override
    public void run() throws Exception {
        FeatureSchema schema = FeatureSchema.tennesseeEastman();
        int dimensions = schema.getWidth();
        int windowLength = 60;

        SensorWindowTestData testData = new SensorWindowTestData(0.05, 1.0, 100.0);
        double[][] normal = testData.generateSeries(1000, dimensions, 7L);
        ModelArtifacts artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                .numberOfEpochs(2).randomSeed(17L).build().train(normal);

        int faultStart = 150;
        int[] faultyChannels = new int[] { schema.indexOf("XMEAS_9"), schema.indexOf("XMV_10") };
        double[][] stream = SensorWindowTestData.injectFault(testData.generateSeries(300, dimensions, 8L), faultStart,
                faultyChannels, 3.0);

        try (IntegratedPredictor predictor = IntegratedPredictor.builder().schema(schema).artifacts(artifacts)
                .build()) {
            SlidingWindowBuffer buffer = new SlidingWindowBuffer(schema, windowLength);
            for (int i = 0; i < stream.length; i++) {
                buffer.addPoint(stream[i], i);
                if (buffer.isFull() && i % 20 == 0) {
                    DetectionResult result = predictor.predict(buffer.getWindow());
                    System.out.printf("row %3d%s probability %.3f [%.3f, %.3f] %-6s anomaly %-5b top %s%n", i,
                            i >= faultStart ? "*" : " ", result.getProbability(), result.getConfidenceLower(),
                            result.getConfidenceUpper(), result.getRiskTier().getLabel(), result.isAnomaly(),
                            Arrays.toString(result.getTopFeatures().toArray()));
                }
            }

            DetectionResult last = predictor.predict(buffer.getWindow());
            System.out.println();
            System.out.println(last.getInterpretation());
        }
    }
}
