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

package com.amazon.faultpredictor.examples.serialization;

import com.amazon.faultpredictor.FaultPredictorTrainer;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.examples.Example;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.state.ModelArtifactsMapper;
import com.amazon.faultpredictor.state.ModelArtifactsState;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize trained model artifacts to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize trained model artifacts as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Train on synthetic normal operation

        int dimensions = 8;
        int windowLength = 30;
        FeatureSchema schema = FeatureSchema.ofWidth(dimensions);
        SensorWindowTestData testData = new SensorWindowTestData();
        double[][] series = testData.generateSeries(300, dimensions, 0L);

        ModelArtifacts artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                .hiddenSize(4).numberOfEpochs(3).numberOfTrees(50).randomSeed(11L).build().train(series);

        // Convert to JSON and print the number of bytes

        ModelArtifactsMapper mapper = new ModelArtifactsMapper();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(artifacts));

        System.out.printf("dimensions = %d, numberOfTrees = %d, hiddenSize = %d%n", dimensions,
                artifacts.getIsolationForest().getNumberOfTrees(), artifacts.getReconstructionModel().getHiddenSize());
        System.out.printf("JSON size = %d bytes%n", json.getBytes().length);

        // Restore from JSON and compare the scores of both bundles

        ModelArtifacts restored = mapper.toModel(jsonMapper.readValue(json, ModelArtifactsState.class));

        double[][] faulty = SensorWindowTestData.injectFault(testData.generateSeries(windowLength, dimensions, 1L),
                windowLength / 2, new int[] { 3 }, 4.0);
        double error = artifacts.getReconstructionModel().reconstructionError(faulty);
        double error2 = restored.getReconstructionModel().reconstructionError(faulty);
        double score = artifacts.getIsolationForest().rawScore(faulty[windowLength - 1]);
        double score2 = restored.getIsolationForest().rawScore(faulty[windowLength - 1]);

        if (error != error2 || score != score2) {
            throw new IllegalStateException("restored artifacts do not agree with the original artifacts");
        }

        System.out.println("Looks good!");
    }
}
