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
import com.amazon.faultpredictor.serialize.ProtostuffArtifactCodec;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

/**
 * Serialize trained model artifacts to a byte array using
 * <a href="https://github.com/protostuff/protostuff">protostuff</a>.
 */
public class ProtostuffExample implements Example {

    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize trained model artifacts with protostuff";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 8;
        int windowLength = 30;
        FeatureSchema schema = FeatureSchema.ofWidth(dimensions);
        SensorWindowTestData testData = new SensorWindowTestData();
        ModelArtifacts artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                .hiddenSize(4).numberOfEpochs(3).numberOfTrees(50).randomSeed(12L).build()
                .train(testData.generateSeries(300, dimensions, 2L));

        ProtostuffArtifactCodec codec = new ProtostuffArtifactCodec();
        byte[] bytes = codec.toBytes(artifacts);

        System.out.printf("dimensions = %d, numberOfTrees = %d, hiddenSize = %d%n", dimensions,
                artifacts.getIsolationForest().getNumberOfTrees(), artifacts.getReconstructionModel().getHiddenSize());
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        ModelArtifacts restored = codec.artifactsFromBytes(bytes);

        int differences = 0;
        for (double[] point : testData.generateSeries(100, dimensions, 3L)) {
            if (artifacts.getIsolationForest().rawScore(point) != restored.getIsolationForest().rawScore(point)) {
                differences++;
            }
        }

        if (differences > 0) {
            throw new IllegalStateException("restored forest does not agree with original forest");
        }

        System.out.println("Looks good!");
    }
}
