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

import java.nio.file.Files;
import java.nio.file.Path;

import com.amazon.faultpredictor.FaultPredictorTrainer;
import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.examples.Example;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.serialize.ModelArtifactLoader;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

/**
 * Saves both detectors to files, one as JSON and one as protostuff bytes, and
 * serves a predictor from the loaded files. A missing file is replaced by an
 * untrained detector.
 */
public class ArtifactFileExample implements Example {

    public static void main(String[] args) throws Exception {
        new ArtifactFileExample().run();
    }

    @Override
    public String command() {
        return "artifact_files";
    }

    @Override
    public String description() {
        return "save model artifacts to files and serve a predictor from them";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 6;
        int windowLength = 40;
        FeatureSchema schema = FeatureSchema.ofWidth(dimensions);
        SensorWindowTestData testData = new SensorWindowTestData();
        double[][] series = testData.generateSeries(400, dimensions, 4L);

        ModelArtifacts artifacts = FaultPredictorTrainer.builder().schema(schema).windowLength(windowLength)
                .hiddenSize(4).numberOfEpochs(3).numberOfTrees(50).randomSeed(13L).build().train(series);

        Path directory = Files.createTempDirectory("faultpredictor");
        Path reconstructionPath = directory.resolve("reconstruction.json");
        Path isolationPath = directory.resolve("isolation.bin");

        ModelArtifactLoader loader = ModelArtifactLoader.builder().schema(schema).randomSeed(13L).build();
        loader.save(reconstructionPath, isolationPath, artifacts);
        System.out.printf("reconstruction model: %d bytes, isolation forest: %d bytes%n",
                Files.size(reconstructionPath), Files.size(isolationPath));

        ModelArtifacts loaded = loader.load(reconstructionPath, isolationPath);
        ModelArtifacts partial = loader.load(reconstructionPath, directory.resolve("missing.bin"));
        System.out.printf("loaded trained = %b, with a missing file trained = %b%n", loaded.isTrained(),
                partial.isTrained());

        double[][] faulty = SensorWindowTestData.injectFault(testData.generateSeries(windowLength, dimensions, 5L),
                windowLength - 10, new int[] { 2 }, 6.0);
        SensorWindow window = new SensorWindow(schema, faulty);
        try (IntegratedPredictor predictor = IntegratedPredictor.builder().schema(schema).artifacts(loaded)
                .minimumWindowLength(windowLength).build()) {
            DetectionResult result = predictor.predict(window);
            System.out.println(result.getInterpretation());
        }

        Files.delete(reconstructionPath);
        Files.delete(isolationPath);
        Files.delete(directory);
    }
}
