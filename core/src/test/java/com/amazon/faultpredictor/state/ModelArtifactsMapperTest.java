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

package com.amazon.faultpredictor.state;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.amazon.faultpredictor.FaultPredictorTrainer;
import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ModelArtifactsMapperTest {

    private static final FeatureSchema SCHEMA = FeatureSchema.ofWidth(5);

    private static List<SensorWindow> windows;
    private static ModelArtifacts artifacts;

    @BeforeAll
    public static void setUpArtifacts() {
        double[][] series = new SensorWindowTestData().generateSeries(100, 5, 31L);
        windows = SlidingWindows.createSequences(SCHEMA, series, 20);
        artifacts = FaultPredictorTrainer.builder().schema(SCHEMA).windowLength(20).hiddenSize(3).numberOfEpochs(2)
                .numberOfTrees(10).randomSeed(4L).build().train(windows);
    }

    private static void assertSamePredictions(ModelArtifacts expected, ModelArtifacts actual) {
        IntegratedPredictor one = IntegratedPredictor.builder().schema(SCHEMA).artifacts(expected)
                .minimumWindowLength(20).build();
        IntegratedPredictor two = IntegratedPredictor.builder().schema(SCHEMA).artifacts(actual)
                .minimumWindowLength(20).build();
        for (int i = 0; i < windows.size(); i += 10) {
            DetectionResult first = one.predict(windows.get(i));
            DetectionResult second = two.predict(windows.get(i));
            assertEquals(first.getProbability(), second.getProbability());
            assertEquals(first.getPredictedValue(), second.getPredictedValue());
            assertEquals(first.isAnomaly(), second.isAnomaly());
            assertEquals(first.getFeatureImportance(), second.getFeatureImportance());
            assertEquals(first.getInterpretation(), second.getInterpretation());
        }
    }

    @Test
    public void testRoundTrip() {
        ModelArtifactsMapper mapper = new ModelArtifactsMapper();
        ModelArtifactsState state = mapper.toState(artifacts);
        assertEquals("generic-5", state.getSchemaVersion());
        assertSamePredictions(artifacts, mapper.toModel(state));
    }

    @Test
    public void testRoundTripThroughJackson() throws Exception {
        ModelArtifactsMapper mapper = new ModelArtifactsMapper();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(artifacts));
        ModelArtifactsState state = jsonMapper.readValue(json, ModelArtifactsState.class);
        assertEquals(mapper.toState(artifacts), state);
        assertSamePredictions(artifacts, mapper.toModel(state));
    }
}
