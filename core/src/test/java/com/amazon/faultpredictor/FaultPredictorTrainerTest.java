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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

public class FaultPredictorTrainerTest {

    private static final FeatureSchema SCHEMA = FeatureSchema.ofWidth(4);

    private static double[][] series;

    @BeforeAll
    public static void setUpSeries() {
        series = new SensorWindowTestData().generateSeries(90, 4, 13L);
    }

    private static FaultPredictorTrainer.Builder<?> builder() {
        return FaultPredictorTrainer.builder().schema(SCHEMA).windowLength(30).hiddenSize(2).numberOfEpochs(2)
                .numberOfTrees(10);
    }

    @Test
    public void testTrainOnSeries() {
        ModelArtifacts artifacts = builder().randomSeed(1L).build().train(series);
        assertTrue(artifacts.isTrained());
        assertEquals(4, artifacts.getDimensions());
        assertEquals("generic-4", artifacts.getSchemaVersion());
        assertEquals(2, artifacts.getReconstructionModel().getHiddenSize());
        assertEquals(10, artifacts.getIsolationForest().getNumberOfTrees());
        // one isolation training vector per window, 90 - 30 + 1 of them
        assertEquals(61, artifacts.getIsolationForest().getSampleSize());
    }

    @Test
    public void testTrainingIsReproducible() {
        ModelArtifacts one = builder().randomSeed(8L).build().train(series);
        ModelArtifacts two = builder().randomSeed(8L).build().train(series);
        assertArrayEquals(one.getReconstructionModel().getDecoderBias(),
                two.getReconstructionModel().getDecoderBias());
        assertEquals(one.getIsolationForest().getOffset(), two.getIsolationForest().getOffset());
        assertEquals(one.getIsolationForest().getRandomSeed(), two.getIsolationForest().getRandomSeed());
    }

    @Test
    public void testCancellationStopsTraining() {
        List<SensorWindow> windows = SlidingWindows.createSequences(SCHEMA, series, 30);
        AtomicInteger polls = new AtomicInteger();
        FaultPredictorTrainer trainer = builder().randomSeed(1L).build();
        assertThrows(CancellationException.class, () -> trainer.train(windows, () -> polls.incrementAndGet() > 1));
        assertEquals(2, polls.get());
    }

    @Test
    public void testInvalidInput() {
        FaultPredictorTrainer trainer = builder().randomSeed(1L).build();
        assertThrows(IllegalArgumentException.class, () -> trainer.train(new double[20][4]));
        List<SensorWindow> windows = SlidingWindows.createSequences(FeatureSchema.ofWidth(4), series, 20);
        // windows shorter than the configured length fail validation
        assertThrows(IllegalArgumentException.class, () -> trainer.train(windows));
    }
}
