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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.faultpredictor.config.PredictorState;
import com.amazon.faultpredictor.config.RiskTier;
import com.amazon.faultpredictor.config.Severity;
import com.amazon.faultpredictor.fusion.ScoreFusion;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.preprocessor.WindowValidationException;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

public class IntegratedPredictorTest {

    private static final FeatureSchema TEP = FeatureSchema.tennesseeEastman();

    private static final FeatureSchema SMALL = FeatureSchema.ofWidth(6);

    private static List<SensorWindow> smallWindows;

    private static ModelArtifacts smallArtifacts;

    @BeforeAll
    public static void setUpArtifacts() {
        double[][] series = new SensorWindowTestData().generateSeries(120, 6, 5L);
        smallWindows = SlidingWindows.createSequences(SMALL, series, 20);
        smallArtifacts = smallTrainer(17L).train(smallWindows);
    }

    static FaultPredictorTrainer smallTrainer(long seed) {
        return FaultPredictorTrainer.builder().schema(SMALL).windowLength(20).hiddenSize(3).numberOfEpochs(2)
                .numberOfTrees(20).randomSeed(seed).build();
    }

    private static SensorWindow tepWindow(long seed) {
        return new SensorWindow(TEP, new SensorWindowTestData().generateSeries(60, 52, seed));
    }

    private static IntegratedPredictor smallPredictor() {
        return IntegratedPredictor.builder().schema(SMALL).artifacts(smallArtifacts).minimumWindowLength(20).build();
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 2L, 3L, 4L })
    public void testResultIsWellFormed(long seed) {
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(seed).build();
        DetectionResult result = predictor.predict(tepWindow(seed));

        assertTrue(result.getProbability() >= 0 && result.getProbability() <= 1);
        assertTrue(0 <= result.getConfidenceLower() && result.getConfidenceLower() <= result.getProbability());
        assertTrue(result.getProbability() <= result.getConfidenceUpper() && result.getConfidenceUpper() <= 1);

        Map<String, Double> importance = result.getFeatureImportance();
        assertEquals(IntegratedPredictor.DEFAULT_TOP_K, importance.size());
        double sum = 0;
        double previous = Double.MAX_VALUE;
        for (double weight : importance.values()) {
            assertTrue(weight >= 0);
            assertThat(weight, lessThanOrEqualTo(previous));
            previous = weight;
            sum += weight;
        }
        assertEquals(1.0, sum, 1e-6);

        assertEquals(5, result.getTopFeatures().size());
        assertEquals(result.getTopFeatures().get(0), importance.keySet().iterator().next());
        assertThat(result.getInterpretation(), containsString(result.getTopFeatures().get(0)));
        assertThat(result.getInterpretation(), containsString("30 minutes"));
        assertEquals(RiskTier.of(result.getProbability()), result.getRiskTier());
        assertEquals(30, result.getHorizon());
    }

    @Test
    public void testUntrainedFallback() {
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(9L).build();
        assertFalse(predictor.getArtifacts().isTrained());
        DetectionResult result = predictor.predict(tepWindow(9L), 15);
        // an untrained forest scores every point at -0.5 and never flags
        assertEquals(1 / (1 + Math.exp(-0.5)), result.getIsolationScore(), 1e-12);
        assertEquals(15, result.getHorizon());
        assertThat(result.getInterpretation(), containsString("15 minutes"));
    }

    @Test
    public void testFusionDecidesTheTier() {
        ScoreFusion fusion = mock(ScoreFusion.class);
        when(fusion.fuse(anyDouble(), anyDouble())).thenReturn(0.9);
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(3L).fusion(fusion).build();

        DetectionResult result = predictor.predict(tepWindow(3L));
        verify(fusion, times(1)).fuse(anyDouble(), anyDouble());
        assertEquals(0.9, result.getProbability());
        assertEquals(RiskTier.HIGH, result.getRiskTier());
        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertThat(result.getInterpretation(), containsString("90.0%"));
        assertThat(result.getInterpretation(), containsString("Immediate inspection is required."));
    }

    @Test
    public void testFusionOutputIsClamped() {
        ScoreFusion fusion = mock(ScoreFusion.class);
        when(fusion.fuse(anyDouble(), anyDouble())).thenReturn(1.7);
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(3L).fusion(fusion).build();
        assertEquals(1.0, predictor.predict(tepWindow(3L)).getProbability());
    }

    @Test
    public void testAnomalyFlagIsEitherDetector() {
        IntegratedPredictor strict = IntegratedPredictor.builder().schema(SMALL).artifacts(smallArtifacts)
                .minimumWindowLength(20).reconstructionThreshold(0).build();
        assertTrue(strict.predict(smallWindows.get(0)).isAnomaly());

        // the last timestep leaves the training range in every channel
        double[][] spike = SensorWindowTestData.injectFault(smallWindows.get(50).getValues(), 19,
                new int[] { 0, 1, 2, 3, 4, 5 }, 1000.0);
        DetectionResult result = IntegratedPredictor.builder().schema(SMALL).artifacts(smallArtifacts)
                .minimumWindowLength(20).reconstructionThreshold(Double.MAX_VALUE).build()
                .predict(new SensorWindow(SMALL, spike));
        assertTrue(result.isAnomaly());
    }

    @Test
    public void testShiftedChannelLeadsTheExplanation() {
        double[][] shifted = SensorWindowTestData.injectFault(smallWindows.get(50).getValues(), 10, new int[] { 2 },
                50.0);
        DetectionResult result = smallPredictor().predict(new SensorWindow(SMALL, shifted));
        assertEquals("f2", result.getTopFeatures().get(0));
        assertThat(result.getInterpretation(), containsString("variable is f2."));
    }

    @Test
    public void testTopKIsConfigurable() {
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(4L).topK(3).build();
        Map<String, Double> importance = predictor.predict(tepWindow(4L)).getFeatureImportance();
        assertEquals(3, importance.size());
        assertEquals(1.0, importance.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-6);
    }

    @Test
    public void testInvalidWindows() {
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(5L).build();
        SensorWindow shortWindow = new SensorWindow(TEP, new SensorWindowTestData().generateSeries(59, 52, 5L));
        assertThrows(WindowValidationException.class, () -> predictor.predict(shortWindow));
        SensorWindow narrow = new SensorWindow(SMALL, new SensorWindowTestData().generateSeries(60, 6, 5L));
        assertThrows(WindowValidationException.class, () -> predictor.predict(narrow));
        assertThrows(IllegalArgumentException.class, () -> predictor.predict(tepWindow(5L), 0));
    }

    @Test
    public void testClose() {
        IntegratedPredictor predictor = IntegratedPredictor.builder().randomSeed(6L).build();
        assertEquals(PredictorState.LOADED, predictor.getState());
        predictor.close();
        assertEquals(PredictorState.NOT_LOADED, predictor.getState());
        assertFalse(predictor.isLoaded());
        assertThrows(IllegalStateException.class, () -> predictor.predict(tepWindow(6L)));
        predictor.close();
    }

    @Test
    public void testSwapArtifacts() {
        IntegratedPredictor predictor = smallPredictor();
        SensorWindow window = smallWindows.get(10);
        DetectionResult before = predictor.predict(window);

        ModelArtifacts untrained = ModelArtifacts.untrained(SMALL, 8L);
        ModelArtifacts previous = predictor.swapArtifacts(untrained);
        assertSame(smallArtifacts, previous);
        assertSame(untrained, predictor.getArtifacts());

        predictor.swapArtifacts(smallArtifacts);
        assertEquals(before.getProbability(), predictor.predict(window).getProbability());

        assertThrows(IllegalArgumentException.class, () -> predictor.swapArtifacts(ModelArtifacts.untrained(TEP, 1L)));
        assertSame(smallArtifacts, predictor.getArtifacts());
    }

    @Test
    public void testRetrainAndSwap() {
        IntegratedPredictor predictor = IntegratedPredictor.builder().schema(SMALL).randomSeed(2L)
                .minimumWindowLength(20).build();
        assertFalse(predictor.getArtifacts().isTrained());
        ModelArtifacts trained = predictor.retrainAndSwap(smallTrainer(17L), smallWindows);
        assertTrue(trained.isTrained());
        assertSame(trained, predictor.getArtifacts());
        assertNotSame(smallArtifacts, trained);
        SensorWindow window = smallWindows.get(3);
        assertEquals(smallPredictor().predict(window).getProbability(), predictor.predict(window).getProbability());
    }

    @Test
    public void testConcurrentPredictionsSeeACompleteBundle() throws InterruptedException {
        IntegratedPredictor predictor = smallPredictor();
        SensorWindow window = smallWindows.get(7);
        double trainedProbability = predictor.predict(window).getProbability();
        ModelArtifacts untrained = ModelArtifacts.untrained(SMALL, 8L);
        predictor.swapArtifacts(untrained);
        double untrainedProbability = predictor.predict(window).getProbability();
        predictor.swapArtifacts(smallArtifacts);

        List<Double> observed = Collections.synchronizedList(new ArrayList<>());
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 25; i++) {
                    observed.add(predictor.predict(window).getProbability());
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (int i = 0; i < 20; i++) {
            predictor.swapArtifacts((i % 2 == 0) ? untrained : smallArtifacts);
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertEquals(100, observed.size());
        for (double probability : observed) {
            assertTrue(probability == trainedProbability || probability == untrainedProbability);
        }
    }
}
