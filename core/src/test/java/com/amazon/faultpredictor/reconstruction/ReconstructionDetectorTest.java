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

package com.amazon.faultpredictor.reconstruction;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.faultpredictor.returntypes.DetectorVerdict;
import com.amazon.faultpredictor.returntypes.Forecast;

public class ReconstructionDetectorTest {

    private ReconstructionDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new ReconstructionDetector(ReconstructionModelTest.constantModel());
    }

    @Test
    public void testDetectAnomaly() {
        DetectorVerdict normal = detector.detectAnomaly(new double[][] { { 1, 2 }, { 1, 2 } });
        assertFalse(normal.isAnomaly());
        assertEquals(0, normal.getScore());

        DetectorVerdict anomaly = detector.detectAnomaly(new double[][] { { 0, 0 }, { 1, 2 } });
        assertTrue(anomaly.isAnomaly());
        assertEquals(1.25, anomaly.getScore(), 1e-12);

        assertFalse(detector.detectAnomaly(new double[][] { { 0, 0 }, { 1, 2 } }, 2.0).isAnomaly());
    }

    @Test
    public void testThresholdIsStrict() {
        // reconstruction error 0.005
        double[][] window = { { 1.1, 2 }, { 1.1, 2 } };
        double error = detector.detectAnomaly(window).getScore();
        assertFalse(detector.detectAnomaly(window, error).isAnomaly());
        assertTrue(detector.detectAnomaly(window, error / 2).isAnomaly());
    }

    @Test
    public void testPredict() {
        Forecast forecast = detector.predict(new double[][] { { 1, 2 }, { 1, 2.2 } }, 45);
        assertArrayEquals(new double[] { 1, 2 }, forecast.getValues());
        assertEquals(1.5, forecast.getMeanValue(), 1e-12);
        assertEquals(0.99, forecast.getConfidence(), 1e-9);
        assertEquals(45, forecast.getHorizon());
        assertEquals(ReconstructionDetector.DEFAULT_HORIZON, detector.predict(new double[][] { { 1, 2 } }).getHorizon());
    }

    @Test
    public void testConfidenceIsClamped() {
        Forecast forecast = detector.predict(new double[][] { { -5, -5 } });
        assertEquals(0, forecast.getConfidence());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.01, 0.3, 0.99, 1.0, 4.0 })
    public void testConfidenceIsNonIncreasing(double error) {
        double confidence = ReconstructionDetector.confidenceOf(error);
        assertTrue(confidence >= 0 && confidence <= 1);
        assertTrue(ReconstructionDetector.confidenceOf(error + 0.1) <= confidence);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> detector.predict(new double[][] { { 1, 2 } }, 0));
        assertThrows(IllegalArgumentException.class, () -> detector.predict(new double[0][]));
        assertThrows(NullPointerException.class, () -> new ReconstructionDetector(null));
    }
}
