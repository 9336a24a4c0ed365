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

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;
import static com.amazon.faultpredictor.CommonUtils.clamp;

import lombok.Getter;

import com.amazon.faultpredictor.returntypes.DetectorVerdict;
import com.amazon.faultpredictor.returntypes.Forecast;

/**
 * Flags windows that the reconstruction model cannot reproduce and reads a
 * short horizon forecast off the reconstruction of the last timestep.
 */
public class ReconstructionDetector {

    /**
     * Default reconstruction error above which a window is anomalous.
     */
    public static final double DEFAULT_THRESHOLD = 0.05;

    /**
     * Default forecast horizon, in minutes.
     */
    public static final int DEFAULT_HORIZON = 30;

    @Getter
    private final ReconstructionModel model;

    public ReconstructionDetector(ReconstructionModel model) {
        this.model = checkNotNull(model, "model must not be null");
    }

    /**
     * @param window  normalized timesteps
     * @param horizon forecast horizon in minutes; carried with the forecast
     * @return the last decoded timestep and clamp(1 - error, 0, 1)
     */
    public Forecast predict(double[][] window, int horizon) {
        checkArgument(window.length > 0, "empty window");
        checkArgument(horizon > 0, "horizon must be positive");
        double[][] output = model.reconstruct(window);
        double error = meanSquaredError(window, output);
        return new Forecast(output[output.length - 1], confidenceOf(error), horizon);
    }

    public Forecast predict(double[][] window) {
        return predict(window, DEFAULT_HORIZON);
    }

    /**
     * @param window    normalized timesteps
     * @param threshold error above which the window is anomalous
     * @return the verdict, scored by the reconstruction error
     */
    public DetectorVerdict detectAnomaly(double[][] window, double threshold) {
        double score = model.reconstructionError(window);
        return new DetectorVerdict(score > threshold, score);
    }

    public DetectorVerdict detectAnomaly(double[][] window) {
        return detectAnomaly(window, DEFAULT_THRESHOLD);
    }

    /**
     * maps a reconstruction error to a confidence; non increasing in the error
     *
     * @param error a non negative reconstruction error
     * @return a value in [0,1]
     */
    public static double confidenceOf(double error) {
        return clamp(1 - error, 0, 1);
    }

    static double meanSquaredError(double[][] window, double[][] output) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < window.length; i++) {
            for (int j = 0; j < window[i].length; j++) {
                double difference = output[i][j] - window[i][j];
                sum += difference * difference;
                ++count;
            }
        }
        return sum / count;
    }
}
