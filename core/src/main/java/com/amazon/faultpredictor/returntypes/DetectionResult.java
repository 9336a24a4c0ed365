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

package com.amazon.faultpredictor.returntypes;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import com.amazon.faultpredictor.config.RiskTier;
import com.amazon.faultpredictor.config.Severity;

/**
 * The answer to one prediction request. A result is created per call and the
 * predictor keeps no reference to it.
 */
@Getter
@Builder
@ToString
public class DetectionResult {

    /**
     * fused fault probability in [0,1]
     */
    private final double probability;

    /**
     * mean of the forecast timestep, in normalized units
     */
    private final double predictedValue;

    private final double forecastConfidence;

    private final double confidenceLower;

    private final double confidenceUpper;

    /**
     * the heaviest features, renormalized to sum to 1, heaviest first
     */
    private final Map<String, Double> featureImportance;

    /**
     * names of the top features, heaviest first
     */
    private final List<String> topFeatures;

    private final String interpretation;

    private final RiskTier riskTier;

    private final Severity severity;

    private final boolean anomaly;

    /**
     * forecast horizon in minutes
     */
    private final int horizon;

    private final double reconstructionScore;

    private final double isolationScore;
}
