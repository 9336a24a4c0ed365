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

package com.amazon.faultpredictor.config;

/**
 * Risk levels of a fused fault probability. The lower bounds are exclusive: a
 * probability of exactly 0.8 is MEDIUM and exactly 0.5 is LOW.
 */
public enum RiskTier {

    /**
     * probability above 0.8
     */
    HIGH("high", "Immediate inspection is required."),

    /**
     * probability above 0.5 and at most 0.8
     */
    MEDIUM("medium", "Strengthen monitoring."),

    /**
     * probability at most 0.5
     */
    LOW("low", "Normal operation can continue.");

    public static final double HIGH_THRESHOLD = 0.8;

    public static final double MEDIUM_THRESHOLD = 0.5;

    private final String label;

    private final String recommendation;

    RiskTier(String label, String recommendation) {
        this.label = label;
        this.recommendation = recommendation;
    }

    public static RiskTier of(double probability) {
        if (probability > HIGH_THRESHOLD) {
            return HIGH;
        } else if (probability > MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    public String getLabel() {
        return label;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
