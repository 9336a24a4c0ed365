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

package com.amazon.faultpredictor.fusion;

import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.Locale;
import java.util.Optional;

import com.amazon.faultpredictor.config.RiskTier;

/**
 * Writes the sentence an operator reads next to a probability.
 */
public class InterpretationSynthesizer {

    public static final String UNKNOWN_FEATURE = "unknown";

    private static final String TEMPLATE = "Fault probability within %d minutes is %.1f%%, a %s risk level. "
            + "The main contributing variable is %s. %s";

    public String interpret(double probability, int horizon, Optional<String> topFeature) {
        checkNotNull(topFeature, "topFeature must not be null");
        RiskTier tier = RiskTier.of(probability);
        return String.format(Locale.ROOT, TEMPLATE, horizon, probability * 100, tier.getLabel(),
                topFeature.orElse(UNKNOWN_FEATURE), tier.getRecommendation());
    }
}
