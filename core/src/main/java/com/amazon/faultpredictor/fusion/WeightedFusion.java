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

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.clamp;

import lombok.Getter;

/**
 * A convex combination of the two clamped detector scores, for deployments
 * where one detector has been calibrated as more reliable than the other.
 */
@Getter
public class WeightedFusion implements ScoreFusion {

    /**
     * weight of the reconstruction score; the isolation score gets the rest
     */
    private final double reconstructionWeight;

    public WeightedFusion(double reconstructionWeight) {
        checkArgument(reconstructionWeight >= 0 && reconstructionWeight <= 1, "weight must be in [0,1]");
        this.reconstructionWeight = reconstructionWeight;
    }

    @Override
    public double fuse(double reconstructionScore, double isolationScore) {
        return reconstructionWeight * clamp(reconstructionScore, 0, 1)
                + (1 - reconstructionWeight) * clamp(isolationScore, 0, 1);
    }
}
