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

import static com.amazon.faultpredictor.CommonUtils.clamp;

/**
 * The arithmetic mean of the two clamped detector scores.
 */
public class EqualWeightFusion implements ScoreFusion {

    @Override
    public double fuse(double reconstructionScore, double isolationScore) {
        return (clamp(reconstructionScore, 0, 1) + clamp(isolationScore, 0, 1)) / 2;
    }
}
