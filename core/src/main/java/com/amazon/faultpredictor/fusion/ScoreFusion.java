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

/**
 * Combines the scores of the two detectors into a single fault probability.
 * Implementations must return a value in [0,1] for any inputs, clamping the
 * detector scores first.
 */
@FunctionalInterface
public interface ScoreFusion {

    /**
     * @param reconstructionScore score of the reconstruction detector
     * @param isolationScore      score of the isolation ensemble
     * @return a probability in [0,1]
     */
    double fuse(double reconstructionScore, double isolationScore);
}
