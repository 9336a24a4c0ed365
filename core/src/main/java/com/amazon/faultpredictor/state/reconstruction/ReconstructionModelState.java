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

package com.amazon.faultpredictor.state.reconstruction;

import static com.amazon.faultpredictor.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * Weight matrices are stored flattened in row-major order.
 */
@Data
public class ReconstructionModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private int dimensions;
    private int hiddenSize;

    // hiddenSize x dimensions
    private double[] encoderWeights;
    private double[] encoderBias;

    // dimensions x hiddenSize
    private double[] decoderWeights;
    private double[] decoderBias;

    private boolean trained;
    private long randomSeed;
}
