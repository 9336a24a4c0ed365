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

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import com.amazon.faultpredictor.reconstruction.ReconstructionModel;
import com.amazon.faultpredictor.state.IStateMapper;
import com.amazon.faultpredictor.state.Version;

public class ReconstructionModelMapper implements IStateMapper<ReconstructionModel, ReconstructionModelState> {

    @Override
    public ReconstructionModel toModel(ReconstructionModelState state, long seed) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        int dimensions = state.getDimensions();
        int hiddenSize = state.getHiddenSize();
        return new ReconstructionModel(unflatten(state.getEncoderWeights(), hiddenSize, dimensions),
                state.getEncoderBias(), unflatten(state.getDecoderWeights(), dimensions, hiddenSize),
                state.getDecoderBias(), state.isTrained(), state.getRandomSeed());
    }

    @Override
    public ReconstructionModelState toState(ReconstructionModel model) {
        ReconstructionModelState state = new ReconstructionModelState();
        state.setDimensions(model.getDimensions());
        state.setHiddenSize(model.getHiddenSize());
        state.setEncoderWeights(flatten(model.getEncoderWeights()));
        state.setEncoderBias(model.getEncoderBias());
        state.setDecoderWeights(flatten(model.getDecoderWeights()));
        state.setDecoderBias(model.getDecoderBias());
        state.setTrained(model.isTrained());
        state.setRandomSeed(model.getRandomSeed());
        return state;
    }

    static double[] flatten(double[][] matrix) {
        int columns = matrix[0].length;
        double[] result = new double[matrix.length * columns];
        for (int i = 0; i < matrix.length; i++) {
            System.arraycopy(matrix[i], 0, result, i * columns, columns);
        }
        return result;
    }

    static double[][] unflatten(double[] values, int rows, int columns) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == rows * columns, "incorrect length");
        double[][] result = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(values, i * columns, result[i], 0, columns);
        }
        return result;
    }
}
