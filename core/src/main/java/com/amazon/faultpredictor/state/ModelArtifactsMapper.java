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

package com.amazon.faultpredictor.state;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.state.isolation.IsolationForestMapper;
import com.amazon.faultpredictor.state.reconstruction.ReconstructionModelMapper;

public class ModelArtifactsMapper implements IStateMapper<ModelArtifacts, ModelArtifactsState> {

    @Override
    public ModelArtifacts toModel(ModelArtifactsState state, long seed) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        return new ModelArtifacts(state.getSchemaVersion(),
                new ReconstructionModelMapper().toModel(state.getReconstructionModelState(), seed),
                new IsolationForestMapper().toModel(state.getIsolationForestState(), seed));
    }

    @Override
    public ModelArtifactsState toState(ModelArtifacts model) {
        ModelArtifactsState state = new ModelArtifactsState();
        state.setSchemaVersion(model.getSchemaVersion());
        state.setReconstructionModelState(new ReconstructionModelMapper().toState(model.getReconstructionModel()));
        state.setIsolationForestState(new IsolationForestMapper().toState(model.getIsolationForest()));
        return state;
    }
}
