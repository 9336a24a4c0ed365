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

package com.amazon.faultpredictor.serialize;

import lombok.Getter;

import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.reconstruction.ReconstructionModel;
import com.amazon.faultpredictor.state.ModelArtifactsMapper;
import com.amazon.faultpredictor.state.ModelArtifactsState;
import com.amazon.faultpredictor.state.isolation.IsolationForestMapper;
import com.amazon.faultpredictor.state.isolation.IsolationForestState;
import com.amazon.faultpredictor.state.reconstruction.ReconstructionModelMapper;
import com.amazon.faultpredictor.state.reconstruction.ReconstructionModelState;
import com.google.gson.Gson;

/**
 * JSON serialization of model artifacts. Each artifact is converted into its
 * state object by the corresponding mapper and the state object is written
 * with <a href="https://github.com/google/gson">Gson</a>. The Gson instance is
 * exposed so callers can customize the output, e.g. by enabling pretty
 * printing.
 */
@Getter
public class ModelArtifactSerDe {

    private final ReconstructionModelMapper reconstructionMapper;
    private final IsolationForestMapper isolationMapper;
    private final ModelArtifactsMapper artifactsMapper;
    private final Gson gson;

    public ModelArtifactSerDe() {
        this(new Gson());
    }

    /**
     * @param gson the Gson instance used to write and read state objects
     */
    public ModelArtifactSerDe(Gson gson) {
        this.reconstructionMapper = new ReconstructionModelMapper();
        this.isolationMapper = new IsolationForestMapper();
        this.artifactsMapper = new ModelArtifactsMapper();
        this.gson = gson;
    }

    public String toJson(ReconstructionModel model) {
        return gson.toJson(reconstructionMapper.toState(model));
    }

    public String toJson(IsolationForest forest) {
        return gson.toJson(isolationMapper.toState(forest));
    }

    public String toJson(ModelArtifacts artifacts) {
        return gson.toJson(artifactsMapper.toState(artifacts));
    }

    public ReconstructionModel reconstructionModelFromJson(String json) {
        return reconstructionMapper.toModel(gson.fromJson(json, ReconstructionModelState.class));
    }

    public IsolationForest isolationForestFromJson(String json) {
        return isolationMapper.toModel(gson.fromJson(json, IsolationForestState.class));
    }

    public ModelArtifacts artifactsFromJson(String json) {
        return artifactsMapper.toModel(gson.fromJson(json, ModelArtifactsState.class));
    }
}
