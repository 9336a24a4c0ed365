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

import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.reconstruction.ReconstructionModel;
import com.amazon.faultpredictor.state.ModelArtifactsMapper;
import com.amazon.faultpredictor.state.ModelArtifactsState;
import com.amazon.faultpredictor.state.isolation.IsolationForestMapper;
import com.amazon.faultpredictor.state.isolation.IsolationForestState;
import com.amazon.faultpredictor.state.reconstruction.ReconstructionModelMapper;
import com.amazon.faultpredictor.state.reconstruction.ReconstructionModelState;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Binary serialization of model artifacts with the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> runtime
 * schema of each state class.
 */
public class ProtostuffArtifactCodec {

    private static final int BUFFER_SIZE = 512;

    private final Schema<ReconstructionModelState> reconstructionSchema = RuntimeSchema
            .getSchema(ReconstructionModelState.class);
    private final Schema<IsolationForestState> isolationSchema = RuntimeSchema.getSchema(IsolationForestState.class);
    private final Schema<ModelArtifactsState> artifactsSchema = RuntimeSchema.getSchema(ModelArtifactsState.class);

    private final ReconstructionModelMapper reconstructionMapper = new ReconstructionModelMapper();
    private final IsolationForestMapper isolationMapper = new IsolationForestMapper();
    private final ModelArtifactsMapper artifactsMapper = new ModelArtifactsMapper();

    public byte[] toBytes(ReconstructionModel model) {
        return write(reconstructionMapper.toState(model), reconstructionSchema);
    }

    public byte[] toBytes(IsolationForest forest) {
        return write(isolationMapper.toState(forest), isolationSchema);
    }

    public byte[] toBytes(ModelArtifacts artifacts) {
        return write(artifactsMapper.toState(artifacts), artifactsSchema);
    }

    public ReconstructionModel reconstructionModelFromBytes(byte[] bytes) {
        return reconstructionMapper.toModel(read(bytes, reconstructionSchema));
    }

    public IsolationForest isolationForestFromBytes(byte[] bytes) {
        return isolationMapper.toModel(read(bytes, isolationSchema));
    }

    public ModelArtifacts artifactsFromBytes(byte[] bytes) {
        return artifactsMapper.toModel(read(bytes, artifactsSchema));
    }

    private static <S> byte[] write(S state, Schema<S> schema) {
        LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
        try {
            return ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }
    }

    private static <S> S read(byte[] bytes, Schema<S> schema) {
        S state = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        return state;
    }
}
