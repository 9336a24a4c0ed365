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

package com.amazon.faultpredictor.state.isolation;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.isolation.IsolationTree;
import com.amazon.faultpredictor.state.IStateMapper;
import com.amazon.faultpredictor.state.Version;

public class IsolationForestMapper implements IStateMapper<IsolationForest, IsolationForestState> {

    @Override
    public IsolationForest toModel(IsolationForestState state, long seed) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        List<IsolationTree> trees = new ArrayList<>();
        if (state.getTreeStates() != null) {
            for (IsolationTreeState treeState : state.getTreeStates()) {
                trees.add(treeMapper.toModel(treeState, seed));
            }
        }
        return new IsolationForest(state.getDimensions(), state.getNumberOfTrees(), state.getMaxSamples(),
                state.getContamination(), state.getRandomSeed(), state.getSampleSize(), state.getOffset(), trees);
    }

    @Override
    public IsolationForestState toState(IsolationForest model) {
        IsolationForestState state = new IsolationForestState();
        state.setDimensions(model.getDimensions());
        state.setNumberOfTrees(model.getNumberOfTrees());
        state.setMaxSamples(model.getMaxSamples());
        state.setContamination(model.getContamination());
        state.setRandomSeed(model.getRandomSeed());
        state.setSampleSize(model.getSampleSize());
        state.setOffset(model.getOffset());
        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        List<IsolationTreeState> treeStates = new ArrayList<>();
        for (IsolationTree tree : model.getTrees()) {
            treeStates.add(treeMapper.toState(tree));
        }
        state.setTreeStates(treeStates);
        return state;
    }
}
