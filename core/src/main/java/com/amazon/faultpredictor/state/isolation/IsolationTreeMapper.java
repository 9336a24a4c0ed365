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

import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import com.amazon.faultpredictor.isolation.IsolationTree;
import com.amazon.faultpredictor.state.IStateMapper;

public class IsolationTreeMapper implements IStateMapper<IsolationTree, IsolationTreeState> {

    @Override
    public IsolationTree toModel(IsolationTreeState state, long seed) {
        checkNotNull(state, "state must not be null");
        return new IsolationTree(state.getCutDimension(), state.getCutValue(), state.getLeftIndex(),
                state.getRightIndex(), state.getLeafMass());
    }

    @Override
    public IsolationTreeState toState(IsolationTree model) {
        IsolationTreeState state = new IsolationTreeState();
        state.setCutDimension(model.getCutDimension());
        state.setCutValue(model.getCutValue());
        state.setLeftIndex(model.getLeftIndex());
        state.setRightIndex(model.getRightIndex());
        state.setLeafMass(model.getLeafMass());
        return state;
    }
}
