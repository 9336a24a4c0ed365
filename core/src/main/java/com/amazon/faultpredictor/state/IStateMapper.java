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

/**
 * A mapper between a model and a plain state object that can be serialized by
 * any of the supported codecs.
 *
 * @param <Model> the model class
 * @param <State> the state class
 */
public interface IStateMapper<Model, State> {

    /**
     * @param state a state object
     * @param seed  a seed for any randomness needed while rebuilding the model
     * @return the model described by the state
     */
    Model toModel(State state, long seed);

    default Model toModel(State state) {
        return toModel(state, 0L);
    }

    State toState(Model model);
}
