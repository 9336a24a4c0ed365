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

package com.amazon.faultpredictor.runner;

import java.util.List;

import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.inputtypes.SensorWindow;

/**
 * This interface is used by SimpleRunner to transform windows of input lines
 * into output values.
 */
public interface LineTransformer {

    /**
     * For the latest full window, return a list of string values that should be
     * written as output. The list of strings will be joined together using the
     * user-specified delimiter.
     *
     * @param window the most recent rows of the input stream
     * @return a list of string values that should be written as output.
     */
    List<String> getResultValues(SensorWindow window);

    /**
     * @return a list of string values that should be written to the output when
     *         processing a line before the first window is full.
     */
    List<String> getEmptyResultValue();

    /**
     * @return a list of column names to write to the output if headers are
     *         enabled.
     */
    List<String> getResultColumnNames();

    /**
     * @return the predictor which is being used internally to score windows.
     */
    IntegratedPredictor getPredictor();
}
