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

package com.amazon.faultpredictor;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.Random;

import lombok.Getter;
import lombok.ToString;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.reconstruction.ReconstructionModel;

/**
 * The learned parameters served by an {@link IntegratedPredictor}: one
 * reconstruction model and one isolation forest over the same features. A
 * bundle is immutable and is replaced as a whole.
 */
@Getter
@ToString(of = { "schemaVersion", "dimensions" })
public class ModelArtifacts {

    /**
     * version of the feature schema the artifacts were trained on
     */
    private final String schemaVersion;

    private final int dimensions;

    private final ReconstructionModel reconstructionModel;

    private final IsolationForest isolationForest;

    public ModelArtifacts(String schemaVersion, ReconstructionModel reconstructionModel,
            IsolationForest isolationForest) {
        this.schemaVersion = checkNotNull(schemaVersion, "schema version must not be null");
        this.reconstructionModel = checkNotNull(reconstructionModel, "reconstruction model must not be null");
        this.isolationForest = checkNotNull(isolationForest, "isolation forest must not be null");
        checkArgument(reconstructionModel.getDimensions() == isolationForest.getDimensions(),
                "both artifacts must be built over the same features");
        this.dimensions = reconstructionModel.getDimensions();
    }

    /**
     * Random parameters for every detector. Predictions made with these
     * artifacts are well formed but carry no information.
     *
     * @param schema the features
     * @param seed   seed of the random parameters
     * @return untrained artifacts
     */
    public static ModelArtifacts untrained(FeatureSchema schema, long seed) {
        checkNotNull(schema, "schema must not be null");
        Random random = new Random(seed);
        ReconstructionModel model = ReconstructionModel.untrained(schema.getWidth(),
                ReconstructionModel.DEFAULT_HIDDEN_SIZE, random.nextLong());
        IsolationForest forest = IsolationForest.builder().dimensions(schema.getWidth()).randomSeed(random.nextLong())
                .build();
        return new ModelArtifacts(schema.getVersion(), model, forest);
    }

    public boolean isTrained() {
        return reconstructionModel.isTrained() && isolationForest.isTrained();
    }
}
