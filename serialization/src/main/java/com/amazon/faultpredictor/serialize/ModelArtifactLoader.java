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

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.reconstruction.ReconstructionModel;

/**
 * Reads and writes the artifacts of each detector from and to files. The
 * format follows the file extension: {@code .json} files hold Gson output,
 * anything else holds protostuff bytes.
 *
 * Loading never fails. A missing, unreadable or corrupt file, or an artifact
 * built over a different number of features, is logged as a warning and
 * replaced by an untrained artifact with the configured hyperparameters, so a
 * predictor can always be started.
 */
@Slf4j
@Getter
public class ModelArtifactLoader {

    public static final String JSON_EXTENSION = ".json";

    private final FeatureSchema schema;

    private final int hiddenSize;

    private final int numberOfTrees;

    private final int maxSamples;

    private final double contamination;

    private final long randomSeed;

    private final ModelArtifactSerDe serDe;

    private final ProtostuffArtifactCodec codec;

    public ModelArtifactLoader(Builder<?> builder) {
        checkNotNull(builder.schema, "schema must not be null");
        checkArgument(builder.hiddenSize > 0, "hidden size must be greater than 0");
        this.schema = builder.schema;
        this.hiddenSize = builder.hiddenSize;
        this.numberOfTrees = builder.numberOfTrees;
        this.maxSamples = builder.maxSamples;
        this.contamination = builder.contamination;
        this.randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
        this.serDe = new ModelArtifactSerDe();
        this.codec = new ProtostuffArtifactCodec();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @param reconstructionPath file of the reconstruction model, may be null
     * @param isolationPath      file of the isolation forest, may be null
     * @return artifacts combining whatever could be loaded with untrained
     *         fallbacks for the rest
     */
    public ModelArtifacts load(Path reconstructionPath, Path isolationPath) {
        return new ModelArtifacts(schema.getVersion(), loadReconstruction(reconstructionPath),
                loadIsolation(isolationPath));
    }

    public ReconstructionModel loadReconstruction(Path path) {
        Optional<ReconstructionModel> model = read(path, "reconstruction model", serDe::reconstructionModelFromJson,
                codec::reconstructionModelFromBytes);
        if (model.isPresent() && model.get().getDimensions() != schema.getWidth()) {
            log.warn("reconstruction model in {} has {} features, expected {}", path, model.get().getDimensions(),
                    schema.getWidth());
            model = Optional.empty();
        }
        return model.orElseGet(this::untrainedReconstruction);
    }

    public IsolationForest loadIsolation(Path path) {
        Optional<IsolationForest> forest = read(path, "isolation forest", serDe::isolationForestFromJson,
                codec::isolationForestFromBytes);
        if (forest.isPresent() && forest.get().getDimensions() != schema.getWidth()) {
            log.warn("isolation forest in {} has {} features, expected {}", path, forest.get().getDimensions(),
                    schema.getWidth());
            forest = Optional.empty();
        }
        return forest.orElseGet(this::untrainedIsolation);
    }

    public void saveReconstruction(Path path, ReconstructionModel model) throws IOException {
        checkNotNull(model, "model must not be null");
        write(path, () -> serDe.toJson(model), () -> codec.toBytes(model));
    }

    public void saveIsolation(Path path, IsolationForest forest) throws IOException {
        checkNotNull(forest, "forest must not be null");
        write(path, () -> serDe.toJson(forest), () -> codec.toBytes(forest));
    }

    /**
     * writes both detectors of the bundle
     */
    public void save(Path reconstructionPath, Path isolationPath, ModelArtifacts artifacts) throws IOException {
        checkNotNull(artifacts, "artifacts must not be null");
        saveReconstruction(reconstructionPath, artifacts.getReconstructionModel());
        saveIsolation(isolationPath, artifacts.getIsolationForest());
    }

    ReconstructionModel untrainedReconstruction() {
        return ReconstructionModel.untrained(schema.getWidth(), hiddenSize, randomSeed);
    }

    IsolationForest untrainedIsolation() {
        return IsolationForest.builder().dimensions(schema.getWidth()).numberOfTrees(numberOfTrees)
                .maxSamples(maxSamples).contamination(contamination).randomSeed(randomSeed).build();
    }

    static boolean isJson(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(JSON_EXTENSION);
    }

    private <M> Optional<M> read(Path path, String description, Function<String, M> fromJson,
            Function<byte[], M> fromBytes) {
        if (path == null) {
            log.warn("no {} configured, using an untrained one", description);
            return Optional.empty();
        }
        if (!Files.isRegularFile(path)) {
            log.warn("{} not found at {}, using an untrained one", description, path);
            return Optional.empty();
        }
        try {
            M model = isJson(path) ? fromJson.apply(new String(Files.readAllBytes(path), StandardCharsets.UTF_8))
                    : fromBytes.apply(Files.readAllBytes(path));
            if (model == null) {
                log.warn("{} at {} is empty, using an untrained one", description, path);
                return Optional.empty();
            }
            log.info("loaded {} from {}", description, path);
            return Optional.of(model);
        } catch (IOException | RuntimeException e) {
            log.warn("could not load {} from {}, using an untrained one", description, path, e);
            return Optional.empty();
        }
    }

    private static void write(Path path, Supplier<String> json, Supplier<byte[]> binary) throws IOException {
        checkNotNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (isJson(path)) {
            Files.write(path, json.get().getBytes(StandardCharsets.UTF_8));
        } else {
            Files.write(path, binary.get());
        }
        log.info("saved artifact to {}", path);
    }

    public static class Builder<T extends Builder<T>> {

        private FeatureSchema schema = FeatureSchema.tennesseeEastman();
        private int hiddenSize = ReconstructionModel.DEFAULT_HIDDEN_SIZE;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int maxSamples = IsolationForest.DEFAULT_MAX_SAMPLES;
        private double contamination = IsolationForest.DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();

        public T schema(FeatureSchema schema) {
            this.schema = schema;
            return (T) this;
        }

        public T hiddenSize(int hiddenSize) {
            this.hiddenSize = hiddenSize;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T maxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public ModelArtifactLoader build() {
            return new ModelArtifactLoader(this);
        }
    }
}
