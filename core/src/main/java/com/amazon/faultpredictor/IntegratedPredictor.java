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
import static com.amazon.faultpredictor.CommonUtils.checkState;
import static com.amazon.faultpredictor.CommonUtils.clamp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.faultpredictor.attribution.FeatureImportance;
import com.amazon.faultpredictor.attribution.FeatureImportanceCalculator;
import com.amazon.faultpredictor.config.PredictorState;
import com.amazon.faultpredictor.config.RiskTier;
import com.amazon.faultpredictor.config.Severity;
import com.amazon.faultpredictor.fusion.EqualWeightFusion;
import com.amazon.faultpredictor.fusion.InterpretationSynthesizer;
import com.amazon.faultpredictor.fusion.ScoreFusion;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.preprocessor.NormalizedWindow;
import com.amazon.faultpredictor.preprocessor.WindowPreprocessor;
import com.amazon.faultpredictor.reconstruction.ReconstructionDetector;
import com.amazon.faultpredictor.returntypes.ConfidenceInterval;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.amazon.faultpredictor.returntypes.DetectorVerdict;
import com.amazon.faultpredictor.returntypes.Forecast;

/**
 * The entry point of the library. A predictor validates and normalizes a
 * sensor window, scores it with the reconstruction detector and the isolation
 * forest, fuses the two scores into a fault probability and explains the
 * result with feature weights and a sentence.
 *
 * <p>
 * The artifacts are held in a single atomic reference. {@link #predict} reads
 * the reference once, so a concurrent {@link #swapArtifacts} is observed either
 * entirely or not at all. Predictions do not mutate shared state and the class
 * is safe for concurrent use.
 * </p>
 */
@Slf4j
public class IntegratedPredictor implements AutoCloseable {

    /**
     * Default number of features exposed in the importance map of a result.
     */
    public static final int DEFAULT_TOP_K = FeatureImportanceCalculator.DEFAULT_TOP_K;

    /**
     * Number of feature names listed in a result.
     */
    public static final int DEFAULT_NUMBER_OF_TOP_FEATURES = 5;

    @Getter
    private final FeatureSchema schema;

    @Getter
    private final WindowPreprocessor preprocessor;

    @Getter
    private final ScoreFusion fusion;

    @Getter
    private final double reconstructionThreshold;

    @Getter
    private final double marginCoefficient;

    @Getter
    private final int topK;

    @Getter
    private final int horizon;

    private final FeatureImportanceCalculator importanceCalculator;

    private final InterpretationSynthesizer synthesizer;

    private final AtomicReference<ModelArtifacts> artifacts;

    private final AtomicReference<PredictorState> state;

    public IntegratedPredictor(Builder<?> builder) {
        checkNotNull(builder.schema, "schema must not be null");
        checkNotNull(builder.fusion, "fusion must not be null");
        checkArgument(builder.reconstructionThreshold >= 0, "reconstruction threshold cannot be negative");
        checkArgument(builder.marginCoefficient >= 0, "margin coefficient cannot be negative");
        checkArgument(builder.topK > 0, "topK must be positive");
        checkArgument(builder.horizon > 0, "horizon must be positive");
        this.schema = builder.schema;
        this.preprocessor = WindowPreprocessor.builder().dimensions(schema.getWidth())
                .minimumLength(builder.minimumWindowLength).build();
        this.fusion = builder.fusion;
        this.reconstructionThreshold = builder.reconstructionThreshold;
        this.marginCoefficient = builder.marginCoefficient;
        this.topK = builder.topK;
        this.horizon = builder.horizon;
        this.importanceCalculator = new FeatureImportanceCalculator(schema);
        this.synthesizer = new InterpretationSynthesizer();

        ModelArtifacts initial = builder.artifacts.orElseGet(() -> {
            log.warn("no model artifacts supplied, serving untrained models for schema {}", schema.getVersion());
            return ModelArtifacts.untrained(schema, builder.randomSeed.orElseGet(() -> new Random().nextLong()));
        });
        checkCompatible(initial);
        this.artifacts = new AtomicReference<>(initial);
        this.state = new AtomicReference<>(PredictorState.LOADED);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public DetectionResult predict(SensorWindow window) {
        return predict(window, horizon);
    }

    /**
     * Scores one window.
     *
     * @param window  raw sensor readings, at least the minimum length and as wide
     *                as the schema
     * @param horizon forecast horizon in minutes
     * @return a new result
     * @throws com.amazon.faultpredictor.preprocessor.WindowValidationException if the window is invalid
     * @throws IllegalStateException if the predictor was closed
     */
    public DetectionResult predict(SensorWindow window, int horizon) {
        checkState(isLoaded(), "predictor is not loaded");
        checkArgument(horizon > 0, "horizon must be positive");
        ModelArtifacts current = artifacts.get();

        NormalizedWindow normalized = preprocessor.normalize(window);
        double[][] values = normalized.getValues();

        ReconstructionDetector detector = new ReconstructionDetector(current.getReconstructionModel());
        Forecast forecast = detector.predict(values, horizon);
        DetectorVerdict reconstruction = detector.detectAnomaly(values, reconstructionThreshold);
        DetectorVerdict isolation = current.getIsolationForest().detectSingle(normalized.getLastTimestep());

        double probability = clamp(fusion.fuse(reconstruction.getScore(), isolation.getScore()), 0, 1);
        ConfidenceInterval interval = ConfidenceInterval.around(probability, forecast.getConfidence(),
                marginCoefficient);

        FeatureImportance importance = importanceCalculator.calculateImportance(window, probability);
        List<String> topFeatures = new ArrayList<>();
        for (FeatureImportance.Entry entry : FeatureImportanceCalculator.getTopFeatures(importance,
                DEFAULT_NUMBER_OF_TOP_FEATURES)) {
            topFeatures.add(entry.getName());
        }
        Optional<String> topFeature = importance.getTopFeature();

        return DetectionResult.builder().probability(probability).predictedValue(forecast.getMeanValue())
                .forecastConfidence(forecast.getConfidence()).confidenceLower(interval.getLower())
                .confidenceUpper(interval.getUpper()).featureImportance(importance.top(topK).asMap())
                .topFeatures(topFeatures).interpretation(synthesizer.interpret(probability, horizon, topFeature))
                .riskTier(RiskTier.of(probability)).severity(Severity.of(probability))
                .anomaly(reconstruction.isAnomaly() || isolation.isAnomaly()).horizon(horizon)
                .reconstructionScore(reconstruction.getScore()).isolationScore(isolation.getScore()).build();
    }

    /**
     * Publishes a new bundle. Predictions already in flight finish with the
     * bundle they started with.
     *
     * @param next artifacts over the features of this predictor
     * @return the bundle that was replaced
     */
    public ModelArtifacts swapArtifacts(ModelArtifacts next) {
        checkState(isLoaded(), "predictor is not loaded");
        checkNotNull(next, "artifacts must not be null");
        checkCompatible(next);
        ModelArtifacts previous = artifacts.getAndSet(next);
        log.debug("swapped model artifacts {} for {}", previous, next);
        return previous;
    }

    /**
     * Trains a new bundle on the calling thread and publishes it. Predictions on
     * other threads keep using the current bundle until the swap.
     *
     * @param trainer trainer configured for the schema of this predictor
     * @param windows training windows
     * @return the newly published bundle
     */
    public ModelArtifacts retrainAndSwap(FaultPredictorTrainer trainer, List<SensorWindow> windows) {
        checkNotNull(trainer, "trainer must not be null");
        checkState(isLoaded(), "predictor is not loaded");
        ModelArtifacts trained = trainer.train(windows);
        swapArtifacts(trained);
        return trained;
    }

    public ModelArtifacts getArtifacts() {
        return artifacts.get();
    }

    public PredictorState getState() {
        return state.get();
    }

    public boolean isLoaded() {
        return state.get() == PredictorState.LOADED;
    }

    @Override
    public void close() {
        if (state.getAndSet(PredictorState.NOT_LOADED) == PredictorState.LOADED) {
            log.info("predictor for schema {} closed", schema.getVersion());
        }
    }

    private void checkCompatible(ModelArtifacts candidate) {
        checkArgument(candidate.getDimensions() == schema.getWidth(), String.format(
                "artifacts have %d features but the schema has %d", candidate.getDimensions(), schema.getWidth()));
        if (!candidate.getSchemaVersion().equals(schema.getVersion())) {
            log.warn("artifacts were trained on schema {} but are served for schema {}",
                    candidate.getSchemaVersion(), schema.getVersion());
        }
    }

    public static class Builder<T extends Builder<T>> {

        private FeatureSchema schema = FeatureSchema.tennesseeEastman();
        private Optional<ModelArtifacts> artifacts = Optional.empty();
        private ScoreFusion fusion = new EqualWeightFusion();
        private int minimumWindowLength = WindowPreprocessor.DEFAULT_MINIMUM_LENGTH;
        private double reconstructionThreshold = ReconstructionDetector.DEFAULT_THRESHOLD;
        private double marginCoefficient = ConfidenceInterval.DEFAULT_MARGIN_COEFFICIENT;
        private int topK = DEFAULT_TOP_K;
        private int horizon = ReconstructionDetector.DEFAULT_HORIZON;
        private Optional<Long> randomSeed = Optional.empty();

        public T schema(FeatureSchema schema) {
            this.schema = schema;
            return (T) this;
        }

        public T artifacts(ModelArtifacts artifacts) {
            this.artifacts = Optional.of(artifacts);
            return (T) this;
        }

        public T fusion(ScoreFusion fusion) {
            this.fusion = fusion;
            return (T) this;
        }

        public T minimumWindowLength(int minimumWindowLength) {
            this.minimumWindowLength = minimumWindowLength;
            return (T) this;
        }

        public T reconstructionThreshold(double reconstructionThreshold) {
            this.reconstructionThreshold = reconstructionThreshold;
            return (T) this;
        }

        public T marginCoefficient(double marginCoefficient) {
            this.marginCoefficient = marginCoefficient;
            return (T) this;
        }

        public T topK(int topK) {
            this.topK = topK;
            return (T) this;
        }

        public T horizon(int horizon) {
            this.horizon = horizon;
            return (T) this;
        }

        /**
         * seed of the untrained fallback used when no artifacts are supplied
         */
        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public IntegratedPredictor build() {
            return new IntegratedPredictor(this);
        }
    }
}
