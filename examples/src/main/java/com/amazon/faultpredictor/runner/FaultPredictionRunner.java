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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.fusion.InterpretationSynthesizer;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.returntypes.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class FaultPredictionRunner extends SimpleRunner {

    public static final String EMPTY_VALUE = "NA";

    public FaultPredictionRunner() {
        this(new ArgumentParser(FaultPredictionRunner.class.getName(),
                "Compute fault probabilities over a sliding window of the input rows and append them to the "
                        + "output rows."));
    }

    private FaultPredictionRunner(ArgumentParser argumentParser) {
        super(argumentParser, predictor -> argumentParser.isJsonOutput() ? new JsonTransformer(predictor)
                : new FaultPredictionTransformer(predictor));
    }

    public static void main(String... args) throws IOException {
        FaultPredictionRunner runner = new FaultPredictionRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    @Override
    protected void writeHeader(String[] values, PrintWriter out) {
        if (!argumentParser.isJsonOutput()) {
            super.writeHeader(values, out);
        }
    }

    // a JSON line stands alone instead of extending the input row
    @Override
    protected String formatLine(String[] values, List<String> result) {
        return argumentParser.isJsonOutput() ? String.join("", result) : super.formatLine(values, result);
    }

    public static class FaultPredictionTransformer implements LineTransformer {
        private final IntegratedPredictor predictor;

        public FaultPredictionTransformer(IntegratedPredictor predictor) {
            this.predictor = predictor;
        }

        @Override
        public List<String> getResultValues(SensorWindow window) {
            DetectionResult result = predictor.predict(window);
            String topFeature = result.getTopFeatures().isEmpty() ? InterpretationSynthesizer.UNKNOWN_FEATURE
                    : result.getTopFeatures().get(0);
            return Arrays.asList(Double.toString(result.getProbability()), Boolean.toString(result.isAnomaly()),
                    result.getRiskTier().getLabel(), topFeature);
        }

        @Override
        public List<String> getEmptyResultValue() {
            return Collections.nCopies(getResultColumnNames().size(), EMPTY_VALUE);
        }

        @Override
        public List<String> getResultColumnNames() {
            return Arrays.asList("probability", "is_anomaly", "risk_tier", "top_feature");
        }

        @Override
        public IntegratedPredictor getPredictor() {
            return predictor;
        }
    }

    /**
     * Writes every {@link DetectionResult} as a JSON object with
     * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
     */
    public static class JsonTransformer implements LineTransformer {
        private final IntegratedPredictor predictor;
        private final ObjectMapper mapper;

        public JsonTransformer(IntegratedPredictor predictor) {
            this.predictor = predictor;
            this.mapper = new ObjectMapper();
        }

        @Override
        public List<String> getResultValues(SensorWindow window) {
            try {
                return Collections.singletonList(mapper.writeValueAsString(predictor.predict(window)));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public List<String> getEmptyResultValue() {
            return Collections.singletonList(EMPTY_VALUE);
        }

        @Override
        public List<String> getResultColumnNames() {
            return Collections.singletonList("result");
        }

        @Override
        public IntegratedPredictor getPredictor() {
            return predictor;
        }
    }
}
