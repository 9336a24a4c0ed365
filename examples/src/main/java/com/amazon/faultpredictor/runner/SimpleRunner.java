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
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

import com.amazon.faultpredictor.IntegratedPredictor;
import com.amazon.faultpredictor.ModelArtifacts;
import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.preprocessor.SlidingWindowBuffer;
import com.amazon.faultpredictor.serialize.ModelArtifactLoader;

public class SimpleRunner {

    protected final ArgumentParser argumentParser;
    protected final Function<IntegratedPredictor, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected SlidingWindowBuffer windowBuffer;
    protected double[] pointBuffer;
    protected int lineNumber;

    public SimpleRunner(String runnerClass, String runnerDescription,
            Function<IntegratedPredictor, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    public SimpleRunner(ArgumentParser argumentParser,
            Function<IntegratedPredictor, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                prepareAlgorithm(schemaOf(Arrays.asList(values)));
                writeHeader(values, out);
                continue;
            }

            if (pointBuffer == null) {
                prepareAlgorithm(values.length);
            }

            processLine(values, out);
        }

        finish(out);
        out.flush();
    }

    protected void prepareAlgorithm(int dimensions) {
        prepareAlgorithm(dimensions == FeatureSchema.NUMBER_OF_MEASURED_VARIABLES
                + FeatureSchema.NUMBER_OF_MANIPULATED_VARIABLES ? FeatureSchema.tennesseeEastman()
                        : FeatureSchema.ofWidth(dimensions));
    }

    protected void prepareAlgorithm(FeatureSchema schema) {
        pointBuffer = new double[schema.getWidth()];
        windowBuffer = new SlidingWindowBuffer(schema, argumentParser.getWindowLength());

        ModelArtifactLoader loader = ModelArtifactLoader.builder().schema(schema)
                .randomSeed(argumentParser.getRandomSeed()).build();
        ModelArtifacts artifacts = loader.load(argumentParser.getReconstructionArtifact().orElse(null),
                argumentParser.getIsolationArtifact().orElse(null));

        IntegratedPredictor predictor = IntegratedPredictor.builder().schema(schema).artifacts(artifacts)
                .minimumWindowLength(argumentParser.getWindowLength())
                .reconstructionThreshold(argumentParser.getReconstructionThreshold())
                .horizon(argumentParser.getHorizon()).randomSeed(argumentParser.getRandomSeed()).build();

        algorithm = algorithmInitializer.apply(predictor);
    }

    /**
     * the schema of a header row; a 52 column header keeps the version of the
     * Tennessee Eastman schema so that artifacts trained on it match
     */
    protected FeatureSchema schemaOf(List<String> names) {
        List<String> trimmed = new ArrayList<>(names.size());
        names.forEach(name -> trimmed.add(name.trim()));
        String version = FeatureSchema.tennesseeEastman().getWidth() == trimmed.size()
                ? FeatureSchema.DEFAULT_SCHEMA_VERSION
                : FeatureSchema.ofWidth(trimmed.size()).getVersion();
        return new FeatureSchema(version, trimmed);
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected void processLine(String[] values, PrintWriter out) {
        if (values.length != pointBuffer.length) {
            throw new IllegalArgumentException(
                    String.format("Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                            pointBuffer.length, values.length));
        }

        parsePoint(values);
        windowBuffer.addPoint(pointBuffer, lineNumber);

        List<String> result;
        if (windowBuffer.isFull()) {
            result = algorithm.getResultValues(windowBuffer.getWindow());
        } else {
            result = algorithm.getEmptyResultValue();
        }

        out.println(formatLine(values, result));
    }

    /**
     * @return the input values followed by the result values
     */
    protected String formatLine(String[] values, List<String> result) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        result.forEach(joiner::add);
        return joiner.toString();
    }

    protected void parsePoint(String... stringValues) {
        for (int i = 0; i < pointBuffer.length; i++) {
            pointBuffer[i] = Double.parseDouble(stringValues[i].trim());
        }
    }

    protected void finish(PrintWriter out) {
        if (algorithm != null) {
            algorithm.getPredictor().close();
        }
    }

    protected int getPointSize() {
        return pointBuffer != null ? pointBuffer.length : 0;
    }
}
