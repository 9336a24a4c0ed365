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

package com.amazon.faultpredictor.inputtypes;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The ordered, named channels of a sensor window. The position of a name in the
 * schema is the column index of that channel in every timestep.
 */
@Getter
@EqualsAndHashCode
public class FeatureSchema {

    public static final String DEFAULT_SCHEMA_VERSION = "tep-52";

    /**
     * number of process measurements (XMEAS) in the Tennessee Eastman Process
     */
    public static final int NUMBER_OF_MEASURED_VARIABLES = 41;

    /**
     * number of manipulated variables (XMV) in the Tennessee Eastman Process
     */
    public static final int NUMBER_OF_MANIPULATED_VARIABLES = 11;

    private final String version;

    private final List<String> featureNames;

    @EqualsAndHashCode.Exclude
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> indexByName;

    public FeatureSchema(String version, List<String> featureNames) {
        checkNotNull(version, "version must not be null");
        checkNotNull(featureNames, "featureNames must not be null");
        checkArgument(!featureNames.isEmpty(), "a schema needs at least one feature");
        this.version = version;
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            String name = checkNotNull(featureNames.get(i), "feature names must not be null");
            checkArgument(indexByName.put(name, i) == null, "duplicate feature name " + name);
        }
    }

    /**
     * @return the 52 channel schema of the Tennessee Eastman Process, XMEAS_1 ..
     *         XMEAS_41 followed by XMV_1 .. XMV_11
     */
    public static FeatureSchema tennesseeEastman() {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= NUMBER_OF_MEASURED_VARIABLES; i++) {
            names.add("XMEAS_" + i);
        }
        for (int i = 1; i <= NUMBER_OF_MANIPULATED_VARIABLES; i++) {
            names.add("XMV_" + i);
        }
        return new FeatureSchema(DEFAULT_SCHEMA_VERSION, names);
    }

    /**
     * a schema with generic names f0 .. f(width-1); used when only the width of the
     * data is known
     *
     * @param width number of channels
     * @return a schema
     */
    public static FeatureSchema ofWidth(int width) {
        checkArgument(width > 0, "width must be positive");
        List<String> names = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            names.add("f" + i);
        }
        return new FeatureSchema("generic-" + width, names);
    }

    public int getWidth() {
        return featureNames.size();
    }

    public String getName(int index) {
        return featureNames.get(index);
    }

    /**
     * @param name a feature name
     * @return the column of the feature, or -1 if it is not part of the schema
     */
    public int indexOf(String name) {
        return indexByName.getOrDefault(name, -1);
    }
}
