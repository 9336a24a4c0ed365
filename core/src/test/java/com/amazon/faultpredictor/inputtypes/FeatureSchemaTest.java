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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class FeatureSchemaTest {

    @Test
    public void testTennesseeEastman() {
        FeatureSchema schema = FeatureSchema.tennesseeEastman();
        assertEquals(52, schema.getWidth());
        assertEquals("XMEAS_1", schema.getName(0));
        assertEquals("XMEAS_41", schema.getName(40));
        assertEquals("XMV_1", schema.getName(41));
        assertEquals("XMV_11", schema.getName(51));
        assertEquals(FeatureSchema.DEFAULT_SCHEMA_VERSION, schema.getVersion());
        assertThat(schema, is(FeatureSchema.tennesseeEastman()));
    }

    @Test
    public void testIndexOf() {
        FeatureSchema schema = FeatureSchema.tennesseeEastman();
        assertEquals(41, schema.indexOf("XMV_1"));
        assertEquals(-1, schema.indexOf("XMV_12"));
    }

    @Test
    public void testLookupCannotBeChangedFromOutside() {
        List<String> names = new ArrayList<>(Arrays.asList("a", "b", "c"));
        FeatureSchema schema = new FeatureSchema("v", names);
        names.set(0, "z");
        assertThrows(UnsupportedOperationException.class, () -> schema.getFeatureNames().set(1, "z"));
        assertEquals(0, schema.indexOf("a"));
        assertEquals(-1, schema.indexOf("z"));
        for (Method method : FeatureSchema.class.getMethods()) {
            assertThat(Map.class.isAssignableFrom(method.getReturnType()), is(false));
        }
    }

    @Test
    public void testOfWidth() {
        FeatureSchema schema = FeatureSchema.ofWidth(3);
        assertEquals(Arrays.asList("f0", "f1", "f2"), schema.getFeatureNames());
        assertThrows(IllegalArgumentException.class, () -> FeatureSchema.ofWidth(0));
    }

    @Test
    public void testInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema("v", Arrays.asList("a", "b", "a")));
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema("v", Collections.emptyList()));
        assertThrows(NullPointerException.class, () -> new FeatureSchema(null, Arrays.asList("a")));
    }
}
