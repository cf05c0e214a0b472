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

package com.amazon.omniad.algorithms.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.omniad.algorithms.pca.PcaModel;
import com.amazon.omniad.state.Version;

public class PcaMapperTest {

    private final PcaMapper mapper = new PcaMapper();

    private final PcaModel model = new PcaModel(3, new double[][] { { 1, 0, 0 }, { 0, 0.6, 0.8 } },
            new double[] { 4.5, 1.25 });

    @Test
    public void testRoundTrip() {
        PcaState state = mapper.toState(model);

        assertEquals(Version.V1_0, state.getVersion());
        assertEquals(3, state.getDimensions());
        assertEquals(2, state.getNumberOfComponents());
        assertArrayEquals(new double[] { 1, 0, 0, 0, 0.6, 0.8 }, state.getComponents());
        assertEquals(model, mapper.toModel(state));
    }

    @Test
    public void testUnsupportedVersion() {
        PcaState state = mapper.toState(model);
        state.setVersion("2.0");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testShapeDoesNotMatchComponents() {
        PcaState state = mapper.toState(model);
        state.setNumberOfComponents(3);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        PcaState missing = mapper.toState(model);
        missing.setComponents(null);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(missing));
    }

    @Test
    public void testMissingExplainedVariance() {
        PcaState state = mapper.toState(model);
        state.setExplainedVariance(null);
        // a model needs one explained variance per component
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }
}
