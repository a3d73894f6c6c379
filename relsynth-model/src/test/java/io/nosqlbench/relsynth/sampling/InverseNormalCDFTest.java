/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.relsynth.sampling;

import io.nosqlbench.relsynth.model.NormalCDF;
import io.nosqlbench.relsynth.model.NormalScalarModel;
import io.nosqlbench.relsynth.model.UniformScalarModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class InverseNormalCDFTest {

    @Test
    void standardQuantiles() {
        assertEquals(0.0, InverseNormalCDF.standardNormalQuantile(0.5), 1e-6);
        assertEquals(1.959964, InverseNormalCDF.standardNormalQuantile(0.975), 1e-4);
        assertEquals(-1.959964, InverseNormalCDF.standardNormalQuantile(0.025), 1e-4);
        assertEquals(-3.090232, InverseNormalCDF.standardNormalQuantile(0.001), 1e-3);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.001, 0.01, 0.2, 0.5, 0.7, 0.99, 0.999})
    void quantileInvertsCdf(double p) {
        double x = InverseNormalCDF.standardNormalQuantile(p);
        assertEquals(p, NormalCDF.standardNormalCDF(x), 1e-6);
    }

    @Test
    void rejectsClosedBounds() {
        assertThrows(IllegalArgumentException.class, () -> InverseNormalCDF.standardNormalQuantile(0.0));
        assertThrows(IllegalArgumentException.class, () -> InverseNormalCDF.standardNormalQuantile(1.0));
        assertThrows(IllegalArgumentException.class, () -> InverseNormalCDF.standardNormalQuantile(Double.NaN));
    }

    @Test
    void samplersFollowTheirModels() {
        ComponentSampler normal = ComponentSamplerFactory.forModel(new NormalScalarModel(5.0, 2.0));
        ComponentSampler uniform = ComponentSamplerFactory.forModel(new UniformScalarModel(-1.0, 3.0));

        assertEquals(5.0, normal.sample(0.5), 1e-5);
        assertEquals(5.0 + 2.0 * 1.959964, normal.sample(0.975), 1e-3);
        assertEquals(-1.0, uniform.sample(0.0), 1e-12);
        assertEquals(1.0, uniform.sample(0.5), 1e-12);
    }

    @Test
    void openUnitIntervalNeverHitsBounds() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(99L);
        for (int i = 0; i < 10_000; i++) {
            double u = UnitInterval.open(rng);
            assertTrue(u > 0.0 && u < 1.0);
        }
        assertEquals(UnitInterval.EPSILON, UnitInterval.clamp(0.0));
        assertEquals(0.5, UnitInterval.clamp(Double.NaN));
    }
}
