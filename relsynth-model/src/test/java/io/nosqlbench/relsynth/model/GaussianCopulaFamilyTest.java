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

package io.nosqlbench.relsynth.model;

import io.nosqlbench.relsynth.extract.BestFitSelector;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class GaussianCopulaFamilyTest {

    private static ModelData correlatedData(int n, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            double x = 10 + 2 * random.nextGaussian();
            rows[i] = new double[]{x, 3 * x + 1 + random.nextGaussian()};
        }
        return new ModelData(List.of("x", "y"), rows);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    @Nested
    @DisplayName("parameter layout")
    class Layout {

        @Test
        void namesLocationScaleThenLowerTriangle() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a", "b", "c"));
            assertThat(family.parameterNames()).containsExactly(
                "a__loc", "a__log_scale", "b__loc", "b__log_scale", "c__loc", "c__log_scale",
                "b__a__corr", "c__a__corr", "c__b__corr");
            assertThat(family.parameterCount()).isEqualTo(9);
        }

        @Test
        void emptyColumnListHasNoParameters() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of());
            assertThat(family.parameterCount()).isZero();

            TableModel model = family.fit(new ModelData(List.of(), new double[3][0]));
            assertThat(model.parameterVector()).isEmpty();
            assertThat(model.sample(4, RandomSource.XO_SHI_RO_256_PP.create(1L)).rowCount()).isEqualTo(4);
        }

        @Test
        void pointMassHasTinyScaleAndNoCorrelation() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a", "b"));
            double[] p = family.pointMassParameters(new double[]{3.0, -1.0});

            assertThat(p[0]).isEqualTo(3.0);
            assertThat(p[1]).isCloseTo(Math.log(ScalarModels.MIN_SCALE), within(1e-12));
            assertThat(p[2]).isEqualTo(-1.0);
            assertThat(p[4]).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("fit and sample")
    class FitAndSample {

        @Test
        void sampledMarginalsAndCorrelationResembleData() {
            ModelData data = correlatedData(500, 11);
            TableModel model = GaussianCopulaFamily.normal(data.columns()).fit(data);
            assertThat(model.getModelType()).isEqualTo(GaussianCopulaModel.MODEL_TYPE);

            UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(42L);
            ModelData sample = model.sample(4000, rng);

            assertThat(sample.columns()).containsExactly("x", "y");
            assertThat(mean(sample.column(0))).isCloseTo(mean(data.column(0)), within(0.2));
            assertThat(mean(sample.column(1))).isCloseTo(mean(data.column(1)), within(0.6));
            double[][] corr = ((GaussianCopulaModel) model).correlation();
            assertThat(corr[0][1]).isGreaterThan(0.9);
        }

        @Test
        void sameSeedSameRows() {
            ModelData data = correlatedData(50, 3);
            TableModel model = GaussianCopulaFamily.normal(data.columns()).fit(data);

            ModelData a = model.sample(10, RandomSource.XO_SHI_RO_256_PP.create(5L));
            ModelData b = model.sample(10, RandomSource.XO_SHI_RO_256_PP.create(5L));
            assertThat(a.rows()).isDeepEqualTo(b.rows());
        }

        @Test
        void conditionalSamplingHoldsFixedColumnAndShiftsTheRest() {
            ModelData data = correlatedData(800, 17);
            TableModel model = GaussianCopulaFamily.normal(data.columns()).fit(data);

            ModelData sample = model.sampleConditional(2000, Map.of("x", 14.0),
                RandomSource.XO_SHI_RO_256_PP.create(8L));

            for (double x : sample.column(0)) {
                assertThat(x).isEqualTo(14.0);
            }
            // y = 3x + 1 + noise
            assertThat(mean(sample.column(1))).isCloseTo(43.0, within(1.5));
        }

        @Test
        void conditionalSamplingRejectsUnknownColumn() {
            ModelData data = correlatedData(20, 1);
            TableModel model = GaussianCopulaFamily.normal(data.columns()).fit(data);
            assertThatThrownBy(() -> model.sampleConditional(1, Map.of("z", 1.0),
                RandomSource.XO_SHI_RO_256_PP.create(1L)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void bestFitFamilyChoosesPerColumnMarginals() {
            Random random = new Random(21);
            double[][] rows = new double[2000][];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = new double[]{random.nextGaussian(), random.nextDouble()};
            }
            ModelData data = new ModelData(List.of("g", "u"), rows);

            GaussianCopulaFamily family = GaussianCopulaFamily.bestFit(data, BestFitSelector.parametricOnly());
            assertThat(family.marginalTypes()).containsExactly("normal", "uniform");

            ModelData sample = family.fit(data).sample(500, RandomSource.XO_SHI_RO_256_PP.create(2L));
            for (double u : sample.column(1)) {
                assertThat(u).isBetween(0.0, 1.0);
            }
        }

        @Test
        void fitRejectsMismatchedColumns() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a"));
            assertThatThrownBy(() -> family.fit(new ModelData(List.of("b"), new double[][]{{1.0}})))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("reconstruction from parameters")
    class Reconstruction {

        @Test
        void parameterVectorSurvivesReconstruction() {
            ModelData data = correlatedData(100, 5);
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(data.columns());
            double[] parameters = family.fit(data).parameterVector();

            double[] rebuilt = family.fromParameters(parameters).parameterVector();

            assertThat(rebuilt).hasSize(family.parameterCount());
            for (int i = 0; i < parameters.length; i++) {
                assertThat(rebuilt[i]).isCloseTo(parameters[i], within(1e-9));
            }
        }

        @Test
        void invalidCorrelationsAreRepaired() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a", "b", "c"));
            double[] p = {0, 0, 0, 0, 0, 0, 0.99, 0.99, -0.99};

            TableModel model = family.fromParameters(p);

            assertThat(model.sample(10, RandomSource.XO_SHI_RO_256_PP.create(4L)).rowCount()).isEqualTo(10);
        }

        @Test
        void tinyOrNegativeScalesAreFloored() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a"));
            GaussianCopulaModel model = (GaussianCopulaModel) family.fromParameters(new double[]{2.0, -500.0});
            assertThat(((NormalScalarModel) model.marginals()[0]).getStdDev()).isEqualTo(ScalarModels.MIN_SCALE);
        }

        @Test
        void rejectsWrongLengthAndNonFiniteVectors() {
            GaussianCopulaFamily family = GaussianCopulaFamily.normal(List.of("a", "b"));
            assertThatThrownBy(() -> family.fromParameters(new double[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 5");
            assertThatThrownBy(() -> family.fromParameters(new double[]{0, Double.NaN, 0, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a__log_scale");
        }
    }
}
