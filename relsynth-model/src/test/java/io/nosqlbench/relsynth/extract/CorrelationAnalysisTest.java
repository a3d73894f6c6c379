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

package io.nosqlbench.relsynth.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CorrelationAnalysisTest {

    @Test
    @DisplayName("perfectly correlated columns yield r = 1 and anti-correlated r = -1")
    void correlationOfLinearColumns() {
        double[][] rows = new double[10][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[]{i, 2 * i + 1, -i};
        }
        double[][] corr = CorrelationAnalysis.computeCorrelationMatrix(rows, 3);

        assertThat(corr[0][1]).isCloseTo(1.0, within(1e-12));
        assertThat(corr[0][2]).isCloseTo(-1.0, within(1e-12));
        assertThat(corr[1][0]).isEqualTo(corr[0][1]);
    }

    @Test
    void fewerThanThreeRowsGiveIdentity() {
        double[][] corr = CorrelationAnalysis.computeCorrelationMatrix(new double[][]{{1, 2}, {3, 5}}, 2);
        assertThat(corr).isDeepEqualTo(CorrelationAnalysis.identity(2));
    }

    @Test
    void constantColumnIsUncorrelated() {
        double[][] rows = {{1, 7}, {2, 7}, {3, 7}, {4, 7}};
        double[][] corr = CorrelationAnalysis.computeCorrelationMatrix(rows, 2);
        assertThat(corr[0][1]).isEqualTo(0.0);
    }

    @Test
    void choleskyReproducesMatrix() {
        double[][] m = {{1.0, 0.5, 0.2}, {0.5, 1.0, 0.3}, {0.2, 0.3, 1.0}};
        double[][] l = CorrelationAnalysis.cholesky(m);

        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double sum = 0;
                for (int k = 0; k < 3; k++) {
                    sum += l[i][k] * l[j][k];
                }
                assertThat(sum).isCloseTo(m[i][j], within(1e-12));
            }
        }
    }

    @Test
    void choleskySolveInvertsSystem() {
        double[][] m = {{4.0, 2.0}, {2.0, 3.0}};
        double[] x = CorrelationAnalysis.choleskySolve(CorrelationAnalysis.cholesky(m), new double[]{10.0, 8.0});
        assertThat(x[0]).isCloseTo(1.75, within(1e-12));
        assertThat(x[1]).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void choleskyRejectsIndefiniteMatrix() {
        double[][] m = {{1.0, 2.0}, {2.0, 1.0}};
        assertThatThrownBy(() -> CorrelationAnalysis.cholesky(m))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive definite");
    }

    @Test
    void repairLeavesValidMatrixUnchanged() {
        double[][] m = {{1.0, 0.4}, {0.4, 1.0}};
        assertThat(CorrelationAnalysis.repair(m)).isDeepEqualTo(m);
    }

    @Test
    void repairFixesInconsistentCorrelations() {
        double[][] m = {
            {1.0, 0.99, 0.99},
            {0.99, 1.0, -0.99},
            {0.99, -0.99, 1.0}
        };
        assertThat(CorrelationAnalysis.isPositiveDefinite(m)).isFalse();

        double[][] repaired = CorrelationAnalysis.repair(m);

        assertThat(CorrelationAnalysis.isPositiveDefinite(repaired)).isTrue();
        for (int i = 0; i < 3; i++) {
            assertThat(repaired[i][i]).isEqualTo(1.0);
        }
        assertThat(Math.signum(repaired[0][1])).isEqualTo(1.0);
    }

    @Test
    void repairClampsOutOfRangeEntries() {
        double[][] repaired = CorrelationAnalysis.repair(new double[][]{{1.0, 3.0}, {3.0, 1.0}});
        assertThat(CorrelationAnalysis.isPositiveDefinite(repaired)).isTrue();
        assertThat(repaired[0][1]).isLessThan(1.0);
    }
}
