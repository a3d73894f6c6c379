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

package io.nosqlbench.relsynth.sampler;

import io.nosqlbench.relsynth.Fixtures;
import io.nosqlbench.relsynth.SynthesizerConfig;
import io.nosqlbench.relsynth.WorkerPool;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.model.TableModel;
import io.nosqlbench.relsynth.modeler.ExtensionBlock;
import io.nosqlbench.relsynth.modeler.FittedDatabase;
import io.nosqlbench.relsynth.modeler.FittedTable;
import io.nosqlbench.relsynth.modeler.Modeler;
import io.nosqlbench.relsynth.modeler.PreparedTable;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SamplerTest {

    /// Delegates to a fitted model, then overwrites the child count and
    /// child parameters of each sampled row.
    private static final class FixedChildren implements TableModel {
        private final TableModel delegate;
        private final int countIndex;
        private final int[] parameterIndex;
        private final double[] counts;
        private final double[][] parameters;

        private FixedChildren(TableModel delegate, ExtensionBlock block, double[] counts, double[][] parameters) {
            this.delegate = delegate;
            this.countIndex = delegate.columns().indexOf(block.countColumn());
            this.parameterIndex = block.parameterColumns().stream().mapToInt(delegate.columns()::indexOf).toArray();
            this.counts = counts;
            this.parameters = parameters;
        }

        @Override
        public String getModelType() {
            return delegate.getModelType();
        }

        @Override
        public List<String> columns() {
            return delegate.columns();
        }

        @Override
        public ModelData sample(int count, UniformRandomProvider rng) {
            ModelData drawn = delegate.sample(count, rng);
            double[][] rows = new double[drawn.rowCount()][];
            for (int r = 0; r < rows.length; r++) {
                rows[r] = drawn.row(r).clone();
                rows[r][countIndex] = counts[r];
                for (int p = 0; p < parameterIndex.length; p++) {
                    rows[r][parameterIndex[p]] = parameters[r][p];
                }
            }
            return new ModelData(drawn.columns(), rows);
        }

        @Override
        public ModelData sampleConditional(int count, Map<String, Double> fixed, UniformRandomProvider rng) {
            return delegate.sampleConditional(count, fixed, rng);
        }

        @Override
        public double[] parameterVector() {
            return delegate.parameterVector();
        }
    }

    private static FittedDatabase withUsersModel(FittedDatabase database, double[] counts, int brokenParent) {
        FittedTable users = database.table("users");
        ExtensionBlock block = users.blocks().get(0);
        double[] fittedOrders = database.table("orders").model().parameterVector();
        double[][] parameters = new double[counts.length][];
        for (int r = 0; r < counts.length; r++) {
            parameters[r] = fittedOrders.clone();
        }
        parameters[brokenParent][0] = Double.NaN;

        PreparedTable prepared = new PreparedTable(users.spec(), users.constraints(), users.transformer(),
            Map.of("user_id", users.primaryKeys()), users.extendedData());
        FittedTable replaced = new FittedTable(prepared, users.extendedData(), users.blocks(), users.family(),
            new FixedChildren(users.model(), block, counts, parameters), users.warnings());

        Map<String, FittedTable> tables = new LinkedHashMap<>(database.tables());
        tables.put("users", replaced);
        return new FittedDatabase(database.metadata(), database.graph(), database.config(), tables);
    }

    @Test
    void unusableParentRowsLoseOnlyTheirOwnChildren() {
        SynthesizerConfig config = SynthesizerConfig.defaults().setThreads(2);
        try (WorkerPool workers = new WorkerPool(config.getThreads())) {
            FittedDatabase fitted = new Modeler(config, workers).fit(Fixtures.shopMetadata(), Fixtures.shop());
            FittedDatabase database = withUsersModel(fitted, new double[]{3, Double.NaN, 1e12, 3, 2}, 3);

            SampleResult result = new Sampler(database, new KeyAllocator(), workers)
                .sample("users", 5, true, RandomSource.XO_SHI_RO_256_PP.create(7L));

            List<Object> userIds = result.table("users").column("user_id");
            List<Object> orderParents = result.table("orders").column("user_id");
            assertThat(userIds).hasSize(5);
            assertThat(orderParents).hasSize(5);
            assertThat(orderParents).filteredOn(userIds.get(0)::equals).hasSize(3);
            assertThat(orderParents).filteredOn(userIds.get(4)::equals).hasSize(2);
            assertThat(orderParents).doesNotContain(userIds.get(1), userIds.get(2), userIds.get(3));

            assertThat(result.warnings("orders")).hasSize(3)
                .anySatisfy(w -> assertThat(w)
                    .contains("children of " + userIds.get(1) + ":").contains("non-finite child count"))
                .anySatisfy(w -> assertThat(w)
                    .contains("children of " + userIds.get(2) + ":").contains("out of range"))
                .anySatisfy(w -> assertThat(w)
                    .contains("children of " + userIds.get(3) + ":").contains("Non-finite parameter"));
            assertThat(result.warnings("users")).isEmpty();
        }
    }
}
