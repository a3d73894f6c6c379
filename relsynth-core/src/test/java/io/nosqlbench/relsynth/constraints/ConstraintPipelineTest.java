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

package io.nosqlbench.relsynth.constraints;

import com.google.gson.Gson;
import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.metadata.ConstraintSpec;
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.table.Table;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConstraintPipelineTest {

    private static TableSpec.Builder trips() {
        return TableSpec.builder("trips")
            .primaryKey("trip_id")
            .fields(
                FieldSpec.decimal("start"),
                FieldSpec.decimal("end"),
                FieldSpec.decimal("duration"),
                FieldSpec.categorical("kind"));
    }

    private static Table tripRows() {
        return Table.builder("trips", "trip_id", "start", "end", "duration", "kind")
            .row(1L, 0.5, 2.0, 1.5, "bus")
            .row(2L, 1.0, 1.0, 0.0, "car")
            .row(3L, 2.25, 8.0, 5.75, "bus")
            .build();
    }

    private static TableSpec tripSpec() {
        return trips()
            .constraint(ConstraintSpec.inequality("start", "end", false))
            .constraint(ConstraintSpec.between("duration", 0, 10))
            .constraint(ConstraintSpec.unique("kind", "start"))
            .build();
    }

    @Test
    void buildsDeclaredConstraintsInOrder() {
        ConstraintPipeline pipeline = ConstraintPipeline.forTable(tripSpec());

        assertThat(pipeline.constraints()).extracting(Constraint::getConstraintType)
            .containsExactly(Inequality.TYPE, Between.TYPE, Unique.TYPE);
        assertThat(pipeline.hasTableWideConstraints()).isTrue();
        assertThat(pipeline.rewrittenColumns()).containsExactly("end", "duration");
    }

    @Test
    void roundTripRestoresRawRows() {
        ConstraintPipeline pipeline = ConstraintPipeline.forTable(tripSpec());
        Table raw = tripRows();

        Table transformed = pipeline.fitTransform(raw);
        assertThat(transformed.column("end")).isNotEqualTo(raw.column("end"));

        Table restored = pipeline.reverseTransform(transformed);
        for (String column : raw.columns()) {
            assertThat(restored.column(column)).as(column).isEqualTo(raw.column(column));
        }
        assertThat(pipeline.isValid(restored)).containsOnly(true);
    }

    @Test
    void derivedColumnIsRecomputedFromRestoredTerms() {
        TableSpec spec = trips()
            .constraint(ConstraintSpec.columnFormula("duration", Map.of("end", 1.0, "start", -1.0), 0))
            .constraint(ConstraintSpec.inequality("start", "end", false))
            .build();
        ConstraintPipeline pipeline = ConstraintPipeline.forTable(spec);
        Table raw = tripRows();

        Table transformed = pipeline.fitTransform(raw);
        assertThat(transformed.hasColumn("duration")).isFalse();

        Table restored = pipeline.reverseTransform(transformed);
        assertThat(restored.column("duration")).isEqualTo(raw.column("duration"));
        assertThat(pipeline.isValid(restored)).containsOnly(true);
    }

    @Test
    void rowsFailingAnyConstraintAreInvalid() {
        ConstraintPipeline pipeline = ConstraintPipeline.forTable(tripSpec());
        Table sampled = Table.builder("trips", "trip_id", "start", "end", "duration", "kind")
            .row(1L, 0.5, 2.0, 1.5, "bus")
            .row(2L, 3.0, 2.0, 1.5, "car")
            .row(3L, 0.5, 2.0, 11.0, "car")
            .row(4L, 0.5, 9.0, 1.5, "bus")
            .build();
        assertThat(pipeline.isValid(sampled)).containsExactly(true, false, false, false);
    }

    @Test
    void constraintOnKeyColumnIsRejected() {
        TableSpec spec = trips().constraint(ConstraintSpec.between("trip_id", 0, 10)).build();
        assertThatThrownBy(() -> ConstraintPipeline.forTable(spec))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("key column");
    }

    @Test
    void constraintOnUnknownColumnIsRejected() {
        TableSpec spec = trips().constraint(ConstraintSpec.unique("missing")).build();
        assertThatThrownBy(() -> ConstraintPipeline.forTable(spec))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("unknown column");
    }

    @Test
    void numericConstraintOnCategoricalIsRejected() {
        TableSpec spec = trips().constraint(ConstraintSpec.between("kind", 0, 1)).build();
        assertThatThrownBy(() -> ConstraintPipeline.forTable(spec))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("numerical");
    }

    @Test
    void unknownKindIsRejected() {
        ConstraintSpec custom = new Gson().fromJson("{\"constraint\": \"custom\", \"column\": \"start\"}", ConstraintSpec.class);
        TableSpec spec = trips().constraint(custom).build();
        assertThatThrownBy(() -> ConstraintPipeline.forTable(spec))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unknown constraint kind");
    }

    @Test
    void violatingRawRowsAreAConfigurationError() {
        TableSpec spec = trips().constraint(ConstraintSpec.between("duration", 0, 1)).build();
        ConstraintPipeline pipeline = ConstraintPipeline.forTable(spec);
        assertThatThrownBy(() -> pipeline.fitTransform(tripRows())).isInstanceOf(ConfigurationException.class);
    }
}
