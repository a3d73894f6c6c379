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

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.table.Table;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ColumnFormulaTest {

    // total = 1 + 2 * price + tax
    private static ColumnFormula formula() {
        Map<String, Double> terms = new LinkedHashMap<>();
        terms.put("price", 2.0);
        terms.put("tax", 1.0);
        return new ColumnFormula("total", terms, 1.0);
    }

    private static Table orders() {
        return Table.builder("orders", "price", "tax", "total")
            .row(1.5, 0.25, 4.25)
            .row(10.0, 2.0, 23.0)
            .row(null, 1.0, 7.0)
            .build();
    }

    @Test
    void transformDropsTheDerivedColumn() {
        ColumnFormula formula = formula();
        Table raw = orders();
        formula.fit(raw);

        Table transformed = formula.transform(raw);
        assertThat(transformed.columns()).containsExactly("price", "tax");
        assertThat(formula.droppedColumns()).containsExactly("total");
    }

    @Test
    void reverseRecomputesTheDerivedColumn() {
        ColumnFormula formula = formula();
        Table raw = orders();
        formula.fit(raw);

        Table restored = formula.reverseTransform(formula.transform(raw));
        assertThat(restored.get(0, "total")).isEqualTo(4.25);
        assertThat(restored.get(1, "total")).isEqualTo(23.0);
        assertThat(restored.get(2, "total")).isNull();
        assertThat(formula.isValid(restored)).containsOnly(true);
    }

    @Test
    void mismatchIsAConfigurationError() {
        ColumnFormula formula = formula();
        Table raw = Table.builder("orders", "price", "tax", "total").row(1.0, 1.0, 5.0).build();
        formula.fit(raw);
        assertThatThrownBy(() -> formula.transform(raw))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("expected 4.0");
    }

    @Test
    void validityAllowsRoundingOfTheDerivedColumn() {
        ColumnFormula formula = formula();
        formula.fit(Table.builder("orders", "price", "tax", "total").row(1.0, 1.0, 4.0).build());

        Table sampled = Table.builder("orders", "price", "tax", "total")
            .row(1.2, 0.1, 4.0)
            .row(1.2, 0.1, 5.0)
            .build();
        assertThat(formula.isValid(sampled)).containsExactly(true, false);
    }

    @Test
    void rejectsSelfReference() {
        assertThatThrownBy(() -> new ColumnFormula("total", Map.of("total", 1.0), 0))
            .isInstanceOf(ConfigurationException.class);
    }
}
