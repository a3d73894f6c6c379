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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class InequalityTest {

    private static Table spans() {
        return Table.builder("t", "start", "end")
            .row(1.0, 3.5)
            .row(2.5, 2.5)
            .row(-4.0, 10.0)
            .build();
    }

    @Test
    void highColumnBecomesLogDifference() {
        Inequality inequality = new Inequality("start", "end", false);
        Table raw = spans();
        inequality.fit(raw);

        Table transformed = inequality.transform(raw);
        assertThat((Double) transformed.get(0, "end")).isCloseTo(Math.log(3.5), within(1e-12));
        assertThat(transformed.get(1, "end")).isEqualTo(0.0);
        assertThat(transformed.column("start")).isEqualTo(raw.column("start"));
    }

    @Test
    void roundTripRestoresRawValues() {
        Inequality inequality = new Inequality("start", "end", false);
        Table raw = spans();
        inequality.fit(raw);

        Table restored = inequality.reverseTransform(inequality.transform(raw));
        assertThat(restored.column("end")).containsExactly(3.5, 2.5, 10.0);
    }

    @Test
    void negativeModelDifferenceClampsToEqual() {
        Inequality inequality = new Inequality("start", "end", false);
        inequality.fit(spans());

        Table restored = inequality.reverseTransform(Table.builder("t", "start", "end").row(5.0, -30.0).build());
        assertThat(restored.get(0, "end")).isEqualTo(5.0);
        assertThat(inequality.isValid(restored)).containsExactly(true);
    }

    @Test
    void nullOnEitherSideIsUnconstrained() {
        Inequality inequality = new Inequality("start", "end", false);
        Table rows = Table.builder("t", "start", "end").row(null, 1.0).row(2.0, null).build();
        inequality.fit(rows);

        assertThat(inequality.transform(rows).column("end")).containsExactly(null, null);
        assertThat(inequality.isValid(rows)).containsExactly(true, true);
    }

    @Test
    void violationIsAConfigurationError() {
        Inequality inequality = new Inequality("start", "end", false);
        Table raw = Table.builder("t", "start", "end").row(3.0, 1.0).build();
        inequality.fit(raw);
        assertThatThrownBy(() -> inequality.transform(raw)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void strictRejectsEquality() {
        Inequality strict = new Inequality("start", "end", true);
        Table rows = Table.builder("t", "start", "end").row(1.0, 1.0).row(1.0, 1.5).build();
        assertThat(strict.isValid(rows)).containsExactly(false, true);
        assertThat(new Inequality("start", "end", false).isValid(rows)).containsExactly(true, true);
    }

    @Test
    void needsDistinctColumns() {
        assertThatThrownBy(() -> new Inequality("a", "a", false)).isInstanceOf(ConfigurationException.class);
    }
}
