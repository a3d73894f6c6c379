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

import io.nosqlbench.relsynth.table.Table;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SampleResultTest {

    private final Table users = Table.builder("users", "user_id").row(1L).build();
    private final Table orders = Table.builder("orders", "order_id", "user_id").row(1L, 1L).build();

    @Test
    void emptyWarningListsAreDropped() {
        SampleResult result = new SampleResult(Map.of("users", users), Map.of("users", List.of()));
        assertThat(result.hasWarnings()).isFalse();
        assertThat(result.warnings("users")).isEmpty();
        assertThat(result.table("users")).isSameAs(users);
        assertThatThrownBy(() -> result.table("orders")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeKeepsTablesAndWarnings() {
        SampleResult first = new SampleResult(Map.of("users", users), Map.of("users", List.of("a")));
        SampleResult second = new SampleResult(Map.of("orders", orders), Map.of("orders", List.of("b")));

        SampleResult merged = first.merge(second);
        assertThat(merged.tableNames()).containsExactly("users", "orders");
        assertThat(merged.allWarnings()).containsExactly("a", "b");
        assertThat(merged.warnings("orders")).containsExactly("b");
    }
}
