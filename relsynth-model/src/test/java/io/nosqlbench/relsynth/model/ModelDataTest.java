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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelDataTest {

    private final ModelData data = new ModelData(List.of("a", "b"), new double[][]{{1, 2}, {3, 4}, {5, 6}});

    @Test
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> new ModelData(List.of("a", "b"), new double[][]{{1, 2}, {3}}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Row 1");
    }

    @Test
    void selectsRowsAndColumns() {
        ModelData picked = data.selectRows(List.of(2, 0)).selectColumns(List.of("b"));
        assertThat(picked.columns()).containsExactly("b");
        assertThat(picked.column(0)).containsExactly(6, 2);
    }

    @Test
    void appendsColumnsAndRows() {
        ModelData wider = data.appendColumns(List.of("c"), new double[][]{{7}, {8}, {9}});
        assertThat(wider.columns()).containsExactly("a", "b", "c");
        assertThat(wider.row(1)).containsExactly(3, 4, 8);

        ModelData taller = data.appendRows(data);
        assertThat(taller.rowCount()).isEqualTo(6);
        assertThatThrownBy(() -> data.appendRows(wider)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyMatrixKeepsColumns() {
        ModelData empty = ModelData.empty(List.of("x"));
        assertThat(empty.rowCount()).isZero();
        assertThat(empty.columnCount()).isEqualTo(1);
        assertThat(empty.indexOf("y")).isEqualTo(-1);
    }
}
