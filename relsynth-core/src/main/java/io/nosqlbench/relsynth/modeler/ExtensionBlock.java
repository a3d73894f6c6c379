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

package io.nosqlbench.relsynth.modeler;

import io.nosqlbench.relsynth.metadata.ForeignKey;

import java.util.ArrayList;
import java.util.List;

/// The columns one child relationship appends to its parent.
///
/// ```
///   __<child>__<fk>__child_rows | __<child>__<fk>__<p0> | ... | __<child>__<fk>__<pk>
/// ```
///
/// @param relationship the child's foreign key
/// @param parameterNames the child family's parameter names, in vector order
public record ExtensionBlock(ForeignKey relationship, List<String> parameterNames) {

    public static final String CHILD_ROWS = "child_rows";

    public ExtensionBlock {
        parameterNames = List.copyOf(parameterNames);
    }

    public String countColumn() {
        return relationship.summaryPrefix() + CHILD_ROWS;
    }

    public List<String> parameterColumns() {
        List<String> columns = new ArrayList<>(parameterNames.size());
        for (String name : parameterNames) {
            columns.add(relationship.summaryPrefix() + name);
        }
        return columns;
    }

    /// Returns the count column followed by the parameter columns.
    public List<String> columns() {
        List<String> columns = new ArrayList<>(parameterNames.size() + 1);
        columns.add(countColumn());
        columns.addAll(parameterColumns());
        return columns;
    }

    public int width() {
        return parameterNames.size() + 1;
    }
}
