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

package io.nosqlbench.relsynth.metadata;

/// A foreign-key relationship: `table.column` references
/// `parentTable.parentColumn`.
///
/// @param table the child table
/// @param column the foreign-key column of the child
/// @param parentTable the referenced table
/// @param parentColumn the referenced primary key
public record ForeignKey(String table, String column, String parentTable, String parentColumn) {

    /// Prefix of the extension columns this relationship adds to the parent.
    public String summaryPrefix() {
        return "__" + table + "__" + column + "__";
    }

    @Override
    public String toString() {
        return table + "." + column + " -> " + parentTable + "." + parentColumn;
    }
}
