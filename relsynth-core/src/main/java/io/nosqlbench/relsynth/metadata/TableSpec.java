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

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One table as declared in the metadata: its fields in column order, its
 * primary key and its ordered constraints.
 */
public class TableSpec {

    @SerializedName("name")
    private String name;

    @SerializedName("primary_key")
    private String primaryKey;

    @SerializedName("fields")
    private List<FieldSpec> fields = new ArrayList<>();

    @SerializedName("constraints")
    private List<ConstraintSpec> constraints = new ArrayList<>();

    @SerializedName("use")
    private Boolean use;

    public TableSpec() {
    }

    public TableSpec(String name, String primaryKey, List<FieldSpec> fields, List<ConstraintSpec> constraints) {
        this.name = name;
        this.primaryKey = primaryKey;
        this.fields = new ArrayList<>(fields);
        this.constraints = new ArrayList<>(constraints);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public List<FieldSpec> getFields() {
        return fields == null ? List.of() : List.copyOf(fields);
    }

    public List<ConstraintSpec> getConstraints() {
        return constraints == null ? List.of() : List.copyOf(constraints);
    }

    /**
     * Tables with {@code "use": false} are ignored.
     */
    public boolean isUsed() {
        return use == null || use;
    }

    public Optional<FieldSpec> field(String fieldName) {
        return getFields().stream().filter(f -> fieldName.equals(f.getName())).findFirst();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (FieldSpec field : getFields()) {
            names.add(field.getName());
        }
        return names;
    }

    /**
     * Returns the key columns: the primary key and every foreign key.
     */
    public List<String> keyColumns() {
        List<String> keys = new ArrayList<>();
        for (FieldSpec field : getFields()) {
            if (field.isKey()) {
                keys.add(field.getName());
            }
        }
        return keys;
    }

    /**
     * Returns the foreign keys in declaration order.
     */
    public List<ForeignKey> foreignKeys() {
        List<ForeignKey> keys = new ArrayList<>();
        for (FieldSpec field : getFields()) {
            if (field.isForeignKey()) {
                keys.add(new ForeignKey(name, field.getName(), field.getRef().getTable(), field.getRef().getField()));
            }
        }
        return keys;
    }

    @Override
    public String toString() {
        return "TableSpec[" + name + ", pk=" + primaryKey + ", fields=" + getFields() + "]";
    }

    /**
     * Fluent construction of a table declaration in code.
     */
    public static final class Builder {
        private final String name;
        private String primaryKey;
        private final List<FieldSpec> fields = new ArrayList<>();
        private final List<ConstraintSpec> constraints = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Declares an integer primary key column. */
        public Builder primaryKey(String column) {
            this.primaryKey = column;
            fields.add(FieldSpec.id(column));
            return this;
        }

        /** Declares a primary key column with an explicit field spec. */
        public Builder primaryKey(FieldSpec field) {
            this.primaryKey = field.getName();
            fields.add(field);
            return this;
        }

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder fields(FieldSpec... specs) {
            fields.addAll(Arrays.asList(specs));
            return this;
        }

        public Builder foreignKey(String column, String parentTable, String parentColumn) {
            fields.add(FieldSpec.foreignKey(column, parentTable, parentColumn));
            return this;
        }

        public Builder constraint(ConstraintSpec constraint) {
            constraints.add(constraint);
            return this;
        }

        public TableSpec build() {
            return new TableSpec(name, primaryKey, fields, constraints);
        }
    }
}
