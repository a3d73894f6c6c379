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

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.table.Table;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks metadata and raw tables before anything is fitted.
 *
 * <p>All problems raise {@link ConfigurationException}. Cycles in the
 * foreign-key graph are detected by
 * {@link io.nosqlbench.relsynth.graph.RelationshipGraph}, constraint
 * declarations by {@link io.nosqlbench.relsynth.constraints.ConstraintFactory}.
 */
public final class MetadataValidator {

    private MetadataValidator() {
        // Utility class
    }

    /**
     * Validates the declarations alone.
     *
     * @param metadata the metadata to check
     * @throws ConfigurationException on the first problem found
     */
    public static void validate(Metadata metadata) {
        if (metadata.tables().isEmpty()) {
            throw new ConfigurationException("Metadata declares no tables");
        }
        for (TableSpec table : metadata.tables()) {
            validateTable(metadata, table);
        }
    }

    private static void validateTable(Metadata metadata, TableSpec table) {
        String name = table.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Table without a name");
        }
        if (table.getFields().isEmpty()) {
            throw new ConfigurationException("Table " + name + " declares no fields");
        }
        Set<String> seen = new HashSet<>();
        for (FieldSpec field : table.getFields()) {
            String fieldName = field.getName();
            if (fieldName == null || fieldName.isBlank()) {
                throw new ConfigurationException("Table " + name + " has a field without a name");
            }
            if (!seen.add(fieldName)) {
                throw new ConfigurationException("Table " + name + " declares field " + fieldName + " twice");
            }
            if (fieldName.startsWith("__")) {
                throw new ConfigurationException("Field names starting with __ are reserved: " + name + "." + fieldName);
            }
            if (field.getType() == null) {
                throw new ConfigurationException("Field " + name + "." + fieldName + " has no or an unknown type");
            }
            validateSubtype(name, field);
            if (field.isStringId() && field.getFormat() != null) {
                validateKeyFormat(name, field);
            }
            if (field.isKey() && !fieldName.equals(table.getPrimaryKey()) && !field.isForeignKey()) {
                throw new ConfigurationException("Id field " + name + "." + fieldName +
                    " must be the primary key or reference another table");
            }
            if (field.isForeignKey()) {
                validateReference(metadata, table, field);
            }
        }
        String primaryKey = table.getPrimaryKey();
        if (primaryKey == null) {
            throw new ConfigurationException("Table " + name + " declares no primary key");
        }
        FieldSpec pk = table.field(primaryKey).orElseThrow(() ->
            new ConfigurationException("Primary key " + name + "." + primaryKey + " is not a declared field"));
        if (!pk.isKey() || pk.isForeignKey()) {
            throw new ConfigurationException("Primary key " + name + "." + primaryKey + " must be an id field without ref");
        }
    }

    private static void validateSubtype(String table, FieldSpec field) {
        String subtype = field.getSubtype();
        if (subtype == null) {
            return;
        }
        switch (field.getType()) {
            case ID:
                if (!FieldSpec.INTEGER.equals(subtype) && !FieldSpec.STRING.equals(subtype)) {
                    throw new ConfigurationException("Id field " + table + "." + field.getName() +
                        " has unsupported subtype " + subtype);
                }
                break;
            case NUMERICAL:
                if (!FieldSpec.INTEGER.equals(subtype) && !FieldSpec.FLOAT.equals(subtype)) {
                    throw new ConfigurationException("Numerical field " + table + "." + field.getName() +
                        " has unsupported subtype " + subtype);
                }
                break;
            default:
                break;
        }
    }

    private static void validateKeyFormat(String table, FieldSpec field) {
        String format = field.getFormat();
        try {
            if (String.format(format, 1L).equals(String.format(format, 2L))) {
                throw new ConfigurationException("Key format '" + format + "' of " + table + "." + field.getName() +
                    " does not include the key number");
            }
        } catch (IllegalFormatException e) {
            throw new ConfigurationException("Invalid key format '" + format + "' of " + table + "." +
                field.getName() + ": " + e.getMessage(), e);
        }
    }

    private static void validateReference(Metadata metadata, TableSpec table, FieldSpec field) {
        FieldSpec.Ref ref = field.getRef();
        String where = table.getName() + "." + field.getName();
        if (ref.getTable() == null || !metadata.hasTable(ref.getTable())) {
            throw new ConfigurationException("Foreign key " + where + " references unknown table " + ref.getTable());
        }
        TableSpec parent = metadata.table(ref.getTable());
        if (ref.getField() == null || !ref.getField().equals(parent.getPrimaryKey())) {
            throw new ConfigurationException("Foreign key " + where + " must reference the primary key of " +
                parent.getName() + ", not " + ref.getField());
        }
    }

    /**
     * Validates raw tables against their declarations.
     *
     * @param metadata validated metadata
     * @param tables raw tables by name
     * @throws ConfigurationException on the first problem found
     */
    public static void validateData(Metadata metadata, Map<String, Table> tables) {
        Map<String, Set<Object>> primaryKeys = new HashMap<>();
        for (TableSpec spec : metadata.tables()) {
            Table table = tables.get(spec.getName());
            if (table == null) {
                throw new ConfigurationException("No data for table " + spec.getName());
            }
            if (table.rowCount() == 0) {
                throw new ConfigurationException("Table " + spec.getName() + " is empty");
            }
            for (String column : spec.columnNames()) {
                if (!table.hasColumn(column)) {
                    throw new ConfigurationException("Table " + spec.getName() + " is missing declared column " + column);
                }
            }
            primaryKeys.put(spec.getName(), primaryKeySet(spec, table));
        }
        for (TableSpec spec : metadata.tables()) {
            Table table = tables.get(spec.getName());
            for (ForeignKey fk : spec.foreignKeys()) {
                Set<Object> parentKeys = primaryKeys.get(fk.parentTable());
                List<Object> values = table.column(fk.column());
                for (int r = 0; r < values.size(); r++) {
                    Object key = Table.normalizeKey(values.get(r));
                    if (key != null && !parentKeys.contains(key)) {
                        throw new ConfigurationException("Foreign key " + fk + " value " + key + " in row " + r +
                            " has no matching parent row");
                    }
                }
            }
        }
    }

    private static Set<Object> primaryKeySet(TableSpec spec, Table table) {
        Set<Object> keys = new HashSet<>();
        List<Object> values = table.column(spec.getPrimaryKey());
        for (int r = 0; r < values.size(); r++) {
            Object key = Table.normalizeKey(values.get(r));
            if (key == null) {
                throw new ConfigurationException("Primary key " + spec.getName() + "." + spec.getPrimaryKey() +
                    " is null in row " + r);
            }
            if (!keys.add(key)) {
                throw new ConfigurationException("Primary key " + spec.getName() + "." + spec.getPrimaryKey() +
                    " has duplicate value " + key);
            }
        }
        return keys;
    }
}
