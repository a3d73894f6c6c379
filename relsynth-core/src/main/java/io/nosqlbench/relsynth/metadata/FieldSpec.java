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

import java.util.Objects;

/**
 * One column of a table as declared in the metadata.
 *
 * <pre>{@code
 * {"name": "user_id", "type": "id", "subtype": "integer",
 *  "ref": {"table": "users", "field": "user_id"}}
 * }</pre>
 *
 * <p>{@code subtype} is {@code integer} or {@code float} for numerical
 * fields and {@code integer} or {@code string} for ids. {@code format} is a
 * {@link String#format} pattern with one {@code %d} for string ids, or a
 * {@link java.time.format.DateTimeFormatter} pattern for datetimes stored
 * as strings.
 */
public class FieldSpec {

    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String STRING = "string";

    /** Reference to the primary key of another table. */
    public static class Ref {
        @SerializedName("table")
        private String table;

        @SerializedName("field")
        private String field;

        public Ref() {
        }

        public Ref(String table, String field) {
            this.table = table;
            this.field = field;
        }

        public String getTable() {
            return table;
        }

        public String getField() {
            return field;
        }
    }

    @SerializedName("name")
    private String name;

    @SerializedName("type")
    private FieldType type;

    @SerializedName("subtype")
    private String subtype;

    @SerializedName("format")
    private String format;

    @SerializedName("ref")
    private Ref ref;

    public FieldSpec() {
    }

    public FieldSpec(String name, FieldType type, String subtype, String format, Ref ref) {
        this.name = name;
        this.type = type;
        this.subtype = subtype;
        this.format = format;
        this.ref = ref;
    }

    public static FieldSpec id(String name) {
        return new FieldSpec(name, FieldType.ID, INTEGER, null, null);
    }

    public static FieldSpec stringId(String name, String format) {
        return new FieldSpec(name, FieldType.ID, STRING, format, null);
    }

    public static FieldSpec foreignKey(String name, String table, String field) {
        return new FieldSpec(name, FieldType.ID, INTEGER, null, new Ref(table, field));
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, FieldType.NUMERICAL, INTEGER, null, null);
    }

    public static FieldSpec decimal(String name) {
        return new FieldSpec(name, FieldType.NUMERICAL, FLOAT, null, null);
    }

    public static FieldSpec categorical(String name) {
        return new FieldSpec(name, FieldType.CATEGORICAL, null, null, null);
    }

    public static FieldSpec bool(String name) {
        return new FieldSpec(name, FieldType.BOOLEAN, null, null, null);
    }

    public static FieldSpec datetime(String name) {
        return new FieldSpec(name, FieldType.DATETIME, null, null, null);
    }

    public static FieldSpec datetime(String name, String format) {
        return new FieldSpec(name, FieldType.DATETIME, null, format, null);
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public String getSubtype() {
        return subtype;
    }

    public String getFormat() {
        return format;
    }

    public Ref getRef() {
        return ref;
    }

    public boolean isKey() {
        return type == FieldType.ID;
    }

    public boolean isForeignKey() {
        return type == FieldType.ID && ref != null;
    }

    public boolean isIntegerNumerical() {
        return type == FieldType.NUMERICAL && INTEGER.equals(subtype);
    }

    public boolean isStringId() {
        return type == FieldType.ID && STRING.equals(subtype);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSpec)) return false;
        FieldSpec that = (FieldSpec) o;
        return Objects.equals(name, that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + (type == null ? "?" : type.name().toLowerCase()) +
            (subtype == null ? "" : "/" + subtype) +
            (ref == null ? "" : "->" + ref.table + "." + ref.field);
    }
}
