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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MetadataLoaderTest {

    private static final String JSON = "{\"tables\": [\n" +
        "  {\"name\": \"users\", \"primary_key\": \"user_id\",\n" +
        "   \"fields\": [\n" +
        "     {\"name\": \"user_id\", \"type\": \"id\", \"subtype\": \"integer\"},\n" +
        "     {\"name\": \"country\", \"type\": \"categorical\"},\n" +
        "     {\"name\": \"age\", \"type\": \"numerical\", \"subtype\": \"integer\"}],\n" +
        "   \"constraints\": [{\"constraint\": \"between\", \"column\": \"age\", \"low\": 18, \"high\": 90}]},\n" +
        "  {\"name\": \"sessions\", \"primary_key\": \"session_id\",\n" +
        "   \"fields\": [\n" +
        "     {\"name\": \"session_id\", \"type\": \"id\", \"subtype\": \"string\", \"format\": \"S-%05d\"},\n" +
        "     {\"name\": \"user_id\", \"type\": \"id\", \"ref\": {\"table\": \"users\", \"field\": \"user_id\"}}]},\n" +
        "  {\"name\": \"ignored\", \"use\": false, \"fields\": []}\n" +
        "]}";

    @Test
    void parsesTablesFieldsAndConstraints() {
        Metadata metadata = MetadataLoader.fromJson(JSON);

        assertThat(metadata.tableNames()).containsExactly("users", "sessions");
        TableSpec users = metadata.table("users");
        assertThat(users.getPrimaryKey()).isEqualTo("user_id");
        assertThat(users.columnNames()).containsExactly("user_id", "country", "age");
        assertThat(users.field("age")).get().extracting(FieldSpec::getType).isEqualTo(FieldType.NUMERICAL);
        assertThat(users.field("age").get().isIntegerNumerical()).isTrue();

        ConstraintSpec between = metadata.constraints("users").get(0);
        assertThat(between.getConstraint()).isEqualTo(ConstraintSpec.BETWEEN);
        assertThat(between.getLow()).isEqualTo(18.0);
        assertThat(between.getHigh()).isEqualTo(90.0);

        TableSpec sessions = metadata.table("sessions");
        assertThat(sessions.field("session_id").get().isStringId()).isTrue();
        assertThat(sessions.field("session_id").get().getFormat()).isEqualTo("S-%05d");
        assertThat(metadata.foreignKeys("sessions"))
            .containsExactly(new ForeignKey("sessions", "user_id", "users", "user_id"));
        assertThat(sessions.keyColumns()).containsExactly("session_id", "user_id");

        MetadataValidator.validate(metadata);
    }

    @Test
    void savedMetadataLoadsBack(@TempDir Path dir) throws IOException {
        Metadata metadata = MetadataLoader.fromJson(JSON);
        Path file = dir.resolve("metadata.json");
        MetadataLoader.save(metadata, file);

        Metadata loaded = MetadataLoader.load(file);
        assertThat(loaded.tableNames()).isEqualTo(metadata.tableNames());
        assertThat(loaded.table("users").getFields()).isEqualTo(metadata.table("users").getFields());
        assertThat(loaded.constraints("users").get(0).getColumn()).isEqualTo("age");
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThatThrownBy(() -> MetadataLoader.fromJson("{\"tables\": [ {\"name\": "))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void duplicateTablesAreAConfigurationError() {
        String json = "{\"tables\": [{\"name\": \"a\", \"fields\": []}, {\"name\": \"a\", \"fields\": []}]}";
        assertThatThrownBy(() -> MetadataLoader.fromJson(json))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void unknownTableLookupFails() {
        Metadata metadata = MetadataLoader.fromJson(JSON);
        assertThat(metadata.hasTable("ignored")).isFalse();
        assertThatThrownBy(() -> metadata.table("ignored")).isInstanceOf(IllegalArgumentException.class);
    }
}
