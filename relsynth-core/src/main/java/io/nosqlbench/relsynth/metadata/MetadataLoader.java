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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.relsynth.ConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads and writes metadata JSON.
///
/// ```json
/// {"tables": [
///   {"name": "users", "primary_key": "user_id",
///    "fields": [{"name": "user_id", "type": "id", "subtype": "integer"}, ...],
///    "constraints": [{"constraint": "between", "column": "age", "low": 18, "high": 90}]}
/// ]}
/// ```
///
/// Parsing only checks that the document is well formed; structural checks
/// belong to [MetadataValidator].
public final class MetadataLoader {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private MetadataLoader() {
        // Utility class
    }

    private static final class Document {
        @SerializedName("tables")
        private List<TableSpec> tables = new ArrayList<>();
    }

    /// Parses metadata from a JSON string.
    ///
    /// @throws ConfigurationException if the JSON is malformed
    public static Metadata fromJson(String json) {
        return read(new StringReader(json), "<string>");
    }

    /// Loads metadata from a JSON file.
    ///
    /// @throws IOException if the file cannot be read
    /// @throws ConfigurationException if the JSON is malformed
    public static Metadata load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return read(reader, path.toString());
        }
    }

    public static String toJson(Metadata metadata) {
        Document document = new Document();
        document.tables = metadata.tables();
        return GSON.toJson(document);
    }

    public static void save(Metadata metadata, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(toJson(metadata));
        }
    }

    private static Metadata read(Reader reader, String source) {
        Document document;
        try {
            document = GSON.fromJson(reader, Document.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed metadata " + source + ": " + e.getMessage(), e);
        }
        if (document == null || document.tables == null) {
            throw new ConfigurationException("Metadata " + source + " declares no tables");
        }
        try {
            return new Metadata(document.tables);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid metadata " + source + ": " + e.getMessage(), e);
        }
    }
}
