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

package io.nosqlbench.relsynth.command;

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.sampler.SampleResult;
import io.nosqlbench.relsynth.table.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Reads and writes tables as CSV files with a header row, one `<table>.csv`
/// per table.
///
/// Fields are separated by commas; a field containing a comma, a quote or a
/// line break is quoted, with quotes doubled inside. An empty field is null.
/// Values of declared columns are parsed by their field type: integer ids and
/// integer numericals as `Long`, other numericals as `Double`, booleans as
/// `Boolean`; everything else stays a string.
public final class CsvTableIO {
    private static final Logger logger = LogManager.getLogger(CsvTableIO.class);

    public static final String EXTENSION = ".csv";

    private CsvTableIO() {
    }

    /// Reads every used table of the metadata from `<dir>/<table>.csv`.
    ///
    /// @throws ConfigurationException if a file is missing or holds a value that does not parse
    public static Map<String, Table> readAll(Path dir, Metadata metadata) throws IOException {
        Map<String, Table> tables = new LinkedHashMap<>();
        for (TableSpec spec : metadata.tables()) {
            Path file = dir.resolve(spec.getName() + EXTENSION);
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("No CSV file for table " + spec.getName() + ": " + file);
            }
            tables.put(spec.getName(), read(file, spec));
        }
        return tables;
    }

    public static Table read(Path file, TableSpec spec) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<String> header = nextRecord(reader);
            if (header == null) {
                throw new ConfigurationException("CSV file " + file + " has no header row");
            }
            List<Optional<FieldSpec>> fields = new ArrayList<>(header.size());
            for (String column : header) {
                fields.add(spec.field(column));
            }

            List<Object[]> rows = new ArrayList<>();
            List<String> record;
            while ((record = nextRecord(reader)) != null) {
                if (record.size() == 1 && record.get(0).isEmpty()) {
                    continue;
                }
                if (record.size() != header.size()) {
                    throw new ConfigurationException("CSV file " + file + " row " + (rows.size() + 1) + " has " +
                        record.size() + " fields, the header has " + header.size());
                }
                Object[] row = new Object[header.size()];
                for (int c = 0; c < row.length; c++) {
                    row[c] = parse(record.get(c), fields.get(c).orElse(null), file, rows.size() + 1, header.get(c));
                }
                rows.add(row);
            }
            logger.debug("Read {} rows of {} from {}", rows.size(), spec.getName(), file);
            return new Table(spec.getName(), header, rows);
        }
    }

    /// Writes every table of the result to `<dir>/<table>.csv`, creating the directory.
    public static List<Path> writeAll(SampleResult result, Path dir) throws IOException {
        Files.createDirectories(dir);
        List<Path> written = new ArrayList<>();
        for (Table table : result.tables().values()) {
            Path file = dir.resolve(table.name() + EXTENSION);
            write(table, file);
            written.add(file);
        }
        return written;
    }

    public static void write(Table table, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(formatRecord(table.columns().toArray()));
            writer.newLine();
            for (int r = 0; r < table.rowCount(); r++) {
                writer.write(formatRecord(table.row(r)));
                writer.newLine();
            }
        }
        logger.debug("Wrote {} rows of {} to {}", table.rowCount(), table.name(), file);
    }

    static Object parse(String text, FieldSpec field, Path file, int row, String column) {
        if (text.isEmpty()) {
            return null;
        }
        if (field == null || field.getType() == null) {
            return text;
        }
        try {
            switch (field.getType()) {
                case ID:
                    return FieldSpec.STRING.equals(field.getSubtype()) ? text : Long.parseLong(text.trim());
                case NUMERICAL:
                    return field.isIntegerNumerical() ? Long.parseLong(text.trim()) : Double.parseDouble(text.trim());
                case BOOLEAN:
                    return parseBoolean(text.trim());
                default:
                    return text;
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("CSV file " + file + " row " + row + " column " + column +
                ": cannot parse '" + text + "' as " + field.getType().name().toLowerCase(Locale.ROOT), e);
        }
    }

    private static Boolean parseBoolean(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("not a boolean: " + text);
        }
    }

    /// Reads one record, which may span lines inside quotes; null at end of input.
    static List<String> nextRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inQuotes) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            current.append('"');
                            i++;
                        } else {
                            inQuotes = false;
                        }
                    } else {
                        current.append(c);
                    }
                } else if (c == '"') {
                    inQuotes = true;
                } else if (c == ',') {
                    fields.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            if (!inQuotes) {
                break;
            }
            line = reader.readLine();
            if (line == null) {
                throw new ConfigurationException("Unterminated quoted CSV field: " + current);
            }
            current.append('\n');
        }
        fields.add(current.toString());
        return fields;
    }

    static String formatRecord(Object[] values) {
        StringBuilder record = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                record.append(',');
            }
            Object value = values[i];
            if (value == null) {
                continue;
            }
            String text = value.toString();
            if (text.isEmpty() || text.indexOf(',') >= 0 || text.indexOf('"') >= 0
                || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                record.append('"').append(text.replace("\"", "\"\"")).append('"');
            } else {
                record.append(text);
            }
        }
        return record.toString();
    }
}
