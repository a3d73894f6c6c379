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

package io.nosqlbench.relsynth.demo;

import io.nosqlbench.relsynth.metadata.ConstraintSpec;
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.table.Table;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/// A small users / sessions / transactions database for trying the engine.
///
/// ```
///   users(user_id, country, gender, age)
///     └── sessions(session_id, user_id, device_type, operative_system)
///           └── transactions(transaction_id, session_id, datetime, amount, approved)
/// ```
///
/// Keys start at 0. Every session belongs to a random user and every
/// transaction to a random session, so some parents have no children.
/// `age` carries a between constraint over `[18, 50]`.
public final class DemoDatabase {

    public static final String USERS = "users";
    public static final String SESSIONS = "sessions";
    public static final String TRANSACTIONS = "transactions";

    public static final int DEFAULT_ROWS = 10;

    private static final String[] COUNTRIES = {"Bulgaria", "Canada", "France", "Germany", "Spain", "United States"};
    private static final String[] GENDERS = {"M", "F", null};
    private static final String[] DEVICE_TYPES = {"MOBILE", "TABLET"};
    private static final String[] OPERATIVE_SYSTEMS = {"iOS", "android", "windows"};
    private static final String DATE_FORMAT = "yyyy-MM-dd";

    private final Metadata metadata;
    private final Map<String, Table> tables;

    private DemoDatabase(Metadata metadata, Map<String, Table> tables) {
        this.metadata = metadata;
        this.tables = tables;
    }

    public static DemoDatabase create(long seed) {
        return create(seed, DEFAULT_ROWS);
    }

    /// @param seed seed of the generator producing the rows
    /// @param rows rows per table, at least 1
    public static DemoDatabase create(long seed, int rows) {
        if (rows < 1) {
            throw new IllegalArgumentException("Demo tables need at least one row, got " + rows);
        }
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        Map<String, Table> tables = new LinkedHashMap<>();

        Table.Builder users = Table.builder(USERS, "user_id", "country", "gender", "age");
        for (long id = 0; id < rows; id++) {
            users.row(id, pick(rng, COUNTRIES), pick(rng, GENDERS), (long) (18 + rng.nextInt(33)));
        }
        tables.put(USERS, users.build());

        Table.Builder sessions = Table.builder(SESSIONS, "session_id", "user_id", "device_type", "operative_system");
        for (long id = 0; id < rows; id++) {
            sessions.row(id, (long) rng.nextInt(rows), pick(rng, DEVICE_TYPES), pick(rng, OPERATIVE_SYSTEMS));
        }
        tables.put(SESSIONS, sessions.build());

        DateTimeFormatter dates = DateTimeFormatter.ofPattern(DATE_FORMAT);
        Table.Builder transactions = Table.builder(TRANSACTIONS,
            "transaction_id", "session_id", "datetime", "amount", "approved");
        for (long id = 0; id < rows; id++) {
            LocalDate date = LocalDate.of(2016 + rng.nextInt(3), 1 + rng.nextInt(12), 1 + rng.nextInt(28));
            double amount = Math.round(rng.nextDouble() * 100_000) / 100.0;
            transactions.row(id, (long) rng.nextInt(rows), dates.format(date), amount, rng.nextBoolean());
        }
        tables.put(TRANSACTIONS, transactions.build());

        return new DemoDatabase(metadata(), tables);
    }

    /// Returns the demo metadata; it does not depend on the seed.
    public static Metadata metadata() {
        return Metadata.builder()
            .table(TableSpec.builder(USERS)
                .primaryKey("user_id")
                .fields(
                    FieldSpec.categorical("country"),
                    FieldSpec.categorical("gender"),
                    FieldSpec.integer("age"))
                .constraint(ConstraintSpec.between("age", 18, 50))
                .build())
            .table(TableSpec.builder(SESSIONS)
                .primaryKey("session_id")
                .foreignKey("user_id", USERS, "user_id")
                .fields(
                    FieldSpec.categorical("device_type"),
                    FieldSpec.categorical("operative_system"))
                .build())
            .table(TableSpec.builder(TRANSACTIONS)
                .primaryKey("transaction_id")
                .foreignKey("session_id", SESSIONS, "session_id")
                .fields(
                    FieldSpec.datetime("datetime", DATE_FORMAT),
                    FieldSpec.decimal("amount"),
                    FieldSpec.bool("approved"))
                .build())
            .build();
    }

    private static String pick(UniformRandomProvider rng, String[] choices) {
        return choices[rng.nextInt(choices.length)];
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Map<String, Table> getTables() {
        return tables;
    }
}
