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

package io.nosqlbench.relsynth;

import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.table.Table;

import java.util.LinkedHashMap;
import java.util.Map;

/// Small databases shared by the engine tests.
public final class Fixtures {

    /// Orders per user in [#usersOrders()]: 12 orders over 5 users.
    public static final long[] ORDERS_PER_USER = {0, 1, 2, 4, 5};

    private Fixtures() {
    }

    public static Metadata usersOrdersMetadata() {
        return Metadata.builder()
            .table(TableSpec.builder("users").primaryKey("user_id").build())
            .table(TableSpec.builder("orders")
                .primaryKey("order_id")
                .foreignKey("user_id", "users", "user_id")
                .build())
            .build();
    }

    public static Map<String, Table> usersOrders() {
        Table.Builder users = Table.builder("users", "user_id");
        Table.Builder orders = Table.builder("orders", "order_id", "user_id");
        long orderId = 100;
        for (int u = 0; u < ORDERS_PER_USER.length; u++) {
            long userId = 10 + u;
            users.row(userId);
            for (int o = 0; o < ORDERS_PER_USER[u]; o++) {
                orders.row(orderId++, userId);
            }
        }
        Map<String, Table> tables = new LinkedHashMap<>();
        tables.put("users", users.build());
        tables.put("orders", orders.build());
        return tables;
    }

    /// users(user_id, age, score) with 30 rows and orders(order_id, user_id, amount)
    /// with 0 to 3 orders per user.
    public static Metadata shopMetadata() {
        return Metadata.builder()
            .table(TableSpec.builder("users")
                .primaryKey("user_id")
                .fields(FieldSpec.integer("age"), FieldSpec.decimal("score"), FieldSpec.categorical("country"))
                .build())
            .table(TableSpec.builder("orders")
                .primaryKey("order_id")
                .foreignKey("user_id", "users", "user_id")
                .fields(FieldSpec.decimal("amount"))
                .build())
            .build();
    }

    public static Map<String, Table> shop() {
        String[] countries = {"DE", "US", "FR"};
        Table.Builder users = Table.builder("users", "user_id", "age", "score", "country");
        Table.Builder orders = Table.builder("orders", "order_id", "user_id", "amount");
        long orderId = 1;
        for (long u = 1; u <= 30; u++) {
            users.row(u, 20L + (u * 7) % 40, (u % 10) / 10.0 + 1.5, countries[(int) (u % 3)]);
            for (int o = 0; o < u % 4; o++) {
                orders.row(orderId++, u, 10.0 + o * 5.5 + u);
            }
        }
        Map<String, Table> tables = new LinkedHashMap<>();
        tables.put("users", users.build());
        tables.put("orders", orders.build());
        return tables;
    }
}
