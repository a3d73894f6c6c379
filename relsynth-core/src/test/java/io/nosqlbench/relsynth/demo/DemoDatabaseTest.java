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

import io.nosqlbench.relsynth.RelationalSynthesizer;
import io.nosqlbench.relsynth.SynthesizerConfig;
import io.nosqlbench.relsynth.metadata.MetadataValidator;
import io.nosqlbench.relsynth.sampler.SampleResult;
import io.nosqlbench.relsynth.table.Table;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DemoDatabaseTest {

    @Test
    void demoDataMatchesItsMetadata() {
        DemoDatabase demo = DemoDatabase.create(42);

        assertThat(demo.getTables()).containsOnlyKeys(
            DemoDatabase.USERS, DemoDatabase.SESSIONS, DemoDatabase.TRANSACTIONS);
        assertThat(demo.getTables().values()).allSatisfy(t -> assertThat(t.rowCount()).isEqualTo(10));
        assertThatCode(() -> MetadataValidator.validateData(demo.getMetadata(), demo.getTables()))
            .doesNotThrowAnyException();
        assertThat(demo.getTables().get(DemoDatabase.USERS).column("age"))
            .allSatisfy(age -> assertThat((Long) age).isBetween(18L, 50L));
    }

    @Test
    void sameSeedSameRows() {
        Table a = DemoDatabase.create(7, 25).getTables().get(DemoDatabase.TRANSACTIONS);
        Table b = DemoDatabase.create(7, 25).getTables().get(DemoDatabase.TRANSACTIONS);
        for (String column : a.columns()) {
            assertThat(b.column(column)).isEqualTo(a.column(column));
        }
    }

    @Test
    void rejectsEmptyTables() {
        assertThatThrownBy(() -> DemoDatabase.create(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void synthesizedDemoKeepsReferencesAndDomains() {
        DemoDatabase demo = DemoDatabase.create(3, 40);
        try (RelationalSynthesizer synthesizer = new RelationalSynthesizer(SynthesizerConfig.defaults().setSeed(3L))) {
            synthesizer.fit(demo.getMetadata(), demo.getTables());
            SampleResult result = synthesizer.sampleAll(30);

            Table users = result.table(DemoDatabase.USERS);
            Table sessions = result.table(DemoDatabase.SESSIONS);
            Table transactions = result.table(DemoDatabase.TRANSACTIONS);
            Set<Object> userIds = new HashSet<>(users.column("user_id"));
            Set<Object> sessionIds = new HashSet<>(sessions.column("session_id"));

            assertThat(users.rowCount()).isEqualTo(30);
            assertThat(userIds).hasSize(30);
            assertThat(sessions.column("user_id")).allSatisfy(id -> assertThat(userIds).contains(id));
            assertThat(transactions.column("session_id")).allSatisfy(id -> assertThat(sessionIds).contains(id));

            assertThat(users.column("age")).allSatisfy(age -> assertThat((Long) age).isBetween(18L, 50L));
            assertThat(users.column("country")).allSatisfy(c -> assertThat(c).isIn(
                "Bulgaria", "Canada", "France", "Germany", "Spain", "United States"));
            assertThat(sessions.column("device_type")).allSatisfy(d -> assertThat(d).isIn("MOBILE", "TABLET"));
            assertThat(transactions.column("approved")).allSatisfy(a -> assertThat(a).isInstanceOf(Boolean.class));
            assertThat(transactions.column("datetime")).allSatisfy(d -> assertThat(d).isInstanceOf(String.class));
            assertThat(transactions.column("datetime")).allSatisfy(d -> assertThat(LocalDate.parse((String) d)).isNotNull());
        }
    }
}
