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

package io.nosqlbench.relsynth.sampler;

import io.nosqlbench.relsynth.metadata.FieldSpec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// Issues primary keys: one monotonic counter per table, starting at 1.
///
/// Integer keys are the counter value. String keys are the counter
/// rendered through the field's `format` (a [String#format] pattern with
/// one `%d`), or its decimal string when no format is declared. Counters
/// continue across sampling calls until [#reset()].
public final class KeyAllocator {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public long next(String table) {
        return counters.computeIfAbsent(table, t -> new AtomicLong()).incrementAndGet();
    }

    /// Returns the next key of a table in the representation of its key field.
    public Object nextKey(String table, FieldSpec keyField) {
        long value = next(table);
        if (keyField.isStringId()) {
            String format = keyField.getFormat();
            return format == null ? Long.toString(value) : String.format(format, value);
        }
        return value;
    }

    /// Returns the last key issued for a table, 0 when none was.
    public long last(String table) {
        AtomicLong counter = counters.get(table);
        return counter == null ? 0 : counter.get();
    }

    public void reset() {
        counters.clear();
    }
}
