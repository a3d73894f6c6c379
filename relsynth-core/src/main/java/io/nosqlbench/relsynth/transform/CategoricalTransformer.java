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

package io.nosqlbench.relsynth.transform;

import io.nosqlbench.relsynth.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Categorical columns as frequency-ordered intervals of [0, 1].
///
/// ```
///   0.0        0.5          0.8    1.0
///    ├─────────┼────────────┼──────┤
///    │  "DE"   │    "US"    │ null │
///    └─────────┴────────────┴──────┘
/// ```
///
/// Each category owns an interval as wide as its relative frequency; the
/// most frequent category comes first. A value encodes to its interval's
/// midpoint and any number decodes to the category whose interval contains
/// it, after clamping to [0, 1]. Null is a category of its own.
public final class CategoricalTransformer implements FieldTransformer {

    private static final Object NULL = new Object() {
        @Override
        public String toString() {
            return "<null>";
        }
    };

    private final List<Object> categories = new ArrayList<>();
    private final Map<Object, Double> midpoints = new LinkedHashMap<>();
    private double[] upperBounds = new double[0];

    @Override
    public void fit(List<Object> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object value : values) {
            counts.merge(key(value), 1, Integer::sum);
        }
        List<Map.Entry<Object, Integer>> ordered = new ArrayList<>(counts.entrySet());
        // stable sort keeps first-seen order among equal counts
        ordered.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        categories.clear();
        midpoints.clear();
        upperBounds = new double[ordered.size()];
        double total = values.size();
        double start = 0.0;
        for (int i = 0; i < ordered.size(); i++) {
            Map.Entry<Object, Integer> entry = ordered.get(i);
            double end = i == ordered.size() - 1 ? 1.0 : start + entry.getValue() / total;
            categories.add(entry.getKey());
            midpoints.put(entry.getKey(), (start + end) / 2.0);
            upperBounds[i] = end;
            start = end;
        }
    }

    @Override
    public double encode(Object value) {
        Double midpoint = midpoints.get(key(value));
        if (midpoint == null) {
            throw new IllegalArgumentException("Unknown category: " + value);
        }
        return midpoint;
    }

    @Override
    public Object decode(double value) {
        if (categories.isEmpty()) {
            return null;
        }
        double clamped = Double.isNaN(value) ? 0.5 : Math.max(0.0, Math.min(1.0, value));
        int index = Arrays.binarySearch(upperBounds, clamped);
        if (index < 0) {
            index = -index - 1;
        } else {
            // exact boundary belongs to the next interval
            index = Math.min(index + 1, upperBounds.length - 1);
        }
        return value(categories.get(Math.min(index, categories.size() - 1)));
    }

    public List<Object> categories() {
        List<Object> values = new ArrayList<>();
        for (Object category : categories) {
            values.add(value(category));
        }
        return values;
    }

    private static Object key(Object value) {
        return value == null ? NULL : Table.normalizeKey(value);
    }

    private static Object value(Object key) {
        return Objects.equals(key, NULL) ? null : key;
    }
}
