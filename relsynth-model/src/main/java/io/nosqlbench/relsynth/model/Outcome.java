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

package io.nosqlbench.relsynth.model;

import java.util.List;
import java.util.Objects;

/// A value together with the degradations that occurred while producing it.
///
/// The extension engine returns the extended parent data with one warning per
/// child subset it had to replace by a degenerate model, and the sampler
/// returns one per parent row whose children could not be drawn. The value
/// is `null` when the work was skipped entirely.
///
/// @param value the produced value, or null when nothing could be produced
/// @param warnings human readable descriptions of each degradation
/// @param <T> the value type
public record Outcome<T>(T value, List<String> warnings) {

    public Outcome {
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings cannot be null"));
    }

    /// A clean outcome with no warnings.
    public static <T> Outcome<T> of(T value) {
        return new Outcome<>(value, List.of());
    }

    /// An outcome with no value.
    public static <T> Outcome<T> skipped(String warning) {
        return new Outcome<>(null, List.of(warning));
    }

    public boolean hasValue() {
        return value != null;
    }
}
