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

import java.util.List;

/// Reversible encoding of one column's boxed values as doubles.
///
/// A transformer is fitted once on the column it encodes and then maps
/// values in both directions. Decoding accepts any finite double, including
/// values never produced by encoding.
public interface FieldTransformer {

    /// Learns the encoding from a column's raw values.
    ///
    /// @param values the column values, possibly containing nulls
    void fit(List<Object> values);

    /// Encodes one value; nulls are imputed.
    double encode(Object value);

    /// Decodes one model-space value back to the column's value kind.
    Object decode(double value);
}
