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

import io.nosqlbench.relsynth.ConfigurationException;

import java.util.List;

/// Numerical columns: the value itself, nulls imputed with the mean.
/// Integer columns round on decode.
public final class NumericalTransformer implements FieldTransformer {

    private final String column;
    private final boolean integer;
    private double mean;

    public NumericalTransformer(String column, boolean integer) {
        this.column = column;
        this.integer = integer;
    }

    @Override
    public void fit(List<Object> values) {
        double sum = 0;
        int count = 0;
        for (Object value : values) {
            if (value != null) {
                sum += toDouble(value);
                count++;
            }
        }
        mean = count == 0 ? 0.0 : sum / count;
    }

    @Override
    public double encode(Object value) {
        return value == null ? mean : toDouble(value);
    }

    @Override
    public Object decode(double value) {
        if (integer) {
            return Math.round(value);
        }
        return value;
    }

    private double toDouble(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw new ConfigurationException("Non-finite value " + d + " in numerical column " + column);
            }
            return d;
        }
        throw new ConfigurationException("Non-numeric value '" + value + "' in numerical column " + column);
    }
}
