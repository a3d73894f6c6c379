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

/// Boolean columns as 0/1, decoded with a 0.5 threshold. Nulls are imputed
/// with the most frequent value.
public final class BooleanTransformer implements FieldTransformer {

    private final String column;
    private boolean mode;

    public BooleanTransformer(String column) {
        this.column = column;
    }

    @Override
    public void fit(List<Object> values) {
        int trues = 0;
        int falses = 0;
        for (Object value : values) {
            if (value != null) {
                if (toBoolean(value)) {
                    trues++;
                } else {
                    falses++;
                }
            }
        }
        mode = trues > falses;
    }

    @Override
    public double encode(Object value) {
        boolean b = value == null ? mode : toBoolean(value);
        return b ? 1.0 : 0.0;
    }

    @Override
    public Object decode(double value) {
        return value >= 0.5;
    }

    private boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.equalsIgnoreCase("true")) {
                return true;
            }
            if (s.equalsIgnoreCase("false")) {
                return false;
            }
        }
        throw new ConfigurationException("Non-boolean value '" + value + "' in boolean column " + column);
    }
}
