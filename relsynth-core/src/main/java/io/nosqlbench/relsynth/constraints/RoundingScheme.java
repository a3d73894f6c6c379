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

package io.nosqlbench.relsynth.constraints;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;

/// Decimal precision learned from a column, restored after reverse transforms.
///
/// A column of integral values (`Long`, `Integer`, ...) rounds to `Long`;
/// otherwise values round to the largest number of decimal places observed,
/// capped at [#MAX_DIGITS].
public final class RoundingScheme {

    public static final int MAX_DIGITS = 15;

    private final boolean integral;
    private final int digits;

    private RoundingScheme(boolean integral, int digits) {
        this.integral = integral;
        this.digits = digits;
    }

    public static RoundingScheme learn(List<Object> values) {
        boolean integral = true;
        boolean any = false;
        int digits = 0;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            any = true;
            if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
                continue;
            }
            integral = false;
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                if (Double.isFinite(d)) {
                    int scale = BigDecimal.valueOf(d).stripTrailingZeros().scale();
                    digits = Math.max(digits, Math.min(MAX_DIGITS, scale));
                }
            }
        }
        if (!any) {
            return new RoundingScheme(false, MAX_DIGITS);
        }
        return new RoundingScheme(integral, integral ? 0 : digits);
    }

    public boolean isIntegral() {
        return integral;
    }

    public int digits() {
        return digits;
    }

    /// Rounds a value to the learned precision and value kind.
    public Object apply(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        if (integral) {
            return Math.round(value);
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /// Half of the smallest step the scheme can represent.
    public double halfStep() {
        return 0.5 * Math.pow(10, -digits);
    }

    @Override
    public String toString() {
        return integral ? "RoundingScheme[integral]" : "RoundingScheme[digits=" + digits + "]";
    }
}
