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

package io.nosqlbench.relsynth.metadata;

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one constraint of a table.
 *
 * <p>The {@code constraint} key names the kind; the remaining keys depend
 * on it:
 *
 * <pre>{@code
 * {"constraint": "between", "column": "age", "low": 18, "high": 90}
 * {"constraint": "inequality", "low_column": "start", "high_column": "end", "strict": false}
 * {"constraint": "unique", "columns": ["email"]}
 * {"constraint": "column_formula", "column": "total",
 *  "terms": {"price": 1.0, "tax": 1.0}, "intercept": 0.0}
 * }</pre>
 */
public class ConstraintSpec {

    public static final String BETWEEN = "between";
    public static final String INEQUALITY = "inequality";
    public static final String UNIQUE = "unique";
    public static final String COLUMN_FORMULA = "column_formula";

    @SerializedName("constraint")
    private String constraint;

    @SerializedName("column")
    private String column;

    @SerializedName("low")
    private Double low;

    @SerializedName("high")
    private Double high;

    @SerializedName("low_column")
    private String lowColumn;

    @SerializedName("high_column")
    private String highColumn;

    @SerializedName("strict")
    private Boolean strict;

    @SerializedName("columns")
    private List<String> columns;

    @SerializedName("terms")
    private LinkedHashMap<String, Double> terms;

    @SerializedName("intercept")
    private Double intercept;

    public ConstraintSpec() {
    }

    public static ConstraintSpec between(String column, double low, double high) {
        ConstraintSpec spec = new ConstraintSpec();
        spec.constraint = BETWEEN;
        spec.column = column;
        spec.low = low;
        spec.high = high;
        return spec;
    }

    public static ConstraintSpec inequality(String lowColumn, String highColumn, boolean strict) {
        ConstraintSpec spec = new ConstraintSpec();
        spec.constraint = INEQUALITY;
        spec.lowColumn = lowColumn;
        spec.highColumn = highColumn;
        spec.strict = strict;
        return spec;
    }

    public static ConstraintSpec unique(String... columns) {
        ConstraintSpec spec = new ConstraintSpec();
        spec.constraint = UNIQUE;
        spec.columns = Arrays.asList(columns);
        return spec;
    }

    public static ConstraintSpec columnFormula(String column, Map<String, Double> terms, double intercept) {
        ConstraintSpec spec = new ConstraintSpec();
        spec.constraint = COLUMN_FORMULA;
        spec.column = column;
        spec.terms = new LinkedHashMap<>(terms);
        spec.intercept = intercept;
        return spec;
    }

    public String getConstraint() {
        return constraint;
    }

    public String getColumn() {
        return column;
    }

    public Double getLow() {
        return low;
    }

    public Double getHigh() {
        return high;
    }

    public String getLowColumn() {
        return lowColumn;
    }

    public String getHighColumn() {
        return highColumn;
    }

    public boolean isStrict() {
        return strict != null && strict;
    }

    public List<String> getColumns() {
        return columns;
    }

    public Map<String, Double> getTerms() {
        return terms;
    }

    public double getIntercept() {
        return intercept == null ? 0.0 : intercept;
    }

    @Override
    public String toString() {
        return "ConstraintSpec[" + constraint + "]";
    }
}
