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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/// Datetime columns as epoch milliseconds (UTC).
///
/// Decoding produces the value kind observed while fitting: an [Instant],
/// [LocalDateTime], [LocalDate] or [OffsetDateTime], or a string in the
/// declared `format` (ISO local date-time when none is declared). Nulls are
/// imputed with the mean instant.
public final class DatetimeTransformer implements FieldTransformer {

    private enum Kind { INSTANT, LOCAL_DATE_TIME, LOCAL_DATE, OFFSET_DATE_TIME, STRING_DATE_TIME, STRING_DATE }

    private final String column;
    private final DateTimeFormatter formatter;
    private Kind kind = Kind.INSTANT;
    private double mean;

    /// @param column the column name, for error messages
    /// @param format a [DateTimeFormatter] pattern for string values, or null
    public DatetimeTransformer(String column, String format) {
        this.column = column;
        this.formatter = format == null ? DateTimeFormatter.ISO_LOCAL_DATE_TIME : DateTimeFormatter.ofPattern(format);
    }

    @Override
    public void fit(List<Object> values) {
        double sum = 0;
        int count = 0;
        Kind observed = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            Kind valueKind = kindOf(value);
            if (observed == null) {
                observed = valueKind;
            }
            sum += toMillis(value);
            count++;
        }
        kind = observed == null ? Kind.INSTANT : observed;
        mean = count == 0 ? 0.0 : sum / count;
    }

    @Override
    public double encode(Object value) {
        return value == null ? mean : toMillis(value);
    }

    @Override
    public Object decode(double value) {
        Instant instant = Instant.ofEpochMilli(Math.round(value));
        switch (kind) {
            case LOCAL_DATE_TIME:
                return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
            case LOCAL_DATE:
                return LocalDate.ofInstant(instant, ZoneOffset.UTC);
            case OFFSET_DATE_TIME:
                return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
            case STRING_DATE_TIME:
                return formatter.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
            case STRING_DATE:
                return formatter.format(LocalDate.ofInstant(instant, ZoneOffset.UTC));
            default:
                return instant;
        }
    }

    private Kind kindOf(Object value) {
        if (value instanceof Instant) return Kind.INSTANT;
        if (value instanceof LocalDateTime) return Kind.LOCAL_DATE_TIME;
        if (value instanceof LocalDate) return Kind.LOCAL_DATE;
        if (value instanceof OffsetDateTime) return Kind.OFFSET_DATE_TIME;
        if (value instanceof String) {
            return parse((String) value).isSupported(ChronoField.HOUR_OF_DAY)
                ? Kind.STRING_DATE_TIME : Kind.STRING_DATE;
        }
        throw new ConfigurationException("Unsupported datetime value '" + value + "' in column " + column);
    }

    private double toMillis(Object value) {
        if (value instanceof Instant) {
            return ((Instant) value).toEpochMilli();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant().toEpochMilli();
        }
        if (value instanceof String) {
            TemporalAccessor parsed = parse((String) value);
            if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
            }
            return LocalDate.from(parsed).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        throw new ConfigurationException("Unsupported datetime value '" + value + "' in column " + column);
    }

    private TemporalAccessor parse(String value) {
        try {
            return formatter.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Unparseable datetime '" + value + "' in column " + column, e);
        }
    }
}
