/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.frames;

import java.time.Duration;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;
import java.time.temporal.TemporalField;
import java.time.temporal.TemporalUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Calendar values: dates, datetimes and times of day. Adds the calendar-field filters and constraints
 * ({@code inMonths}, {@code ninHours}, ...), the total reducers measuring the span between the minimum and maximum
 * value, the delta arithmetic transformers, and the unit casters.
 *
 * @param <T> the java.time type of the values
 */
abstract class TemporalType<T extends Temporal & Comparable<? super T>> extends ComparableType<T> {
    /** Calendar fields by the suffix of their filter and constraint names. */
    static final Map<String, TemporalField> FIELDS = new LinkedHashMap<>();
    /** Calendar fields by the name accepted by the {@code unit} caster. */
    static final Map<String, TemporalField> UNIT_FIELDS = new LinkedHashMap<>();
    /** Units by the suffix of their total reducer and add transformer names. */
    static final Map<String, TemporalUnit> UNITS = new LinkedHashMap<>();
    
    static {
        FIELDS.put("Years", ChronoField.YEAR);
        FIELDS.put("Months", ChronoField.MONTH_OF_YEAR);
        FIELDS.put("Days", ChronoField.DAY_OF_MONTH);
        FIELDS.put("WeekDays", ChronoField.DAY_OF_WEEK);
        FIELDS.put("Weeks", ChronoField.ALIGNED_WEEK_OF_YEAR);
        FIELDS.put("Quarters", IsoFields.QUARTER_OF_YEAR);
        FIELDS.put("Hours", ChronoField.HOUR_OF_DAY);
        FIELDS.put("Minutes", ChronoField.MINUTE_OF_HOUR);
        FIELDS.put("Seconds", ChronoField.SECOND_OF_MINUTE);
        
        UNIT_FIELDS.put("year", ChronoField.YEAR);
        UNIT_FIELDS.put("quarter", IsoFields.QUARTER_OF_YEAR);
        UNIT_FIELDS.put("month", ChronoField.MONTH_OF_YEAR);
        UNIT_FIELDS.put("week", ChronoField.ALIGNED_WEEK_OF_YEAR);
        UNIT_FIELDS.put("weekDay", ChronoField.DAY_OF_WEEK);
        UNIT_FIELDS.put("day", ChronoField.DAY_OF_MONTH);
        UNIT_FIELDS.put("hour", ChronoField.HOUR_OF_DAY);
        UNIT_FIELDS.put("minute", ChronoField.MINUTE_OF_HOUR);
        UNIT_FIELDS.put("second", ChronoField.SECOND_OF_MINUTE);
        UNIT_FIELDS.put("ms", ChronoField.MILLI_OF_SECOND);
        
        UNITS.put("Years", ChronoUnit.YEARS);
        UNITS.put("Quarters", IsoFields.QUARTER_YEARS);
        UNITS.put("Months", ChronoUnit.MONTHS);
        UNITS.put("Weeks", ChronoUnit.WEEKS);
        UNITS.put("Days", ChronoUnit.DAYS);
        UNITS.put("Hours", ChronoUnit.HOURS);
        UNITS.put("Minutes", ChronoUnit.MINUTES);
        UNITS.put("Seconds", ChronoUnit.SECONDS);
        UNITS.put("Ms", ChronoUnit.MILLIS);
    }
    
    /**
     * @param kind the value kind
     * @param fields the calendar fields (keys of {@link #FIELDS}) this kind can filter and constrain on
     * @param filterOnlyFields the calendar fields this kind can filter, but not constrain, on
     * @param units the units (keys of {@link #UNITS}) this kind can add and total
     * @param totalOnlyUnits the units this kind can total, but not add
     */
    TemporalType(ValueKind kind, List<String> fields, List<String> filterOnlyFields,
                 List<String> units, List<String> totalOnlyUnits) {
        super(kind);
        List<String> filterFields = new ArrayList<>(fields);
        filterFields.addAll(filterOnlyFields);
        for (String name : filterFields) {
            TemporalField field = FIELDS.get(name);
            filter("in" + name, (series, operand) ->
                keysWhere(series, (key, value) -> value != null && hasField(operand, value.get(field))));
            filter("nin" + name, (series, operand) ->
                keysWhere(series, (key, value) -> value != null && !hasField(operand, value.get(field))));
        }
        for (String name : fields) {
            TemporalField field = FIELDS.get(name);
            constraint("in" + name, (value, param) -> value == null || hasField(param, value.get(field)));
            constraint("nin" + name, (value, param) -> value == null || !hasField(param, value.get(field)));
        }
        
        List<String> totalUnits = new ArrayList<>(units);
        totalUnits.addAll(totalOnlyUnits);
        for (String name : totalUnits) {
            TemporalUnit unit = UNITS.get(name);
            reducer("total" + name, ValueKind.NUMBER, (series, args) -> {
                List<T> sorted = sortedValues(series);
                return sorted.isEmpty() ? 0 : unit.between(sorted.get(0), sorted.get(sorted.size() - 1));
            });
        }
        for (String name : units) {
            TemporalUnit unit = UNITS.get(name);
            transformer("add" + name, (series, args) -> {
                long amount = (long) Utils.number(Utils.arg(args, 0), 0);
                return series.mapValues(this, v -> v.plus(amount, unit));
            });
        }
        transformer("add", (series, args) -> {
            TemporalAmount amount = amount(Utils.arg(args, 0));
            return series.mapValues(this, v -> v.plus(amount));
        });
        transformer("sub", (series, args) -> {
            TemporalAmount amount = amount(Utils.arg(args, 0));
            return series.mapValues(this, v -> v.minus(amount));
        });
        
        caster("toNumber", (series, args) -> series.mapValues(ValueType.NUMBER, this::toMillis));
        caster("format", (series, args) -> {
            Object pattern = Utils.arg(args, 0);
            if (pattern == null)
                throw new IllegalArgumentException("Expected a format pattern");
            Object locale = Utils.arg(args, 1);
            DateTimeFormatter formatter = locale == null
                ? DateTimeFormatter.ofPattern(pattern.toString())
                : DateTimeFormatter.ofPattern(pattern.toString(), Locale.forLanguageTag(locale.toString()));
            return series.mapValues(ValueType.STRING, formatter::format);
        });
        caster("unit", (series, args) -> {
            TemporalField field = unitField(Utils.arg(args, 0));
            return series.mapValues(ValueType.NUMBER, v -> v.get(field));
        });
        caster("cumsum", (series, args) -> {
            TemporalUnit unit = totalUnit(Utils.arg(args, 0), totalUnits);
            List<T> sorted = sortedValues(series);
            T min = sorted.isEmpty() ? null : sorted.get(0);
            return series.mapValues(ValueType.NUMBER, v -> unit.between(min, v));
        });
        caster("delta", (series, args) -> {
            TemporalUnit unit = totalUnit(Utils.arg(args, 0), totalUnits);
            Series<T> sorted = series.clone().sort(false);
            Series<Double> deltas = Series.empty(ValueType.NUMBER, series.name());
            T previous = null;
            for (Map.Entry<Integer, T> entry : sorted) {
                T value = entry.getValue();
                if (value == null)
                    deltas.put(entry.getKey(), null);
                else {
                    deltas.put(entry.getKey(), previous == null ? 0.0 : (double) unit.between(previous, value));
                    previous = value;
                }
            }
            return deltas;
        });
    }
    
    /**
     * Converts a value to epoch milliseconds (UTC), or milliseconds of day for times.
     */
    abstract long toMillis(T value);
    
    /**
     * The inverse of {@link #toMillis}.
     */
    abstract T fromMillis(long millis);
    
    @Override
    T midpoint(T a, T b) {
        return fromMillis(Math.floorDiv(toMillis(a) + toMillis(b), 2L));
    }
    
    private static boolean hasField(Object param, int fieldValue) {
        for (Object candidate : Utils.asList(param))
            if (candidate != null && Utils.integer(candidate, -1) == fieldValue)
                return true;
        return false;
    }
    
    /**
     * Parses a delta: a {@code Period} or {@code Duration}, or its ISO-8601 text.
     */
    static TemporalAmount amount(Object raw) {
        if (raw instanceof TemporalAmount)
            return (TemporalAmount) raw;
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            try {
                return text.contains("T") ? Duration.parse(text) : Period.parse(text);
            } catch (java.time.format.DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid delta: " + raw, e);
            }
        }
        throw new IllegalArgumentException("Invalid delta: " + raw);
    }
    
    private TemporalField unitField(Object name) {
        TemporalField field = name == null ? null : UNIT_FIELDS.get(name.toString());
        if (field == null || !isSupported(field))
            throw new IllegalArgumentException(kind().label() + " series does not have unit: " + name);
        return field;
    }
    
    private TemporalUnit totalUnit(Object name, List<String> totalUnits) {
        if (name != null)
            for (String unit : totalUnits)
                if (unit.equalsIgnoreCase(name.toString()))
                    return UNITS.get(unit);
        throw new IllegalArgumentException(kind().label() + " series does not have unit: " + name);
    }
    
    /**
     * Whether values of this kind carry the given calendar field.
     */
    abstract boolean isSupported(TemporalField field);
}
