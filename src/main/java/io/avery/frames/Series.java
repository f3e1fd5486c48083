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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * A named, typed, sparse column of nullable values, keyed by non-negative integers. Iteration follows key insertion
 * order, which {@link #sort(boolean, Comparator)} rearranges.
 *
 * <p>A series carries two {@link Constraints constraint} sets. Validations are enforced on every write: a value that
 * fails them is dropped, and the write has no effect. Violations are advisory: values that fail them are stored, but
 * are reported as unstable. Assigning a constraint set with a name unknown to the series' kind throws.
 *
 * <p>In-place mutators ({@code set}, {@code push}, {@code unset}, {@code delete}, {@code fillNulls},
 * {@code omitNulls}, {@code sort}) return this series. Every other operation returns a new series and leaves this
 * one untouched. Reducers return a single-element series (key {@code 0}) of the reducer's result kind.
 *
 * <p>Example:
 * <pre>{@code
 * Series<Double> prices = Series.ofNumbers("price", 3, 1, 4, 1, 5);
 * Object total = prices.reduce("sum").value(0);     // 14.0
 * KeySet cheap = prices.match(new Match().lt(3));   // [1, 3]
 * Series<?> rounded = prices.transform("divideBy", 3).transform("round", 2);
 * }</pre>
 *
 * @param <T> the Java type of the values
 */
public final class Series<T> implements Iterable<Map.Entry<Integer, T>> {
    private static final Logger logger = LoggerFactory.getLogger(Series.class);
    
    private final ValueType<T> type;
    private final LinkedHashMap<Integer, T> map = new LinkedHashMap<>();
    private String name;
    private Constraints validations = Constraints.none();
    private Constraints violations = Constraints.none();
    
    Series(ValueType<T> type, String name) {
        this.type = Objects.requireNonNull(type);
        this.name = name;
    }
    
    // ---- construction
    
    /**
     * Creates an empty series.
     *
     * @param type the value type
     * @param name the series name
     * @return an empty series
     * @param <T> the Java type of the values
     */
    public static <T> Series<T> empty(ValueType<T> type, String name) {
        return new Series<>(type, name);
    }
    
    public static <T> Series<T> of(ValueType<T> type, String name, List<?> values) {
        return of(type, name, values, Constraints.none(), Constraints.none());
    }
    
    /**
     * Creates a series from a list of raw values, keyed by position. Values that fail the validations are dropped,
     * leaving their key absent.
     *
     * @param type the value type
     * @param name the series name
     * @param values the raw values
     * @param validations the constraints every stored value must satisfy
     * @param violations the constraints a value must satisfy to be stable
     * @return the series
     * @param <T> the Java type of the values
     * @throws IllegalArgumentException if a constraint set names a constraint unknown to the type, or if a value
     * cannot be held by the type at all
     */
    public static <T> Series<T> of(ValueType<T> type, String name, List<?> values,
                                   Constraints validations, Constraints violations) {
        Series<T> series = new Series<>(type, name);
        type.checkConstraints(validations);
        type.checkConstraints(violations);
        series.validations = validations;
        series.violations = violations;
        for (int i = 0; i < values.size(); i++)
            series.set(i, values.get(i));
        return series;
    }
    
    public static Series<?> of(ValueKind kind, String name, List<?> values) {
        return of(kind.type(), name, values);
    }
    
    public static Series<Double> ofNumbers(String name, Number... values) {
        return of(ValueType.NUMBER, name, Arrays.asList(values));
    }
    
    public static Series<String> ofStrings(String name, String... values) {
        return of(ValueType.STRING, name, Arrays.asList(values));
    }
    
    public static Series<Boolean> ofBooleans(String name, Boolean... values) {
        return of(ValueType.BOOLEAN, name, Arrays.asList(values));
    }
    
    public static Series<LocalDate> ofDates(String name, LocalDate... values) {
        return of(ValueType.DATE, name, Arrays.asList(values));
    }
    
    public static Series<LocalDateTime> ofDatetimes(String name, LocalDateTime... values) {
        return of(ValueType.DATETIME, name, Arrays.asList(values));
    }
    
    public static Series<LocalTime> ofTimes(String name, LocalTime... values) {
        return of(ValueType.TIME, name, Arrays.asList(values));
    }
    
    // ---- metadata and lookup
    
    public String name() {
        return name;
    }
    
    /**
     * Renames this series in place. A series shared by several frames is renamed in all of them.
     *
     * @param name the new name
     * @return this series
     */
    public Series<T> rename(String name) {
        this.name = name;
        return this;
    }
    
    public ValueType<T> type() {
        return type;
    }
    
    public ValueKind kind() {
        return type.kind();
    }
    
    public int size() {
        return map.size();
    }
    
    public boolean isEmpty() {
        return map.isEmpty();
    }
    
    public List<Integer> keys() {
        return new ArrayList<>(map.keySet());
    }
    
    public List<T> values() {
        return new ArrayList<>(map.values());
    }
    
    @Override
    public Iterator<Map.Entry<Integer, T>> iterator() {
        return Collections.unmodifiableMap(map).entrySet().iterator();
    }
    
    public boolean hasKey(int key) {
        return map.containsKey(key);
    }
    
    /**
     * Returns the value at the given key, or null if the value is null or the key is absent.
     *
     * @param key the key
     * @return the value at the key, or null
     */
    public T value(int key) {
        return map.get(key);
    }
    
    public boolean hasValue(Object raw) {
        return keyOf(raw) != -1;
    }
    
    /**
     * Returns the first key, in iteration order, whose value equals the given raw value after conversion.
     *
     * @param raw the raw value
     * @return the first key holding the value, or -1 if none does
     */
    public int keyOf(Object raw) {
        T value = type.convert(raw);
        for (Map.Entry<Integer, T> entry : map.entrySet())
            if (type.compare(entry.getValue(), value) == 0)
                return entry.getKey();
        return -1;
    }
    
    // ---- constraints
    
    public Constraints validations() {
        return validations;
    }
    
    public Constraints violations() {
        return violations;
    }
    
    /**
     * Replaces the validations, then drops every stored value that fails them.
     *
     * @param validations the new validations
     * @return this series
     * @throws IllegalArgumentException if the set names a constraint unknown to this series' kind
     */
    public Series<T> setValidations(Constraints validations) {
        type.checkConstraints(validations);
        this.validations = validations;
        for (Iterator<Map.Entry<Integer, T>> i = map.entrySet().iterator(); i.hasNext(); ) {
            Map.Entry<Integer, T> entry = i.next();
            if (!type.satisfies(entry.getValue(), validations)) {
                logger.trace("Dropping value {} at key {} of series '{}' under new validations", entry.getValue(), entry.getKey(), name);
                i.remove();
            }
        }
        return this;
    }
    
    /**
     * Replaces the violations. Stored values are kept.
     *
     * @param violations the new violations
     * @return this series
     * @throws IllegalArgumentException if the set names a constraint unknown to this series' kind
     */
    public Series<T> setViolations(Constraints violations) {
        type.checkConstraints(violations);
        this.violations = violations;
        return this;
    }
    
    /**
     * Returns true if the raw value would be accepted by a write.
     */
    public boolean isValid(Object raw) {
        return type.satisfies(type.convert(raw), validations);
    }
    
    /**
     * Returns true if the raw value satisfies the violations.
     */
    public boolean isStable(Object raw) {
        return stable(type.convert(raw));
    }
    
    public boolean hasViolations() {
        for (T value : map.values())
            if (!stable(value))
                return true;
        return false;
    }
    
    boolean stable(T value) {
        return type.satisfies(value, violations);
    }
    
    // ---- in-place mutation
    
    /**
     * Writes a raw value at the given key. A value that fails the validations is dropped, and the series is left
     * unchanged.
     *
     * @param key the key
     * @param raw the raw value
     * @return this series
     * @throws IllegalArgumentException if the key is negative, or the value cannot be held by this series' kind
     */
    public Series<T> set(int key, Object raw) {
        if (key < 0)
            throw new IllegalArgumentException("Invalid key: " + key);
        T value = type.convert(raw);
        if (!type.satisfies(value, validations)) {
            logger.trace("Dropping invalid value {} at key {} of series '{}'", raw, key, name);
            return this;
        }
        map.put(key, value);
        return this;
    }
    
    /**
     * Stores a converted value without validating it.
     */
    void put(int key, T value) {
        map.put(key, value);
    }
    
    public Series<T> unset(int key) {
        map.remove(key);
        return this;
    }
    
    /**
     * Writes a raw value at the smallest key not in use.
     *
     * @param raw the raw value
     * @return this series
     */
    public Series<T> push(Object raw) {
        return set(Utils.generateKey(map.keySet()), raw);
    }
    
    public Series<T> delete(Iterable<Integer> keys) {
        for (Integer key : keys)
            map.remove(key);
        return this;
    }
    
    /**
     * Replaces null values with the given value. The name of a reducer whose result has this series' kind, such as
     * {@code mode} on any kind or {@code max} on numbers, stands for that reducer's value over this series, computed
     * once before filling.
     *
     * @param valueOrReducer the fill value, or a reducer name
     * @param args reducer arguments
     * @return this series
     */
    public Series<T> fillNulls(Object valueOrReducer, Object... args) {
        Object fill = valueOrReducer;
        if (isFillReducer(valueOrReducer))
            fill = reduce((String) valueOrReducer, args).value(0);
        for (Integer key : keys())
            if (map.get(key) == null)
                set(key, fill);
        return this;
    }
    
    boolean isFillReducer(Object valueOrReducer) {
        return valueOrReducer instanceof String && type.reducerNames().contains(valueOrReducer)
            && type.reducerKind((String) valueOrReducer) == kind();
    }
    
    public Series<T> omitNulls() {
        map.values().removeIf(Objects::isNull);
        return this;
    }
    
    public Series<T> sort(boolean desc) {
        return sort(desc, null);
    }
    
    /**
     * Sorts this series in place by value, nulls first when ascending. The sort is stable; keys with equal values
     * are ordered by the tiebreaker, when given, or else keep their relative order.
     *
     * @param desc true to sort descending
     * @param tiebreaker a comparator over keys, or null
     * @return this series
     */
    public Series<T> sort(boolean desc, Comparator<Integer> tiebreaker) {
        List<Map.Entry<Integer, T>> entries = new ArrayList<>();
        for (Map.Entry<Integer, T> entry : map.entrySet())
            entries.add(new AbstractMap.SimpleImmutableEntry<>(entry));
        Comparator<Map.Entry<Integer, T>> comparator = (a, b) -> type.compare(a.getValue(), b.getValue());
        if (desc)
            comparator = comparator.reversed();
        if (tiebreaker != null)
            comparator = comparator.thenComparing((a, b) -> tiebreaker.compare(a.getKey(), b.getKey()));
        entries.sort(comparator);
        map.clear();
        for (Map.Entry<Integer, T> entry : entries)
            map.put(entry.getKey(), entry.getValue());
        return this;
    }
    
    /**
     * Compares the values at two keys, nulls first when ascending.
     *
     * @param key1 the first key
     * @param key2 the second key
     * @param desc true to reverse the comparison
     * @return the comparison result
     */
    public int compare(int key1, int key2, boolean desc) {
        int c = type.compare(map.get(key1), map.get(key2));
        return desc ? -c : c;
    }
    
    // ---- new series
    
    /**
     * Returns a series holding this series' entries at the given keys, in the given order. Absent keys are skipped.
     * Constraints are carried over.
     *
     * @param keys the keys to keep
     * @return the narrowed series
     */
    public Series<T> get(Iterable<Integer> keys) {
        Series<T> series = withConstraints(name);
        for (Integer key : keys)
            if (map.containsKey(key))
                series.map.put(key, map.get(key));
        return series;
    }
    
    public Series<T> omit(Iterable<Integer> keys) {
        Set<Integer> omitted = new HashSet<>();
        for (Integer key : keys)
            omitted.add(key);
        Series<T> series = withConstraints(name);
        map.forEach((key, value) -> {
            if (!omitted.contains(key))
                series.map.put(key, value);
        });
        return series;
    }
    
    /**
     * Returns the entries at positions {@code [start, end)} of the iteration order. Negative positions count back
     * from the end.
     *
     * @param start the first position
     * @param end the position after the last
     * @return the sliced series
     */
    public Series<T> slice(int start, int end) {
        List<Integer> keys = keys();
        int from = start < 0 ? Math.max(keys.size() + start, 0) : Math.min(start, keys.size());
        int to = end < 0 ? Math.max(keys.size() + end, 0) : Math.min(end, keys.size());
        return get(from < to ? keys.subList(from, to) : Collections.emptyList());
    }
    
    public Series<T> head(int n) {
        return slice(0, Math.max(n, 0));
    }
    
    public Series<T> tail(int n) {
        return slice(Math.max(size() - Math.max(n, 0), 0), size());
    }
    
    @Override
    public Series<T> clone() {
        return clone(name, true, true);
    }
    
    public Series<T> clone(String name) {
        return clone(name, true, true);
    }
    
    /**
     * Returns a copy of this series, with the same keys in the same order.
     *
     * @param name the name of the copy, or null to keep this series' name
     * @param includeValidations true to copy the validations
     * @param includeViolations true to copy the violations
     * @return the copy
     */
    public Series<T> clone(String name, boolean includeValidations, boolean includeViolations) {
        Series<T> series = new Series<>(type, name == null ? this.name : name);
        if (includeValidations)
            series.validations = validations;
        if (includeViolations)
            series.violations = violations;
        series.map.putAll(map);
        return series;
    }
    
    /**
     * Returns the distinct values of this series, in first-seen order, keyed by position.
     *
     * @return the distinct values
     */
    public Series<T> distinct() {
        Series<T> series = withConstraints(name);
        for (T value : map.values())
            if (!series.containsValue(value))
                series.map.put(series.map.size(), value);
        return series;
    }
    
    public boolean hasUniqueValues() {
        return distinct().size() == size();
    }
    
    public Series<T> concat(Series<?> other) {
        return concat(other, name);
    }
    
    /**
     * Returns the values of this series followed by the values of the other, re-keyed by position. Keys of the
     * inputs are ignored. The other series' values are converted to this series' kind.
     *
     * @param other the series to append
     * @param name the name of the result
     * @return the concatenated series
     */
    public Series<T> concat(Series<?> other, String name) {
        Series<T> series = new Series<>(type, name);
        for (T value : map.values())
            series.map.put(series.map.size(), value);
        for (Object value : other.map.values())
            series.map.put(series.map.size(), type.convert(value));
        return series;
    }
    
    // ---- operators
    
    /**
     * Returns the keys selected by a single named filter.
     *
     * @param operator the filter name
     * @param operand the filter operand
     * @return the selected keys
     * @throws IllegalArgumentException if this series' kind has no such filter
     */
    public KeySet match(String operator, Object operand) {
        return type.filter(operator).apply(this, operand);
    }
    
    /**
     * Returns the keys selected by a match: the intersection of the keys selected by each of its operators,
     * intersected with the union of the keys selected by its alternatives.
     *
     * @param match the match
     * @return the selected keys
     */
    public KeySet match(Match match) {
        KeySet keys = KeySet.of(map.keySet());
        for (Map.Entry<String, Object> entry : match.operators().entrySet())
            keys = keys.and(match(entry.getKey(), entry.getValue()));
        if (!match.alternatives().isEmpty()) {
            KeySet any = KeySet.empty();
            for (Match alternative : match.alternatives())
                any = any.or(match(alternative));
            keys = keys.and(any);
        }
        return keys;
    }
    
    /**
     * Returns the entries selected by a match, keeping their keys.
     *
     * @param match the match
     * @return the narrowed series
     */
    public Series<T> filter(Match match) {
        return get(match(match));
    }
    
    /**
     * Applies a named reducer.
     *
     * @param reducer the reducer name
     * @param args reducer arguments
     * @return a single-element series, at key 0, of the reducer's result kind
     * @throws IllegalArgumentException if this series' kind has no such reducer
     */
    public Series<?> reduce(String reducer, Object... args) {
        ValueType.Reduction<T> reduction = type.reduction(reducer);
        return single(reduction.kind.type(), name, reduction.reducer.reduce(this, args));
    }
    
    /**
     * Applies a named transformer, which maps the values to new values of the same kind.
     *
     * @param operator the transformer name
     * @param args transformer arguments
     * @return the transformed series
     * @throws IllegalArgumentException if this series' kind has no such transformer
     */
    public Series<?> transform(String operator, Object... args) {
        return type.transformer(operator).apply(this, args);
    }
    
    /**
     * Applies a named caster, which maps the values to values of another kind.
     *
     * @param operator the caster name
     * @param args caster arguments
     * @return the cast series
     * @throws IllegalArgumentException if this series' kind has no such caster
     */
    public Series<?> cast(String operator, Object... args) {
        return type.caster(operator).apply(this, args);
    }
    
    // ---- internals
    
    /**
     * Returns a series of the given type holding, at each key, the mapped value of this series' value. Nulls map to
     * null without calling the function.
     */
    <R> Series<R> mapValues(ValueType<R> out, Function<? super T, ?> mapper) {
        Series<R> series = new Series<>(out, name);
        map.forEach((key, value) -> series.map.put(key, value == null ? null : out.convert(mapper.apply(value))));
        return series;
    }
    
    /**
     * Returns the values of this series, in iteration order, at the given keys by position. Values past the end of
     * the keys are dropped.
     */
    Series<T> rekey(List<Integer> keys) {
        Series<T> series = withConstraints(name);
        int i = 0;
        for (T value : map.values()) {
            if (i >= keys.size())
                break;
            series.map.put(keys.get(i++), value);
        }
        return series;
    }
    
    static <R> Series<R> single(ValueType<R> type, String name, Object raw) {
        Series<R> series = new Series<>(type, name);
        series.map.put(0, type.convert(raw));
        return series;
    }
    
    private Series<T> withConstraints(String name) {
        Series<T> series = new Series<>(type, name);
        series.validations = validations;
        series.violations = violations;
        return series;
    }
    
    private boolean containsValue(T value) {
        for (T v : map.values())
            if (type.compare(v, value) == 0)
                return true;
        return false;
    }
    
    @Override
    public String toString() {
        return "Series[" + name + ": " + type + "]" + map;
    }
}
