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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * The capabilities of one {@link ValueKind}: how raw values are coerced, compared and formatted, and the tables of
 * named constraints, reducers, transformers, casters and filters a {@link Series} of that kind dispatches to.
 *
 * <p>There is exactly one value type per kind, available as a constant on this class or through
 * {@link ValueKind#type()}. Operator tables are fixed when the type is created; lookups of names absent from a table
 * throw {@link IllegalArgumentException} naming the kind and the missing operator.
 *
 * @param <T> the Java type of the values
 */
public abstract class ValueType<T> {
    public static final ValueType<Boolean> BOOLEAN = new BooleanType();
    public static final ValueType<LocalDate> DATE = new DateType();
    public static final ValueType<LocalDateTime> DATETIME = new DatetimeType();
    public static final ValueType<Double> NUMBER = new NumberType();
    public static final ValueType<String> STRING = new StringType();
    public static final ValueType<LocalTime> TIME = new TimeType();
    
    interface Check<T> {
        boolean test(T value, Object param);
    }
    
    interface Reducer<T> {
        Object reduce(Series<T> series, Object[] args);
    }
    
    interface Operator<T> {
        Series<?> apply(Series<T> series, Object[] args);
    }
    
    interface Filter<T> {
        KeySet apply(Series<T> series, Object operand);
    }
    
    static final class Reduction<T> {
        final ValueKind kind;
        final Reducer<T> reducer;
        
        Reduction(ValueKind kind, Reducer<T> reducer) {
            this.kind = kind;
            this.reducer = reducer;
        }
    }
    
    private final ValueKind kind;
    private final Comparator<T> comparator;
    private final Map<String, Check<T>> constraints = new LinkedHashMap<>();
    private final Map<String, Reduction<T>> reducers = new LinkedHashMap<>();
    private final Map<String, Operator<T>> transformers = new LinkedHashMap<>();
    private final Map<String, Operator<T>> casters = new LinkedHashMap<>();
    private final Map<String, Filter<T>> filters = new LinkedHashMap<>();
    
    ValueType(ValueKind kind) {
        this.kind = kind;
        this.comparator = Utils.nullsFirst(this::compareValues);
        
        constraint("notNull", (value, param) -> value != null || Boolean.FALSE.equals(param));
        constraint("eq", (value, param) -> value == null || equal(value, convert(param)));
        constraint("neq", (value, param) -> value == null || !equal(value, convert(param)));
        
        reducer("count", ValueKind.NUMBER, (series, args) -> series.size());
        reducer("nullCount", ValueKind.NUMBER, (series, args) -> countWhere(series, v -> v == null));
        reducer("stablesCount", ValueKind.NUMBER, (series, args) -> countWhere(series, series::stable));
        reducer("violationsCount", ValueKind.NUMBER, (series, args) -> countWhere(series, v -> !series.stable(v)));
        reducer("mode", kind, (series, args) -> frequent(series, true));
        reducer("rear", kind, (series, args) -> frequent(series, false));
        
        filter("eq", (series, operand) -> compareFilter(series, operand, c -> c == 0, true));
        filter("neq", (series, operand) -> compareFilter(series, operand, c -> c != 0, true));
        filter("in", (series, operand) -> membershipFilter(series, operand, true));
        filter("nin", (series, operand) -> membershipFilter(series, operand, false));
        filter("violations", (series, operand) -> keysWhere(series, (key, value) -> !series.stable(value)));
        
        caster("toString", (series, args) -> series.mapValues(ValueType.STRING, this::format));
        caster("toBoolean", (series, args) -> {
            Object match = Utils.arg(args, 0);
            Series<Boolean> out = Series.empty(ValueType.BOOLEAN, series.name());
            if (match == null) {
                for (Map.Entry<Integer, T> entry : series)
                    out.put(entry.getKey(), entry.getValue() != null && truthy(entry.getValue()));
                return out;
            }
            KeySet keys = series.match(match instanceof Match ? (Match) match : Match.of(Utils.cast(match)));
            for (Integer key : series.keys())
                out.put(key, keys.contains(key));
            return out;
        });
    }
    
    // ---- kind-specific behavior
    
    /**
     * Coerces a scalar raw value to a value of this type, or null if it cannot be interpreted as one.
     */
    abstract T coerce(Object raw);
    
    /**
     * Compares two non-null values.
     */
    abstract int compareValues(T a, T b);
    
    /**
     * Returns the value halfway between two non-null values.
     */
    T midpoint(T a, T b) {
        throw new UnsupportedOperationException();
    }
    
    /**
     * Whether a non-null value counts as true when cast to a boolean without a match.
     */
    boolean truthy(T value) {
        return true;
    }
    
    // ---- public surface
    
    public ValueKind kind() {
        return kind;
    }
    
    /**
     * Converts a raw value to a value of this type. Values that are not scalars (numbers, text, booleans, calendar
     * values) cannot be held by any series, and are rejected. Scalars this type cannot interpret become null.
     *
     * @param raw the raw value
     * @return the converted value, or null
     * @throws IllegalArgumentException if the raw value is not a scalar
     */
    public T convert(Object raw) {
        if (!Utils.isScalar(raw))
            throw new IllegalArgumentException("Cannot hold " + raw.getClass().getName() + " in a " + kind.label() + " series");
        return coerce(raw);
    }
    
    /**
     * Compares two values, nulls first.
     *
     * @param a the first value
     * @param b the second value
     * @return a negative integer, zero, or a positive integer as the first value is less than, equal to, or greater
     * than the second
     */
    public int compare(T a, T b) {
        return comparator.compare(a, b);
    }
    
    /**
     * Formats a value as text, or null for a null value.
     *
     * @param value the value
     * @return the formatted value
     */
    public String format(T value) {
        return value == null ? null : value.toString();
    }
    
    public Set<String> constraintNames() {
        return Collections.unmodifiableSet(constraints.keySet());
    }
    
    public Set<String> reducerNames() {
        return Collections.unmodifiableSet(reducers.keySet());
    }
    
    public Set<String> transformerNames() {
        return Collections.unmodifiableSet(transformers.keySet());
    }
    
    public Set<String> casterNames() {
        return Collections.unmodifiableSet(casters.keySet());
    }
    
    public Set<String> filterNames() {
        return Collections.unmodifiableSet(filters.keySet());
    }
    
    /**
     * Returns the kind of the single-element series produced by the named reducer.
     *
     * @param name the reducer name
     * @return the result kind of the reducer
     * @throws IllegalArgumentException if this type has no such reducer
     */
    public ValueKind reducerKind(String name) {
        return reduction(name).kind;
    }
    
    /**
     * Returns all value types, in kind declaration order.
     */
    static List<ValueType<?>> all() {
        List<ValueType<?>> types = new ArrayList<>();
        for (ValueKind kind : ValueKind.values())
            types.add(kind.type());
        return types;
    }
    
    /**
     * Returns true if any value type has an entry with the given name in the selected table.
     */
    static boolean anyHas(Function<ValueType<?>, Set<String>> table, String name) {
        for (ValueType<?> type : all())
            if (table.apply(type).contains(name))
                return true;
        return false;
    }
    
    // ---- lookups used by Series
    
    void checkConstraints(Constraints constraints) {
        for (String name : constraints.names())
            if (!this.constraints.containsKey(name))
                throw new IllegalArgumentException("Unknown " + kind.label() + " constraint: " + name);
    }
    
    boolean satisfies(T value, Constraints constraints) {
        for (Map.Entry<String, Object> entry : constraints.asMap().entrySet()) {
            Check<T> check = this.constraints.get(entry.getKey());
            if (check == null)
                throw new IllegalArgumentException("Unknown " + kind.label() + " constraint: " + entry.getKey());
            if (!check.test(value, entry.getValue()))
                return false;
        }
        return true;
    }
    
    Reduction<T> reduction(String name) {
        Reduction<T> reduction = reducers.get(name);
        if (reduction == null)
            throw new IllegalArgumentException(kind.label() + " series does not have reducer: " + name);
        return reduction;
    }
    
    Operator<T> transformer(String name) {
        Operator<T> operator = transformers.get(name);
        if (operator == null)
            throw new IllegalArgumentException(kind.label() + " series does not have operator: " + name);
        return operator;
    }
    
    Operator<T> caster(String name) {
        Operator<T> operator = casters.get(name);
        if (operator == null)
            throw new IllegalArgumentException(kind.label() + " series does not have operator: " + name);
        return operator;
    }
    
    Filter<T> filter(String name) {
        Filter<T> filter = filters.get(name);
        if (filter == null)
            throw new IllegalArgumentException(kind.label() + " series does not have filter: " + name);
        return filter;
    }
    
    // ---- table registration
    
    void constraint(String name, Check<T> check) {
        constraints.put(name, check);
    }
    
    void reducer(String name, ValueKind resultKind, Reducer<T> reducer) {
        reducers.put(name, new Reduction<>(resultKind, reducer));
    }
    
    void transformer(String name, Operator<T> operator) {
        transformers.put(name, operator);
    }
    
    void caster(String name, Operator<T> operator) {
        casters.put(name, operator);
    }
    
    void filter(String name, Filter<T> filter) {
        filters.put(name, filter);
    }
    
    /**
     * Registers the in/nin constraints, for kinds with a meaningful value set.
     */
    void membershipConstraints() {
        constraint("in", (value, param) -> value == null || contains(Utils.asList(param), value));
        constraint("nin", (value, param) -> value == null || !contains(Utils.asList(param), value));
    }
    
    // ---- shared helpers
    
    boolean equal(T a, T b) {
        return compare(a, b) == 0;
    }
    
    boolean contains(List<?> rawValues, T value) {
        for (Object raw : rawValues)
            if (equal(value, convert(raw)))
                return true;
        return false;
    }
    
    /**
     * Resolves a scalar filter operand. On non-string kinds, a string naming one of this type's reducers stands for
     * that reducer's value over the series being filtered.
     */
    T resolveOperand(Series<T> series, Object operand) {
        if (operand instanceof String && kind != ValueKind.STRING && reducers.containsKey(operand))
            return convert(reduction((String) operand).reducer.reduce(series, new Object[0]));
        return convert(operand);
    }
    
    interface KeyValuePredicate<T> {
        boolean test(int key, T value);
    }
    
    KeySet keysWhere(Series<T> series, KeyValuePredicate<T> predicate) {
        List<Integer> keys = new ArrayList<>();
        for (Map.Entry<Integer, T> entry : series)
            if (predicate.test(entry.getKey(), entry.getValue()))
                keys.add(entry.getKey());
        return KeySet.of(keys);
    }
    
    /**
     * Selects the keys whose value compares to the operand as the test demands. The operand may be a series (compared
     * by key), a collection or array (compared by position), or a scalar. Nulls never compare, except that equality
     * filters treat two nulls as equal and a null and a non-null as unequal.
     */
    KeySet compareFilter(Series<T> series, Object operand, IntPredicate test, boolean nullsComparable) {
        if (operand instanceof Series) {
            Series<?> other = (Series<?>) operand;
            return keysWhere(series, (key, value) -> compares(value, convert(other.value(key)), test, nullsComparable));
        }
        if (operand instanceof java.util.Collection || operand instanceof Object[]) {
            List<Object> others = Utils.asList(operand);
            int[] position = { 0 };
            return keysWhere(series, (key, value) -> {
                int i = position[0]++;
                return compares(value, i < others.size() ? convert(others.get(i)) : null, test, nullsComparable);
            });
        }
        T other = resolveOperand(series, operand);
        return keysWhere(series, (key, value) -> compares(value, other, test, nullsComparable));
    }
    
    private boolean compares(T value, T other, IntPredicate test, boolean nullsComparable) {
        if (value == null || other == null)
            return nullsComparable && test.test(value == other ? 0 : 1);
        return test.test(compareValues(value, other));
    }
    
    private KeySet membershipFilter(Series<T> series, Object operand, boolean in) {
        if (operand instanceof Series) {
            Series<?> other = (Series<?>) operand;
            return keysWhere(series, (key, value) -> other.hasValue(value) == in);
        }
        List<Object> others = Utils.asList(operand);
        return keysWhere(series, (key, value) -> {
            for (Object raw : others)
                if (compare(value, convert(raw)) == 0)
                    return in;
            return !in;
        });
    }
    
    int countWhere(Series<T> series, java.util.function.Predicate<T> predicate) {
        int count = 0;
        for (T value : series.values())
            if (predicate.test(value))
                count++;
        return count;
    }
    
    /**
     * Returns the most (or least) frequent non-null value, first-seen winning ties, or null for no values.
     */
    private T frequent(Series<T> series, boolean most) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T value : series.values())
            if (value != null)
                counts.merge(value, 1, Integer::sum);
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (best == null || (most ? count > bestCount : count < bestCount)) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best;
    }
    
    /**
     * Returns the non-null values of the series, ascending.
     */
    List<T> sortedValues(Series<T> series) {
        List<T> values = new ArrayList<>();
        for (T value : series.values())
            if (value != null)
                values.add(value);
        values.sort(this::compareValues);
        return values;
    }
    
    @Override
    public String toString() {
        return kind.label();
    }
}
