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

import java.util.ArrayList;
import java.util.List;

/**
 * Value types with a natural total order: numbers and calendar values. Adds the range constraints, the ordering
 * filters and the order-statistic reducers.
 *
 * @param <T> the Java type of the values
 */
abstract class ComparableType<T extends Comparable<? super T>> extends ValueType<T> {
    ComparableType(ValueKind kind) {
        super(kind);
        membershipConstraints();
        constraint("min", (value, param) -> value == null || compareValues(value, convert(param)) >= 0);
        constraint("max", (value, param) -> value == null || compareValues(value, convert(param)) <= 0);
        
        filter("gt", (series, operand) -> compareFilter(series, operand, c -> c > 0, false));
        filter("gte", (series, operand) -> compareFilter(series, operand, c -> c >= 0, false));
        filter("lt", (series, operand) -> compareFilter(series, operand, c -> c < 0, false));
        filter("lte", (series, operand) -> compareFilter(series, operand, c -> c <= 0, false));
        filter("inRange", (series, operand) -> rangeFilter(series, operand, true));
        filter("ninRange", (series, operand) -> rangeFilter(series, operand, false));
        
        reducer("min", kind, (series, args) -> extreme(series, false));
        reducer("max", kind, (series, args) -> extreme(series, true));
        reducer("mid", kind, (series, args) -> {
            List<T> sorted = sortedValues(series);
            return sorted.isEmpty() ? emptyExtreme() : midpoint(sorted.get(0), sorted.get(sorted.size() - 1));
        });
        reducer("quantile", kind, (series, args) -> quantile(series, Utils.number(Utils.arg(args, 0), 0.5)));
        reducer("qnt", kind, (series, args) -> quantile(series, Utils.number(Utils.arg(args, 0), 0.5)));
    }
    
    @Override
    int compareValues(T a, T b) {
        return a.compareTo(b);
    }
    
    /**
     * The value of min/max/mid over a series with no non-null values.
     */
    T emptyExtreme() {
        return null;
    }
    
    private T extreme(Series<T> series, boolean max) {
        T best = null;
        for (T value : series.values())
            if (value != null && (best == null || (max ? value.compareTo(best) > 0 : value.compareTo(best) < 0)))
                best = value;
        return best == null ? emptyExtreme() : best;
    }
    
    /**
     * Returns the value at the given position (0 to 1) of the ascending non-null values. With {@code index = n * p},
     * a fractional index takes the element at {@code ceil(index)}, while an integral index takes the midpoint of the
     * elements at {@code index} and {@code index + 1}; positions past the end are skipped.
     */
    T quantile(Series<T> series, double position) {
        List<T> sorted = sortedValues(series);
        if (sorted.isEmpty() || position < 0 || position > 1)
            return emptyExtreme();
        double index = sorted.size() * position;
        if (index != Math.floor(index)) {
            int i = (int) Math.ceil(index);
            return i < sorted.size() ? sorted.get(i) : null;
        }
        List<T> neighbors = new ArrayList<>(2);
        for (int i = (int) index; i <= (int) index + 1; i++)
            if (i < sorted.size())
                neighbors.add(sorted.get(i));
        if (neighbors.isEmpty())
            return null;
        return neighbors.size() == 1 ? neighbors.get(0) : midpoint(neighbors.get(0), neighbors.get(1));
    }
    
    private KeySet rangeFilter(Series<T> series, Object operand, boolean inside) {
        List<Object> bounds = Utils.asList(operand);
        if (bounds.size() != 2)
            throw new IllegalArgumentException("Expected a [from, to] range, got: " + operand);
        T from = resolveOperand(series, bounds.get(0));
        T to = resolveOperand(series, bounds.get(1));
        return keysWhere(series, (key, value) -> {
            if (value == null || from == null || to == null)
                return false;
            boolean within = compareValues(value, from) >= 0 && compareValues(value, to) <= 0;
            return within == inside;
        });
    }
}
