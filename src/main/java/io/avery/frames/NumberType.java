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

import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.regex.Matcher;

/**
 * Numbers, held as {@code Double}. Any {@code Number} is accepted, as is text that parses as a number; other text
 * and NaN become null.
 */
final class NumberType extends ComparableType<Double> {
    NumberType() {
        super(ValueKind.NUMBER);
        
        reducer("sum", ValueKind.NUMBER, (series, args) -> sum(series));
        reducer("mean", ValueKind.NUMBER, (series, args) -> mean(series));
        reducer("variance", ValueKind.NUMBER, (series, args) -> variance(series));
        reducer("std", ValueKind.NUMBER, (series, args) -> Math.sqrt(variance(series)));
        reducer("skew", ValueKind.NUMBER, (series, args) -> {
            double std = Math.sqrt(variance(series));
            if (std == 0)
                return 0.0;
            Double median = quantile(series, 0.5);
            return 3 * (mean(series) - (median == null ? 0 : median)) / std;
        });
        
        transformer("round", (series, args) -> {
            double scale = Math.pow(10, Utils.integer(Utils.arg(args, 0), 0));
            return series.mapValues(this, v -> Math.round(v * scale) / scale);
        });
        transformer("floor", (series, args) -> series.mapValues(this, Math::floor));
        transformer("ceil", (series, args) -> series.mapValues(this, Math::ceil));
        transformer("abs", (series, args) -> series.mapValues(this, Math::abs));
        transformer("sign", (series, args) -> series.mapValues(this, Math::signum));
        transformer("cumsum", (series, args) -> {
            double[] total = { 0 };
            return series.mapValues(this, v -> total[0] += v);
        });
        transformer("percOfTotal", (series, args) -> {
            double total = sum(series);
            return series.mapValues(this, v -> total == 0 ? 0 : v / total * 100);
        });
        transformer("percOfRange", (series, args) -> {
            double min = amount(series, Utils.arg(args, 0), "min");
            double max = amount(series, Utils.arg(args, 1), "max");
            double range = max - min;
            return series.mapValues(this, v -> range == 0 ? 0 : (v - min) / range * 100);
        });
        arithmetic("add", (v, amount) -> v + amount);
        arithmetic("sub", (v, amount) -> v - amount);
        arithmetic("times", (v, amount) -> v * amount);
        arithmetic("divideBy", (v, amount) -> v / amount);
        arithmetic("mod", (v, amount) -> v % amount);
        arithmetic("power", Math::pow);
        arithmetic("root", (v, amount) -> Math.pow(v, 1 / amount));
        transformer("math", (series, args) -> {
            Object expression = Utils.arg(args, 0);
            if (!(expression instanceof String))
                throw new IllegalArgumentException("Expected an expression, got: " + expression);
            Map<String, Double> bindings = new HashMap<>();
            ArithmeticExpression compiled = ArithmeticExpression.compile(bindReducers(series, (String) expression, bindings));
            return series.mapValues(this, v -> {
                bindings.put("n", v);
                return compiled.evaluate(bindings);
            });
        });
        
        caster("toDate", (series, args) -> series.mapValues(ValueType.DATE, v -> Calendars.toDate(v.longValue())));
        caster("toDatetime", (series, args) -> series.mapValues(ValueType.DATETIME, v -> Calendars.toDatetime(v.longValue())));
        caster("toTime", (series, args) -> series.mapValues(ValueType.TIME, v -> Calendars.toTime(v.longValue())));
    }
    
    @Override
    Double coerce(Object raw) {
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isNaN(value) ? null : value;
        }
        if (!(raw instanceof CharSequence))
            return null;
        try {
            double value = Double.parseDouble(raw.toString().trim());
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    @Override
    Double midpoint(Double a, Double b) {
        return (a + b) / 2;
    }
    
    @Override
    Double emptyExtreme() {
        return 0.0;
    }
    
    @Override
    boolean truthy(Double value) {
        return value != 0;
    }
    
    /**
     * Formats integral values without a fractional part.
     */
    @Override
    public String format(Double value) {
        if (value == null)
            return null;
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15)
            return Long.toString(value.longValue());
        return value.toString();
    }
    
    private void arithmetic(String name, DoubleBinaryOperator operator) {
        transformer(name, (series, args) -> {
            double amount = amount(series, Utils.arg(args, 0), null);
            return series.mapValues(this, v -> operator.applyAsDouble(v, amount));
        });
    }
    
    /**
     * Resolves an amount argument: a number, or the name of a reducer evaluated over the series.
     */
    private double amount(Series<Double> series, Object arg, String defaultReducer) {
        if (arg == null && defaultReducer != null)
            arg = defaultReducer;
        if (arg == null)
            throw new IllegalArgumentException("Expected an amount");
        if (arg instanceof String && reducerNames().contains(arg)) {
            Double value = convert(series.reduce((String) arg).value(0));
            return value == null ? 0 : value;
        }
        return Utils.number(arg, 0);
    }
    
    /**
     * Rewrites each {@code {reducer}} placeholder to a variable, bound to the reducer's value over the series.
     */
    private String bindReducers(Series<Double> series, String expression, Map<String, Double> bindings) {
        Matcher matcher = ArithmeticExpression.PLACEHOLDER.matcher(expression);
        StringBuffer rewritten = new StringBuffer();
        while (matcher.find()) {
            String reducer = matcher.group(1);
            if (!reducerNames().contains(reducer))
                throw new IllegalArgumentException("number series does not have reducer: " + reducer);
            String variable = ArithmeticExpression.reducerVariable(reducer);
            Double value = convert(series.reduce(reducer).value(0));
            bindings.put(variable, value == null ? 0 : value);
            matcher.appendReplacement(rewritten, variable);
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }
    
    static double sum(Series<Double> series) {
        double sum = 0;
        for (Double value : series.values())
            if (value != null)
                sum += value;
        return sum;
    }
    
    /**
     * The sum of the non-null values over the number of entries, nulls included.
     */
    static double mean(Series<Double> series) {
        return series.isEmpty() ? 0 : sum(series) / series.size();
    }
    
    /**
     * Accumulates {@code (v - mean)^2 / count - 1} per non-null value.
     */
    static double variance(Series<Double> series) {
        int count = series.size();
        if (count <= 1)
            return 0;
        double mean = mean(series);
        double variance = 0;
        for (Double value : series.values())
            if (value != null)
                variance += Math.pow(value - mean, 2) / count - 1;
        return variance;
    }
}
