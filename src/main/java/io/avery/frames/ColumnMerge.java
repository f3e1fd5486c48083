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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Combines several series into one, position by position. The number of positions is decided by an
 * {@link Alignment}: the shortest series for inner, the longest for outer, the first for left, the last for right.
 * Keys of the inputs are ignored; the value at position {@code i} of each input (null past its end) forms row
 * {@code i}, and the output is keyed by position.
 *
 * <p>The operators are:
 * <ul>
 *     <li>{@link Operator#MERGE merge}: applies a reducer across each row. All inputs must share one kind, and the
 *     output has the reducer's result kind.
 *     <li>{@link Operator#DELTA delta}: applies a {@code total*} reducer across each row of calendar values, giving
 *     the span between the row's earliest and latest value.
 *     <li>{@link Operator#CALCULATE calculate}: evaluates an {@link ArithmeticExpression} over number inputs, bound
 *     by series name. {@code {reducer}} placeholders bind a reducer applied across the row. A row with a null input
 *     yields null.
 *     <li>{@link Operator#CONCAT concat}: joins the row's non-null values as text, with a separator (a space by
 *     default). Inputs may be of mixed kinds.
 *     <li>{@link Operator#TEMPLATE template}: renders a template, replacing each {@code {{name}}} with the value of
 *     the input of that name (empty when null). Inputs may be of mixed kinds.
 * </ul>
 */
public final class ColumnMerge {
    private static final Logger logger = LoggerFactory.getLogger(ColumnMerge.class);
    
    private static final Pattern TEMPLATE_FIELD = Pattern.compile("\\{\\{\\s*([^}\\s]+)\\s*}}");
    
    private ColumnMerge() {}
    
    public enum Operator {
        MERGE,
        CONCAT,
        TEMPLATE,
        CALCULATE,
        DELTA;
        
        public static Operator of(String name) {
            for (Operator operator : values())
                if (operator.name().equalsIgnoreCase(name))
                    return operator;
            throw new IllegalArgumentException("Unknown merge operator: " + name);
        }
        
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
    
    /**
     * Validates and applies a merge operator.
     *
     * @param operator the operator
     * @param name the output series name
     * @param series the inputs
     * @param argument the operator argument: a reducer name for merge and delta, an expression for calculate, a
     *                 separator (or null) for concat, a template for template
     * @param alignment how inputs of unequal length are lined up
     * @return the merged series
     * @throws IllegalArgumentException if there are no inputs, or the operator does not accept the inputs' kinds or
     * the argument
     */
    public static Series<?> apply(Operator operator, String name, List<? extends Series<?>> series, Object argument,
                                  Alignment alignment) {
        validate(operator, series, argument);
        logger.debug("Merging {} series into '{}' with {} ({})", series.size(), name, operator.label(), alignment);
        switch (operator) {
            case MERGE:
            case DELTA:
                return reduceRows(name, series, argument.toString(), alignment);
            case CALCULATE:
                return calculateRows(name, series, argument.toString(), alignment);
            case CONCAT:
                return concatRows(name, series, argument == null ? " " : argument.toString(), alignment);
            case TEMPLATE:
                return templateRows(name, series, argument.toString(), alignment);
            default:
                throw new AssertionError();
        }
    }
    
    public static Series<?> reduce(String name, List<? extends Series<?>> series, String reducer, Alignment alignment) {
        return apply(Operator.MERGE, name, series, reducer, alignment);
    }
    
    public static Series<?> delta(String name, List<? extends Series<?>> series, String reducer, Alignment alignment) {
        return apply(Operator.DELTA, name, series, reducer, alignment);
    }
    
    public static Series<?> calculate(String name, List<? extends Series<?>> series, String expression,
                                      Alignment alignment) {
        return apply(Operator.CALCULATE, name, series, expression, alignment);
    }
    
    public static Series<?> concat(String name, List<? extends Series<?>> series, String separator,
                                   Alignment alignment) {
        return apply(Operator.CONCAT, name, series, separator, alignment);
    }
    
    public static Series<?> template(String name, List<? extends Series<?>> series, String template,
                                     Alignment alignment) {
        return apply(Operator.TEMPLATE, name, series, template, alignment);
    }
    
    /**
     * Checks that an operator accepts the given inputs and argument.
     *
     * @throws IllegalArgumentException if it does not
     */
    static void validate(Operator operator, List<? extends Series<?>> series, Object argument) {
        if (series.isEmpty())
            throw new IllegalArgumentException("Expected at least one series to " + operator.label());
        Set<ValueKind> kinds = new LinkedHashSet<>();
        for (Series<?> s : series)
            kinds.add(s.kind());
        ValueKind kind = kinds.size() == 1 ? kinds.iterator().next() : null;
        switch (operator) {
            case MERGE:
                if (kind == null)
                    throw new IllegalArgumentException("Cannot merge series of mixed kinds " + kinds + " with operator merge");
                if (argument == null)
                    throw new IllegalArgumentException("Operator merge requires a reducer");
                kind.type().reducerKind(argument.toString());
                break;
            case DELTA:
                if (kind != ValueKind.DATE && kind != ValueKind.DATETIME && kind != ValueKind.TIME)
                    throw new IllegalArgumentException("Operator delta requires date, datetime or time series of one kind, got " + kinds);
                if (argument == null || !argument.toString().startsWith("total"))
                    throw new IllegalArgumentException("Operator delta requires a total reducer, got: " + argument);
                kind.type().reducerKind(argument.toString());
                break;
            case CALCULATE:
                if (kind != ValueKind.NUMBER)
                    throw new IllegalArgumentException("Operator calculate requires number series, got " + kinds);
                if (argument == null)
                    throw new IllegalArgumentException("Operator calculate requires an expression");
                for (String reducer : placeholders(argument.toString()))
                    ValueType.NUMBER.reducerKind(reducer);
                break;
            case TEMPLATE:
                if (argument == null)
                    throw new IllegalArgumentException("Operator template requires a template");
                break;
            case CONCAT:
                break;
        }
    }
    
    /**
     * Lines the inputs up: row {@code i} holds the value at position {@code i} of each input, or null past its end.
     */
    static List<List<Object>> rows(List<? extends Series<?>> series, Alignment alignment) {
        int length = alignment.length(series);
        List<List<?>> columns = new ArrayList<>();
        for (Series<?> s : series)
            columns.add(s.values());
        List<List<Object>> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (List<?> column : columns)
                row.add(i < column.size() ? column.get(i) : null);
            rows.add(row);
        }
        return rows;
    }
    
    private static Series<?> reduceRows(String name, List<? extends Series<?>> series, String reducer,
                                        Alignment alignment) {
        ValueType<?> type = series.get(0).type();
        Series<?> out = Series.empty(type.reducerKind(reducer).type(), name);
        int position = 0;
        for (List<Object> row : rows(series, alignment))
            out.set(position++, Series.of(type, name, row).reduce(reducer).value(0));
        return out;
    }
    
    private static Series<?> calculateRows(String name, List<? extends Series<?>> series, String expression,
                                           Alignment alignment) {
        List<String> reducers = placeholders(expression);
        Matcher matcher = ArithmeticExpression.PLACEHOLDER.matcher(expression);
        StringBuffer rewritten = new StringBuffer();
        while (matcher.find())
            matcher.appendReplacement(rewritten, ArithmeticExpression.reducerVariable(matcher.group(1)));
        matcher.appendTail(rewritten);
        ArithmeticExpression compiled = ArithmeticExpression.compile(rewritten.toString());
        
        Series<Double> out = Series.empty(ValueType.NUMBER, name);
        int position = 0;
        for (List<Object> row : rows(series, alignment)) {
            int key = position++;
            if (row.contains(null)) {
                out.put(key, null);
                continue;
            }
            Map<String, Double> bindings = new HashMap<>();
            for (int i = 0; i < series.size(); i++)
                bindings.put(series.get(i).name(), (Double) row.get(i));
            Series<Double> values = Series.of(ValueType.NUMBER, name, row);
            for (String reducer : reducers)
                bindings.put(ArithmeticExpression.reducerVariable(reducer),
                             ValueType.NUMBER.convert(values.reduce(reducer).value(0)));
            out.set(key, compiled.evaluate(bindings));
        }
        return out;
    }
    
    private static Series<?> concatRows(String name, List<? extends Series<?>> series, String separator,
                                        Alignment alignment) {
        List<List<Object>> formatted = formattedRows(series, alignment);
        Series<String> out = Series.empty(ValueType.STRING, name);
        int position = 0;
        for (List<Object> row : formatted) {
            StringJoiner joiner = new StringJoiner(separator);
            for (Object value : row)
                if (value != null)
                    joiner.add(value.toString());
            out.set(position++, joiner.toString());
        }
        return out;
    }
    
    private static Series<?> templateRows(String name, List<? extends Series<?>> series, String template,
                                          Alignment alignment) {
        List<List<Object>> formatted = formattedRows(series, alignment);
        Series<String> out = Series.empty(ValueType.STRING, name);
        int position = 0;
        for (List<Object> row : formatted) {
            Map<String, Object> fields = new HashMap<>();
            for (int i = 0; i < series.size(); i++)
                fields.put(series.get(i).name(), row.get(i));
            Matcher matcher = TEMPLATE_FIELD.matcher(template);
            StringBuffer rendered = new StringBuffer();
            while (matcher.find()) {
                Object value = fields.get(matcher.group(1));
                matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value.toString()));
            }
            matcher.appendTail(rendered);
            out.set(position++, rendered.toString());
        }
        return out;
    }
    
    private static List<List<Object>> formattedRows(List<? extends Series<?>> series, Alignment alignment) {
        List<Series<String>> formatted = new ArrayList<>();
        for (Series<?> s : series)
            formatted.add(formatted(s));
        return rows(formatted, alignment);
    }
    
    private static <T> Series<String> formatted(Series<T> series) {
        Series<String> out = Series.empty(ValueType.STRING, series.name());
        for (Map.Entry<Integer, T> entry : series)
            out.put(entry.getKey(), series.type().format(entry.getValue()));
        return out;
    }
    
    private static List<String> placeholders(String expression) {
        List<String> reducers = new ArrayList<>();
        Matcher matcher = ArithmeticExpression.PLACEHOLDER.matcher(expression);
        while (matcher.find())
            if (!reducers.contains(matcher.group(1)))
                reducers.add(matcher.group(1));
        return reducers;
    }
}
