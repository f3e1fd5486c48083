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

import java.util.List;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text. Any scalar is accepted, formatted with {@code String.valueOf}.
 */
final class StringType extends ValueType<String> {
    StringType() {
        super(ValueKind.STRING);
        membershipConstraints();
        constraint("notEmpty", (value, param) -> value == null || !value.isEmpty() || Boolean.FALSE.equals(param));
        constraint("len", (value, param) -> value == null || value.length() == Utils.integer(param, 0));
        constraint("minLen", (value, param) -> value == null || value.length() >= Utils.integer(param, 0));
        constraint("maxLen", (value, param) -> value == null || value.length() <= Utils.integer(param, Integer.MAX_VALUE));
        constraint("regex", (value, param) -> value == null || pattern(param).matcher(value).find());
        
        reducer("sumLen", ValueKind.NUMBER, (series, args) -> sumLength(series));
        reducer("minLen", ValueKind.NUMBER, (series, args) ->
            series.values().stream().filter(v -> v != null).mapToInt(String::length).min().orElse(0));
        reducer("maxLen", ValueKind.NUMBER, (series, args) ->
            series.values().stream().filter(v -> v != null).mapToInt(String::length).max().orElse(0));
        reducer("avgLen", ValueKind.NUMBER, (series, args) ->
            series.isEmpty() ? 0 : (double) sumLength(series) / series.size());
        
        filter("eqLen", (series, operand) -> lengthFilter(series, operand, c -> c == 0));
        filter("neqLen", (series, operand) -> lengthFilter(series, operand, c -> c != 0));
        filter("gtLen", (series, operand) -> lengthFilter(series, operand, c -> c > 0));
        filter("gteLen", (series, operand) -> lengthFilter(series, operand, c -> c >= 0));
        filter("ltLen", (series, operand) -> lengthFilter(series, operand, c -> c < 0));
        filter("lteLen", (series, operand) -> lengthFilter(series, operand, c -> c <= 0));
        filter("regex", (series, operand) -> {
            Pattern pattern = pattern(operand);
            return keysWhere(series, (key, value) -> value != null && pattern.matcher(value).find());
        });
        
        transformer("lowercase", (series, args) -> series.mapValues(this, String::toLowerCase));
        transformer("uppercase", (series, args) -> series.mapValues(this, String::toUpperCase));
        transformer("trim", (series, args) -> series.mapValues(this, String::trim));
        transformer("substr", (series, args) -> {
            Object end = Utils.arg(args, 1);
            int start = Utils.integer(Utils.arg(args, 0), 0);
            return series.mapValues(this, v -> substring(v, start, end == null ? v.length() : Utils.integer(end, 0)));
        });
        transformer("replace", (series, args) -> {
            String match = String.valueOf(Utils.arg(args, 0));
            String replacement = Matcher.quoteReplacement(String.valueOf(Utils.arg(args, 1)));
            return series.mapValues(this, v -> v.replaceFirst(Pattern.quote(match), replacement));
        });
        transformer("template", (series, args) -> {
            Object template = Utils.arg(args, 0);
            if (template == null)
                throw new IllegalArgumentException("Expected a template");
            return series.mapValues(this, v -> template.toString().replace("{s}", v));
        });
        
        caster("len", (series, args) -> series.mapValues(ValueType.NUMBER, String::length));
        caster("toNumber", (series, args) -> series.mapValues(ValueType.NUMBER, v -> v));
        caster("toDate", (series, args) -> {
            String pattern = (String) Utils.arg(args, 0);
            return series.mapValues(ValueType.DATE, v -> Calendars.toDate(v, pattern));
        });
        caster("toDatetime", (series, args) -> {
            String pattern = (String) Utils.arg(args, 0);
            return series.mapValues(ValueType.DATETIME, v -> Calendars.toDatetime(v, pattern));
        });
        caster("toTime", (series, args) -> {
            String pattern = (String) Utils.arg(args, 0);
            return series.mapValues(ValueType.TIME, v -> Calendars.toTime(v, pattern));
        });
    }
    
    @Override
    String coerce(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }
    
    @Override
    int compareValues(String a, String b) {
        return a.compareTo(b);
    }
    
    @Override
    boolean truthy(String value) {
        return !value.isEmpty();
    }
    
    private static Pattern pattern(Object param) {
        if (param instanceof Pattern)
            return (Pattern) param;
        if (param == null)
            throw new IllegalArgumentException("Expected a regular expression");
        return Pattern.compile(param.toString());
    }
    
    private static int sumLength(Series<String> series) {
        int sum = 0;
        for (String value : series.values())
            if (value != null)
                sum += value.length();
        return sum;
    }
    
    /**
     * Substring with negative positions counting back from the end, clamped to the string.
     */
    private static String substring(String value, int start, int end) {
        int length = value.length();
        int from = start < 0 ? Math.max(length + start, 0) : Math.min(start, length);
        int to = end < 0 ? Math.max(length + end, 0) : Math.min(end, length);
        return from < to ? value.substring(from, to) : "";
    }
    
    /**
     * Compares value lengths to the operand: a length, the name of a length reducer, a collection of lengths
     * (by position), or a number series (by key).
     */
    private KeySet lengthFilter(Series<String> series, Object operand, IntPredicate test) {
        if (operand instanceof Series) {
            Series<?> other = (Series<?>) operand;
            return keysWhere(series, (key, value) -> {
                Double length = ValueType.NUMBER.convert(other.value(key));
                return value != null && length != null && test.test(Double.compare(value.length(), length));
            });
        }
        if (operand instanceof java.util.Collection || operand instanceof Object[]) {
            List<Object> lengths = Utils.asList(operand);
            int[] position = { 0 };
            return keysWhere(series, (key, value) -> {
                int i = position[0]++;
                Double length = i < lengths.size() ? ValueType.NUMBER.convert(lengths.get(i)) : null;
                return value != null && length != null && test.test(Double.compare(value.length(), length));
            });
        }
        double length = operand instanceof String && reducerNames().contains(operand)
            ? Utils.number(series.reduce((String) operand).value(0), 0)
            : Utils.number(operand, 0);
        return keysWhere(series, (key, value) -> value != null && test.test(Double.compare(value.length(), length)));
    }
}
