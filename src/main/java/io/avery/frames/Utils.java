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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Common utils
 */
class Utils {
    /**
     * Totally unchecked cast, for when a normal cast is illegal, but we know the cast is safe.
     */
    @SuppressWarnings("unchecked")
    static <T> T cast(Object o) {
        return (T) o;
    }
    
    /**
     * Wraps the comparator so that nulls come first/lowest.
     */
    static <T> Comparator<T> nullsFirst(Comparator<? super T> comparator) {
        return (a, b) -> {
            if (a == b)
                return 0;
            if (a == null)
                return -1;
            if (b == null)
                return 1;
            return comparator.compare(a, b);
        };
    }
    
    /**
     * Returns the smallest non-negative integer not present in the given keys.
     */
    static int generateKey(Collection<Integer> used) {
        int key = 0;
        while (used.contains(key))
            key++;
        return key;
    }
    
    /**
     * Returns the argument at the given position, or null if there are not that many arguments.
     */
    static Object arg(Object[] args, int index) {
        return args != null && index < args.length ? args[index] : null;
    }
    
    static double number(Object o, double defaultValue) {
        if (o == null)
            return defaultValue;
        if (o instanceof Number)
            return ((Number) o).doubleValue();
        if (o instanceof CharSequence) {
            try {
                return Double.parseDouble(o.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a number, got: " + o, e);
            }
        }
        throw new IllegalArgumentException("Expected a number, got: " + o);
    }
    
    static int integer(Object o, int defaultValue) {
        return o == null ? defaultValue : (int) number(o, defaultValue);
    }
    
    /**
     * Views an operand as a list: collections and arrays are spread, anything else becomes a singleton.
     */
    static List<Object> asList(Object operand) {
        if (operand == null)
            return Collections.emptyList();
        if (operand instanceof List)
            return cast(operand);
        if (operand instanceof Collection)
            return new java.util.ArrayList<>((Collection<?>) operand);
        if (operand instanceof Object[])
            return Arrays.asList((Object[]) operand);
        return Collections.singletonList(operand);
    }
    
    /**
     * True for values a single series cell may hold: numbers, text, booleans and calendar values.
     */
    static boolean isScalar(Object o) {
        return o == null
            || o instanceof Number
            || o instanceof CharSequence
            || o instanceof Character
            || o instanceof Boolean
            || o instanceof java.time.temporal.TemporalAccessor
            || o instanceof java.util.Date
            || o instanceof Enum;
    }
}
