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
import java.util.Locale;

/**
 * The six kinds of value a {@link Series} can hold.
 */
public enum ValueKind {
    BOOLEAN,
    DATE,
    DATETIME,
    NUMBER,
    STRING,
    TIME;
    
    private static final int INFERENCE_SAMPLE = 10;
    
    /**
     * Returns the value type that implements this kind.
     *
     * @return the value type of this kind
     */
    public ValueType<?> type() {
        switch (this) {
            case BOOLEAN: return ValueType.BOOLEAN;
            case DATE: return ValueType.DATE;
            case DATETIME: return ValueType.DATETIME;
            case NUMBER: return ValueType.NUMBER;
            case STRING: return ValueType.STRING;
            case TIME: return ValueType.TIME;
            default: throw new AssertionError();
        }
    }
    
    /**
     * Returns the lowercase name of this kind, as used in messages and pipeline descriptors.
     *
     * @return the lowercase name of this kind
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Returns the kind with the given (case-insensitive) name.
     *
     * @param name the kind name
     * @return the kind with the given name
     * @throws IllegalArgumentException if no kind has the given name
     */
    public static ValueKind of(String name) {
        for (ValueKind kind : values())
            if (kind.name().equalsIgnoreCase(name))
                return kind;
        throw new IllegalArgumentException("Unknown value kind: " + name);
    }
    
    /**
     * Infers the kind of a column of raw values, by majority vote over the kinds of its first few non-null values.
     * Ties are broken in declaration order. A column with no non-null values is a string column.
     *
     * @param values the raw values
     * @return the inferred kind
     */
    public static ValueKind infer(List<?> values) {
        int[] votes = new int[values().length];
        int sampled = 0;
        for (Object value : values) {
            if (value == null)
                continue;
            votes[kindOf(value).ordinal()]++;
            if (++sampled == INFERENCE_SAMPLE)
                break;
        }
        if (sampled == 0)
            return STRING;
        ValueKind best = BOOLEAN;
        for (ValueKind kind : values())
            if (votes[kind.ordinal()] > votes[best.ordinal()])
                best = kind;
        return best;
    }
    
    private static ValueKind kindOf(Object value) {
        if (value instanceof Number)
            return NUMBER;
        if (value instanceof Boolean)
            return BOOLEAN;
        if (value instanceof java.time.LocalDate)
            return DATE;
        if (value instanceof java.time.LocalDateTime || value instanceof java.time.Instant
            || value instanceof java.time.ZonedDateTime || value instanceof java.time.OffsetDateTime
            || value instanceof java.util.Date)
            return DATETIME;
        if (value instanceof java.time.LocalTime)
            return TIME;
        return STRING;
    }
}
