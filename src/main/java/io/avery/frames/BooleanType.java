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

/**
 * Booleans. Text {@code "true"}/{@code "false"} (any case) and numbers (non-zero is true) are accepted.
 */
final class BooleanType extends ValueType<Boolean> {
    BooleanType() {
        super(ValueKind.BOOLEAN);
        
        reducer("and", ValueKind.BOOLEAN, (series, args) -> trueCount(series) == series.size());
        reducer("or", ValueKind.BOOLEAN, (series, args) -> trueCount(series) > 0);
        reducer("nand", ValueKind.BOOLEAN, (series, args) -> trueCount(series) != series.size());
        reducer("nor", ValueKind.BOOLEAN, (series, args) -> trueCount(series) == 0);
        reducer("xor", ValueKind.BOOLEAN, (series, args) -> {
            int trues = trueCount(series);
            return trues > 0 && trues < series.size();
        });
        reducer("xnor", ValueKind.BOOLEAN, (series, args) -> {
            int trues = trueCount(series);
            return trues == 0 || trues == series.size();
        });
        reducer("trueCount", ValueKind.NUMBER, (series, args) -> trueCount(series));
        reducer("falseCount", ValueKind.NUMBER, (series, args) -> countWhere(series, Boolean.FALSE::equals));
        
        transformer("inverse", (series, args) -> series.mapValues(this, v -> !v));
        
        caster("toNumber", (series, args) -> series.mapValues(ValueType.NUMBER, v -> v ? 1 : 0));
    }
    
    @Override
    Boolean coerce(Object raw) {
        if (raw instanceof Boolean)
            return (Boolean) raw;
        if (raw instanceof Number)
            return ((Number) raw).doubleValue() != 0;
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if (text.equalsIgnoreCase("true"))
                return true;
            if (text.equalsIgnoreCase("false"))
                return false;
        }
        return null;
    }
    
    @Override
    int compareValues(Boolean a, Boolean b) {
        return a.compareTo(b);
    }
    
    @Override
    boolean truthy(Boolean value) {
        return value;
    }
    
    private int trueCount(Series<Boolean> series) {
        return countWhere(series, Boolean.TRUE::equals);
    }
}
