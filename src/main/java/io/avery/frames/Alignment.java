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
 * How series of unequal length are lined up when combined positionally, or how the keys of two frames are combined
 * when merged.
 */
public enum Alignment {
    /** Shortest series; keys present on both sides. */
    INNER,
    /** Longest series; keys present on either side. */
    OUTER,
    /** First series; keys of the left side. */
    LEFT,
    /** Last series; keys of the right side. */
    RIGHT;
    
    /**
     * Returns the number of positions a positional combination of the given series produces.
     *
     * @param series the series being combined
     * @return the output length
     */
    public int length(List<? extends Series<?>> series) {
        if (series.isEmpty())
            return 0;
        switch (this) {
            case INNER: return series.stream().mapToInt(Series::size).min().getAsInt();
            case OUTER: return series.stream().mapToInt(Series::size).max().getAsInt();
            case LEFT: return series.get(0).size();
            case RIGHT: return series.get(series.size() - 1).size();
            default: throw new AssertionError();
        }
    }
    
    public static Alignment of(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment: " + name, e);
        }
    }
}
