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
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Joins of any number of frames, each on one of its columns. The rows of the first frame drive the join: for each
 * of them, every other frame is scanned, in its row order, for the first row whose join column equals the first
 * frame's join value.
 *
 * <p>An {@link #inner} join drops a driving row that finds no match in some frame. An {@link #outer} join keeps it,
 * with nulls for that frame's columns; rows found only in the other frames never appear. The output holds the first
 * frame's columns, then each other frame's columns except its join column, renamed {@code <frame name>_<column>}.
 *
 * <p>Example:
 * <pre>{@code
 * DataFrame joined = Joins.inner(Joins.on(orders, "customerId"), Joins.on(customers, "id"));
 * }</pre>
 */
public final class Joins {
    private static final Logger logger = LoggerFactory.getLogger(Joins.class);
    
    private Joins() {}
    
    /**
     * A frame and the column it is joined on.
     */
    public static final class Source {
        final DataFrame frame;
        final String column;
        
        private Source(DataFrame frame, String column) {
            this.frame = Objects.requireNonNull(frame);
            this.column = Objects.requireNonNull(column);
        }
        
        public DataFrame frame() {
            return frame;
        }
        
        public String column() {
            return column;
        }
    }
    
    public static Source on(DataFrame frame, String column) {
        return new Source(frame, column);
    }
    
    public static DataFrame inner(Source... sources) {
        return inner(Arrays.asList(sources));
    }
    
    /**
     * Joins the sources, keeping only driving rows matched in every other frame.
     *
     * @param sources the frames and their join columns; the first drives the join
     * @return the joined frame, named after the first frame
     * @throws IllegalArgumentException if fewer than two sources are given
     * @throws java.util.NoSuchElementException if a join column does not exist
     */
    public static DataFrame inner(List<Source> sources) {
        return join(sources, false);
    }
    
    public static DataFrame outer(Source... sources) {
        return outer(Arrays.asList(sources));
    }
    
    /**
     * Joins the sources, keeping every driving row, with nulls where another frame has no match.
     *
     * @param sources the frames and their join columns; the first drives the join
     * @return the joined frame, named after the first frame
     * @throws IllegalArgumentException if fewer than two sources are given
     * @throws java.util.NoSuchElementException if a join column does not exist
     */
    public static DataFrame outer(List<Source> sources) {
        return join(sources, true);
    }
    
    private static DataFrame join(List<Source> sources, boolean outer) {
        if (sources.size() < 2)
            throw new IllegalArgumentException("Expected at least two frames to join, got " + sources.size());
        Source base = sources.get(0);
        Series<?> baseKeys = base.frame.column(base.column);
        List<Source> others = sources.subList(1, sources.size());
        
        List<Series<?>> output = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (Series<?> column : base.frame.columns()) {
            output.add(Series.empty(column.type(), column.name()));
            names.add(column.name());
        }
        List<List<Series<?>>> joinedColumns = new ArrayList<>();
        for (Source other : others) {
            other.frame.column(other.column);
            List<Series<?>> joined = new ArrayList<>();
            for (Series<?> column : other.frame.columns()) {
                if (column.name().equals(other.column))
                    continue;
                String name = other.frame.name() + "_" + column.name();
                for (int i = 1; names.contains(name); i++)
                    name = other.frame.name() + "_" + column.name() + "_" + i;
                names.add(name);
                joined.add(column);
                output.add(Series.empty(column.type(), name));
            }
            joinedColumns.add(joined);
        }
        
        int row = 0;
        for (Integer baseKey : base.frame.rowKeys()) {
            Object value = baseKeys.value(baseKey);
            int[] matches = new int[others.size()];
            boolean matched = true;
            for (int i = 0; i < others.size(); i++) {
                matches[i] = find(others.get(i), value);
                matched &= matches[i] != -1;
            }
            if (!matched && !outer)
                continue;
            int col = 0;
            for (Series<?> column : base.frame.columns())
                output.get(col++).set(row, column.value(baseKey));
            for (int i = 0; i < others.size(); i++)
                for (Series<?> column : joinedColumns.get(i))
                    output.get(col++).set(row, matches[i] == -1 ? null : column.value(matches[i]));
            row++;
        }
        logger.debug("{} join of '{}' with {} other frame(s): {} rows", outer ? "Outer" : "Inner",
                     base.frame.name(), others.size(), row);
        return DataFrame.ofColumns(base.frame.name(), output);
    }
    
    /**
     * Returns the internal key of the first row, in row order, whose join column equals the value, or -1.
     */
    private static int find(Source source, Object value) {
        if (value == null)
            return -1;
        Series<?> column = source.frame.column(source.column);
        for (Integer key : source.frame.rowKeys())
            if (matches(column, key, value))
                return key;
        return -1;
    }
    
    private static <T> boolean matches(Series<T> column, int key, Object value) {
        T other = column.value(key);
        return other != null && column.type().compare(other, column.type().convert(value)) == 0;
    }
}
