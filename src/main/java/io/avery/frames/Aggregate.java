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
import java.util.Map;
import java.util.Objects;

/**
 * A reducer applied to a column, producing one output column in a reduce or group-by.
 *
 * <p>Example:
 * <pre>{@code
 * Aggregate.of("price", "quantile", 0.9).as("p90")
 * }</pre>
 */
public final class Aggregate {
    private final String column;
    private final String reducer;
    private final Object[] args;
    private final String alias;
    
    private Aggregate(String column, String reducer, Object[] args, String alias) {
        this.column = Objects.requireNonNull(column);
        this.reducer = Objects.requireNonNull(reducer);
        this.args = args;
        this.alias = alias;
    }
    
    /**
     * Creates an aggregate, whose output column is named after the input column.
     *
     * @param column the input column
     * @param reducer the reducer name
     * @param args reducer arguments
     * @return the aggregate
     */
    public static Aggregate of(String column, String reducer, Object... args) {
        return new Aggregate(column, reducer, args, null);
    }
    
    /**
     * Parses an aggregate from a descriptor with the keys {@code column}, {@code reducer}, and optionally
     * {@code args} (a list) and {@code as}.
     *
     * @param descriptor the descriptor map
     * @return the aggregate
     * @throws IllegalArgumentException if the column or reducer is missing
     */
    public static Aggregate parse(Map<String, ?> descriptor) {
        Object column = descriptor.get("column");
        Object reducer = descriptor.get("reducer");
        if (column == null || reducer == null)
            throw new IllegalArgumentException("Aggregate requires a column and a reducer: " + descriptor);
        Object as = descriptor.get("as");
        return new Aggregate(column.toString(), reducer.toString(), Utils.asList(descriptor.get("args")).toArray(),
                             as == null ? null : as.toString());
    }
    
    /**
     * Returns a copy of this aggregate whose output column has the given name.
     *
     * @param alias the output column name
     * @return the renamed aggregate
     */
    public Aggregate as(String alias) {
        return new Aggregate(column, reducer, args, alias);
    }
    
    public String column() {
        return column;
    }
    
    public String reducer() {
        return reducer;
    }
    
    public String alias() {
        return alias;
    }
    
    /**
     * Returns the name of the output column: the alias if given, else the input column.
     */
    public String output() {
        return alias != null ? alias : column;
    }
    
    Object[] args() {
        return args;
    }
    
    @Override
    public String toString() {
        return reducer + "(" + column + (args.length == 0 ? "" : ", " + Arrays.toString(args)) + ")"
            + (alias == null ? "" : " as " + alias);
    }
}
