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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A predicate over the rows of a {@link DataFrame}: per-column {@link Match}es, optional positional selectors
 * (head, tail, slice), an optional list of record keys, and optional alternatives. All parts are intersected, and
 * the alternatives contribute the union of their own results.
 *
 * @see DataFrame#where(FrameMatch)
 */
public class FrameMatch {
    private final Map<String, Match> columns = new LinkedHashMap<>();
    private final List<FrameMatch> alternatives = new ArrayList<>();
    private Integer head;
    private Integer tail;
    private int[] slice;
    private List<Object> index;
    
    public FrameMatch() {}
    
    /**
     * Parses a frame match from a descriptor map. Keys starting with {@code '$'} name a column and hold a
     * {@link Match#of(Map) match descriptor}. The keys {@code head} and {@code tail} hold counts, {@code slice} holds
     * a {@code [start, end]} pair, {@code index} holds a list of record keys, and {@code or} holds a list of nested
     * frame match descriptors. Any other key is rejected.
     *
     * @param descriptor the descriptor map
     * @return the parsed frame match
     * @throws IllegalArgumentException if the descriptor holds an unknown key or a malformed value
     */
    public static FrameMatch of(Map<String, ?> descriptor) {
        FrameMatch match = new FrameMatch();
        descriptor.forEach((key, value) -> {
            if (key.startsWith("$")) {
                if (!(value instanceof Map))
                    throw new IllegalArgumentException("Invalid match for column " + key + ": " + value);
                match.column(key.substring(1), Match.of(Utils.<Map<String, ?>>cast(value)));
                return;
            }
            switch (key) {
                case "head":
                    match.head(Utils.integer(value, 0));
                    break;
                case "tail":
                    match.tail(Utils.integer(value, 0));
                    break;
                case "slice":
                    List<Object> bounds = Utils.asList(value);
                    if (bounds.isEmpty() || bounds.size() > 2)
                        throw new IllegalArgumentException("Invalid slice: " + value);
                    match.slice(Utils.integer(bounds.get(0), 0),
                                bounds.size() > 1 ? Utils.integer(bounds.get(1), Integer.MAX_VALUE) : Integer.MAX_VALUE);
                    break;
                case "index":
                    match.index(Utils.asList(value).toArray());
                    break;
                case "or":
                    for (Object alternative : Utils.asList(value)) {
                        if (!(alternative instanceof Map))
                            throw new IllegalArgumentException("Invalid alternative match: " + alternative);
                        match.or(of(Utils.<Map<String, ?>>cast(alternative)));
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Invalid frame match key: " + key);
            }
        });
        return match;
    }
    
    /**
     * Restricts the named column to values selected by the given match.
     *
     * @param column the column name
     * @param match the column match
     * @return this frame match
     */
    public FrameMatch column(String column, Match match) {
        columns.put(column, match);
        return this;
    }
    
    /**
     * Restricts to the first {@code n} rows, in iteration order.
     */
    public FrameMatch head(int n) {
        this.head = n;
        return this;
    }
    
    /**
     * Restricts to the last {@code n} rows, in iteration order.
     */
    public FrameMatch tail(int n) {
        this.tail = n;
        return this;
    }
    
    /**
     * Restricts to the rows at positions {@code [start, end)}, in iteration order.
     */
    public FrameMatch slice(int start, int end) {
        this.slice = new int[]{ start, end };
        return this;
    }
    
    /**
     * Restricts to the rows whose key column holds one of the given values.
     */
    public FrameMatch index(Object... keys) {
        this.index = Arrays.asList(keys);
        return this;
    }
    
    public FrameMatch or(FrameMatch... alternatives) {
        this.alternatives.addAll(Arrays.asList(alternatives));
        return this;
    }
    
    public Map<String, Match> columns() {
        return Collections.unmodifiableMap(columns);
    }
    
    public List<FrameMatch> alternatives() {
        return Collections.unmodifiableList(alternatives);
    }
    
    Integer head() {
        return head;
    }
    
    Integer tail() {
        return tail;
    }
    
    int[] slice() {
        return slice;
    }
    
    List<Object> index() {
        return index;
    }
}
