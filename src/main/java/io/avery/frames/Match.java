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
 * A predicate over the values of a single series, made of named filter operators and their operands, plus optional
 * alternative matches. A series evaluates a match by starting from all of its keys, intersecting with the keys
 * selected by each operator, and finally intersecting with the union of the keys selected by the alternatives.
 *
 * <p>Example:
 * <pre>{@code
 * KeySet keys = prices.match(new Match().gte(10).lt(20).or(new Match().eq(0)));
 * }</pre>
 *
 * @see Series#match(Match)
 * @see FrameMatch
 */
public class Match {
    private final Map<String, Object> operators = new LinkedHashMap<>();
    private final List<Match> alternatives = new ArrayList<>();
    
    /**
     * Creates an empty match, which selects every key.
     */
    public Match() {}
    
    /**
     * Parses a match from a descriptor map of operator names to operands. The reserved key {@code "or"} holds a list
     * of nested descriptor maps.
     *
     * @param descriptor the descriptor map
     * @return the parsed match
     * @throws IllegalArgumentException if {@code "or"} does not hold a list of maps
     */
    public static Match of(Map<String, ?> descriptor) {
        Match match = new Match();
        descriptor.forEach((operator, operand) -> {
            if (!"or".equals(operator)) {
                match.op(operator, operand);
                return;
            }
            for (Object alternative : Utils.asList(operand)) {
                if (!(alternative instanceof Map))
                    throw new IllegalArgumentException("Invalid alternative match: " + alternative);
                match.or(of(Utils.<Map<String, ?>>cast(alternative)));
            }
        });
        return match;
    }
    
    /**
     * Adds (or replaces) a filter operator with its operand. The operator name is resolved against the value type of
     * the series the match is evaluated on.
     *
     * @param operator the filter operator name
     * @param operand the operand
     * @return this match
     */
    public Match op(String operator, Object operand) {
        operators.put(operator, operand);
        return this;
    }
    
    public Match eq(Object operand) { return op("eq", operand); }
    public Match neq(Object operand) { return op("neq", operand); }
    public Match gt(Object operand) { return op("gt", operand); }
    public Match gte(Object operand) { return op("gte", operand); }
    public Match lt(Object operand) { return op("lt", operand); }
    public Match lte(Object operand) { return op("lte", operand); }
    public Match in(Object... operands) { return op("in", Arrays.asList(operands)); }
    public Match nin(Object... operands) { return op("nin", Arrays.asList(operands)); }
    public Match inRange(Object from, Object to) { return op("inRange", Arrays.asList(from, to)); }
    public Match ninRange(Object from, Object to) { return op("ninRange", Arrays.asList(from, to)); }
    public Match regex(String pattern) { return op("regex", pattern); }
    
    /**
     * Adds alternative matches. A key passes the alternatives if it passes at least one of them.
     *
     * @param alternatives the alternative matches
     * @return this match
     */
    public Match or(Match... alternatives) {
        this.alternatives.addAll(Arrays.asList(alternatives));
        return this;
    }
    
    public Map<String, Object> operators() {
        return Collections.unmodifiableMap(operators);
    }
    
    public List<Match> alternatives() {
        return Collections.unmodifiableList(alternatives);
    }
    
    @Override
    public String toString() {
        return "Match" + operators + (alternatives.isEmpty() ? "" : " or " + alternatives);
    }
}
