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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, ordered set of named constraints, each with a parameter. Constraints are used by a {@link Series}
 * both as validations (values that fail are refused) and as violations (values that fail are kept but reported as
 * unstable).
 *
 * <p>Constraint names are checked against the value type of the series they are assigned to; see
 * {@link ValueType#constraintNames()}.
 */
public final class Constraints {
    private static final Constraints NONE = new Constraints(Collections.emptyMap());
    
    private final Map<String, Object> params;
    
    private Constraints(Map<String, Object> params) {
        this.params = params;
    }
    
    /**
     * Returns an empty set of constraints.
     *
     * @return an empty set of constraints
     */
    public static Constraints none() {
        return NONE;
    }
    
    /**
     * Returns constraints holding a single named constraint.
     *
     * @param name the constraint name
     * @param param the constraint parameter
     * @return constraints holding a single named constraint
     */
    public static Constraints of(String name, Object param) {
        return NONE.with(name, param);
    }
    
    /**
     * Returns constraints holding the given name/parameter pairs.
     *
     * @param params the constraint parameters by name
     * @return constraints holding the given pairs
     */
    public static Constraints of(Map<String, ?> params) {
        if (params == null || params.isEmpty())
            return NONE;
        Map<String, Object> copy = new LinkedHashMap<>();
        params.forEach((name, param) -> copy.put(Objects.requireNonNull(name), param));
        return new Constraints(Collections.unmodifiableMap(copy));
    }
    
    /**
     * Returns a copy of these constraints with the named constraint added or replaced.
     *
     * @param name the constraint name
     * @param param the constraint parameter
     * @return a copy of these constraints with the named constraint set
     */
    public Constraints with(String name, Object param) {
        Map<String, Object> copy = new LinkedHashMap<>(params);
        copy.put(Objects.requireNonNull(name), param);
        return new Constraints(Collections.unmodifiableMap(copy));
    }
    
    public boolean isEmpty() {
        return params.isEmpty();
    }
    
    public Set<String> names() {
        return params.keySet();
    }
    
    public Object param(String name) {
        return params.get(name);
    }
    
    public Map<String, Object> asMap() {
        return params;
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof Constraints && params.equals(((Constraints) o).params);
    }
    
    @Override
    public int hashCode() {
        return params.hashCode();
    }
    
    @Override
    public String toString() {
        return "Constraints" + params;
    }
}
