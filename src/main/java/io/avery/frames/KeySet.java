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
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable, ordered set of series keys, as produced by filters. Set algebra preserves the order of the left
 * operand, with any keys new to the result appended in the order of the right operand.
 */
public final class KeySet implements Iterable<Integer> {
    private static final KeySet EMPTY = new KeySet(Collections.emptySet());
    
    private final Set<Integer> keys;
    
    private KeySet(Set<Integer> keys) {
        this.keys = keys;
    }
    
    public static KeySet empty() {
        return EMPTY;
    }
    
    public static KeySet of(Integer... keys) {
        return of(Arrays.asList(keys));
    }
    
    public static KeySet of(Iterable<Integer> keys) {
        Set<Integer> set = new LinkedHashSet<>();
        for (Integer key : keys)
            set.add(key);
        return new KeySet(Collections.unmodifiableSet(set));
    }
    
    /**
     * Returns the keys present in both this set and the other.
     *
     * @param other the other key set
     * @return the intersection
     */
    public KeySet and(KeySet other) {
        Set<Integer> set = new LinkedHashSet<>(keys);
        set.retainAll(other.keys);
        return new KeySet(Collections.unmodifiableSet(set));
    }
    
    /**
     * Returns the keys present in either this set or the other.
     *
     * @param other the other key set
     * @return the union
     */
    public KeySet or(KeySet other) {
        Set<Integer> set = new LinkedHashSet<>(keys);
        set.addAll(other.keys);
        return new KeySet(Collections.unmodifiableSet(set));
    }
    
    /**
     * Returns the keys of this set that are not in the other.
     *
     * @param other the other key set
     * @return the difference
     */
    public KeySet diff(KeySet other) {
        Set<Integer> set = new LinkedHashSet<>(keys);
        set.removeAll(other.keys);
        return new KeySet(Collections.unmodifiableSet(set));
    }
    
    /**
     * Returns the keys present in exactly one of this set and the other.
     *
     * @param other the other key set
     * @return the symmetric difference
     */
    public KeySet xor(KeySet other) {
        return diff(other).or(other.diff(this));
    }
    
    public boolean contains(int key) {
        return keys.contains(key);
    }
    
    public int size() {
        return keys.size();
    }
    
    public boolean isEmpty() {
        return keys.isEmpty();
    }
    
    public List<Integer> toList() {
        return new ArrayList<>(keys);
    }
    
    @Override
    public Iterator<Integer> iterator() {
        return keys.iterator();
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof KeySet && keys.equals(((KeySet) o).keys);
    }
    
    @Override
    public int hashCode() {
        return keys.hashCode();
    }
    
    @Override
    public String toString() {
        return keys.toString();
    }
}
