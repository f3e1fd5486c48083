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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class BooleanTypeTest {
    @Test
    void testLogicalReducers() {
        Series<Boolean> mixed = Series.ofBooleans("b", true, false, true);
        assertEquals(false, mixed.reduce("and").value(0));
        assertEquals(true, mixed.reduce("or").value(0));
        assertEquals(true, mixed.reduce("nand").value(0));
        assertEquals(false, mixed.reduce("nor").value(0));
        assertEquals(true, mixed.reduce("xor").value(0));
        assertEquals(false, mixed.reduce("xnor").value(0));
        assertEquals(2.0, mixed.reduce("trueCount").value(0));
        assertEquals(1.0, mixed.reduce("falseCount").value(0));
        
        Series<Boolean> same = Series.ofBooleans("b", true, true);
        assertEquals(true, same.reduce("and").value(0));
        assertEquals(false, same.reduce("xor").value(0));
        assertEquals(true, same.reduce("xnor").value(0));
    }
    
    @Test
    void testCoercion() {
        Series<Boolean> series = Series.of(ValueType.BOOLEAN, "b", Arrays.asList("TRUE", "false", 0, 2, "maybe"));
        assertEquals(Arrays.asList(true, false, false, true, null), series.values());
    }
    
    @Test
    void testInverseAndCasts() {
        Series<Boolean> series = Series.ofBooleans("b", true, null, false);
        assertEquals(Arrays.asList(false, null, true), series.transform("inverse").values());
        assertEquals(Arrays.asList(1.0, null, 0.0), series.cast("toNumber").values());
        assertEquals(Arrays.asList("true", null, "false"), series.cast("toString").values());
        assertEquals(List.of(true, false, false), series.cast("toBoolean").values());
    }
    
    @Test
    void testFilters() {
        Series<Boolean> series = Series.ofBooleans("b", true, false, true);
        assertEquals(List.of(0, 2), series.match("eq", true).toList());
        assertEquals(List.of(1), series.match(new Match().nin(true)).toList());
    }
}
