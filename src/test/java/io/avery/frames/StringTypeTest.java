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

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StringTypeTest {
    @Test
    void testLengthConstraints() {
        Series<String> series = Series.of(ValueType.STRING, "s", List.of("ab", "abcd", ""),
                                          Constraints.of("minLen", 1).with("maxLen", 3), Constraints.none());
        assertEquals(List.of("ab"), series.values());
        assertEquals(List.of(0), series.keys());
        
        Series<String> exact = Series.of(ValueType.STRING, "s", List.of("ab", "abc"),
                                         Constraints.of("len", 3), Constraints.none());
        assertEquals(List.of("abc"), exact.values());
    }
    
    @Test
    void testContentConstraints() {
        Series<String> series = Series.of(ValueType.STRING, "s", Arrays.asList("a1", "b2", "", null),
                                          Constraints.of("regex", "^a").with("notNull", true), Constraints.none());
        assertEquals(List.of("a1"), series.values());
        
        Series<String> nonEmpty = Series.of(ValueType.STRING, "s", Arrays.asList("x", "", null),
                                            Constraints.of("notEmpty", true), Constraints.none());
        assertEquals(Arrays.asList("x", null), nonEmpty.values());
        
        Series<String> members = Series.of(ValueType.STRING, "s", List.of("x", "y", "z"),
                                           Constraints.of("in", List.of("x", "z")), Constraints.none());
        assertEquals(List.of("x", "z"), members.values());
    }
    
    @Test
    void testUnknownConstraint() {
        Series<String> series = Series.ofStrings("s", "a");
        assertEquals("Unknown string constraint: min",
                     assertThrows(IllegalArgumentException.class,
                                  () -> series.setValidations(Constraints.of("min", 1))).getMessage());
    }
    
    @Test
    void testLengthReducers() {
        Series<String> series = Series.ofStrings("s", "ab", "c", null);
        assertEquals(3.0, series.reduce("sumLen").value(0));
        assertEquals(1.0, series.reduce("minLen").value(0));
        assertEquals(2.0, series.reduce("maxLen").value(0));
        assertEquals(1.0, series.reduce("avgLen").value(0));
    }
    
    @Test
    void testLengthFilters() {
        Series<String> series = Series.ofStrings("s", "abc", "a", "ab");
        assertEquals(List.of(0, 2), series.match("gtLen", 1).toList());
        assertEquals(List.of(1), series.match("ltLen", 2).toList());
        assertEquals(List.of(0), series.match("eqLen", "maxLen").toList());
        assertEquals(List.of(1, 2), series.match("neqLen", 3).toList());
        assertEquals(List.of(0, 1), series.match("lteLen", List.of(3, 1, 1)).toList());
        assertEquals(List.of(0, 2), series.match("gteLen", 2).toList());
    }
    
    @Test
    void testRegexFilter() {
        Series<String> series = Series.ofStrings("s", "apple", "banana", null, "avocado");
        assertEquals(List.of(0, 3), series.match(new Match().regex("^a")).toList());
        assertEquals(List.of(1), series.match(new Match().regex("an").neq("avocado")).toList());
    }
    
    @Test
    void testTextTransforms() {
        Series<String> series = Series.ofStrings("s", " Hello ");
        assertEquals("hello", series.transform("trim").transform("lowercase").value(0));
        assertEquals(" HELLO ", series.transform("uppercase").value(0));
        
        Series<String> word = Series.ofStrings("s", "hello");
        assertEquals("el", word.transform("substr", 1, 3).value(0));
        assertEquals("llo", word.transform("substr", -3).value(0));
        assertEquals("heLlo", word.transform("replace", "l", "L").value(0));
        assertEquals("<hello>", word.transform("template", "<{s}>").value(0));
        assertEquals("a$b", Series.ofStrings("s", "a.b").transform("replace", ".", "$").value(0));
    }
    
    @Test
    void testCasts() {
        assertEquals(5.0, Series.ofStrings("s", "hello").cast("len").value(0));
        assertEquals(Arrays.asList(42.0, null), Series.ofStrings("s", "42", "x").cast("toNumber").values());
        assertEquals(LocalDate.of(2024, 3, 1), Series.ofStrings("s", "2024-03-01").cast("toDate").value(0));
        assertEquals(LocalDate.of(2024, 3, 1), Series.ofStrings("s", "01/03/2024").cast("toDate", "dd/MM/yyyy").value(0));
        assertEquals(List.of(false, true), Series.ofStrings("s", "", "x").cast("toBoolean").values());
    }
    
    @Test
    void testAnyScalarIsText() {
        Series<String> series = Series.of(ValueType.STRING, "s", List.of(1, true, 'c'));
        assertEquals(List.of("1", "true", "c"), series.values());
    }
}
