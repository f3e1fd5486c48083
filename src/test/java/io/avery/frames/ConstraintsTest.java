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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConstraintsTest {
    @Test
    void testWithCopies() {
        Constraints base = Constraints.of("min", 0);
        Constraints more = base.with("max", 10);
        assertEquals(Set.of("min"), base.names());
        assertEquals(List.of("min", "max"), List.copyOf(more.names()));
        assertEquals(10, more.param("max"));
        assertNotEquals(base, more);
        assertEquals(more, Constraints.of("min", 0).with("max", 10));
    }
    
    @Test
    void testOfMap() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("notNull", true);
        params.put("regex", "^x");
        Constraints constraints = Constraints.of(params);
        params.put("len", 3);
        assertEquals(2, constraints.names().size());
        assertSame(Constraints.none(), Constraints.of(new LinkedHashMap<>()));
        assertTrue(Constraints.none().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> constraints.asMap().put("len", 3));
    }
    
    @Test
    void testEachKindAcceptsExactlyItsConstraintNames() {
        for (ValueKind kind : ValueKind.values()) {
            ValueType<?> type = kind.type();
            for (String name : type.constraintNames())
                type.checkConstraints(Constraints.of(name, null));
            assertThrows(IllegalArgumentException.class, () -> type.checkConstraints(Constraints.of("unknown", 1)));
        }
        assertTrue(ValueType.STRING.constraintNames().containsAll(List.of("notEmpty", "len", "minLen", "maxLen", "regex")));
        assertTrue(ValueType.DATETIME.constraintNames().containsAll(List.of("inHours", "ninSeconds", "inWeekDays")));
        assertFalse(ValueType.BOOLEAN.constraintNames().contains("min"));
        assertFalse(ValueType.TIME.constraintNames().contains("inDays"));
    }
    
    @Test
    void testNotNull() {
        Series<Double> required = Series.of(ValueType.NUMBER, "n", java.util.Arrays.asList(1, null),
                                            Constraints.of("notNull", true), Constraints.none());
        assertEquals(List.of(0), required.keys());
        
        Series<Double> optional = Series.of(ValueType.NUMBER, "n", java.util.Arrays.asList(1, null),
                                            Constraints.of("notNull", false), Constraints.none());
        assertEquals(List.of(0, 1), optional.keys());
    }
    
    @Test
    void testEqualityConstraints() {
        Series<Boolean> series = Series.ofBooleans("b", true, false, null);
        series.setViolations(Constraints.of("eq", true));
        assertEquals(1.0, series.reduce("violationsCount").value(0));
        series.setValidations(Constraints.of("neq", true));
        assertEquals(List.of(1, 2), series.keys());
    }
}
