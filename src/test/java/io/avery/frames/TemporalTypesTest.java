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
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Period;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TemporalTypesTest {
    private static final LocalDate JAN_15 = LocalDate.of(2024, 1, 15);
    private static final LocalDate FEB_01 = LocalDate.of(2024, 2, 1);
    private static final LocalDate MAR_10 = LocalDate.of(2024, 3, 10);
    
    @Test
    void testDateTotals() {
        Series<LocalDate> dates = Series.ofDates("d", JAN_15, MAR_10, FEB_01);
        assertEquals(JAN_15, dates.reduce("min").value(0));
        assertEquals(MAR_10, dates.reduce("max").value(0));
        assertEquals(55.0, dates.reduce("totalDays").value(0));
        assertEquals(1.0, dates.reduce("totalMonths").value(0));
        assertEquals(7.0, dates.reduce("totalWeeks").value(0));
        assertEquals(0.0, dates.reduce("totalQuarters").value(0));
        assertEquals(ValueKind.NUMBER, dates.reduce("totalDays").kind());
    }
    
    @Test
    void testDateMidpoint() {
        Series<LocalDate> dates = Series.ofDates("d", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));
        assertEquals(LocalDate.of(2024, 1, 2), dates.reduce("mid").value(0));
    }
    
    @Test
    void testCalendarFieldFilters() {
        Series<LocalDate> dates = Series.ofDates("d", JAN_15, MAR_10, FEB_01);
        assertEquals(List.of(0, 1), dates.match("inMonths", List.of(1, 3)).toList());
        assertEquals(List.of(1, 2), dates.match("ninMonths", 1).toList());
        assertEquals(List.of(0), dates.match("inWeekDays", 1).toList());
        assertEquals(List.of(0, 1, 2), dates.match("inYears", 2024).toList());
        assertEquals(List.of(0, 2), dates.match("inQuarters", 1).and(dates.match("ninDays", 10)).toList());
    }
    
    @Test
    void testCalendarFieldConstraints() {
        Series<LocalDate> dates = Series.of(ValueType.DATE, "d", List.of(JAN_15, LocalDate.of(2024, 5, 1)),
                                            Constraints.of("inQuarters", 1), Constraints.none());
        assertEquals(List.of(JAN_15), dates.values());
        assertThrows(IllegalArgumentException.class, () -> dates.setValidations(Constraints.of("inHours", 1)));
        assertThrows(IllegalArgumentException.class, () -> dates.setValidations(Constraints.of("inWeeks", 1)));
    }
    
    @Test
    void testDateArithmetic() {
        Series<LocalDate> dates = Series.ofDates("d", LocalDate.of(2024, 1, 31));
        assertEquals(LocalDate.of(2024, 2, 1), dates.transform("addDays", 1).value(0));
        assertEquals(LocalDate.of(2024, 2, 29), dates.transform("addMonths", 1).value(0));
        assertEquals(LocalDate.of(2025, 1, 31), dates.transform("addYears", 1).value(0));
        assertEquals(LocalDate.of(2024, 2, 14), dates.transform("addWeeks", 2).value(0));
        assertEquals(LocalDate.of(2024, 2, 29), dates.transform("add", "P1M").value(0));
        assertEquals(LocalDate.of(2024, 1, 30), dates.transform("sub", Period.ofDays(1)).value(0));
        assertThrows(IllegalArgumentException.class, () -> dates.transform("add", "soon"));
        assertThrows(IllegalArgumentException.class, () -> dates.transform("addHours", 1));
    }
    
    @Test
    void testDateCasts() {
        Series<LocalDate> dates = Series.ofDates("d", LocalDate.of(2024, 1, 31));
        assertEquals(1.0, dates.cast("unit", "month").value(0));
        assertEquals(3.0, dates.cast("unit", "weekDay").value(0));
        assertEquals("2024-01-31", dates.cast("iso").value(0));
        assertEquals("31.01.2024", dates.cast("format", "dd.MM.yyyy").value(0));
        assertEquals(LocalDateTime.of(2024, 1, 31, 0, 0), dates.cast("toDatetime").value(0));
        assertEquals(86_400_000.0, Series.ofDates("d", LocalDate.of(1970, 1, 2)).cast("toNumber").value(0));
        assertThrows(IllegalArgumentException.class, () -> dates.cast("unit", "hour"));
    }
    
    @Test
    void testDeltaAndCumsumCasts() {
        Series<LocalDate> dates = Series.ofDates("d", LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 1),
                                                 LocalDate.of(2024, 1, 4));
        Series<?> delta = dates.cast("delta", "days");
        assertEquals(List.of(1, 2, 0), delta.keys());
        assertEquals(6.0, delta.value(0));
        assertEquals(0.0, delta.value(1));
        assertEquals(3.0, delta.value(2));
        
        Series<?> cumsum = dates.cast("cumsum", "days");
        assertEquals(9.0, cumsum.value(0));
        assertEquals(0.0, cumsum.value(1));
        assertEquals(3.0, cumsum.value(2));
        
        assertThrows(IllegalArgumentException.class, () -> dates.cast("delta", "hours"));
    }
    
    @Test
    void testDatetimes() {
        Series<LocalDateTime> datetimes = Series.of(ValueType.DATETIME, "t",
                                                    List.of("2024-01-01T10:30:00", "2024-01-01T10:00:00+02:00"));
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 30), datetimes.value(0));
        assertEquals(LocalDateTime.of(2024, 1, 1, 8, 0), datetimes.value(1));
        assertEquals(150.0, datetimes.reduce("totalMinutes").value(0));
        assertEquals(2.0, datetimes.reduce("totalHours").value(0));
        assertEquals(List.of(0), datetimes.match("inHours", 10).toList());
        assertEquals(List.of(10.0, 8.0), datetimes.cast("unit", "hour").values());
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 30), datetimes.transform("addHours", 2).value(0));
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 45), datetimes.transform("add", "PT15M").value(0));
        assertEquals(LocalDate.of(2024, 1, 1), datetimes.cast("toDate").value(0));
        assertEquals(LocalTime.of(10, 30), datetimes.cast("toTime").value(0));
        assertEquals(List.of(1), datetimes.match(new Match().lt("2024-01-01T09:00")).toList());
    }
    
    @Test
    void testTimes() {
        Series<LocalTime> times = Series.of(ValueType.TIME, "t", List.of("08:00", LocalTime.of(12, 30), 3_600_000));
        assertEquals(LocalTime.of(1, 0), times.value(2));
        assertEquals(LocalTime.of(1, 0), times.reduce("min").value(0));
        assertEquals(690.0, times.reduce("totalMinutes").value(0));
        assertEquals(LocalTime.of(1, 30), times.transform("addHours", 13).value(1));
        assertEquals(List.of(8.0, 12.0, 1.0), times.cast("unit", "hour").values());
        assertEquals(List.of(1), times.match("inMinutes", 30).toList());
        assertThrows(IllegalArgumentException.class, () -> times.cast("unit", "month"));
        assertThrows(IllegalArgumentException.class, () -> times.reduce("totalDays"));
        assertTrue(times.type().filterNames().contains("ninSeconds"));
    }
    
    @Test
    void testTypedFactories() {
        Series<LocalDateTime> datetimes = Series.ofDatetimes("t", LocalDateTime.of(2024, 1, 2, 0, 0),
                                                             LocalDateTime.of(2024, 1, 1, 0, 0));
        assertEquals(ValueKind.DATETIME, datetimes.kind());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), datetimes.reduce("min").value(0));
        assertEquals(1.0, datetimes.reduce("totalDays").value(0));
        
        Series<LocalTime> times = Series.ofTimes("t", LocalTime.NOON, null);
        assertEquals(ValueKind.TIME, times.kind());
        assertEquals(1.0, times.reduce("nullCount").value(0));
    }
}
