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

import java.time.LocalDate;
import java.time.temporal.TemporalField;
import java.util.Arrays;
import java.util.Collections;

/**
 * Calendar dates.
 */
final class DateType extends TemporalType<LocalDate> {
    DateType() {
        super(ValueKind.DATE,
              Arrays.asList("Years", "Months", "Days", "WeekDays", "Quarters"),
              Collections.singletonList("Weeks"),
              Arrays.asList("Years", "Months", "Weeks", "Days"),
              Collections.singletonList("Quarters"));
        caster("toDatetime", (series, args) -> series.mapValues(ValueType.DATETIME, LocalDate::atStartOfDay));
        caster("iso", (series, args) -> series.mapValues(ValueType.STRING, LocalDate::toString));
    }
    
    @Override
    LocalDate coerce(Object raw) {
        return Calendars.toDate(raw);
    }
    
    @Override
    long toMillis(LocalDate value) {
        return Calendars.epochMillis(value);
    }
    
    @Override
    LocalDate fromMillis(long millis) {
        return Calendars.toDate(millis);
    }
    
    @Override
    boolean isSupported(TemporalField field) {
        return field.isDateBased();
    }
}
