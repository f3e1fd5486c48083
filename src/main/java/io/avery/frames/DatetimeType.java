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

import java.time.LocalDateTime;
import java.time.temporal.TemporalField;
import java.util.Arrays;
import java.util.Collections;

/**
 * Dates with a time of day, without a zone. Instants and zoned values are read in UTC.
 */
final class DatetimeType extends TemporalType<LocalDateTime> {
    DatetimeType() {
        super(ValueKind.DATETIME,
              Arrays.asList("Years", "Months", "Days", "WeekDays", "Quarters", "Hours", "Minutes", "Seconds"),
              Collections.singletonList("Weeks"),
              Arrays.asList("Years", "Months", "Weeks", "Days", "Hours", "Minutes", "Seconds", "Ms"),
              Collections.singletonList("Quarters"));
        caster("toDate", (series, args) -> series.mapValues(ValueType.DATE, LocalDateTime::toLocalDate));
        caster("toTime", (series, args) -> series.mapValues(ValueType.TIME, LocalDateTime::toLocalTime));
        caster("iso", (series, args) -> series.mapValues(ValueType.STRING, LocalDateTime::toString));
    }
    
    @Override
    LocalDateTime coerce(Object raw) {
        return Calendars.toDatetime(raw);
    }
    
    @Override
    long toMillis(LocalDateTime value) {
        return Calendars.epochMillis(value);
    }
    
    @Override
    LocalDateTime fromMillis(long millis) {
        return Calendars.toDatetime(millis);
    }
    
    @Override
    boolean isSupported(TemporalField field) {
        return true;
    }
}
