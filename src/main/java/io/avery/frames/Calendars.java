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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Conversions from raw values to the calendar values held by date, datetime and time series. Every conversion
 * returns null for input it cannot interpret. Epoch milliseconds and instants are read in UTC.
 */
public final class Calendars {
    private static final long MILLIS_PER_DAY = 86_400_000L;
    
    private Calendars() {}
    
    public static LocalDate toDate(Object raw) {
        return toDate(raw, null);
    }
    
    /**
     * Converts a raw value to a date.
     *
     * @param raw the raw value: a calendar value, epoch milliseconds, or text
     * @param pattern a {@link DateTimeFormatter} pattern for text input, or null for ISO-8601
     * @return the date, or null if the value cannot be interpreted as one
     */
    public static LocalDate toDate(Object raw, String pattern) {
        if (raw == null || raw instanceof LocalTime)
            return null;
        if (raw instanceof LocalDate)
            return (LocalDate) raw;
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if (pattern != null)
                return parse(text, pattern, LocalDate::from);
            LocalDate date = parse(text, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from);
            if (date != null)
                return date;
        }
        LocalDateTime datetime = toDatetime(raw);
        return datetime == null ? null : datetime.toLocalDate();
    }
    
    public static LocalDateTime toDatetime(Object raw) {
        return toDatetime(raw, null);
    }
    
    /**
     * Converts a raw value to a datetime.
     *
     * @param raw the raw value: a calendar value, epoch milliseconds, or text
     * @param pattern a {@link DateTimeFormatter} pattern for text input, or null for ISO-8601
     * @return the datetime, or null if the value cannot be interpreted as one
     */
    public static LocalDateTime toDatetime(Object raw, String pattern) {
        if (raw == null || raw instanceof LocalTime)
            return null;
        if (raw instanceof LocalDateTime)
            return (LocalDateTime) raw;
        if (raw instanceof LocalDate)
            return ((LocalDate) raw).atStartOfDay();
        if (raw instanceof Instant)
            return LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC);
        if (raw instanceof ZonedDateTime)
            return ((ZonedDateTime) raw).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        if (raw instanceof OffsetDateTime)
            return ((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        if (raw instanceof Date)
            return LocalDateTime.ofInstant(((Date) raw).toInstant(), ZoneOffset.UTC);
        if (raw instanceof Number)
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) raw).longValue()), ZoneOffset.UTC);
        if (!(raw instanceof CharSequence))
            return null;
        String text = raw.toString().trim();
        if (pattern != null)
            return parse(text, pattern, LocalDateTime::from);
        LocalDateTime datetime = parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from);
        if (datetime != null)
            return datetime;
        OffsetDateTime offset = parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from);
        if (offset != null)
            return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        LocalDate date = parse(text, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from);
        return date == null ? null : date.atStartOfDay();
    }
    
    public static LocalTime toTime(Object raw) {
        return toTime(raw, null);
    }
    
    /**
     * Converts a raw value to a time of day. Numbers are read as milliseconds since midnight, wrapping at a day.
     *
     * @param raw the raw value: a calendar value, milliseconds of day, or text
     * @param pattern a {@link DateTimeFormatter} pattern for text input, or null for ISO-8601
     * @return the time, or null if the value cannot be interpreted as one
     */
    public static LocalTime toTime(Object raw, String pattern) {
        if (raw == null || raw instanceof LocalDate)
            return null;
        if (raw instanceof LocalTime)
            return (LocalTime) raw;
        if (raw instanceof Number)
            return LocalTime.ofNanoOfDay(Math.floorMod(((Number) raw).longValue(), MILLIS_PER_DAY) * 1_000_000L);
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if (pattern != null)
                return parse(text, pattern, LocalTime::from);
            LocalTime time = parse(text, DateTimeFormatter.ISO_LOCAL_TIME, LocalTime::from);
            if (time != null)
                return time;
        }
        LocalDateTime datetime = toDatetime(raw);
        return datetime == null ? null : datetime.toLocalTime();
    }
    
    static long epochMillis(LocalDate date) {
        return date.toEpochDay() * MILLIS_PER_DAY;
    }
    
    static long epochMillis(LocalDateTime datetime) {
        return datetime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
    
    static long millisOfDay(LocalTime time) {
        return time.toNanoOfDay() / 1_000_000L;
    }
    
    private static <T> T parse(String text, String pattern, java.time.temporal.TemporalQuery<T> query) {
        return parse(text, DateTimeFormatter.ofPattern(pattern), query);
    }
    
    private static <T> T parse(String text, DateTimeFormatter formatter, java.time.temporal.TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
