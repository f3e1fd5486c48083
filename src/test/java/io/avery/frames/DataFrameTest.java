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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DataFrameTest {
    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2)
            row.put((String) kv[i], kv[i + 1]);
        return row;
    }
    
    private static DataFrame people() {
        return DataFrame.of("people", List.of(
            row("name", "ann", "age", 30, "city", "x"),
            row("name", "bob", "age", null, "city", "y"),
            row("name", "cy", "age", 25)
        ));
    }
    
    private static List<Object> names(DataFrame frame) {
        return values(frame, "name");
    }
    
    private static List<Object> values(DataFrame frame, String column) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> record : frame.records())
            values.add(record.get(column));
        return values;
    }
    
    // ---- construction
    
    @Test
    void testOfRecords() {
        DataFrame people = people();
        assertEquals(List.of("name", "age", "city"), people.columnNames());
        assertEquals(3, people.size());
        assertEquals(ValueKind.NUMBER, people.column("age").kind());
        assertEquals(ValueKind.STRING, people.column("city").kind());
        assertEquals(row("name", "cy", "age", 25.0, "city", null), people.records().get(2));
        assertEquals(DataFrame.INDEX_COLUMN, people.keyColumn());
        assertEquals(List.of(0.0, 1.0, 2.0), people.index().values());
    }
    
    @Test
    void testOfRecordsWithOptions() {
        DataFrame byName = DataFrame.of("people", List.of(row("name", "ann", "age", 30), row("name", "bob")),
                                        options -> options.index("name").kind("age", ValueKind.STRING));
        assertEquals("name", byName.keyColumn());
        assertEquals(List.of("name", "age"), byName.columnNames());
        assertEquals(ValueKind.STRING, byName.column("age").kind());
        assertNull(byName.record("bob").get("age"));
        assertThrows(NoSuchElementException.class, () -> byName.record("zed"));
        
        DataFrame ages = DataFrame.of("people", List.of(row("name", "ann", "age", 30)), options -> options.select("age"));
        assertEquals(List.of("age"), ages.columnNames());
    }
    
    @Test
    void testInvalidColumn() {
        NoSuchElementException e = assertThrows(NoSuchElementException.class, () -> people().column("zzz"));
        assertEquals("Invalid column: zzz", e.getMessage());
    }
    
    @Test
    void testOfColumnsFillsKeys() {
        Series<Double> a = Series.ofNumbers("a", 1, 2, 3);
        Series<String> b = Series.ofStrings("b", "x");
        DataFrame frame = DataFrame.ofColumns("f", List.of(a, b));
        assertEquals(3, frame.size());
        assertSame(b, frame.column("b"));
        assertTrue(b.hasKey(2));
        assertNull(b.value(2));
        
        assertThrows(IllegalArgumentException.class,
                     () -> DataFrame.ofColumns("f", List.of(a, Series.ofNumbers("a", 4))));
    }
    
    // ---- rows
    
    @Test
    void testAddRecordTakesSmallestUnusedKey() {
        DataFrame people = people();
        people.removeRecord(1);
        assertEquals(2, people.size());
        people.addRecord(row("name", "dan"));
        assertEquals("dan", people.column("name").value(1));
        assertEquals(1.0, people.index().value(1));
        assertEquals(row("name", "dan", "age", null, "city", null), people.records().get(2));
    }
    
    @Test
    void testAddRecordRejectsDuplicateKey() {
        DataFrame frame = DataFrame.of("t", List.of(row("id", 1, "v", "a")), options -> options.index("id"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> frame.addRecord(row("id", 1, "v", "b")));
        assertEquals("Duplicate record key: 1", e.getMessage());
        assertEquals(1, frame.size());
    }
    
    @Test
    void testAddRecordRollsBack() {
        DataFrame frame = DataFrame.of("t", List.of(row("id", 1, "v", 10)), options -> options.index("id"));
        assertThrows(IllegalArgumentException.class, () -> frame.addRecord(row("id", 2, "v", new HashMap<>())));
        assertEquals(1, frame.size());
        assertFalse(frame.index().hasValue(2));
        assertFalse(frame.column("v").hasKey(1));
    }
    
    @Test
    void testUpdate() {
        DataFrame frame = DataFrame.of("t", List.of(row("id", 1, "v", "a"), row("id", 2, "v", "b")),
                                       options -> options.index("id"));
        frame.update(2, row("v", "c"));
        assertEquals("c", frame.record(2).get("v"));
        
        assertThrows(IllegalStateException.class, () -> frame.update(1, row("id", 2)));
        assertThrows(NoSuchElementException.class, () -> frame.update(9, row("v", "z")));
        assertThrows(NoSuchElementException.class, () -> frame.update(1, row("nope", 1)));
        assertEquals(List.of(row("id", 1.0, "v", "a"), row("id", 2.0, "v", "c")), frame.records());
    }
    
    @Test
    void testCloneIsIndependent() {
        DataFrame people = people();
        DataFrame copy = people.clone();
        assertEquals(people.records(), copy.records());
        assertNotSame(people.column("name"), copy.column("name"));
        copy.update(0, row("name", "zed"));
        assertEquals("ann", people.record(0).get("name"));
        assertEquals("zed", copy.record(0).get("name"));
    }
    
    // ---- columns
    
    @Test
    void testSelectSharesColumns() {
        DataFrame people = people();
        DataFrame ages = people.select("age");
        assertEquals(List.of("age"), ages.columnNames());
        assertSame(people.column("age"), ages.column("age"));
        
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("age", "years");
        renames.put("name", null);
        DataFrame renamed = people.select(renames);
        assertEquals(List.of("years", "name"), renamed.columnNames());
        assertNotSame(people.column("age"), renamed.column("years"));
        assertSame(people.column("name"), renamed.column("name"));
        assertTrue(people.hasColumn("age"));
        
        assertEquals(List.of("name", "age"), people.unselect("city").columnNames());
        assertThrows(NoSuchElementException.class, () -> people.select("nope"));
    }
    
    @Test
    void testRenameSharedColumn() {
        DataFrame people = people();
        DataFrame ages = people.select("age");
        people.renameColumn("age", "years");
        assertEquals(List.of("years"), ages.columnNames());
        assertThrows(IllegalArgumentException.class, () -> people.renameColumn("years", "name"));
    }
    
    @Test
    void testAddColumn() {
        DataFrame people = people();
        people.addColumn(Series.ofNumbers("age", 1, 2, 3));
        assertEquals(List.of("name", "age", "city", "age_1"), people.columnNames());
        
        people.addColumn("score", Arrays.asList(7, 8, 9, 10));
        assertEquals(List.of(7.0, 8.0, 9.0), people.column("score").values());
    }
    
    @Test
    void testDeleteKeyColumnResetsIndex() {
        DataFrame frame = DataFrame.of("people", List.of(row("name", "ann", "age", 30), row("name", "bob", "age", 40)),
                                       options -> options.index("name"));
        assertThrows(NoSuchElementException.class, () -> frame.deleteColumns("age", "missing"));
        assertTrue(frame.hasColumn("age"));
        
        frame.deleteColumns("name");
        assertEquals(DataFrame.INDEX_COLUMN, frame.keyColumn());
        assertEquals(List.of("age"), frame.columnNames());
        assertEquals(2, frame.size());
        assertEquals(row("age", 40.0), frame.record(1));
    }
    
    @Test
    void testResetIndex() {
        DataFrame frame = DataFrame.of("people", List.of(row("name", "ann"), row("name", "bob")),
                                       options -> options.index("name"));
        frame.resetIndex();
        assertEquals(DataFrame.INDEX_COLUMN, frame.keyColumn());
        assertEquals(List.of("name"), frame.columnNames());
        assertEquals("bob", frame.record(1).get("name"));
    }
    
    @Test
    void testAddRecordAfterResetIndexOnSparseKeys() {
        DataFrame frame = DataFrame.of("t", List.of(row("id", 10, "v", "a"), row("id", 11, "v", "b"),
                                                    row("id", 12, "v", "c"), row("id", 13, "v", "d")),
                                       options -> options.index("id"));
        DataFrame later = frame.where(new FrameMatch().column("id", new Match().gte(12)));
        later.resetIndex();
        assertEquals(List.of(0.0, 1.0), later.index().values());
        
        later.addRecord(row("id", 99, "v", "e"));
        assertEquals(List.of(0.0, 1.0, 2.0), later.index().values());
        assertEquals(row("id", 12.0, "v", "c"), later.record(0));
        assertEquals(row("id", 99.0, "v", "e"), later.record(2));
    }
    
    @Test
    void testAddRecordOnColumnsWithSparseKeys() {
        Series<Double> a = Series.ofNumbers("a", 1, 2, 3, 4).filter(new Match().gte(3));
        DataFrame frame = DataFrame.ofColumns("f", List.of(a));
        frame.addRecord(row("a", 5));
        assertEquals(List.of(0.0, 1.0, 2.0), frame.index().values());
        assertEquals(row("a", 3.0), frame.record(0));
        assertEquals(row("a", 5.0), frame.record(2));
    }
    
    @Test
    void testHeadTailSlice() {
        DataFrame people = people();
        assertEquals(List.of("ann", "bob"), names(people.head(2)));
        assertEquals(List.of("cy"), names(people.tail(1)));
        assertEquals(List.of("bob"), names(people.slice(-2, -1)));
        assertEquals(List.of(), names(people.slice(2, 1)));
        assertEquals(3, people.size());
    }
    
    // ---- ordering and filtering
    
    @Test
    void testSortWithTiebreakers() {
        DataFrame frame = DataFrame.of("t", List.of(
            row("g", "a", "n", 2, "tag", "a2"),
            row("g", "b", "n", 1, "tag", "b1"),
            row("g", "a", "n", 1, "tag", "a1")
        ));
        frame.sort(false, "g", "n");
        assertEquals("g", frame.sortColumn());
        assertEquals(List.of("a1", "a2", "b1"), values(frame, "tag"));
        
        frame.sort(true, "n");
        assertEquals(List.of("a2", "b1", "a1"), values(frame, "tag"));
    }
    
    @Test
    void testSortedOrderSurvivesSelect() {
        DataFrame people = people().sort(true, "name");
        assertEquals(List.of("cy", "bob", "ann"), names(people.select("name")));
        assertEquals(List.of("cy", "bob"), names(people.head(2)));
    }
    
    @Test
    void testWhere() {
        DataFrame people = people();
        DataFrame older = people.where(new FrameMatch().column("age", new Match().gte(26)));
        assertEquals(List.of("ann"), names(older));
        assertEquals(3, people.size());
    }
    
    @Test
    void testFillAndOmitNulls() {
        DataFrame people = people();
        people.fillNulls("age", "max");
        assertEquals(30.0, people.column("age").value(1));
        
        DataFrame cities = people();
        cities.omitNulls("city");
        assertEquals(List.of("ann", "bob"), names(cities));
        
        DataFrame complete = people();
        complete.omitNulls();
        assertEquals(List.of("ann"), names(complete));
    }
    
    @Test
    void testTransformAndCast() {
        DataFrame people = people();
        people.transform("age", "add", "next", 1);
        assertEquals(Arrays.asList(31.0, null, 26.0), people.column("next").values());
        assertEquals(List.of("name", "age", "city", "next"), people.columnNames());
        
        people.cast("age", "toString", null);
        assertEquals(ValueKind.STRING, people.column("age").kind());
        assertEquals("30", people.column("age").value(0));
        
        assertThrows(IllegalArgumentException.class, () -> people.transform("name", "round", null));
    }
    
    // ---- aggregation
    
    @Test
    void testReduce() {
        DataFrame reduced = people().reduce(List.of(Aggregate.of("age", "max").as("oldest"), Aggregate.of("name", "count")));
        assertEquals(List.of(row("oldest", 30.0, "name", 3.0)), reduced.records());
        assertThrows(IllegalArgumentException.class, () -> people().reduce(List.of(Aggregate.of("name", "sum"))));
    }
    
    @Test
    void testGroupBy() {
        DataFrame sales = DataFrame.of("sales", List.of(
            row("region", "east", "amount", 100),
            row("region", "west", "amount", 80),
            row("region", "east", "amount", 20),
            row("region", "east", "amount", 45)
        ));
        DataFrame totals = sales.groupBy(List.of("region"), List.of(Aggregate.of("amount", "sum").as("total"),
                                                                    Aggregate.of("amount", "count").as("n")));
        assertEquals(List.of(
            row("region", "east", "total", 165.0, "n", 3.0),
            row("region", "west", "total", 80.0, "n", 1.0)
        ), totals.records());
        
        assertThrows(IllegalArgumentException.class,
                     () -> sales.groupBy(List.of("region"), List.of(Aggregate.of("amount", "sum").as("region"))));
        assertThrows(IllegalArgumentException.class,
                     () -> sales.groupBy(List.of(), List.of(Aggregate.of("amount", "sum"))));
    }
    
    @Test
    void testMergeColumns() {
        DataFrame frame = DataFrame.of("f", List.of(row("a", 1, "b", 2), row("a", 3, "b", 4)));
        frame.mergeColumns(List.of("a", "b"), ColumnMerge.Operator.CALCULATE, "a + b", "c", Alignment.LEFT, false);
        assertEquals(List.of(3.0, 7.0), frame.column("c").values());
        assertEquals(List.of("a", "b", "c"), frame.columnNames());
        
        frame.mergeColumns(List.of("a", "b"), ColumnMerge.Operator.MERGE, "max", "m", Alignment.LEFT, true);
        assertEquals(List.of("c", "m"), frame.columnNames());
        assertEquals(List.of(2.0, 4.0), frame.column("m").values());
    }
    
    // ---- combining frames
    
    private static DataFrame left() {
        return DataFrame.of("l", List.of(row("id", 1, "v", "A"), row("id", 2, "v", "B")));
    }
    
    private static DataFrame right() {
        return DataFrame.of("r", List.of(row("id", 2, "w", "X"), row("id", 3, "w", "Y")));
    }
    
    @Test
    void testMergeAlignments() {
        DataFrame inner = left().merge(right(), "id", "id", Alignment.INNER);
        assertEquals(List.of(row("id", 2.0, "v", "B", "r_w", "X")), inner.records());
        assertEquals("id", inner.keyColumn());
        
        assertEquals(List.of(
            row("id", 1.0, "v", "A", "r_w", null),
            row("id", 2.0, "v", "B", "r_w", "X"),
            row("id", 3.0, "v", null, "r_w", "Y")
        ), left().merge(right(), "id", "id", Alignment.OUTER).records());
        
        assertEquals(List.of(
            row("id", 1.0, "v", "A", "r_w", null),
            row("id", 2.0, "v", "B", "r_w", "X")
        ), left().merge(right(), "id", "id", Alignment.LEFT).records());
        
        assertEquals(List.of(
            row("id", 2.0, "v", "B", "r_w", "X"),
            row("id", 3.0, "v", null, "r_w", "Y")
        ), left().merge(right(), "id", "id", Alignment.RIGHT).records());
    }
    
    @Test
    void testMergeRejectsKindMismatch() {
        DataFrame strings = DataFrame.of("s", List.of(row("id", "2", "w", "X")));
        assertThrows(IllegalArgumentException.class, () -> left().merge(strings, "id", "id", Alignment.INNER));
    }
    
    @Test
    void testConcatWithMapping() {
        DataFrame left = left();
        DataFrame other = DataFrame.of("o", List.of(row("ident", 5, "v", "Z", "extra", true)));
        DataFrame combined = left.concat(other, Map.of("ident", "id"));
        assertEquals(3, combined.size());
        assertEquals(row("id", 5.0, "v", "Z"), combined.records().get(2));
        assertEquals(2, left.size());
    }
}
