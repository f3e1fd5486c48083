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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PipelineTest {
    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2)
            row.put((String) kv[i], kv[i + 1]);
        return row;
    }
    
    private static Map<String, Object> step(String kind, Object descriptor) {
        return row(kind, descriptor);
    }
    
    private static DataFrame sales() {
        return DataFrame.of("sales", List.of(
            row("region", "east", "amount", 100, "note", "x"),
            row("region", "west", "amount", 80),
            row("region", "east", "amount", 20),
            row("region", "west", "amount", -5),
            row("region", "east", "amount", 45)
        ));
    }
    
    private static List<Object> values(DataFrame frame, String column) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> record : frame.records())
            values.add(record.get(column));
        return values;
    }
    
    @Test
    void testEndToEnd() {
        DataFrame sales = sales();
        Pipeline pipeline = Pipeline.of(p -> p
            .filter(new FrameMatch().column("amount", new Match().gt(0)))
            .transformAs("amountK", "amount", "divideBy", 1000)
            .groupBy(List.of("region"), Aggregate.of("amount", "sum").as("total"))
            .sort(true, "total")
        );
        DataFrame result = sales.aggregate(pipeline);
        assertEquals(List.of(
            row("region", "east", "total", 165.0),
            row("region", "west", "total", 80.0)
        ), result.records());
        assertEquals(5, sales.size());
        assertEquals(List.of("region", "amount", "note"), sales.columnNames());
    }
    
    @Test
    void testParsedPipelineMatchesBuiltPipeline() {
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("filter", row("$amount", row("gt", 0))));
        descriptors.add(step("groupBy", row("by", List.of("region"),
                                            "aggregates", List.of(row("column", "amount", "reducer", "sum", "as", "total")))));
        descriptors.add(step("sort", row("by", List.of("total"), "desc", true)));
        Pipeline parsed = Pipeline.parse(descriptors);
        
        Pipeline built = Pipeline.of(p -> p
            .filter(new FrameMatch().column("amount", new Match().gt(0)))
            .groupBy(List.of("region"), Aggregate.of("amount", "sum").as("total"))
            .sort(true, "total")
        );
        assertEquals(built.stepKinds(), parsed.stepKinds());
        assertEquals(built.apply(sales()).records(), parsed.apply(sales()).records());
    }
    
    @Test
    void testUnrecognizedStepIsSkipped() {
        Pipeline pipeline = Pipeline.parse(List.of(step("bogus", 1), step("omit", List.of("note"))));
        assertEquals(1, pipeline.size());
        assertEquals(List.of("region", "amount"), pipeline.apply(sales()).columnNames());
    }
    
    @Test
    void testStepWithSeveralKinds() {
        Map<String, Object> descriptor = row("omit", List.of("note"), "select", List.of("amount"));
        assertThrows(IllegalArgumentException.class, () -> Pipeline.parse(List.of(descriptor)));
    }
    
    @Test
    void testUnknownNamesFailOnBuild() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                                  () -> Pipeline.of(p -> p.transform("amount", "nope")));
        assertEquals("Unknown transformer: nope", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Pipeline.of(p -> p.cast("amount", "nope")));
        assertThrows(IllegalArgumentException.class,
                     () -> Pipeline.of(p -> p.groupBy(List.of("region"), Aggregate.of("amount", "nope"))));
        assertThrows(IllegalArgumentException.class,
                     () -> Pipeline.of(p -> p.filter(new FrameMatch().column("amount", new Match().op("nope", 1)))));
        assertThrows(IllegalArgumentException.class,
                     () -> Pipeline.of(p -> p.merge(ColumnMerge.Operator.MERGE, List.of("amount"), "nope", "m")));
        assertThrows(IllegalArgumentException.class,
                     () -> Pipeline.of(p -> p.merge(ColumnMerge.Operator.CALCULATE, List.of("amount"), "amount +", "m")));
    }
    
    @Test
    void testKindMismatchFailsOnApply() {
        Pipeline pipeline = Pipeline.of(p -> p.transform("region", "round"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> pipeline.apply(sales()));
        assertEquals("string series does not have operator: round", e.getMessage());
        
        Pipeline missing = Pipeline.of(p -> p.select("nope"));
        assertThrows(NoSuchElementException.class, () -> missing.apply(sales()));
    }
    
    @Test
    void testOperationsReadTheFrameAsItWas() {
        DataFrame frame = DataFrame.of("t", List.of(row("a", 1)));
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("transform", List.of(
            row("column", "a", "operator", "times", "args", List.of(2)),
            row("column", "a", "operator", "add", "args", List.of(100), "as", "c")
        )));
        DataFrame result = Pipeline.parse(descriptors).apply(frame);
        assertEquals(List.of(row("a", 2.0, "c", 101.0)), result.records());
        assertEquals(List.of(row("a", 1.0)), frame.records());
    }
    
    @Test
    void testCast() {
        DataFrame result = Pipeline.of(p -> p.castAs("label", "amount", "toString")).apply(sales());
        assertEquals(ValueKind.STRING, result.column("label").kind());
        assertEquals("100", result.column("label").value(0));
        assertEquals(ValueKind.NUMBER, result.column("amount").kind());
    }
    
    @Test
    void testClean() {
        DataFrame frame = DataFrame.of("t", Arrays.asList(row("n", null), row("n", 5), row("n", -1)));
        DataFrame result = Pipeline.of(p -> p.clean(c -> c
            .fillNulls("n", "max")
            .validations("n", Constraints.of("min", 0))
        )).apply(frame);
        assertEquals(Arrays.asList(5.0, 5.0, null), values(result, "n"));
        assertEquals(3, result.size());
        
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("clean", List.of(row("column", "n", "omitNulls", true))));
        assertEquals(List.of(5.0, -1.0), values(Pipeline.parse(descriptors).apply(frame), "n"));
    }
    
    @Test
    void testCleanFillsStringsWithMode() {
        DataFrame frame = DataFrame.of("t", Arrays.asList(row("s", "x"), row("s", null), row("s", "x")));
        DataFrame result = Pipeline.of(p -> p.clean(c -> c.fillNulls("s", "mode"))).apply(frame);
        assertEquals(List.of("x", "x", "x"), values(result, "s"));
        
        frame = DataFrame.of("t", Arrays.asList(row("s", "y"), row("s", null), row("s", "y")));
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("clean", List.of(row("column", "s", "fillNulls", "mode"))));
        assertEquals(List.of("y", "y", "y"), values(Pipeline.parse(descriptors).apply(frame), "s"));
    }
    
    @Test
    void testCleanChecksConstraints() {
        assertThrows(IllegalArgumentException.class,
                     () -> Pipeline.of(p -> p.clean(c -> c.validations("n", Constraints.of("bogus", 1)))));
        
        Pipeline pipeline = Pipeline.of(p -> p.clean(c -> c.violations("region", Constraints.of("min", 0))));
        assertThrows(IllegalArgumentException.class, () -> pipeline.apply(sales()));
    }
    
    @Test
    void testMerge() {
        DataFrame frame = DataFrame.of("t", List.of(row("a", 1, "b", 2), row("a", 3, "b", 4)));
        DataFrame sum = Pipeline.of(p -> p.merge(ColumnMerge.Operator.CALCULATE, List.of("a", "b"), "a + b", "c"))
            .apply(frame);
        assertEquals(List.of(3.0, 7.0), values(sum, "c"));
        
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("merge", row("columns", List.of("a", "b"), "operator", "concat", "argument", "/",
                                          "as", "ab", "replace", true)));
        DataFrame joined = Pipeline.parse(descriptors).apply(frame);
        assertEquals(List.of("ab"), joined.columnNames());
        assertEquals(List.of("1/2", "3/4"), values(joined, "ab"));
    }
    
    @Test
    void testConcatFromRegistry() {
        FrameRegistry registry = new FrameRegistry()
            .register(DataFrame.of("archive", List.of(row("region", "north", "amt", 7))));
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("concat", row("frame", "archive", "columns", row("amt", "amount"))));
        DataFrame result = Pipeline.parse(descriptors).apply(sales(), registry);
        assertEquals(6, result.size());
        assertEquals(row("region", "north", "amount", 7.0, "note", null), result.records().get(5));
        
        Pipeline missing = Pipeline.of(p -> p.concat("nope"));
        assertThrows(NoSuchElementException.class, () -> missing.apply(sales(), registry));
    }
    
    @Test
    void testJoinFromRegistry() {
        FrameRegistry registry = new FrameRegistry().register(DataFrame.of("regions", List.of(
            row("code", "east", "manager", "kim"),
            row("code", "west", "manager", "lee")
        )));
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("groupBy", row("by", List.of("region"),
                                            "aggregates", List.of(row("column", "amount", "reducer", "count", "as", "n")))));
        descriptors.add(step("join", row("frame", "regions", "on", List.of("region", "code"), "alignment", "left")));
        DataFrame result = Pipeline.parse(descriptors).apply(sales(), registry);
        assertEquals(List.of(
            row("region", "east", "n", 3.0, "regions_manager", "kim"),
            row("region", "west", "n", 2.0, "regions_manager", "lee")
        ), result.records());
    }
    
    @Test
    void testProjectionAndSortDescriptors() {
        List<Map<String, Object>> descriptors = new ArrayList<>();
        Map<String, Object> renames = new LinkedHashMap<>();
        renames.put("amount", "amt");
        renames.put("region", null);
        descriptors.add(step("select", renames));
        descriptors.add(step("sort", List.of("amt")));
        DataFrame result = Pipeline.parse(descriptors).apply(sales());
        assertEquals(List.of("amt", "region"), result.columnNames());
        assertEquals(List.of(-5.0, 20.0, 45.0, 80.0, 100.0), values(result, "amt"));
    }
    
    @Test
    void testReduce() {
        List<Map<String, Object>> descriptors = new ArrayList<>();
        descriptors.add(step("reduce", List.of(row("column", "amount", "reducer", "sum"),
                                               row("column", "region", "reducer", "count", "as", "rows"))));
        DataFrame result = Pipeline.parse(descriptors).apply(sales());
        assertEquals(List.of(row("amount", 240.0, "rows", 5.0)), result.records());
    }
    
    @Test
    void testStepKinds() {
        Pipeline pipeline = Pipeline.of(p -> p.filter(new FrameMatch()).select("amount").sort(false));
        assertEquals(List.of("filter", "select", "sort"), pipeline.stepKinds());
        assertEquals(3, pipeline.size());
        assertEquals("Pipeline[filter, select, sort]", pipeline.toString());
    }
}
