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

/**
 * Classes for typed, in-memory columnar data: series, data frames, key-set predicates, and aggregation pipelines.
 * For example:
 *
 * <pre>{@code
 *     DataFrame orders = DataFrame.of("orders", records, options -> options.index("id"));
 *
 *     Pipeline pipeline = Pipeline.of(p -> p
 *         .filter(new FrameMatch().column("status", new Match().eq("shipped")))
 *         .castAs("month", "placed", "unit", "month")
 *         .groupBy(List.of("month"), Aggregate.of("amount", "sum").as("total"))
 *         .sort(false, "month")
 *     );
 *
 *     List<Map<String, Object>> totals = orders.aggregate(pipeline).records();
 * }</pre>
 *
 * <p>Here we create a frame from a list of records, keyed by their {@code id}. Then we define a pipeline that keeps
 * shipped orders, derives the month each order was placed in, and sums the amounts per month, and run it over the
 * frame. The input frame is left unchanged.
 *
 * <h2><a id="Series">Series and value kinds</a></h2>
 *
 * <p>A {@code Series} is a named column of nullable values, keyed by non-negative integers. Every series holds values
 * of one {@code ValueKind}: boolean, date, datetime, number, string, or time. The kind's {@code ValueType} decides how
 * raw values are converted ({@code Double} for numbers, {@code java.time} values for calendar kinds), how values are
 * ordered, and which named operators the series supports:
 * <ul>
 *     <li><b>reducers</b> collapse a series to a single-element series ({@code sum}, {@code mode}, {@code totalDays})
 *     <li><b>transformers</b> map values to values of the same kind ({@code round}, {@code trim}, {@code addDays})
 *     <li><b>casters</b> map values to another kind ({@code toString}, {@code len}, {@code unit})
 *     <li><b>filters</b> select keys ({@code gt}, {@code regex}, {@code inWeekDays})
 * </ul>
 * Asking a series for an operator its kind does not have throws an {@code IllegalArgumentException} naming both.
 *
 * <h2><a id="Constraints">Validations and violations</a></h2>
 *
 * <p>A series carries two sets of {@code Constraints}. Validations guard every write: a value that fails them is
 * dropped without an exception. Violations are advisory: failing values are stored, and can be found with the
 * {@code violations} filter or counted with the {@code violationsCount} reducer. A constraint name the series' kind
 * does not know is rejected as soon as the set is assigned.
 *
 * <h2><a id="KeySets">Matches and key-sets</a></h2>
 *
 * <p>Filtering produces a {@code KeySet}, a set of row keys. A {@code Match} names filters and their operands; its
 * results are intersected, then intersected with the union of its alternatives. A {@code FrameMatch} applies one match
 * per column of a frame and adds positional selectors ({@code head}, {@code tail}, {@code slice}, {@code index}).
 *
 * <h2><a id="Frames">Data frames</a></h2>
 *
 * <p>A {@code DataFrame} is an ordered list of series sharing one key domain, plus a key column. Columns are held by
 * reference, so projecting a frame shares its series with the source; {@code clone} copies. Frames combine through
 * {@code DataFrame.merge} (two frames, on a key universe), {@code Joins} (left-driven joins of several frames), and
 * {@code ColumnMerge} (several columns into one, lined up by position).
 *
 * <h2><a id="Pipelines">Pipelines</a></h2>
 *
 * <p>A {@code Pipeline} is an ordered list of steps, built with a {@code PipelineAPI} configurator or parsed from plain
 * maps and lists. Operator names are checked when the pipeline is built. Steps that reference other frames resolve
 * them through a {@code FrameRegistry} supplied by the caller.
 */
package io.avery.frames;
