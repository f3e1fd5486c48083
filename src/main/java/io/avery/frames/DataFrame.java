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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A named, ordered collection of {@link Series} sharing one key domain, with one designated key column.
 *
 * <p>The key column is either a column chosen by the caller ({@link #setIndex(String)}), or an implicit column named
 * {@value #INDEX_COLUMN} holding row numbers. The implicit column is not reported by {@link #columnNames()} or by
 * record views. After every structural change the frame re-normalizes its columns so that each holds every key,
 * with null where it has no value.
 *
 * <p>Columns are held by reference. {@link #select(String...)}, {@link #addColumn(Series)} and
 * {@link #ofColumns(String, List)} share the given series with the caller or the source frame, so in-place changes
 * to a shared series ({@code sort}, {@code fillNulls}, {@code set}) are visible wherever it is held. {@link #clone()}
 * and the slicing operations copy.
 *
 * <p>Example:
 * <pre>{@code
 * DataFrame sales = DataFrame.of("sales", List.of(
 *     Map.of("region", "east", "amount", 120),
 *     Map.of("region", "west", "amount", 80),
 *     Map.of("region", "east", "amount", 45)
 * ));
 * DataFrame totals = sales.groupBy(List.of("region"), List.of(Aggregate.of("amount", "sum").as("total")));
 * // [{region=east, total=165.0}, {region=west, total=80.0}]
 * }</pre>
 */
public class DataFrame {
    private static final Logger logger = LoggerFactory.getLogger(DataFrame.class);
    
    /** The name of the implicit key column. */
    public static final String INDEX_COLUMN = "_df_index";
    
    private String name;
    private final List<Series<?>> columns = new ArrayList<>();
    private String keyColumn;
    private Series<?> sortColumn;
    
    private DataFrame(String name) {
        this.name = name;
    }
    
    /**
     * Options for creating a frame from records.
     */
    public static class Options {
        private String index;
        private List<String> select;
        private final Map<String, ValueKind> kinds = new HashMap<>();
        
        Options() {}
        
        /**
         * Designates a key column. Without one, the frame gets an implicit row-number key column.
         */
        public Options index(String column) {
            this.index = column;
            return this;
        }
        
        /**
         * Restricts the frame to the given columns, in the given order. Without a selection, the frame holds every
         * column named by any record, in order of first appearance.
         */
        public Options select(String... columns) {
            this.select = Arrays.asList(columns);
            return this;
        }
        
        /**
         * Fixes the kind of a column. Without one, the kind is inferred from the column's values.
         */
        public Options kind(String column, ValueKind kind) {
            kinds.put(column, kind);
            return this;
        }
    }
    
    // ---- construction
    
    public static DataFrame of(String name, List<? extends Map<String, ?>> records) {
        return of(name, records, options -> {});
    }
    
    /**
     * Creates a frame from records. Each record becomes a row, keyed by its position.
     *
     * @param name the frame name
     * @param records the records, as maps of column name to raw value
     * @param config a consumer that configures the {@link Options}
     * @return the frame
     * @throws NoSuchElementException if the designated key column is not among the columns
     * @throws IllegalArgumentException if a value cannot be held by its column's kind
     */
    public static DataFrame of(String name, List<? extends Map<String, ?>> records, Consumer<Options> config) {
        Options options = new Options();
        config.accept(options);
        List<String> names = options.select;
        if (names == null) {
            Set<String> union = new LinkedHashSet<>();
            for (Map<String, ?> record : records)
                union.addAll(record.keySet());
            names = new ArrayList<>(union);
        }
        DataFrame frame = new DataFrame(name);
        for (String column : names) {
            List<Object> values = new ArrayList<>(records.size());
            for (Map<String, ?> record : records)
                values.add(record.get(column));
            ValueKind kind = options.kinds.get(column);
            frame.columns.add(Series.of(kind != null ? kind : ValueKind.infer(values), column, values));
        }
        List<Integer> keys = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++)
            keys.add(i);
        if (options.index != null)
            frame.setIndex(options.index);
        else
            frame.addImplicitIndex(keys);
        return frame.fillKeys();
    }
    
    /**
     * Creates a frame holding the given series by reference, with an implicit key column.
     *
     * @param name the frame name
     * @param columns the columns
     * @return the frame
     * @throws IllegalArgumentException if two columns have the same name
     */
    public static DataFrame ofColumns(String name, List<? extends Series<?>> columns) {
        DataFrame frame = new DataFrame(name);
        Set<Integer> keys = new LinkedHashSet<>();
        for (Series<?> column : columns) {
            if (frame.hasColumn(column.name()) || INDEX_COLUMN.equals(column.name()))
                throw new IllegalArgumentException("Duplicate column: " + column.name());
            frame.columns.add(column);
            keys.addAll(column.keys());
        }
        frame.addImplicitIndex(new ArrayList<>(keys));
        return frame.fillKeys();
    }
    
    private void addImplicitIndex(List<Integer> keys) {
        Series<Double> index = Series.empty(ValueType.NUMBER, INDEX_COLUMN);
        for (int i = 0; i < keys.size(); i++)
            index.put(keys.get(i), (double) i);
        columns.add(0, index);
        keyColumn = INDEX_COLUMN;
    }
    
    // ---- metadata
    
    public String name() {
        return name;
    }
    
    public DataFrame rename(String name) {
        this.name = name;
        return this;
    }
    
    /**
     * Returns the number of rows.
     */
    public int size() {
        int size = 0;
        for (Series<?> column : columns)
            size = Math.max(size, column.size());
        return size;
    }
    
    /**
     * Returns the names of the columns, excluding the implicit key column.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (Series<?> column : userColumns())
            names.add(column.name());
        return names;
    }
    
    /**
     * Returns the columns, excluding the implicit key column.
     */
    public List<Series<?>> columns() {
        return Collections.unmodifiableList(userColumns());
    }
    
    public boolean hasColumn(String name) {
        return find(name) != null;
    }
    
    /**
     * Returns the named column. The implicit key column can be looked up by name.
     *
     * @param name the column name
     * @return the column
     * @throws NoSuchElementException if there is no such column
     */
    public Series<?> column(String name) {
        Series<?> column = find(name);
        if (column == null)
            throw new NoSuchElementException("Invalid column: " + name);
        return column;
    }
    
    public String keyColumn() {
        return keyColumn;
    }
    
    public Series<?> index() {
        return column(keyColumn);
    }
    
    /**
     * Returns the name of the column whose order row iteration follows, or null if it follows key order.
     */
    public String sortColumn() {
        return sortColumn != null && holds(sortColumn) ? sortColumn.name() : null;
    }
    
    // ---- keys
    
    /**
     * Gives every column every key held by any column, with null where it has no value. Missing keys of the implicit
     * key column get the smallest row number it does not hold yet.
     *
     * @return this frame
     */
    public DataFrame fillKeys() {
        Set<Integer> keys = new LinkedHashSet<>();
        for (Series<?> column : columns)
            keys.addAll(column.keys());
        for (Series<?> column : columns) {
            boolean implicit = isImplicitIndex(column);
            for (Integer key : keys)
                if (!column.hasKey(key)) {
                    if (implicit)
                        Utils.<Series<Double>>cast(column).put(key, nextIndexValue(column));
                    else
                        column.put(key, null);
                }
        }
        return this;
    }
    
    // Smallest row number not yet held by the implicit key column.
    private static double nextIndexValue(Series<?> index) {
        Set<Integer> used = new HashSet<>();
        for (Object value : index.values())
            if (value != null)
                used.add(((Double) value).intValue());
        return Utils.generateKey(used);
    }
    
    /**
     * Makes the named column the key column, dropping the implicit key column if there was one.
     *
     * @param column the column name
     * @return this frame
     * @throws NoSuchElementException if there is no such column
     */
    public DataFrame setIndex(String column) {
        Series<?> series = column(column);
        if (isImplicit() && !INDEX_COLUMN.equals(column))
            columns.remove(find(INDEX_COLUMN));
        columns.remove(series);
        columns.add(0, series);
        keyColumn = column;
        return this;
    }
    
    /**
     * Replaces an explicit key column with an implicit one numbering the rows in iteration order. The former key
     * column stays as a regular column.
     *
     * @return this frame
     */
    public DataFrame resetIndex() {
        if (!isImplicit())
            addImplicitIndex(rowKeys());
        return fillKeys();
    }
    
    boolean isImplicit() {
        return INDEX_COLUMN.equals(keyColumn);
    }
    
    /**
     * Returns the internal row keys in iteration order: the order of the sort column if there is one, else the order
     * of the key column.
     */
    List<Integer> rowKeys() {
        Series<?> order = sortColumn != null && holds(sortColumn) ? sortColumn : index();
        return order.keys();
    }
    
    // ---- rows
    
    /**
     * Returns the record whose key column holds the given value.
     *
     * @param key the key column value
     * @return the record, as a map of column name to value
     * @throws NoSuchElementException if no record has the key
     */
    public Map<String, Object> record(Object key) {
        return row(internalKey(key));
    }
    
    /**
     * Returns every record, in iteration order.
     */
    public List<Map<String, Object>> records() {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Integer key : rowKeys())
            records.add(row(key));
        return records;
    }
    
    /**
     * Returns the records whose key column holds the given values, in the given order.
     *
     * @throws NoSuchElementException if some record does not exist
     */
    public List<Map<String, Object>> records(Iterable<?> keys) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object key : keys)
            records.add(record(key));
        return records;
    }
    
    /**
     * Adds a row under the smallest unused internal key. Columns the row does not name get null; names the frame
     * does not have are ignored. Values failing a column's validations become null. If writing any column throws,
     * the columns already written are rolled back and the exception propagates. On a frame with an implicit key
     * column the row gets the smallest row number not yet in use.
     *
     * @param row the row, as a map of column name to raw value
     * @return this frame
     * @throws IllegalStateException if the row's key column value is already in use
     * @throws IllegalArgumentException if a value cannot be held by its column's kind
     */
    public DataFrame addRecord(Map<String, ?> row) {
        Object keyValue = row.get(keyColumn);
        if (keyValue != null && index().hasValue(keyValue))
            throw new IllegalStateException("Duplicate record key: " + keyValue);
        Set<Integer> used = new LinkedHashSet<>();
        for (Series<?> column : columns)
            used.addAll(column.keys());
        int key = Utils.generateKey(used);
        List<Series<?>> written = new ArrayList<>();
        try {
            for (Series<?> column : columns) {
                if (isImplicitIndex(column))
                    column.set(key, keyValue != null ? keyValue : nextIndexValue(column));
                else
                    column.set(key, row.get(column.name()));
                written.add(column);
            }
        } catch (RuntimeException e) {
            for (Series<?> column : written)
                column.unset(key);
            throw e;
        }
        return fillKeys();
    }
    
    /**
     * Updates the named columns of the record with the given key. If writing any column throws, the columns already
     * written are restored and the exception propagates.
     *
     * @param key the key column value
     * @param values the new values, by column name
     * @return this frame
     * @throws NoSuchElementException if the record or a column does not exist
     * @throws IllegalStateException if the key column would take a value already in use
     */
    public DataFrame update(Object key, Map<String, ?> values) {
        int internal = internalKey(key);
        for (String column : values.keySet())
            column(column);
        Object newKey = values.get(keyColumn);
        if (newKey != null && index().keyOf(newKey) != -1 && index().keyOf(newKey) != internal)
            throw new IllegalStateException("Duplicate record key: " + newKey);
        Map<Series<?>, Object> previous = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                Series<?> column = column(entry.getKey());
                previous.put(column, column.value(internal));
                column.set(internal, entry.getValue());
            }
        } catch (RuntimeException e) {
            previous.forEach((column, value) -> Utils.<Series<Object>>cast(column).put(internal, value));
            throw e;
        }
        return fillKeys();
    }
    
    /**
     * Removes the record with the given key from every column.
     *
     * @param key the key column value
     * @return this frame
     * @throws NoSuchElementException if the record does not exist
     */
    public DataFrame removeRecord(Object key) {
        int internal = internalKey(key);
        for (Series<?> column : columns)
            column.unset(internal);
        return this;
    }
    
    private int internalKey(Object key) {
        int internal = index().keyOf(key);
        if (internal == -1)
            throw new NoSuchElementException("Invalid record key: " + key);
        return internal;
    }
    
    private Map<String, Object> row(int key) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Series<?> column : userColumns())
            row.put(column.name(), column.value(key));
        return row;
    }
    
    // ---- columns
    
    /**
     * Adds a column by reference. If the frame already has a column of that name, a copy under a disambiguated name
     * ({@code name_1}, {@code name_2}, ...) is added instead.
     *
     * @param series the column
     * @return this frame
     */
    public DataFrame addColumn(Series<?> series) {
        Series<?> column = series;
        if (hasColumn(series.name()) || INDEX_COLUMN.equals(series.name()))
            column = series.clone(uniqueName(series.name()));
        columns.add(column);
        return fillKeys();
    }
    
    public DataFrame addColumn(String name, List<?> values) {
        return addColumn(name, ValueKind.infer(values), values);
    }
    
    /**
     * Adds a column of raw values, assigned to the rows in iteration order. Values beyond the last row are dropped.
     *
     * @param name the column name
     * @param kind the column kind
     * @param values the raw values
     * @return this frame
     */
    public DataFrame addColumn(String name, ValueKind kind, List<?> values) {
        List<Integer> keys = rowKeys();
        Series<?> column = Series.of(kind, name, values.size() > keys.size() ? values.subList(0, keys.size()) : values);
        return addColumn(column.rekey(keys));
    }
    
    /**
     * Renames a column. A column shared with other frames is renamed in all of them.
     *
     * @param from the current name
     * @param to the new name
     * @return this frame
     * @throws NoSuchElementException if there is no such column
     * @throws IllegalArgumentException if the new name is taken
     */
    public DataFrame renameColumn(String from, String to) {
        Series<?> column = column(from);
        if (hasColumn(to) || INDEX_COLUMN.equals(to))
            throw new IllegalArgumentException("Duplicate column: " + to);
        column.rename(to);
        if (from.equals(keyColumn))
            keyColumn = to;
        return this;
    }
    
    /**
     * Removes columns. Removing the key column first resets the frame to an implicit key column.
     *
     * @param names the column names
     * @return this frame
     * @throws NoSuchElementException if a column does not exist; no column is removed in that case
     */
    public DataFrame deleteColumns(String... names) {
        for (String name : names)
            column(name);
        for (String name : names) {
            if (name.equals(keyColumn))
                resetIndex();
            columns.remove(column(name));
        }
        return this;
    }
    
    /**
     * Returns a frame holding the named columns of this frame by reference, in the given order, after the key
     * column.
     *
     * @param names the column names
     * @return the projected frame
     * @throws NoSuchElementException if a column does not exist
     */
    public DataFrame select(String... names) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (String name : names)
            renames.put(name, name);
        return select(renames);
    }
    
    /**
     * Returns a frame holding the named columns of this frame, in the given order, after the key column. Columns
     * mapped to their own name (or to null) are held by reference; renamed columns are copied under the new name.
     *
     * @param renames the new column name, by current column name
     * @return the projected frame
     * @throws NoSuchElementException if a column does not exist
     */
    public DataFrame select(Map<String, String> renames) {
        List<Series<?>> selected = new ArrayList<>();
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            Series<?> column = column(entry.getKey());
            String rename = entry.getValue();
            selected.add(rename == null || rename.equals(column.name()) ? column : column.clone(rename));
        }
        return project(selected);
    }
    
    /**
     * Returns a frame holding every column of this frame by reference except the named ones.
     *
     * @param names the column names to leave out
     * @return the projected frame
     * @throws NoSuchElementException if a column does not exist
     */
    public DataFrame unselect(String... names) {
        List<Series<?>> omitted = new ArrayList<>();
        for (String name : names)
            omitted.add(column(name));
        List<Series<?>> selected = new ArrayList<>();
        for (Series<?> column : userColumns())
            if (!omitted.contains(column))
                selected.add(column);
        return project(selected);
    }
    
    private DataFrame project(List<Series<?>> selected) {
        DataFrame frame = new DataFrame(name);
        Series<?> key = index();
        boolean keepKey = isImplicit() || selected.contains(key);
        if (keepKey)
            frame.columns.add(key);
        for (Series<?> column : selected) {
            if (column == key || frame.hasColumn(column.name()))
                continue;
            frame.columns.add(column);
        }
        if (keepKey)
            frame.keyColumn = keyColumn;
        else
            frame.addImplicitIndex(rowKeys());
        if (sortColumn != null && frame.holds(sortColumn))
            frame.sortColumn = sortColumn;
        return frame.fillKeys();
    }
    
    /**
     * Replaces the named column with the given series, renamed to the column's name. Appends the series if there is
     * no such column. A replaced sort column passes its role on to the series, which is expected to iterate in the
     * same order.
     */
    void putColumn(String name, Series<?> series) {
        series.rename(name);
        Series<?> existing = find(name);
        if (existing == null)
            columns.add(series);
        else {
            columns.set(columns.indexOf(existing), series);
            if (existing == sortColumn)
                sortColumn = series;
        }
        fillKeys();
    }
    
    // ---- copies
    
    @Override
    public DataFrame clone() {
        return clone(name);
    }
    
    /**
     * Returns a deep copy of this frame: every column is copied with its constraints.
     *
     * @param name the name of the copy
     * @return the copy
     */
    public DataFrame clone(String name) {
        DataFrame frame = new DataFrame(name);
        for (Series<?> column : columns) {
            Series<?> copy = column.clone();
            frame.columns.add(copy);
            if (column == sortColumn)
                frame.sortColumn = copy;
        }
        frame.keyColumn = keyColumn;
        return frame;
    }
    
    public DataFrame head(int n) {
        return slice(0, Math.max(n, 0));
    }
    
    public DataFrame tail(int n) {
        int size = size();
        return slice(Math.max(size - Math.max(n, 0), 0), size);
    }
    
    /**
     * Returns a copy of the rows at positions {@code [start, end)} of the iteration order. Negative positions count
     * back from the end.
     *
     * @param start the first position
     * @param end the position after the last
     * @return the sliced frame
     */
    public DataFrame slice(int start, int end) {
        return rows(positions(rowKeys(), start, end));
    }
    
    /**
     * Returns a copy holding only the rows with the given internal keys, in iteration order.
     */
    DataFrame rows(KeySet keys) {
        List<Integer> kept = new ArrayList<>();
        for (Integer key : rowKeys())
            if (keys.contains(key))
                kept.add(key);
        DataFrame frame = new DataFrame(name);
        for (Series<?> column : columns) {
            Series<?> copy = column.get(kept);
            frame.columns.add(copy);
            if (column == sortColumn)
                frame.sortColumn = copy;
        }
        frame.keyColumn = keyColumn;
        return frame;
    }
    
    static KeySet positions(List<Integer> keys, int start, int end) {
        int from = start < 0 ? Math.max(keys.size() + start, 0) : Math.min(start, keys.size());
        int to = end < 0 ? Math.max(keys.size() + end, 0) : Math.min(end, keys.size());
        return KeySet.of(from < to ? keys.subList(from, to) : Collections.emptyList());
    }
    
    // ---- ordering and cleaning
    
    /**
     * Sorts the rows in place by the given columns, the first deciding and each later one breaking ties. With no
     * columns, sorts by the key column. Row iteration then follows the first column's order.
     *
     * @param desc true to sort descending
     * @param columns the column names
     * @return this frame
     * @throws NoSuchElementException if a column does not exist
     */
    public DataFrame sort(boolean desc, String... columns) {
        List<Series<?>> by = new ArrayList<>();
        for (String column : columns.length == 0 ? new String[]{ keyColumn } : columns)
            by.add(column(column));
        List<Series<?>> tiebreakers = by.subList(1, by.size());
        by.get(0).sort(desc, (k1, k2) -> {
            for (Series<?> column : tiebreakers) {
                int c = column.compare(k1, k2, desc);
                if (c != 0)
                    return c;
            }
            return 0;
        });
        sortColumn = by.get(0);
        return this;
    }
    
    /**
     * Replaces nulls in the named column.
     *
     * @see Series#fillNulls(Object, Object...)
     */
    public DataFrame fillNulls(String column, Object valueOrReducer, Object... args) {
        column(column).fillNulls(valueOrReducer, args);
        return this;
    }
    
    /**
     * Removes every row holding a null in any of the named columns, or in any column if none are named.
     *
     * @param columns the column names
     * @return this frame
     * @throws NoSuchElementException if a column does not exist
     */
    public DataFrame omitNulls(String... columns) {
        List<Series<?>> checked = new ArrayList<>();
        if (columns.length == 0)
            checked.addAll(userColumns());
        else
            for (String column : columns)
                checked.add(column(column));
        List<Integer> removed = new ArrayList<>();
        for (Integer key : rowKeys())
            for (Series<?> column : checked)
                if (column.value(key) == null) {
                    removed.add(key);
                    break;
                }
        for (Series<?> column : this.columns)
            column.delete(removed);
        return this;
    }
    
    // ---- filtering
    
    /**
     * Returns the internal keys of the rows selected by a frame match.
     *
     * @param match the frame match
     * @return the selected keys
     * @throws NoSuchElementException if the match names a column that does not exist
     */
    public KeySet match(FrameMatch match) {
        List<Integer> order = rowKeys();
        KeySet keys = KeySet.of(order);
        for (Map.Entry<String, Match> entry : match.columns().entrySet())
            keys = keys.and(column(entry.getKey()).match(entry.getValue()));
        if (match.head() != null)
            keys = keys.and(positions(order, 0, Math.max(match.head(), 0)));
        if (match.tail() != null)
            keys = keys.and(positions(order, Math.max(order.size() - Math.max(match.tail(), 0), 0), order.size()));
        if (match.slice() != null)
            keys = keys.and(positions(order, match.slice()[0], match.slice()[1]));
        if (match.index() != null) {
            List<Integer> indexed = new ArrayList<>();
            for (Object key : match.index()) {
                int internal = index().keyOf(key);
                if (internal != -1)
                    indexed.add(internal);
            }
            keys = keys.and(KeySet.of(indexed));
        }
        if (!match.alternatives().isEmpty()) {
            KeySet any = KeySet.empty();
            for (FrameMatch alternative : match.alternatives())
                any = any.or(match(alternative));
            keys = keys.and(any);
        }
        return keys;
    }
    
    /**
     * Returns a copy holding the rows selected by a frame match.
     *
     * @param match the frame match
     * @return the narrowed frame
     */
    public DataFrame where(FrameMatch match) {
        return rows(match(match));
    }
    
    // ---- column operators
    
    /**
     * Applies a transformer to a column, replacing it, or adding the result under an alias.
     *
     * @param column the column name
     * @param operator the transformer name
     * @param as the output column name, or null to replace the column
     * @param args transformer arguments
     * @return this frame
     * @throws NoSuchElementException if the column does not exist
     * @throws IllegalArgumentException if the column's kind has no such transformer
     */
    public DataFrame transform(String column, String operator, String as, Object... args) {
        Series<?> result = column(column).transform(operator, args);
        putColumn(as != null ? as : column, result);
        return this;
    }
    
    /**
     * Applies a caster to a column, replacing it, or adding the result under an alias.
     *
     * @param column the column name
     * @param operator the caster name
     * @param as the output column name, or null to replace the column
     * @param args caster arguments
     * @return this frame
     * @throws NoSuchElementException if the column does not exist
     * @throws IllegalArgumentException if the column's kind has no such caster
     */
    public DataFrame cast(String column, String operator, String as, Object... args) {
        Series<?> result = column(column).cast(operator, args);
        putColumn(as != null ? as : column, result);
        return this;
    }
    
    // ---- aggregation
    
    /**
     * Collapses the frame to a single row holding one column per aggregate.
     *
     * @param aggregates the aggregates
     * @return a new single-row frame
     * @throws NoSuchElementException if a column does not exist
     * @throws IllegalArgumentException if a reducer is unknown to its column's kind, or two aggregates have the same
     * output name
     */
    public DataFrame reduce(List<Aggregate> aggregates) {
        checkAggregates(Collections.emptyList(), aggregates);
        List<Series<?>> reduced = new ArrayList<>();
        for (Aggregate aggregate : aggregates)
            reduced.add(column(aggregate.column()).reduce(aggregate.reducer(), aggregate.args()).rename(aggregate.output()));
        return ofColumns(name, reduced);
    }
    
    /**
     * Partitions the rows by the distinct combinations of values of the grouping columns, in order of first
     * appearance, and emits one row per group: the grouping values followed by one column per aggregate, reduced
     * over the group's rows.
     *
     * @param by the grouping column names
     * @param aggregates the aggregates
     * @return a new frame with one row per group
     * @throws NoSuchElementException if a column does not exist
     * @throws IllegalArgumentException if a reducer is unknown to its column's kind, or two output columns have the
     * same name
     */
    public DataFrame groupBy(List<String> by, List<Aggregate> aggregates) {
        if (by.isEmpty())
            throw new IllegalArgumentException("Expected at least one grouping column");
        checkAggregates(by, aggregates);
        List<Series<?>> groupColumns = new ArrayList<>();
        for (String column : by)
            groupColumns.add(column(column));
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (Integer key : rowKeys()) {
            List<Object> group = new ArrayList<>(groupColumns.size());
            for (Series<?> column : groupColumns)
                group.add(column.value(key));
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(key);
        }
        
        List<Series<?>> output = new ArrayList<>();
        for (int i = 0; i < groupColumns.size(); i++) {
            Series<?> out = Series.empty(groupColumns.get(i).type(), groupColumns.get(i).name());
            int row = 0;
            for (List<Object> group : groups.keySet())
                out.set(row++, group.get(i));
            output.add(out);
        }
        for (Aggregate aggregate : aggregates) {
            Series<?> source = column(aggregate.column());
            Series<?> out = Series.empty(source.type().reducerKind(aggregate.reducer()).type(), aggregate.output());
            int row = 0;
            for (List<Integer> keys : groups.values())
                out.set(row++, source.get(keys).reduce(aggregate.reducer(), aggregate.args()).value(0));
            output.add(out);
        }
        logger.debug("Grouped frame '{}' by {} into {} groups", name, by, groups.size());
        return ofColumns(name, output);
    }
    
    private void checkAggregates(List<String> by, List<Aggregate> aggregates) {
        Set<String> outputs = new LinkedHashSet<>(by);
        for (Aggregate aggregate : aggregates) {
            column(aggregate.column()).type().reducerKind(aggregate.reducer());
            if (!outputs.add(aggregate.output()))
                throw new IllegalArgumentException("Duplicate output column: " + aggregate.output());
        }
    }
    
    /**
     * Combines columns position by position, in row iteration order, into one column.
     *
     * @param columns the column names
     * @param operator the merge operator
     * @param argument the operator argument: a reducer name, separator, template or expression
     * @param as the output column name
     * @param alignment how columns of unequal length are lined up
     * @param replace true to remove the source columns (other than the key column)
     * @return this frame
     * @throws NoSuchElementException if a column does not exist
     * @throws IllegalArgumentException if the operator does not accept the columns' kinds
     * @see ColumnMerge
     */
    public DataFrame mergeColumns(List<String> columns, ColumnMerge.Operator operator, Object argument, String as,
                                  Alignment alignment, boolean replace) {
        List<Integer> keys = rowKeys();
        List<Series<?>> sources = new ArrayList<>();
        for (String column : columns)
            sources.add(column(column).get(keys));
        Series<?> merged = ColumnMerge.apply(operator, as, sources, argument, alignment).rekey(keys);
        if (replace)
            for (String column : columns)
                if (!column.equals(keyColumn) && !column.equals(as))
                    this.columns.remove(column(column));
        putColumn(as, merged);
        return this;
    }
    
    // ---- combining frames
    
    public DataFrame merge(DataFrame other, String leftOn, String rightOn, Alignment alignment) {
        return merge(other, leftOn, rightOn, alignment, name);
    }
    
    /**
     * Merges another frame into a new frame, on a column of each. Rows are formed for each distinct value in the key
     * universe of the alignment: values of both columns for inner, of either for outer, of the left or right column
     * for left or right. Each row holds this frame's columns (from its first row with the value), then the other
     * frame's columns except its merge column, prefixed with {@code <other name>_} (from its first row with the
     * value). The result is keyed by the left merge column.
     *
     * @param other the other frame
     * @param leftOn the merge column of this frame
     * @param rightOn the merge column of the other frame
     * @param alignment how the key universe is formed
     * @param name the name of the result
     * @return the merged frame
     * @throws NoSuchElementException if a merge column does not exist
     * @throws IllegalArgumentException if the merge columns are of different kinds
     */
    public DataFrame merge(DataFrame other, String leftOn, String rightOn, Alignment alignment, String name) {
        Series<?> left = column(leftOn).get(rowKeys());
        Series<?> right = other.column(rightOn).get(other.rowKeys());
        if (left.kind() != right.kind())
            throw new IllegalArgumentException("Cannot merge " + left.kind().label() + " column " + leftOn + " with "
                                                   + right.kind().label() + " column " + rightOn);
        List<Object> universe = new ArrayList<>();
        switch (alignment) {
            case INNER:
                for (Object value : left.distinct().values())
                    if (right.hasValue(value))
                        universe.add(value);
                break;
            case OUTER:
                universe.addAll(left.distinct().values());
                for (Object value : right.distinct().values())
                    if (!left.hasValue(value))
                        universe.add(value);
                break;
            case LEFT:
                universe.addAll(left.distinct().values());
                break;
            case RIGHT:
                universe.addAll(right.distinct().values());
                break;
        }
        
        List<Series<?>> output = new ArrayList<>();
        for (Series<?> column : userColumns()) {
            Series<?> out = Series.empty(column.type(), column.name());
            for (int row = 0; row < universe.size(); row++) {
                Object value = universe.get(row);
                int key = left.keyOf(value);
                out.set(row, column.name().equals(leftOn) ? value : key == -1 ? null : column.value(key));
            }
            output.add(out);
        }
        Set<String> names = new LinkedHashSet<>(columnNames());
        for (Series<?> column : other.userColumns()) {
            if (column.name().equals(rightOn))
                continue;
            String outName = other.name() + "_" + column.name();
            for (int i = 1; names.contains(outName); i++)
                outName = other.name() + "_" + column.name() + "_" + i;
            names.add(outName);
            Series<?> out = Series.empty(column.type(), outName);
            for (int row = 0; row < universe.size(); row++) {
                int key = right.keyOf(universe.get(row));
                out.set(row, key == -1 ? null : column.value(key));
            }
            output.add(out);
        }
        logger.debug("Merged frame '{}' with '{}' on {}={} ({}): {} rows", this.name, other.name(), leftOn, rightOn,
                     alignment, universe.size());
        DataFrame merged = ofColumns(name, output);
        return hasColumn(leftOn) && !INDEX_COLUMN.equals(leftOn) ? merged.setIndex(leftOn) : merged;
    }
    
    public DataFrame concat(DataFrame other) {
        return concat(other, Collections.emptyMap());
    }
    
    /**
     * Returns a copy of this frame with the rows of another frame appended. Each of the other frame's columns is
     * written to the column of this frame named by the mapping (or of the same name when unmapped); columns this frame
     * does not have are dropped.
     *
     * @param other the other frame
     * @param columnMapping the target column name, by the other frame's column name
     * @return the concatenated frame
     * @throws IllegalStateException if an appended row's key column value is already in use
     */
    public DataFrame concat(DataFrame other, Map<String, String> columnMapping) {
        DataFrame frame = clone();
        for (Map<String, Object> record : other.records()) {
            Map<String, Object> row = new LinkedHashMap<>();
            record.forEach((column, value) -> row.put(columnMapping.getOrDefault(column, column), value));
            frame.addRecord(row);
        }
        return frame;
    }
    
    /**
     * Runs a pipeline over a copy of this frame.
     *
     * @param pipeline the pipeline
     * @return the pipeline's output frame
     */
    public DataFrame aggregate(Pipeline pipeline) {
        return pipeline.apply(this);
    }
    
    /**
     * Runs a pipeline over a copy of this frame, resolving frame references through the given registry.
     *
     * @param pipeline the pipeline
     * @param registry the frames pipeline steps may reference by name
     * @return the pipeline's output frame
     */
    public DataFrame aggregate(Pipeline pipeline, FrameRegistry registry) {
        return pipeline.apply(this, registry);
    }
    
    // ---- internals
    
    private List<Series<?>> userColumns() {
        List<Series<?>> user = new ArrayList<>();
        for (Series<?> column : columns)
            if (!isImplicitIndex(column))
                user.add(column);
        return user;
    }
    
    private boolean isImplicitIndex(Series<?> column) {
        return isImplicit() && INDEX_COLUMN.equals(column.name());
    }
    
    private Series<?> find(String name) {
        for (Series<?> column : columns)
            if (column.name().equals(name))
                return column;
        return null;
    }
    
    private boolean holds(Series<?> series) {
        for (Series<?> column : columns)
            if (column == series)
                return true;
        return false;
    }
    
    private String uniqueName(String name) {
        String unique = name;
        for (int i = 1; hasColumn(unique) || INDEX_COLUMN.equals(unique); i++)
            unique = name + "_" + i;
        return unique;
    }
    
    @Override
    public String toString() {
        return "DataFrame[" + name + "]" + columnNames() + " (" + size() + " rows)";
    }
}
