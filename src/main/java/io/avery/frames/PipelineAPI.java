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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A configurator used to define the steps of a {@link Pipeline}. Steps run in the order they are defined.
 *
 * <p>Names of operators and reducers are checked as steps are defined: a name that no value kind knows is rejected
 * with an {@link IllegalArgumentException}. Columns and frames are resolved when the pipeline runs.
 *
 * @see Pipeline#of
 */
public class PipelineAPI {
    final List<Pipeline.Step> steps = new ArrayList<>();
    
    PipelineAPI() {}
    
    /**
     * Narrows the frame to the rows selected by a frame match.
     *
     * @param match the frame match
     * @return this configurator
     * @throws IllegalArgumentException if the match uses a filter no value kind has
     */
    public PipelineAPI filter(FrameMatch match) {
        checkFilters(match);
        steps.add(new FilterStep(match));
        return this;
    }
    
    /**
     * Projects the frame to the named columns, in the given order.
     *
     * @param columns the column names
     * @return this configurator
     */
    public PipelineAPI select(String... columns) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (String column : columns)
            renames.put(column, column);
        return select(renames);
    }
    
    /**
     * Projects the frame to the named columns, renaming each to its mapped name (or keeping it, if mapped to null).
     *
     * @param renames the new column name, by column name
     * @return this configurator
     */
    public PipelineAPI select(Map<String, String> renames) {
        steps.add(new SelectStep(new LinkedHashMap<>(renames)));
        return this;
    }
    
    /**
     * Removes the named columns.
     *
     * @param columns the column names
     * @return this configurator
     */
    public PipelineAPI omit(String... columns) {
        steps.add(new OmitStep(columns.clone()));
        return this;
    }
    
    /**
     * Sorts the rows by the named columns, the first deciding and the rest breaking ties.
     *
     * @param desc true to sort descending
     * @param columns the column names
     * @return this configurator
     */
    public PipelineAPI sort(boolean desc, String... columns) {
        steps.add(new SortStep(desc, columns.clone()));
        return this;
    }
    
    /**
     * Fills or omits nulls and replaces constraints, on several columns at once.
     *
     * @param config a consumer of the {@link CleanAPI sub-configurator}
     * @return this configurator
     * @throws IllegalArgumentException if a constraint name is unknown to every value kind
     */
    public PipelineAPI clean(Consumer<CleanAPI> config) {
        CleanAPI clean = new CleanAPI();
        config.accept(clean);
        steps.add(new CleanStep(new ArrayList<>(clean.actions)));
        return this;
    }
    
    public PipelineAPI groupBy(List<String> by, Aggregate... aggregates) {
        return groupBy(by, Arrays.asList(aggregates));
    }
    
    /**
     * Groups the rows by the named columns, and reduces each group to one row.
     *
     * @param by the grouping column names
     * @param aggregates the aggregates computed per group
     * @return this configurator
     * @throws IllegalArgumentException if a reducer is unknown to every value kind
     * @see DataFrame#groupBy
     */
    public PipelineAPI groupBy(List<String> by, List<Aggregate> aggregates) {
        checkReducers(aggregates);
        steps.add(new GroupByStep(new ArrayList<>(by), new ArrayList<>(aggregates)));
        return this;
    }
    
    public PipelineAPI reduce(Aggregate... aggregates) {
        return reduce(Arrays.asList(aggregates));
    }
    
    /**
     * Collapses the frame to a single row.
     *
     * @param aggregates the aggregates
     * @return this configurator
     * @throws IllegalArgumentException if a reducer is unknown to every value kind
     * @see DataFrame#reduce
     */
    public PipelineAPI reduce(List<Aggregate> aggregates) {
        checkReducers(aggregates);
        steps.add(new ReduceStep(new ArrayList<>(aggregates)));
        return this;
    }
    
    /**
     * Replaces a column with the result of a transformer.
     *
     * @param column the column name
     * @param operator the transformer name
     * @param args transformer arguments
     * @return this configurator
     * @throws IllegalArgumentException if the transformer is unknown to every value kind
     */
    public PipelineAPI transform(String column, String operator, Object... args) {
        return transformAs(null, column, operator, args);
    }
    
    /**
     * Adds (or replaces) a column holding the result of a transformer.
     *
     * @param as the output column name, or null to replace the input column
     * @param column the column name
     * @param operator the transformer name
     * @param args transformer arguments
     * @return this configurator
     * @throws IllegalArgumentException if the transformer is unknown to every value kind
     */
    public PipelineAPI transformAs(String as, String column, String operator, Object... args) {
        return operate(false, Collections.singletonList(new ColumnOperation(column, operator, args, as)));
    }
    
    /**
     * Replaces a column with the result of a caster.
     *
     * @param column the column name
     * @param operator the caster name
     * @param args caster arguments
     * @return this configurator
     * @throws IllegalArgumentException if the caster is unknown to every value kind
     */
    public PipelineAPI cast(String column, String operator, Object... args) {
        return castAs(null, column, operator, args);
    }
    
    /**
     * Adds (or replaces) a column holding the result of a caster.
     *
     * @param as the output column name, or null to replace the input column
     * @param column the column name
     * @param operator the caster name
     * @param args caster arguments
     * @return this configurator
     * @throws IllegalArgumentException if the caster is unknown to every value kind
     */
    public PipelineAPI castAs(String as, String column, String operator, Object... args) {
        return operate(true, Collections.singletonList(new ColumnOperation(column, operator, args, as)));
    }
    
    public PipelineAPI merge(ColumnMerge.Operator operator, List<String> columns, Object argument, String as) {
        return merge(operator, columns, argument, as, Alignment.LEFT, false);
    }
    
    /**
     * Combines columns into one.
     *
     * @param operator the merge operator
     * @param columns the column names
     * @param argument the operator argument
     * @param as the output column name
     * @param alignment how columns of unequal length are lined up
     * @param replace true to remove the source columns
     * @return this configurator
     * @throws IllegalArgumentException if no columns are given, or the argument names a reducer unknown to every value
     * kind, or is a malformed expression
     * @see DataFrame#mergeColumns
     */
    public PipelineAPI merge(ColumnMerge.Operator operator, List<String> columns, Object argument, String as,
                             Alignment alignment, boolean replace) {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(as);
        if (columns.isEmpty())
            throw new IllegalArgumentException("Expected at least one column to merge");
        switch (operator) {
            case MERGE:
            case DELTA:
                if (argument == null || !ValueType.anyHas(ValueType::reducerNames, argument.toString()))
                    throw new IllegalArgumentException("Unknown reducer: " + argument);
                break;
            case CALCULATE:
                if (argument == null)
                    throw new IllegalArgumentException("Operator calculate requires an expression");
                ArithmeticExpression.compile(ArithmeticExpression.PLACEHOLDER.matcher(argument.toString()).replaceAll("reducer_$1"));
                break;
            case TEMPLATE:
                if (argument == null)
                    throw new IllegalArgumentException("Operator template requires a template");
                break;
            case CONCAT:
                break;
        }
        steps.add(new MergeStep(operator, new ArrayList<>(columns), argument, as, alignment, replace));
        return this;
    }
    
    public PipelineAPI concat(String frame) {
        return concat(frame, Collections.emptyMap());
    }
    
    /**
     * Appends the rows of a registered frame.
     *
     * @param frame the registered frame name
     * @param columns the column of this frame each of the other frame's columns is written to, by the other frame's
     *                column name
     * @return this configurator
     * @see DataFrame#concat(DataFrame, Map)
     */
    public PipelineAPI concat(String frame, Map<String, String> columns) {
        steps.add(new ConcatStep(Objects.requireNonNull(frame), new LinkedHashMap<>(columns)));
        return this;
    }
    
    /**
     * Merges a registered frame in, on a column of each.
     *
     * @param frame the registered frame name
     * @param leftOn the merge column of this frame
     * @param rightOn the merge column of the registered frame
     * @param alignment how the key universe is formed
     * @return this configurator
     * @see DataFrame#merge(DataFrame, String, String, Alignment)
     */
    public PipelineAPI join(String frame, String leftOn, String rightOn, Alignment alignment) {
        steps.add(new JoinStep(Objects.requireNonNull(frame), Objects.requireNonNull(leftOn),
                               Objects.requireNonNull(rightOn), Objects.requireNonNull(alignment)));
        return this;
    }
    
    /**
     * A sub-configurator used to define the actions of a clean step. Actions run in the order they are defined.
     */
    public static class CleanAPI {
        private final List<CleanAction> actions = new ArrayList<>();
        
        CleanAPI() {}
        
        /**
         * Replaces nulls in a column with a value, or with the value of a reducer over the column.
         *
         * @see Series#fillNulls(Object, Object...)
         */
        public CleanAPI fillNulls(String column, Object valueOrReducer, Object... args) {
            actions.add(new CleanAction(column, CleanAction.FILL, valueOrReducer, args));
            return this;
        }
        
        /**
         * Removes the rows holding a null in any of the given columns.
         */
        public CleanAPI omitNulls(String... columns) {
            for (String column : columns)
                actions.add(new CleanAction(column, CleanAction.OMIT, null, null));
            return this;
        }
        
        /**
         * Replaces a column's validations, dropping the values that fail them.
         *
         * @throws IllegalArgumentException if a constraint name is unknown to every value kind
         */
        public CleanAPI validations(String column, Constraints constraints) {
            checkConstraints(constraints);
            actions.add(new CleanAction(column, CleanAction.VALIDATIONS, constraints, null));
            return this;
        }
        
        /**
         * Replaces a column's violations.
         *
         * @throws IllegalArgumentException if a constraint name is unknown to every value kind
         */
        public CleanAPI violations(String column, Constraints constraints) {
            checkConstraints(constraints);
            actions.add(new CleanAction(column, CleanAction.VIOLATIONS, constraints, null));
            return this;
        }
        
        private static void checkConstraints(Constraints constraints) {
            for (String name : constraints.names())
                if (!ValueType.anyHas(ValueType::constraintNames, name))
                    throw new IllegalArgumentException("Unknown constraint: " + name);
        }
    }
    
    // ---- descriptor parsing
    
    void parseStep(String kind, Object descriptor) {
        switch (kind) {
            case "filter":
                filter(FrameMatch.of(Pipeline.asMap(kind, descriptor)));
                break;
            case "select":
                if (descriptor instanceof Map) {
                    Map<String, String> renames = new LinkedHashMap<>();
                    Utils.<Map<String, ?>>cast(descriptor).forEach((column, rename) ->
                        renames.put(column, rename == null ? null : rename.toString()));
                    select(renames);
                }
                else
                    select(strings(descriptor));
                break;
            case "omit":
                omit(strings(descriptor));
                break;
            case "sort":
                if (descriptor instanceof Map) {
                    Map<String, Object> sort = Pipeline.asMap(kind, descriptor);
                    sort(Boolean.TRUE.equals(sort.get("desc")), strings(sort.get("by")));
                }
                else
                    sort(false, strings(descriptor));
                break;
            case "clean":
                List<Object> actions = Utils.asList(descriptor);
                clean(clean -> {
                    for (Object action : actions)
                        parseCleanAction(clean, Pipeline.asMap(kind, action));
                });
                break;
            case "groupBy":
                Map<String, Object> groupBy = Pipeline.asMap(kind, descriptor);
                groupBy(Arrays.asList(strings(groupBy.get("by"))), aggregates(groupBy.get("aggregates")));
                break;
            case "reduce":
                reduce(aggregates(descriptor));
                break;
            case "transform":
            case "cast":
                List<ColumnOperation> operations = new ArrayList<>();
                for (Object operation : Utils.asList(descriptor))
                    operations.add(ColumnOperation.parse(Pipeline.asMap(kind, operation)));
                operate(kind.equals("cast"), operations);
                break;
            case "merge":
                Map<String, Object> merge = Pipeline.asMap(kind, descriptor);
                Object operator = merge.get("operator");
                Object as = merge.get("as");
                Object alignment = merge.get("alignment");
                if (operator == null || as == null)
                    throw new IllegalArgumentException("Merge step requires an operator and an output column: " + merge);
                merge(ColumnMerge.Operator.of(operator.toString()), Arrays.asList(strings(merge.get("columns"))),
                      merge.get("argument"), as.toString(),
                      alignment == null ? Alignment.LEFT : Alignment.of(alignment.toString()),
                      Boolean.TRUE.equals(merge.get("replace")));
                break;
            case "concat":
                if (descriptor instanceof Map) {
                    Map<String, Object> concat = Pipeline.asMap(kind, descriptor);
                    Map<String, String> columns = new LinkedHashMap<>();
                    if (concat.get("columns") != null)
                        Pipeline.asMap(kind, concat.get("columns")).forEach((from, to) -> columns.put(from, String.valueOf(to)));
                    concat(String.valueOf(concat.get("frame")), columns);
                }
                else
                    concat(String.valueOf(descriptor));
                break;
            case "join":
                Map<String, Object> join = Pipeline.asMap(kind, descriptor);
                String[] on = strings(join.get("on"));
                if (on.length < 1 || on.length > 2)
                    throw new IllegalArgumentException("Join step requires one or two columns to join on: " + join);
                Object joinAlignment = join.get("alignment");
                join(String.valueOf(join.get("frame")), on[0], on[on.length - 1],
                     joinAlignment == null ? Alignment.INNER : Alignment.of(joinAlignment.toString()));
                break;
            default:
                throw new AssertionError(kind);
        }
    }
    
    private static void parseCleanAction(CleanAPI clean, Map<String, Object> action) {
        Object column = action.get("column");
        if (column == null)
            throw new IllegalArgumentException("Clean action requires a column: " + action);
        String name = column.toString();
        if (action.containsKey("fillNulls"))
            clean.fillNulls(name, action.get("fillNulls"), Utils.asList(action.get("args")).toArray());
        if (Boolean.TRUE.equals(action.get("omitNulls")))
            clean.omitNulls(name);
        if (action.get("validations") != null)
            clean.validations(name, Constraints.of(Pipeline.asMap("clean", action.get("validations"))));
        if (action.get("violations") != null)
            clean.violations(name, Constraints.of(Pipeline.asMap("clean", action.get("violations"))));
    }
    
    private static String[] strings(Object descriptor) {
        List<Object> values = Utils.asList(descriptor);
        String[] strings = new String[values.size()];
        for (int i = 0; i < strings.length; i++)
            strings[i] = String.valueOf(values.get(i));
        return strings;
    }
    
    private static List<Aggregate> aggregates(Object descriptor) {
        List<Aggregate> aggregates = new ArrayList<>();
        for (Object aggregate : Utils.asList(descriptor))
            aggregates.add(Aggregate.parse(Pipeline.asMap("aggregate", aggregate)));
        return aggregates;
    }
    
    // ---- checks
    
    private PipelineAPI operate(boolean cast, List<ColumnOperation> operations) {
        for (ColumnOperation operation : operations)
            if (!ValueType.anyHas(cast ? ValueType::casterNames : ValueType::transformerNames, operation.operator))
                throw new IllegalArgumentException("Unknown " + (cast ? "caster" : "transformer") + ": " + operation.operator);
        steps.add(new OperateStep(cast, new ArrayList<>(operations)));
        return this;
    }
    
    private static void checkReducers(List<Aggregate> aggregates) {
        for (Aggregate aggregate : aggregates)
            if (!ValueType.anyHas(ValueType::reducerNames, aggregate.reducer()))
                throw new IllegalArgumentException("Unknown reducer: " + aggregate.reducer());
    }
    
    private static void checkFilters(FrameMatch match) {
        for (Match columnMatch : match.columns().values())
            checkFilters(columnMatch);
        for (FrameMatch alternative : match.alternatives())
            checkFilters(alternative);
    }
    
    private static void checkFilters(Match match) {
        for (String operator : match.operators().keySet())
            if (!ValueType.anyHas(ValueType::filterNames, operator))
                throw new IllegalArgumentException("Unknown filter: " + operator);
        for (Match alternative : match.alternatives())
            checkFilters(alternative);
    }
    
    // ---- steps
    
    private static class ColumnOperation {
        final String column;
        final String operator;
        final Object[] args;
        final String as;
        
        ColumnOperation(String column, String operator, Object[] args, String as) {
            this.column = Objects.requireNonNull(column);
            this.operator = Objects.requireNonNull(operator);
            this.args = args == null ? new Object[0] : args;
            this.as = as;
        }
        
        static ColumnOperation parse(Map<String, Object> descriptor) {
            Object column = descriptor.get("column");
            Object operator = descriptor.get("operator");
            if (column == null || operator == null)
                throw new IllegalArgumentException("Operation requires a column and an operator: " + descriptor);
            Object as = descriptor.get("as");
            return new ColumnOperation(column.toString(), operator.toString(),
                                       Utils.asList(descriptor.get("args")).toArray(), as == null ? null : as.toString());
        }
    }
    
    private static class CleanAction {
        static final int FILL = 0;
        static final int OMIT = 1;
        static final int VALIDATIONS = 2;
        static final int VIOLATIONS = 3;
        
        final String column;
        final int type;
        final Object value;
        final Object[] args;
        
        CleanAction(String column, int type, Object value, Object[] args) {
            this.column = Objects.requireNonNull(column);
            this.type = type;
            this.value = value;
            this.args = args == null ? new Object[0] : args;
        }
    }
    
    private static class FilterStep implements Pipeline.Step {
        final FrameMatch match;
        
        FilterStep(FrameMatch match) {
            this.match = match;
        }
        
        @Override
        public String kind() {
            return "filter";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.where(match);
        }
    }
    
    private static class SelectStep implements Pipeline.Step {
        final Map<String, String> renames;
        
        SelectStep(Map<String, String> renames) {
            this.renames = renames;
        }
        
        @Override
        public String kind() {
            return "select";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.select(renames);
        }
    }
    
    private static class OmitStep implements Pipeline.Step {
        final String[] columns;
        
        OmitStep(String[] columns) {
            this.columns = columns;
        }
        
        @Override
        public String kind() {
            return "omit";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.unselect(columns);
        }
    }
    
    private static class SortStep implements Pipeline.Step {
        final boolean desc;
        final String[] columns;
        
        SortStep(boolean desc, String[] columns) {
            this.desc = desc;
            this.columns = columns;
        }
        
        @Override
        public String kind() {
            return "sort";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.sort(desc, columns);
        }
    }
    
    private static class CleanStep implements Pipeline.Step {
        final List<CleanAction> actions;
        
        CleanStep(List<CleanAction> actions) {
            this.actions = actions;
        }
        
        @Override
        public String kind() {
            return "clean";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            for (CleanAction action : actions) {
                Series<?> column = frame.column(action.column);
                switch (action.type) {
                    case CleanAction.FILL:
                        if (!column.isFillReducer(action.value))
                            column.type().convert(action.value);
                        break;
                    case CleanAction.VALIDATIONS:
                    case CleanAction.VIOLATIONS:
                        column.type().checkConstraints((Constraints) action.value);
                        break;
                    default:
                        break;
                }
            }
            for (CleanAction action : actions) {
                Series<?> column = frame.column(action.column);
                switch (action.type) {
                    case CleanAction.FILL:
                        column.fillNulls(action.value, action.args);
                        break;
                    case CleanAction.OMIT:
                        frame.omitNulls(action.column);
                        break;
                    case CleanAction.VALIDATIONS:
                        column.setValidations((Constraints) action.value);
                        break;
                    case CleanAction.VIOLATIONS:
                        column.setViolations((Constraints) action.value);
                        break;
                    default:
                        throw new AssertionError(action.type);
                }
            }
            return frame.fillKeys();
        }
    }
    
    private static class GroupByStep implements Pipeline.Step {
        final List<String> by;
        final List<Aggregate> aggregates;
        
        GroupByStep(List<String> by, List<Aggregate> aggregates) {
            this.by = by;
            this.aggregates = aggregates;
        }
        
        @Override
        public String kind() {
            return "groupBy";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.groupBy(by, aggregates);
        }
    }
    
    private static class ReduceStep implements Pipeline.Step {
        final List<Aggregate> aggregates;
        
        ReduceStep(List<Aggregate> aggregates) {
            this.aggregates = aggregates;
        }
        
        @Override
        public String kind() {
            return "reduce";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.reduce(aggregates);
        }
    }
    
    /**
     * Transforms or casts columns. Every operation reads the frame as it was when the step began; results are put in
     * place only once all of them are computed.
     */
    private static class OperateStep implements Pipeline.Step {
        final boolean cast;
        final List<ColumnOperation> operations;
        
        OperateStep(boolean cast, List<ColumnOperation> operations) {
            this.cast = cast;
            this.operations = operations;
        }
        
        @Override
        public String kind() {
            return cast ? "cast" : "transform";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            List<Series<?>> results = new ArrayList<>();
            for (ColumnOperation operation : operations) {
                Series<?> column = frame.column(operation.column);
                results.add(cast ? column.cast(operation.operator, operation.args)
                                 : column.transform(operation.operator, operation.args));
            }
            for (int i = 0; i < operations.size(); i++) {
                ColumnOperation operation = operations.get(i);
                frame.putColumn(operation.as != null ? operation.as : operation.column, results.get(i));
            }
            return frame;
        }
    }
    
    private static class MergeStep implements Pipeline.Step {
        final ColumnMerge.Operator operator;
        final List<String> columns;
        final Object argument;
        final String as;
        final Alignment alignment;
        final boolean replace;
        
        MergeStep(ColumnMerge.Operator operator, List<String> columns, Object argument, String as,
                  Alignment alignment, boolean replace) {
            this.operator = operator;
            this.columns = columns;
            this.argument = argument;
            this.as = as;
            this.alignment = alignment;
            this.replace = replace;
        }
        
        @Override
        public String kind() {
            return "merge";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.mergeColumns(columns, operator, argument, as, alignment, replace);
        }
    }
    
    private static class ConcatStep implements Pipeline.Step {
        final String frame;
        final Map<String, String> columns;
        
        ConcatStep(String frame, Map<String, String> columns) {
            this.frame = frame;
            this.columns = columns;
        }
        
        @Override
        public String kind() {
            return "concat";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.concat(registry.get(this.frame), columns);
        }
    }
    
    private static class JoinStep implements Pipeline.Step {
        final String frame;
        final String leftOn;
        final String rightOn;
        final Alignment alignment;
        
        JoinStep(String frame, String leftOn, String rightOn, Alignment alignment) {
            this.frame = frame;
            this.leftOn = leftOn;
            this.rightOn = rightOn;
            this.alignment = alignment;
        }
        
        @Override
        public String kind() {
            return "join";
        }
        
        @Override
        public DataFrame apply(DataFrame frame, FrameRegistry registry) {
            return frame.merge(registry.get(this.frame), leftOn, rightOn, alignment);
        }
    }
}
