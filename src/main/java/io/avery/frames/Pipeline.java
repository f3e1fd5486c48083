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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * An ordered list of steps, each turning a frame into a frame. Applying a pipeline threads a copy of the input frame
 * through the steps strictly in order; the input frame itself is not modified.
 *
 * <p>Each step checks everything it needs (columns, operators, kinds) before changing anything, so a step that
 * throws leaves the frame as it was when the step began. A failing step does not undo earlier steps.
 *
 * <p>Operator and reducer names are checked when the pipeline is built, against the tables of every value kind;
 * whether the operator applies to a particular column's kind is checked when the step runs.
 *
 * <p>A pipeline is built with a configurator:
 * <pre>{@code
 * Pipeline pipeline = Pipeline.of(p -> p
 *     .filter(new FrameMatch().column("amount", new Match().gt(0)))
 *     .transformAs("amountK", "amount", "divideBy", 1000)
 *     .groupBy(List.of("region"), Aggregate.of("amountK", "sum").as("totalK"))
 *     .sort(true, "totalK")
 * );
 * DataFrame result = sales.aggregate(pipeline);
 * }</pre>
 *
 * <p>or parsed from plain data, one single-key map per step:
 * <pre>{@code
 * [ {"filter":    {"$amount": {"gt": 0}, "head": 100}},
 *   {"select":    ["region", "amount"]}                  // or {"amount": "amt", "region": null} to rename
 *   {"omit":      ["note"]},
 *   {"sort":      {"by": ["amount"], "desc": true}},     // or ["amount"]
 *   {"clean":     [{"column": "amount", "fillNulls": "mean", "omitNulls": false,
 *                   "validations": {"min": 0}, "violations": {"max": 1000}}]},
 *   {"transform": [{"column": "amount", "operator": "round", "args": [2], "as": "rounded"}]},
 *   {"cast":      [{"column": "amount", "operator": "toString"}]},
 *   {"merge":     {"columns": ["a", "b"], "operator": "calculate", "argument": "a + b", "as": "c",
 *                  "alignment": "left", "replace": false}},
 *   {"groupBy":   {"by": ["region"], "aggregates": [{"column": "amount", "reducer": "sum", "as": "total"}]}},
 *   {"reduce":    [{"column": "amount", "reducer": "mean"}]},
 *   {"concat":    {"frame": "archive", "columns": {"amt": "amount"}}},
 *   {"join":      {"frame": "regions", "on": ["region", "code"], "alignment": "left"}} ]
 * }</pre>
 * A step map with no recognized key is ignored, with a warning.
 *
 * @see PipelineAPI
 */
public final class Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);
    
    static final Set<String> STEP_KINDS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        "filter", "select", "omit", "sort", "clean", "groupBy", "reduce", "transform", "cast", "merge", "concat", "join"
    )));
    
    interface Step {
        String kind();
        DataFrame apply(DataFrame frame, FrameRegistry registry);
    }
    
    private final List<Step> steps;
    
    private Pipeline(List<Step> steps) {
        this.steps = steps;
    }
    
    /**
     * Builds a pipeline with a configurator.
     *
     * @param config a consumer that adds steps to the {@link PipelineAPI configurator}
     * @return the pipeline
     * @throws IllegalArgumentException if a step names an operator or reducer no value kind has
     */
    public static Pipeline of(Consumer<PipelineAPI> config) {
        PipelineAPI api = new PipelineAPI();
        config.accept(api);
        return new Pipeline(Collections.unmodifiableList(new ArrayList<>(api.steps)));
    }
    
    /**
     * Parses a pipeline from step descriptors. See the class documentation for the descriptor forms.
     *
     * @param descriptors the step descriptors, in order
     * @return the pipeline
     * @throws IllegalArgumentException if a descriptor is malformed, holds more than one step kind, or names an
     * operator or reducer no value kind has
     */
    public static Pipeline parse(List<? extends Map<String, ?>> descriptors) {
        return of(api -> {
            for (Map<String, ?> descriptor : descriptors) {
                List<String> kinds = new ArrayList<>();
                for (String key : descriptor.keySet())
                    if (STEP_KINDS.contains(key))
                        kinds.add(key);
                if (kinds.isEmpty()) {
                    logger.warn("Ignoring unrecognized pipeline step: {}", descriptor.keySet());
                    continue;
                }
                if (kinds.size() > 1)
                    throw new IllegalArgumentException("Pipeline step holds more than one step kind: " + kinds);
                api.parseStep(kinds.get(0), descriptor.get(kinds.get(0)));
            }
        });
    }
    
    /**
     * Applies the pipeline to a copy of the frame, with no frames available to reference.
     *
     * @param frame the input frame
     * @return the output frame
     */
    public DataFrame apply(DataFrame frame) {
        return apply(frame, new FrameRegistry());
    }
    
    /**
     * Applies the pipeline to a copy of the frame.
     *
     * @param frame the input frame
     * @param registry the frames steps may reference by name
     * @return the output frame
     * @throws java.util.NoSuchElementException if a step references a column or frame that does not exist
     * @throws IllegalArgumentException if a step's operator does not apply to its column's kind
     */
    public DataFrame apply(DataFrame frame, FrameRegistry registry) {
        DataFrame current = frame.clone();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            logger.debug("Applying step {} ({}) to frame '{}' of {} rows", i, step.kind(), current.name(), current.size());
            current = step.apply(current, registry);
        }
        return current;
    }
    
    public int size() {
        return steps.size();
    }
    
    /**
     * Returns the kinds of the steps, in order.
     */
    public List<String> stepKinds() {
        List<String> kinds = new ArrayList<>();
        for (Step step : steps)
            kinds.add(step.kind());
        return kinds;
    }
    
    @Override
    public String toString() {
        return "Pipeline" + stepKinds();
    }
    
    static Map<String, Object> asMap(String step, Object descriptor) {
        if (!(descriptor instanceof Map))
            throw new IllegalArgumentException("Invalid " + step + " step: " + descriptor);
        return new LinkedHashMap<>(Utils.<Map<String, Object>>cast(descriptor));
    }
}
