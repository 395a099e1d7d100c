/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.workflow.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime record of one active loop: the sequence materialised by the loop head,
 * the current position and the accumulated per-iteration results.
 */
public final class LoopFrame {

    private final String stepId;
    private final List<Object> items;
    private final int maxIterations;
    private int index;
    private final List<Object> results;
    private final List<Map<String, Object>> errors;
    private int successCount;
    private int completed;
    private Object lastOutput;
    private boolean lastSucceeded;
    private boolean breakEarly;
    private Integer breakIndex;
    private Object breakItem;

    LoopFrame(String stepId, List<Object> items, int maxIterations) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.items = new ArrayList<>(items);
        this.maxIterations = maxIterations;
        this.results = new ArrayList<>();
        this.errors = new ArrayList<>();
    }

    public String getStepId() {
        return stepId;
    }

    public List<Object> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Zero-based position of the current iteration.
     */
    public int getIndex() {
        return index;
    }

    public Object getCurrentItem() {
        return index < items.size() ? items.get(index) : null;
    }

    public int getTotal() {
        return items.size();
    }

    /**
     * Iterations the loop will actually run, bounded by {@code max_iterations}.
     */
    public int getLimit() {
        return Math.min(items.size(), maxIterations);
    }

    public boolean isTruncated() {
        return items.size() > maxIterations;
    }

    public int getCompleted() {
        return completed;
    }

    public boolean isBreakEarly() {
        return breakEarly;
    }

    /**
     * Whether the most recent iteration ran and succeeded; {@code break_if} is only
     * checked then.
     */
    boolean isLastSucceeded() {
        return lastSucceeded;
    }

    void recordSuccess(Map<String, Object> outputs) {
        results.add(outputs);
        lastOutput = outputs;
        lastSucceeded = true;
        successCount++;
        completed++;
    }

    void recordSkip() {
        results.add(null);
        lastOutput = null;
        lastSucceeded = false;
        completed++;
    }

    void recordFailure(String kind, String message, Map<String, Object> outputs) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("index", (long) index + 1);
        error.put("item", getCurrentItem());
        error.put("kind", kind);
        error.put("message", message);
        errors.add(error);
        results.add(null);
        lastOutput = outputs;
        lastSucceeded = false;
        completed++;
    }

    void requestBreak() {
        breakEarly = true;
        breakIndex = index + 1;
        breakItem = getCurrentItem();
    }

    /**
     * Moves to the next item. Returns {@code false} when the loop is exhausted.
     */
    boolean advance() {
        index++;
        return index < getLimit();
    }

    /**
     * The value bound to {@code loop} in expressions.
     */
    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("item", getCurrentItem());
        view.put("index", (long) index + 1);
        view.put("index0", (long) index);
        view.put("total", (long) getLimit());
        view.put("first", index == 0);
        view.put("last", index == getLimit() - 1);
        view.put("output", lastOutput);
        return view;
    }

    /**
     * Outputs recorded for the loop step once the loop is left.
     */
    public Map<String, Object> toOutputs() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("results", new ArrayList<>(results));
        outputs.put("iterations", (long) completed);
        outputs.put("count", (long) completed);
        outputs.put("success_count", (long) successCount);
        outputs.put("errors", new ArrayList<>(errors));
        outputs.put("break_early", breakEarly);
        outputs.put("break_index", breakIndex != null ? (Object) breakIndex.longValue() : null);
        outputs.put("break_item", breakItem);
        return outputs;
    }

    /**
     * Whether every iteration that ran failed.
     */
    boolean allFailed() {
        return completed > 0 && errors.size() == completed;
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step", stepId);
        map.put("items", new ArrayList<>(items));
        map.put("max_iterations", (long) maxIterations);
        map.put("index", (long) index);
        map.put("results", new ArrayList<>(results));
        map.put("errors", new ArrayList<>(errors));
        map.put("success_count", (long) successCount);
        map.put("completed", (long) completed);
        map.put("last_output", lastOutput);
        map.put("last_succeeded", lastSucceeded);
        map.put("break_early", breakEarly);
        map.put("break_index", breakIndex != null ? (Object) breakIndex.longValue() : null);
        map.put("break_item", breakItem);
        return map;
    }

    @SuppressWarnings("unchecked")
    static LoopFrame fromMap(Map<String, Object> map) {
        LoopFrame frame = new LoopFrame((String) map.get("step"), (List<Object>) map.get("items"),
                ((Number) map.get("max_iterations")).intValue());
        frame.index = ((Number) map.get("index")).intValue();
        frame.results.addAll((List<Object>) map.get("results"));
        for (Object error : (List<Object>) map.get("errors")) {
            frame.errors.add((Map<String, Object>) error);
        }
        frame.successCount = ((Number) map.get("success_count")).intValue();
        frame.completed = ((Number) map.get("completed")).intValue();
        frame.lastOutput = map.get("last_output");
        frame.lastSucceeded = Boolean.TRUE.equals(map.get("last_succeeded"));
        frame.breakEarly = Boolean.TRUE.equals(map.get("break_early"));
        Object breakIndex = map.get("break_index");
        frame.breakIndex = breakIndex != null ? ((Number) breakIndex).intValue() : null;
        frame.breakItem = map.get("break_item");
        return frame;
    }
}
