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

package dev.mars.stepflow.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, ordered list of steps plus the hook lists walked when it finishes.
 */
public class Job {

    private final String name;
    private final List<Step> steps;
    private final List<Step> onComplete;
    private final List<Step> onFailure;
    private final List<Step> finallySteps;

    public Job(String name, List<Step> steps, List<Step> onComplete, List<Step> onFailure, List<Step> finallySteps) {
        this.name = Objects.requireNonNull(name, "Job name cannot be null");
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Steps cannot be null"));
        this.onComplete = onComplete != null ? List.copyOf(onComplete) : List.of();
        this.onFailure = onFailure != null ? List.copyOf(onFailure) : List.of();
        this.finallySteps = finallySteps != null ? List.copyOf(finallySteps) : List.of();
    }

    public String getName() {
        return name;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public List<Step> getOnComplete() {
        return onComplete;
    }

    public List<Step> getOnFailure() {
        return onFailure;
    }

    public List<Step> getFinally() {
        return finallySteps;
    }

    /**
     * Every step of the job: main steps first, then the hook lists.
     */
    public List<Step> getAllSteps() {
        List<Step> all = new ArrayList<>(steps);
        all.addAll(onComplete);
        all.addAll(onFailure);
        all.addAll(finallySteps);
        return all;
    }

    public Optional<Step> findStep(String id) {
        return getAllSteps().stream().filter(step -> step.getId().equals(id)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return name.equals(job.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Job{name='" + name + "', steps=" + steps.size() + ", finally=" + finallySteps.size() + "}";
    }
}
