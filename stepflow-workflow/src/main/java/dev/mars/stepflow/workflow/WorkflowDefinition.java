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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed representation of one workflow document. Immutable and shared
 * read-only by every run of the document.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowDefinition {

    public static final String SUPPORTED_SCHEMA_VERSION = "1.0";

    /**
     * Handling of interpolations in string-form {@code run} commands.
     */
    public enum ShellSafety {
        /** Unquoted interpolations are reported as warnings. */
        WARN,
        /** Unquoted interpolations are validation errors. */
        STRICT,
        /** Unquoted interpolations are quoted automatically at run time. */
        AUTO_QUOTE;

        public static ShellSafety fromString(String value) {
            if (value == null) {
                return WARN;
            }
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "strict":
                    return STRICT;
                case "auto_quote":
                    return AUTO_QUOTE;
                case "warn":
                    return WARN;
                default:
                    throw new IllegalArgumentException("Unknown shell_safety mode: " + value);
            }
        }
    }

    private final String name;
    private final String version;
    private final String schemaVersion;
    private final String description;
    private final String author;
    private final Map<String, InputDefinition> inputs;
    private final Map<String, Object> env;
    private final Map<String, Job> jobs;
    private final List<Step> onComplete;
    private final List<Step> onFailure;
    private final List<Step> finallySteps;
    private final Map<String, Object> guardrails;
    private final ShellSafety shellSafety;
    private final Duration defaultTimeout;
    private final String fingerprint;

    private WorkflowDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.version = builder.version != null ? builder.version : "1.0";
        this.schemaVersion = builder.schemaVersion != null ? builder.schemaVersion : SUPPORTED_SCHEMA_VERSION;
        this.description = builder.description;
        this.author = builder.author;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputs));
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        if (builder.jobs.isEmpty()) {
            throw new IllegalArgumentException("A workflow needs at least one job");
        }
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.jobs));
        this.onComplete = List.copyOf(builder.onComplete);
        this.onFailure = List.copyOf(builder.onFailure);
        this.finallySteps = List.copyOf(builder.finallySteps);
        this.guardrails = builder.guardrails != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.guardrails))
                : Map.of();
        this.shellSafety = builder.shellSafety != null ? builder.shellSafety : ShellSafety.WARN;
        this.defaultTimeout = builder.defaultTimeout != null ? builder.defaultTimeout : Duration.ofSeconds(300);
        this.fingerprint = builder.fingerprint;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    public Map<String, InputDefinition> getInputs() {
        return inputs;
    }

    /**
     * Raw {@code env} entries, usually templates resolved lazily by the engine.
     */
    public Map<String, Object> getEnv() {
        return env;
    }

    /**
     * Jobs in declaration order, which is also execution order.
     */
    public Map<String, Job> getJobs() {
        return jobs;
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
     * Workflow-wide guardrail defaults; empty when none are configured.
     */
    public Map<String, Object> getGuardrails() {
        return guardrails;
    }

    public ShellSafety getShellSafety() {
        return shellSafety;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * SHA-256 over the canonical JSON form of the source document, or
     * {@code null} for definitions built in code.
     */
    public String getFingerprint() {
        return fingerprint;
    }

    /**
     * Document-level hook steps in walk order.
     */
    public List<Step> getWorkflowHookSteps() {
        List<Step> all = new ArrayList<>(onComplete);
        all.addAll(onFailure);
        all.addAll(finallySteps);
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(version, that.version) &&
               Objects.equals(fingerprint, that.fingerprint) &&
               Objects.equals(jobs.keySet(), that.jobs.keySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, fingerprint);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", inputs=" + inputs.keySet() +
               ", jobs=" + jobs.keySet() +
               '}';
    }

    public static class Builder {
        private final String name;
        private String version;
        private String schemaVersion;
        private String description;
        private String author;
        private final Map<String, InputDefinition> inputs = new LinkedHashMap<>();
        private final Map<String, Object> env = new LinkedHashMap<>();
        private final Map<String, Job> jobs = new LinkedHashMap<>();
        private List<Step> onComplete = List.of();
        private List<Step> onFailure = List.of();
        private List<Step> finallySteps = List.of();
        private Map<String, Object> guardrails;
        private ShellSafety shellSafety;
        private Duration defaultTimeout;
        private String fingerprint;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder schemaVersion(String schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder input(InputDefinition input) {
            this.inputs.put(input.getName(), input);
            return this;
        }

        public Builder env(String key, Object value) {
            this.env.put(key, value);
            return this;
        }

        public Builder job(Job job) {
            this.jobs.put(job.getName(), job);
            return this;
        }

        public Builder onComplete(List<Step> steps) {
            this.onComplete = steps;
            return this;
        }

        public Builder onFailure(List<Step> steps) {
            this.onFailure = steps;
            return this;
        }

        public Builder finallySteps(List<Step> steps) {
            this.finallySteps = steps;
            return this;
        }

        public Builder guardrails(Map<String, Object> guardrails) {
            this.guardrails = guardrails;
            return this;
        }

        public Builder shellSafety(ShellSafety shellSafety) {
            this.shellSafety = shellSafety;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
