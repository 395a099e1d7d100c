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

package dev.mars.stepflow.action.report;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A finding recorded by the {@code report/add} action.
 */
public final class Finding {

    public enum Severity {
        INFO, LOW, MEDIUM, HIGH, CRITICAL;

        public static Severity fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final String runId;
    private final String title;
    private final Severity severity;
    private final String description;
    private final String evidence;
    private final List<String> tags;
    private final Instant recordedAt;

    public Finding(String runId, String title, Severity severity, String description,
                   String evidence, List<String> tags, Instant recordedAt) {
        this.runId = runId;
        this.title = Objects.requireNonNull(title, "Title cannot be null");
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.description = description;
        this.evidence = evidence;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.recordedAt = recordedAt != null ? recordedAt : Instant.now();
    }

    public String getRunId() {
        return runId;
    }

    public String getTitle() {
        return title;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getEvidence() {
        return evidence;
    }

    public List<String> getTags() {
        return tags;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "Finding{title='" + title + "', severity=" + severity + ", runId='" + runId + "'}";
    }
}
