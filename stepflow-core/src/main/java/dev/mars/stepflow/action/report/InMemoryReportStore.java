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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryReportStore implements ReportStore {

    private final Map<String, Finding> findings = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized String addFinding(Finding finding) {
        String id = String.format("F-%04d", sequence.incrementAndGet());
        findings.put(id, finding);
        return id;
    }

    @Override
    public synchronized List<Finding> getFindings(String runId) {
        List<Finding> result = new ArrayList<>();
        for (Finding finding : findings.values()) {
            if (Objects.equals(runId, finding.getRunId())) {
                result.add(finding);
            }
        }
        return result;
    }
}
