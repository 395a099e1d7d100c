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

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Lists the findings recorded so far, by default for the current run.
 * {@code with.min_severity} drops findings below the given level.
 */
public class ReportListAction implements WorkflowAction {

    public static final String ACTION_ID = "report/list";

    private final ReportStore reportStore;

    public ReportListAction(ReportStore reportStore) {
        this.reportStore = Objects.requireNonNull(reportStore, "Report store cannot be null");
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String runId = params.getString("run_id", request.getRunId());
        Finding.Severity minimum;
        try {
            minimum = Finding.Severity.fromString(params.getString("min_severity", "info"));
        } catch (IllegalArgumentException e) {
            throw params.invalid("min_severity must be one of info, low, medium, high, critical");
        }

        List<Object> findings = new ArrayList<>();
        for (Finding finding : reportStore.getFindings(runId)) {
            if (finding.getSeverity().compareTo(minimum) >= 0) {
                findings.add(toMap(finding));
            }
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("run_id", runId);
        outputs.put("findings", findings);
        outputs.put("count", (long) findings.size());
        return ActionResult.of(outputs);
    }

    private static Map<String, Object> toMap(Finding finding) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("title", finding.getTitle());
        map.put("severity", finding.getSeverity().name().toLowerCase(Locale.ROOT));
        map.put("description", finding.getDescription());
        map.put("evidence", finding.getEvidence());
        map.put("tags", new ArrayList<Object>(finding.getTags()));
        map.put("recorded_at", finding.getRecordedAt().toString());
        return map;
    }
}
