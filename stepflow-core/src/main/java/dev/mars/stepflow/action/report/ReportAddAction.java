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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public class ReportAddAction implements WorkflowAction {

    public static final String ACTION_ID = "report/add";

    private final ReportStore reportStore;

    public ReportAddAction(ReportStore reportStore) {
        this.reportStore = Objects.requireNonNull(reportStore, "Report store cannot be null");
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String title = params.requireString("title");
        Finding.Severity severity;
        try {
            severity = Finding.Severity.fromString(params.getString("severity", "info"));
        } catch (IllegalArgumentException e) {
            throw params.invalid("severity must be one of info, low, medium, high, critical");
        }

        Finding finding = new Finding(request.getRunId(), title, severity,
                params.getString("description"), params.getString("evidence"),
                params.getStringList("tags"), Instant.now());
        String findingId = reportStore.addFinding(finding);

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("finding_id", findingId);
        outputs.put("title", title);
        outputs.put("severity", severity.name().toLowerCase(Locale.ROOT));
        outputs.put("success", true);
        return ActionResult.of(outputs);
    }
}
