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

package dev.mars.stepflow.workflow.guardrail;

import java.util.Map;

/**
 * A content scanner applied to action inputs or outputs.
 * Implementations are stateless and shared by concurrent runs.
 */
public interface GuardrailScanner {

    /**
     * Name the scanner is configured under, for example {@code secrets}.
     */
    String getName();

    /**
     * Scans a payload.
     *
     * @param text the payload
     * @param params scanner parameters from the guardrail configuration, never {@code null}
     * @return pass (possibly with a rewritten payload) or a violation
     * @throws IllegalArgumentException if the parameters are invalid
     */
    ScanResult scan(String text, Map<String, Object> params);
}
