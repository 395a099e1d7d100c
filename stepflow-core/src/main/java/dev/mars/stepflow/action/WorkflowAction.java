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

package dev.mars.stepflow.action;

import dev.mars.stepflow.core.exceptions.ActionException;

/**
 * Interface for the operations a workflow step can invoke.
 * Implementations are registered in an {@link ActionRegistry} under their action id
 * (for example {@code http/request}) and must be safe for concurrent use by
 * independent runs.
 */
public interface WorkflowAction {

    /**
     * Get the action identifier, for example {@code state/set}
     */
    String getActionId();

    /**
     * Execute the action.
     *
     * @param request resolved step parameters and a read-only view of the run
     * @return the action outputs plus any control directives for the engine
     * @throws ActionException if the action fails
     */
    ActionResult execute(ActionRequest request) throws ActionException;

    /**
     * Whether the action only manipulates engine state and never performs
     * external I/O. Such actions run on the engine thread without a timeout guard.
     */
    default boolean isInline() {
        return false;
    }
}
