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

package dev.mars.stepflow.action.llm;

import dev.mars.stepflow.core.exceptions.ActionException;

/**
 * Provider-neutral completion interface implemented by the embedding application.
 */
public interface LlmClient {

    /**
     * Run one completion.
     *
     * @throws ActionException if the provider call fails
     */
    LlmResponse complete(LlmRequest request) throws ActionException;
}
