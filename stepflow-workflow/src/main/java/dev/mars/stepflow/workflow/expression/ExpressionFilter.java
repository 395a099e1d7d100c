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

package dev.mars.stepflow.workflow.expression;

import java.util.List;

/**
 * A named, side-effect-free transformation usable as {@code value | name(args)}
 * or as {@code name(value, args)}.
 */
@FunctionalInterface
public interface ExpressionFilter {

    /**
     * @param subject the piped value, possibly {@link Undefined#INSTANCE}
     * @param arguments the evaluated arguments following the subject
     * @throws ExpressionException if the filter cannot be applied to its operands
     */
    Object apply(Object subject, List<Object> arguments);
}
