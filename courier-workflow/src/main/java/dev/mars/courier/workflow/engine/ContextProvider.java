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


package dev.mars.courier.workflow.engine;

import dev.mars.courier.core.ContextSnapshot;

/**
 * Supplies the current user and environment context when a workflow is started without one.
 */
@FunctionalInterface
public interface ContextProvider {

    ContextSnapshot currentContext();

    static ContextProvider empty() {
        return ContextSnapshot::empty;
    }

    static ContextProvider fixed(ContextSnapshot snapshot) {
        return () -> snapshot;
    }
}
