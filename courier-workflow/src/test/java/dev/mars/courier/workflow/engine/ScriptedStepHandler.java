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

import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.WorkflowContext;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.workflow.handler.StepHandler;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test handler whose behaviour is scripted per step id. Unscripted steps succeed immediately.
 */
final class ScriptedStepHandler implements StepHandler {

    @FunctionalInterface
    interface Script {
        Future<StepResult> run(WorkflowStep step, WorkflowContext context, int attempt);
    }

    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final Map<String, List<Promise<StepResult>>> held = new ConcurrentHashMap<>();
    private final List<String> invocations = Collections.synchronizedList(new ArrayList<>());

    ScriptedStepHandler on(String stepId, Script script) {
        scripts.put(stepId, script);
        return this;
    }

    /**
     * Every attempt of the step returns a future that only completes when the test completes it.
     */
    ScriptedStepHandler hold(String stepId) {
        return on(stepId, (step, context, attempt) -> {
            Promise<StepResult> promise = Promise.promise();
            held.computeIfAbsent(stepId, k -> new CopyOnWriteArrayList<>()).add(promise);
            return promise.future();
        });
    }

    ScriptedStepHandler failAlways(String stepId) {
        return on(stepId, (step, context, attempt) ->
                Future.succeededFuture(StepResult.failure(step.getType(), "scripted failure " + attempt)));
    }

    @Override
    public Future<StepResult> handle(WorkflowStep step, WorkflowContext context) {
        invocations.add(step.getId());
        int attempt = attempts.computeIfAbsent(step.getId(), k -> new AtomicInteger()).incrementAndGet();
        Script script = scripts.get(step.getId());
        if (script == null) {
            return Future.succeededFuture(StepResult.success(step.getType(), Map.of("step", step.getId())));
        }
        return script.run(step, context, attempt);
    }

    int attempts(String stepId) {
        AtomicInteger count = attempts.get(stepId);
        return count != null ? count.get() : 0;
    }

    List<String> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    /**
     * @param index zero-based attempt index
     */
    Promise<StepResult> heldPromise(String stepId, int index) {
        return held.get(stepId).get(index);
    }

    int heldCount(String stepId) {
        List<Promise<StepResult>> promises = held.get(stepId);
        return promises != null ? promises.size() : 0;
    }
}
