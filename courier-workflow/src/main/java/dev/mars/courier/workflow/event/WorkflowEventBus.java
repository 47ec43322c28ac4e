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


package dev.mars.courier.workflow.event;

import dev.mars.courier.core.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publisher of {@link WorkflowEvent}s.
 *
 * <p>Events are delivered synchronously, in emission order, to listeners in registration
 * order. A listener that throws is logged and skipped; the remaining listeners still
 * receive the event.</p>
 */
public class WorkflowEventBus {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEventBus.class);

    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(WorkflowEventListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(WorkflowEvent event) {
        for (WorkflowEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.error("Listener failed on {} for workflow {}: {}",
                        event.type().getWireName(), event.workflowInstanceId(), e.getMessage(), e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
