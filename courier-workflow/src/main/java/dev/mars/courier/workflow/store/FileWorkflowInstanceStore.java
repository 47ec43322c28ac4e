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


package dev.mars.courier.workflow.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepStatus;
import dev.mars.courier.core.WorkflowError;
import dev.mars.courier.core.WorkflowInstance;
import dev.mars.courier.core.WorkflowResult;
import dev.mars.courier.core.WorkflowStatus;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.NotFoundException;
import dev.mars.courier.core.json.CourierObjectMapper;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Durable {@link WorkflowInstanceStore} keeping one directory per instance.
 *
 * <p><b>Layout:</b></p>
 * <pre>
 * {baseDir}/
 *   {instanceId}/
 *     instance.json          full record, rewritten only by save()
 *     status.json            workflow status, result and error overlay
 *     steps/{stepId}.json    step status and result overlay
 * </pre>
 *
 * <p>Partial updates write only the small overlay files; {@link #load} merges them over
 * {@code instance.json}. A full {@link #save} rewrites the record and drops the overlays.
 * Every file is written to a temporary file first and then atomically renamed.</p>
 *
 * <p>All file I/O runs on worker threads, ordered on the context that opened the store.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class FileWorkflowInstanceStore implements WorkflowInstanceStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileWorkflowInstanceStore.class);

    static final String INSTANCE_FILE = "instance.json";
    static final String STATUS_FILE = "status.json";
    static final String STEPS_DIR = "steps";

    private final Vertx vertx;
    private final Path baseDir;
    private final ObjectMapper mapper;

    private volatile Context context;
    private volatile boolean opened = false;

    public FileWorkflowInstanceStore(Vertx vertx, Path baseDir) {
        this.vertx = vertx;
        this.baseDir = baseDir;
        this.mapper = CourierObjectMapper.create();
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public Future<Void> open() {
        if (context == null) {
            context = vertx.getOrCreateContext();
        }
        return context.executeBlocking(() -> {
            Files.createDirectories(baseDir);
            opened = true;
            LOG.info("FileWorkflowInstanceStore opened: {}", baseDir);
            return null;
        }, true);
    }

    @Override
    public Future<Void> close() {
        if (context == null) {
            return Future.succeededFuture();
        }
        return context.executeBlocking(() -> {
            opened = false;
            LOG.info("FileWorkflowInstanceStore closed: {}", baseDir);
            return null;
        }, true);
    }

    // =========================================================================
    // Instance records
    // =========================================================================

    @Override
    public Future<Void> save(WorkflowInstance instance) {
        WorkflowInstance copy;
        synchronized (instance) {
            copy = instance.copy();
        }
        return blocking(() -> {
            Path dir = instanceDir(copy.getId());
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(INSTANCE_FILE), copy);
            Files.deleteIfExists(dir.resolve(STATUS_FILE));
            deleteRecursively(dir.resolve(STEPS_DIR));
            LOG.debug("Saved workflow instance {} ({})", copy.getId(), copy.getStatus());
            return null;
        });
    }

    @Override
    public Future<WorkflowInstance> load(String instanceId) {
        return blocking(() -> {
            Path dir = existingInstanceDir(instanceId);
            return read(dir);
        });
    }

    @Override
    public Future<List<WorkflowInstance>> loadForUser(String userId) {
        return blocking(() -> {
            List<WorkflowInstance> result = new ArrayList<>();
            for (WorkflowInstance instance : readAll()) {
                if (userId == null || userId.equals(instance.getUserId())) {
                    result.add(instance);
                }
            }
            return result;
        });
    }

    @Override
    public Future<List<WorkflowInstance>> loadAll() {
        return loadForUser(null);
    }

    @Override
    public Future<Boolean> delete(String instanceId) {
        return blocking(() -> {
            Path dir = instanceDir(instanceId);
            if (!Files.isDirectory(dir)) {
                return false;
            }
            deleteRecursively(dir);
            LOG.debug("Deleted workflow instance {}", instanceId);
            return true;
        });
    }

    @Override
    public Future<Integer> deleteOlderThan(Duration maxAge) {
        return blocking(() -> {
            Instant cutoff = Instant.now().minus(maxAge);
            int removed = 0;
            for (WorkflowInstance instance : readAll()) {
                if (instance.isTerminal() && instance.getCompletedAt() != null
                        && instance.getCompletedAt().isBefore(cutoff)) {
                    deleteRecursively(instanceDir(instance.getId()));
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.info("Removed {} workflow instances older than {}", removed, maxAge);
            }
            return removed;
        });
    }

    // =========================================================================
    // Partial updates
    // =========================================================================

    @Override
    public Future<Void> updateStatus(String instanceId, WorkflowStatus status) {
        return blocking(() -> {
            Path file = existingInstanceDir(instanceId).resolve(STATUS_FILE);
            StatusOverlay current = readOverlay(file, StatusOverlay.class, StatusOverlay.EMPTY);
            writeAtomically(file, new StatusOverlay(status, current.result(), current.error()));
            return null;
        });
    }

    @Override
    public Future<Void> saveWorkflowResult(String instanceId, WorkflowResult result) {
        return blocking(() -> {
            Path file = existingInstanceDir(instanceId).resolve(STATUS_FILE);
            StatusOverlay current = readOverlay(file, StatusOverlay.class, StatusOverlay.EMPTY);
            writeAtomically(file, new StatusOverlay(current.status(), result, current.error()));
            return null;
        });
    }

    @Override
    public Future<Void> saveWorkflowError(String instanceId, WorkflowError error) {
        return blocking(() -> {
            Path file = existingInstanceDir(instanceId).resolve(STATUS_FILE);
            StatusOverlay current = readOverlay(file, StatusOverlay.class, StatusOverlay.EMPTY);
            writeAtomically(file, new StatusOverlay(current.status(), current.result(), error));
            return null;
        });
    }

    @Override
    public Future<Void> updateStepStatus(String instanceId, String stepId, StepStatus status) {
        return blocking(() -> {
            Path file = stepOverlayFile(instanceId, stepId);
            StepOverlay current = readOverlay(file, StepOverlay.class, StepOverlay.EMPTY);
            writeAtomically(file, new StepOverlay(status, current.result()));
            return null;
        });
    }

    @Override
    public Future<Void> saveStepResult(String instanceId, String stepId, StepResult result) {
        return blocking(() -> {
            Path file = stepOverlayFile(instanceId, stepId);
            StepOverlay current = readOverlay(file, StepOverlay.class, StepOverlay.EMPTY);
            writeAtomically(file, new StepOverlay(current.status(), result));
            return null;
        });
    }

    public Path getBaseDir() {
        return baseDir;
    }

    // =========================================================================
    // Blocking helpers
    // =========================================================================

    private <T> Future<T> blocking(Callable<T> work) {
        if (!opened || context == null) {
            return Future.failedFuture(new IllegalStateException("Store not open"));
        }
        return context.executeBlocking(work, true);
    }

    private WorkflowInstance read(Path dir) throws IOException {
        WorkflowInstance instance = mapper.readValue(dir.resolve(INSTANCE_FILE).toFile(), WorkflowInstance.class);

        StatusOverlay status = readOverlay(dir.resolve(STATUS_FILE), StatusOverlay.class, StatusOverlay.EMPTY);
        if (status.status() != null) {
            instance.setStatus(status.status());
        }
        if (status.result() != null) {
            instance.setResult(status.result());
        }
        if (status.error() != null) {
            instance.setError(status.error());
        }

        Path stepsDir = dir.resolve(STEPS_DIR);
        for (WorkflowStep step : instance.getSteps()) {
            StepOverlay overlay = readOverlay(stepsDir.resolve(step.getId() + ".json"), StepOverlay.class,
                    StepOverlay.EMPTY);
            if (overlay.status() != null) {
                step.setStatus(overlay.status());
            }
            if (overlay.result() != null) {
                step.setResult(overlay.result());
            }
        }
        return instance;
    }

    private List<WorkflowInstance> readAll() throws IOException {
        List<WorkflowInstance> result = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) {
            return result;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(baseDir, path -> Files.isDirectory(path))) {
            for (Path dir : dirs) {
                if (Files.exists(dir.resolve(INSTANCE_FILE))) {
                    result.add(read(dir));
                }
            }
        }
        return result;
    }

    private <T> T readOverlay(Path file, Class<T> type, T empty) throws IOException {
        if (!Files.exists(file)) {
            return empty;
        }
        return mapper.readValue(file.toFile(), type);
    }

    private void writeAtomically(Path target, Object value) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), value);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path stepOverlayFile(String instanceId, String stepId) throws IOException, NotFoundException {
        Path stepsDir = existingInstanceDir(instanceId).resolve(STEPS_DIR);
        Files.createDirectories(stepsDir);
        return stepsDir.resolve(checkedName(stepId, "step id") + ".json");
    }

    private Path existingInstanceDir(String instanceId) throws NotFoundException {
        Path dir = instanceDir(instanceId);
        if (!Files.exists(dir.resolve(INSTANCE_FILE))) {
            throw NotFoundException.instance(instanceId);
        }
        return dir;
    }

    private Path instanceDir(String instanceId) {
        return baseDir.resolve(checkedName(instanceId, "instance id"));
    }

    private static String checkedName(String id, String what) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.startsWith(".")) {
            throw new IllegalArgumentException("Invalid " + what + ": " + id);
        }
        return id;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path p : paths) {
                Files.delete(p);
            }
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StatusOverlay(WorkflowStatus status, WorkflowResult result, WorkflowError error) {
        static final StatusOverlay EMPTY = new StatusOverlay(null, null, null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StepOverlay(StepStatus status, StepResult result) {
        static final StepOverlay EMPTY = new StepOverlay(null, null);
    }
}
