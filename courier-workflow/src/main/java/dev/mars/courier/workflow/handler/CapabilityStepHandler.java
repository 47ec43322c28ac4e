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


package dev.mars.courier.workflow.handler;

import dev.mars.courier.core.Artifact;
import dev.mars.courier.core.ContextSnapshot;
import dev.mars.courier.core.StepError;
import dev.mars.courier.core.StepResult;
import dev.mars.courier.core.StepType;
import dev.mars.courier.core.WorkflowContext;
import dev.mars.courier.core.WorkflowErrorCode;
import dev.mars.courier.core.WorkflowStep;
import dev.mars.courier.core.exceptions.StepExecutionException;
import dev.mars.courier.core.step.AiActionConfig;
import dev.mars.courier.core.step.ContextCheckConfig;
import dev.mars.courier.core.step.DeliverabilityFixConfig;
import dev.mars.courier.core.step.DocumentGenerationConfig;
import dev.mars.courier.core.step.EmailSendConfig;
import dev.mars.courier.core.step.ProviderVerificationConfig;
import dev.mars.courier.core.step.SmartShareConfig;
import dev.mars.courier.core.step.UserActionConfig;
import dev.mars.courier.core.step.WaitConfig;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Built-in handler for every step type.
 *
 * <p>Types backed by an external service delegate to the matching capability of
 * {@link StepCapabilities}. User actions, event waits and Smart Share requests complete
 * with an awaiting result and are finished through the engine. Time waits, condition
 * waits and context checks are evaluated here.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class CapabilityStepHandler implements StepHandler {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityStepHandler.class);

    private static final String DEFAULT_VERIFIED_RESULT = "verified";

    private final Vertx vertx;
    private final StepCapabilities capabilities;

    public CapabilityStepHandler(Vertx vertx, StepCapabilities capabilities) {
        this.vertx = vertx;
        this.capabilities = capabilities;
    }

    /**
     * @return the step types this handler can execute with the configured capabilities
     */
    public Set<StepType> getSupportedTypes() {
        Set<StepType> types = EnumSet.of(StepType.USER_ACTION, StepType.WAIT, StepType.CONTEXT_CHECK);
        capabilities.getActionExecutor().ifPresent(c -> types.add(StepType.AI_ACTION));
        capabilities.getSmartShareRequester().ifPresent(c -> types.add(StepType.SMART_SHARE));
        capabilities.getProviderVerifier().ifPresent(c -> types.add(StepType.PROVIDER_VERIFICATION));
        capabilities.getDeliverabilityFixer().ifPresent(c -> types.add(StepType.DELIVERABILITY_FIX));
        capabilities.getDocumentGenerator().ifPresent(c -> types.add(StepType.DOCUMENT_GENERATION));
        capabilities.getMailer().ifPresent(c -> types.add(StepType.EMAIL_SEND));
        return types;
    }

    @Override
    public Future<StepResult> handle(WorkflowStep step, WorkflowContext context) {
        logger.debug("Executing {} step {} of {}", step.getType(), step.getId(), context.getInstanceId());
        return switch (step.getType()) {
            case AI_ACTION -> executeAction(step, (AiActionConfig) step.getConfig(), context);
            case USER_ACTION -> requestUserAction((UserActionConfig) step.getConfig());
            case SMART_SHARE -> requestSmartShare(step, (SmartShareConfig) step.getConfig(), context);
            case PROVIDER_VERIFICATION -> verifyProvider(step, (ProviderVerificationConfig) step.getConfig(), context);
            case DELIVERABILITY_FIX -> fixDeliverability(step, (DeliverabilityFixConfig) step.getConfig(), context);
            case DOCUMENT_GENERATION -> generateDocument(step, (DocumentGenerationConfig) step.getConfig(), context);
            case EMAIL_SEND -> sendEmail(step, (EmailSendConfig) step.getConfig(), context);
            case WAIT -> await((WaitConfig) step.getConfig(), context);
            case CONTEXT_CHECK -> checkContext(step, (ContextCheckConfig) step.getConfig(), context);
        };
    }

    private Future<StepResult> executeAction(WorkflowStep step, AiActionConfig config, WorkflowContext context) {
        if (capabilities.getActionExecutor().isEmpty()) {
            return missingCapability(step);
        }
        return capabilities.getActionExecutor().get()
                .execute(config.actionId(), config.params(), context)
                .map(output -> {
                    Map<String, Object> data = output != null ? output : Map.of();
                    if (config.expectedResult() != null
                            && !ContextSnapshot.valuesEqual(data.get("result"), config.expectedResult())) {
                        return StepResult.failure(StepType.AI_ACTION, "Action " + config.actionId()
                                + " returned '" + data.get("result") + "', expected '" + config.expectedResult() + "'");
                    }
                    return StepResult.success(StepType.AI_ACTION, data, "Action " + config.actionId() + " completed");
                });
    }

    private Future<StepResult> requestUserAction(UserActionConfig config) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionType", config.actionType().getWireName());
        if (config.actionTitle() != null) {
            data.put("actionTitle", config.actionTitle());
        }
        if (!config.options().isEmpty()) {
            data.put("options", config.options().size());
        }
        data.put("required", config.required());
        String title = config.actionTitle() != null ? config.actionTitle() : "User action";
        return Future.succeededFuture(StepResult.awaiting(StepType.USER_ACTION, data, title + " awaiting user input"));
    }

    private Future<StepResult> requestSmartShare(WorkflowStep step, SmartShareConfig config, WorkflowContext context) {
        if (capabilities.getSmartShareRequester().isEmpty()) {
            return missingCapability(step);
        }
        return capabilities.getSmartShareRequester().get()
                .request(config, context)
                .map(requestId -> StepResult.awaiting(StepType.SMART_SHARE,
                        Map.of("requestId", requestId, "lookFor", config.lookFor()),
                        "Waiting for Smart Share to find " + config.lookFor()));
    }

    private Future<StepResult> verifyProvider(WorkflowStep step, ProviderVerificationConfig config,
                                              WorkflowContext context) {
        if (capabilities.getProviderVerifier().isEmpty()) {
            return missingCapability(step);
        }
        String expected = config.expectedResult() != null ? config.expectedResult() : DEFAULT_VERIFIED_RESULT;
        return capabilities.getProviderVerifier().get()
                .verify(config, context)
                .map(outcome -> expected.equals(outcome)
                        ? StepResult.success(StepType.PROVIDER_VERIFICATION,
                                Map.of("providerId", config.providerId(), "outcome", outcome),
                                "Provider " + config.providerId() + " " + outcome)
                        : StepResult.failure(StepType.PROVIDER_VERIFICATION,
                                "Provider verification returned '" + outcome + "', expected '" + expected + "'"));
    }

    private Future<StepResult> fixDeliverability(WorkflowStep step, DeliverabilityFixConfig config,
                                                 WorkflowContext context) {
        if (capabilities.getDeliverabilityFixer().isEmpty()) {
            return missingCapability(step);
        }
        return capabilities.getDeliverabilityFixer().get()
                .apply(config, context)
                .map(score -> {
                    int value = score != null ? score : 0;
                    if (config.targetScore() > 0 && value < config.targetScore()) {
                        return StepResult.failure(StepType.DELIVERABILITY_FIX, "Deliverability score " + value
                                + " is below target " + config.targetScore() + " for " + config.issue());
                    }
                    return StepResult.success(StepType.DELIVERABILITY_FIX,
                            Map.of("issue", config.issue(), "score", value),
                            "Fixed " + config.issue());
                });
    }

    private Future<StepResult> generateDocument(WorkflowStep step, DocumentGenerationConfig config,
                                                WorkflowContext context) {
        if (capabilities.getDocumentGenerator().isEmpty()) {
            return missingCapability(step);
        }
        return capabilities.getDocumentGenerator().get()
                .generate(config, context)
                .map(artifact -> {
                    if (artifact == null) {
                        return StepResult.failure(StepType.DOCUMENT_GENERATION,
                                "No document produced for " + config.documentType());
                    }
                    context.getArtifacts().add(artifact);
                    return StepResult.success(StepType.DOCUMENT_GENERATION, describe(artifact),
                            "Generated " + config.documentType());
                });
    }

    private Future<StepResult> sendEmail(WorkflowStep step, EmailSendConfig config, WorkflowContext context) {
        if (capabilities.getMailer().isEmpty()) {
            return missingCapability(step);
        }
        return capabilities.getMailer().get()
                .send(config, context)
                .map(messageId -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    if (messageId != null) {
                        data.put("messageId", messageId);
                    } else {
                        // accepted without an id, still a delivery
                        logger.warn("Mailer returned no message id for step {}", step.getId());
                    }
                    data.put("recipients", config.to().size());
                    return StepResult.success(StepType.EMAIL_SEND, data,
                            "Sent to " + config.to().size() + " recipient(s)");
                });
    }

    private Future<StepResult> await(WaitConfig config, WorkflowContext context) {
        switch (config.waitType()) {
            case TIME: {
                Map<String, Object> data = Map.of("waitedMs", config.durationMs());
                if (config.durationMs() == 0) {
                    return Future.succeededFuture(StepResult.success(StepType.WAIT, data));
                }
                Promise<StepResult> promise = Promise.promise();
                vertx.setTimer(config.durationMs(), id -> promise.complete(StepResult.success(StepType.WAIT, data)));
                return promise.future();
            }
            case CONDITION: {
                Object value = context.lookup(config.conditionPath());
                if (isTruthy(value)) {
                    return Future.succeededFuture(StepResult.success(StepType.WAIT,
                            Map.of("condition", config.conditionPath())));
                }
                return Future.succeededFuture(StepResult.failure(StepType.WAIT,
                        "Condition " + config.conditionPath() + " is not met"));
            }
            default:
                return Future.succeededFuture(StepResult.awaiting(StepType.WAIT,
                        config.eventName() != null ? Map.of("event", config.eventName()) : Map.of(),
                        "Waiting for event " + config.eventName()));
        }
    }

    private Future<StepResult> checkContext(WorkflowStep step, ContextCheckConfig config, WorkflowContext context) {
        Object actual = context.lookup(config.contextPath());
        boolean passed = evaluate(config.operator(), actual, config.expectedValue());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("contextPath", config.contextPath());
        data.put("operator", config.operator().getWireName());
        data.put("passed", passed);

        if (passed || config.onFailure() == ContextCheckConfig.OnFailure.CONTINUE) {
            return Future.succeededFuture(StepResult.success(StepType.CONTEXT_CHECK, data));
        }
        String message = "Context check failed: " + config.contextPath() + " " + config.operator().getWireName()
                + " " + config.expectedValue() + " (actual " + actual + ")";
        StepError error = new StepError(WorkflowErrorCode.CONTEXT_CHECK_FAILED, message, data, true);
        return Future.failedFuture(new StepExecutionException(step.getId(), error));
    }

    static boolean evaluate(ContextCheckConfig.Operator operator, Object actual, Object expected) {
        switch (operator) {
            case EQUALS:
                return ContextSnapshot.valuesEqual(actual, expected);
            case NOT_EQUALS:
                return !ContextSnapshot.valuesEqual(actual, expected);
            case EXISTS:
                return actual != null;
            case CONTAINS:
                if (actual instanceof Collection) {
                    return ((Collection<?>) actual).stream().anyMatch(item -> ContextSnapshot.valuesEqual(item, expected));
                }
                if (actual instanceof Map) {
                    return expected != null && ((Map<?, ?>) actual).containsKey(expected.toString());
                }
                return actual != null && expected != null && actual.toString().contains(expected.toString());
            case GREATER_THAN:
                return compareNumbers(actual, expected) > 0;
            case LESS_THAN:
                return compareNumbers(actual, expected) < 0;
            default:
                return false;
        }
    }

    private static int compareNumbers(Object actual, Object expected) {
        BigDecimal left = toDecimal(actual);
        BigDecimal right = toDecimal(expected);
        if (left == null || right == null) {
            return 0;
        }
        return left.compareTo(right);
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            return !text.isEmpty() && !"false".equalsIgnoreCase(text);
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    private static Map<String, Object> describe(Artifact artifact) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("artifactType", artifact.type());
        data.put("artifactName", artifact.name());
        if (artifact.reference() != null) {
            data.put("reference", artifact.reference());
        }
        return data;
    }

    private Future<StepResult> missingCapability(WorkflowStep step) {
        StepError error = StepError.of(WorkflowErrorCode.HANDLER_NOT_REGISTERED,
                "No capability configured for step type " + step.getType().getWireName());
        return Future.failedFuture(new StepExecutionException(step.getId(), error));
    }
}
