// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.mturk.model.ApproveAssignmentRequest;
import software.amazon.mturk.resilience.DispatchConfig;
import software.amazon.mturk.resilience.Dispatcher;
import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.classify.DefaultErrorClassifier;
import software.amazon.mturk.resilience.classify.ErrorClassifier;
import software.amazon.mturk.resilience.classify.RetryableOperations;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.retry.RetryBudget;

/**
 * Example demonstrating custom dispatch configuration.
 *
 * <p>This example demonstrates:
 *
 * <ul>
 *   <li>Declaring exactly which operations are idempotent instead of inferring it from their names
 *   <li>A classifier that ignores a known-harmless fault and defers to the default for everything else
 *   <li>A smaller retry budget with a longer initial delay
 * </ul>
 *
 * Approving an assignment twice is harmless, so approval is declared retryable and a client fault reporting that the
 * assignment is no longer approvable is ignored.
 */
public class ApproveAssignmentExample {
    private static final Logger logger = LoggerFactory.getLogger(ApproveAssignmentExample.class);

    static final String NOT_APPROVABLE_FAULT_CODE = "Client.RequestError";

    private final Dispatcher dispatcher;

    public ApproveAssignmentExample(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /** Applies this example's settings to a configuration builder. */
    public static DispatchConfig.Builder configure(DispatchConfig.Builder builder) {
        return builder.withRetryBudget(new RetryBudget(3, Duration.ofMillis(250), 2.0))
                .withErrorClassifier(classifier());
    }

    static ErrorClassifier classifier() {
        var defaults = DefaultErrorClassifier.builder()
                .retryableOperations(
                        RetryableOperations.named(List.of("getAccountBalance", "getHIT", "approveAssignment")))
                .build();
        return (error, operationName) -> {
            if ("approveAssignment".equals(operationName)
                    && error instanceof FaultException
                    && NOT_APPROVABLE_FAULT_CODE.equals(((FaultException) error).getFaultCode())) {
                return Classification.IGNORE;
            }
            return defaults.classify(error, operationName);
        };
    }

    /**
     * @param assignmentId the assignment to approve
     * @return true if this call approved it, false if it was already settled
     */
    public boolean approve(String assignmentId) {
        var request = ApproveAssignmentRequest.builder()
                .assignmentId(assignmentId)
                .requesterFeedback("Thanks!")
                .build();
        return !dispatcher.dispatch("approveAssignment", request).isIgnored();
    }

    public static void main(String[] args) {
        try (var mturk = MTurkRelays.sandboxClient()) {
            var config = configure(DispatchConfig.builder().withRelay(MTurkRelays.forClient(mturk))).build();
            var example = new ApproveAssignmentExample(new Dispatcher(config));
            var approved = example.approve(args[0]);
            logger.info("Assignment {} {}", args[0], approved ? "approved" : "was already settled");
        }
    }
}
