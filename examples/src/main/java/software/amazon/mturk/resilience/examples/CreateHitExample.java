// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.mturk.model.CreateHitRequest;
import software.amazon.mturk.resilience.Dispatcher;
import software.amazon.mturk.resilience.exception.ResponseValidationException;
import software.amazon.mturk.resilience.exception.UnknownOutcomeException;

/**
 * Example creating a HIT, an operation that is not safe to repeat.
 *
 * <p>This example shows how to handle:
 *
 * <ul>
 *   <li>{@link UnknownOutcomeException} - a timeout left it unclear whether the HIT was created
 *   <li>{@link ResponseValidationException} - the service rejected the request
 * </ul>
 *
 * Throttling is still retried with backoff, since a throttled request was never applied.
 */
public class CreateHitExample {
    private static final Logger logger = LoggerFactory.getLogger(CreateHitExample.class);

    static final String QUESTION = "<HTMLQuestion xmlns=\"http://mechanicalturk.amazonaws.com/"
            + "AWSMechanicalTurkDataSchemas/2011-11-11/HTMLQuestion.xsd\"><HTMLContent><![CDATA[<p>Label</p>]]>"
            + "</HTMLContent><FrameHeight>400</FrameHeight></HTMLQuestion>";

    /** What happened to a create request. */
    public enum Status {
        CREATED,
        REJECTED,
        UNCERTAIN
    }

    /**
     * @param status what happened
     * @param hitId the new HIT id when created
     * @param detail the rejection or uncertainty detail otherwise
     */
    public record Outcome(Status status, String hitId, String detail) {}

    private final Dispatcher dispatcher;

    public CreateHitExample(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public Outcome createHit(String title, String reward) {
        var request = CreateHitRequest.builder()
                .title(title)
                .description("Label a single image")
                .reward(reward)
                .maxAssignments(1)
                .assignmentDurationInSeconds(600L)
                .lifetimeInSeconds(86400L)
                .question(QUESTION)
                .build();
        try {
            var response = dispatcher.dispatch("createHIT", request).getResponse();
            var hitId = (String) response.find("CreateHITResult", "HIT", "HITId");
            logger.info("Created HIT {}", hitId);
            return new Outcome(Status.CREATED, hitId, null);
        } catch (UnknownOutcomeException e) {
            // The HIT may exist. Reconcile by title before creating it again.
            logger.warn("Create for '{}' has an unknown outcome: {}", title, e.getCause().getMessage());
            return new Outcome(Status.UNCERTAIN, null, e.getCause().getMessage());
        } catch (ResponseValidationException e) {
            logger.warn("Create for '{}' was rejected: {}", title, e.getMessage());
            return new Outcome(Status.REJECTED, null, e.getMessage());
        }
    }

    public static void main(String[] args) {
        try (var mturk = MTurkRelays.sandboxClient()) {
            var example = new CreateHitExample(Dispatcher.create(MTurkRelays.forClient(mturk)));
            var outcome = example.createHit("Label an image", "0.05");
            logger.info("Outcome: {}", outcome);
        }
    }
}
