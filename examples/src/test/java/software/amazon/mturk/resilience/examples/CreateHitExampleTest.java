// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.exception.TransientInfraException;
import software.amazon.mturk.resilience.testing.LocalDispatchTestRunner;
import software.amazon.mturk.resilience.testing.Responses;

class CreateHitExampleTest {

    @Test
    void testCreatesHit() {
        var runner = LocalDispatchTestRunner.create();
        runner.getRelay()
                .fail("createHIT", new FaultException("aws:Server.ServiceUnavailable"))
                .respond("createHIT", Responses.result("createHIT", Map.of("HIT", Map.of("HITId", "HIT-9"))));

        var outcome = new CreateHitExample(runner.getDispatcher()).createHit("Label an image", "0.05");

        assertEquals(CreateHitExample.Status.CREATED, outcome.status());
        assertEquals("HIT-9", outcome.hitId());
    }

    @Test
    void testTimeoutIsUncertainAndNotRetried() {
        var runner = LocalDispatchTestRunner.create();
        runner.getRelay().alwaysFail("createHIT", new TransientInfraException("Read timed out"));

        var outcome = new CreateHitExample(runner.getDispatcher()).createHit("Label an image", "0.05");

        assertEquals(CreateHitExample.Status.UNCERTAIN, outcome.status());
        assertEquals("Read timed out", outcome.detail());
        assertEquals(1, runner.getRelay().getCallCount("createHIT"));
    }

    @Test
    void testRejectedRequest() {
        var runner = LocalDispatchTestRunner.create();
        runner.getRelay().respond("createHIT", Responses.itemError("createHIT", "AWS.ParameterOutOfRange"));

        var outcome = new CreateHitExample(runner.getDispatcher()).createHit("Label an image", "-1");

        assertEquals(CreateHitExample.Status.REJECTED, outcome.status());
        assertNull(outcome.hitId());
    }
}
