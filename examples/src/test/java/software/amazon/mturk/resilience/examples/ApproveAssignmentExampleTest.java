// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.exception.TransientInfraException;
import software.amazon.mturk.resilience.testing.LocalDispatchTestRunner;
import software.amazon.mturk.resilience.testing.Responses;

class ApproveAssignmentExampleTest {

    @Test
    void testApproves() {
        var runner = LocalDispatchTestRunner.create(ApproveAssignmentExample::configure);
        runner.getRelay().respond("approveAssignment", Responses.result("approveAssignment"));

        assertTrue(new ApproveAssignmentExample(runner.getDispatcher()).approve("A-1"));
    }

    @Test
    void testAlreadySettledAssignmentIsIgnored() {
        var runner = LocalDispatchTestRunner.create(ApproveAssignmentExample::configure);
        runner.getRelay().fail("approveAssignment", new FaultException("Client.RequestError", "already approved"));

        assertFalse(new ApproveAssignmentExample(runner.getDispatcher()).approve("A-1"));
    }

    @Test
    void testTimeoutsRetriedWithinSmallerBudget() {
        var runner = LocalDispatchTestRunner.create(ApproveAssignmentExample::configure);
        var timeout = new TransientInfraException("Read timed out");
        runner.getRelay().alwaysFail("approveAssignment", timeout);

        var thrown = assertThrows(
                TransientInfraException.class,
                () -> new ApproveAssignmentExample(runner.getDispatcher()).approve("A-1"));

        assertSame(timeout, thrown);
        assertEquals(4, runner.getRelay().getCallCount("approveAssignment"));
    }

    @Test
    void testClassifierDefersToDefaults() {
        var classifier = ApproveAssignmentExample.classifier();

        assertEquals(
                Classification.UNKNOWN,
                classifier.classify(new FaultException("Client.RequestError"), "createHIT"));
        assertEquals(
                Classification.RETRY_IMMEDIATE,
                classifier.classify(new TransientInfraException("t"), "approveAssignment"));
        assertEquals(Classification.UNKNOWN, classifier.classify(new TransientInfraException("t"), "searchHITs"));
    }
}
