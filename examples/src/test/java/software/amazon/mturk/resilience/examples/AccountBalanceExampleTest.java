// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.mturk.MTurkClient;
import software.amazon.awssdk.services.mturk.model.GetAccountBalanceRequest;
import software.amazon.awssdk.services.mturk.model.GetAccountBalanceResponse;
import software.amazon.awssdk.services.mturk.model.ServiceException;
import software.amazon.mturk.resilience.DispatchConfig;
import software.amazon.mturk.resilience.Dispatcher;
import software.amazon.mturk.resilience.exception.GenericRelayException;
import software.amazon.mturk.resilience.testing.LocalDispatchTestRunner;
import software.amazon.mturk.resilience.testing.RecordingSleeper;
import software.amazon.mturk.resilience.testing.Responses;

class AccountBalanceExampleTest {

    @Test
    void testReadsBalanceAfterThrottling() {
        var runner = LocalDispatchTestRunner.create();
        runner.getRelay()
                .fail("getAccountBalance", new GenericRelayException("Throttled"))
                .respond(
                        "getAccountBalance",
                        Responses.result("getAccountBalance", Map.of("AvailableBalance", "42.00")));

        var balance = new AccountBalanceExample(runner.getDispatcher()).availableBalance();

        assertEquals("42.00", balance);
        assertEquals(2, runner.getRelay().getCallCount("getAccountBalance"));
    }

    @Test
    void testAgainstSdkClient() {
        var mturk = mock(MTurkClient.class);
        when(mturk.getAccountBalance(any(GetAccountBalanceRequest.class)))
                .thenThrow(SdkClientException.builder()
                        .message("Unable to execute HTTP request")
                        .cause(new SocketTimeoutException("Read timed out"))
                        .build())
                .thenThrow(ServiceException.builder()
                        .awsErrorDetails(AwsErrorDetails.builder()
                                .errorCode("ThrottlingException")
                                .errorMessage("Rate exceeded")
                                .build())
                        .statusCode(400)
                        .build())
                .thenReturn(GetAccountBalanceResponse.builder()
                        .availableBalance("10000.00")
                        .build());
        var sleeper = new RecordingSleeper();
        var dispatcher = new Dispatcher(DispatchConfig.builder()
                .withRelay(MTurkRelays.forClient(mturk))
                .withSleeper(sleeper)
                .build());

        var balance = new AccountBalanceExample(dispatcher).availableBalance();

        assertEquals("10000.00", balance);
        verify(mturk, times(3)).getAccountBalance(any(GetAccountBalanceRequest.class));
        assertEquals(List.of(Duration.ofMillis(400)), sleeper.getDelays());
    }
}
