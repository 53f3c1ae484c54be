// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.relay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.classify.DefaultErrorClassifier;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.exception.ThrottledException;
import software.amazon.mturk.resilience.exception.TransientInfraException;

class SdkExceptionTranslatorTest {

    private final SdkExceptionTranslator translator = new SdkExceptionTranslator();

    private static AwsServiceException serviceException(int statusCode, String errorCode) {
        return AwsServiceException.builder()
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode(errorCode)
                        .errorMessage(errorCode + " happened")
                        .build())
                .statusCode(statusCode)
                .build();
    }

    @Test
    void serverErrorBecomesServerFault() {
        var original = serviceException(500, "InternalFailure");

        var translated = assertInstanceOf(FaultException.class, translator.translate(original));

        assertEquals("Server.InternalFailure", translated.getFaultCode());
        assertEquals("Fault Server.InternalFailure: InternalFailure happened", translated.getMessage());
        assertSame(original, translated.getCause());
    }

    @Test
    void clientErrorBecomesClientFault() {
        var translated =
                assertInstanceOf(FaultException.class, translator.translate(serviceException(400, "RequestError")));

        assertEquals("Client.RequestError", translated.getFaultCode());
    }

    @Test
    void throttlingBecomesThrottledSignal() {
        var original = serviceException(400, "ThrottlingException");

        var translated = assertInstanceOf(ThrottledException.class, translator.translate(original));

        assertEquals("Throttled", translated.getMessage());
        assertSame(original, translated.getCause());
    }

    @Test
    void customThrottledMessage() {
        var custom = new SdkExceptionTranslator("SlowDown");

        assertEquals("SlowDown", custom.translate(serviceException(429, "TooManyRequestsException")).getMessage());
    }

    @Test
    void serviceUnavailableIsRetriedWithBackoff() {
        var translated = translator.translate(serviceException(503, "ServiceUnavailable"));

        assertEquals(
                Classification.RETRY_WITH_BACKOFF, DefaultErrorClassifier.defaults().classify(translated, "createHIT"));
    }

    @Test
    void serviceErrorWithoutCodeIsUnchanged() {
        var original = AwsServiceException.builder().message("no details").statusCode(500).build();

        assertSame(original, translator.translate(original));
    }

    @Test
    void timeoutsBecomeTransient() {
        var callTimeout = ApiCallTimeoutException.builder().message("call timed out").build();
        var attemptTimeout = ApiCallAttemptTimeoutException.builder().message("attempt timed out").build();

        assertInstanceOf(TransientInfraException.class, translator.translate(callTimeout));
        assertSame(attemptTimeout, translator.translate(attemptTimeout).getCause());
    }

    @Test
    void ioFailuresBecomeTransient() {
        var direct = SdkClientException.builder()
                .message("Unable to execute HTTP request")
                .cause(new SocketTimeoutException("Read timed out"))
                .build();
        var nested = SdkClientException.builder()
                .message("Unable to execute HTTP request")
                .cause(new UncheckedIOException(new SocketTimeoutException("Read timed out")))
                .build();

        assertInstanceOf(TransientInfraException.class, translator.translate(direct));
        assertInstanceOf(TransientInfraException.class, translator.translate(nested));
    }

    @Test
    void otherClientFailuresAreUnchanged() {
        var original = SdkClientException.builder().message("Unable to load credentials").build();

        assertSame(original, translator.translate(original));
    }
}
