// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.relay;

import java.io.IOException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.mturk.resilience.classify.DefaultErrorClassifier;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.exception.ThrottledException;
import software.amazon.mturk.resilience.exception.TransientInfraException;
import software.amazon.mturk.resilience.validation.ParameterValidator;

/**
 * Maps AWS SDK v2 exceptions onto relay failures of a known shape.
 *
 * <ul>
 *   <li>call or attempt timeouts, and client failures caused by I/O errors, become {@link TransientInfraException}
 *   <li>throttling service errors become a {@link ThrottledException} carrying the throttled message
 *   <li>other service errors become a {@link FaultException}, coded {@code Server.<ErrorCode>} for 5xx responses and
 *       {@code Client.<ErrorCode>} otherwise
 *   <li>anything else is returned unchanged and will be treated as opaque
 * </ul>
 */
public class SdkExceptionTranslator {
    static final String SERVER_FAULT_PREFIX = "Server.";
    static final String CLIENT_FAULT_PREFIX = "Client.";

    private final String throttledMessage;

    public SdkExceptionTranslator() {
        this(DefaultErrorClassifier.DEFAULT_THROTTLED_MESSAGE);
    }

    public SdkExceptionTranslator(String throttledMessage) {
        ParameterValidator.validateNotBlank(throttledMessage, "throttledMessage");
        this.throttledMessage = throttledMessage;
    }

    /**
     * @param exception the exception raised by an SDK client
     * @return the relay failure to throw in its place
     */
    public RuntimeException translate(SdkException exception) {
        if (exception instanceof ApiCallTimeoutException || exception instanceof ApiCallAttemptTimeoutException) {
            return new TransientInfraException(exception.getMessage(), exception);
        }
        if (exception instanceof AwsServiceException) {
            return translateServiceException((AwsServiceException) exception);
        }
        if (exception instanceof SdkClientException && hasIoCause(exception)) {
            return new TransientInfraException(exception.getMessage(), exception);
        }
        return exception;
    }

    private RuntimeException translateServiceException(AwsServiceException exception) {
        if (exception.isThrottlingException()) {
            return new ThrottledException(throttledMessage, exception);
        }
        var details = exception.awsErrorDetails();
        if (details == null || details.errorCode() == null) {
            return exception;
        }
        var prefix = exception.statusCode() >= 500 ? SERVER_FAULT_PREFIX : CLIENT_FAULT_PREFIX;
        return new FaultException(prefix + details.errorCode(), details.errorMessage(), exception);
    }

    private static boolean hasIoCause(Throwable exception) {
        for (var cause = exception.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return true;
            }
            if (cause == cause.getCause()) {
                break;
            }
        }
        return false;
    }
}
