// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.classify;

import java.util.Objects;
import java.util.function.Predicate;
import software.amazon.mturk.resilience.exception.FaultException;
import software.amazon.mturk.resilience.exception.RelayErrorKind;
import software.amazon.mturk.resilience.exception.ThrottledException;
import software.amazon.mturk.resilience.validation.ParameterValidator;

/**
 * The standard classification rules, keyed on the failure's {@link RelayErrorKind}:
 *
 * <ul>
 *   <li>{@code TRANSIENT_INFRA}: retry immediately if the operation is retryable, otherwise unknown
 *   <li>{@code FAULT}: back off on the service-unavailable code, otherwise unknown
 *   <li>{@code VALIDATION}: fail
 *   <li>{@code GENERIC}: back off on a {@link ThrottledException} or the throttled message, otherwise retry immediately
 *   <li>{@code OPAQUE}: unknown
 * </ul>
 *
 * <p>Instances are immutable and hold no state between calls.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    public static final String DEFAULT_SERVICE_UNAVAILABLE_FAULT_CODE = "Server.ServiceUnavailable";
    public static final String DEFAULT_THROTTLED_MESSAGE = "Throttled";

    private final Predicate<String> retryableOperations;
    private final String serviceUnavailableFaultCode;
    private final String throttledMessage;

    private DefaultErrorClassifier(Builder builder) {
        this.retryableOperations =
                builder.retryableOperations != null ? builder.retryableOperations : RetryableOperations.defaults();
        this.serviceUnavailableFaultCode = builder.serviceUnavailableFaultCode != null
                ? builder.serviceUnavailableFaultCode
                : DEFAULT_SERVICE_UNAVAILABLE_FAULT_CODE;
        this.throttledMessage = builder.throttledMessage != null ? builder.throttledMessage : DEFAULT_THROTTLED_MESSAGE;
    }

    /** @return a classifier with the default retryable prefixes, fault code and throttled message */
    public static DefaultErrorClassifier defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Classification classify(Throwable error, String operationName) {
        return switch (RelayErrorKind.of(error)) {
            case TRANSIENT_INFRA -> retryableOperations.test(operationName)
                    ? Classification.RETRY_IMMEDIATE
                    : Classification.UNKNOWN;
            case FAULT -> isServiceUnavailable(error) ? Classification.RETRY_WITH_BACKOFF : Classification.UNKNOWN;
            case VALIDATION -> Classification.FAIL;
            case GENERIC -> isThrottled(error)
                    ? Classification.RETRY_WITH_BACKOFF
                    : Classification.RETRY_IMMEDIATE;
            case OPAQUE -> Classification.UNKNOWN;
        };
    }

    public String getServiceUnavailableFaultCode() {
        return serviceUnavailableFaultCode;
    }

    public String getThrottledMessage() {
        return throttledMessage;
    }

    private boolean isThrottled(Throwable error) {
        return error instanceof ThrottledException || throttledMessage.equals(error.getMessage());
    }

    private boolean isServiceUnavailable(Throwable error) {
        if (!(error instanceof FaultException)) {
            return false;
        }
        var fault = (FaultException) error;
        return serviceUnavailableFaultCode.equals(fault.getFaultCode())
                || serviceUnavailableFaultCode.equals(fault.getQualifiedFaultCode());
    }

    /** Builder for {@link DefaultErrorClassifier}. Unset values fall back to the defaults. */
    public static final class Builder {
        private Predicate<String> retryableOperations;
        private String serviceUnavailableFaultCode;
        private String throttledMessage;

        private Builder() {}

        /**
         * Sets which operations may be retried immediately after a transport failure.
         *
         * @param retryableOperations predicate over operation names
         * @return this builder
         * @throws NullPointerException if retryableOperations is null
         */
        public Builder retryableOperations(Predicate<String> retryableOperations) {
            this.retryableOperations =
                    Objects.requireNonNull(retryableOperations, "retryableOperations cannot be null");
            return this;
        }

        /**
         * Sets the fault code that signals temporary unavailability and triggers a backoff retry.
         *
         * @param faultCode the local fault code, e.g. {@code Server.ServiceUnavailable}
         * @return this builder
         */
        public Builder serviceUnavailableFaultCode(String faultCode) {
            ParameterValidator.validateNotBlank(faultCode, "serviceUnavailableFaultCode");
            this.serviceUnavailableFaultCode = faultCode;
            return this;
        }

        /**
         * Sets the message of a generic failure that signals server-side throttling.
         *
         * @param message the throttled message
         * @return this builder
         */
        public Builder throttledMessage(String message) {
            ParameterValidator.validateNotBlank(message, "throttledMessage");
            this.throttledMessage = message;
            return this;
        }

        public DefaultErrorClassifier build() {
            return new DefaultErrorClassifier(this);
        }
    }
}
