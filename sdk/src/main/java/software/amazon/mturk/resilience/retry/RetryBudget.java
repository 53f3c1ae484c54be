// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.retry;

import java.time.Duration;
import software.amazon.mturk.resilience.validation.ParameterValidator;

/**
 * Immutable retry limits shared by every dispatch using the same configuration.
 *
 * @param maxAttempts highest attempt number after which a retry is still allowed
 * @param initialDelay base of the exponential backoff
 * @param backoffExponent growth factor per attempt
 */
public record RetryBudget(int maxAttempts, Duration initialDelay, double backoffExponent) {

    public static final int DEFAULT_MAX_ATTEMPTS = 6;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_BACKOFF_EXPONENT = 2.0;

    public RetryBudget {
        ParameterValidator.validatePositiveInteger(maxAttempts, "maxAttempts");
        ParameterValidator.validatePositiveDuration(initialDelay, "initialDelay");
        ParameterValidator.validatePositiveDouble(backoffExponent, "backoffExponent");
    }

    /** Default budget: 6 retries, 100ms initial delay, doubling per attempt. */
    public static RetryBudget defaults() {
        return new RetryBudget(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_BACKOFF_EXPONENT);
    }
}
