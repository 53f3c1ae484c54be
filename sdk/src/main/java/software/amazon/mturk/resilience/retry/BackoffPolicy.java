// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether an attempt may be retried and how long to wait first.
 *
 * <p>The delay for attempt {@code n} is {@code initialDelay × backoffExponent^n}. There is no jitter and no cap other
 * than the attempt ceiling. Stateless and safe to share between threads.
 */
public class BackoffPolicy {
    private final RetryBudget budget;

    public BackoffPolicy(RetryBudget budget) {
        this.budget = Objects.requireNonNull(budget, "RetryBudget cannot be null");
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @return true if another attempt is allowed
     */
    public boolean canRetry(int attempt) {
        return attempt <= budget.maxAttempts();
    }

    /**
     * Calculates the wait before retrying a failed attempt. Callers must check {@link #canRetry(int)} first.
     *
     * @param attempt the attempt that just failed, starting at 1
     * @return the backoff delay
     * @throws IllegalArgumentException if attempt is less than 1
     * @throws IllegalStateException if the attempt is beyond the retry budget
     */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1, got: " + attempt);
        }
        if (!canRetry(attempt)) {
            throw new IllegalStateException(
                    "attempt " + attempt + " exceeds the retry budget of " + budget.maxAttempts());
        }
        double nanos = budget.initialDelay().toNanos() * Math.pow(budget.backoffExponent(), attempt);
        return Duration.ofNanos(Math.round(nanos));
    }
}
