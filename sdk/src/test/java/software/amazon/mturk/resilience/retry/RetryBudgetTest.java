// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryBudgetTest {

    @Test
    void testDefaults() {
        var budget = RetryBudget.defaults();

        assertEquals(6, budget.maxAttempts());
        assertEquals(Duration.ofMillis(100), budget.initialDelay());
        assertEquals(2.0, budget.backoffExponent());
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new RetryBudget(0, Duration.ofMillis(100), 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryBudget(6, Duration.ZERO, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryBudget(6, null, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryBudget(6, Duration.ofMillis(100), 0));
        assertThrows(IllegalArgumentException.class, () -> new RetryBudget(6, Duration.ofMillis(100), Double.NaN));
    }
}
