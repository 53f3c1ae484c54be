// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.classify;

/**
 * Maps a failed attempt to the action the dispatcher should take.
 *
 * <p>Implementations must be pure functions of their arguments so that one instance can serve concurrent dispatches.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @param error the failure raised by the relay or by response validation
     * @param operationName the operation that failed
     * @return the action to take, never null
     */
    Classification classify(Throwable error, String operationName);
}
