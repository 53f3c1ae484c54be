// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/**
 * The calling thread was interrupted while sleeping between retries. The thread's interrupt flag is restored before
 * this is thrown; the cause is the failure that triggered the backoff.
 */
public class DispatchInterruptedException extends DispatchException {
    public DispatchInterruptedException(String operationName, Throwable cause) {
        super("Interrupted during backoff for " + operationName, cause);
    }
}
