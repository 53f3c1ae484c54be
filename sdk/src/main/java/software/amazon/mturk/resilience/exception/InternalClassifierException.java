// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/** The error classifier produced a value the dispatcher has no handling for. Indicates a programming error. */
public class InternalClassifierException extends DispatchException {
    public InternalClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
