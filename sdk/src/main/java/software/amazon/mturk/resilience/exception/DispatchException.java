// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/** Base class for every exception raised by the dispatcher or by a relay feeding it. */
public class DispatchException extends RuntimeException {
    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public DispatchException(String message) {
        super(message);
    }
}
