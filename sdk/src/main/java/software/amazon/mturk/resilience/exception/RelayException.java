// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/** A failure raised by a relay (or by response validation) whose shape is known up front. */
public abstract class RelayException extends DispatchException {
    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    protected RelayException(String message) {
        super(message);
    }

    /** @return the tag the classifier dispatches on */
    public abstract RelayErrorKind kind();
}
