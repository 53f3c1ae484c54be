// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/** An opaque relay failure that carries nothing but its message, such as a bare {@code Throttled} signal. */
public class GenericRelayException extends RelayException {
    public GenericRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public GenericRelayException(String message) {
        super(message);
    }

    @Override
    public RelayErrorKind kind() {
        return RelayErrorKind.GENERIC;
    }
}
