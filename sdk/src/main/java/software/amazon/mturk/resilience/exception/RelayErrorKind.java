// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/**
 * The shape of a failure raised by a relay. The kind is fixed when the relay boundary builds the exception, so
 * classification never has to inspect class names or messages to recover it.
 */
public enum RelayErrorKind {
    /** Timeout or stream-level failure below the protocol. */
    TRANSIENT_INFRA,

    /** Protocol-level fault carrying a fault code. */
    FAULT,

    /** A response that arrived intact but failed validation. */
    VALIDATION,

    /** Opaque failure carrying only a message. */
    GENERIC,

    /** Anything that does not match a known shape. */
    OPAQUE;

    /**
     * Resolves the kind of an arbitrary failure.
     *
     * @param error the failure, may be null
     * @return the declared kind for a {@link RelayException}, {@link #OPAQUE} otherwise
     */
    public static RelayErrorKind of(Throwable error) {
        if (error instanceof RelayException) {
            return ((RelayException) error).kind();
        }
        return OPAQUE;
    }
}
