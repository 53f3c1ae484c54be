// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/**
 * A generic failure raised for a response or service error that signals throttling. Classified as a backoff retry
 * whatever its message.
 */
public class ThrottledException extends GenericRelayException {
    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }

    public ThrottledException(String message) {
        super(message);
    }
}
