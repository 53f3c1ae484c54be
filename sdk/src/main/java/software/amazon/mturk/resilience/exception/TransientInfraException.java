// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

/** The remote call timed out or its transport stream broke before a response was decoded. */
public class TransientInfraException extends RelayException {
    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientInfraException(String message) {
        super(message);
    }

    @Override
    public RelayErrorKind kind() {
        return RelayErrorKind.TRANSIENT_INFRA;
    }
}
