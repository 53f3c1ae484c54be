// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

import software.amazon.mturk.resilience.model.Response;

/** A structurally valid response carried an embedded error or no recognizable result. Never retried. */
public class ResponseValidationException extends RelayException {
    private final Response response;
    private final String reason;

    public ResponseValidationException(Response response, String reason) {
        super(reason != null ? "Invalid response: " + reason : "Invalid response: " + response);
        this.response = response;
        this.reason = reason;
    }

    public ResponseValidationException(Response response) {
        this(response, null);
    }

    /** @return the offending response, or null if the relay returned none */
    public Response getResponse() {
        return response;
    }

    /** @return why the response was rejected, or null when the response itself says it all */
    public String getReason() {
        return reason;
    }

    @Override
    public RelayErrorKind kind() {
        return RelayErrorKind.VALIDATION;
    }
}
