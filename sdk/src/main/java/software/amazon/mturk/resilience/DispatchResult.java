// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience;

import java.util.Objects;
import software.amazon.mturk.resilience.model.Response;

/**
 * The non-exceptional outcome of a dispatch: either a validated response, or a failure the classifier chose to ignore.
 * Callers must check {@link #isIgnored()} before using the response.
 */
public final class DispatchResult {
    private final Response response;
    private final Throwable ignoredError;

    private DispatchResult(Response response, Throwable ignoredError) {
        this.response = response;
        this.ignoredError = ignoredError;
    }

    /**
     * @param response a response that passed validation
     * @return a successful result
     */
    public static DispatchResult success(Response response) {
        return new DispatchResult(Objects.requireNonNull(response, "response cannot be null"), null);
    }

    /**
     * @param error the failure that was classified as ignorable
     * @return an ignored result wrapping the failure
     */
    public static DispatchResult ignored(Throwable error) {
        return new DispatchResult(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    /** @return true if the call failed and the failure was ignored */
    public boolean isIgnored() {
        return ignoredError != null;
    }

    /**
     * @return the validated response
     * @throws IllegalStateException if the result is ignored
     */
    public Response getResponse() {
        if (isIgnored()) {
            throw new IllegalStateException("No response: dispatch ignored error " + ignoredError);
        }
        return response;
    }

    /** @return the ignored failure, or null for a successful result */
    public Throwable getIgnoredError() {
        return ignoredError;
    }

    @Override
    public String toString() {
        return isIgnored()
                ? String.format("DispatchResult{ignored %s}", ignoredError)
                : String.format("DispatchResult{%s}", response);
    }
}
