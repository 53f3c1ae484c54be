// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.testing;

import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.model.Invocation;
import software.amazon.mturk.resilience.model.Response;

/**
 * An event captured by {@link RecordingDispatchListener}. Fields not carried by the event type are null.
 *
 * @param type what happened
 * @param invocation the call the event belongs to
 * @param response the response, for {@link Type#VALIDATED} events
 * @param error the failure, for {@link Type#CLASSIFIED} events and rejected {@link Type#VALIDATED} events
 * @param classification the chosen action, for {@link Type#CLASSIFIED} events
 */
public record DispatchEvent(
        Type type, Invocation invocation, Response response, Throwable error, Classification classification) {

    public enum Type {
        ATTEMPT,
        VALIDATED,
        CLASSIFIED
    }
}
